package com.cueleague.scoring.service;

import com.cueleague.scoring.model.MatchResult;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published once both teams have verified a match. Consumed by standings and
 * reporting.
 */
public record MatchFinalizedEvent(
        UUID matchId,
        UUID homeTeamId,
        UUID awayTeamId,
        MatchResult result,
        UUID winnerTeamId,
        int homeGamesWon,
        int awayGamesWon,
        int homePointsEarned,
        int awayPointsEarned,
        UUID homeVerifiedBy,
        UUID awayVerifiedBy,
        OffsetDateTime completedAt
) {
}
