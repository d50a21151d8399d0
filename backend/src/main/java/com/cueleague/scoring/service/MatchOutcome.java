package com.cueleague.scoring.service;

import com.cueleague.scoring.model.MatchResult;

import java.util.UUID;

/**
 * Aggregate view of a match derived from its finalized games.
 *
 * @param homeGamesWon       finalized regulation wins for the home team
 * @param awayGamesWon       finalized regulation wins for the away team
 * @param regulationComplete every regulation game exists and is finalized
 * @param tiebreakerRequired regulation is complete without a decision
 */
public record MatchOutcome(
        MatchResult result,
        UUID winnerTeamId,
        int homeGamesWon,
        int awayGamesWon,
        int homeTiebreakerWins,
        int awayTiebreakerWins,
        int finalizedGames,
        boolean regulationComplete,
        boolean tiebreakerRequired,
        boolean decidedByTiebreaker
) {
}
