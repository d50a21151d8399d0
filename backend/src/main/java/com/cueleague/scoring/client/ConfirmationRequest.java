package com.cueleague.scoring.client;

import com.cueleague.scoring.model.TeamSide;

import java.util.UUID;

/**
 * One decision waiting for the local user.
 */
public record ConfirmationRequest(
        Kind kind,
        UUID gameId,
        int gameNumber,
        UUID winnerPlayerId,
        String winnerDisplayName,
        boolean breakAndRun,
        boolean goldenBreak,
        TeamSide requestedBy,
        Long gameVersion
) {
    public enum Kind {
        SCORE,
        VACATE
    }
}
