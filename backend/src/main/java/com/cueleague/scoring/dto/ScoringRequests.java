package com.cueleague.scoring.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public final class ScoringRequests {

    private ScoringRequests() {
    }

    /**
     * Claimed winner of a game. {@code expectedVersion} is the row version the
     * caller last saw; a mismatch is reported as a write conflict.
     */
    public record ProposeResultRequest(
            @NotNull(message = "winningTeamId is required")
            UUID winningTeamId,

            @NotNull(message = "winningPlayerId is required")
            UUID winningPlayerId,

            boolean breakAndRun,

            boolean goldenBreak,

            @Min(value = 0, message = "expectedVersion must be non-negative")
            Long expectedVersion
    ) {
    }

    public record GameActionRequest(
            @Min(value = 0, message = "expectedVersion must be non-negative")
            Long expectedVersion
    ) {
        public static GameActionRequest unversioned() {
            return new GameActionRequest(null);
        }
    }

    public record SubstitutePlayerRequest(
            @NotNull(message = "playerId is required")
            UUID playerId,

            @Min(value = 0, message = "handicap must be non-negative")
            Integer handicap
    ) {
    }
}
