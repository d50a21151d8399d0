package com.cueleague.scoring.client;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.web.ScoringErrorKind;

/**
 * What a client action did. Rejections carry the error kind so callers can
 * tell a blocked action from a retryable failure.
 */
public record ScoringOutcome(
        Status status,
        MatchScoringResponses.GameView game,
        ScoringErrorKind errorKind,
        String message
) {
    public enum Status {
        APPLIED,
        NO_CHANGE,
        REJECTED
    }

    public static ScoringOutcome of(MatchScoringResponses.GameTransitionResult result) {
        return new ScoringOutcome(
                result.changed() ? Status.APPLIED : Status.NO_CHANGE,
                result.game(),
                null,
                result.message()
        );
    }

    public static ScoringOutcome applied(MatchScoringResponses.GameView game, String message) {
        return new ScoringOutcome(Status.APPLIED, game, null, message);
    }

    public static ScoringOutcome noChange(MatchScoringResponses.GameView game, String message) {
        return new ScoringOutcome(Status.NO_CHANGE, game, null, message);
    }

    public static ScoringOutcome rejected(ScoringErrorKind kind, MatchScoringResponses.GameView game, String message) {
        return new ScoringOutcome(Status.REJECTED, game, kind, message);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    public boolean isRetryable() {
        return errorKind != null && errorKind.retryable();
    }
}
