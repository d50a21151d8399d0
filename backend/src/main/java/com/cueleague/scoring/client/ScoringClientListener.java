package com.cueleague.scoring.client;

import com.cueleague.scoring.dto.MatchScoringResponses;

import java.util.Optional;

/**
 * UI callbacks of a {@link MatchScoringClient}. All methods default to no-ops.
 */
public interface ScoringClientListener {

    default void onGameChanged(MatchScoringResponses.GameView game) {
    }

    default void onMatchChanged(MatchScoringResponses.MatchView match) {
    }

    default void onPromptChanged(Optional<ConfirmationRequest> visible) {
    }

    /**
     * The local team's pending claim was replaced by the other team's claim.
     */
    default void onProposalSuperseded(
            MatchScoringResponses.GameView previous,
            MatchScoringResponses.GameView current
    ) {
    }

    /**
     * The other team denied the local team's claim and the game is empty again.
     */
    default void onProposalDenied(MatchScoringResponses.GameView game) {
    }

    default void onError(ScoringOutcome outcome) {
    }

    static ScoringClientListener none() {
        return new ScoringClientListener() {
        };
    }
}
