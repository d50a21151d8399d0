package com.cueleague.scoring.client;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.web.ScoringErrorKind;

/**
 * Rejects actions the local view already shows to be invalid, before any
 * write is attempted. The server re-checks every rule.
 */
final class LocalTransitionGuard {

    private LocalTransitionGuard() {
    }

    static ScoringOutcome checkPropose(
            MatchScoringResponses.GameView game,
            TeamSide side,
            boolean breakAndRun,
            boolean goldenBreak
    ) {
        if (breakAndRun && goldenBreak) {
            return ScoringOutcome.rejected(ScoringErrorKind.CONSTRAINT_VIOLATION, game,
                    "A game cannot be both a break and run and a golden break");
        }
        GameState state = game.state();
        if (state == GameState.FINALIZED || state == GameState.VACATE_PENDING) {
            return ScoringOutcome.rejected(ScoringErrorKind.INVALID_TRANSITION, game,
                    "Game " + game.gameNumber() + " is already finalized; request a vacate to change its result");
        }
        if (state == GameState.PROPOSED && game.proposingSide() != side) {
            return ScoringOutcome.rejected(ScoringErrorKind.INVALID_TRANSITION, game,
                    "Game " + game.gameNumber() + " already has a result proposed by the other team; confirm or deny it");
        }
        return null;
    }

    static ScoringOutcome checkConfirm(MatchScoringResponses.GameView game, TeamSide side) {
        GameState state = game.state();
        if (state == GameState.FINALIZED) {
            return ScoringOutcome.noChange(game, "Game " + game.gameNumber() + " is already finalized");
        }
        if (state != GameState.PROPOSED) {
            return ScoringOutcome.rejected(ScoringErrorKind.INVALID_TRANSITION, game,
                    "Game " + game.gameNumber() + " has no proposed result to confirm");
        }
        if (game.proposingSide() == side) {
            return ScoringOutcome.rejected(ScoringErrorKind.IDENTITY_VIOLATION, game,
                    "Game " + game.gameNumber() + " result was proposed by your team; the other team must confirm it");
        }
        return null;
    }

    static ScoringOutcome checkDeny(MatchScoringResponses.GameView game, TeamSide side) {
        if (game.state() != GameState.PROPOSED) {
            return ScoringOutcome.rejected(ScoringErrorKind.INVALID_TRANSITION, game,
                    "Game " + game.gameNumber() + " has no proposed result to deny");
        }
        if (game.proposingSide() == side) {
            return ScoringOutcome.rejected(ScoringErrorKind.IDENTITY_VIOLATION, game,
                    "Game " + game.gameNumber() + " result was proposed by your team; only the other team can deny it");
        }
        return null;
    }

    static ScoringOutcome checkRequestVacate(MatchScoringResponses.GameView game, TeamSide side) {
        GameState state = game.state();
        if (state == GameState.VACATE_PENDING && game.vacateRequestedSide() == side) {
            return ScoringOutcome.noChange(game, "Vacate of game " + game.gameNumber() + " is already requested");
        }
        if (state != GameState.FINALIZED) {
            return ScoringOutcome.rejected(ScoringErrorKind.INVALID_TRANSITION, game,
                    "Only a finalized game can be vacated");
        }
        return null;
    }

    static ScoringOutcome checkVacateResponse(MatchScoringResponses.GameView game, TeamSide side) {
        if (game.state() != GameState.VACATE_PENDING) {
            return ScoringOutcome.rejected(ScoringErrorKind.INVALID_TRANSITION, game,
                    "Game " + game.gameNumber() + " has no pending vacate request");
        }
        if (game.vacateRequestedSide() == side) {
            return ScoringOutcome.rejected(ScoringErrorKind.IDENTITY_VIOLATION, game,
                    "Your team requested this vacate; the other team must answer it");
        }
        return null;
    }
}
