package com.cueleague.scoring.service;

import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.web.ScoringException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Two-party agreement rules for a single game.
 * <p>
 * Every method mutates the passed row in memory only; persistence and locking
 * belong to {@link GameConfirmationService}. Rejections are thrown as
 * {@link ScoringException} before any field is touched.
 */
@Component
public class GameConfirmationStateMachine {

    public GameTransition propose(
            Match match,
            MatchGame game,
            ScoringSession session,
            UUID winningTeamId,
            UUID winningPlayerId,
            boolean breakAndRun,
            boolean goldenBreak
    ) {
        requireParticipant(match, session);
        if (breakAndRun && goldenBreak) {
            throw ScoringException.constraintViolation(
                    "A game cannot be both a break and run and a golden break"
            );
        }
        if (winningTeamId == null || winningPlayerId == null) {
            throw ScoringException.constraintViolation("Both the winning team and the winning player are required");
        }
        TeamSide winningSide = match.sideOf(winningTeamId);
        if (winningSide == null) {
            throw ScoringException.constraintViolation("Winning team is not playing in this match");
        }
        UUID assignedPlayerId = game.playerOf(winningSide);
        if (assignedPlayerId != null && !assignedPlayerId.equals(winningPlayerId)) {
            throw ScoringException.constraintViolation(
                    "Game " + game.getGameNumber() + " winner must be the player assigned to the winning team"
            );
        }

        GameState state = game.state();
        if (state == GameState.FINALIZED || state == GameState.VACATE_PENDING) {
            throw ScoringException.invalidTransition(
                    "Game " + game.getGameNumber() + " is already finalized; request a vacate to change its result"
            );
        }
        if (state == GameState.PROPOSED) {
            TeamSide proposingSide = game.proposingSide();
            if (proposingSide != session.side()) {
                throw ScoringException.invalidTransition(
                        "Game " + game.getGameNumber() + " already has a result proposed by the other team; confirm or deny it"
                );
            }
            if (matchesProposal(game, winningTeamId, winningPlayerId, breakAndRun, goldenBreak)) {
                return GameTransition.unchanged(
                        "Game " + game.getGameNumber() + " is already proposed with this result; waiting for the other team"
                );
            }
        }

        game.setWinnerTeamId(winningTeamId);
        game.setWinnerPlayerId(winningPlayerId);
        game.setBreakAndRun(breakAndRun);
        game.setGoldenBreak(goldenBreak);
        game.setConfirmationOf(session.side(), session.memberId());
        game.setConfirmationOf(session.side().opponent(), null);
        game.setConfirmedAt(null);
        return GameTransition.applied(
                state == GameState.PROPOSED
                        ? "Game " + game.getGameNumber() + " proposal updated; waiting for the other team"
                        : "Game " + game.getGameNumber() + " result proposed; waiting for the other team"
        );
    }

    public GameTransition confirm(Match match, MatchGame game, ScoringSession session) {
        requireParticipant(match, session);
        GameState state = game.state();
        switch (state) {
            case EMPTY -> throw ScoringException.invalidTransition(
                    "Game " + game.getGameNumber() + " has no proposed result to confirm"
            );
            case FINALIZED -> {
                return GameTransition.unchanged("Game " + game.getGameNumber() + " is already finalized");
            }
            case VACATE_PENDING -> throw ScoringException.invalidTransition(
                    "Game " + game.getGameNumber() + " has a pending vacate request; accept or deny it instead"
            );
            default -> {
                // proposed
            }
        }
        if (game.proposingSide() == session.side()) {
            throw ScoringException.identityViolation(
                    "Game " + game.getGameNumber() + " result was proposed by your team; the other team must confirm it"
            );
        }
        game.setConfirmationOf(session.side(), session.memberId());
        game.setConfirmedAt(OffsetDateTime.now());
        return GameTransition.applied("Game " + game.getGameNumber() + " finalized");
    }

    public GameTransition deny(Match match, MatchGame game, ScoringSession session) {
        requireParticipant(match, session);
        GameState state = game.state();
        if (state == GameState.EMPTY) {
            throw ScoringException.invalidTransition(
                    "Game " + game.getGameNumber() + " has no proposed result to deny"
            );
        }
        if (state != GameState.PROPOSED) {
            throw ScoringException.invalidTransition(
                    "Game " + game.getGameNumber() + " is already finalized; request a vacate instead"
            );
        }
        if (game.proposingSide() == session.side()) {
            throw ScoringException.identityViolation(
                    "Game " + game.getGameNumber() + " result was proposed by your team; only the other team can deny it"
            );
        }
        game.clearResult();
        return GameTransition.applied("Game " + game.getGameNumber() + " result denied and cleared");
    }

    /**
     * Allowed on a completed match: vacating a deciding game reopens it.
     */
    public GameTransition requestVacate(Match match, MatchGame game, ScoringSession session) {
        requireSide(match, session);
        GameState state = game.state();
        if (state == GameState.VACATE_PENDING) {
            if (game.getVacateRequestedSide() == session.side()) {
                return GameTransition.unchanged(
                        "Vacate of game " + game.getGameNumber() + " is already requested; waiting for the other team"
                );
            }
            throw ScoringException.invalidTransition(
                    "The other team already requested a vacate of game " + game.getGameNumber() + "; accept or deny it"
            );
        }
        if (state != GameState.FINALIZED) {
            throw ScoringException.invalidTransition(
                    "Only a finalized game can be vacated; game " + game.getGameNumber() + " is " + describe(state)
            );
        }
        game.setVacateRequestedBy(session.memberId());
        game.setVacateRequestedSide(session.side());
        return GameTransition.applied("Vacate of game " + game.getGameNumber() + " requested; waiting for the other team");
    }

    public GameTransition acceptVacate(Match match, MatchGame game, ScoringSession session) {
        requireVacateResponder(match, game, session);
        game.clearResult();
        return GameTransition.applied("Game " + game.getGameNumber() + " vacated and cleared");
    }

    public GameTransition denyVacate(Match match, MatchGame game, ScoringSession session) {
        requireVacateResponder(match, game, session);
        game.setVacateRequestedBy(null);
        game.setVacateRequestedSide(null);
        return GameTransition.applied("Vacate of game " + game.getGameNumber() + " denied; original result stands");
    }

    public void requireParticipant(Match match, ScoringSession session) {
        requireSide(match, session);
        if (match.isTerminal()) {
            throw ScoringException.invalidTransition("Match is completed and can no longer be scored");
        }
    }

    private static void requireSide(Match match, ScoringSession session) {
        Objects.requireNonNull(session, "session is required");
        TeamSide teamSide = match.sideOf(session.teamId());
        if (teamSide == null || teamSide != session.side()) {
            throw ScoringException.identityViolation("Your team is not the " + describe(session.side()) + " team of this match");
        }
    }

    private void requireVacateResponder(Match match, MatchGame game, ScoringSession session) {
        requireSide(match, session);
        if (game.state() != GameState.VACATE_PENDING) {
            throw ScoringException.invalidTransition(
                    "Game " + game.getGameNumber() + " has no pending vacate request"
            );
        }
        if (game.getVacateRequestedSide() == session.side()) {
            throw ScoringException.identityViolation(
                    "Your team requested this vacate; the other team must answer it"
            );
        }
    }

    private static boolean matchesProposal(
            MatchGame game,
            UUID winningTeamId,
            UUID winningPlayerId,
            boolean breakAndRun,
            boolean goldenBreak
    ) {
        return winningTeamId.equals(game.getWinnerTeamId())
                && winningPlayerId.equals(game.getWinnerPlayerId())
                && breakAndRun == game.isBreakAndRun()
                && goldenBreak == game.isGoldenBreak();
    }

    private static String describe(GameState state) {
        return state.name().toLowerCase().replace('_', ' ');
    }

    private static String describe(TeamSide side) {
        return side.name().toLowerCase();
    }
}
