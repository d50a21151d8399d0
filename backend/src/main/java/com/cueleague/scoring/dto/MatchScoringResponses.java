package com.cueleague.scoring.dto;

import com.cueleague.scoring.model.GameAction;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.MatchFormat;
import com.cueleague.scoring.model.MatchResult;
import com.cueleague.scoring.model.MatchStatus;
import com.cueleague.scoring.model.TeamSide;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class MatchScoringResponses {

    private MatchScoringResponses() {
    }

    public record GameView(
            UUID gameId,
            UUID matchId,
            int gameNumber,
            boolean tiebreaker,
            UUID homePlayerId,
            UUID awayPlayerId,
            GameAction homeAction,
            GameAction awayAction,
            UUID winnerTeamId,
            UUID winnerPlayerId,
            boolean breakAndRun,
            boolean goldenBreak,
            UUID confirmedByHome,
            UUID confirmedByAway,
            OffsetDateTime confirmedAt,
            UUID vacateRequestedBy,
            TeamSide vacateRequestedSide,
            GameState state,
            Long version,
            OffsetDateTime updatedAt
    ) {
        public UUID confirmationOf(TeamSide side) {
            return side == TeamSide.HOME ? confirmedByHome : confirmedByAway;
        }

        public UUID playerOf(TeamSide side) {
            return side == TeamSide.HOME ? homePlayerId : awayPlayerId;
        }

        public TeamSide proposingSide() {
            if (state != GameState.PROPOSED) {
                return null;
            }
            if (confirmedByHome != null) {
                return TeamSide.HOME;
            }
            return confirmedByAway != null ? TeamSide.AWAY : null;
        }
    }

    public record MatchView(
            UUID matchId,
            UUID homeTeamId,
            UUID awayTeamId,
            MatchFormat format,
            MatchStatus status,
            Integer homeGamesToWin,
            Integer awayGamesToWin,
            Integer homeGamesToTie,
            Integer awayGamesToTie,
            Integer homeGamesToLose,
            Integer awayGamesToLose,
            int homeGamesWon,
            int awayGamesWon,
            int homePointsEarned,
            int awayPointsEarned,
            MatchResult matchResult,
            UUID winnerTeamId,
            UUID homeVerifiedBy,
            UUID awayVerifiedBy,
            OffsetDateTime startedAt,
            OffsetDateTime tiebreakerStartedAt,
            OffsetDateTime completedAt,
            Long version,
            OffsetDateTime updatedAt
    ) {
    }

    /**
     * Canonical post-write state of a game. {@code changed} is false when the
     * action was accepted but left the row as it was.
     */
    public record GameTransitionResult(
            GameView game,
            boolean changed,
            String message
    ) {
    }

    public record MatchTransitionResult(
            MatchView match,
            boolean changed,
            String message
    ) {
    }

    public record GameBatchResult(
            List<GameView> games,
            boolean changed,
            String message
    ) {
    }

    public record TeamScore(
            UUID teamId,
            TeamSide side,
            int wins,
            int losses,
            int points,
            int tiebreakerWins,
            int breakAndRuns,
            int goldenBreaks
    ) {
    }

    public record PlayerScore(
            UUID playerId,
            TeamSide side,
            int wins,
            int losses,
            int breakAndRuns,
            int goldenBreaks
    ) {
    }

    public record Scoreboard(
            UUID matchId,
            MatchStatus status,
            MatchResult matchResult,
            TeamScore home,
            TeamScore away,
            List<PlayerScore> players,
            int completedGames,
            int totalGames,
            int pendingConfirmations
    ) {
    }

    public record ReassignmentResult(
            TeamSide side,
            int position,
            UUID previousPlayerId,
            UUID playerId,
            List<GameView> updatedGames,
            String message
    ) {
    }
}
