package com.cueleague.scoring.service;

import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.MatchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class MatchOutcomeCalculator {

    private final ScoringRuntimeProperties scoringRuntimeProperties;

    public MatchOutcome calculate(Match match, List<MatchGame> games) {
        Objects.requireNonNull(match, "match is required");
        UUID homeTeamId = match.getHomeTeamId();
        UUID awayTeamId = match.getAwayTeamId();

        int homeWins = 0;
        int awayWins = 0;
        int homeTiebreakerWins = 0;
        int awayTiebreakerWins = 0;
        int finalizedGames = 0;
        int finalizedRegulation = 0;
        int tiebreakerSlots = 0;
        int finalizedTiebreakers = 0;

        for (MatchGame game : games) {
            if (game.isTiebreaker()) {
                tiebreakerSlots++;
            }
            if (!isCounted(game)) {
                continue;
            }
            finalizedGames++;
            boolean homeWon = homeTeamId.equals(game.getWinnerTeamId());
            boolean awayWon = awayTeamId.equals(game.getWinnerTeamId());
            if (game.isTiebreaker()) {
                finalizedTiebreakers++;
                homeTiebreakerWins += homeWon ? 1 : 0;
                awayTiebreakerWins += awayWon ? 1 : 0;
            } else {
                finalizedRegulation++;
                homeWins += homeWon ? 1 : 0;
                awayWins += awayWon ? 1 : 0;
            }
        }

        boolean regulationComplete = finalizedRegulation >= match.getFormat().regulationGameCount();

        if (reached(homeWins, match.getHomeGamesToWin())) {
            return decided(MatchResult.HOME_WIN, homeTeamId, homeWins, awayWins,
                    homeTiebreakerWins, awayTiebreakerWins, finalizedGames, regulationComplete, false);
        }
        if (reached(awayWins, match.getAwayGamesToWin())) {
            return decided(MatchResult.AWAY_WIN, awayTeamId, homeWins, awayWins,
                    homeTiebreakerWins, awayTiebreakerWins, finalizedGames, regulationComplete, false);
        }
        if (!regulationComplete) {
            return new MatchOutcome(MatchResult.PENDING, null, homeWins, awayWins,
                    homeTiebreakerWins, awayTiebreakerWins, finalizedGames, false, false, false);
        }
        // Regulation over and neither side at its win threshold, tie thresholds included.
        int winsRequired = resolveWinsRequired();
        if (homeTiebreakerWins >= winsRequired) {
            return decided(MatchResult.HOME_WIN, homeTeamId, homeWins, awayWins,
                    homeTiebreakerWins, awayTiebreakerWins, finalizedGames, true, true);
        }
        if (awayTiebreakerWins >= winsRequired) {
            return decided(MatchResult.AWAY_WIN, awayTeamId, homeWins, awayWins,
                    homeTiebreakerWins, awayTiebreakerWins, finalizedGames, true, true);
        }
        // only reachable with an even tiebreaker game count
        if (tiebreakerSlots > 0 && finalizedTiebreakers >= tiebreakerSlots) {
            return decided(MatchResult.TIE, null, homeWins, awayWins,
                    homeTiebreakerWins, awayTiebreakerWins, finalizedGames, true, true);
        }
        return new MatchOutcome(MatchResult.PENDING, null, homeWins, awayWins,
                homeTiebreakerWins, awayTiebreakerWins, finalizedGames, true, true, false);
    }

    int resolveWinsRequired() {
        ScoringRuntimeProperties.Tiebreaker tiebreaker = scoringRuntimeProperties.getTiebreaker();
        int winsRequired = tiebreaker.getWinsRequired();
        if (winsRequired <= 0 || winsRequired > tiebreaker.getGameCount()) {
            throw new IllegalStateException(
                    "scoring.tiebreaker.wins-required must be between 1 and scoring.tiebreaker.game-count"
            );
        }
        return winsRequired;
    }

    private static MatchOutcome decided(
            MatchResult result,
            UUID winnerTeamId,
            int homeWins,
            int awayWins,
            int homeTiebreakerWins,
            int awayTiebreakerWins,
            int finalizedGames,
            boolean regulationComplete,
            boolean byTiebreaker
    ) {
        return new MatchOutcome(result, winnerTeamId, homeWins, awayWins, homeTiebreakerWins,
                awayTiebreakerWins, finalizedGames, regulationComplete, byTiebreaker, byTiebreaker);
    }

    private static boolean isCounted(MatchGame game) {
        GameState state = game.state();
        return state == GameState.FINALIZED || state == GameState.VACATE_PENDING;
    }

    private static boolean reached(int wins, Integer threshold) {
        return threshold != null && wins >= threshold;
    }
}
