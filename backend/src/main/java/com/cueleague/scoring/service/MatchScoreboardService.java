package com.cueleague.scoring.service;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of a match: canonical game rows, the match aggregate and the
 * scoreboard. Only finalized games count towards any total.
 */
@Service
@RequiredArgsConstructor
public class MatchScoreboardService {

    private final MatchRepository matchRepository;
    private final MatchGameRepository matchGameRepository;
    private final MatchOutcomeCalculator matchOutcomeCalculator;
    private final ScoringResponseMapper scoringResponseMapper;

    @Transactional(readOnly = true)
    public MatchScoringResponses.MatchView getMatch(UUID matchId) {
        return scoringResponseMapper.toMatchView(requireMatch(matchId));
    }

    @Transactional(readOnly = true)
    public List<MatchScoringResponses.GameView> listGames(UUID matchId) {
        requireMatch(matchId);
        return scoringResponseMapper.toGameViews(matchGameRepository.findByMatchIdOrderByGameNumberAsc(matchId));
    }

    @Transactional(readOnly = true)
    public MatchScoringResponses.Scoreboard getScoreboard(UUID matchId) {
        Match match = requireMatch(matchId);
        List<MatchGame> games = matchGameRepository.findByMatchIdOrderByGameNumberAsc(matchId);
        MatchOutcome outcome = matchOutcomeCalculator.calculate(match, games);

        Map<UUID, PlayerTally> players = new LinkedHashMap<>();
        TeamTally home = new TeamTally();
        TeamTally away = new TeamTally();
        int pendingConfirmations = 0;

        for (MatchGame game : games) {
            registerPlayer(players, game.getHomePlayerId(), TeamSide.HOME);
            registerPlayer(players, game.getAwayPlayerId(), TeamSide.AWAY);
            GameState state = game.state();
            if (state == GameState.PROPOSED) {
                pendingConfirmations++;
            }
            if (state != GameState.FINALIZED && state != GameState.VACATE_PENDING) {
                continue;
            }
            TeamSide winningSide = match.sideOf(game.getWinnerTeamId());
            if (winningSide == null) {
                continue;
            }
            TeamTally winner = winningSide == TeamSide.HOME ? home : away;
            if (game.isBreakAndRun()) {
                winner.breakAndRuns++;
            }
            if (game.isGoldenBreak()) {
                winner.goldenBreaks++;
            }

            PlayerTally winningPlayer = players.get(game.playerOf(winningSide));
            if (winningPlayer == null && game.getWinnerPlayerId() != null) {
                winningPlayer = registerPlayer(players, game.getWinnerPlayerId(), winningSide);
            }
            if (winningPlayer != null) {
                winningPlayer.wins++;
                winningPlayer.breakAndRuns += game.isBreakAndRun() ? 1 : 0;
                winningPlayer.goldenBreaks += game.isGoldenBreak() ? 1 : 0;
            }
            PlayerTally losingPlayer = players.get(game.playerOf(winningSide.opponent()));
            if (losingPlayer != null) {
                losingPlayer.losses++;
            }
        }

        int regulationFinalized = outcome.homeGamesWon() + outcome.awayGamesWon();
        MatchScoringResponses.TeamScore homeScore = new MatchScoringResponses.TeamScore(
                match.getHomeTeamId(),
                TeamSide.HOME,
                outcome.homeGamesWon(),
                regulationFinalized - outcome.homeGamesWon(),
                MatchEndVerifier.pointsFor(outcome.homeGamesWon(), match.getHomeGamesToTie(), match.getHomeGamesToWin()),
                outcome.homeTiebreakerWins(),
                home.breakAndRuns,
                home.goldenBreaks
        );
        MatchScoringResponses.TeamScore awayScore = new MatchScoringResponses.TeamScore(
                match.getAwayTeamId(),
                TeamSide.AWAY,
                outcome.awayGamesWon(),
                regulationFinalized - outcome.awayGamesWon(),
                MatchEndVerifier.pointsFor(outcome.awayGamesWon(), match.getAwayGamesToTie(), match.getAwayGamesToWin()),
                outcome.awayTiebreakerWins(),
                away.breakAndRuns,
                away.goldenBreaks
        );

        List<MatchScoringResponses.PlayerScore> playerScores = new ArrayList<>();
        players.forEach((playerId, tally) -> playerScores.add(new MatchScoringResponses.PlayerScore(
                playerId,
                tally.side,
                tally.wins,
                tally.losses,
                tally.breakAndRuns,
                tally.goldenBreaks
        )));

        return new MatchScoringResponses.Scoreboard(
                matchId,
                match.getStatus(),
                match.getMatchResult(),
                homeScore,
                awayScore,
                playerScores,
                outcome.finalizedGames(),
                games.size(),
                pendingConfirmations
        );
    }

    private Match requireMatch(UUID matchId) {
        return matchRepository.findById(matchId)
                .orElseThrow(() -> ScoringException.notFound("Match not found: " + matchId));
    }

    private static PlayerTally registerPlayer(Map<UUID, PlayerTally> players, UUID playerId, TeamSide side) {
        if (playerId == null) {
            return null;
        }
        return players.computeIfAbsent(playerId, ignored -> new PlayerTally(side));
    }

    private static final class TeamTally {
        private int breakAndRuns;
        private int goldenBreaks;
    }

    private static final class PlayerTally {
        private final TeamSide side;
        private int wins;
        private int losses;
        private int breakAndRuns;
        private int goldenBreaks;

        private PlayerTally(TeamSide side) {
            this.side = side;
        }
    }
}
