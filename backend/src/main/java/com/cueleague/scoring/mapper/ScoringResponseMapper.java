package com.cueleague.scoring.mapper;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class ScoringResponseMapper {

    public MatchScoringResponses.GameView toGameView(MatchGame game) {
        return new MatchScoringResponses.GameView(
                game.getGameId(),
                game.getMatchId(),
                game.getGameNumber(),
                game.isTiebreaker(),
                game.getHomePlayerId(),
                game.getAwayPlayerId(),
                game.getHomeAction(),
                game.getAwayAction(),
                game.getWinnerTeamId(),
                game.getWinnerPlayerId(),
                game.isBreakAndRun(),
                game.isGoldenBreak(),
                game.getConfirmedByHome(),
                game.getConfirmedByAway(),
                game.getConfirmedAt(),
                game.getVacateRequestedBy(),
                game.getVacateRequestedSide(),
                game.state(),
                game.getVersion(),
                game.getUpdatedAt()
        );
    }

    public List<MatchScoringResponses.GameView> toGameViews(Collection<MatchGame> games) {
        return games.stream()
                .map(this::toGameView)
                .toList();
    }

    public MatchScoringResponses.MatchView toMatchView(Match match) {
        return new MatchScoringResponses.MatchView(
                match.getMatchId(),
                match.getHomeTeamId(),
                match.getAwayTeamId(),
                match.getFormat(),
                match.getStatus(),
                match.getHomeGamesToWin(),
                match.getAwayGamesToWin(),
                match.getHomeGamesToTie(),
                match.getAwayGamesToTie(),
                match.getHomeGamesToLose(),
                match.getAwayGamesToLose(),
                match.getHomeGamesWon(),
                match.getAwayGamesWon(),
                match.getHomePointsEarned(),
                match.getAwayPointsEarned(),
                match.getMatchResult(),
                match.getWinnerTeamId(),
                match.getHomeVerifiedBy(),
                match.getAwayVerifiedBy(),
                match.getStartedAt(),
                match.getTiebreakerStartedAt(),
                match.getCompletedAt(),
                match.getVersion(),
                match.getUpdatedAt()
        );
    }
}
