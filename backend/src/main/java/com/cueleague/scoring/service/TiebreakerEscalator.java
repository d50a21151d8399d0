package com.cueleague.scoring.service;

import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.model.GameMatchup;
import com.cueleague.scoring.model.GameOrder;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.MatchLineup;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchLineupRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Materialises the tiebreaker games once regulation play ends in a deadlock.
 * <p>
 * Callers must hold the match row lock. Existing tiebreaker rows are never
 * recreated or deleted, so unused slots stay empty after the phase is decided.
 */
@Service
@RequiredArgsConstructor
public class TiebreakerEscalator {

    private static final Logger log = LoggerFactory.getLogger(TiebreakerEscalator.class);

    private final MatchGameRepository matchGameRepository;
    private final MatchLineupRepository matchLineupRepository;
    private final ScoringRuntimeProperties scoringRuntimeProperties;

    public List<MatchGame> escalateIfDeadlocked(Match match, List<MatchGame> games, MatchOutcome outcome) {
        if (!outcome.tiebreakerRequired()) {
            return List.of();
        }
        if (games.stream().anyMatch(MatchGame::isTiebreaker)) {
            return List.of();
        }

        UUID matchId = match.getMatchId();
        MatchLineup homeLineup = resolveLockedLineup(matchId, match.getHomeTeamId());
        MatchLineup awayLineup = resolveLockedLineup(matchId, match.getAwayTeamId());

        OffsetDateTime now = OffsetDateTime.now();
        List<MatchGame> created = new ArrayList<>();
        for (GameMatchup matchup : GameOrder.tiebreaker(match.getFormat(), resolveGameCount(match))) {
            MatchGame game = new MatchGame();
            game.setGameId(UUID.randomUUID());
            game.setMatchId(matchId);
            game.setGameNumber(matchup.gameNumber());
            game.setTiebreaker(true);
            game.setHomePlayerId(homeLineup == null ? null : homeLineup.playerAt(matchup.homePosition()));
            game.setAwayPlayerId(awayLineup == null ? null : awayLineup.playerAt(matchup.awayPosition()));
            game.setHomeAction(matchup.homeAction());
            game.setAwayAction(matchup.awayAction());
            game.setCreatedAt(now);
            game.setUpdatedAt(now);
            created.add(game);
        }

        List<MatchGame> saved = matchGameRepository.saveAll(created);
        if (match.getTiebreakerStartedAt() == null) {
            match.setTiebreakerStartedAt(now);
        }
        log.info(
                "Match {} regulation ended {}-{} without a decision; created {} tiebreaker games",
                matchId,
                outcome.homeGamesWon(),
                outcome.awayGamesWon(),
                saved.size()
        );
        return saved;
    }

    public boolean isPhaseDecided(MatchOutcome outcome) {
        return outcome.decidedByTiebreaker();
    }

    private int resolveGameCount(Match match) {
        int gameCount = scoringRuntimeProperties.getTiebreaker().getGameCount();
        if (gameCount <= 0 || gameCount > match.getFormat().lineupSize()) {
            throw new IllegalStateException(
                    "scoring.tiebreaker.game-count must be between 1 and the lineup size of " + match.getFormat()
            );
        }
        return gameCount;
    }

    private MatchLineup resolveLockedLineup(UUID matchId, UUID teamId) {
        MatchLineup lineup = matchLineupRepository.findByMatchIdAndTeamId(matchId, teamId).orElse(null);
        if (lineup == null || !lineup.isLocked()) {
            log.warn(
                    "Tiebreaker games for match {} created without players for team {} because its lineup is not locked",
                    matchId,
                    teamId
            );
            return null;
        }
        return lineup;
    }
}
