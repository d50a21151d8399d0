package com.cueleague.scoring.service;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.feed.MatchChangePublisher;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.GameMatchup;
import com.cueleague.scoring.model.GameOrder;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.MatchLineup;
import com.cueleague.scoring.model.MatchStatus;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchLineupRepository;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates the empty regulation games once both lineups are locked. Repeated
 * calls return the existing games.
 */
@Service
@RequiredArgsConstructor
public class MatchGameProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(MatchGameProvisioningService.class);

    private final MatchRepository matchRepository;
    private final MatchGameRepository matchGameRepository;
    private final MatchLineupRepository matchLineupRepository;
    private final GameConfirmationStateMachine stateMachine;
    private final ScoringResponseMapper scoringResponseMapper;
    private final MatchChangePublisher matchChangePublisher;

    @Transactional
    public MatchScoringResponses.GameBatchResult provisionRegulationGames(UUID matchId, ScoringSession session) {
        Match match = matchRepository.findByMatchIdForUpdate(matchId)
                .orElseThrow(() -> ScoringException.notFound("Match not found: " + matchId));
        stateMachine.requireParticipant(match, session);

        List<MatchGame> existing = matchGameRepository.findByMatchIdOrderByGameNumberAsc(matchId);
        if (!existing.isEmpty()) {
            return new MatchScoringResponses.GameBatchResult(
                    scoringResponseMapper.toGameViews(existing),
                    false,
                    "Games for this match already exist"
            );
        }

        MatchLineup homeLineup = requireLockedLineup(matchId, match.getHomeTeamId(), "home");
        MatchLineup awayLineup = requireLockedLineup(matchId, match.getAwayTeamId(), "away");

        OffsetDateTime now = OffsetDateTime.now();
        List<MatchGame> games = new ArrayList<>();
        for (GameMatchup matchup : GameOrder.regulation(match.getFormat())) {
            MatchGame game = new MatchGame();
            game.setGameId(UUID.randomUUID());
            game.setMatchId(matchId);
            game.setGameNumber(matchup.gameNumber());
            game.setTiebreaker(false);
            game.setHomePlayerId(homeLineup.playerAt(matchup.homePosition()));
            game.setAwayPlayerId(awayLineup.playerAt(matchup.awayPosition()));
            game.setHomeAction(matchup.homeAction());
            game.setAwayAction(matchup.awayAction());
            game.setCreatedAt(now);
            game.setUpdatedAt(now);
            games.add(game);
        }
        List<MatchGame> saved = matchGameRepository.saveAll(games);

        if (match.getStatus() == MatchStatus.SCHEDULED) {
            match.setStatus(MatchStatus.IN_PROGRESS);
        }
        if (match.getStartedAt() == null) {
            match.setStartedAt(now);
        }
        match.setUpdatedAt(now);
        Match savedMatch = matchRepository.save(match);

        List<MatchScoringResponses.GameView> views = scoringResponseMapper.toGameViews(saved);
        matchChangePublisher.publishGamesCreated(matchId, views);
        matchChangePublisher.publishMatchUpdated(scoringResponseMapper.toMatchView(savedMatch));
        log.info("Created {} regulation games for {} match {}", saved.size(), match.getFormat(), matchId);
        return new MatchScoringResponses.GameBatchResult(views, true, "Created " + saved.size() + " games");
    }

    private MatchLineup requireLockedLineup(UUID matchId, UUID teamId, String sideLabel) {
        MatchLineup lineup = matchLineupRepository.findByMatchIdAndTeamId(matchId, teamId)
                .orElseThrow(() -> ScoringException.invalidTransition(
                        "The " + sideLabel + " lineup has not been submitted"
                ));
        if (!lineup.isLocked()) {
            throw ScoringException.invalidTransition("The " + sideLabel + " lineup is not locked yet");
        }
        return lineup;
    }
}
