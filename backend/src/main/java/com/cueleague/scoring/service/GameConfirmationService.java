package com.cueleague.scoring.service;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.feed.MatchChangePublisher;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.repository.MatchGameRepository;
import com.cueleague.scoring.repository.MatchRepository;
import com.cueleague.scoring.web.ScoringException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Transactional boundary for per-game actions.
 * <p>
 * Each call locks the match row and then the game row, applies the transition,
 * re-derives the match aggregate and returns the committed game as the caller
 * will see it on the next read.
 */
@Service
@RequiredArgsConstructor
public class GameConfirmationService {

    private static final Logger log = LoggerFactory.getLogger(GameConfirmationService.class);

    private final MatchRepository matchRepository;
    private final MatchGameRepository matchGameRepository;
    private final GameConfirmationStateMachine stateMachine;
    private final MatchOutcomeCalculator matchOutcomeCalculator;
    private final TiebreakerEscalator tiebreakerEscalator;
    private final MatchProgressionService matchProgressionService;
    private final ScoringResponseMapper scoringResponseMapper;
    private final MatchChangePublisher matchChangePublisher;

    @Transactional
    public MatchScoringResponses.GameTransitionResult propose(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.ProposeResultRequest request
    ) {
        Objects.requireNonNull(request, "request is required");
        return execute("propose", matchId, gameId, session, request.expectedVersion(), (match, game) -> {
            requireOpenTiebreakerSlot(match, game);
            return stateMachine.propose(
                    match,
                    game,
                    session,
                    request.winningTeamId(),
                    request.winningPlayerId(),
                    request.breakAndRun(),
                    request.goldenBreak()
            );
        });
    }

    @Transactional
    public MatchScoringResponses.GameTransitionResult confirm(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return execute("confirm", matchId, gameId, session, versionOf(request),
                (match, game) -> stateMachine.confirm(match, game, session));
    }

    @Transactional
    public MatchScoringResponses.GameTransitionResult deny(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return execute("deny", matchId, gameId, session, versionOf(request),
                (match, game) -> stateMachine.deny(match, game, session));
    }

    @Transactional
    public MatchScoringResponses.GameTransitionResult requestVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return execute("request vacate", matchId, gameId, session, versionOf(request),
                (match, game) -> stateMachine.requestVacate(match, game, session));
    }

    @Transactional
    public MatchScoringResponses.GameTransitionResult acceptVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return execute("accept vacate", matchId, gameId, session, versionOf(request),
                (match, game) -> stateMachine.acceptVacate(match, game, session));
    }

    @Transactional
    public MatchScoringResponses.GameTransitionResult denyVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return execute("deny vacate", matchId, gameId, session, versionOf(request),
                (match, game) -> stateMachine.denyVacate(match, game, session));
    }

    private MatchScoringResponses.GameTransitionResult execute(
            String action,
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            Long expectedVersion,
            GameMutation mutation
    ) {
        Objects.requireNonNull(session, "session is required");
        Match match = matchRepository.findByMatchIdForUpdate(matchId)
                .orElseThrow(() -> ScoringException.notFound("Match not found: " + matchId));
        MatchGame game = matchGameRepository.findByGameIdForUpdate(gameId)
                .filter(candidate -> candidate.getMatchId().equals(matchId))
                .orElseThrow(() -> ScoringException.notFound("Game not found in match: " + gameId));

        GameTransition transition;
        try {
            requireExpectedVersion(game, expectedVersion);
            transition = mutation.apply(match, game);
        } catch (ScoringException ex) {
            log.warn(
                    "Rejected {} on game {} of match {} by {} team member {}: {} {}",
                    action,
                    game.getGameNumber(),
                    matchId,
                    session.side().name().toLowerCase(),
                    session.memberId(),
                    ex.getKind(),
                    ex.getMessage()
            );
            throw ex;
        }

        if (!transition.changed()) {
            log.debug("No change for {} on game {} of match {}: {}",
                    action, game.getGameNumber(), matchId, transition.message());
            return new MatchScoringResponses.GameTransitionResult(
                    scoringResponseMapper.toGameView(game),
                    false,
                    transition.message()
            );
        }

        game.setUpdatedAt(OffsetDateTime.now());
        MatchGame saved = matchGameRepository.saveAndFlush(game);
        logTransition(action, saved, matchId);

        MatchScoringResponses.GameView view = scoringResponseMapper.toGameView(saved);
        matchChangePublisher.publishGameUpdated(view);
        matchProgressionService.reconcile(match);
        return new MatchScoringResponses.GameTransitionResult(view, true, transition.message());
    }

    private void requireOpenTiebreakerSlot(Match match, MatchGame game) {
        if (!game.isTiebreaker() || game.state() != GameState.EMPTY) {
            return;
        }
        List<MatchGame> games = matchGameRepository.findByMatchIdOrderByGameNumberAsc(match.getMatchId());
        MatchOutcome outcome = matchOutcomeCalculator.calculate(match, games);
        if (tiebreakerEscalator.isPhaseDecided(outcome)) {
            throw ScoringException.invalidTransition(
                    "The tiebreaker is already decided; game " + game.getGameNumber() + " is not played"
            );
        }
    }

    private static void requireExpectedVersion(MatchGame game, Long expectedVersion) {
        if (expectedVersion != null && !expectedVersion.equals(game.getVersion())) {
            throw ScoringException.writeConflict(
                    "Game " + game.getGameNumber() + " changed since you last loaded it; refresh and try again"
            );
        }
    }

    private static Long versionOf(ScoringRequests.GameActionRequest request) {
        return request == null ? null : request.expectedVersion();
    }

    private static void logTransition(String action, MatchGame game, UUID matchId) {
        GameState state = game.state();
        if (state == GameState.FINALIZED || state == GameState.VACATE_PENDING || state == GameState.EMPTY) {
            log.info("Game {} of match {} is {} after {}", game.getGameNumber(), matchId, state, action);
        } else {
            log.debug("Game {} of match {} is {} after {}", game.getGameNumber(), matchId, state, action);
        }
    }

    @FunctionalInterface
    private interface GameMutation {
        GameTransition apply(Match match, MatchGame game);
    }
}
