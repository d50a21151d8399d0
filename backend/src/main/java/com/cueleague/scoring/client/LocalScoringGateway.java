package com.cueleague.scoring.client;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.service.GameConfirmationService;
import com.cueleague.scoring.service.MatchEndVerifier;
import com.cueleague.scoring.service.MatchScoreboardService;
import com.cueleague.scoring.web.ScoringException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * In-process gateway that calls the scoring services directly.
 */
@Component
@RequiredArgsConstructor
public class LocalScoringGateway implements ScoringGateway {

    private final GameConfirmationService gameConfirmationService;
    private final MatchEndVerifier matchEndVerifier;
    private final MatchScoreboardService matchScoreboardService;

    @Override
    public List<MatchScoringResponses.GameView> fetchGames(UUID matchId) {
        return call(() -> matchScoreboardService.listGames(matchId));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult propose(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.ProposeResultRequest request
    ) {
        return call(() -> gameConfirmationService.propose(matchId, gameId, session, request));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult confirm(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return call(() -> gameConfirmationService.confirm(matchId, gameId, session, request));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult deny(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return call(() -> gameConfirmationService.deny(matchId, gameId, session, request));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult requestVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return call(() -> gameConfirmationService.requestVacate(matchId, gameId, session, request));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult acceptVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return call(() -> gameConfirmationService.acceptVacate(matchId, gameId, session, request));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult denyVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return call(() -> gameConfirmationService.denyVacate(matchId, gameId, session, request));
    }

    @Override
    public MatchScoringResponses.MatchTransitionResult verify(UUID matchId, ScoringSession session) {
        return call(() -> matchEndVerifier.verify(matchId, session));
    }

    private static <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (OptimisticLockingFailureException ex) {
            throw ScoringException.writeConflict("The record changed while your action was being saved", ex);
        } catch (DataAccessResourceFailureException | TransientDataAccessException | CannotCreateTransactionException ex) {
            throw ScoringException.transportFailure("Scoring store is unreachable; try again", ex);
        }
    }
}
