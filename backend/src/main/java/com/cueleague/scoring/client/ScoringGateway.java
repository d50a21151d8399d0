package com.cueleague.scoring.client;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.model.ScoringSession;

import java.util.List;
import java.util.UUID;

/**
 * Write and read path from a scoring client to the authoritative records.
 * Failures are thrown as {@link com.cueleague.scoring.web.ScoringException};
 * an unreachable back end is reported as a transport failure.
 */
public interface ScoringGateway {

    List<MatchScoringResponses.GameView> fetchGames(UUID matchId);

    MatchScoringResponses.GameTransitionResult propose(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.ProposeResultRequest request
    );

    MatchScoringResponses.GameTransitionResult confirm(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    );

    MatchScoringResponses.GameTransitionResult deny(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    );

    MatchScoringResponses.GameTransitionResult requestVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    );

    MatchScoringResponses.GameTransitionResult acceptVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    );

    MatchScoringResponses.GameTransitionResult denyVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    );

    MatchScoringResponses.MatchTransitionResult verify(UUID matchId, ScoringSession session);
}
