package com.cueleague.scoring.service;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.feed.MatchChangePublisher;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.GameMatchup;
import com.cueleague.scoring.model.GameOrder;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.MatchLineup;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Substitutes the player at one lineup position of a locked lineup.
 * <p>
 * The migration touches exactly two tables: the position column of
 * {@code match_lineups} and the side's player column of every
 * {@code match_games} row played from that position which is not finalized.
 * Finalized games keep the player who actually played them. A pending
 * proposal naming the replaced player is cleared because its claimed winner
 * no longer matches the assignment.
 */
@Service
@RequiredArgsConstructor
public class PlayerReassignmentService {

    private static final Logger log = LoggerFactory.getLogger(PlayerReassignmentService.class);

    private final MatchRepository matchRepository;
    private final MatchGameRepository matchGameRepository;
    private final MatchLineupRepository matchLineupRepository;
    private final GameConfirmationStateMachine stateMachine;
    private final MatchProgressionService matchProgressionService;
    private final ScoringResponseMapper scoringResponseMapper;
    private final MatchChangePublisher matchChangePublisher;

    @Transactional
    public MatchScoringResponses.ReassignmentResult substitute(
            UUID matchId,
            TeamSide side,
            int position,
            ScoringSession session,
            ScoringRequests.SubstitutePlayerRequest request
    ) {
        Match match = matchRepository.findByMatchIdForUpdate(matchId)
                .orElseThrow(() -> ScoringException.notFound("Match not found: " + matchId));
        stateMachine.requireParticipant(match, session);
        if (session.side() != side) {
            throw ScoringException.identityViolation("Only the " + side.name().toLowerCase()
                    + " team can substitute its own players");
        }
        MatchFormat format = match.getFormat();
        if (position < 1 || position > format.lineupSize()) {
            throw ScoringException.constraintViolation(
                    "Lineup position must be between 1 and " + format.lineupSize()
            );
        }

        MatchLineup lineup = matchLineupRepository.findByMatchIdAndTeamId(matchId, match.teamOf(side))
                .orElseThrow(() -> ScoringException.invalidTransition("Lineup has not been submitted"));
        if (!lineup.isLocked()) {
            throw ScoringException.invalidTransition("Lineup is not locked; edit it directly instead");
        }

        UUID previousPlayerId = lineup.playerAt(position);
        UUID playerId = request.playerId();
        for (int other = 1; other <= format.lineupSize(); other++) {
            if (other != position && playerId.equals(lineup.playerAt(other))) {
                throw ScoringException.constraintViolation("Player already occupies position " + other);
            }
        }
        if (playerId.equals(previousPlayerId)) {
            return new MatchScoringResponses.ReassignmentResult(
                    side, position, previousPlayerId, playerId, List.of(), "Player already occupies this position"
            );
        }

        OffsetDateTime now = OffsetDateTime.now();
        lineup.setPlayerAt(position, playerId);
        lineup.setHandicapAt(position, request.handicap());
        lineup.setUpdatedAt(now);
        matchLineupRepository.save(lineup);

        Map<Integer, GameMatchup> matchups = matchupsByGameNumber(format);
        List<MatchGame> updated = new ArrayList<>();
        for (MatchGame game : matchGameRepository.findByMatchIdOrderByGameNumberAsc(matchId)) {
            GameMatchup matchup = matchups.get(game.getGameNumber());
            if (matchup == null || positionOf(matchup, side) != position) {
                continue;
            }
            GameState state = game.state();
            if (state == GameState.FINALIZED || state == GameState.VACATE_PENDING) {
                continue;
            }
            if (state == GameState.PROPOSED && previousPlayerId != null
                    && previousPlayerId.equals(game.getWinnerPlayerId())) {
                game.clearResult();
            }
            if (side == TeamSide.HOME) {
                game.setHomePlayerId(playerId);
            } else {
                game.setAwayPlayerId(playerId);
            }
            game.setUpdatedAt(now);
            updated.add(game);
        }

        List<MatchGame> saved = matchGameRepository.saveAllAndFlush(updated);
        List<MatchScoringResponses.GameView> views = scoringResponseMapper.toGameViews(saved);
        views.forEach(matchChangePublisher::publishGameUpdated);
        matchProgressionService.reconcile(match);

        log.info(
                "Substituted {} position {} of match {}: {} -> {}, {} games reassigned",
                side,
                position,
                matchId,
                previousPlayerId,
                playerId,
                saved.size()
        );
        return new MatchScoringResponses.ReassignmentResult(
                side,
                position,
                previousPlayerId,
                playerId,
                views,
                "Reassigned " + saved.size() + " unfinished games"
        );
    }

    private static Map<Integer, GameMatchup> matchupsByGameNumber(MatchFormat format) {
        Map<Integer, GameMatchup> matchups = new HashMap<>();
        for (GameMatchup matchup : GameOrder.regulation(format)) {
            matchups.put(matchup.gameNumber(), matchup);
        }
        for (GameMatchup matchup : GameOrder.tiebreaker(format, format.lineupSize())) {
            matchups.put(matchup.gameNumber(), matchup);
        }
        return matchups;
    }

    private static int positionOf(GameMatchup matchup, TeamSide side) {
        return side == TeamSide.HOME ? matchup.homePosition() : matchup.awayPosition();
    }
}
