package com.cueleague.scoring.client;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.feed.MatchChangeEvent;
import com.cueleague.scoring.feed.MatchChangeFeed;
import com.cueleague.scoring.feed.MatchChangeListener;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import com.cueleague.scoring.model.MatchGame;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.service.GameConfirmationStateMachine;
import com.cueleague.scoring.service.GameTransition;
import com.cueleague.scoring.web.ScoringException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Gateway over in-memory rows that applies the real state machine, bumps row
 * versions like the database does and pushes changes through a synchronous feed.
 */
class InProcessScoringGateway implements ScoringGateway {

    private final GameConfirmationStateMachine stateMachine = new GameConfirmationStateMachine();
    private final ScoringResponseMapper mapper = new ScoringResponseMapper();
    private final Match match = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
    private final Map<Integer, MatchGame> games = new TreeMap<>();
    private final DirectChangeFeed feed = new DirectChangeFeed();

    private boolean unreachable;
    private boolean publishing = true;
    private int writes;

    InProcessScoringGateway() {
        for (MatchGame game : ScoringFixtures.regulationGames(match)) {
            games.put(game.getGameNumber(), game);
        }
    }

    Match match() {
        return match;
    }

    MatchGame row(int gameNumber) {
        return games.get(gameNumber);
    }

    MatchChangeFeed feed() {
        return feed;
    }

    int writes() {
        return writes;
    }

    void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    void setPublishing(boolean publishing) {
        this.publishing = publishing;
    }

    @Override
    public List<MatchScoringResponses.GameView> fetchGames(UUID matchId) {
        requireReachable();
        return mapper.toGameViews(games.values());
    }

    @Override
    public MatchScoringResponses.GameTransitionResult propose(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.ProposeResultRequest request
    ) {
        return write(gameId, request.expectedVersion(), (m, game) -> stateMachine.propose(
                m, game, session, request.winningTeamId(), request.winningPlayerId(),
                request.breakAndRun(), request.goldenBreak()
        ));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult confirm(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return write(gameId, request.expectedVersion(), (m, game) -> stateMachine.confirm(m, game, session));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult deny(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return write(gameId, request.expectedVersion(), (m, game) -> stateMachine.deny(m, game, session));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult requestVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return write(gameId, request.expectedVersion(), (m, game) -> stateMachine.requestVacate(m, game, session));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult acceptVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return write(gameId, request.expectedVersion(), (m, game) -> stateMachine.acceptVacate(m, game, session));
    }

    @Override
    public MatchScoringResponses.GameTransitionResult denyVacate(
            UUID matchId,
            UUID gameId,
            ScoringSession session,
            ScoringRequests.GameActionRequest request
    ) {
        return write(gameId, request.expectedVersion(), (m, game) -> stateMachine.denyVacate(m, game, session));
    }

    @Override
    public MatchScoringResponses.MatchTransitionResult verify(UUID matchId, ScoringSession session) {
        requireReachable();
        return new MatchScoringResponses.MatchTransitionResult(mapper.toMatchView(match), false, "not decided");
    }

    private MatchScoringResponses.GameTransitionResult write(
            UUID gameId,
            Long expectedVersion,
            BiFunction<Match, MatchGame, GameTransition> mutation
    ) {
        requireReachable();
        writes++;
        MatchGame game = games.values().stream()
                .filter(candidate -> candidate.getGameId().equals(gameId))
                .findFirst()
                .orElseThrow(() -> ScoringException.notFound("Game not found: " + gameId));
        if (expectedVersion != null && !expectedVersion.equals(game.getVersion())) {
            throw ScoringException.writeConflict("Game " + game.getGameNumber() + " changed since you last loaded it");
        }
        GameTransition transition = mutation.apply(match, game);
        if (!transition.changed()) {
            return new MatchScoringResponses.GameTransitionResult(mapper.toGameView(game), false, transition.message());
        }
        game.setVersion(game.getVersion() + 1);
        MatchScoringResponses.GameView view = mapper.toGameView(game);
        if (publishing) {
            feed.publish(MatchChangeEvent.gameUpdated(view));
        }
        return new MatchScoringResponses.GameTransitionResult(view, true, transition.message());
    }

    private void requireReachable() {
        if (unreachable) {
            throw ScoringException.transportFailure("Scoring store is unreachable; try again", null);
        }
    }

    /**
     * Delivers on the publishing thread, in subscription order.
     */
    static final class DirectChangeFeed implements MatchChangeFeed {

        private final List<MatchChangeListener> listeners = new ArrayList<>();

        @Override
        public void publish(MatchChangeEvent event) {
            for (MatchChangeListener listener : new ArrayList<>(listeners)) {
                listener.onChange(event);
            }
        }

        @Override
        public Subscription subscribe(UUID matchId, MatchChangeListener listener) {
            MatchChangeListener filtered = event -> {
                if (matchId.equals(event.matchId())) {
                    listener.onChange(event);
                }
            };
            listeners.add(filtered);
            return () -> listeners.remove(filtered);
        }

        @Override
        public Subscription subscribeAll(MatchChangeListener listener) {
            listeners.add(listener);
            return () -> listeners.remove(listener);
        }
    }
}
