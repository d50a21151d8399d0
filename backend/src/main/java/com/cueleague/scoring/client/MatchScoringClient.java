package com.cueleague.scoring.client;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.feed.MatchChangeEvent;
import com.cueleague.scoring.feed.MatchChangeFeed;
import com.cueleague.scoring.model.GameState;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.web.ScoringErrorKind;
import com.cueleague.scoring.web.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Scoring client for one side of one match.
 * <p>
 * Keeps a local copy of the match's games that only ever changes to the state
 * returned by the server or pushed by the change feed. Pending decisions for
 * the local user are held in a {@link ConfirmationQueue}; with auto-confirm on,
 * score claims from the other team are confirmed as soon as they arrive.
 */
public class MatchScoringClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MatchScoringClient.class);

    private final UUID matchId;
    private final ScoringSession session;
    private final ScoringGateway gateway;
    private final MatchChangeFeed changeFeed;
    private final PlayerDirectory playerDirectory;
    private final ScoringClientListener listener;
    private final boolean autoConfirm;

    private final ConfirmationQueue queue = new ConfirmationQueue();
    private final NavigableMap<Integer, MatchScoringResponses.GameView> games = new TreeMap<>();

    private MatchScoringResponses.MatchView match;
    private MatchChangeFeed.Subscription subscription;
    private boolean autoConfirming;

    public MatchScoringClient(
            UUID matchId,
            ScoringSession session,
            ScoringGateway gateway,
            MatchChangeFeed changeFeed,
            PlayerDirectory playerDirectory,
            ScoringClientListener listener,
            boolean autoConfirm
    ) {
        this.matchId = Objects.requireNonNull(matchId, "matchId is required");
        this.session = Objects.requireNonNull(session, "session is required");
        this.gateway = Objects.requireNonNull(gateway, "gateway is required");
        this.changeFeed = changeFeed;
        this.playerDirectory = playerDirectory == null ? PlayerDirectory.byId() : playerDirectory;
        this.listener = listener == null ? ScoringClientListener.none() : listener;
        this.autoConfirm = autoConfirm;
    }

    /**
     * Subscribes to the change feed and loads the current games.
     */
    public synchronized ScoringOutcome start() {
        if (changeFeed != null && subscription == null) {
            subscription = changeFeed.subscribe(matchId, this::onChange);
        }
        return sync();
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    /**
     * Replaces the local view with the authoritative rows. Dismissed prompts
     * that are still pending surface again.
     */
    public synchronized ScoringOutcome sync() {
        List<MatchScoringResponses.GameView> fetched;
        try {
            fetched = gateway.fetchGames(matchId);
        } catch (ScoringException ex) {
            return report(ScoringOutcome.rejected(ex.getKind(), null, ex.getMessage()));
        }
        queue.clearDismissed();
        for (MatchScoringResponses.GameView game : fetched) {
            absorb(game);
        }
        reconcilePrompts();
        return ScoringOutcome.applied(null, "Loaded " + fetched.size() + " games");
    }

    public synchronized void onChange(MatchChangeEvent event) {
        if (!matchId.equals(event.matchId())) {
            return;
        }
        switch (event.type()) {
            case GAME_UPDATED, GAMES_CREATED -> {
                for (MatchScoringResponses.GameView game : event.games()) {
                    absorb(game);
                }
                reconcilePrompts();
            }
            case MATCH_UPDATED -> {
                if (event.match() != null) {
                    match = event.match();
                    listener.onMatchChanged(match);
                }
            }
        }
    }

    public synchronized ScoringOutcome propose(
            int gameNumber,
            UUID winningTeamId,
            UUID winningPlayerId,
            boolean breakAndRun,
            boolean goldenBreak
    ) {
        MatchScoringResponses.GameView game = games.get(gameNumber);
        if (game == null) {
            return report(missingGame(gameNumber));
        }
        ScoringOutcome blocked = LocalTransitionGuard.checkPropose(game, session.side(), breakAndRun, goldenBreak);
        if (blocked != null) {
            return report(blocked);
        }
        ScoringRequests.ProposeResultRequest request = new ScoringRequests.ProposeResultRequest(
                winningTeamId,
                winningPlayerId,
                breakAndRun,
                goldenBreak,
                game.version()
        );
        return submit(game, true, () -> gateway.propose(matchId, game.gameId(), session, request));
    }

    public synchronized ScoringOutcome confirm(int gameNumber) {
        MatchScoringResponses.GameView game = games.get(gameNumber);
        if (game == null) {
            return report(missingGame(gameNumber));
        }
        ScoringOutcome blocked = LocalTransitionGuard.checkConfirm(game, session.side());
        if (blocked != null) {
            return report(blocked);
        }
        return submit(game, false, () -> gateway.confirm(matchId, game.gameId(), session, versioned(game)));
    }

    public synchronized ScoringOutcome deny(int gameNumber) {
        MatchScoringResponses.GameView game = games.get(gameNumber);
        if (game == null) {
            return report(missingGame(gameNumber));
        }
        ScoringOutcome blocked = LocalTransitionGuard.checkDeny(game, session.side());
        if (blocked != null) {
            return report(blocked);
        }
        return submit(game, false, () -> gateway.deny(matchId, game.gameId(), session, versioned(game)));
    }

    public synchronized ScoringOutcome requestVacate(int gameNumber) {
        MatchScoringResponses.GameView game = games.get(gameNumber);
        if (game == null) {
            return report(missingGame(gameNumber));
        }
        ScoringOutcome blocked = LocalTransitionGuard.checkRequestVacate(game, session.side());
        if (blocked != null) {
            return report(blocked);
        }
        return submit(game, false, () -> gateway.requestVacate(matchId, game.gameId(), session, versioned(game)));
    }

    public synchronized ScoringOutcome acceptVacate(int gameNumber) {
        MatchScoringResponses.GameView game = games.get(gameNumber);
        if (game == null) {
            return report(missingGame(gameNumber));
        }
        ScoringOutcome blocked = LocalTransitionGuard.checkVacateResponse(game, session.side());
        if (blocked != null) {
            return report(blocked);
        }
        return submit(game, false, () -> gateway.acceptVacate(matchId, game.gameId(), session, versioned(game)));
    }

    public synchronized ScoringOutcome denyVacate(int gameNumber) {
        MatchScoringResponses.GameView game = games.get(gameNumber);
        if (game == null) {
            return report(missingGame(gameNumber));
        }
        ScoringOutcome blocked = LocalTransitionGuard.checkVacateResponse(game, session.side());
        if (blocked != null) {
            return report(blocked);
        }
        return submit(game, false, () -> gateway.denyVacate(matchId, game.gameId(), session, versioned(game)));
    }

    public synchronized ScoringOutcome verifyMatch() {
        MatchScoringResponses.MatchTransitionResult result;
        try {
            result = gateway.verify(matchId, session);
        } catch (ScoringException ex) {
            return report(ScoringOutcome.rejected(ex.getKind(), null, ex.getMessage()));
        }
        match = result.match();
        listener.onMatchChanged(match);
        return result.changed()
                ? ScoringOutcome.applied(null, result.message())
                : ScoringOutcome.noChange(null, result.message());
    }

    /**
     * Hides the visible prompt without acting on it. The game stays proposed.
     */
    public synchronized Optional<ConfirmationRequest> dismissPrompt() {
        Optional<ConfirmationRequest> dismissed = queue.dismiss();
        listener.onPromptChanged(queue.current());
        return dismissed;
    }

    public synchronized Optional<ConfirmationRequest> visiblePrompt() {
        return queue.current();
    }

    public synchronized List<ConfirmationRequest> pendingPrompts() {
        return queue.snapshot();
    }

    public synchronized Optional<MatchScoringResponses.GameView> game(int gameNumber) {
        return Optional.ofNullable(games.get(gameNumber));
    }

    public synchronized List<MatchScoringResponses.GameView> games() {
        return new ArrayList<>(games.values());
    }

    public synchronized Optional<MatchScoringResponses.MatchView> match() {
        return Optional.ofNullable(match);
    }

    public ScoringSession session() {
        return session;
    }

    private ScoringOutcome submit(
            MatchScoringResponses.GameView before,
            boolean proposing,
            Supplier<MatchScoringResponses.GameTransitionResult> write
    ) {
        MatchScoringResponses.GameTransitionResult result;
        try {
            result = write.get();
        } catch (ScoringException ex) {
            return recover(before, proposing, ex);
        }
        absorb(result.game());
        queue.resolve(before.gameNumber());
        reconcilePrompts();
        return ScoringOutcome.of(result);
    }

    private ScoringOutcome recover(MatchScoringResponses.GameView before, boolean proposing, ScoringException ex) {
        ScoringErrorKind kind = ex.getKind();
        // local view stays as it was for every failure except a lost race
        if (kind != ScoringErrorKind.WRITE_CONFLICT) {
            return report(ScoringOutcome.rejected(kind, before, ex.getMessage()));
        }

        log.debug("Write conflict on game {} of match {}; reloading", before.gameNumber(), matchId);
        sync();
        MatchScoringResponses.GameView current = games.get(before.gameNumber());
        if (proposing && current != null && current.state() == GameState.PROPOSED
                && current.proposingSide() == session.side().opponent()) {
            listener.onProposalSuperseded(before, current);
        }
        return report(ScoringOutcome.rejected(kind, current, ex.getMessage()));
    }

    private void absorb(MatchScoringResponses.GameView incoming) {
        if (incoming == null || !matchId.equals(incoming.matchId())) {
            return;
        }
        MatchScoringResponses.GameView previous = games.get(incoming.gameNumber());
        if (previous != null && isOlder(incoming, previous)) {
            return;
        }
        if (incoming.equals(previous)) {
            return;
        }
        games.put(incoming.gameNumber(), incoming);
        notifyOwnClaimChanges(previous, incoming);
        listener.onGameChanged(incoming);
    }

    private void notifyOwnClaimChanges(
            MatchScoringResponses.GameView previous,
            MatchScoringResponses.GameView incoming
    ) {
        if (previous == null || previous.state() != GameState.PROPOSED || previous.proposingSide() != session.side()) {
            return;
        }
        if (incoming.state() == GameState.EMPTY) {
            listener.onProposalDenied(incoming);
        } else if (incoming.state() == GameState.PROPOSED && incoming.proposingSide() == session.side().opponent()) {
            listener.onProposalSuperseded(previous, incoming);
        }
    }

    private void reconcilePrompts() {
        Optional<ConfirmationRequest> visibleBefore = queue.current();
        queue.prune(request -> {
            MatchScoringResponses.GameView game = games.get(request.gameNumber());
            return game != null
                    && promptKind(game) == request.kind()
                    && Objects.equals(game.version(), request.gameVersion());
        });

        List<Integer> toConfirm = new ArrayList<>();
        for (MatchScoringResponses.GameView game : games.values()) {
            ConfirmationRequest.Kind kind = promptKind(game);
            if (kind == null) {
                continue;
            }
            if (kind == ConfirmationRequest.Kind.SCORE && autoConfirm) {
                if (!autoConfirming) {
                    toConfirm.add(game.gameNumber());
                }
                continue;
            }
            queue.offer(toRequest(game, kind));
        }

        Optional<ConfirmationRequest> visibleAfter = queue.current();
        if (!visibleAfter.equals(visibleBefore)) {
            listener.onPromptChanged(visibleAfter);
        }

        for (Integer gameNumber : toConfirm) {
            autoConfirming = true;
            try {
                ScoringOutcome outcome = confirm(gameNumber);
                log.debug("Auto-confirm of game {} in match {}: {}", gameNumber, matchId, outcome.status());
            } finally {
                autoConfirming = false;
            }
            MatchScoringResponses.GameView game = games.get(gameNumber);
            if (game != null && promptKind(game) == ConfirmationRequest.Kind.SCORE && queue.offer(
                    toRequest(game, ConfirmationRequest.Kind.SCORE))) {
                listener.onPromptChanged(queue.current());
            }
        }
    }

    private ConfirmationRequest.Kind promptKind(MatchScoringResponses.GameView game) {
        TeamSide opponent = session.side().opponent();
        if (game.state() == GameState.PROPOSED && game.proposingSide() == opponent) {
            return ConfirmationRequest.Kind.SCORE;
        }
        if (game.state() == GameState.VACATE_PENDING && game.vacateRequestedSide() == opponent) {
            return ConfirmationRequest.Kind.VACATE;
        }
        return null;
    }

    private ConfirmationRequest toRequest(MatchScoringResponses.GameView game, ConfirmationRequest.Kind kind) {
        return new ConfirmationRequest(
                kind,
                game.gameId(),
                game.gameNumber(),
                game.winnerPlayerId(),
                playerDirectory.displayName(game.winnerPlayerId()),
                game.breakAndRun(),
                game.goldenBreak(),
                session.side().opponent(),
                game.version()
        );
    }

    private ScoringOutcome report(ScoringOutcome outcome) {
        if (outcome.isRejected()) {
            log.debug("Action on match {} rejected: {} {}", matchId, outcome.errorKind(), outcome.message());
            listener.onError(outcome);
        }
        return outcome;
    }

    private static ScoringOutcome missingGame(int gameNumber) {
        return ScoringOutcome.rejected(ScoringErrorKind.NOT_FOUND, null, "Game " + gameNumber + " is not loaded");
    }

    private static ScoringRequests.GameActionRequest versioned(MatchScoringResponses.GameView game) {
        return new ScoringRequests.GameActionRequest(game.version());
    }

    private static boolean isOlder(MatchScoringResponses.GameView incoming, MatchScoringResponses.GameView current) {
        return incoming.version() != null && current.version() != null && incoming.version() < current.version();
    }
}
