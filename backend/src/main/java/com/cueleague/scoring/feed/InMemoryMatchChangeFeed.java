package com.cueleague.scoring.feed;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single-instance feed. Events are dispatched in publish order on one
 * background thread so listeners never run inside the publishing transaction.
 */
@Service
public class InMemoryMatchChangeFeed implements MatchChangeFeed {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMatchChangeFeed.class);

    private final BlockingQueue<MatchChangeEvent> queue = new LinkedBlockingQueue<>();
    private final Map<UUID, List<MatchChangeListener>> listenersByMatch = new ConcurrentHashMap<>();
    private final List<MatchChangeListener> globalListeners = new CopyOnWriteArrayList<>();

    private volatile boolean running = true;
    private Thread dispatcherThread;

    @PostConstruct
    void startDispatcher() {
        dispatcherThread = new Thread(this::dispatchLoop, "scoring-change-feed-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stopDispatcher() {
        running = false;
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public void publish(MatchChangeEvent event) {
        if (!running) {
            throw new IllegalStateException("Match change feed is not running");
        }
        queue.offer(Objects.requireNonNull(event, "event is required"));
    }

    @Override
    public Subscription subscribe(UUID matchId, MatchChangeListener listener) {
        UUID requiredMatchId = Objects.requireNonNull(matchId, "matchId is required");
        MatchChangeListener requiredListener = Objects.requireNonNull(listener, "listener is required");
        // add and remove run under the per-key lock; the key goes away with its last listener
        listenersByMatch.compute(requiredMatchId, (id, listeners) -> {
            List<MatchChangeListener> target = listeners == null ? new CopyOnWriteArrayList<>() : listeners;
            target.add(requiredListener);
            return target;
        });
        return () -> listenersByMatch.computeIfPresent(requiredMatchId, (id, listeners) -> {
            listeners.remove(requiredListener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    @Override
    public Subscription subscribeAll(MatchChangeListener listener) {
        MatchChangeListener requiredListener = Objects.requireNonNull(listener, "listener is required");
        globalListeners.add(requiredListener);
        return () -> globalListeners.remove(requiredListener);
    }

    int subscribedMatchCount() {
        return listenersByMatch.size();
    }

    void dispatch(MatchChangeEvent event) {
        log.debug("Dispatching {} for match {}", event.type(), event.matchId());
        for (MatchChangeListener listener : globalListeners) {
            deliver(listener, event);
        }
        for (MatchChangeListener listener : listenersByMatch.getOrDefault(event.matchId(), List.of())) {
            deliver(listener, event);
        }
    }

    private void deliver(MatchChangeListener listener, MatchChangeEvent event) {
        try {
            listener.onChange(event);
        } catch (RuntimeException ex) {
            log.error("Match change listener failed for {} on match {}", event.type(), event.matchId(), ex);
        }
    }

    private void dispatchLoop() {
        while (running) {
            try {
                dispatch(queue.take());
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
