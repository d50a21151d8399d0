package com.cueleague.scoring.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * FIFO of pending decisions with one visible at a time.
 * <p>
 * At most one request per game number is held. Dismissing the visible request
 * hides it until {@link #clearDismissed()} runs on the next full sync or the
 * game moves to a new version.
 */
public class ConfirmationQueue {

    private final Deque<ConfirmationRequest> pending = new ArrayDeque<>();
    private final Map<Integer, Long> dismissedVersions = new HashMap<>();

    public synchronized boolean offer(ConfirmationRequest request) {
        Objects.requireNonNull(request, "request is required");
        if (contains(request.gameNumber())) {
            return false;
        }
        Long dismissedVersion = dismissedVersions.get(request.gameNumber());
        if (dismissedVersion != null && dismissedVersion.equals(request.gameVersion())) {
            return false;
        }
        dismissedVersions.remove(request.gameNumber());
        pending.addLast(request);
        return true;
    }

    public synchronized Optional<ConfirmationRequest> current() {
        return Optional.ofNullable(pending.peekFirst());
    }

    /**
     * Drops the request for a game once the local user has acted on it.
     */
    public synchronized boolean resolve(int gameNumber) {
        return pending.removeIf(request -> request.gameNumber() == gameNumber);
    }

    /**
     * Hides the visible request without acting on it.
     */
    public synchronized Optional<ConfirmationRequest> dismiss() {
        ConfirmationRequest request = pending.pollFirst();
        if (request != null) {
            dismissedVersions.put(request.gameNumber(), request.gameVersion());
        }
        return Optional.ofNullable(request);
    }

    public synchronized int prune(Predicate<ConfirmationRequest> stillValid) {
        int removed = 0;
        Iterator<ConfirmationRequest> iterator = pending.iterator();
        while (iterator.hasNext()) {
            if (!stillValid.test(iterator.next())) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized void clearDismissed() {
        dismissedVersions.clear();
    }

    public synchronized boolean contains(int gameNumber) {
        return pending.stream().anyMatch(request -> request.gameNumber() == gameNumber);
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public synchronized List<ConfirmationRequest> snapshot() {
        return new ArrayList<>(pending);
    }
}
