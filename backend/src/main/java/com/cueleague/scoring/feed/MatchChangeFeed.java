package com.cueleague.scoring.feed;

import java.util.UUID;

/**
 * Push feed of committed game and match mutations.
 */
public interface MatchChangeFeed {

    void publish(MatchChangeEvent event);

    Subscription subscribe(UUID matchId, MatchChangeListener listener);

    /**
     * Receives events for every match, used by transport bridges.
     */
    Subscription subscribeAll(MatchChangeListener listener);

    interface Subscription extends AutoCloseable {

        @Override
        void close();
    }
}
