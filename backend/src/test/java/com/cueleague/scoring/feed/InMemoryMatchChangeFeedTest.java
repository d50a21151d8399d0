package com.cueleague.scoring.feed;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.Match;
import com.cueleague.scoring.model.MatchFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryMatchChangeFeedTest {

    private final ScoringResponseMapper mapper = new ScoringResponseMapper();

    private InMemoryMatchChangeFeed feed;
    private Match match;

    @BeforeEach
    void setUp() {
        feed = new InMemoryMatchChangeFeed();
        match = ScoringFixtures.match(MatchFormat.THREE_V_THREE);
    }

    @AfterEach
    void tearDown() {
        feed.stopDispatcher();
    }

    @Test
    void dispatchDeliversOnlyToSubscribersOfThatMatch() {
        List<MatchChangeEvent> received = new ArrayList<>();
        List<MatchChangeEvent> otherMatch = new ArrayList<>();
        List<MatchChangeEvent> everything = new ArrayList<>();
        feed.subscribe(match.getMatchId(), received::add);
        feed.subscribe(UUID.randomUUID(), otherMatch::add);
        feed.subscribeAll(everything::add);

        MatchChangeEvent event = MatchChangeEvent.matchUpdated(mapper.toMatchView(match));
        feed.dispatch(event);

        assertEquals(List.of(event), received);
        assertTrue(otherMatch.isEmpty());
        assertEquals(List.of(event), everything);
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        List<MatchChangeEvent> received = new ArrayList<>();
        MatchChangeFeed.Subscription subscription = feed.subscribe(match.getMatchId(), received::add);

        subscription.close();
        feed.dispatch(MatchChangeEvent.matchUpdated(mapper.toMatchView(match)));

        assertTrue(received.isEmpty());
    }

    @Test
    void lastUnsubscribeForgetsTheMatch() {
        List<MatchChangeEvent> received = new ArrayList<>();
        MatchChangeFeed.Subscription first = feed.subscribe(match.getMatchId(), received::add);
        MatchChangeFeed.Subscription second = feed.subscribe(match.getMatchId(), received::add);
        MatchChangeFeed.Subscription other = feed.subscribe(UUID.randomUUID(), received::add);
        assertEquals(2, feed.subscribedMatchCount());

        first.close();
        assertEquals(2, feed.subscribedMatchCount());

        second.close();
        second.close();
        other.close();
        assertEquals(0, feed.subscribedMatchCount());

        feed.subscribe(match.getMatchId(), received::add);
        feed.dispatch(MatchChangeEvent.matchUpdated(mapper.toMatchView(match)));
        assertEquals(1, received.size());
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<MatchChangeEvent> received = new ArrayList<>();
        feed.subscribe(match.getMatchId(), event -> {
            throw new IllegalStateException("listener failure");
        });
        feed.subscribe(match.getMatchId(), received::add);

        feed.dispatch(MatchChangeEvent.matchUpdated(mapper.toMatchView(match)));

        assertEquals(1, received.size());
    }

    @Test
    void publishedEventsArriveInOrderOnDispatcherThread() throws InterruptedException {
        feed.startDispatcher();
        List<MatchScoringResponses.GameView> games = mapper.toGameViews(ScoringFixtures.regulationGames(match));
        CountDownLatch latch = new CountDownLatch(games.size());
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        feed.subscribe(match.getMatchId(), event -> {
            order.add(event.games().get(0).gameNumber());
            threads.add(Thread.currentThread().getName());
            latch.countDown();
        });

        games.forEach(game -> feed.publish(MatchChangeEvent.gameUpdated(game)));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < games.size(); i++) {
            assertEquals(i + 1, order.get(i));
        }
        assertTrue(threads.stream().allMatch("scoring-change-feed-dispatcher"::equals));
    }

    @Test
    void publishAfterShutdownFails() {
        feed.stopDispatcher();

        assertThrows(IllegalStateException.class,
                () -> feed.publish(MatchChangeEvent.matchUpdated(mapper.toMatchView(match))));
    }
}
