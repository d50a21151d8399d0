package com.cueleague.scoring.feed;

import com.cueleague.scoring.ScoringFixtures;
import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.cueleague.scoring.mapper.ScoringResponseMapper;
import com.cueleague.scoring.model.MatchFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisMatchChangeFeedTest {

    private static final String CHANNEL = "cueleague:test:scoring:changes";

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private InMemoryMatchChangeFeed localFeed;

    private ObjectMapper objectMapper;
    private ScoringRuntimeProperties properties;
    private RedisMatchChangeFeed feed;
    private MatchChangeEvent event;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        properties = new ScoringRuntimeProperties();
        properties.getChangeFeed().setRedisChannel(CHANNEL);
        feed = new RedisMatchChangeFeed(stringRedisTemplate, objectMapper, properties, localFeed);
        event = MatchChangeEvent.gameUpdated(new ScoringResponseMapper().toGameView(
                ScoringFixtures.regulationGames(ScoringFixtures.match(MatchFormat.THREE_V_THREE)).get(0)
        ));
    }

    @Test
    void publishDeliversLocallyAndRelaysEnvelope() {
        feed.publish(event);

        verify(localFeed).publish(event);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(stringRedisTemplate).convertAndSend(eq(CHANNEL), payload.capture());
        assertTrue(payload.getValue().contains(feed.instanceId()));
        assertTrue(payload.getValue().contains(event.matchId().toString()));
        assertTrue(payload.getValue().contains("\"type\":\"GAME_UPDATED\""));
    }

    @Test
    void publishKeepsLocalDeliveryWhenRedisIsDown() {
        doThrow(new RedisConnectionFailureException("redis unavailable"))
                .when(stringRedisTemplate).convertAndSend(eq(CHANNEL), anyString());

        feed.publish(event);
        feed.publish(event);

        verify(localFeed, times(2)).publish(event);
    }

    @Test
    void messagesFromOtherInstancesAreDeliveredLocally() throws Exception {
        String payload = objectMapper.writeValueAsString(
                new RedisMatchChangeFeed.RelayEnvelope(UUID.randomUUID().toString(), event)
        );

        feed.onMessage(new DefaultMessage(CHANNEL.getBytes(StandardCharsets.UTF_8),
                payload.getBytes(StandardCharsets.UTF_8)), null);

        ArgumentCaptor<MatchChangeEvent> captor = ArgumentCaptor.forClass(MatchChangeEvent.class);
        verify(localFeed).publish(captor.capture());
        assertEquals(event.matchId(), captor.getValue().matchId());
        assertEquals(event.games().get(0).gameId(), captor.getValue().games().get(0).gameId());
    }

    @Test
    void ownMessagesAreIgnored() throws Exception {
        String payload = objectMapper.writeValueAsString(new RedisMatchChangeFeed.RelayEnvelope(feed.instanceId(), event));

        feed.onMessage(new DefaultMessage(CHANNEL.getBytes(StandardCharsets.UTF_8),
                payload.getBytes(StandardCharsets.UTF_8)), null);

        verify(localFeed, never()).publish(any());
    }

    @Test
    void unreadableMessageIsDiscarded() {
        feed.onMessage(new DefaultMessage(CHANNEL.getBytes(StandardCharsets.UTF_8),
                "not-json".getBytes(StandardCharsets.UTF_8)), null);

        verify(localFeed, never()).publish(any());
    }

    @Test
    void blankChannelIsRejected() {
        properties.getChangeFeed().setRedisChannel(" ");

        assertThrows(IllegalStateException.class, () -> feed.resolveChannel());
    }
}
