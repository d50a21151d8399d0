package com.cueleague.scoring.feed;

import com.cueleague.scoring.config.ScoringRuntimeProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Relays committed changes across instances over Redis pub/sub.
 * <p>
 * Local subscribers are always served by the in-memory feed, so this instance
 * keeps delivering its own events while Redis is unreachable. Messages that
 * originated here are ignored when they come back from the channel.
 */
@Service
@Primary
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "scoring.change-feed",
        name = "mode",
        havingValue = "redis"
)
public class RedisMatchChangeFeed implements MatchChangeFeed, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisMatchChangeFeed.class);
    private static final String INSTANCE_ID = UUID.randomUUID().toString();

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final ScoringRuntimeProperties scoringRuntimeProperties;
    private final InMemoryMatchChangeFeed localFeed;

    private volatile boolean fallbackMode;

    @Override
    public void publish(MatchChangeEvent event) {
        MatchChangeEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        localFeed.publish(requiredEvent);
        try {
            String payload = objectMapper.writeValueAsString(new RelayEnvelope(INSTANCE_ID, requiredEvent));
            stringRedisTemplate.convertAndSend(resolveChannel(), payload);
            markRedisHealthy();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize match change event", ex);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
    }

    @Override
    public Subscription subscribe(UUID matchId, MatchChangeListener listener) {
        return localFeed.subscribe(matchId, listener);
    }

    @Override
    public Subscription subscribeAll(MatchChangeListener listener) {
        return localFeed.subscribeAll(listener);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        RelayEnvelope envelope;
        try {
            envelope = objectMapper.readValue(raw, RelayEnvelope.class);
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable match change relay message: {}", ex.getOriginalMessage());
            return;
        }
        if (INSTANCE_ID.equals(envelope.sourceInstance()) || envelope.event() == null) {
            return;
        }
        localFeed.publish(envelope.event());
    }

    String instanceId() {
        return INSTANCE_ID;
    }

    String resolveChannel() {
        String channel = scoringRuntimeProperties.getChangeFeed().getRedisChannel();
        if (channel == null || channel.isBlank()) {
            throw new IllegalStateException("scoring.change-feed.redis-channel must not be blank");
        }
        return channel.trim();
    }

    private void markRedisFailure(RuntimeException ex) {
        if (!fallbackMode) {
            fallbackMode = true;
            String reason = ex.getMessage() == null || ex.getMessage().isBlank()
                    ? ex.getClass().getSimpleName()
                    : ex.getMessage();
            log.warn("Redis change relay is unavailable ({}); delivering to local subscribers only", reason);
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis change relay restored");
        }
        fallbackMode = false;
    }

    record RelayEnvelope(
            String sourceInstance,
            MatchChangeEvent event
    ) {
    }
}
