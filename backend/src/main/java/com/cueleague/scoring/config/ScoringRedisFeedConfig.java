package com.cueleague.scoring.config;

import com.cueleague.scoring.feed.RedisMatchChangeFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

@Configuration
@ConditionalOnProperty(
        prefix = "scoring.change-feed",
        name = "mode",
        havingValue = "redis"
)
public class ScoringRedisFeedConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringRedisFeedConfig.class);

    @Bean
    public RedisMessageListenerContainer scoringChangeListenerContainer(
            RedisConnectionFactory connectionFactory,
            RedisMatchChangeFeed redisMatchChangeFeed,
            ScoringRuntimeProperties scoringRuntimeProperties
    ) {
        String channel = scoringRuntimeProperties.getChangeFeed().getRedisChannel();
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(redisMatchChangeFeed, new ChannelTopic(channel));
        log.info("Scoring change relay subscribed to Redis channel {}", channel);
        return container;
    }
}
