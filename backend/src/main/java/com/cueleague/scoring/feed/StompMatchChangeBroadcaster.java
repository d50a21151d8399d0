package com.cueleague.scoring.feed;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Pushes every change event to the match's STOMP topic.
 */
@Component
@RequiredArgsConstructor
public class StompMatchChangeBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(StompMatchChangeBroadcaster.class);
    static final String TOPIC_PREFIX = "/topic/matches/";

    private final MatchChangeFeed matchChangeFeed;
    private final SimpMessagingTemplate messagingTemplate;

    private MatchChangeFeed.Subscription subscription;

    @PostConstruct
    void start() {
        subscription = matchChangeFeed.subscribeAll(this::broadcast);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.close();
        }
    }

    void broadcast(MatchChangeEvent event) {
        String destination = destinationFor(event.matchId());
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (MessagingException ex) {
            log.warn("STOMP push of {} to {} failed: {}", event.type(), destination, ex.getMessage());
        }
    }

    static String destinationFor(UUID matchId) {
        return TOPIC_PREFIX + matchId;
    }
}
