package com.cueleague.scoring.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class ScoringWebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${scoring.websocket.allowed-origins:http://localhost:5173}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(@NonNull MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic");
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(@NonNull StompEndpointRegistry registry) {
        registry.addEndpoint("/ws-scoring")
                .setAllowedOrigins(parseOrigins(allowedOrigins))
                .withSockJS();
    }

    private String[] parseOrigins(String raw) {
        if (raw == null || raw.isBlank()) {
            return new String[] {"http://localhost:5173"};
        }
        return raw.split("\\s*,\\s*");
    }
}
