package com.surveillance.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over WebSocket for streaming detections in and outbreak alerts out.
 *
 * Endpoints:
 * - /ws/detections: connection endpoint
 * - /app/detections: sensors publish detections here
 * - /topic/alerts: every new outbreak alert is broadcast here
 * - /user/queue/*: per-sender acknowledgements and errors
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${surveillance.websocket.endpoint:/ws/detections}")
    private String websocketEndpoint;

    @Value("${surveillance.websocket.allowed-origins:*}")
    private String allowedOrigins;

    // Detections are small; anything bigger is a misbehaving gateway
    @Value("${surveillance.websocket.max-message-bytes:65536}")
    private int maxMessageBytes;

    @Value("${surveillance.websocket.inbound-threads:4}")
    private int inboundThreads;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        // Each inbound detection does a synchronous insert
        registration.taskExecutor()
                .corePoolSize(inboundThreads)
                .maxPoolSize(inboundThreads);
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setMessageSizeLimit(maxMessageBytes);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        // Native WebSocket clients (sensor gateways) skip SockJS
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
