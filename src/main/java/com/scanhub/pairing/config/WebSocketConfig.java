package com.scanhub.pairing.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.scanhub.pairing.websocket.PairingWebSocketHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Exposes the pairing WebSocket endpoint.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final PairingWebSocketHandler pairingWebSocketHandler;
    private final PairingHubProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        PairingHubProperties.WebSocketConfig config = properties.getWebsocket();
        registry.addHandler(pairingWebSocketHandler, config.getPath())
                .setAllowedOriginPatterns(config.getAllowedOrigins().toArray(String[]::new));
        log.info("WebSocket endpoint registered at {}", config.getPath());
    }
}
