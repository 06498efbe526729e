package com.example.rcaengine.config;

import com.example.rcaengine.gateway.GatewayWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Mounts the JSON-RPC gateway (activity feed, suspect reads, reruns) at the
 * configured path.
 */
@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final GatewayWebSocketHandler gatewayHandler;
    private final RcaProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        RcaProperties.GatewayConfig gateway = properties.getGateway();
        registry.addHandler(gatewayHandler, gateway.getPath())
                .setAllowedOrigins(gateway.getAllowedOrigins().toArray(String[]::new));
        log.info("Gateway socket mounted at {} (origins: {})", gateway.getPath(), gateway.getAllowedOrigins());
    }
}
