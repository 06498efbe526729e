package com.example.rcaengine.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single WebSocket endpoint for live activity. Routes JSON-RPC requests and
 * pushes activity events to every connected session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private final ObjectMapper objectMapper;
    private final GatewayRpcRouter rpcRouter;
    private final Clock clock;

    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        GatewaySession gatewaySession = GatewaySession.builder()
                .sessionId(session.getId())
                .webSocketSession(session)
                .connectedAt(clock.instant())
                .lastHeartbeat(clock.instant())
                .build();

        sessions.put(session.getId(), gatewaySession);
        log.info("Gateway session connected: {} (total: {})", session.getId(), sessions.size());

        send(session, JsonRpcMessage.notification("gateway.connected", Map.of(
                "sessionId", session.getId(),
                "methods", rpcRouter.listMethods())));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonRpcMessage request;
        try {
            request = objectMapper.readValue(message.getPayload(), JsonRpcMessage.class);
        } catch (IOException e) {
            log.debug("Unparseable gateway message from {}: {}", session.getId(), e.getMessage());
            send(session, JsonRpcMessage.error(null, JsonRpcMessage.PARSE_ERROR, "Parse error: " + e.getMessage()));
            return;
        }

        GatewaySession gatewaySession = sessions.get(session.getId());
        if (gatewaySession != null) {
            gatewaySession.updateHeartbeat(clock.instant());
        }

        if ("heartbeat".equals(request.getMethod())) {
            send(session, JsonRpcMessage.success(request.getId(), Map.of(
                    "status", "alive",
                    "timestamp", clock.instant().toString())));
            return;
        }

        log.debug("RPC request: method={}, id={}", request.getMethod(), request.getId());
        send(session, rpcRouter.route(request, gatewaySession));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Gateway session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Push a notification to all live sessions. Delivery is best effort; a
     * failed send only affects that session.
     */
    public void broadcast(String method, Object params) {
        JsonRpcMessage notification = JsonRpcMessage.notification(method, params);
        sessions.values().forEach(s -> {
            if (s.isAlive()) {
                send(s.getWebSocketSession(), notification);
            }
        });
    }

    private void send(WebSocketSession session, JsonRpcMessage message) {
        try {
            String json = objectMapper.writeValueAsString(message);
            // WebSocketSession is not safe for concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.warn("Failed to send to gateway session {}: {}", session.getId(), e.getMessage());
        }
    }
}
