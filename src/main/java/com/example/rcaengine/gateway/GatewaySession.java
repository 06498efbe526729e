package com.example.rcaengine.gateway;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * A connected activity-feed client.
 */
@Data
@Builder
public class GatewaySession {

    private final String sessionId;
    private final WebSocketSession webSocketSession;
    private final Instant connectedAt;
    private Instant lastHeartbeat;

    public void updateHeartbeat(Instant now) {
        this.lastHeartbeat = now;
    }

    public boolean isAlive() {
        return webSocketSession != null && webSocketSession.isOpen();
    }
}
