package com.example.rcaengine.gateway;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.rca.IncidentNotFoundException;
import com.example.rcaengine.rca.RcaRunCoordinator;
import com.example.rcaengine.repository.IncidentRepository;
import com.example.rcaengine.repository.SuspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Registers the gateway's JSON-RPC methods at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayRpcRegistration {

    private final GatewayRpcRouter router;
    private final ActivityLogService activityLog;
    private final IncidentRepository incidentRepository;
    private final SuspectRepository suspectRepository;
    private final RcaRunCoordinator rcaCoordinator;

    @EventListener(ApplicationReadyEvent.class)
    public void registerRpcMethods() {
        router.registerMethod("gateway.methods", (params, session) -> router.listMethods());

        router.registerMethod("activity.since", (params, session) -> {
            long cursor = longParam(params, "since", 0L);
            Integer limit = params.containsKey("limit") ? (int) longParam(params, "limit", 0L) : null;
            Object type = params.get("type");
            Object service = params.get("service");
            return activityLog.since(cursor, limit,
                    type == null ? null : ActivityType.fromWireName(type.toString()),
                    service == null ? null : service.toString());
        });

        router.registerMethod("incident.suspects", (params, session) -> {
            String id = requiredString(params, "incident_id");
            if (!incidentRepository.existsById(id)) {
                throw new IncidentNotFoundException(id);
            }
            return suspectRepository.findByIncidentIdOrderByRankAsc(id);
        });

        router.registerMethod("incident.rerun", (params, session) -> {
            String id = requiredString(params, "incident_id");
            return Map.of("incident_id", id, "outcome", rcaCoordinator.requestManualRun(id).name().toLowerCase(Locale.ROOT));
        });

        log.info("Registered {} RPC methods", router.getMethodCount());
    }

    private static String requiredString(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing parameter: " + name);
        }
        return value.toString();
    }

    private static long longParam(Map<String, Object> params, String name, long defaultValue) {
        Object value = params.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be a number");
        }
    }
}
