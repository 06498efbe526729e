package com.example.rcaengine.gateway;

import com.example.rcaengine.rca.IncidentNotFoundException;
import com.example.rcaengine.rca.RcaRunException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Maps JSON-RPC method names to handlers. Namespaces:
 * activity.* for the event feed, incident.* for incident and suspect reads,
 * gateway.* for introspection.
 */
@Slf4j
@Component
public class GatewayRpcRouter {

    private final Map<String, BiFunction<Map<String, Object>, GatewaySession, Object>> handlers =
            new ConcurrentHashMap<>();

    public void registerMethod(String method, BiFunction<Map<String, Object>, GatewaySession, Object> handler) {
        handlers.put(method, handler);
        log.debug("Registered RPC method: {}", method);
    }

    @SuppressWarnings("unchecked")
    public JsonRpcMessage route(JsonRpcMessage request, GatewaySession session) {
        String method = request.getMethod();
        if (method == null) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INVALID_REQUEST, "Invalid request: missing method");
        }

        var handler = handlers.get(method);
        if (handler == null) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.METHOD_NOT_FOUND, "Method not found: " + method);
        }

        Object rawParams = request.getParams();
        if (rawParams != null && !(rawParams instanceof Map)) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INVALID_PARAMS, "Params must be an object");
        }
        Map<String, Object> params = rawParams == null ? Map.of() : (Map<String, Object>) rawParams;

        try {
            return JsonRpcMessage.success(request.getId(), handler.apply(params, session));
        } catch (IncidentNotFoundException e) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INCIDENT_NOT_FOUND, e.getMessage());
        } catch (RcaRunException e) {
            log.warn("RPC method {} failed for incident {}: {}", method, e.getIncidentId(), e.getMessage());
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.RCA_RUN_FAILED, e.getMessage());
        } catch (IllegalArgumentException e) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INVALID_PARAMS, e.getMessage());
        } catch (Exception e) {
            log.error("Error executing RPC method {}: {}", method, e.getMessage(), e);
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    public TreeSet<String> listMethods() {
        return new TreeSet<>(handlers.keySet());
    }

    public int getMethodCount() {
        return handlers.size();
    }
}
