package com.example.rcaengine.activity;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityEvent;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.gateway.GatewayWebSocketHandler;
import com.example.rcaengine.repository.ActivityEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only activity log with a monotonic cursor. Every recorded event is
 * also pushed to live gateway sessions as an {@code activity.event}
 * notification. Recording never fails the caller.
 * <p>
 * Inside a caller's transaction the event is written only after that
 * transaction commits, in a transaction of its own. Appends are serialized so
 * sequence order is commit order and a cursor never skips a late commit.
 */
@Slf4j
@Service
public class ActivityLogService {

    public static final String NOTIFICATION_METHOD = "activity.event";
    private static final int MAX_PAGE_SIZE = 1000;
    private static final int DEFAULT_RECENT = 50;

    private final ActivityEventRepository repository;
    private final GatewayWebSocketHandler gatewayHandler;
    private final RcaProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate appendTransaction;
    private final ReentrantLock appendLock = new ReentrantLock();

    public ActivityLogService(ActivityEventRepository repository,
                              GatewayWebSocketHandler gatewayHandler,
                              RcaProperties properties,
                              ObjectMapper objectMapper,
                              Clock clock,
                              PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.gatewayHandler = gatewayHandler;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.appendTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(ActivityType type, String service, String incidentId,
                       String message, Map<String, ?> metadata) {
        ActivityEvent event = ActivityEvent.builder()
                .timestamp(clock.instant())
                .type(type)
                .service(service)
                .incidentId(incidentId)
                .message(message)
                .metadata(toJson(metadata))
                .build();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    append(event, metadata);
                }
            });
            return;
        }
        append(event, metadata);
    }

    private void append(ActivityEvent event, Map<String, ?> metadata) {
        appendLock.lock();
        try {
            ActivityEvent saved = appendTransaction.execute(status -> repository.save(event));
            gatewayHandler.broadcast(NOTIFICATION_METHOD, toPayload(saved, metadata));
        } catch (RuntimeException e) {
            log.warn("Failed to record {} activity event: {}", event.getType().wireName(), e.getMessage());
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Events strictly after the cursor in sequence order, optionally filtered.
     */
    public List<ActivityEvent> since(long cursor, Integer limit, ActivityType type, String service) {
        int pageSize = limit == null || limit <= 0
                ? properties.getActivity().getDefaultPageSize()
                : Math.min(limit, MAX_PAGE_SIZE);
        return repository.findSince(Math.max(cursor, 0), type, service, PageRequest.of(0, pageSize));
    }

    /**
     * The newest events, newest first.
     */
    public List<ActivityEvent> recent(Integer limit) {
        int pageSize = limit == null || limit <= 0 ? DEFAULT_RECENT : Math.min(limit, MAX_PAGE_SIZE);
        return repository.findAllByOrderBySequenceDesc(PageRequest.of(0, pageSize));
    }

    @Scheduled(fixedDelay = 60_000)
    public void pruneExpired() {
        Instant cutoff = clock.instant().minus(properties.getActivity().getRetention());
        int removed = repository.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.debug("Pruned {} activity events older than {}", removed, cutoff);
        }
    }

    private Map<String, Object> toPayload(ActivityEvent event, Map<String, ?> metadata) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sequence", event.getSequence());
        payload.put("timestamp", event.getTimestamp().toString());
        payload.put("type", event.getType().wireName());
        if (event.getService() != null) payload.put("service", event.getService());
        if (event.getIncidentId() != null) payload.put("incident_id", event.getIncidentId());
        payload.put("message", event.getMessage());
        if (metadata != null && !metadata.isEmpty()) payload.put("metadata", metadata);
        return payload;
    }

    private String toJson(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.debug("Unserializable activity metadata: {}", e.getMessage());
            return null;
        }
    }
}
