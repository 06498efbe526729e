package com.example.rcaengine.ingest;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.detection.DetectionService;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.ChangeEvent;
import com.example.rcaengine.domain.LogEntry;
import com.example.rcaengine.domain.MetricSample;
import com.example.rcaengine.domain.SuspectType;
import com.example.rcaengine.ingest.IngestRequests.ConfigChange;
import com.example.rcaengine.ingest.IngestRequests.Deployment;
import com.example.rcaengine.ingest.IngestRequests.FlagChange;
import com.example.rcaengine.ingest.IngestRequests.LogRecord;
import com.example.rcaengine.ingest.IngestRequests.MetricPoint;
import com.example.rcaengine.repository.ChangeEventRepository;
import com.example.rcaengine.repository.LogEntryRepository;
import com.example.rcaengine.repository.MetricSampleRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Validates and stores incoming telemetry. Metric samples are forwarded to the
 * detector after they are stored. Change events are idempotent on
 * (type, identifier): a repeat returns the stored event unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final RcaProperties properties;
    private final MetricSampleRepository metricRepository;
    private final LogEntryRepository logRepository;
    private final ChangeEventRepository changeEventRepository;
    private final DetectionService detectionService;
    private final ActivityLogService activityLog;
    private final ObjectMapper objectMapper;

    public IngestResult ingestMetrics(List<MetricPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IngestionException("No points provided");
        }
        List<IngestResult.Rejection> rejections = new ArrayList<>();
        List<MetricSample> accepted = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            try {
                accepted.add(toSample(points.get(i)));
            } catch (IngestionException e) {
                rejections.add(new IngestResult.Rejection(i, e.getMessage()));
            }
        }

        int touched = 0;
        for (MetricSample sample : metricRepository.saveAll(accepted)) {
            touched += detectionService.process(sample).size();
        }

        if (accepted.size() >= properties.getActivity().getMetricsBatchThreshold()) {
            TreeSet<String> services = new TreeSet<>();
            accepted.forEach(s -> services.add(s.getService()));
            activityLog.record(ActivityType.METRICS_INGESTED, services.size() == 1 ? services.first() : null, null,
                    "Ingested " + accepted.size() + " metric points",
                    Map.of("count", accepted.size(), "services", List.copyOf(services)));
        }
        if (!rejections.isEmpty()) {
            log.warn("Rejected {} of {} metric points", rejections.size(), points.size());
        }
        return new IngestResult(accepted.size(), rejections.size(), rejections, touched);
    }

    public IngestResult ingestLogs(List<LogRecord> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IngestionException("No entries provided");
        }
        List<IngestResult.Rejection> rejections = new ArrayList<>();
        List<LogEntry> accepted = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            LogRecord entry = entries.get(i);
            try {
                require(entry.service(), "service");
                require(entry.level(), "level");
                if (entry.timestamp() == null) throw new IngestionException("ts is required");
                accepted.add(LogEntry.builder()
                        .service(entry.service().trim())
                        .timestamp(entry.timestamp())
                        .level(entry.level().trim().toUpperCase(Locale.ROOT))
                        .eventSignature(blankToNull(entry.event()))
                        .message(entry.message())
                        .traceId(blankToNull(entry.traceId()))
                        .build());
            } catch (IngestionException e) {
                rejections.add(new IngestResult.Rejection(i, e.getMessage()));
            }
        }
        logRepository.saveAll(accepted);
        if (!rejections.isEmpty()) {
            log.warn("Rejected {} of {} log entries", rejections.size(), entries.size());
        }
        return new IngestResult(accepted.size(), rejections.size(), rejections, 0);
    }

    public ChangeEvent ingestDeployment(Deployment deployment) {
        require(deployment.service(), "service");
        require(deployment.commitSha(), "commit_sha");
        requireTimestamp(deployment.timestamp());
        String identifier = deployment.id() != null && !deployment.id().isBlank()
                ? deployment.id().trim()
                : deployment.service().trim() + "@" + deployment.commitSha().trim();
        return store(ChangeEvent.builder()
                .changeType(SuspectType.DEPLOYMENT)
                .identifier(identifier)
                .service(deployment.service().trim())
                .timestamp(deployment.timestamp())
                .commitSha(deployment.commitSha().trim())
                .version(deployment.version())
                .author(deployment.author())
                .diffSummary(deployment.diffSummary())
                .build());
    }

    public ChangeEvent ingestConfigChange(ConfigChange change) {
        require(change.service(), "service");
        require(change.key(), "key");
        requireTimestamp(change.timestamp());
        String identifier = change.id() != null && !change.id().isBlank()
                ? change.id().trim()
                : change.service().trim() + ":" + change.key().trim() + "@" + change.timestamp();
        return store(ChangeEvent.builder()
                .changeType(SuspectType.CONFIG_CHANGE)
                .identifier(identifier)
                .service(change.service().trim())
                .timestamp(change.timestamp())
                .configKey(change.key().trim())
                .oldValue(change.oldValue())
                .newValue(change.newValue())
                .diffSummary(change.diffSummary())
                .source(change.source())
                .build());
    }

    public ChangeEvent ingestFlagChange(FlagChange change) {
        require(change.flagName(), "flag_name");
        requireTimestamp(change.timestamp());
        String identifier = change.id() != null && !change.id().isBlank()
                ? change.id().trim()
                : change.flagName().trim() + "@" + change.timestamp();
        return store(ChangeEvent.builder()
                .changeType(SuspectType.FLAG_CHANGE)
                .identifier(identifier)
                .service(blankToNull(change.service()))
                .timestamp(change.timestamp())
                .flagName(change.flagName().trim())
                .oldState(stateText(change.oldState()))
                .newState(stateText(change.newState()))
                .build());
    }

    private ChangeEvent store(ChangeEvent event) {
        var existing = changeEventRepository.findByChangeTypeAndIdentifier(event.getChangeType(), event.getIdentifier());
        if (existing.isPresent()) {
            log.debug("Duplicate {} {} ignored", event.getChangeType().getWireName(), event.getIdentifier());
            return existing.get();
        }
        try {
            ChangeEvent saved = changeEventRepository.save(event);
            log.info("Ingested {} {} for {} at {}", saved.getChangeType().getWireName(), saved.getIdentifier(),
                    saved.getService() != null ? saved.getService() : "all services", saved.getTimestamp());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Concurrent duplicate; the unique constraint decided the winner.
            return changeEventRepository.findByChangeTypeAndIdentifier(event.getChangeType(), event.getIdentifier())
                    .orElseThrow(() -> e);
        }
    }

    private MetricSample toSample(MetricPoint point) {
        if (point == null) throw new IngestionException("point is null");
        require(point.service(), "service");
        require(point.metric(), "metric");
        requireTimestamp(point.timestamp());
        if (point.value() == null || !Double.isFinite(point.value())) {
            throw new IngestionException("value must be a finite number");
        }
        return MetricSample.builder()
                .service(point.service().trim())
                .metric(point.metric().trim())
                .timestamp(point.timestamp())
                .value(point.value())
                .build();
    }

    private String stateText(Object state) {
        if (state == null) return null;
        if (state instanceof String s) return s;
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IngestionException("Unserializable flag state: " + e.getOriginalMessage());
        }
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IngestionException(field + " is required");
        }
    }

    private static void requireTimestamp(Object timestamp) {
        if (timestamp == null) {
            throw new IngestionException("ts is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
