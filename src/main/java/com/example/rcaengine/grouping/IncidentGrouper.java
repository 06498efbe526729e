package com.example.rcaengine.grouping;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.Anomaly;
import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.rca.RcaRunCoordinator;
import com.example.rcaengine.repository.AnomalyRepository;
import com.example.rcaengine.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Groups anomalies into incidents by correlation key and time proximity.
 *
 * <p>An anomaly joins an OPEN incident of the same correlation key whose active
 * window {@code [start - grace, lastActivity + grace]} overlaps it; otherwise
 * a new incident is created. Incidents quiet for longer than the quiet period
 * are closed and never reopened. All decisions for one correlation key are
 * serialized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentGrouper {

    private final RcaProperties properties;
    private final IncidentRepository incidentRepository;
    private final AnomalyRepository anomalyRepository;
    private final ActivityLogService activityLog;
    private final RcaRunCoordinator rcaCoordinator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final Map<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    /**
     * Correlation group containing the service, else the service itself.
     */
    public String correlationKeyFor(String service) {
        for (var group : properties.getGrouping().getCorrelationGroups().entrySet()) {
            if (group.getValue() != null && group.getValue().contains(service)) {
                return group.getKey();
            }
        }
        return service;
    }

    /**
     * Assign a newly opened, extended or closed anomaly to an incident. Returns
     * the incident it belongs to afterwards, or null when nothing changed.
     */
    public Incident onAnomaly(Anomaly anomaly) {
        String key = correlationKeyFor(anomaly.getService());
        ReentrantLock lock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        Incident incident;
        lock.lock();
        try {
            incident = transactionTemplate.execute(status -> assign(anomaly, key));
        } finally {
            lock.unlock();
        }
        if (incident != null && incident.isOpen()) {
            rcaCoordinator.requestRun(incident.getId());
        }
        return incident;
    }

    /**
     * Close OPEN incidents whose last activity is older than the quiet period
     * and that have no ongoing anomaly.
     */
    @Scheduled(fixedDelayString = "${rca-engine.grouping.sweep-interval-ms:30000}")
    public void sweepQuietIncidents() {
        closeQuietIncidents(clock.instant());
    }

    public int closeQuietIncidents(Instant now) {
        int closed = 0;
        for (Incident candidate : incidentRepository.findByStatusOrderByStartTsDesc(Incident.IncidentStatus.OPEN)) {
            ReentrantLock lock = keyLocks.computeIfAbsent(candidate.getCorrelationKey(), k -> new ReentrantLock());
            lock.lock();
            try {
                Boolean didClose = transactionTemplate.execute(status ->
                        incidentRepository.findById(candidate.getId())
                                .filter(Incident::isOpen)
                                .filter(i -> isQuiet(i, now))
                                .map(i -> {
                                    close(i, now);
                                    return true;
                                })
                                .orElse(false));
                if (Boolean.TRUE.equals(didClose)) closed++;
            } catch (RuntimeException e) {
                log.error("Failed to close incident {}: {}", candidate.getId(), e.getMessage(), e);
            } finally {
                lock.unlock();
            }
        }
        return closed;
    }

    private Incident assign(Anomaly anomaly, String key) {
        if (anomaly.getIncidentId() != null) {
            Optional<Incident> current = incidentRepository.findById(anomaly.getIncidentId());
            if (current.isPresent() && current.get().isOpen()) {
                return attach(current.get(), anomaly);
            }
            if (!anomaly.isOngoing()) {
                return null;
            }
            log.info("Anomaly {} extended after incident {} closed; opening a new incident",
                    anomaly.getId(), anomaly.getIncidentId());
        }

        Instant now = clock.instant();
        Incident target = null;
        for (Incident open : incidentRepository.findByCorrelationKeyAndStatusOrderByLastActivityTsDesc(
                key, Incident.IncidentStatus.OPEN)) {
            if (isQuiet(open, anomaly.getStartTs())) {
                close(open, now);
                continue;
            }
            if (target == null && overlaps(open, anomaly)) {
                target = open;
            }
        }
        return target != null ? attach(target, anomaly) : create(anomaly, key, now);
    }

    private boolean overlaps(Incident incident, Anomaly anomaly) {
        var grace = properties.getGrouping().getGrace();
        Instant windowStart = incident.getStartTs().minus(grace);
        Instant windowEnd = incident.getLastActivityTs().plus(grace);
        return !anomaly.getStartTs().isAfter(windowEnd) && !anomaly.getEndTs().isBefore(windowStart);
    }

    private boolean isQuiet(Incident incident, Instant reference) {
        Instant quietUntil = incident.getLastActivityTs().plus(properties.getGrouping().getQuietPeriod());
        return quietUntil.isBefore(reference) && !anomalyRepository.existsByIncidentIdAndOngoingTrue(incident.getId());
    }

    private Incident create(Anomaly anomaly, String key, Instant now) {
        Incident incident = Incident.builder()
                .status(Incident.IncidentStatus.OPEN)
                .correlationKey(key)
                .startTs(anomaly.getStartTs())
                .lastActivityTs(anomaly.getEndTs())
                .endTs(anomaly.isOngoing() ? null : anomaly.getEndTs())
                .createdAt(now)
                .build();
        incident.getAnomalyIds().add(anomaly.getId());
        incident.getServices().add(anomaly.getService());
        incident.setTitle(titleFor(incident));
        incident.setSummary(summaryFor(incident, List.of(anomaly)));
        incident = incidentRepository.save(incident);

        anomaly.setIncidentId(incident.getId());
        anomalyRepository.save(anomaly);

        log.info("Incident created: {} ({}) from anomaly {}/{}", incident.getId(), incident.getTitle(),
                anomaly.getService(), anomaly.getMetric());
        activityLog.record(ActivityType.INCIDENT_CREATED, anomaly.getService(), incident.getId(),
                incident.getTitle(), Map.of("correlation_key", key, "anomaly_id", anomaly.getId()));
        return incident;
    }

    private Incident attach(Incident incident, Anomaly anomaly) {
        if (!incident.getId().equals(anomaly.getIncidentId())) {
            anomaly.setIncidentId(incident.getId());
            anomalyRepository.save(anomaly);
        }
        incident.getAnomalyIds().add(anomaly.getId());
        incident.getServices().add(anomaly.getService());
        if (anomaly.getStartTs().isBefore(incident.getStartTs())) {
            incident.setStartTs(anomaly.getStartTs());
        }
        if (anomaly.getEndTs().isAfter(incident.getLastActivityTs())) {
            incident.setLastActivityTs(anomaly.getEndTs());
        }
        incident.setEndTs(anomalyRepository.existsByIncidentIdAndOngoingTrue(incident.getId())
                ? null
                : anomalyRepository.findLatestEndTs(incident.getId()).orElse(incident.getLastActivityTs()));
        incident.setTitle(titleFor(incident));
        incident.setSummary(summaryFor(incident, anomalyRepository.findByIncidentIdOrderByStartTsAsc(incident.getId())));
        log.debug("Anomaly {} attached to incident {}", anomaly.getId(), incident.getId());
        return incidentRepository.save(incident);
    }

    private void close(Incident incident, Instant now) {
        incident.setStatus(Incident.IncidentStatus.CLOSED);
        incident.setClosedAt(now);
        if (incident.getEndTs() == null) {
            incident.setEndTs(anomalyRepository.findLatestEndTs(incident.getId()).orElse(incident.getLastActivityTs()));
        }
        incidentRepository.save(incident);
        log.info("Incident closed: {} ({})", incident.getId(), incident.getTitle());
        activityLog.record(ActivityType.INCIDENT_CLOSED, null, incident.getId(), incident.getTitle(),
                Map.of("end_ts", incident.getEndTs().toString()));
    }

    static String titleFor(Incident incident) {
        TreeSet<String> services = new TreeSet<>(incident.getServices());
        if (services.size() == 1) {
            return "Incident in " + services.first();
        }
        return "Incident affecting " + String.join(", ", services);
    }

    static String summaryFor(Incident incident, List<Anomaly> anomalies) {
        String metrics = anomalies.stream()
                .map(a -> a.getService() + "/" + a.getMetric())
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
        return anomalies.size() + (anomalies.size() == 1 ? " anomaly" : " anomalies")
                + " since " + incident.getStartTs() + ": " + metrics;
    }
}
