package com.example.rcaengine.rca;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.domain.Evidence;
import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.LogEntry;
import com.example.rcaengine.repository.LabelRepository;
import com.example.rcaengine.repository.LogEntryRepository;
import com.example.rcaengine.repository.MetricSampleRepository;
import com.example.rcaengine.repository.MetricSampleRepository.MetricAverage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Computes {@link Evidence} for candidates. Every sub-computation defaults to
 * zero on its own failure; a failure outside them drops only that candidate.
 * Candidates are extracted in parallel on the bounded extraction executor.
 */
@Slf4j
@Component
public class FeatureExtractor {

    public static final String TIME_PROXIMITY_SCORE = "time_proximity_score";
    public static final String AVG_METRIC_DELTA = "avg_metric_delta";
    public static final String DIFF_KEYWORD_COUNT = "diff_keyword_count";
    public static final String NEW_ERROR_SIGNATURE_COUNT = "new_error_signature_count";

    /** Window ends are inclusive; JPQL bounds are exclusive. */
    private static final Duration INCLUSIVE_END = Duration.ofMillis(1);

    private final RcaProperties properties;
    private final MetricSampleRepository metricRepository;
    private final LogEntryRepository logRepository;
    private final LabelRepository labelRepository;
    private final Executor extractionExecutor;
    private final Cache<String, Map<String, Boolean>> historyCache;

    public FeatureExtractor(RcaProperties properties,
                            MetricSampleRepository metricRepository,
                            LogEntryRepository logRepository,
                            LabelRepository labelRepository,
                            @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.properties = properties;
        this.metricRepository = metricRepository;
        this.logRepository = logRepository;
        this.labelRepository = labelRepository;
        this.extractionExecutor = extractionExecutor;
        this.historyCache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getFeatures().getHistoryCacheTtl())
                .maximumSize(1_000)
                .build();
    }

    /**
     * Extract evidence for all candidates. The result keeps candidate order and
     * omits candidates whose extraction failed.
     */
    public Map<Candidate, Evidence> extractAll(Incident incident, List<Candidate> candidates, RunToken token) {
        List<CompletableFuture<Evidence>> futures = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> token.isAborted() ? null : extract(incident, candidate), extractionExecutor)
                    .exceptionally(e -> {
                        log.warn("Incident {}: dropping candidate {} {} after extraction failure: {}",
                                incident.getId(), candidate.suspectType().getWireName(), candidate.suspectKey(),
                                e.getMessage());
                        return null;
                    }));
        }

        Map<Candidate, Evidence> result = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            Evidence evidence = futures.get(i).join();
            if (evidence != null) {
                result.put(candidates.get(i), evidence);
            }
        }
        return result;
    }

    public Evidence extract(Incident incident, Candidate candidate) {
        double minutesBefore = Duration.between(candidate.changeTs(), incident.getStartTs()).toMillis() / 60_000.0;
        Evidence evidence = Evidence.builder()
                .minutesBeforeIncident(minutesBefore)
                .beforeIncident(minutesBefore >= 0)
                .build();
        evidence.withExtension(TIME_PROXIMITY_SCORE, Math.max(0.0, 1.0 - Math.abs(minutesBefore) / 60.0));

        Set<String> services = scopedServices(incident, candidate);
        applyMetricDeltas(evidence, incident, candidate);
        applyErrorLogDelta(evidence, services, candidate);
        applyNewErrorSignatures(evidence, services, candidate);
        applyKeywords(evidence, candidate);
        applyHistoricalRisk(evidence, incident, candidate);
        return evidence;
    }

    private void applyMetricDeltas(Evidence evidence, Incident incident, Candidate candidate) {
        try {
            Duration window = properties.getFeatures().getDeltaWindow();
            Instant change = candidate.changeTs();
            Set<String> services = new LinkedHashSet<>();
            if (candidate.service() != null) services.add(candidate.service());
            services.addAll(incident.getServices());

            List<Double> deltas = new ArrayList<>();
            for (String service : services) {
                Map<String, Double> before = averages(service, change.minus(window), change);
                Map<String, Double> after = averages(service, change, change.plus(window).plus(INCLUSIVE_END));
                for (var entry : before.entrySet()) {
                    Double afterValue = after.get(entry.getKey());
                    double beforeValue = entry.getValue();
                    if (afterValue == null || beforeValue == 0) continue;
                    deltas.add(Math.abs(afterValue - beforeValue) / Math.abs(beforeValue));
                }
            }
            if (deltas.isEmpty()) return;

            double threshold = properties.getFeatures().getMinMetricChange();
            evidence.setMetricDeltaCount((int) deltas.stream().filter(d -> d >= threshold).count());
            evidence.setMaxMetricDelta(deltas.stream().mapToDouble(Double::doubleValue).max().orElse(0));
            evidence.withExtension(AVG_METRIC_DELTA, deltas.stream().mapToDouble(Double::doubleValue).average().orElse(0));
        } catch (RuntimeException e) {
            log.warn("Metric delta extraction failed for {}: {}", candidate.suspectKey(), e.getMessage());
        }
    }

    private Map<String, Double> averages(String service, Instant from, Instant to) {
        Map<String, Double> averages = new HashMap<>();
        for (MetricAverage row : metricRepository.averageByMetric(service, from, to)) {
            if (row.getAverage() != null) averages.put(row.getMetric(), row.getAverage());
        }
        return averages;
    }

    private void applyErrorLogDelta(Evidence evidence, Collection<String> services, Candidate candidate) {
        try {
            Duration window = properties.getFeatures().getDeltaWindow();
            Instant change = candidate.changeTs();
            long before = logRepository.countByLevel(services, LogEntry.ERROR, change.minus(window), change);
            long after = logRepository.countByLevel(services, LogEntry.ERROR, change, change.plus(window).plus(INCLUSIVE_END));
            evidence.setErrorLogDelta((after - before) / (double) Math.max(before, 1));
        } catch (RuntimeException e) {
            log.warn("Error log delta extraction failed for {}: {}", candidate.suspectKey(), e.getMessage());
        }
    }

    private void applyNewErrorSignatures(Evidence evidence, Collection<String> services, Candidate candidate) {
        try {
            Instant change = candidate.changeTs();
            Instant afterEnd = change.plus(properties.getFeatures().getDeltaWindow()).plus(INCLUSIVE_END);
            Set<String> after = new HashSet<>(logRepository.distinctSignatures(services, LogEntry.ERROR, change, afterEnd));
            if (after.isEmpty()) return;
            Instant baselineStart = change.minus(properties.getFeatures().getSignatureBaseline());
            after.removeAll(logRepository.distinctSignatures(services, LogEntry.ERROR, baselineStart, change));
            evidence.setNewErrorSignature(!after.isEmpty());
            evidence.withExtension(NEW_ERROR_SIGNATURE_COUNT, after.size());
        } catch (RuntimeException e) {
            log.warn("Error signature extraction failed for {}: {}", candidate.suspectKey(), e.getMessage());
        }
    }

    private void applyKeywords(Evidence evidence, Candidate candidate) {
        String text = candidate.payloadText();
        if (text == null || text.isBlank()) return;
        String haystack = text.toLowerCase(Locale.ROOT);
        long hits = properties.getFeatures().getRiskKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT).trim())
                .filter(k -> !k.isEmpty() && haystack.contains(k))
                .count();
        evidence.setDiffKeywordHit(hits > 0);
        evidence.withExtension(DIFF_KEYWORD_COUNT, hits);
    }

    private void applyHistoricalRisk(Evidence evidence, Incident incident, Candidate candidate) {
        try {
            Map<String, Boolean> outcomes = historyCache.get(
                    candidate.suspectType().name() + '|' + candidate.service(),
                    k -> loadHistory(candidate));
            long past = 0;
            long causal = 0;
            for (var entry : outcomes.entrySet()) {
                if (entry.getKey().equals(incident.getId())) continue;
                past++;
                if (entry.getValue()) causal++;
            }
            evidence.setHistoricalRisk(past == 0 ? 0.0 : causal / (double) past);
        } catch (RuntimeException e) {
            log.warn("Historical risk extraction failed for {}: {}", candidate.suspectKey(), e.getMessage());
        }
    }

    /**
     * Outcome per past incident for this (type, service): causal when any of its
     * suspects resolves, by its latest label, to a true cause.
     */
    private Map<String, Boolean> loadHistory(Candidate candidate) {
        Map<String, Map<String, Boolean>> latestBySuspect = new HashMap<>();
        for (Label label : labelRepository.findBySuspectTypeAndServiceOrderByIdAsc(candidate.suspectType(), candidate.service())) {
            latestBySuspect.computeIfAbsent(label.getIncidentId(), k -> new HashMap<>())
                    .put(label.getSuspectId(), label.isTrueCause());
        }
        Map<String, Boolean> outcomes = new HashMap<>();
        latestBySuspect.forEach((incidentId, suspects) ->
                outcomes.put(incidentId, suspects.containsValue(Boolean.TRUE)));
        return outcomes;
    }

    /** Forget cached label history; called after new labels arrive. */
    public void invalidateHistory() {
        historyCache.invalidateAll();
    }

    private static Set<String> scopedServices(Incident incident, Candidate candidate) {
        if (candidate.isGlobal()) return new LinkedHashSet<>(incident.getServices());
        return Set.of(candidate.service());
    }
}
