package com.example.rcaengine.detection;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.detection.MetricSeriesDetector.Episode;
import com.example.rcaengine.detection.MetricSeriesDetector.Evaluation;
import com.example.rcaengine.detection.MetricSeriesDetector.Observation;
import com.example.rcaengine.detection.MetricSeriesDetector.Transition;
import com.example.rcaengine.domain.ActivityType;
import com.example.rcaengine.domain.Anomaly;
import com.example.rcaengine.domain.MetricSample;
import com.example.rcaengine.grouping.IncidentGrouper;
import com.example.rcaengine.repository.AnomalyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams metric samples through one {@link MetricSeriesDetector} per
 * (service, metric) series, persists the resulting anomalies and hands them to
 * the incident grouper. Series are independent; each one is only touched
 * under its own monitor.
 */
@Slf4j
@Service
public class DetectionService {

    public static final String DETECTOR_NAME = "robust_zscore";

    private final RcaProperties properties;
    private final AnomalyRepository anomalyRepository;
    private final IncidentGrouper incidentGrouper;
    private final ActivityLogService activityLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Counter droppedSamples;

    private final Map<String, MetricSeriesDetector> series = new ConcurrentHashMap<>();

    public DetectionService(RcaProperties properties,
                            AnomalyRepository anomalyRepository,
                            IncidentGrouper incidentGrouper,
                            ActivityLogService activityLog,
                            ObjectMapper objectMapper,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.anomalyRepository = anomalyRepository;
        this.incidentGrouper = incidentGrouper;
        this.activityLog = activityLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.droppedSamples = Counter.builder("rca.detector.samples.dropped")
                .description("Metric samples rejected for arriving beyond the allowed lateness")
                .register(meterRegistry);
        Gauge.builder("rca.detector.series", this, DetectionService::trackedSeriesCount)
                .description("Metric series with detector state")
                .register(meterRegistry);
    }

    /**
     * Evaluate one sample. Returns the anomalies created or updated by it.
     */
    public List<Anomaly> process(MetricSample sample) {
        if (!properties.getDetection().isEnabled()) return List.of();

        MetricSeriesDetector detector = series.computeIfAbsent(seriesKey(sample.getService(), sample.getMetric()),
                k -> new MetricSeriesDetector(sample.getService(), sample.getMetric(), properties.getDetection()));

        synchronized (detector) {
            Observation observation = detector.observe(sample.getTimestamp(), sample.getValue());
            if (observation.dropped()) {
                droppedSamples.increment();
                log.warn("Dropped late sample for {}/{} at {} (watermark {})",
                        sample.getService(), sample.getMetric(), sample.getTimestamp(), detector.getWatermark());
                return List.of();
            }
            return apply(detector, observation.transitions());
        }
    }

    /**
     * Close episodes of series that stopped reporting.
     */
    @Scheduled(fixedDelayString = "${rca-engine.detection.idle-sweep-interval-ms:30000}")
    public void sweepIdleSeries() {
        var now = clock.instant();
        for (MetricSeriesDetector detector : series.values()) {
            try {
                synchronized (detector) {
                    apply(detector, detector.closeIdle(now));
                }
            } catch (RuntimeException e) {
                log.error("Idle sweep failed for {}/{}: {}", detector.getService(), detector.getMetric(), e.getMessage(), e);
            }
        }
    }

    public int trackedSeriesCount() {
        return series.size();
    }

    private List<Anomaly> apply(MetricSeriesDetector detector, List<Transition> transitions) {
        if (transitions.isEmpty()) return List.of();
        List<Anomaly> touched = new ArrayList<>(transitions.size());
        for (Transition transition : transitions) {
            Anomaly anomaly = switch (transition.kind()) {
                case OPENED -> open(detector, transition.episode());
                case EXTENDED -> update(transition.episode(), true);
                case CLOSED -> update(transition.episode(), false);
            };
            if (anomaly != null) {
                incidentGrouper.onAnomaly(anomaly);
                touched.add(anomaly);
            }
        }
        return touched;
    }

    private Anomaly open(MetricSeriesDetector detector, Episode episode) {
        Anomaly anomaly = anomalyRepository.save(Anomaly.builder()
                .service(detector.getService())
                .metric(detector.getMetric())
                .startTs(episode.getStart())
                .endTs(episode.getLastBreach())
                .score(episode.getPeakScore())
                .detector(DETECTOR_NAME)
                .details(details(detector, episode))
                .ongoing(true)
                .build());
        episode.bindAnomaly(anomaly.getId());

        log.info("Anomaly opened: {}/{} at {} (z={})", anomaly.getService(), anomaly.getMetric(),
                anomaly.getStartTs(), String.format("%.2f", anomaly.getScore()));
        activityLog.record(ActivityType.ANOMALY_DETECTED, anomaly.getService(), null,
                "Anomaly on " + anomaly.getMetric() + " for " + anomaly.getService(),
                Map.of("anomaly_id", anomaly.getId(),
                        "metric", anomaly.getMetric(),
                        "score", anomaly.getScore()));
        return anomaly;
    }

    private Anomaly update(Episode episode, boolean ongoing) {
        if (episode.getAnomalyId() == null) return null;
        return anomalyRepository.findById(episode.getAnomalyId())
                .map(anomaly -> {
                    anomaly.setEndTs(episode.getLastBreach());
                    anomaly.setScore(Math.max(anomaly.getScore(), episode.getPeakScore()));
                    anomaly.setOngoing(ongoing);
                    Anomaly saved = anomalyRepository.save(anomaly);
                    if (!ongoing) {
                        log.info("Anomaly closed: {}/{} [{} .. {}]", saved.getService(), saved.getMetric(),
                                saved.getStartTs(), saved.getEndTs());
                    } else {
                        log.debug("Anomaly extended: {}/{} to {}", saved.getService(), saved.getMetric(), saved.getEndTs());
                    }
                    return saved;
                })
                .orElseGet(() -> {
                    log.warn("Anomaly {} vanished before update", episode.getAnomalyId());
                    return null;
                });
    }

    private String details(MetricSeriesDetector detector, Episode episode) {
        Evaluation peak = episode.getPeak();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("direction", detector.getDirection().name());
        details.put("observed", peak.aggregate());
        details.put("baseline_median", peak.baselineMedian());
        details.put("baseline_mad", peak.baselineMad());
        details.put("z_score", peak.zScore());
        details.put("relative_change", peak.relativeChange());
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize anomaly details: {}", e.getMessage());
            return null;
        }
    }

    private static String seriesKey(String service, String metric) {
        return service + '\u0000' + metric;
    }
}
