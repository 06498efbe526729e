package com.example.rcaengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the RCA engine.
 * Maps to the 'rca-engine' prefix in application.yml.
 * Thresholds, windows and weights are policy parameters; the defaults below
 * are starting points pending calibration data.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rca-engine")
public class RcaProperties {

    private DetectionConfig detection = new DetectionConfig();
    private GroupingConfig grouping = new GroupingConfig();
    private CandidateConfig candidates = new CandidateConfig();
    private FeatureConfig features = new FeatureConfig();
    private RankingConfig ranking = new RankingConfig();
    private RunConfig runs = new RunConfig();
    private FeedbackConfig feedback = new FeedbackConfig();
    private ActivityConfig activity = new ActivityConfig();
    private GatewayConfig gateway = new GatewayConfig();

    public enum Direction {
        UP, DOWN, BOTH
    }

    @Data
    public static class DetectionConfig {
        private boolean enabled = true;
        private Duration baselineWindow = Duration.ofMinutes(30);
        private Duration evaluationWindow = Duration.ofSeconds(30);
        private int minBaselinePoints = 10;
        /** Robust z-score a breach must exceed. */
        private double scoreThreshold = 3.0;
        /** Minimum fractional change against the baseline median for a breach. */
        private double minRelativeChange = 0.1;
        private Duration gapTolerance = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofSeconds(120);
        private Duration allowedLateness = Duration.ofSeconds(30);
        private Direction defaultDirection = Direction.UP;
        private Map<String, Direction> badDirections = new HashMap<>(Map.of(
                "p95_latency_ms", Direction.UP,
                "p99_latency_ms", Direction.UP,
                "error_rate", Direction.UP,
                "qps", Direction.DOWN));
        private long idleSweepIntervalMs = 30_000;
    }

    @Data
    public static class GroupingConfig {
        private Duration grace = Duration.ofMinutes(5);
        private Duration quietPeriod = Duration.ofMinutes(10);
        /** Named groups of services whose anomalies correlate into one incident. */
        private Map<String, List<String>> correlationGroups = new HashMap<>();
        private long sweepIntervalMs = 30_000;
    }

    @Data
    public static class CandidateConfig {
        private Duration lookback = Duration.ofHours(2);
        private Duration lookahead = Duration.ofMinutes(10);
    }

    @Data
    public static class FeatureConfig {
        private Duration deltaWindow = Duration.ofMinutes(10);
        private double minMetricChange = 0.2;
        private Duration signatureBaseline = Duration.ofHours(1);
        private List<String> riskKeywords = new ArrayList<>(List.of(
                "timeout", "retry", "pool size", "pool", "cache", "connection", "database", "db"));
        private Duration historyCacheTtl = Duration.ofSeconds(60);
    }

    @Data
    public static class RankingConfig {
        private HeuristicWeights weights = new HeuristicWeights();

        @Data
        public static class HeuristicWeights {
            private double beforeIncident = 3.0;
            private double recency = 2.0;
            private double recencyDecayMinutes = 30.0;
            private double maxMetricDelta = 2.5;
            private double metricDeltaCount = 0.5;
            private double metricDeltaCountSaturation = 5.0;
            private double errorLogDelta = 2.0;
            private double errorLogDeltaSaturation = 10.0;
            private double newErrorSignature = 1.5;
            private double diffKeywordHit = 1.0;
            private double historicalRisk = 2.0;
            private double afterIncidentPenalty = 4.0;
            private double afterIncidentRampMinutes = 15.0;
        }
    }

    @Data
    public static class RunConfig {
        private Duration debounce = Duration.ofSeconds(5);
        private Duration maxDuration = Duration.ofSeconds(60);
        private int extractionParallelism = 4;
        private int maxConsecutiveFailures = 3;
    }

    @Data
    public static class FeedbackConfig {
        private int minLabels = 10;
        private boolean autoRetrain = true;
        private int holdoutModulus = 5;
        private int trainingIterations = 2000;
        private double learningRate = 0.1;
        private double l2 = 0.01;
        private long retrainCheckIntervalMs = 300_000;
    }

    @Data
    public static class ActivityConfig {
        private Duration retention = Duration.ofHours(1);
        private int metricsBatchThreshold = 10;
        private int defaultPageSize = 250;
    }

    @Data
    public static class GatewayConfig {
        private String path = "/ws/gateway";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
