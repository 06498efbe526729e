package com.example.rcaengine.detection;

import com.example.rcaengine.config.RcaProperties;
import com.example.rcaengine.config.RcaProperties.Direction;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Robust z-score detector for a single (service, metric) series.
 *
 * <p>The baseline is the median and scaled MAD of the non-breaching samples in
 * the trailing baseline window that ends where the evaluation window starts.
 * The aggregate under test is the mean of the evaluation window. A sample
 * breaches when the aggregate deviates in the metric's bad direction by more
 * than the z threshold and by at least the minimum relative change.
 *
 * <h3>Episodes</h3>
 * A breach opens an episode, a breach within the gap tolerance of the last
 * breach extends it, a clean sample at least one cooldown after the last
 * breach closes it. A breach after the gap tolerance closes the old episode
 * and opens a new one.
 *
 * <h3>Ordering</h3>
 * Samples older than the watermark minus the allowed lateness are rejected.
 * Late samples within the bound are inserted in order and evaluated once;
 * earlier decisions are never revisited.
 *
 * <p>Not thread-safe. Callers serialize access per series.
 */
public class MetricSeriesDetector {

    static final double MAD_SCALE = 1.4826;
    static final double MIN_SCALE = 1e-6;
    static final double RELATIVE_SCALE_FLOOR = 0.01;

    @Getter
    private final String service;
    @Getter
    private final String metric;
    private final Direction direction;
    private final Duration baselineWindow;
    private final Duration evaluationWindow;
    private final int minBaselinePoints;
    private final double zThreshold;
    private final double minRelativeChange;
    private final Duration gapTolerance;
    private final Duration cooldown;
    private final Duration allowedLateness;

    /** Retained samples ordered by timestamp. */
    private final List<Point> points = new ArrayList<>();
    @Getter
    private Instant watermark;
    @Getter
    private Episode openEpisode;

    public MetricSeriesDetector(String service, String metric, RcaProperties.DetectionConfig config) {
        this.service = Objects.requireNonNull(service, "service");
        this.metric = Objects.requireNonNull(metric, "metric");
        this.direction = config.getBadDirections().getOrDefault(metric, config.getDefaultDirection());
        this.baselineWindow = config.getBaselineWindow();
        this.evaluationWindow = config.getEvaluationWindow();
        this.minBaselinePoints = Math.max(1, config.getMinBaselinePoints());
        this.zThreshold = config.getScoreThreshold();
        this.minRelativeChange = config.getMinRelativeChange();
        this.gapTolerance = config.getGapTolerance();
        this.cooldown = config.getCooldown();
        this.allowedLateness = config.getAllowedLateness();
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Feed one sample. Returns the episode transitions it caused, in order.
     */
    public Observation observe(Instant timestamp, double value) {
        if (watermark != null && timestamp.isBefore(watermark.minus(allowedLateness))) {
            return Observation.rejected();
        }

        Point point = new Point(timestamp, value);
        insert(point);
        if (watermark == null || timestamp.isAfter(watermark)) {
            watermark = timestamp;
        }
        evict();

        Evaluation evaluation = evaluate(timestamp);
        if (evaluation == null) {
            return Observation.of(null, maybeClose(timestamp));
        }
        point.breaching = evaluation.breach();
        if (!evaluation.breach()) {
            return Observation.of(evaluation, maybeClose(timestamp));
        }
        return Observation.of(evaluation, onBreach(timestamp, evaluation));
    }

    /**
     * Close the open episode when the series has been silent for a cooldown.
     */
    public List<Transition> closeIdle(Instant now) {
        if (openEpisode == null || watermark == null) return List.of();
        if (Duration.between(watermark, now).compareTo(cooldown) < 0) return List.of();
        return List.of(close());
    }

    private List<Transition> onBreach(Instant timestamp, Evaluation evaluation) {
        if (openEpisode == null) {
            openEpisode = new Episode(timestamp, evaluation);
            return List.of(new Transition(TransitionKind.OPENED, openEpisode));
        }
        Duration sinceLastBreach = Duration.between(openEpisode.lastBreach, timestamp);
        if (sinceLastBreach.compareTo(gapTolerance) <= 0) {
            openEpisode.extend(timestamp, evaluation);
            return List.of(new Transition(TransitionKind.EXTENDED, openEpisode));
        }
        Transition closed = close();
        openEpisode = new Episode(timestamp, evaluation);
        return List.of(closed, new Transition(TransitionKind.OPENED, openEpisode));
    }

    private List<Transition> maybeClose(Instant timestamp) {
        if (openEpisode == null) return List.of();
        if (Duration.between(openEpisode.lastBreach, timestamp).compareTo(cooldown) < 0) return List.of();
        return List.of(close());
    }

    private Transition close() {
        Episode episode = openEpisode;
        episode.closed = true;
        openEpisode = null;
        return new Transition(TransitionKind.CLOSED, episode);
    }

    private Evaluation evaluate(Instant timestamp) {
        Instant evalStart = timestamp.minus(evaluationWindow);
        Instant baselineStart = evalStart.minus(baselineWindow);

        double evalSum = 0;
        int evalCount = 0;
        List<Double> baseline = new ArrayList<>();
        for (Point p : points) {
            if (p.timestamp.isAfter(timestamp)) break;
            if (p.timestamp.isAfter(evalStart)) {
                evalSum += p.value;
                evalCount++;
            } else if (!p.timestamp.isBefore(baselineStart) && !p.breaching) {
                baseline.add(p.value);
            }
        }
        if (evalCount == 0 || baseline.size() < minBaselinePoints) {
            return null;
        }

        double aggregate = evalSum / evalCount;
        double median = median(baseline);
        double mad = median(baseline.stream().map(v -> Math.abs(v - median)).toList());
        double scale = Math.max(MAD_SCALE * mad, Math.max(Math.abs(median) * RELATIVE_SCALE_FLOOR, MIN_SCALE));

        double z = (aggregate - median) / scale;
        double relative = median == 0
                ? (aggregate == 0 ? 0 : Math.signum(aggregate) * Double.POSITIVE_INFINITY)
                : (aggregate - median) / Math.abs(median);

        double directionalZ;
        double directionalRelative;
        switch (direction) {
            case DOWN -> {
                directionalZ = -z;
                directionalRelative = -relative;
            }
            case BOTH -> {
                directionalZ = Math.abs(z);
                directionalRelative = Math.abs(relative);
            }
            default -> {
                directionalZ = z;
                directionalRelative = relative;
            }
        }
        boolean breach = directionalZ > zThreshold && directionalRelative >= minRelativeChange;
        return new Evaluation(aggregate, median, MAD_SCALE * mad, directionalZ, relative, breach);
    }

    private void insert(Point point) {
        if (points.isEmpty() || !point.timestamp.isBefore(points.get(points.size() - 1).timestamp)) {
            points.add(point);
            return;
        }
        int index = Collections.binarySearch(points, point, (a, b) -> a.timestamp.compareTo(b.timestamp));
        if (index < 0) {
            index = -index - 1;
        } else {
            while (index < points.size() && !points.get(index).timestamp.isAfter(point.timestamp)) {
                index++;
            }
        }
        points.add(index, point);
    }

    private void evict() {
        Instant horizon = watermark.minus(baselineWindow).minus(evaluationWindow).minus(allowedLateness);
        int drop = 0;
        while (drop < points.size() && points.get(drop).timestamp.isBefore(horizon)) {
            drop++;
        }
        if (drop > 0) {
            points.subList(0, drop).clear();
        }
    }

    static double median(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n == 0) return 0;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    private static final class Point {
        final Instant timestamp;
        final double value;
        boolean breaching;

        Point(Instant timestamp, double value) {
            this.timestamp = timestamp;
            this.value = value;
        }
    }

    public enum TransitionKind {
        OPENED, EXTENDED, CLOSED
    }

    public record Transition(TransitionKind kind, Episode episode) {
    }

    /**
     * Outcome of one sample evaluation.
     */
    public record Evaluation(double aggregate, double baselineMedian, double baselineMad,
                             double zScore, double relativeChange, boolean breach) {
    }

    /**
     * Result of {@link #observe}: whether the sample was accepted, the
     * evaluation (null while the baseline is too thin) and any transitions.
     */
    public record Observation(boolean dropped, Evaluation evaluation, List<Transition> transitions) {

        static Observation rejected() {
            return new Observation(true, null, List.of());
        }

        static Observation of(Evaluation evaluation, List<Transition> transitions) {
            return new Observation(false, evaluation, transitions);
        }
    }

    /**
     * Mutable state of one deviation episode. The anomaly id is bound by the
     * caller once the episode has been persisted.
     */
    @Getter
    public static final class Episode {
        private final Instant start;
        private Instant lastBreach;
        private double peakScore;
        private Evaluation peak;
        private Evaluation latest;
        private boolean closed;
        private String anomalyId;

        Episode(Instant start, Evaluation evaluation) {
            this.start = start;
            this.lastBreach = start;
            this.peakScore = evaluation.zScore();
            this.peak = evaluation;
            this.latest = evaluation;
        }

        void extend(Instant timestamp, Evaluation evaluation) {
            if (timestamp.isAfter(lastBreach)) {
                lastBreach = timestamp;
            }
            latest = evaluation;
            if (evaluation.zScore() > peakScore) {
                peakScore = evaluation.zScore();
                peak = evaluation;
            }
        }

        public void bindAnomaly(String anomalyId) {
            this.anomalyId = anomalyId;
        }
    }
}
