package com.example.rcaengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed-schema feature record describing how a candidate change relates to an
 * incident. Every field defaults to zero when it cannot be computed. Values
 * outside the fixed schema go into {@link #extensions} and are never read by
 * the ranker.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Evidence {

    /** Ordered model input schema. Changing it invalidates trained models. */
    public static final List<String> FEATURE_NAMES = List.of(
            "minutes_before_incident",
            "is_before_incident",
            "metric_delta_count",
            "max_metric_delta",
            "error_log_delta",
            "new_error_signature",
            "diff_keyword_hit",
            "historical_risk");

    public static final String SCHEMA_ID = String.join(",", FEATURE_NAMES);

    @JsonProperty("minutes_before_incident")
    private double minutesBeforeIncident;

    @JsonProperty("is_before_incident")
    private boolean beforeIncident;

    @JsonProperty("metric_delta_count")
    private int metricDeltaCount;

    @JsonProperty("max_metric_delta")
    private double maxMetricDelta;

    @JsonProperty("error_log_delta")
    private double errorLogDelta;

    @JsonProperty("new_error_signature")
    private boolean newErrorSignature;

    @JsonProperty("diff_keyword_hit")
    private boolean diffKeywordHit;

    @JsonProperty("historical_risk")
    private double historicalRisk;

    @JsonProperty("extensions")
    @Builder.Default
    private Map<String, Double> extensions = new TreeMap<>();

    /**
     * Feature vector in {@link #FEATURE_NAMES} order; booleans map to 0/1.
     */
    public double[] toFeatureVector() {
        return new double[] {
                minutesBeforeIncident,
                beforeIncident ? 1.0 : 0.0,
                metricDeltaCount,
                maxMetricDelta,
                errorLogDelta,
                newErrorSignature ? 1.0 : 0.0,
                diffKeywordHit ? 1.0 : 0.0,
                historicalRisk
        };
    }

    @JsonIgnore
    public double getExtension(String name) {
        if (extensions == null) return 0.0;
        return extensions.getOrDefault(name, 0.0);
    }

    public Evidence withExtension(String name, double value) {
        if (extensions == null) extensions = new TreeMap<>();
        extensions.put(name, value);
        return this;
    }
}
