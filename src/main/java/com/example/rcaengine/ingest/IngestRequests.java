package com.example.rcaengine.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Wire shapes accepted by the ingestion endpoints.
 */
public final class IngestRequests {

    private IngestRequests() {
    }

    public record MetricPoint(@JsonProperty("ts") Instant timestamp,
                              String service,
                              String metric,
                              Double value) {
    }

    public record MetricsBatch(List<MetricPoint> points) {
    }

    public record LogRecord(@JsonProperty("ts") Instant timestamp,
                            String service,
                            String level,
                            String event,
                            String message,
                            @JsonProperty("trace_id") String traceId) {
    }

    public record LogsBatch(List<LogRecord> entries) {
    }

    public record Deployment(String id,
                             @JsonProperty("ts") Instant timestamp,
                             String service,
                             @JsonProperty("commit_sha") String commitSha,
                             String version,
                             String author,
                             @JsonProperty("diff_summary") String diffSummary) {
    }

    public record ConfigChange(String id,
                               @JsonProperty("ts") Instant timestamp,
                               String service,
                               String key,
                               @JsonProperty("old_value") String oldValue,
                               @JsonProperty("new_value") String newValue,
                               @JsonProperty("diff_summary") String diffSummary,
                               String source) {
    }

    /** {@code service} is null for global flags. States are arbitrary JSON. */
    public record FlagChange(String id,
                             @JsonProperty("ts") Instant timestamp,
                             String service,
                             @JsonProperty("flag_name") String flagName,
                             @JsonProperty("old_state") Object oldState,
                             @JsonProperty("new_state") Object newState) {
    }
}
