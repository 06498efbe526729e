package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A time-bounded group of related anomalies. Grouping fields are owned by the
 * incident grouper, RCA bookkeeping fields by the RCA run coordinator; dynamic
 * updates keep one writer from overwriting the other's columns.
 */
@Entity
@Table(name = "incidents", indexes = {
        @Index(name = "idx_incidents_status_ts", columnList = "status, start_ts"),
        @Index(name = "idx_incidents_correlation", columnList = "correlation_key, status")
})
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    @Column(name = "start_ts", nullable = false)
    private Instant startTs;

    /** Null while any attached anomaly is still ongoing. */
    @Column(name = "end_ts")
    private Instant endTs;

    @Column(length = 4096)
    private String summary;

    @Column(name = "correlation_key", nullable = false)
    private String correlationKey;

    /** Latest end timestamp of any attached anomaly. */
    @Column(name = "last_activity_ts", nullable = false)
    private Instant lastActivityTs;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_anomalies", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "anomaly_id")
    @Builder.Default
    private Set<String> anomalyIds = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_services", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "service")
    @Builder.Default
    private Set<String> services = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    // RCA bookkeeping

    @Enumerated(EnumType.STRING)
    @Column(name = "rca_status", nullable = false)
    @Builder.Default
    private RcaStatus rcaStatus = RcaStatus.NOT_STARTED;

    @Column(name = "suspects_count")
    @Builder.Default
    private int suspectsCount = 0;

    @Column(name = "last_rca_at")
    private Instant lastRcaAt;

    @Column(name = "ranking_mode")
    private String rankingMode;

    @Column(name = "model_version")
    private Long modelVersion;

    @Column(name = "rca_failure_count")
    @Builder.Default
    private int rcaFailureCount = 0;

    @Column(name = "last_rca_error", length = 1024)
    private String lastRcaError;

    public enum IncidentStatus {
        OPEN, CLOSED
    }

    public boolean isOpen() {
        return status == IncidentStatus.OPEN;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = IncidentStatus.OPEN;
        if (rcaStatus == null) rcaStatus = RcaStatus.NOT_STARTED;
    }
}
