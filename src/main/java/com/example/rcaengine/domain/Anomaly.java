package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A deviation episode for one (service, metric) series. Created by the
 * detector; afterwards only the end timestamp, score and ongoing flag move.
 */
@Entity
@Table(name = "anomalies", indexes = {
        @Index(name = "idx_anomalies_service_ts", columnList = "service, start_ts"),
        @Index(name = "idx_anomalies_incident", columnList = "incident_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String service;

    @Column(nullable = false)
    private String metric;

    @Column(name = "start_ts", nullable = false)
    private Instant startTs;

    @Column(name = "end_ts", nullable = false)
    private Instant endTs;

    @Column(nullable = false)
    private double score;

    @Column(nullable = false)
    private String detector;

    /** JSON details from the detector (baseline median, MAD, observed value). */
    @Column(length = 4096)
    private String details;

    /** True while the episode is still breaching. */
    @Builder.Default
    private boolean ongoing = true;

    @Column(name = "incident_id")
    private String incidentId;
}
