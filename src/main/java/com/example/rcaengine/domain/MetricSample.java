package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single metric point for a (service, metric) series.
 */
@Entity
@Table(name = "metric_samples", indexes = {
        @Index(name = "idx_metric_samples_service_ts", columnList = "service, ts"),
        @Index(name = "idx_metric_samples_series_ts", columnList = "service, metric, ts")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String service;

    @Column(nullable = false)
    private String metric;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(name = "sample_value", nullable = false)
    private double value;
}
