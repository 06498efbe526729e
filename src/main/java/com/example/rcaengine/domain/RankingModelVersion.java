package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Versioned learned-ranking artifact. At most one version is ACTIVE; retired
 * versions are kept for rollback and audit.
 */
@Entity
@Table(name = "ranking_models")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long version;

    @Column(name = "label_count", nullable = false)
    private int labelCount;

    @Column(name = "training_example_count", nullable = false)
    private int trainingExampleCount;

    /** Comma-joined feature names the parameters were fitted against. */
    @Column(name = "feature_schema", nullable = false, length = 1024)
    private String featureSchema;

    /** JSON-encoded model parameters. */
    @Column(name = "parameters", nullable = false, length = 8192)
    private String parameters;

    @Column(name = "validation_score")
    private double validationScore;

    @Column(name = "baseline_score")
    private double baselineScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "activated_at")
    private Instant activatedAt;

    public enum Status {
        ACTIVE, RETIRED, REJECTED
    }
}
