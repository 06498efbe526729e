package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * A ranked candidate persisted against an incident. The full set for one
 * incident is replaced on every RCA run.
 */
@Entity
@Table(name = "suspects",
        uniqueConstraints = @UniqueConstraint(name = "uk_suspects_incident_rank",
                columnNames = {"incident_id", "suspect_rank"}),
        indexes = @Index(name = "idx_suspects_incident_rank", columnList = "incident_id, suspect_rank"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Suspect {

    /** Derived from (incident, type, key) so reruns keep suspect ids stable. */
    @Id
    private String id;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "suspect_type", nullable = false)
    private SuspectType suspectType;

    @Column(name = "suspect_key", nullable = false)
    private String suspectKey;

    private String service;

    @Column(name = "change_ts")
    private Instant changeTs;

    @Column(name = "suspect_rank", nullable = false)
    private int rank;

    @Column(nullable = false)
    private double score;

    @Convert(converter = EvidenceConverter.class)
    @Column(length = 8192)
    private Evidence evidence;

    @Column(name = "ranking_mode")
    private String rankingMode;

    @Column(name = "model_version")
    private Long modelVersion;

    @Column(name = "created_at")
    private Instant createdAt;

    public static String idFor(String incidentId, SuspectType type, String suspectKey) {
        String seed = incidentId + "|" + type.name() + "|" + suspectKey;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
