package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Human feedback on a suspect. Append-only: a later label for the same
 * (incident, suspect) supersedes earlier ones for training, history stays.
 * The suspect's identity and evidence are snapshotted so training data
 * survives suspect replacement.
 */
@Entity
@Table(name = "labels", indexes = {
        @Index(name = "idx_labels_incident_suspect", columnList = "incident_id, suspect_id"),
        @Index(name = "idx_labels_type_service", columnList = "suspect_type, service")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Label {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Column(name = "suspect_id", nullable = false)
    private String suspectId;

    /** 1 = true cause, 0 = not the cause. */
    @Column(name = "label_value", nullable = false)
    private int value;

    private String annotator;

    @Column(length = 2048)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "suspect_type", nullable = false)
    private SuspectType suspectType;

    @Column(name = "suspect_key", nullable = false)
    private String suspectKey;

    private String service;

    @Convert(converter = EvidenceConverter.class)
    @Column(length = 8192)
    private Evidence evidence;

    public boolean isTrueCause() {
        return value == 1;
    }
}
