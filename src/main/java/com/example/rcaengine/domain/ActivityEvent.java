package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entry in the monotonic activity log. The sequence id doubles as the
 * polling cursor.
 */
@Entity
@Table(name = "activity_events", indexes = {
        @Index(name = "idx_activity_ts", columnList = "ts")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long sequence;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ActivityType type;

    private String service;

    @Column(name = "incident_id")
    private String incidentId;

    @Column(length = 1024)
    private String message;

    /** JSON metadata. */
    @Column(length = 4096)
    private String metadata;
}
