package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Log line as delivered by ingestion. Read-only to the RCA core.
 */
@Entity
@Table(name = "log_entries", indexes = {
        @Index(name = "idx_log_entries_service_level_ts", columnList = "service, level, ts")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEntry {

    public static final String ERROR = "ERROR";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String service;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private String level;

    /** Stable event signature, e.g. DB_TIMEOUT. */
    @Column(name = "event_signature")
    private String eventSignature;

    @Column(length = 4096)
    private String message;

    @Column(name = "trace_id")
    private String traceId;
}
