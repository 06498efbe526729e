package com.example.rcaengine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A deployment, configuration change or feature-flag flip. The payload
 * columns used depend on {@link #changeType}. Immutable once ingested.
 */
@Entity
@Table(name = "change_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_change_events_type_identifier",
                columnNames = {"change_type", "identifier"}),
        indexes = {
                @Index(name = "idx_change_events_service_ts", columnList = "service, ts"),
                @Index(name = "idx_change_events_ts", columnList = "ts")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false)
    private SuspectType changeType;

    /** Stable external identifier; becomes the suspect key. */
    @Column(nullable = false)
    private String identifier;

    /** Null only for global feature flags. */
    private String service;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    // Deployment
    @Column(name = "commit_sha")
    private String commitSha;

    private String version;

    private String author;

    @Column(name = "diff_summary", length = 8192)
    private String diffSummary;

    // Config change
    @Column(name = "config_key")
    private String configKey;

    @Column(name = "old_value", length = 2048)
    private String oldValue;

    @Column(name = "new_value", length = 2048)
    private String newValue;

    private String source;

    // Flag change
    @Column(name = "flag_name")
    private String flagName;

    @Column(name = "old_state", length = 2048)
    private String oldState;

    @Column(name = "new_state", length = 2048)
    private String newState;

    /**
     * Free text searched for risk keywords: the diff for deployments, key and
     * values for config changes, name and states for flags.
     */
    public String payloadText() {
        Stream<String> parts = switch (changeType) {
            case DEPLOYMENT -> Stream.of(diffSummary, version);
            case CONFIG_CHANGE -> Stream.of(configKey, oldValue, newValue, diffSummary);
            case FLAG_CHANGE -> Stream.of(flagName, oldState, newState);
        };
        return parts.filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
