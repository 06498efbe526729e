package com.example.rcaengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActivityType {
    METRICS_INGESTED,
    ANOMALY_DETECTED,
    INCIDENT_CREATED,
    INCIDENT_CLOSED,
    RCA_STARTED,
    SUSPECTS_GENERATED,
    SUSPECT_SCORE_UPDATED,
    RCA_FAILED,
    LABEL_RECORDED,
    MODEL_ACTIVATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActivityType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
