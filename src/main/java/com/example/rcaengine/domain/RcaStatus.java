package com.example.rcaengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RcaStatus {
    NOT_STARTED, IN_PROGRESS, COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
