package com.example.rcaengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of change a suspect refers to. Declaration order is the tie-break
 * priority used by the ranker: deployments first, flag flips last.
 */
public enum SuspectType {
    DEPLOYMENT("deployment"),
    CONFIG_CHANGE("config_change"),
    FLAG_CHANGE("flag_change");

    private final String wireName;

    SuspectType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int priority() {
        return ordinal();
    }
}
