package com.example.rcaengine.feedback;

/**
 * A label submission that was not recorded. Nothing is written when this is
 * thrown.
 */
public class LabelRejectedException extends IllegalArgumentException {

    public enum Reason {
        UNKNOWN_INCIDENT, UNKNOWN_SUSPECT, INVALID_VALUE
    }

    private final Reason reason;

    public LabelRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
