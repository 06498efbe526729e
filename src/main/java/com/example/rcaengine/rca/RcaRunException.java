package com.example.rcaengine.rca;

/**
 * An RCA run failed, timed out or was aborted before it could commit.
 */
public class RcaRunException extends RuntimeException {

    private final String incidentId;

    public RcaRunException(String incidentId, String message) {
        super(message);
        this.incidentId = incidentId;
    }

    public RcaRunException(String incidentId, String message, Throwable cause) {
        super(message, cause);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
