package com.example.rcaengine.rca;

public class IncidentNotFoundException extends IllegalArgumentException {

    private final String incidentId;

    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
