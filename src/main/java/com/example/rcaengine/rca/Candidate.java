package com.example.rcaengine.rca;

import com.example.rcaengine.domain.ChangeEvent;
import com.example.rcaengine.domain.SuspectType;

import java.time.Instant;

/**
 * A change that may have caused an incident. Transient; lives for one RCA run.
 *
 * @param service null for global feature flags
 */
public record Candidate(String incidentId,
                        SuspectType suspectType,
                        String suspectKey,
                        String service,
                        Instant changeTs,
                        String payloadText) {

    public static Candidate from(String incidentId, ChangeEvent change) {
        return new Candidate(incidentId, change.getChangeType(), change.getIdentifier(),
                change.getService(), change.getTimestamp(), change.payloadText());
    }

    public boolean isGlobal() {
        return service == null;
    }
}
