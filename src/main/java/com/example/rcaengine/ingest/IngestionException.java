package com.example.rcaengine.ingest;

/**
 * A telemetry record failed validation at the ingestion boundary.
 */
public class IngestionException extends IllegalArgumentException {

    public IngestionException(String message) {
        super(message);
    }
}
