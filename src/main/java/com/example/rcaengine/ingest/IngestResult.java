package com.example.rcaengine.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of an ingestion batch. Rejections are reported per record index.
 */
public record IngestResult(int accepted, int rejected, List<Rejection> errors,
                           @JsonProperty("anomalies_touched") int anomaliesTouched) {

    public record Rejection(int index, String reason) {
    }
}
