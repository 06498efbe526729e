package com.example.rcaengine.controller;

import com.example.rcaengine.domain.ChangeEvent;
import com.example.rcaengine.ingest.IngestRequests;
import com.example.rcaengine.ingest.IngestResult;
import com.example.rcaengine.ingest.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Telemetry ingestion endpoints.
 */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestController {

    private final IngestionService ingestionService;

    @PostMapping("/metrics")
    public ResponseEntity<?> ingestMetrics(@RequestBody IngestRequests.MetricsBatch batch) {
        try {
            IngestResult result = ingestionService.ingestMetrics(batch.points());
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/logs")
    public ResponseEntity<?> ingestLogs(@RequestBody IngestRequests.LogsBatch batch) {
        try {
            return ResponseEntity.ok(ingestionService.ingestLogs(batch.entries()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/deployments")
    public ResponseEntity<?> ingestDeployment(@RequestBody IngestRequests.Deployment deployment) {
        try {
            return ResponseEntity.ok(changeResponse(ingestionService.ingestDeployment(deployment)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/config-changes")
    public ResponseEntity<?> ingestConfigChange(@RequestBody IngestRequests.ConfigChange change) {
        try {
            return ResponseEntity.ok(changeResponse(ingestionService.ingestConfigChange(change)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/flag-changes")
    public ResponseEntity<?> ingestFlagChange(@RequestBody IngestRequests.FlagChange change) {
        try {
            return ResponseEntity.ok(changeResponse(ingestionService.ingestFlagChange(change)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private static Map<String, Object> changeResponse(ChangeEvent event) {
        return Map.of(
                "status", "ok",
                "id", event.getIdentifier(),
                "type", event.getChangeType().getWireName());
    }
}
