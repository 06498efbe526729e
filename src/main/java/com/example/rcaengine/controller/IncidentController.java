package com.example.rcaengine.controller;

import com.example.rcaengine.domain.Anomaly;
import com.example.rcaengine.domain.Incident;
import com.example.rcaengine.domain.Label;
import com.example.rcaengine.domain.Suspect;
import com.example.rcaengine.feedback.FeedbackService;
import com.example.rcaengine.feedback.LabelRejectedException;
import com.example.rcaengine.rca.IncidentNotFoundException;
import com.example.rcaengine.rca.RcaRunCoordinator;
import com.example.rcaengine.repository.AnomalyRepository;
import com.example.rcaengine.repository.IncidentRepository;
import com.example.rcaengine.repository.SuspectRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Incident, suspect and feedback endpoints.
 */
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
public class IncidentController {

    private final IncidentRepository incidentRepository;
    private final AnomalyRepository anomalyRepository;
    private final SuspectRepository suspectRepository;
    private final FeedbackService feedbackService;
    private final RcaRunCoordinator rcaCoordinator;

    /**
     * List incidents, newest first, optionally filtered by status.
     */
    @GetMapping
    public ResponseEntity<?> listIncidents(@RequestParam(required = false) String status) {
        if (status == null) {
            return ResponseEntity.ok(incidentRepository.findAllByOrderByStartTsDesc());
        }
        try {
            Incident.IncidentStatus parsed = Incident.IncidentStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            return ResponseEntity.ok(incidentRepository.findByStatusOrderByStartTsDesc(parsed));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<Incident> getIncident(@PathVariable String id) {
        return incidentRepository.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/anomalies")
    public ResponseEntity<List<Anomaly>> getAnomalies(@PathVariable String id) {
        if (!incidentRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(anomalyRepository.findByIncidentIdOrderByStartTsAsc(id));
    }

    /**
     * Ranked suspects of the latest completed RCA run.
     */
    @GetMapping("/{id}/suspects")
    public ResponseEntity<List<Suspect>> getSuspects(@PathVariable String id) {
        if (!incidentRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(suspectRepository.findByIncidentIdOrderByRankAsc(id));
    }

    /**
     * RCA progress for polling clients.
     */
    @GetMapping("/{id}/status")
    public ResponseEntity<?> getStatus(@PathVariable String id) {
        return incidentRepository.findById(id)
                .<ResponseEntity<?>>map(incident -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("incident_id", incident.getId());
                    body.put("status", incident.getStatus());
                    body.put("rca_status", incident.getRcaStatus());
                    body.put("suspects_count", incident.getSuspectsCount());
                    body.put("last_rca_at", incident.getLastRcaAt());
                    body.put("ranking_mode", incident.getRankingMode());
                    body.put("model_version", incident.getModelVersion());
                    body.put("rca_failure_count", incident.getRcaFailureCount());
                    body.put("rca_running", rcaCoordinator.isRunning(id));
                    return ResponseEntity.ok(body);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Record feedback on a suspect: 1 = true cause, 0 = not the cause.
     */
    @PostMapping("/{id}/label")
    public ResponseEntity<?> label(@PathVariable String id, @RequestBody Map<String, Object> body) {
        try {
            Label label = feedbackService.submitLabel(id,
                    stringValue(body.get("suspect_id")),
                    intValue(body.get("label")),
                    stringValue(body.get("annotator")),
                    stringValue(body.get("notes")));
            return ResponseEntity.ok(Map.of("status", "ok", "label_id", label.getId()));
        } catch (LabelRejectedException e) {
            HttpStatus status = e.getReason() == LabelRejectedException.Reason.UNKNOWN_INCIDENT
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{id}/labels")
    public ResponseEntity<List<Label>> getLabels(@PathVariable String id) {
        if (!incidentRepository.existsById(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(feedbackService.labelsFor(id));
    }

    @PostMapping("/{id}/rerun-rca")
    public ResponseEntity<?> rerun(@PathVariable String id) {
        try {
            RcaRunCoordinator.TriggerOutcome outcome = rcaCoordinator.requestManualRun(id);
            return ResponseEntity.accepted().body(Map.of(
                    "incident_id", id,
                    "outcome", outcome.name().toLowerCase(Locale.ROOT)));
        } catch (IncidentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer intValue(Object value) {
        if (value == null) return null;
        if (value instanceof Boolean b) return b ? 1 : 0;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) ? (int) d : -1;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
