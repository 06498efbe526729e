package com.example.rcaengine.controller;

import com.example.rcaengine.domain.RankingModelVersion;
import com.example.rcaengine.feedback.ModelRegistry;
import com.example.rcaengine.feedback.Retrainer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Learned ranking model versions: listing, retraining and rollback.
 */
@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistry modelRegistry;
    private final Retrainer retrainer;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listModels() {
        List<RankingModelVersion> versions = modelRegistry.listVersions();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active_version", modelRegistry.current().map(ModelRegistry.ActiveModel::version).orElse(null));
        body.put("versions", versions);
        return ResponseEntity.ok(body);
    }

    /**
     * Retrain synchronously and report the outcome.
     */
    @PostMapping("/retrain")
    public ResponseEntity<Retrainer.RetrainOutcome> retrain() {
        return ResponseEntity.ok(retrainer.retrainAsync().join());
    }

    @PostMapping("/{version}/activate")
    public ResponseEntity<?> activate(@PathVariable long version) {
        try {
            return ResponseEntity.ok(modelRegistry.activate(version));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
