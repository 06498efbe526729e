package com.example.rcaengine.controller;

import com.example.rcaengine.domain.MetricSample;
import com.example.rcaengine.repository.MetricSampleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the services and metrics seen in ingested telemetry.
 */
@RestController
@RequestMapping("/api/services")
@RequiredArgsConstructor
public class ServiceController {

    private final MetricSampleRepository metricRepository;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listServices() {
        return ResponseEntity.ok(Map.of("services", metricRepository.findDistinctServices()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> listMetrics(@RequestParam(required = false) String service) {
        String filter = service == null || service.isBlank() ? null : service;
        return ResponseEntity.ok(Map.of("metrics", metricRepository.findDistinctMetrics(filter)));
    }

    /**
     * Latest point of one series; both fields are null when the series has no data.
     */
    @GetMapping("/metrics/latest")
    public ResponseEntity<Map<String, Object>> latest(@RequestParam String service, @RequestParam String metric) {
        Optional<MetricSample> sample = metricRepository.findFirstByServiceAndMetricOrderByTimestampDesc(service, metric);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("value", sample.map(MetricSample::getValue).orElse(null));
        body.put("ts", sample.map(s -> s.getTimestamp().toString()).orElse(null));
        return ResponseEntity.ok(body);
    }
}
