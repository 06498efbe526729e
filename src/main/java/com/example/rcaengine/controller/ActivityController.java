package com.example.rcaengine.controller;

import com.example.rcaengine.activity.ActivityLogService;
import com.example.rcaengine.domain.ActivityEvent;
import com.example.rcaengine.domain.ActivityType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cursor-based polling over the activity log, plus a newest-first tail.
 */
@RestController
@RequestMapping("/api/activity")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityLogService activityLog;

    @GetMapping
    public ResponseEntity<?> since(@RequestParam(defaultValue = "0") long since,
                                   @RequestParam(required = false) Integer limit,
                                   @RequestParam(required = false) String type,
                                   @RequestParam(required = false) String service) {
        ActivityType activityType;
        try {
            activityType = type == null || type.isBlank() ? null : ActivityType.fromWireName(type);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown activity type: " + type));
        }
        List<ActivityEvent> events = activityLog.since(since, limit, activityType, service);
        long cursor = events.isEmpty() ? since : events.get(events.size() - 1).getSequence();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("events", events);
        body.put("cursor", cursor);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/recent")
    public ResponseEntity<Map<String, Object>> recent(@RequestParam(required = false) Integer limit) {
        List<ActivityEvent> events = activityLog.recent(limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("events", events);
        body.put("count", events.size());
        return ResponseEntity.ok(body);
    }
}
