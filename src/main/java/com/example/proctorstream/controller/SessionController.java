package com.example.proctorstream.controller;

import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.RawDetection;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.service.SessionLifecycleService;
import com.example.proctorstream.service.SessionRegistry;
import com.example.proctorstream.service.ViolationIngestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Upstream surface: the LMS opens and closes sessions, the ML backend pushes detections.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionLifecycleService lifecycle;
    private final SessionRegistry registry;
    private final ViolationIngestService ingest;

    public SessionController(SessionLifecycleService lifecycle,
                             SessionRegistry registry,
                             ViolationIngestService ingest) {
        this.lifecycle = lifecycle;
        this.registry = registry;
        this.ingest = ingest;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody Map<String, String> request) {
        MonitoringSession session = lifecycle.create(request.get("ownerId"), request.get("examId"));
        Map<String, Object> body = new HashMap<>();
        body.put("sessionId", session.getSessionId());
        body.put("status", session.getStatus().getWireName());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/{sessionId}/end")
    public ResponseEntity<Map<String, Object>> end(@PathVariable String sessionId,
                                                   @RequestBody(required = false) Map<String, String> request) {
        String reason = request != null ? request.get("reason") : null;
        return ResponseEntity.ok(lifecycle.end(sessionId, reason).toSummary());
    }

    @GetMapping("/active")
    public ResponseEntity<Map<String, Object>> active() {
        List<Map<String, Object>> sessions = registry.listActive().stream()
                .map(MonitoringSession::toSummary)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("sessions", sessions, "count", sessions.size()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String sessionId) {
        MonitoringSession session = registry.get(sessionId);
        Map<String, Object> body = new HashMap<>(session.toSummary());
        body.put("violations", session.getViolations().stream().map(Violation::toMap).collect(Collectors.toList()));
        body.put("clientStatus", session.getClientStatus());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{sessionId}/detections")
    public ResponseEntity<Map<String, Object>> detection(@PathVariable String sessionId,
                                                         @RequestBody RawDetection detection) {
        detection.setSessionId(sessionId);
        Violation violation = ingest.ingestDetection(detection);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(violation.toMap());
    }
}
