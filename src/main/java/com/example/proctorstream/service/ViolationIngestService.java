package com.example.proctorstream.service;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.model.BehaviorEvent;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.RawDetection;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.store.DownstreamCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for violations, whether a student's client reports them or the ML
 * backend pushes them. A violation that passes validation is recorded in the session ledger,
 * queued for aggregation, broadcast and mirrored to the downstream store, in that order.
 */
@Service
public class ViolationIngestService {

    private static final Logger logger = LoggerFactory.getLogger(ViolationIngestService.class);

    private final ViolationClassifier classifier;
    private final SessionRegistry registry;
    private final BatchRiskAggregator aggregator;
    private final BroadcastRouter router;
    private final DownstreamDispatcher dispatcher;

    public ViolationIngestService(ViolationClassifier classifier,
                                  SessionRegistry registry,
                                  BatchRiskAggregator aggregator,
                                  BroadcastRouter router,
                                  DownstreamDispatcher dispatcher) {
        this.classifier = classifier;
        this.registry = registry;
        this.aggregator = aggregator;
        this.router = router;
        this.dispatcher = dispatcher;
    }

    /**
     * Detection pushed by the ML backend.
     */
    public Violation ingestDetection(RawDetection detection) {
        MonitoringSession session = registry.get(requireSessionId(detection));
        return accept(session, classifier.normalize(detection, session.getOwnerId()));
    }

    /**
     * Detection reported by the student's own client.
     */
    public Violation ingestDetection(RawDetection detection, ConnectionPrincipal student) {
        MonitoringSession session = ownedSession(requireSessionId(detection), student);
        return accept(session, classifier.normalize(detection, session.getOwnerId()));
    }

    public List<Violation> ingestBehavior(BehaviorEvent event, ConnectionPrincipal student) {
        MonitoringSession session = ownedSession(event.getSessionId(), student);
        List<Violation> violations = classifier.classify(event);
        if (violations.isEmpty()) {
            registry.touch(session.getSessionId());
            logger.debug("Behavior {} on session {} produced no violation", event.getKind(), session.getSessionId());
            return List.of();
        }
        List<Violation> accepted = new ArrayList<>(violations.size());
        for (Violation violation : violations) {
            accepted.add(accept(session, violation));
        }
        return accepted;
    }

    private Violation accept(MonitoringSession session, Violation violation) {
        MonitoringSession updated = registry.recordViolation(session.getSessionId(), violation);
        aggregator.enqueue(violation);
        router.violationAlert(updated, violation);

        Map<String, Object> body = new LinkedHashMap<>(violation.toMap());
        body.put("ownerId", violation.getOwnerId());
        body.put("metadata", violation.getMetadata());
        dispatcher.submit(DownstreamCall.builder()
                .kind(DownstreamCall.Kind.STORE_VIOLATION)
                .targetId(session.getSessionId())
                .body(body)
                .build());

        logger.info("Violation {} ({}, confidence {}) recorded for session {}",
                violation.getRawType(), violation.severity().getWireName(), violation.getConfidence(),
                session.getSessionId());
        return violation;
    }

    private MonitoringSession ownedSession(String sessionId, ConnectionPrincipal student) {
        if (sessionId == null || sessionId.isBlank()) {
            throw ProctorException.invalidInput("sessionId is required");
        }
        MonitoringSession session = registry.get(sessionId);
        if (!session.getOwnerId().equals(student.getUserId())) {
            throw new ProctorException(ErrorCode.INSUFFICIENT_PERMISSION,
                    "Session " + sessionId + " belongs to another user");
        }
        return session;
    }

    private static String requireSessionId(RawDetection detection) {
        if (detection == null || detection.getSessionId() == null || detection.getSessionId().isBlank()) {
            throw ProctorException.invalidInput("sessionId is required");
        }
        return detection.getSessionId();
    }
}
