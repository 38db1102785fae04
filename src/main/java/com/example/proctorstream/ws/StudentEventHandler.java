package com.example.proctorstream.ws;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.RoomKey;
import com.example.proctorstream.broadcast.RoomRegistry;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.broadcast.ServerMessage;
import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.model.BehaviorEvent;
import com.example.proctorstream.model.BehaviorKind;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.RawDetection;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.service.InterventionService;
import com.example.proctorstream.service.SessionLifecycleService;
import com.example.proctorstream.service.SessionRegistry;
import com.example.proctorstream.service.ViolationIngestService;
import com.example.proctorstream.ws.dto.BehaviorEventRequest;
import com.example.proctorstream.ws.dto.EmergencyRequest;
import com.example.proctorstream.ws.dto.ScreenshotResponseRequest;
import com.example.proctorstream.ws.dto.SessionRef;
import com.example.proctorstream.ws.dto.StatusUpdateRequest;
import com.example.proctorstream.ws.dto.SubmissionRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Handles events from student connections. A student may only act on the session it owns.
 */
@Component
public class StudentEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(StudentEventHandler.class);

    private final SessionRegistry registry;
    private final SessionLifecycleService lifecycle;
    private final ViolationIngestService ingest;
    private final InterventionService interventions;
    private final BroadcastRouter router;
    private final RoomRegistry rooms;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean endOnDisconnect;

    public StudentEventHandler(SessionRegistry registry,
                               SessionLifecycleService lifecycle,
                               ViolationIngestService ingest,
                               InterventionService interventions,
                               BroadcastRouter router,
                               RoomRegistry rooms,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${app.session.end-on-student-disconnect:false}") boolean endOnDisconnect) {
        this.registry = registry;
        this.lifecycle = lifecycle;
        this.ingest = ingest;
        this.interventions = interventions;
        this.router = router;
        this.rooms = rooms;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.endOnDisconnect = endOnDisconnect;
    }

    public void handle(WebSocketConnection connection, StudentEvent event, JsonNode data) {
        switch (event) {
            case JOIN_SESSION:
                joinSession(connection, read(data, SessionRef.class));
                break;
            case BEHAVIOR_EVENT:
                behaviorEvent(connection, read(data, BehaviorEventRequest.class));
                break;
            case VIOLATION_DETECTED:
                violationDetected(connection, read(data, RawDetection.class));
                break;
            case STATUS_UPDATE:
                statusUpdate(connection, read(data, StatusUpdateRequest.class));
                break;
            case EMERGENCY_HELP:
                emergencyHelp(connection, read(data, EmergencyRequest.class));
                break;
            case QUIZ_SUBMITTED:
                quizSubmitted(connection, read(data, SubmissionRequest.class));
                break;
            case SCREENSHOT_RESPONSE:
                screenshotResponse(connection, read(data, ScreenshotResponseRequest.class));
                break;
            case PING:
                connection.send(ServerMessage.of(ServerEvent.PONG, Map.of("timestamp", clock.instant())));
                break;
        }
    }

    private void joinSession(WebSocketConnection connection, SessionRef request) {
        String sessionId = resolveSessionId(connection, request.getSessionId());
        ownedSession(connection.getPrincipal(), sessionId);

        RoomKey room = RoomKey.session(sessionId);
        rooms.join(connection.getId(), room);
        connection.bindSession(sessionId);
        registry.recordRoomJoin(sessionId, room.name());
        MonitoringSession session = lifecycle.ownerJoined(sessionId, connection.getId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", sessionId);
        data.put("examId", session.getExamId());
        data.put("status", session.getStatus().getWireName());
        data.put("room", room.name());
        connection.send(ServerMessage.of(ServerEvent.SESSION_JOINED, data));
    }

    private void behaviorEvent(WebSocketConnection connection, BehaviorEventRequest request) {
        String sessionId = resolveSessionId(connection, request.getSessionId());
        BehaviorKind kind = BehaviorKind.fromWire(request.getEventType());
        BehaviorEvent event = BehaviorEvent.builder()
                .sessionId(sessionId)
                .ownerId(connection.getPrincipal().getUserId())
                .kind(kind)
                .payload(request.getEventData() != null ? request.getEventData() : Map.of())
                .clientTimestamp(request.getTimestamp() != null ? Instant.ofEpochMilli(request.getTimestamp()) : null)
                .build();
        List<Violation> violations = ingest.ingestBehavior(event, connection.getPrincipal());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", sessionId);
        data.put("eventType", request.getEventType());
        data.put("violationsDetected", violations.size());
        data.put("violations", violations.stream().map(Violation::toMap).collect(Collectors.toList()));
        connection.send(ServerMessage.of(ServerEvent.BEHAVIOR_PROCESSED, data));
    }

    private void violationDetected(WebSocketConnection connection, RawDetection detection) {
        detection.setSessionId(resolveSessionId(connection, detection.getSessionId()));
        Violation violation = ingest.ingestDetection(detection, connection.getPrincipal());
        connection.send(ServerMessage.of(ServerEvent.VIOLATION_RECORDED, violation.toMap()));
    }

    private void statusUpdate(WebSocketConnection connection, StatusUpdateRequest request) {
        String sessionId = resolveSessionId(connection, request.getSessionId());
        ownedSession(connection.getPrincipal(), sessionId);
        MonitoringSession session = registry.update(sessionId, request.getStatus());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", sessionId);
        data.put("ownerId", session.getOwnerId());
        data.put("status", session.getClientStatus());
        router.toObservers(session.getExamId(), ServerEvent.SESSION_STATUS_UPDATE, data, null);
    }

    private void emergencyHelp(WebSocketConnection connection, EmergencyRequest request) {
        String sessionId = resolveSessionId(connection, request.getSessionId());
        MonitoringSession session = ownedSession(connection.getPrincipal(), sessionId);

        Map<String, Object> alert = new LinkedHashMap<>();
        alert.put("sessionId", sessionId);
        alert.put("ownerId", session.getOwnerId());
        alert.put("examId", session.getExamId());
        alert.put("type", request.getType() != null ? request.getType() : "general");
        alert.put("message", request.getMessage());
        alert.put("priority", "urgent");
        router.toObservers(session.getExamId(), ServerEvent.EMERGENCY_ALERT, alert, null);
        logger.warn("Emergency help requested on session {} by {}", sessionId, session.getOwnerId());

        connection.send(ServerMessage.of(ServerEvent.EMERGENCY_ACKNOWLEDGED, Map.of(
                "sessionId", sessionId,
                "message", "Help request sent to proctors. Please wait for assistance.")));
    }

    private void quizSubmitted(WebSocketConnection connection, SubmissionRequest request) {
        String sessionId = resolveSessionId(connection, request.getSessionId());
        MonitoringSession session = ownedSession(connection.getPrincipal(), sessionId);

        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("sessionId", sessionId);
        notice.put("ownerId", session.getOwnerId());
        notice.put("examId", session.getExamId());
        notice.put("submissionId", request.getSubmissionId());
        notice.put("riskScore", session.getRiskScore());
        notice.put("violationCount", session.getViolationCount());
        router.toObservers(session.getExamId(), ServerEvent.QUIZ_SUBMITTED, notice, null);
        connection.send(ServerMessage.of(ServerEvent.SUBMISSION_RECEIVED, Map.of("sessionId", sessionId)));
        lifecycle.end(sessionId, "quiz-submitted");
    }

    private void screenshotResponse(WebSocketConnection connection, ScreenshotResponseRequest request) {
        interventions.screenshotResponse(connection.getPrincipal(), request.getRequestId(), request.getScreenshot());
    }

    /**
     * Student went away. The registry record stays; observers hear about it.
     */
    public void onDisconnect(WebSocketConnection connection) {
        String sessionId = connection.getBoundSessionId();
        if (sessionId == null) {
            return;
        }
        try {
            registry.find(sessionId).ifPresent(session -> {
                MonitoringSession updated = registry.recordRoomLeave(sessionId, RoomKey.session(sessionId).name());
                if (updated.isClosed()) {
                    return;
                }
                lifecycle.ownerLeft(updated, connection.getId());
                if (endOnDisconnect) {
                    lifecycle.end(sessionId, "student-disconnected");
                }
            });
        } catch (Exception e) {
            logger.warn("Disconnect handling for session {} failed: {}", sessionId, e.getMessage());
        }
    }

    private String resolveSessionId(WebSocketConnection connection, String requested) {
        String bound = connection.getPrincipal().getSessionId();
        if (requested != null && !requested.isBlank()) {
            if (bound != null && !bound.equals(requested)) {
                throw new ProctorException(ErrorCode.INSUFFICIENT_PERMISSION,
                        "Token is bound to another session");
            }
            return requested;
        }
        if (connection.getBoundSessionId() != null) return connection.getBoundSessionId();
        if (bound != null) return bound;
        throw ProctorException.invalidInput("sessionId is required");
    }

    private MonitoringSession ownedSession(ConnectionPrincipal student, String sessionId) {
        MonitoringSession session = registry.get(sessionId);
        if (!session.getOwnerId().equals(student.getUserId())) {
            throw new ProctorException(ErrorCode.INSUFFICIENT_PERMISSION,
                    "Session " + sessionId + " belongs to another user");
        }
        return session;
    }

    private <T> T read(JsonNode data, Class<T> type) {
        return Payloads.read(objectMapper, data, type);
    }
}
