package com.example.proctorstream.broadcast;

import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.Severity;
import com.example.proctorstream.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fan-out rules. Decides which rooms an event goes to; the {@link RoomBus} does the delivery.
 *
 * <ul>
 *   <li>violation alert: the session room always; observer-global and the exam room from
 *       {@code app.broadcast.observer-alert-min-severity} up; critical adds a second,
 *       urgent emission to the observer rooms</li>
 *   <li>lifecycle events: observer-global, the exam room and the session room</li>
 * </ul>
 */
@Service
public class BroadcastRouter {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastRouter.class);

    private final RoomBus bus;
    private final RoomRegistry rooms;
    private final Severity observerAlertMinSeverity;

    public BroadcastRouter(RoomBus bus,
                           RoomRegistry rooms,
                           @Value("${app.broadcast.observer-alert-min-severity:medium}") String observerAlertMinSeverity) {
        this.bus = bus;
        this.rooms = rooms;
        this.observerAlertMinSeverity = Severity.fromWire(observerAlertMinSeverity);
    }

    public void violationAlert(MonitoringSession session, Violation violation) {
        Severity severity = violation.severity();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", session.getSessionId());
        data.put("ownerId", session.getOwnerId());
        data.put("examId", session.getExamId());
        data.put("severity", severity.getWireName());
        data.put("message", violation.getType().getStudentMessage());
        data.put("violation", violation.toMap());

        List<RoomKey> targets = new ArrayList<>();
        targets.add(RoomKey.session(session.getSessionId()));
        if (severity.isAtLeast(observerAlertMinSeverity)) {
            targets.addAll(observerRooms(session.getExamId()));
        }
        publish(targets, Audience.EVERYONE, null, ServerEvent.VIOLATION_ALERT, data, List.of());

        if (severity.isAtLeast(Severity.HIGH)) {
            Map<String, Object> popup = new LinkedHashMap<>();
            popup.put("title", "Proctoring Violation Detected");
            popup.put("message", violation.getType().getStudentMessage());
            popup.put("type", violation.getRawType());
            popup.put("detectedAt", violation.getDetectedAt());
            toOwner(session.getSessionId(), ServerEvent.WARNING_POPUP, popup);
        }
        if (severity == Severity.CRITICAL) {
            publish(observerRooms(session.getExamId()), Audience.EVERYONE, null,
                    ServerEvent.CRITICAL_VIOLATION, data, List.of());
        }
        logger.debug("Violation alert {} ({}) for session {} sent to {}",
                violation.getRawType(), severity.getWireName(), session.getSessionId(), targets);
    }

    /**
     * Lifecycle event to the observers and the session room. With {@code closeSessionRoom} the
     * session room is emptied after delivery.
     */
    public void lifecycle(ServerEvent event, MonitoringSession session, Map<String, Object> extra, boolean closeSessionRoom) {
        Map<String, Object> data = new LinkedHashMap<>(session.toSummary());
        if (extra != null) data.putAll(extra);

        List<RoomKey> targets = new ArrayList<>(observerRooms(session.getExamId()));
        targets.add(RoomKey.session(session.getSessionId()));
        List<RoomKey> dissolve = closeSessionRoom ? List.of(RoomKey.session(session.getSessionId())) : List.of();
        publish(targets, Audience.EVERYONE, null, event, data, dissolve);
        logger.info("Lifecycle {} for session {}", event.getWireName(), session.getSessionId());
    }

    public void toOwner(String sessionId, ServerEvent event, Map<String, Object> data) {
        publish(List.of(RoomKey.session(sessionId)), Audience.STUDENTS, null, event, data, List.of());
    }

    public void toSessionRoom(String sessionId, ServerEvent event, Map<String, Object> data) {
        publish(List.of(RoomKey.session(sessionId)), Audience.EVERYONE, null, event, data, List.of());
    }

    /**
     * Observer-global plus the exam room, optionally skipping the connection that caused the event.
     */
    public void toObservers(String examId, ServerEvent event, Map<String, Object> data, String excludeConnectionId) {
        publish(observerRooms(examId), Audience.EVERYONE, excludeConnectionId, event, data, List.of());
    }

    public void toRoom(RoomKey room, ServerEvent event, Map<String, Object> data) {
        publish(List.of(room), Audience.EVERYONE, null, event, data, List.of());
    }

    /**
     * Direct send to one connection on this instance.
     *
     * @return false when the connection is gone
     */
    public boolean toConnection(String connectionId, ServerEvent event, Map<String, Object> data) {
        return rooms.connection(connectionId)
                .map(handle -> {
                    handle.send(ServerMessage.of(event, data));
                    return true;
                })
                .orElse(false);
    }

    private static List<RoomKey> observerRooms(String examId) {
        List<RoomKey> targets = new ArrayList<>();
        targets.add(RoomKey.observerGlobal());
        if (examId != null && !examId.isBlank()) {
            targets.add(RoomKey.observerExam(examId));
        }
        return targets;
    }

    private void publish(List<RoomKey> targets, Audience audience, String exclude,
                         ServerEvent event, Map<String, Object> data, List<RoomKey> dissolveAfter) {
        bus.publish(RoomEnvelope.builder()
                .rooms(List.copyOf(targets))
                .audience(audience)
                .excludeConnectionId(exclude)
                .event(event)
                .data(data)
                .timestamp(Instant.now())
                .dissolveAfter(dissolveAfter)
                .build());
    }
}
