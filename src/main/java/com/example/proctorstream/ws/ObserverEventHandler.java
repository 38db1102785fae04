package com.example.proctorstream.ws;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.auth.Permission;
import com.example.proctorstream.auth.Role;
import com.example.proctorstream.broadcast.RoomKey;
import com.example.proctorstream.broadcast.RoomRegistry;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.broadcast.ServerMessage;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.model.InterventionKind;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.service.DashboardService;
import com.example.proctorstream.service.InterventionService;
import com.example.proctorstream.service.SessionRegistry;
import com.example.proctorstream.ws.dto.BulkActionRequest;
import com.example.proctorstream.ws.dto.DashboardSubscriptionRequest;
import com.example.proctorstream.ws.dto.InterventionRequest;
import com.example.proctorstream.ws.dto.SessionRef;
import com.example.proctorstream.ws.dto.SettingsUpdateRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Handles events from observer connections.
 */
@Component
public class ObserverEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(ObserverEventHandler.class);
    private static final int RECENT_VIOLATIONS = 10;

    private final SessionRegistry registry;
    private final InterventionService interventions;
    private final DashboardService dashboard;
    private final RoomRegistry rooms;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ObserverEventHandler(SessionRegistry registry,
                                InterventionService interventions,
                                DashboardService dashboard,
                                RoomRegistry rooms,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.registry = registry;
        this.interventions = interventions;
        this.dashboard = dashboard;
        this.rooms = rooms;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Puts a fresh observer in observer-global and sends it the active sessions.
     */
    public void onConnect(WebSocketConnection connection) {
        rooms.join(connection.getId(), RoomKey.observerGlobal());
        List<Map<String, Object>> active = registry.listActive().stream()
                .map(MonitoringSession::toSummary)
                .collect(Collectors.toList());
        connection.send(ServerMessage.of(ServerEvent.ACTIVE_SESSIONS, Map.of("sessions", active)));
    }

    public void handle(WebSocketConnection connection, ObserverEvent event, JsonNode data) {
        ConnectionPrincipal observer = connection.getPrincipal();
        switch (event) {
            case MONITOR_SESSION:
                monitorSession(connection, read(data, SessionRef.class));
                break;
            case STOP_MONITORING:
                stopMonitoring(connection, read(data, SessionRef.class));
                break;
            case WATCH_EXAM:
                watchExam(connection, read(data, SessionRef.class));
                break;
            case SEND_INTERVENTION:
                connection.send(ServerMessage.of(ServerEvent.INTERVENTION_SENT,
                        intervene(observer, read(data, InterventionRequest.class))));
                break;
            case TERMINATE_SESSION: {
                SessionRef request = read(data, SessionRef.class);
                connection.send(ServerMessage.of(ServerEvent.SESSION_TERMINATED_SUCCESS,
                        interventions.terminate(observer, request.getSessionId(), request.getReason())));
                break;
            }
            case END_SESSION: {
                SessionRef request = read(data, SessionRef.class);
                connection.send(ServerMessage.of(ServerEvent.SESSION_ENDED_SUCCESS,
                        interventions.end(observer, requireSessionId(request), request.getReason())));
                break;
            }
            case FLAG_SESSION: {
                SessionRef request = read(data, SessionRef.class);
                connection.send(ServerMessage.of(ServerEvent.SESSION_FLAGGED_SUCCESS,
                        interventions.flag(observer, requireSessionId(request), request.getReason())));
                break;
            }
            case REQUEST_SCREENSHOT: {
                SessionRef request = read(data, SessionRef.class);
                connection.send(ServerMessage.of(ServerEvent.SCREENSHOT_REQUEST_SENT,
                        interventions.requestScreenshot(observer, connection.getId(),
                                request.getSessionId(), request.getReason())));
                break;
            }
            case BULK_ACTION:
                bulkAction(connection, read(data, BulkActionRequest.class));
                break;
            case SUBSCRIBE_DASHBOARD: {
                observer.requirePermission(Permission.MONITOR);
                DashboardSubscriptionRequest request = read(data, DashboardSubscriptionRequest.class);
                long interval = dashboard.subscribe(connection.getId(), request.getIntervalMs());
                connection.send(ServerMessage.of(ServerEvent.DASHBOARD_SUBSCRIBED, Map.of("intervalMs", interval)));
                break;
            }
            case UNSUBSCRIBE_DASHBOARD:
                dashboard.unsubscribe(connection.getId());
                connection.send(ServerMessage.of(ServerEvent.DASHBOARD_UNSUBSCRIBED, Map.of()));
                break;
            case UPDATE_SETTINGS: {
                SettingsUpdateRequest request = read(data, SettingsUpdateRequest.class);
                connection.send(ServerMessage.of(ServerEvent.SETTINGS_UPDATED_SUCCESS,
                        interventions.updateSettings(observer, connection.getId(), request.getQuizId(), request.getSettings())));
                break;
            }
            case GET_SESSION_DETAILS:
                sessionDetails(connection, read(data, SessionRef.class));
                break;
            case PING:
                connection.send(ServerMessage.of(ServerEvent.PONG, Map.of("timestamp", clock.instant())));
                break;
        }
    }

    private void monitorSession(WebSocketConnection connection, SessionRef request) {
        connection.getPrincipal().requirePermission(Permission.MONITOR);
        MonitoringSession session = registry.get(requireSessionId(request));
        rooms.join(connection.getId(), RoomKey.session(session.getSessionId()));
        session = registry.setMonitored(session.getSessionId(), true);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", session.getSessionId());
        data.put("session", session.toSummary());
        data.put("recentViolations", recentViolations(session));
        connection.send(ServerMessage.of(ServerEvent.MONITORING_STARTED, data));
        logger.info("Observer {} monitoring session {}", connection.getPrincipal().getUserId(), session.getSessionId());
    }

    private void stopMonitoring(WebSocketConnection connection, SessionRef request) {
        String sessionId = requireSessionId(request);
        RoomKey room = RoomKey.session(sessionId);
        rooms.leave(connection.getId(), room);
        boolean watched = rooms.members(room).stream()
                .anyMatch(handle -> handle.getPrincipal().getRole() == Role.OBSERVER);
        if (!watched) {
            registry.find(sessionId).ifPresent(session -> registry.setMonitored(sessionId, false));
        }
        connection.send(ServerMessage.of(ServerEvent.MONITORING_STOPPED, Map.of("sessionId", sessionId)));
    }

    private void watchExam(WebSocketConnection connection, SessionRef request) {
        connection.getPrincipal().requirePermission(Permission.MONITOR);
        String examId = request.getExamId();
        if (examId == null || examId.isBlank()) {
            throw ProctorException.invalidInput("examId is required");
        }
        rooms.join(connection.getId(), RoomKey.observerExam(examId));
        List<Map<String, Object>> sessions = registry.listActive().stream()
                .filter(s -> examId.equals(s.getExamId()))
                .map(MonitoringSession::toSummary)
                .collect(Collectors.toList());
        connection.send(ServerMessage.of(ServerEvent.EXAM_WATCH_STARTED, Map.of("examId", examId, "sessions", sessions)));
    }

    private Map<String, Object> intervene(ConnectionPrincipal observer, InterventionRequest request) {
        InterventionKind kind = InterventionKind.fromWire(request.getType() != null ? request.getType() : "message");
        if (kind == null) {
            throw ProctorException.invalidInput("Unknown intervention type: " + request.getType());
        }
        switch (kind) {
            case MESSAGE:
                return interventions.sendMessage(observer, request.getSessionId(), request.getMessage(), request.getPriority());
            case PAUSE:
                return interventions.pause(observer, request.getSessionId(), request.getReason());
            case RESUME:
                return interventions.resume(observer, request.getSessionId());
            default:
                throw ProctorException.invalidInput("Intervention type " + kind.getWireName() + " has its own event");
        }
    }

    private void bulkAction(WebSocketConnection connection, BulkActionRequest request) {
        List<InterventionService.BulkItemResult> results = interventions.bulkAction(
                connection.getPrincipal(), request.getAction(), request.getSessionIds(), request.getParams());
        long succeeded = results.stream().filter(InterventionService.BulkItemResult::isSuccess).count();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", request.getAction());
        data.put("total", results.size());
        data.put("succeeded", succeeded);
        data.put("failed", results.size() - succeeded);
        data.put("results", results.stream().map(InterventionService.BulkItemResult::toMap).collect(Collectors.toList()));
        connection.send(ServerMessage.of(ServerEvent.BULK_ACTION_COMPLETED, data));
    }

    private void sessionDetails(WebSocketConnection connection, SessionRef request) {
        connection.getPrincipal().requirePermission(Permission.MONITOR);
        MonitoringSession session = registry.get(requireSessionId(request));

        Map<String, Object> data = new LinkedHashMap<>(session.toSummary());
        data.put("clientStatus", session.getClientStatus());
        data.put("violations", session.getViolations().stream().map(Violation::toMap).collect(Collectors.toList()));
        connection.send(ServerMessage.of(ServerEvent.SESSION_DETAILS, data));
    }

    /**
     * Observer went away: its dashboard stream and pending screenshot timers go with it.
     */
    public void onDisconnect(WebSocketConnection connection) {
        dashboard.unsubscribe(connection.getId());
        interventions.cancelScreenshotsFor(connection.getId());
    }

    private static List<Map<String, Object>> recentViolations(MonitoringSession session) {
        List<Violation> ledger = session.getViolations();
        return ledger.subList(Math.max(0, ledger.size() - RECENT_VIOLATIONS), ledger.size()).stream()
                .map(Violation::toMap)
                .collect(Collectors.toList());
    }

    private static String requireSessionId(SessionRef request) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw ProctorException.invalidInput("sessionId is required");
        }
        return request.getSessionId();
    }

    private <T> T read(JsonNode data, Class<T> type) {
        return Payloads.read(objectMapper, data, type);
    }
}
