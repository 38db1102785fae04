package com.example.proctorstream.service;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.auth.Permission;
import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.model.Intervention;
import com.example.proctorstream.model.InterventionKind;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.SessionStatus;
import com.example.proctorstream.store.DownstreamCall;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observer actions against running sessions. Each public operation checks the caller's
 * permission first; a caller without it gets {@code insufficient-permission} and nothing happens.
 * Downstream logging of an intervention is best effort and never delays the acknowledgement.
 */
@Service
public class InterventionService {

    private static final Logger logger = LoggerFactory.getLogger(InterventionService.class);

    private final SessionRegistry registry;
    private final BroadcastRouter router;
    private final DownstreamDispatcher dispatcher;
    private final Scheduler timerScheduler;
    private final Clock clock;
    private final Duration screenshotTimeout;
    private final Map<String, PendingScreenshot> pendingScreenshots = new ConcurrentHashMap<>();

    public InterventionService(SessionRegistry registry,
                               BroadcastRouter router,
                               DownstreamDispatcher dispatcher,
                               Scheduler timerScheduler,
                               Clock clock,
                               @Value("${app.intervention.screenshot-timeout-ms:30000}") long screenshotTimeoutMs) {
        this.registry = registry;
        this.router = router;
        this.dispatcher = dispatcher;
        this.timerScheduler = timerScheduler;
        this.clock = clock;
        this.screenshotTimeout = Duration.ofMillis(screenshotTimeoutMs);
    }

    public Map<String, Object> sendMessage(ConnectionPrincipal observer, String sessionId, String message, String priority) {
        observer.requirePermission(Permission.INTERVENE);
        return deliverMessage(observer, sessionId, message, priority);
    }

    private Map<String, Object> deliverMessage(ConnectionPrincipal observer, String sessionId, String message, String priority) {
        if (message == null || message.isBlank()) {
            throw ProctorException.invalidInput("message is required");
        }
        MonitoringSession session = openSession(sessionId);
        Intervention intervention = newIntervention(observer, session, InterventionKind.MESSAGE,
                Map.of("message", message, "priority", priority != null ? priority : "normal"));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("interventionId", intervention.getId());
        data.put("sessionId", sessionId);
        data.put("type", "message");
        data.put("message", message);
        data.put("priority", intervention.getPayload().get("priority"));
        data.put("from", observer.getUserId());
        data.put("timestamp", intervention.getCreatedAt());
        router.toSessionRoom(sessionId, ServerEvent.INTERVENTION, data);
        logIntervention(intervention);
        return ack(intervention, "sent");
    }

    public Map<String, Object> pause(ConnectionPrincipal observer, String sessionId, String reason) {
        observer.requirePermission(Permission.INTERVENE);
        return doPause(observer, sessionId, reason);
    }

    private Map<String, Object> doPause(ConnectionPrincipal observer, String sessionId, String reason) {
        SessionRegistry.StatusChange change = registry.transition(sessionId, SessionStatus.PAUSED, reason);
        Intervention intervention = newIntervention(observer, change.getSession(), InterventionKind.PAUSE,
                reason != null ? Map.of("reason", reason) : Map.of());
        if (change.isChanged()) {
            router.lifecycle(ServerEvent.SESSION_PAUSED, change.getSession(), actor(observer, reason), false);
            logIntervention(intervention);
        }
        return ack(intervention, change.getSession().getStatus().getWireName());
    }

    public Map<String, Object> resume(ConnectionPrincipal observer, String sessionId) {
        observer.requirePermission(Permission.INTERVENE);
        return doResume(observer, sessionId);
    }

    private Map<String, Object> doResume(ConnectionPrincipal observer, String sessionId) {
        SessionRegistry.StatusChange change = registry.resume(sessionId);
        Intervention intervention = newIntervention(observer, change.getSession(), InterventionKind.RESUME, Map.of());
        if (change.isChanged()) {
            router.lifecycle(ServerEvent.SESSION_RESUMED, change.getSession(), actor(observer, null), false);
            logIntervention(intervention);
        }
        return ack(intervention, change.getSession().getStatus().getWireName());
    }

    public Map<String, Object> terminate(ConnectionPrincipal observer, String sessionId, String reason) {
        observer.requirePermission(Permission.TERMINATE);
        return doTerminate(observer, sessionId, reason);
    }

    private Map<String, Object> doTerminate(ConnectionPrincipal observer, String sessionId, String reason) {
        String why = reason != null && !reason.isBlank() ? reason : "Terminated by proctor";
        SessionRegistry.StatusChange change = registry.transition(sessionId, SessionStatus.TERMINATED, why);
        Intervention intervention = newIntervention(observer, change.getSession(), InterventionKind.TERMINATE,
                Map.of("reason", why));
        if (change.isChanged()) {
            Map<String, Object> extra = actor(observer, why);
            extra.put("terminatedBy", observer.getUserId());
            router.lifecycle(ServerEvent.SESSION_TERMINATED, change.getSession(), extra, true);
            dispatcher.submit(DownstreamCall.builder()
                    .kind(DownstreamCall.Kind.TERMINATE_SESSION)
                    .targetId(sessionId)
                    .body(Map.of("reason", why, "terminatedBy", observer.getUserId()))
                    .build());
            logIntervention(intervention);
        }
        return ack(intervention, SessionStatus.TERMINATED.getWireName());
    }

    /**
     * Ends the session normally on an observer's behalf, as opposed to {@link #terminate}.
     */
    public Map<String, Object> end(ConnectionPrincipal observer, String sessionId, String reason) {
        observer.requirePermission(Permission.TERMINATE);
        String why = reason != null && !reason.isBlank() ? reason : "Ended by proctor";
        SessionRegistry.StatusChange change = registry.transition(sessionId, SessionStatus.ENDED, why);
        Intervention intervention = newIntervention(observer, change.getSession(), InterventionKind.END,
                Map.of("reason", why));
        if (change.isChanged()) {
            Map<String, Object> extra = actor(observer, why);
            extra.put("endedBy", observer.getUserId());
            router.lifecycle(ServerEvent.SESSION_ENDED, change.getSession(), extra, true);
            logIntervention(intervention);
        }
        return ack(intervention, change.getSession().getStatus().getWireName());
    }

    /**
     * Flags the session for review. Flagging a paused session leaves it paused.
     */
    public Map<String, Object> flag(ConnectionPrincipal observer, String sessionId, String reason) {
        observer.requirePermission(Permission.INTERVENE);
        return doFlag(observer, sessionId, reason);
    }

    private Map<String, Object> doFlag(ConnectionPrincipal observer, String sessionId, String reason) {
        String why = reason != null && !reason.isBlank() ? reason : "Flagged by proctor";
        Optional<MonitoringSession> flagged = registry.markFlagged(sessionId, why);
        MonitoringSession session = flagged.orElseGet(() -> registry.get(sessionId));
        Intervention intervention = newIntervention(observer, session, InterventionKind.FLAG, Map.of("reason", why));
        if (flagged.isPresent()) {
            dispatcher.submit(DownstreamCall.builder()
                    .kind(DownstreamCall.Kind.FLAG_SESSION)
                    .targetId(sessionId)
                    .body(Map.of("reason", why, "flaggedBy", observer.getUserId()))
                    .build());
            router.lifecycle(ServerEvent.SESSION_FLAGGED, session, actor(observer, why), false);
            logIntervention(intervention);
        }
        Map<String, Object> result = ack(intervention, session.getStatus().getWireName());
        result.put("flaggedAt", session.getFlaggedAt());
        return result;
    }

    /**
     * Asks the owner's client for a screenshot. If no response arrives within the timeout, the
     * requesting connection gets exactly one {@code screenshot-timeout}.
     */
    public Map<String, Object> requestScreenshot(ConnectionPrincipal observer, String requesterConnectionId,
                                                 String sessionId, String reason) {
        observer.requirePermission(Permission.SCREENSHOT);
        MonitoringSession session = openSession(sessionId);
        Intervention intervention = newIntervention(observer, session, InterventionKind.SCREENSHOT_REQUEST,
                reason != null ? Map.of("reason", reason) : Map.of());
        String requestId = intervention.getId();

        PendingScreenshot pending = PendingScreenshot.builder()
                .requestId(requestId)
                .sessionId(sessionId)
                .requesterConnectionId(requesterConnectionId)
                .observerId(observer.getUserId())
                .build();
        // registered before the timer starts, so an immediate expiry still finds it
        pendingScreenshots.put(requestId, pending);
        pending.timer.replace(Mono.delay(screenshotTimeout, timerScheduler)
                .subscribe(tick -> expireScreenshot(requestId)));

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("requestId", requestId);
        request.put("sessionId", sessionId);
        request.put("reason", reason != null ? reason : "Proctor verification");
        request.put("requestedBy", observer.getUserId());
        router.toOwner(sessionId, ServerEvent.SCREENSHOT_REQUESTED, request);
        logIntervention(intervention);

        Map<String, Object> ack = ack(intervention, "requested");
        ack.put("requestId", requestId);
        ack.put("timeoutMs", screenshotTimeout.toMillis());
        return ack;
    }

    private void expireScreenshot(String requestId) {
        PendingScreenshot pending = pendingScreenshots.remove(requestId);
        if (pending == null) {
            return;
        }
        logger.info("Screenshot request {} for session {} timed out", requestId, pending.sessionId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requestId", requestId);
        data.put("sessionId", pending.sessionId);
        data.put("timeoutMs", screenshotTimeout.toMillis());
        router.toConnection(pending.requesterConnectionId, ServerEvent.SCREENSHOT_TIMEOUT, data);
    }

    /**
     * Forwards a screenshot to whoever asked for it.
     *
     * @return false when the request is unknown or already timed out
     */
    public boolean screenshotResponse(ConnectionPrincipal student, String requestId, Map<String, Object> screenshot) {
        if (requestId == null || requestId.isBlank()) {
            throw ProctorException.invalidInput("requestId is required");
        }
        PendingScreenshot pending = pendingScreenshots.get(requestId);
        if (pending == null) {
            logger.debug("Late or unknown screenshot response {}", requestId);
            return false;
        }
        MonitoringSession session = registry.get(pending.sessionId);
        if (!session.getOwnerId().equals(student.getUserId())) {
            throw new ProctorException(ErrorCode.INSUFFICIENT_PERMISSION,
                    "Screenshot request " + requestId + " is not addressed to this user");
        }
        if (!pendingScreenshots.remove(requestId, pending)) {
            return false;
        }
        pending.timer.dispose();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requestId", requestId);
        data.put("sessionId", pending.sessionId);
        data.put("ownerId", student.getUserId());
        data.put("screenshot", screenshot != null ? screenshot : Map.of());
        data.put("capturedAt", clock.instant());
        boolean delivered = router.toConnection(pending.requesterConnectionId, ServerEvent.SCREENSHOT_CAPTURED, data);
        if (!delivered) {
            logger.info("Requester of screenshot {} disconnected before it arrived", requestId);
        }
        return true;
    }

    /**
     * Drops the timers of requests made by a connection that went away.
     */
    public void cancelScreenshotsFor(String requesterConnectionId) {
        pendingScreenshots.values().removeIf(pending -> {
            if (pending.requesterConnectionId.equals(requesterConnectionId)) {
                pending.timer.dispose();
                return true;
            }
            return false;
        });
    }

    int pendingScreenshotCount() {
        return pendingScreenshots.size();
    }

    public enum BulkAction {
        SEND_MESSAGE, TERMINATE, FLAG, PAUSE, RESUME;

        public String getWireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static BulkAction fromWire(String value) {
            if (value == null) {
                throw ProctorException.invalidInput("action is required");
            }
            try {
                return BulkAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw ProctorException.invalidInput("Unknown bulk action: " + value);
            }
        }
    }

    /**
     * Applies one action to each session in order. A failing item is reported in its slot and
     * does not stop the rest.
     */
    public List<BulkItemResult> bulkAction(ConnectionPrincipal observer, String action,
                                           List<String> sessionIds, Map<String, Object> params) {
        observer.requirePermission(Permission.BULK);
        BulkAction bulkAction = BulkAction.fromWire(action);
        if (sessionIds == null || sessionIds.isEmpty()) {
            throw ProctorException.invalidInput("sessionIds must not be empty");
        }
        Map<String, Object> options = params != null ? params : Map.of();
        String message = options.get("message") != null ? String.valueOf(options.get("message")) : null;
        String reason = options.get("reason") != null ? String.valueOf(options.get("reason")) : null;

        List<BulkItemResult> results = new ArrayList<>(sessionIds.size());
        for (String sessionId : sessionIds) {
            try {
                Map<String, Object> result;
                switch (bulkAction) {
                    case SEND_MESSAGE:
                        result = deliverMessage(observer, sessionId, message, "high");
                        break;
                    case TERMINATE:
                        result = doTerminate(observer, sessionId, reason != null ? reason : "Bulk termination");
                        break;
                    case FLAG:
                        result = doFlag(observer, sessionId, reason != null ? reason : "Bulk flag");
                        break;
                    case PAUSE:
                        result = doPause(observer, sessionId, reason);
                        break;
                    case RESUME:
                        result = doResume(observer, sessionId);
                        break;
                    default:
                        throw ProctorException.invalidInput("Unsupported bulk action: " + action);
                }
                results.add(BulkItemResult.success(sessionId, result));
            } catch (ProctorException e) {
                results.add(BulkItemResult.failure(sessionId, e.toMap()));
            } catch (Exception e) {
                logger.error("Bulk {} failed for session {}", bulkAction.getWireName(), sessionId, e);
                results.add(BulkItemResult.failure(sessionId, Map.of("code", ErrorCode.INTERNAL.getWireName(), "message", String.valueOf(e.getMessage()))));
            }
        }
        logger.info("Bulk {} by {} over {} sessions", bulkAction.getWireName(), observer.getUserId(), sessionIds.size());
        return results;
    }

    @lombok.Value
    public static class BulkItemResult {
        String sessionId;
        String status;
        Map<String, Object> result;
        Map<String, Object> error;

        static BulkItemResult success(String sessionId, Map<String, Object> result) {
            return new BulkItemResult(sessionId, "success", result, null);
        }

        static BulkItemResult failure(String sessionId, Map<String, Object> error) {
            return new BulkItemResult(sessionId, "error", null, error);
        }

        public boolean isSuccess() {
            return "success".equals(status);
        }

        public Map<String, Object> toMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("sessionId", sessionId);
            out.put("status", status);
            if (result != null) out.put("result", result);
            if (error != null) out.put("error", error);
            return out;
        }
    }

    public Map<String, Object> updateSettings(ConnectionPrincipal observer, String connectionId,
                                              String quizId, Map<String, Object> settings) {
        observer.requirePermission(Permission.MANAGE_SETTINGS);
        if (quizId == null || quizId.isBlank()) {
            throw ProctorException.invalidInput("quizId is required");
        }
        if (settings == null || settings.isEmpty()) {
            throw ProctorException.invalidInput("settings must not be empty");
        }
        dispatcher.submit(DownstreamCall.builder()
                .kind(DownstreamCall.Kind.UPDATE_SETTINGS)
                .targetId(quizId)
                .body(settings)
                .build());

        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("quizId", quizId);
        notice.put("settings", settings);
        notice.put("updatedBy", observer.getUserId());
        router.toObservers(null, ServerEvent.SETTINGS_UPDATED, notice, connectionId);
        logger.info("Settings of quiz {} updated by {}", quizId, observer.getUserId());

        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("quizId", quizId);
        ack.put("status", "updated");
        return ack;
    }

    private MonitoringSession openSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw ProctorException.invalidInput("sessionId is required");
        }
        MonitoringSession session = registry.get(sessionId);
        if (session.isClosed()) {
            throw ProctorException.sessionClosed(sessionId);
        }
        return session;
    }

    private Intervention newIntervention(ConnectionPrincipal observer, MonitoringSession session,
                                         InterventionKind kind, Map<String, Object> payload) {
        return Intervention.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getSessionId())
                .observerId(observer.getUserId())
                .kind(kind)
                .payload(payload)
                .createdAt(clock.instant())
                .build();
    }

    private void logIntervention(Intervention intervention) {
        dispatcher.submit(DownstreamCall.builder()
                .kind(DownstreamCall.Kind.LOG_INTERVENTION)
                .body(intervention.toMap())
                .build());
    }

    private static Map<String, Object> actor(ConnectionPrincipal observer, String reason) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("by", observer.getUserId());
        if (reason != null) extra.put("reason", reason);
        return extra;
    }

    private static Map<String, Object> ack(Intervention intervention, String status) {
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("interventionId", intervention.getId());
        ack.put("sessionId", intervention.getSessionId());
        ack.put("kind", intervention.getKind().getWireName());
        ack.put("status", status);
        ack.put("timestamp", intervention.getCreatedAt());
        return ack;
    }

    @Builder
    private static class PendingScreenshot {
        private final String requestId;
        private final String sessionId;
        private final String requesterConnectionId;
        private final String observerId;
        private final Disposable.Swap timer = Disposables.swap();
    }
}
