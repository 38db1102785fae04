package com.example.proctorstream.service;

import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.SessionStatus;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session start and end as seen by the rooms: each change of the registry record is followed
 * by the matching lifecycle event.
 */
@Service
public class SessionLifecycleService {

    private final SessionRegistry registry;
    private final BroadcastRouter router;

    public SessionLifecycleService(SessionRegistry registry, BroadcastRouter router) {
        this.registry = registry;
        this.router = router;
    }

    public MonitoringSession create(String ownerId, String examId) {
        return registry.create(ownerId, examId);
    }

    /**
     * Owner joined: a pending session becomes active, anything else keeps its status.
     */
    public MonitoringSession ownerJoined(String sessionId, String connectionId) {
        if (registry.get(sessionId).getStatus() == SessionStatus.PENDING) {
            registry.transition(sessionId, SessionStatus.ACTIVE, null);
        }
        MonitoringSession session = registry.touch(sessionId);
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("connectionId", connectionId);
        router.lifecycle(ServerEvent.STUDENT_JOINED, session, extra, false);
        return session;
    }

    public void ownerLeft(MonitoringSession session, String connectionId) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("connectionId", connectionId);
        router.lifecycle(ServerEvent.STUDENT_LEFT, session, extra, false);
    }

    public MonitoringSession end(String sessionId, String reason) {
        SessionRegistry.StatusChange change = registry.transition(sessionId, SessionStatus.ENDED,
                reason != null ? reason : "completed");
        if (change.isChanged()) {
            router.lifecycle(ServerEvent.SESSION_ENDED, change.getSession(),
                    Map.of("reason", change.getSession().getCloseReason()), true);
        }
        return change.getSession();
    }
}
