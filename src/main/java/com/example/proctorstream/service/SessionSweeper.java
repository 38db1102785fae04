package com.example.proctorstream.service;

import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.model.MonitoringSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Ends idle sessions and tells their rooms.
 */
@Component
public class SessionSweeper {

    private static final Logger logger = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionRegistry registry;
    private final BroadcastRouter router;
    private final Clock clock;

    public SessionSweeper(SessionRegistry registry, BroadcastRouter router, Clock clock) {
        this.registry = registry;
        this.router = router;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.registry.sweep-interval-ms:60000}", initialDelay = 60000L)
    public void run() {
        SessionRegistry.SweepResult result = registry.sweep(clock.instant());
        for (MonitoringSession session : result.getExpired()) {
            try {
                router.lifecycle(ServerEvent.SESSION_ENDED_BY_TIMEOUT, session, Map.of("reason", "inactivity-timeout"), true);
            } catch (Exception e) {
                logger.error("Could not announce timeout of session {}", session.getSessionId(), e);
            }
        }
    }
}
