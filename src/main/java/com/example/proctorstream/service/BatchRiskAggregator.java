package com.example.proctorstream.service;

import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.store.DownstreamCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Periodic risk aggregation.
 * 1. Accepted violations queue up in arrival order.
 * 2. Each tick drains the queue and groups it by session, first arrival first.
 * 3. Per group: ask the store to recalculate, refold the local score, and flag the session
 *    once the critical violations of that group alone reach the threshold.
 */
@Service
public class BatchRiskAggregator {

    private static final Logger logger = LoggerFactory.getLogger(BatchRiskAggregator.class);

    private final Queue<Violation> pending = new ConcurrentLinkedQueue<>();
    private final SessionRegistry registry;
    private final DownstreamDispatcher dispatcher;
    private final BroadcastRouter router;
    private final int flagThreshold;
    private final CriticalCountMode countMode;

    public BatchRiskAggregator(SessionRegistry registry,
                               DownstreamDispatcher dispatcher,
                               BroadcastRouter router,
                               @Value("${app.aggregator.flag-threshold:2}") int flagThreshold,
                               @Value("${app.aggregator.critical-count-mode:derived}") String countMode) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.router = router;
        this.flagThreshold = flagThreshold;
        this.countMode = CriticalCountMode.fromProperty(countMode);
    }

    public void enqueue(Violation violation) {
        pending.add(violation);
    }

    @Scheduled(fixedDelayString = "${app.aggregator.tick-ms:5000}", initialDelayString = "${app.aggregator.tick-ms:5000}")
    public void tick() {
        List<Violation> batch = drain();
        if (batch.isEmpty()) {
            return;
        }

        Map<String, List<Violation>> bySession = new LinkedHashMap<>();
        for (Violation violation : batch) {
            bySession.computeIfAbsent(violation.getSessionId(), k -> new ArrayList<>()).add(violation);
        }
        logger.debug("Aggregating {} violations across {} sessions", batch.size(), bySession.size());

        for (Map.Entry<String, List<Violation>> group : bySession.entrySet()) {
            try {
                process(group.getKey(), group.getValue());
            } catch (Exception e) {
                logger.error("Risk aggregation failed for session {}", group.getKey(), e);
            }
        }
    }

    private List<Violation> drain() {
        List<Violation> batch = new ArrayList<>();
        Violation next;
        while ((next = pending.poll()) != null) {
            batch.add(next);
        }
        return batch;
    }

    private void process(String sessionId, List<Violation> violations) {
        dispatcher.submit(DownstreamCall.builder()
                .kind(DownstreamCall.Kind.RECALCULATE_RISK)
                .targetId(sessionId)
                .build());

        MonitoringSession session = registry.recomputeRisk(sessionId);
        if (session.isClosed()) {
            return;
        }

        // only this window's violations count toward the flag
        long criticalCount = violations.stream().filter(countMode::counts).count();
        if (criticalCount < flagThreshold || session.getFlaggedAt() != null) {
            return;
        }

        Optional<MonitoringSession> flagged = registry.markFlagged(sessionId, "critical-violations");
        if (flagged.isEmpty()) {
            return;
        }
        session = flagged.get();
        logger.warn("Session {} flagged: {} critical violations in one window, risk {}",
                sessionId, criticalCount, session.getRiskScore());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reason", "critical-violations");
        body.put("criticalCount", criticalCount);
        body.put("riskScore", session.getRiskScore());
        dispatcher.submit(DownstreamCall.builder()
                .kind(DownstreamCall.Kind.FLAG_SESSION)
                .targetId(sessionId)
                .body(body)
                .build());
        router.lifecycle(ServerEvent.SESSION_FLAGGED, session,
                Map.of("criticalCount", criticalCount, "newViolations", violations.size()), false);
    }

    public int pendingCount() {
        return pending.size();
    }

    public int getFlagThreshold() { return flagThreshold; }
    public CriticalCountMode getCountMode() { return countMode; }
}
