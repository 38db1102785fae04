package com.example.proctorstream.mcp;

import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.service.DashboardService;
import com.example.proctorstream.service.DownstreamDispatcher;
import com.example.proctorstream.service.SessionRegistry;
import com.example.proctorstream.store.DownstreamStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only operator tools over the live registry.
 */
@Service
public class MonitoringTools {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringTools.class);

    private final SessionRegistry registry;
    private final DashboardService dashboard;
    private final DownstreamDispatcher dispatcher;
    private final DownstreamStore store;

    public MonitoringTools(SessionRegistry registry,
                           DashboardService dashboard,
                           DownstreamDispatcher dispatcher,
                           DownstreamStore store) {
        this.registry = registry;
        this.dashboard = dashboard;
        this.dispatcher = dispatcher;
        this.store = store;
    }

    @Tool(description = "List sessions that have not ended, oldest first")
    public Map<String, Object> sessions_active() {
        List<Map<String, Object>> sessions = registry.listActive().stream()
                .map(MonitoringSession::toSummary)
                .collect(Collectors.toList());
        return Map.of("sessions", sessions, "count", sessions.size());
    }

    @Tool(description = "Get one session with its violation ledger")
    public Map<String, Object> session_get(String sessionId) {
        return registry.find(sessionId)
                .map(session -> {
                    Map<String, Object> result = new HashMap<>(session.toSummary());
                    result.put("violations", session.getViolations().stream()
                            .map(Violation::toMap)
                            .collect(Collectors.toList()));
                    return result;
                })
                .orElseGet(() -> Map.of("sessionId", String.valueOf(sessionId), "found", false));
    }

    @Tool(description = "Dashboard snapshot and connection statistics")
    public Map<String, Object> statistics_snapshot() {
        return Map.of(
                "dashboard", dashboard.snapshot(),
                "statistics", dashboard.statistics());
    }

    @Tool(description = "Downstream dispatch pool and outbox backlog")
    public Map<String, Object> downstream_status() {
        return dispatcher.getDispatchStats();
    }

    @Tool(description = "Persisted record of a session from the analytics store, including sessions already swept from memory")
    public Map<String, Object> session_history(String sessionId) {
        try {
            Map<String, Object> details = store.sessionDetails(sessionId).block();
            return details != null ? details : Map.of("sessionId", String.valueOf(sessionId), "found", false);
        } catch (Exception e) {
            logger.warn("Downstream session lookup for {} failed: {}", sessionId, e.getMessage());
            return Map.of("sessionId", String.valueOf(sessionId), "error", String.valueOf(e.getMessage()));
        }
    }

    @Tool(description = "Active sessions as the analytics store sees them")
    public Map<String, Object> downstream_sessions_active() {
        try {
            Map<String, Object> result = store.activeSessions().block();
            return result != null ? result : Map.of();
        } catch (Exception e) {
            logger.warn("Downstream active session lookup failed: {}", e.getMessage());
            return Map.of("error", String.valueOf(e.getMessage()));
        }
    }
}
