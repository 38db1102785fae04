package com.example.proctorstream.service;

import com.example.proctorstream.auth.Role;
import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.RoomKey;
import com.example.proctorstream.broadcast.RoomRegistry;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.SessionStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Observer dashboard: on-demand snapshots, per-connection periodic pushes and the
 * statistics broadcast to {@code stats-subscribers}.
 */
@Service
public class DashboardService {

    private static final Logger logger = LoggerFactory.getLogger(DashboardService.class);
    private static final double HIGH_RISK = 0.7;
    private static final int TOP_RISK_LIMIT = 10;

    private final SessionRegistry registry;
    private final RoomRegistry rooms;
    private final BroadcastRouter router;
    private final BatchRiskAggregator aggregator;
    private final Scheduler timerScheduler;
    private final Clock clock;
    private final long defaultIntervalMs;
    private final long minIntervalMs;
    private final Map<String, Disposable> subscriptions = new ConcurrentHashMap<>();

    public DashboardService(SessionRegistry registry,
                            RoomRegistry rooms,
                            BroadcastRouter router,
                            BatchRiskAggregator aggregator,
                            Scheduler timerScheduler,
                            Clock clock,
                            @Value("${app.dashboard.default-interval-ms:10000}") long defaultIntervalMs,
                            @Value("${app.dashboard.min-interval-ms:5000}") long minIntervalMs) {
        this.registry = registry;
        this.rooms = rooms;
        this.router = router;
        this.aggregator = aggregator;
        this.timerScheduler = timerScheduler;
        this.clock = clock;
        this.minIntervalMs = minIntervalMs;
        this.defaultIntervalMs = Math.max(defaultIntervalMs, minIntervalMs);
    }

    public Map<String, Object> snapshot() {
        Collection<MonitoringSession> all = registry.listAll();
        List<MonitoringSession> active = all.stream().filter(s -> !s.isClosed()).collect(Collectors.toList());

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (SessionStatus status : SessionStatus.values()) {
            byStatus.put(status.getWireName(), 0L);
        }
        all.forEach(s -> byStatus.merge(s.getStatus().getWireName(), 1L, Long::sum));

        double averageRisk = active.stream().mapToDouble(MonitoringSession::getRiskScore).average().orElse(0.0);
        List<Map<String, Object>> highRisk = active.stream()
                .filter(s -> s.getRiskScore() >= HIGH_RISK)
                .sorted(Comparator.comparingDouble(MonitoringSession::getRiskScore).reversed())
                .limit(TOP_RISK_LIMIT)
                .map(MonitoringSession::toSummary)
                .collect(Collectors.toList());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("activeSessions", active.size());
        out.put("sessionsByStatus", byStatus);
        out.put("totalViolations", active.stream().mapToInt(MonitoringSession::getViolationCount).sum());
        out.put("averageRiskScore", averageRisk);
        out.put("highRiskSessions", highRisk);
        out.put("timestamp", clock.instant());
        return out;
    }

    public Map<String, Object> statistics() {
        Map<Role, Long> connections = rooms.countByRole();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("connectedStudents", connections.getOrDefault(Role.STUDENT, 0L));
        out.put("connectedObservers", connections.getOrDefault(Role.OBSERVER, 0L));
        out.put("rooms", rooms.roomCount());
        out.put("trackedSessions", registry.size());
        out.put("activeSessions", registry.listActive().size());
        out.put("pendingAggregation", aggregator.pendingCount());
        out.put("timestamp", clock.instant());
        return out;
    }

    /**
     * Starts pushing {@code dashboard-data} to the connection, first push immediately.
     * A new subscription replaces the previous one.
     *
     * @return the effective interval after clamping
     */
    public long subscribe(String connectionId, Long requestedIntervalMs) {
        long interval = requestedIntervalMs == null ? defaultIntervalMs : Math.max(requestedIntervalMs, minIntervalMs);
        Disposable subscription = Flux.interval(Duration.ZERO, Duration.ofMillis(interval), timerScheduler)
                .subscribe(tick -> push(connectionId),
                        error -> logger.warn("Dashboard stream for {} stopped: {}", connectionId, error.getMessage()));
        Disposable previous = subscriptions.put(connectionId, subscription);
        if (previous != null) {
            previous.dispose();
        }
        rooms.join(connectionId, RoomKey.statsSubscribers());
        logger.debug("Dashboard subscription for {} every {} ms", connectionId, interval);
        return interval;
    }

    private void push(String connectionId) {
        try {
            if (!router.toConnection(connectionId, ServerEvent.DASHBOARD_DATA, snapshot())) {
                unsubscribe(connectionId);
            }
        } catch (Exception e) {
            logger.warn("Dashboard push to {} failed: {}", connectionId, e.getMessage());
        }
    }

    public boolean unsubscribe(String connectionId) {
        Disposable subscription = subscriptions.remove(connectionId);
        rooms.leave(connectionId, RoomKey.statsSubscribers());
        if (subscription != null) {
            subscription.dispose();
            return true;
        }
        return false;
    }

    public boolean isSubscribed(String connectionId) {
        return subscriptions.containsKey(connectionId);
    }

    @Scheduled(fixedDelayString = "${app.dashboard.statistics-interval-ms:30000}",
            initialDelayString = "${app.dashboard.statistics-interval-ms:30000}")
    public void publishStatistics() {
        if (rooms.members(RoomKey.statsSubscribers()).isEmpty()) {
            return;
        }
        router.toRoom(RoomKey.statsSubscribers(), ServerEvent.STATISTICS_UPDATE, statistics());
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.values().forEach(Disposable::dispose);
        subscriptions.clear();
    }
}
