package com.example.proctorstream.service;

import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.LocalRoomBus;
import com.example.proctorstream.broadcast.RoomKey;
import com.example.proctorstream.broadcast.RoomRegistry;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.kv.NoOpSessionCache;
import com.example.proctorstream.model.SessionStatus;
import com.example.proctorstream.model.Violation;
import com.example.proctorstream.model.ViolationType;
import com.example.proctorstream.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private DownstreamDispatcher dispatcher;

    private VirtualTimeScheduler timer;
    private SessionRegistry registry;
    private RoomRegistry rooms;
    private DashboardService dashboard;
    private RecordingConnection observer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        timer = VirtualTimeScheduler.create();
        registry = new SessionRegistry(new NoOpSessionCache(), new RiskScorer(0.4, 0.25, 0.1, 0.05),
                clock, 7_200_000L, 600_000L);
        rooms = new RoomRegistry();
        BroadcastRouter router = new BroadcastRouter(new LocalRoomBus(rooms), rooms, "medium");
        BatchRiskAggregator aggregator = new BatchRiskAggregator(registry, dispatcher, router, 2, "derived");
        dashboard = new DashboardService(registry, rooms, router, aggregator, timer, clock, 10_000L, 5_000L);

        observer = RecordingConnection.observer("c-observer", "teacher-1");
        rooms.register(observer);
    }

    private void addViolations(String sessionId, int count) {
        for (int i = 0; i < count; i++) {
            registry.recordViolation(sessionId, Violation.builder()
                    .id(sessionId + "-" + i)
                    .sessionId(sessionId)
                    .type(ViolationType.MULTIPLE_FACES)
                    .rawType("multiple_faces")
                    .confidence(0.95)
                    .detectedAt(NOW)
                    .build());
        }
        registry.recomputeRisk(sessionId);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSnapshot_CountsAndHighRiskSessions() {
        // Given
        String risky = registry.create("student-1", "exam-1").getSessionId();
        String calm = registry.create("student-2", "exam-1").getSessionId();
        String done = registry.create("student-3", "exam-1").getSessionId();
        addViolations(risky, 2);
        addViolations(calm, 1);
        registry.transition(done, SessionStatus.ENDED, null);

        // When
        Map<String, Object> snapshot = dashboard.snapshot();

        // Then
        assertEquals(2, snapshot.get("activeSessions"));
        assertEquals(3, snapshot.get("totalViolations"));
        Map<String, Long> byStatus = (Map<String, Long>) snapshot.get("sessionsByStatus");
        assertEquals(2L, byStatus.get("pending"));
        assertEquals(1L, byStatus.get("ended"));
        assertEquals(0L, byStatus.get("terminated"));
        List<Map<String, Object>> highRisk = (List<Map<String, Object>>) snapshot.get("highRiskSessions");
        assertEquals(1, highRisk.size());
        assertEquals(risky, highRisk.get(0).get("sessionId"));
    }

    @Test
    void testStatistics_CountsConnectionsByRole() {
        // Given
        rooms.register(RecordingConnection.student("c-student", "student-1"));

        // When
        Map<String, Object> stats = dashboard.statistics();

        // Then
        assertEquals(1L, stats.get("connectedStudents"));
        assertEquals(1L, stats.get("connectedObservers"));
        assertEquals(0, stats.get("pendingAggregation"));
    }

    @Test
    void testSubscribe_ReplacesPreviousSubscription() {
        // Given
        dashboard.subscribe(observer.getId(), 5_000L);

        // When
        long interval = dashboard.subscribe(observer.getId(), 20_000L);
        observer.clear();
        timer.advanceTimeBy(Duration.ofSeconds(20));

        // Then
        assertEquals(20_000L, interval);
        assertEquals(1, observer.received(ServerEvent.DASHBOARD_DATA).size());
    }

    @Test
    void testSubscribe_DefaultInterval() {
        assertEquals(10_000L, dashboard.subscribe(observer.getId(), null));
        assertTrue(dashboard.isSubscribed(observer.getId()));
    }

    @Test
    void testPush_StopsWhenConnectionIsGone() {
        // Given
        dashboard.subscribe(observer.getId(), 5_000L);

        // When
        rooms.unregister(observer.getId());
        timer.advanceTimeBy(Duration.ofSeconds(5));

        // Then
        assertFalse(dashboard.isSubscribed(observer.getId()));
    }

    @Test
    void testPublishStatistics_OnlyWithSubscribers() {
        // When
        dashboard.publishStatistics();

        // Then
        assertTrue(observer.received().isEmpty());

        // When
        rooms.join(observer.getId(), RoomKey.statsSubscribers());
        dashboard.publishStatistics();

        // Then
        assertEquals(List.of(ServerEvent.STATISTICS_UPDATE), observer.events());
    }
}
