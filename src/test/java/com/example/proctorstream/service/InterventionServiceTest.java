package com.example.proctorstream.service;

import com.example.proctorstream.auth.ConnectionPrincipal;
import com.example.proctorstream.auth.Permission;
import com.example.proctorstream.broadcast.BroadcastRouter;
import com.example.proctorstream.broadcast.LocalRoomBus;
import com.example.proctorstream.broadcast.RoomKey;
import com.example.proctorstream.broadcast.RoomRegistry;
import com.example.proctorstream.broadcast.ServerEvent;
import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.kv.NoOpSessionCache;
import com.example.proctorstream.model.SessionStatus;
import com.example.proctorstream.store.DownstreamCall;
import com.example.proctorstream.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InterventionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private DownstreamDispatcher dispatcher;

    private VirtualTimeScheduler timer;
    private SessionRegistry registry;
    private RoomRegistry rooms;
    private InterventionService service;

    private RecordingConnection student;
    private RecordingConnection observer;
    private String sessionId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        timer = VirtualTimeScheduler.create();
        registry = new SessionRegistry(new NoOpSessionCache(), new RiskScorer(0.4, 0.25, 0.1, 0.05),
                clock, 7_200_000L, 600_000L);
        rooms = new RoomRegistry();
        BroadcastRouter router = new BroadcastRouter(new LocalRoomBus(rooms), rooms, "medium");
        service = new InterventionService(registry, router, dispatcher, timer, clock, 30_000L);

        sessionId = registry.create("student-1", "exam-1").getSessionId();
        registry.transition(sessionId, SessionStatus.ACTIVE, null);

        student = RecordingConnection.student("c-student", "student-1");
        observer = RecordingConnection.observer("c-observer", "teacher-1", Permission.values());
        rooms.register(student);
        rooms.register(observer);
        rooms.join(student.getId(), RoomKey.session(sessionId));
        rooms.join(observer.getId(), RoomKey.session(sessionId));
        rooms.join(observer.getId(), RoomKey.observerGlobal());
    }

    private static ConnectionPrincipal observerWith(Permission... permissions) {
        return RecordingConnection.observer("c-x", "teacher-2", permissions).getPrincipal();
    }

    private List<DownstreamCall.Kind> submittedKinds() {
        ArgumentCaptor<DownstreamCall> captor = ArgumentCaptor.forClass(DownstreamCall.class);
        verify(dispatcher, atLeastOnce()).submit(captor.capture());
        return captor.getAllValues().stream().map(DownstreamCall::getKind).collect(Collectors.toList());
    }

    @Test
    void testSendMessage_ReachesSessionRoom() {
        // When
        Map<String, Object> ack = service.sendMessage(observer.getPrincipal(), sessionId, "Eyes on screen", null);

        // Then
        assertEquals("sent", ack.get("status"));
        assertEquals("message", ack.get("kind"));
        assertEquals(List.of(ServerEvent.INTERVENTION), student.events());
        assertEquals("normal", student.received().get(0).getData().get("priority"));
        assertEquals(List.of(DownstreamCall.Kind.LOG_INTERVENTION), submittedKinds());
    }

    @Test
    void testSendMessage_WithoutPermissionChangesNothing() {
        // When
        ProctorException e = assertThrows(ProctorException.class,
                () -> service.sendMessage(observerWith(Permission.MONITOR), sessionId, "hi", null));

        // Then
        assertEquals(ErrorCode.INSUFFICIENT_PERMISSION, e.getCode());
        assertTrue(student.received().isEmpty());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testSendMessage_StudentCannotIntervene() {
        assertEquals(ErrorCode.INSUFFICIENT_PERMISSION, assertThrows(ProctorException.class,
                () -> service.sendMessage(student.getPrincipal(), sessionId, "hi", null)).getCode());
    }

    @Test
    void testPauseAndResume() {
        // When
        Map<String, Object> paused = service.pause(observer.getPrincipal(), sessionId, "identity check");
        Map<String, Object> resumed = service.resume(observer.getPrincipal(), sessionId);

        // Then
        assertEquals("paused", paused.get("status"));
        assertEquals("active", resumed.get("status"));
        assertEquals(List.of(ServerEvent.SESSION_PAUSED, ServerEvent.SESSION_RESUMED), student.events());
        assertEquals(SessionStatus.ACTIVE, registry.get(sessionId).getStatus());
    }

    @Test
    void testTerminate_ClosesSessionAndRoom() {
        // When
        Map<String, Object> ack = service.terminate(observerWith(Permission.TERMINATE), sessionId, "Cheating");

        // Then
        assertEquals("terminated", ack.get("status"));
        assertEquals(SessionStatus.TERMINATED, registry.get(sessionId).getStatus());
        assertEquals("Cheating", registry.get(sessionId).getCloseReason());
        assertEquals(List.of(ServerEvent.SESSION_TERMINATED), student.events());
        assertTrue(rooms.members(RoomKey.session(sessionId)).isEmpty());
        assertEquals(List.of(DownstreamCall.Kind.TERMINATE_SESSION, DownstreamCall.Kind.LOG_INTERVENTION), submittedKinds());
    }

    @Test
    void testTerminate_ThenMessageIsRejected() {
        // Given
        service.terminate(observer.getPrincipal(), sessionId, null);

        // When
        ProctorException e = assertThrows(ProctorException.class,
                () -> service.sendMessage(observer.getPrincipal(), sessionId, "still there?", null));

        // Then
        assertEquals(ErrorCode.SESSION_CLOSED, e.getCode());
    }

    @Test
    void testEnd_EndsSessionNormally() {
        // When
        Map<String, Object> ack = service.end(observerWith(Permission.TERMINATE), sessionId, null);

        // Then
        assertEquals("ended", ack.get("status"));
        assertEquals("end", ack.get("kind"));
        assertEquals(SessionStatus.ENDED, registry.get(sessionId).getStatus());
        assertEquals("Ended by proctor", registry.get(sessionId).getCloseReason());
        assertEquals(List.of(ServerEvent.SESSION_ENDED), student.events());
        assertTrue(rooms.members(RoomKey.session(sessionId)).isEmpty());
        assertEquals(List.of(DownstreamCall.Kind.LOG_INTERVENTION), submittedKinds());
    }

    @Test
    void testEnd_RequiresTerminatePermission() {
        // When
        ProctorException e = assertThrows(ProctorException.class,
                () -> service.end(observerWith(Permission.INTERVENE), sessionId, "done"));

        // Then
        assertEquals(ErrorCode.INSUFFICIENT_PERMISSION, e.getCode());
        assertEquals(SessionStatus.ACTIVE, registry.get(sessionId).getStatus());
    }

    @Test
    void testFlag_FlagsOnceAndAnnounces() {
        // When
        Map<String, Object> first = service.flag(observerWith(Permission.INTERVENE), sessionId, "Looks off-screen");
        Map<String, Object> again = service.flag(observerWith(Permission.INTERVENE), sessionId, "Again");

        // Then
        assertEquals("flagged", first.get("status"));
        assertEquals(NOW, first.get("flaggedAt"));
        assertEquals("flagged", again.get("status"));
        assertEquals(List.of(ServerEvent.SESSION_FLAGGED), student.events());
        assertEquals(List.of(DownstreamCall.Kind.FLAG_SESSION, DownstreamCall.Kind.LOG_INTERVENTION), submittedKinds());
    }

    @Test
    void testFlag_PausedSessionStaysPaused() {
        // Given
        service.pause(observer.getPrincipal(), sessionId, "identity check");

        // When
        Map<String, Object> ack = service.flag(observer.getPrincipal(), sessionId, null);

        // Then
        assertEquals("paused", ack.get("status"));
        assertEquals(SessionStatus.PAUSED, registry.get(sessionId).getStatus());
        assertEquals("flagged", service.resume(observer.getPrincipal(), sessionId).get("status"));
    }

    @Test
    void testRequestScreenshot_ImmediateTimeoutStillNotifies() {
        // Given
        service = new InterventionService(registry, new BroadcastRouter(new LocalRoomBus(rooms), rooms, "medium"),
                dispatcher, timer, Clock.fixed(NOW, ZoneOffset.UTC), 0L);

        // When
        service.requestScreenshot(observer.getPrincipal(), observer.getId(), sessionId, null);
        timer.advanceTime();

        // Then
        assertEquals(1, observer.received(ServerEvent.SCREENSHOT_TIMEOUT).size());
        assertEquals(0, service.pendingScreenshotCount());
    }

    @Test
    void testRequestScreenshot_TimeoutGoesOnlyToRequester() {
        // Given
        Map<String, Object> ack = service.requestScreenshot(observer.getPrincipal(), observer.getId(), sessionId, null);
        student.clear();

        // When
        timer.advanceTimeBy(Duration.ofSeconds(29));
        assertTrue(observer.received(ServerEvent.SCREENSHOT_TIMEOUT).isEmpty());
        timer.advanceTimeBy(Duration.ofSeconds(2));

        // Then
        assertEquals(30_000L, ack.get("timeoutMs"));
        assertEquals(1, observer.received(ServerEvent.SCREENSHOT_TIMEOUT).size());
        assertEquals(ack.get("requestId"), observer.received(ServerEvent.SCREENSHOT_TIMEOUT).get(0).getData().get("requestId"));
        assertTrue(student.received().isEmpty());
        assertEquals(0, service.pendingScreenshotCount());
    }

    @Test
    void testRequestScreenshot_ResponseForwardedAndTimerCancelled() {
        // Given
        Map<String, Object> ack = service.requestScreenshot(observer.getPrincipal(), observer.getId(), sessionId, "check desk");
        assertEquals(List.of(ServerEvent.SCREENSHOT_REQUESTED), student.events());
        String requestId = (String) ack.get("requestId");

        // When
        boolean accepted = service.screenshotResponse(student.getPrincipal(), requestId, Map.of("data", "base64"));
        timer.advanceTimeBy(Duration.ofMinutes(1));

        // Then
        assertTrue(accepted);
        assertEquals(1, observer.received(ServerEvent.SCREENSHOT_CAPTURED).size());
        assertTrue(observer.received(ServerEvent.SCREENSHOT_TIMEOUT).isEmpty());
        assertFalse(service.screenshotResponse(student.getPrincipal(), requestId, Map.of()));
    }

    @Test
    void testScreenshotResponse_FromAnotherStudentRejected() {
        // Given
        String requestId = (String) service.requestScreenshot(observer.getPrincipal(), observer.getId(), sessionId, null)
                .get("requestId");
        ConnectionPrincipal intruder = RecordingConnection.student("c-intruder", "student-2").getPrincipal();

        // When
        ProctorException e = assertThrows(ProctorException.class,
                () -> service.screenshotResponse(intruder, requestId, Map.of()));

        // Then
        assertEquals(ErrorCode.INSUFFICIENT_PERMISSION, e.getCode());
        assertEquals(1, service.pendingScreenshotCount());
    }

    @Test
    void testCancelScreenshotsFor_DropsTimers() {
        // Given
        service.requestScreenshot(observer.getPrincipal(), observer.getId(), sessionId, null);

        // When
        service.cancelScreenshotsFor(observer.getId());
        timer.advanceTimeBy(Duration.ofMinutes(1));

        // Then
        assertEquals(0, service.pendingScreenshotCount());
        assertTrue(observer.received(ServerEvent.SCREENSHOT_TIMEOUT).isEmpty());
    }

    @Test
    void testBulkAction_FailuresStayInTheirSlot() {
        // Given
        String second = registry.create("student-2", "exam-1").getSessionId();

        // When
        List<InterventionService.BulkItemResult> results = service.bulkAction(observerWith(Permission.BULK),
                "terminate", Arrays.asList(sessionId, "missing", second), Map.of("reason", "exam cancelled"));

        // Then
        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccess());
        assertFalse(results.get(1).isSuccess());
        assertEquals("session-not-found", results.get(1).getError().get("code"));
        assertTrue(results.get(2).isSuccess());
        assertEquals(SessionStatus.TERMINATED, registry.get(sessionId).getStatus());
        assertEquals(SessionStatus.TERMINATED, registry.get(second).getStatus());
        assertEquals("missing", results.get(1).toMap().get("sessionId"));
    }

    @Test
    void testBulkAction_SendMessage() {
        // When
        List<InterventionService.BulkItemResult> results = service.bulkAction(observerWith(Permission.BULK),
                "send_message", List.of(sessionId), Map.of("message", "Five minutes left"));

        // Then
        assertTrue(results.get(0).isSuccess());
        assertEquals("Five minutes left", student.received(ServerEvent.INTERVENTION).get(0).getData().get("message"));
        assertEquals("high", student.received(ServerEvent.INTERVENTION).get(0).getData().get("priority"));
    }

    @Test
    void testBulkAction_RequiresPermissionAndKnownAction() {
        assertEquals(ErrorCode.INSUFFICIENT_PERMISSION, assertThrows(ProctorException.class,
                () -> service.bulkAction(observerWith(Permission.TERMINATE), "terminate", List.of(sessionId), null)).getCode());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(ProctorException.class,
                () -> service.bulkAction(observerWith(Permission.BULK), "explode", List.of(sessionId), null)).getCode());
        assertEquals(ErrorCode.INVALID_INPUT, assertThrows(ProctorException.class,
                () -> service.bulkAction(observerWith(Permission.BULK), "flag", List.of(), null)).getCode());
        assertEquals(SessionStatus.ACTIVE, registry.get(sessionId).getStatus());
    }

    @Test
    void testUpdateSettings_NotifiesOtherObservers() {
        // Given
        RecordingConnection other = RecordingConnection.observer("c-other", "teacher-9");
        rooms.register(other);
        rooms.join(other.getId(), RoomKey.observerGlobal());

        // When
        Map<String, Object> ack = service.updateSettings(observer.getPrincipal(), observer.getId(), "quiz-1",
                Map.of("maxViolations", 3));

        // Then
        assertEquals("updated", ack.get("status"));
        assertEquals(List.of(ServerEvent.SETTINGS_UPDATED), other.events());
        assertTrue(observer.received(ServerEvent.SETTINGS_UPDATED).isEmpty());
        verify(dispatcher).submit(any(DownstreamCall.class));
    }
}
