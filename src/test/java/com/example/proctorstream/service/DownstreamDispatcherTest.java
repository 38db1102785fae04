package com.example.proctorstream.service;

import com.example.proctorstream.model.OutboxEvent;
import com.example.proctorstream.repo.OutboxRepo;
import com.example.proctorstream.store.DownstreamCall;
import com.example.proctorstream.store.DownstreamStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DownstreamDispatcherTest {

    @Mock
    private DownstreamStore store;

    @Mock
    private OutboxRepo outboxRepo;

    private DownstreamDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DownstreamDispatcher(store, outboxRepo, 2, 500L);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    private static DownstreamCall storeViolation(String sessionId) {
        return DownstreamCall.builder()
                .kind(DownstreamCall.Kind.STORE_VIOLATION)
                .targetId(sessionId)
                .body(Map.of("type", "tab_switch"))
                .build();
    }

    @Test
    void testSubmit_SuccessDoesNotTouchOutbox() {
        // Given
        when(store.execute(any(DownstreamCall.class))).thenReturn(Mono.empty());

        // When
        dispatcher.submit(storeViolation("session-1"));

        // Then
        verify(store, timeout(1000)).execute(any(DownstreamCall.class));
        verify(outboxRepo, after(200).never()).save(any(OutboxEvent.class));
    }

    @Test
    void testSubmit_FailureParksCallInOutbox() {
        // Given
        when(store.execute(any(DownstreamCall.class)))
                .thenReturn(Mono.error(new IllegalStateException("store down")));

        // When
        dispatcher.submit(storeViolation("session-1"));

        // Then
        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepo, timeout(1000)).save(captor.capture());
        OutboxEvent parked = captor.getValue();
        assertEquals("STORE_VIOLATION", parked.getType());
        assertFalse(parked.isProcessed());
        assertEquals(1, parked.getAttempts());
        assertEquals("session-1", parked.getPayload().get("targetId"));
        assertTrue(parked.getLastError().contains("store down"));
    }

    @Test
    void testSubmit_TimeoutParksCall() {
        // Given
        when(store.execute(any(DownstreamCall.class))).thenReturn(Mono.never());

        // When
        dispatcher.submit(storeViolation("session-2"));

        // Then
        verify(outboxRepo, timeout(2000)).save(any(OutboxEvent.class));
    }

    @Test
    void testSubmit_SynchronousThrowIsParkedNotPropagated() {
        // Given
        when(store.execute(any(DownstreamCall.class))).thenThrow(new RuntimeException("boom"));

        // When
        assertDoesNotThrow(() -> dispatcher.submit(storeViolation("session-3")));

        // Then
        verify(outboxRepo, timeout(1000)).save(any(OutboxEvent.class));
    }

    @Test
    void testSubmit_OutboxFailureIsSwallowedByCaller() {
        // Given
        when(store.execute(any(DownstreamCall.class))).thenReturn(Mono.error(new RuntimeException("store down")));
        when(outboxRepo.save(any(OutboxEvent.class))).thenThrow(new RuntimeException("mongo down"));

        // When
        assertDoesNotThrow(() -> dispatcher.submit(storeViolation("session-4")));

        // Then
        verify(outboxRepo, timeout(1000)).save(any(OutboxEvent.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetDispatchStats() {
        // Given
        when(outboxRepo.countByProcessedFalse()).thenReturn(3L);

        // When
        Map<String, Object> stats = dispatcher.getDispatchStats();

        // Then
        assertEquals(3L, stats.get("outboxUnprocessed"));
        assertEquals(500L, stats.get("callTimeoutMs"));
        Map<String, Object> threads = (Map<String, Object>) stats.get("dispatchThreads");
        assertEquals(2, threads.get("maxPoolSize"));
    }

    @Test
    void testGetDispatchStats_OutboxUnavailable() {
        // Given
        when(outboxRepo.countByProcessedFalse()).thenThrow(new RuntimeException("mongo down"));

        // When
        Map<String, Object> stats = dispatcher.getDispatchStats();

        // Then
        assertEquals(-1L, stats.get("outboxUnprocessed"));
    }
}
