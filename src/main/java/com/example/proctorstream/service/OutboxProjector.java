package com.example.proctorstream.service;

import com.example.proctorstream.model.OutboxEvent;
import com.example.proctorstream.repo.OutboxRepo;
import com.example.proctorstream.store.DownstreamCall;
import com.example.proctorstream.store.DownstreamStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Replays parked downstream calls until they succeed or run out of attempts.
 */
@Service
public class OutboxProjector {

    private static final Logger logger = LoggerFactory.getLogger(OutboxProjector.class);

    private final OutboxRepo outboxRepo;
    private final DownstreamStore store;
    private final int maxAttempts;
    private final Duration callTimeout;

    public OutboxProjector(OutboxRepo outboxRepo,
                           DownstreamStore store,
                           @Value("${app.downstream.max-attempts:5}") int maxAttempts,
                           @Value("${app.downstream.timeout-ms:5000}") long callTimeoutMs) {
        this.outboxRepo = outboxRepo;
        this.store = store;
        this.maxAttempts = maxAttempts;
        this.callTimeout = Duration.ofMillis(callTimeoutMs);
    }

    @Scheduled(fixedDelayString = "${app.downstream.outbox-poll-ms:10000}", initialDelay = 5000L)
    public void run() {
        List<OutboxEvent> events;
        try {
            events = outboxRepo.findTop50ByProcessedFalseAndAttemptsLessThanOrderByTsAsc(maxAttempts);
        } catch (Exception e) {
            logger.warn("Outbox unavailable, skipping replay: {}", e.getMessage());
            return;
        }
        for (OutboxEvent e : events) {
            replay(e);
        }
    }

    void replay(OutboxEvent e) {
        DownstreamCall call;
        try {
            call = DownstreamCall.fromPayload(e.getType(), e.getPayload());
        } catch (IllegalArgumentException ex) {
            logger.error("Discarding outbox event {} of unknown type {}", e.getId(), e.getType());
            e.setProcessed(true);
            e.setLastError("unknown type");
            outboxRepo.save(e);
            return;
        }

        e.setAttempts(e.getAttempts() + 1);
        e.setLastAttemptAt(Instant.now());
        try {
            store.execute(call).block(callTimeout);
            e.setProcessed(true);
            e.setLastError(null);
            logger.info("Replayed downstream call {} after {} attempts", call.describe(), e.getAttempts());
        } catch (Exception ex) {
            e.setLastError(ex.toString());
            if (e.getAttempts() >= maxAttempts) {
                logger.error("Giving up on downstream call {} after {} attempts: {}",
                        call.describe(), e.getAttempts(), ex.toString());
            } else {
                logger.debug("Replay of {} failed (attempt {}): {}", call.describe(), e.getAttempts(), ex.toString());
            }
        }
        outboxRepo.save(e);
    }
}
