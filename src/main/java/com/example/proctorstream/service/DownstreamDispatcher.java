package com.example.proctorstream.service;

import com.example.proctorstream.model.OutboxEvent;
import com.example.proctorstream.repo.OutboxRepo;
import com.example.proctorstream.store.DownstreamCall;
import com.example.proctorstream.store.DownstreamStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs downstream store calls as detached background tasks.
 * 1. The call goes out once on the dispatch pool with a bounded timeout.
 * 2. A failure is logged and parked in the outbox; {@link OutboxProjector} retries it later.
 * Callers never wait on either step.
 */
@Service
public class DownstreamDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(DownstreamDispatcher.class);

    private final DownstreamStore store;
    private final OutboxRepo outboxRepo;
    private final ExecutorService dispatchExecutor;
    private final Scheduler dispatchScheduler;
    private final Duration callTimeout;
    private final int maxThreads;

    public DownstreamDispatcher(DownstreamStore store,
                                OutboxRepo outboxRepo,
                                @Value("${app.downstream.max-threads:4}") int maxThreads,
                                @Value("${app.downstream.timeout-ms:5000}") long callTimeoutMs) {
        this.store = store;
        this.outboxRepo = outboxRepo;
        this.maxThreads = maxThreads > 0 ? maxThreads : 4;
        this.callTimeout = Duration.ofMillis(callTimeoutMs);
        this.dispatchExecutor = createExecutorService(this.maxThreads);
        this.dispatchScheduler = Schedulers.fromExecutorService(dispatchExecutor, "downstream-dispatch");
    }

    private static ExecutorService createExecutorService(int threadCount) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threadCount, r -> {
            Thread t = new Thread(r, "downstream-dispatch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Fire-and-forget: returns immediately, the outcome is only logged.
     */
    public void submit(DownstreamCall call) {
        logger.debug("Dispatching downstream call {}", call.describe());
        try {
            store.execute(call)
                    .subscribeOn(dispatchScheduler)
                    .timeout(callTimeout)
                    .subscribe(
                            ignored -> { },
                            error -> park(call, error),
                            () -> logger.debug("Downstream call {} completed", call.describe()));
        } catch (Exception e) {
            park(call, e);
        }
    }

    private void park(DownstreamCall call, Throwable error) {
        logger.warn("Downstream call {} failed: {}", call.describe(), error.toString());
        try {
            OutboxEvent event = OutboxEvent.builder()
                    .type(call.getKind().name())
                    .ts(Instant.now())
                    .payload(call.toPayload())
                    .processed(false)
                    .attempts(1)
                    .lastError(error.toString())
                    .lastAttemptAt(Instant.now())
                    .build();
            outboxRepo.save(event);
            logger.debug("Downstream call {} parked for retry", call.describe());
        } catch (Exception e) {
            logger.error("Could not park downstream call {}, it is dropped", call.describe(), e);
        }
    }

    public Map<String, Object> getDispatchStats() {
        ThreadPoolExecutor executor = (ThreadPoolExecutor) dispatchExecutor;
        long unprocessed;
        try {
            unprocessed = outboxRepo.countByProcessedFalse();
        } catch (Exception e) {
            logger.warn("Outbox count unavailable: {}", e.getMessage());
            unprocessed = -1;
        }
        return Map.of(
            "dispatchThreads", Map.of(
                "activeCount", executor.getActiveCount(),
                "poolSize", executor.getPoolSize(),
                "maxPoolSize", maxThreads,
                "queueSize", executor.getQueue().size(),
                "completedTasks", executor.getCompletedTaskCount()
            ),
            "callTimeoutMs", callTimeout.toMillis(),
            "outboxUnprocessed", unprocessed
        );
    }

    @PreDestroy
    public void shutdown() {
        dispatchScheduler.dispose();
        dispatchExecutor.shutdown();
    }
}
