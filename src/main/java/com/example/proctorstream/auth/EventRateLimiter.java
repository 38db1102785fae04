package com.example.proctorstream.auth;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding-window limit on inbound events per identity. An identity over its budget has the
 * offending event refused; the connection stays up.
 */
@Component
public class EventRateLimiter {

    private final int maxEvents;
    private final long windowMs;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    public EventRateLimiter(@Value("${app.auth.rate-limit.max-events:100}") int maxEvents,
                            @Value("${app.auth.rate-limit.window-ms:60000}") long windowMs,
                            Clock clock) {
        this.maxEvents = maxEvents;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    public boolean tryAcquire(String identity) {
        long now = clock.millis();
        boolean[] accepted = {false};
        // the whole check runs inside compute, so prune cannot drop a window mid-acquire
        windows.compute(identity, (k, window) -> {
            Deque<Long> current = window != null ? window : new ArrayDeque<>();
            evictBefore(current, now - windowMs);
            if (current.size() < maxEvents) {
                current.addLast(now);
                accepted[0] = true;
            }
            return current;
        });
        return accepted[0];
    }

    @Scheduled(fixedDelayString = "${app.auth.rate-limit.window-ms:60000}")
    public void prune() {
        long cutoff = clock.millis() - windowMs;
        for (String identity : List.copyOf(windows.keySet())) {
            windows.computeIfPresent(identity, (k, window) -> {
                evictBefore(window, cutoff);
                return window.isEmpty() ? null : window;
            });
        }
    }

    private static void evictBefore(Deque<Long> window, long cutoff) {
        while (!window.isEmpty() && window.peekFirst() <= cutoff) {
            window.pollFirst();
        }
    }

    int windowSize(String identity) {
        Deque<Long> window = windows.get(identity);
        return window != null ? window.size() : 0;
    }

    int trackedIdentities() {
        return windows.size();
    }
}
