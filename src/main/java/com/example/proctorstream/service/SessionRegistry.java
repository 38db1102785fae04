package com.example.proctorstream.service;

import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import com.example.proctorstream.kv.SessionCache;
import com.example.proctorstream.model.MonitoringSession;
import com.example.proctorstream.model.SessionStatus;
import com.example.proctorstream.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Authoritative in-process store of monitored sessions.
 *
 * <p>Every mutation goes through {@link ConcurrentHashMap#compute}, so updates to one session
 * are serialized while different sessions proceed in parallel. Each mutation swaps in a fresh
 * immutable snapshot and writes it through to the {@link SessionCache}.
 */
@Service
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, MonitoringSession> sessions = new ConcurrentHashMap<>();
    private final SessionCache cache;
    private final RiskScorer riskScorer;
    private final Clock clock;
    private final Duration inactivityTimeout;
    private final Duration closedRetention;

    public SessionRegistry(SessionCache cache,
                           RiskScorer riskScorer,
                           Clock clock,
                           @Value("${app.registry.inactivity-timeout-ms:7200000}") long inactivityTimeoutMs,
                           @Value("${app.registry.closed-retention-ms:600000}") long closedRetentionMs) {
        this.cache = cache;
        this.riskScorer = riskScorer;
        this.clock = clock;
        this.inactivityTimeout = Duration.ofMillis(inactivityTimeoutMs);
        this.closedRetention = Duration.ofMillis(closedRetentionMs);
    }

    public MonitoringSession create(String ownerId, String examId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw ProctorException.invalidInput("ownerId is required");
        }
        if (examId == null || examId.isBlank()) {
            throw ProctorException.invalidInput("examId is required");
        }
        Instant now = clock.instant();
        MonitoringSession session = MonitoringSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .examId(examId)
                .status(SessionStatus.PENDING)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        sessions.put(session.getSessionId(), session);
        cache.save(session);
        logger.info("Created session {} for owner {} in exam {}", session.getSessionId(), ownerId, examId);
        return session;
    }

    /**
     * @throws ProctorException with {@link ErrorCode#SESSION_NOT_FOUND} when neither this
     *         instance nor the mirror knows the session
     */
    public MonitoringSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> ProctorException.sessionNotFound(sessionId));
    }

    public Optional<MonitoringSession> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return Optional.empty();
        MonitoringSession local = sessions.get(sessionId);
        if (local != null) return Optional.of(local);
        return cache.load(sessionId).map(loaded -> {
            MonitoringSession existing = sessions.putIfAbsent(sessionId, loaded);
            return existing != null ? existing : loaded;
        });
    }

    /**
     * Applies a mutation that originates with the session owner, refreshing the last-activity time.
     */
    public MonitoringSession update(String sessionId, UnaryOperator<MonitoringSession> mutation) {
        return apply(sessionId, current -> mutation.apply(current).toBuilder().lastActivityAt(clock.instant()).build());
    }

    /**
     * Applies {@code mutation} atomically without touching the last-activity time. Observer and
     * aggregator bookkeeping goes through here, so it never keeps an abandoned session alive.
     */
    private MonitoringSession apply(String sessionId, UnaryOperator<MonitoringSession> mutation) {
        find(sessionId).orElseThrow(() -> ProctorException.sessionNotFound(sessionId));
        MonitoringSession updated = sessions.computeIfPresent(sessionId, (id, current) -> mutation.apply(current));
        if (updated == null) {
            throw ProctorException.sessionNotFound(sessionId);
        }
        cache.save(updated);
        return updated;
    }

    /**
     * Merges client-reported status fields into the session.
     */
    public MonitoringSession update(String sessionId, Map<String, Object> partial) {
        return update(sessionId, current -> {
            Map<String, Object> merged = new LinkedHashMap<>(current.getClientStatus());
            if (partial != null) {
                partial.forEach((k, v) -> {
                    if (k != null && v != null) merged.put(k, v);
                });
            }
            return current.toBuilder().clientStatus(Map.copyOf(merged)).build();
        });
    }

    public MonitoringSession touch(String sessionId) {
        return update(sessionId, UnaryOperator.identity());
    }

    public boolean delete(String sessionId) {
        MonitoringSession removed = sessions.remove(sessionId);
        cache.remove(sessionId);
        if (removed != null) {
            logger.info("Deleted session {}", sessionId);
        }
        return removed != null;
    }

    public List<MonitoringSession> listActive() {
        return sessions.values().stream()
                .filter(s -> !s.isClosed())
                .sorted(Comparator.comparing(MonitoringSession::getCreatedAt))
                .collect(Collectors.toList());
    }

    public Collection<MonitoringSession> listAll() {
        return List.copyOf(sessions.values());
    }

    /**
     * Moves the session to {@code target}. Moving to the current status changes nothing.
     *
     * @throws ProctorException with {@link ErrorCode#INVALID_TRANSITION} for a move the state machine forbids
     */
    public StatusChange transition(String sessionId, SessionStatus target, String reason) {
        SessionStatus[] previous = new SessionStatus[1];
        MonitoringSession updated = apply(sessionId, current -> {
            previous[0] = current.getStatus();
            return applyStatus(current, target, reason);
        });
        StatusChange change = new StatusChange(updated, previous[0]);
        if (change.isChanged()) {
            logger.info("Session {} {} -> {}{}", sessionId, previous[0].getWireName(), target.getWireName(),
                    reason != null ? " (" + reason + ")" : "");
        }
        return change;
    }

    /**
     * Leaves {@link SessionStatus#PAUSED}, returning to flagged when the session had been flagged.
     */
    public StatusChange resume(String sessionId) {
        SessionStatus[] previous = new SessionStatus[1];
        MonitoringSession updated = apply(sessionId, current -> {
            previous[0] = current.getStatus();
            if (current.getStatus() != SessionStatus.PAUSED) {
                if (current.getStatus() == SessionStatus.ACTIVE || current.getStatus() == SessionStatus.FLAGGED) {
                    return current;
                }
                throw invalidTransition(current.getStatus(), SessionStatus.ACTIVE);
            }
            SessionStatus target = current.getFlaggedAt() != null ? SessionStatus.FLAGGED : SessionStatus.ACTIVE;
            return applyStatus(current, target, null);
        });
        return new StatusChange(updated, previous[0]);
    }

    /**
     * Puts the flag mark on a session. A paused session keeps its pause and only records
     * {@code flaggedAt}; resuming it later lands in {@link SessionStatus#FLAGGED}.
     *
     * @return the updated session when this call set the mark, empty when it was already set
     * @throws ProctorException with {@link ErrorCode#INVALID_TRANSITION} for a closed session
     */
    public Optional<MonitoringSession> markFlagged(String sessionId, String reason) {
        boolean[] marked = {false};
        MonitoringSession updated = apply(sessionId, current -> {
            if (current.isClosed()) {
                throw invalidTransition(current.getStatus(), SessionStatus.FLAGGED);
            }
            if (current.getFlaggedAt() != null) {
                return current;
            }
            marked[0] = true;
            if (current.getStatus() == SessionStatus.PAUSED) {
                return current.toBuilder().flaggedAt(clock.instant()).build();
            }
            return applyStatus(current, SessionStatus.FLAGGED, reason);
        });
        if (!marked[0]) {
            return Optional.empty();
        }
        logger.info("Session {} flagged while {} ({})", sessionId, updated.getStatus().getWireName(), reason);
        return Optional.of(updated);
    }

    private MonitoringSession applyStatus(MonitoringSession current, SessionStatus target, String reason) {
        SessionStatus from = current.getStatus();
        if (from == target) {
            return current;
        }
        if (!from.canTransitionTo(target)) {
            throw invalidTransition(from, target);
        }
        MonitoringSession.MonitoringSessionBuilder next = current.toBuilder().status(target);
        Instant now = clock.instant();
        if (target == SessionStatus.FLAGGED && current.getFlaggedAt() == null) {
            next.flaggedAt(now);
        }
        if (target.isClosed()) {
            next.closedAt(now).closeReason(reason).monitored(false);
        }
        return next.build();
    }

    private static ProctorException invalidTransition(SessionStatus from, SessionStatus to) {
        return new ProctorException(ErrorCode.INVALID_TRANSITION,
                "Cannot move session from " + from.getWireName() + " to " + to.getWireName());
    }

    /**
     * Appends to the ledger.
     *
     * @throws ProctorException with {@link ErrorCode#SESSION_CLOSED} once the session has ended
     */
    public MonitoringSession recordViolation(String sessionId, Violation violation) {
        return update(sessionId, current -> {
            if (current.isClosed()) {
                throw ProctorException.sessionClosed(sessionId);
            }
            List<Violation> ledger = new ArrayList<>(current.getViolations().size() + 1);
            ledger.addAll(current.getViolations());
            ledger.add(violation);
            return current.toBuilder()
                    .violations(List.copyOf(ledger))
                    .violationCount(current.getViolationCount() + 1)
                    .build();
        });
    }

    public MonitoringSession recomputeRisk(String sessionId) {
        return apply(sessionId, current -> current.toBuilder()
                .riskScore(riskScorer.score(current.scoredViolations()))
                .build());
    }

    /**
     * Zeroes the score; violations recorded so far no longer count toward it.
     */
    public MonitoringSession resetRisk(String sessionId) {
        MonitoringSession updated = apply(sessionId, current -> current.toBuilder()
                .riskScore(0.0)
                .riskBaseline(current.getViolations().size())
                .build());
        logger.info("Risk score of session {} reset", sessionId);
        return updated;
    }

    public MonitoringSession setMonitored(String sessionId, boolean monitored) {
        return apply(sessionId, current -> current.toBuilder().monitored(monitored).build());
    }

    public MonitoringSession recordRoomJoin(String sessionId, String room) {
        return update(sessionId, current -> {
            if (current.getRooms().contains(room)) return current;
            Set<String> rooms = new HashSet<>(current.getRooms());
            rooms.add(room);
            return current.toBuilder().rooms(Set.copyOf(rooms)).build();
        });
    }

    public MonitoringSession recordRoomLeave(String sessionId, String room) {
        return update(sessionId, current -> {
            if (!current.getRooms().contains(room)) return current;
            Set<String> rooms = new HashSet<>(current.getRooms());
            rooms.remove(room);
            return current.toBuilder().rooms(Set.copyOf(rooms)).build();
        });
    }

    /**
     * Ends sessions idle past the inactivity timeout and forgets closed sessions past retention.
     *
     * @return the sessions ended by this sweep
     */
    public SweepResult sweep(Instant now) {
        List<MonitoringSession> expired = new ArrayList<>();
        int purged = 0;
        for (String sessionId : List.copyOf(sessions.keySet())) {
            MonitoringSession[] ended = new MonitoringSession[1];
            boolean[] remove = {false};
            sessions.computeIfPresent(sessionId, (id, current) -> {
                if (current.isClosed()) {
                    Instant closedAt = current.getClosedAt() != null ? current.getClosedAt() : current.getLastActivityAt();
                    if (closedAt.plus(closedRetention).isBefore(now)) {
                        remove[0] = true;
                        return null;
                    }
                    return current;
                }
                if (current.getLastActivityAt().plus(inactivityTimeout).isBefore(now)) {
                    ended[0] = current.toBuilder()
                            .status(SessionStatus.ENDED)
                            .closedAt(now)
                            .closeReason("inactivity-timeout")
                            .monitored(false)
                            .build();
                    return ended[0];
                }
                return current;
            });
            if (remove[0]) {
                cache.remove(sessionId);
                purged++;
            } else if (ended[0] != null) {
                cache.save(ended[0]);
                expired.add(ended[0]);
            }
        }
        if (!expired.isEmpty() || purged > 0) {
            logger.info("Sweep ended {} idle sessions, purged {} closed sessions", expired.size(), purged);
        }
        return new SweepResult(List.copyOf(expired), purged);
    }

    public Map<SessionStatus, Long> countByStatus() {
        Map<SessionStatus, Long> counts = new EnumMap<>(SessionStatus.class);
        for (MonitoringSession session : sessions.values()) {
            counts.merge(session.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    public int size() {
        return sessions.size();
    }

    @lombok.Value
    public static class StatusChange {
        MonitoringSession session;
        SessionStatus previous;

        public boolean isChanged() {
            return previous != session.getStatus();
        }
    }

    @lombok.Value
    public static class SweepResult {
        List<MonitoringSession> expired;
        int purged;
    }
}
