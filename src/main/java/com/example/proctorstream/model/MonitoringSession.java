package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of one monitored exam attempt. Instances are immutable; the registry swaps in
 * a new snapshot on every mutation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MonitoringSession {
    String sessionId;
    String ownerId;
    String examId;
    SessionStatus status;
    Instant createdAt;
    Instant lastActivityAt;
    double riskScore;
    int violationCount;
    // ledger index the risk score is folded from; moved forward by an explicit reset
    int riskBaseline;
    @Builder.Default
    List<Violation> violations = List.of();
    @Builder.Default
    Set<String> rooms = Set.of();
    @Builder.Default
    Map<String, Object> clientStatus = Map.of();
    boolean monitored;
    Instant flaggedAt;
    Instant closedAt;
    String closeReason;

    @JsonIgnore
    public boolean isClosed() {
        return status != null && status.isClosed();
    }

    public List<Violation> scoredViolations() {
        return violations.subList(Math.min(riskBaseline, violations.size()), violations.size());
    }

    public Map<String, Object> toSummary() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sessionId", sessionId);
        out.put("ownerId", ownerId);
        out.put("examId", examId);
        out.put("status", status.getWireName());
        out.put("riskScore", riskScore);
        out.put("violationCount", violationCount);
        out.put("monitored", monitored);
        out.put("createdAt", createdAt);
        out.put("lastActivityAt", lastActivityAt);
        if (flaggedAt != null) out.put("flaggedAt", flaggedAt);
        if (closedAt != null) out.put("closedAt", closedAt);
        if (closeReason != null) out.put("closeReason", closeReason);
        return out;
    }
}
