package com.example.proctorstream.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An observer-initiated action against one session. Never edited after it is issued;
 * its resolution is emitted as a separate event.
 */
@Value
@Builder
public class Intervention {
    String id;
    String sessionId;
    String observerId;
    InterventionKind kind;
    @Builder.Default
    Map<String, Object> payload = Map.of();
    Instant createdAt;

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("interventionId", id);
        out.put("sessionId", sessionId);
        out.put("observerId", observerId);
        out.put("kind", kind.getWireName());
        out.put("payload", payload);
        out.put("createdAt", createdAt);
        return out;
    }
}
