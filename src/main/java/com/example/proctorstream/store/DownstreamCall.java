package com.example.proctorstream.store;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.HashMap;
import java.util.Map;

/**
 * One fire-and-forget write against the downstream store. All calls are idempotent or
 * safely retryable on the store side, so the same call may be replayed from the outbox.
 */
@Value
@Builder
public class DownstreamCall {

    public enum Kind {
        STORE_VIOLATION(HttpMethod.POST, "/violations/{id}"),
        RECALCULATE_RISK(HttpMethod.POST, "/risk-score/{id}/recalculate"),
        LOG_INTERVENTION(HttpMethod.POST, "/interventions"),
        TERMINATE_SESSION(HttpMethod.POST, "/sessions/{id}/terminate"),
        FLAG_SESSION(HttpMethod.POST, "/sessions/{id}/flag"),
        UPDATE_SETTINGS(HttpMethod.PUT, "/settings/quiz/{id}");

        private final HttpMethod method;
        private final String pathTemplate;

        Kind(HttpMethod method, String pathTemplate) {
            this.method = method;
            this.pathTemplate = pathTemplate;
        }

        public HttpMethod getMethod() { return method; }
        public String getPathTemplate() { return pathTemplate; }
    }

    Kind kind;
    // path variable: session id, or quiz id for UPDATE_SETTINGS; unused by LOG_INTERVENTION
    String targetId;
    @Builder.Default
    Map<String, Object> body = Map.of();

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("targetId", targetId);
        payload.put("body", body);
        return payload;
    }

    @SuppressWarnings("unchecked")
    public static DownstreamCall fromPayload(String kind, Map<String, Object> payload) {
        Object body = payload.get("body");
        return DownstreamCall.builder()
                .kind(Kind.valueOf(kind))
                .targetId((String) payload.get("targetId"))
                .body(body instanceof Map ? (Map<String, Object>) body : Map.of())
                .build();
    }

    public String describe() {
        return targetId == null ? kind.name() : kind.name() + "(" + targetId + ")";
    }
}
