package com.example.proctorstream.store;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Durability sink for violations, risk recalculations, interventions and session outcomes.
 * It is never the source of truth for real-time decisions.
 */
public interface DownstreamStore {
    Mono<Void> execute(DownstreamCall call);
    Mono<Map<String,Object>> sessionDetails(String sessionId);
    Mono<Map<String,Object>> activeSessions();
}
