package com.example.proctorstream.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Client-reported behavioral signal. Consumed once by the classifier, never stored.
 */
@Value
@Builder
public class BehaviorEvent {
    String sessionId;
    String ownerId;
    BehaviorKind kind;
    Map<String, Object> payload;
    Instant clientTimestamp;
}
