package com.example.proctorstream.broadcast;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One outbound frame: {@code {"event": ..., "data": {...}, "timestamp": ...}}.
 */
@Value
public class ServerMessage {
    ServerEvent event;
    Map<String, Object> data;
    Instant timestamp;

    public static ServerMessage of(ServerEvent event, Map<String, Object> data) {
        return new ServerMessage(event, data, Instant.now());
    }
}
