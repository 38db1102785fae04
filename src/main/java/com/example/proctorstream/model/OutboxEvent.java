package com.example.proctorstream.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * A downstream store call that failed on its first attempt, parked for background retry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("downstream_outbox")
public class OutboxEvent {
    @Id
    private String id;
    private String type; // DownstreamCall.Kind name
    private Instant ts;
    private Map<String,Object> payload;
    private boolean processed;
    private int attempts;
    private String lastError;
    private Instant lastAttemptAt;
}
