package com.example.proctorstream.ws.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class BehaviorEventRequest {
    private String sessionId;
    private String eventType;
    private Map<String, Object> eventData;
    // epoch millis
    private Long timestamp;
}
