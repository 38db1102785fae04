package com.example.proctorstream.ws.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observer action on one session. {@code type} is message, pause or resume.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class InterventionRequest {
    private String sessionId;
    private String type;
    private String message;
    private String priority;
    private String reason;
}
