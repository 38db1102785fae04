package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.Map;

/**
 * A pre-classified detection as pushed by the ML backend or the client-side detector.
 * Fields are boxed so missing values can be told apart from zero.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawDetection {
    private String sessionId;
    private String type;
    private Double confidence;
    private String details;
    // epoch millis
    private Long timestamp;
    private String screenshot;
    private Map<String, Object> metadata;
}
