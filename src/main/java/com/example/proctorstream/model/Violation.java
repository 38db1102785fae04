package com.example.proctorstream.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A normalized, immutable record of a detected rule breach.
 */
@Value
@Builder
@Jacksonized
public class Violation {
    String id;
    String sessionId;
    String ownerId;
    ViolationType type;
    // name as reported; differs from type.getWireName() only for OTHER
    String rawType;
    double confidence;
    String detail;
    Instant detectedAt;
    String evidenceUrl;
    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * Severity derived from the listed bucket of the type and the confidence bucket, whichever is higher.
     */
    public Severity severity() {
        return Severity.max(type.getListedSeverity(), Severity.fromConfidence(confidence));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", id);
        out.put("type", rawType != null ? rawType : type.getWireName());
        out.put("confidence", confidence);
        out.put("severity", severity().getWireName());
        out.put("detail", detail);
        out.put("detectedAt", detectedAt);
        if (evidenceUrl != null) out.put("evidenceUrl", evidenceUrl);
        return out;
    }
}
