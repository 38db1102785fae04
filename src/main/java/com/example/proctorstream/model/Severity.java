package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most urgent.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Bucket implied by confidence alone: >= 0.9 critical, >= 0.7 high, >= 0.5 medium.
     */
    public static Severity fromConfidence(double confidence) {
        if (confidence >= 0.9) return CRITICAL;
        if (confidence >= 0.7) return HIGH;
        if (confidence >= 0.5) return MEDIUM;
        return LOW;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWire(String value) {
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
