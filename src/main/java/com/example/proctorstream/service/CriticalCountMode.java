package com.example.proctorstream.service;

import com.example.proctorstream.model.Severity;
import com.example.proctorstream.model.Violation;

import java.util.Locale;

/**
 * Which violations count toward the flag threshold.
 */
public enum CriticalCountMode {
    /** Critical by type or by confidence. */
    DERIVED,
    /** Critical by type only. */
    LISTED_TYPES;

    public boolean counts(Violation violation) {
        if (this == LISTED_TYPES) {
            return violation.getType().getListedSeverity() == Severity.CRITICAL;
        }
        return violation.severity() == Severity.CRITICAL;
    }

    public static CriticalCountMode fromProperty(String value) {
        if (value == null || value.isBlank()) return DERIVED;
        return CriticalCountMode.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
