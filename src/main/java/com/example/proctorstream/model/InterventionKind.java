package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InterventionKind {
    MESSAGE,
    PAUSE,
    RESUME,
    TERMINATE,
    END,
    FLAG,
    SCREENSHOT_REQUEST,
    BULK;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterventionKind fromWire(String value) {
        if (value == null) return null;
        try {
            return InterventionKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
