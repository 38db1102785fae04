package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BehaviorKind {
    TAB_SWITCH,
    COPY_PASTE,
    RIGHT_CLICK,
    KEY_COMBINATION,
    WINDOW_BLUR,
    FULLSCREEN_EXIT;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BehaviorKind fromWire(String value) {
        if (value == null) return null;
        for (BehaviorKind kind : values()) {
            if (kind.getWireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        return null;
    }
}
