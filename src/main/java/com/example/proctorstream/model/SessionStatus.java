package com.example.proctorstream.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a monitored session. {@link #ENDED} and {@link #TERMINATED} are terminal;
 * {@link #FLAGGED} is a mark on a session that keeps running.
 */
public enum SessionStatus {
    PENDING,
    ACTIVE,
    PAUSED,
    FLAGGED,
    ENDED,
    TERMINATED;

    public boolean isClosed() {
        return this == ENDED || this == TERMINATED;
    }

    public boolean canTransitionTo(SessionStatus target) {
        if (this == target) return true;
        return allowedTargets().contains(target);
    }

    private Set<SessionStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ACTIVE, FLAGGED, ENDED, TERMINATED);
            case ACTIVE:
                return EnumSet.of(PAUSED, FLAGGED, ENDED, TERMINATED);
            case PAUSED:
                return EnumSet.of(ACTIVE, FLAGGED, ENDED, TERMINATED);
            case FLAGGED:
                return EnumSet.of(PAUSED, ENDED, TERMINATED);
            case ENDED:
            case TERMINATED:
            default:
                return EnumSet.noneOf(SessionStatus.class);
        }
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionStatus fromWire(String value) {
        return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
