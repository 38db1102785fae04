package com.example.proctorstream.ws;

import java.util.Optional;

/**
 * Events a student connection may send.
 */
public enum StudentEvent {
    JOIN_SESSION("join-session"),
    BEHAVIOR_EVENT("behavior-event"),
    VIOLATION_DETECTED("violation-detected"),
    STATUS_UPDATE("status-update"),
    EMERGENCY_HELP("emergency-help"),
    QUIZ_SUBMITTED("quiz-submitted"),
    SCREENSHOT_RESPONSE("screenshot-response"),
    PING("ping");

    private final String wireName;

    StudentEvent(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() { return wireName; }

    public static Optional<StudentEvent> fromWire(String name) {
        for (StudentEvent event : values()) {
            if (event.wireName.equals(name)) return Optional.of(event);
        }
        return Optional.empty();
    }
}
