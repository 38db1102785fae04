package com.example.proctorstream.broadcast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Every event the server pushes to clients.
 */
public enum ServerEvent {
    CONNECTED("connected"),
    ERROR("error"),
    PONG("pong"),

    // student-facing
    SESSION_JOINED("session-joined"),
    BEHAVIOR_PROCESSED("behavior-processed"),
    VIOLATION_RECORDED("violation-recorded"),
    SUBMISSION_RECEIVED("submission-received"),
    VIOLATION_ALERT("violation-alert"),
    WARNING_POPUP("warning-popup"),
    INTERVENTION("intervention"),
    SCREENSHOT_REQUESTED("screenshot-requested"),
    EMERGENCY_ACKNOWLEDGED("emergency-acknowledged"),

    // lifecycle, to observers and the session room
    STUDENT_JOINED("student-joined"),
    STUDENT_LEFT("student-left"),
    SESSION_FLAGGED("session-flagged"),
    SESSION_PAUSED("session-paused"),
    SESSION_RESUMED("session-resumed"),
    SESSION_ENDED("session-ended"),
    SESSION_ENDED_BY_TIMEOUT("session-ended-by-timeout"),
    SESSION_TERMINATED("session-terminated"),

    // observer-facing
    CRITICAL_VIOLATION("critical-violation"),
    SESSION_STATUS_UPDATE("session-status-update"),
    EMERGENCY_ALERT("emergency-alert"),
    QUIZ_SUBMITTED("quiz-submitted"),
    ACTIVE_SESSIONS("active-sessions"),
    MONITORING_STARTED("monitoring-started"),
    MONITORING_STOPPED("monitoring-stopped"),
    EXAM_WATCH_STARTED("exam-watch-started"),
    SESSION_DETAILS("session-details"),
    INTERVENTION_SENT("intervention-sent"),
    SESSION_TERMINATED_SUCCESS("session-terminated-success"),
    SESSION_ENDED_SUCCESS("session-ended-success"),
    SESSION_FLAGGED_SUCCESS("session-flagged-success"),
    SCREENSHOT_REQUEST_SENT("screenshot-request-sent"),
    SCREENSHOT_CAPTURED("screenshot-captured"),
    SCREENSHOT_TIMEOUT("screenshot-timeout"),
    BULK_ACTION_COMPLETED("bulk-action-completed"),
    DASHBOARD_SUBSCRIBED("dashboard-subscribed"),
    DASHBOARD_UNSUBSCRIBED("dashboard-unsubscribed"),
    DASHBOARD_DATA("dashboard-data"),
    STATISTICS_UPDATE("statistics-update"),
    SETTINGS_UPDATED("settings-updated"),
    SETTINGS_UPDATED_SUCCESS("settings-updated-success");

    private final String wireName;

    ServerEvent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() { return wireName; }

    @JsonCreator
    public static ServerEvent fromWire(String name) {
        for (ServerEvent event : values()) {
            if (event.wireName.equals(name)) return event;
        }
        throw new IllegalArgumentException("Unknown server event: " + name);
    }
}
