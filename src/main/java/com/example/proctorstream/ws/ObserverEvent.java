package com.example.proctorstream.ws;

import java.util.Optional;

/**
 * Events an observer connection may send.
 */
public enum ObserverEvent {
    MONITOR_SESSION("monitor-session"),
    STOP_MONITORING("stop-monitoring"),
    WATCH_EXAM("watch-exam"),
    SEND_INTERVENTION("send-intervention"),
    TERMINATE_SESSION("terminate-session"),
    END_SESSION("end-session"),
    FLAG_SESSION("flag-session"),
    REQUEST_SCREENSHOT("request-screenshot"),
    BULK_ACTION("bulk-action"),
    SUBSCRIBE_DASHBOARD("subscribe-dashboard"),
    UNSUBSCRIBE_DASHBOARD("unsubscribe-dashboard"),
    UPDATE_SETTINGS("update-settings"),
    GET_SESSION_DETAILS("get-session-details"),
    PING("ping");

    private final String wireName;

    ObserverEvent(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() { return wireName; }

    public static Optional<ObserverEvent> fromWire(String name) {
        for (ObserverEvent event : values()) {
            if (event.wireName.equals(name)) return Optional.of(event);
        }
        return Optional.empty();
    }
}
