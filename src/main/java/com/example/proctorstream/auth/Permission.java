package com.example.proctorstream.auth;

import java.util.Arrays;
import java.util.Optional;

public enum Permission {
    MONITOR("monitor_sessions"),
    INTERVENE("send_interventions"),
    TERMINATE("terminate_sessions"),
    SCREENSHOT("request_screenshots"),
    BULK("bulk_actions"),
    MANAGE_SETTINGS("manage_settings"),
    // implies every other permission
    SUPER_ADMIN("super_admin");

    private final String claimName;

    Permission(String claimName) {
        this.claimName = claimName;
    }

    public String getClaimName() { return claimName; }

    public static Optional<Permission> fromClaim(String name) {
        return Arrays.stream(values())
                .filter(p -> p.claimName.equalsIgnoreCase(name == null ? "" : name.trim()))
                .findFirst();
    }
}
