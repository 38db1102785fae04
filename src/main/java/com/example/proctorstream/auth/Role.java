package com.example.proctorstream.auth;

import java.util.Locale;
import java.util.Optional;

public enum Role {
    STUDENT,
    OBSERVER;

    /**
     * Accepts the legacy "teacher" and "admin" role names as observers.
     */
    public static Optional<Role> fromClaim(String claim) {
        if (claim == null) return Optional.empty();
        switch (claim.trim().toLowerCase(Locale.ROOT)) {
            case "student":
                return Optional.of(STUDENT);
            case "observer":
            case "teacher":
            case "admin":
                return Optional.of(OBSERVER);
            default:
                return Optional.empty();
        }
    }

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
