package com.example.proctorstream.broadcast;

import com.example.proctorstream.auth.Role;

/**
 * Role filter applied to room members at delivery time. A session room holds the owner and
 * watching observers; {@link #STUDENTS} narrows a delivery to the owner.
 */
public enum Audience {
    EVERYONE,
    STUDENTS,
    OBSERVERS;

    public boolean admits(Role role) {
        switch (this) {
            case STUDENTS:
                return role == Role.STUDENT;
            case OBSERVERS:
                return role == Role.OBSERVER;
            case EVERYONE:
            default:
                return true;
        }
    }
}
