package com.example.proctorstream.auth;

import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Identity facts attached to a connection once the credential gate passes. Read-only for
 * the rest of the connection's life.
 */
@Value
@Builder
public class ConnectionPrincipal {
    String userId;
    Role role;
    @Builder.Default
    Set<Permission> permissions = Set.of();
    // session id bound in the token, students only
    String sessionId;

    public boolean isObserver() {
        return role == Role.OBSERVER;
    }

    public boolean hasPermission(Permission permission) {
        return isObserver()
                && (permissions.contains(Permission.SUPER_ADMIN) || permissions.contains(permission));
    }

    public void requirePermission(Permission permission) {
        if (!hasPermission(permission)) {
            throw ProctorException.insufficientPermission(permission.getClaimName());
        }
    }

    public void requireRole(Role required) {
        if (role != required) {
            throw new ProctorException(ErrorCode.WRONG_ROLE,
                    "Event requires role " + required.getWireName());
        }
    }
}
