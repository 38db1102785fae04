package com.example.proctorstream.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-facing failure of a real-time operation. Carries a stable {@link ErrorCode}
 * that is sent back on the socket or mapped to an HTTP status.
 */
public class ProctorException extends RuntimeException {

    private final ErrorCode code;

    public ProctorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static ProctorException invalidInput(String message) {
        return new ProctorException(ErrorCode.INVALID_INPUT, message);
    }

    public static ProctorException sessionNotFound(String sessionId) {
        return new ProctorException(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }

    public static ProctorException sessionClosed(String sessionId) {
        return new ProctorException(ErrorCode.SESSION_CLOSED, "Session is no longer accepting events: " + sessionId);
    }

    public static ProctorException insufficientPermission(String permission) {
        return new ProctorException(ErrorCode.INSUFFICIENT_PERMISSION, "Permission required: " + permission);
    }

    public ErrorCode getCode() { return code; }

    public Map<String, Object> toMap() {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code.getWireName());
        error.put("message", getMessage());
        return error;
    }
}
