package com.example.proctorstream.error;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_INPUT("invalid-input", HttpStatus.BAD_REQUEST),
    UNKNOWN_EVENT("unknown-event", HttpStatus.BAD_REQUEST),
    WRONG_ROLE("wrong-role", HttpStatus.FORBIDDEN),
    INSUFFICIENT_PERMISSION("insufficient-permission", HttpStatus.FORBIDDEN),
    SESSION_NOT_FOUND("session-not-found", HttpStatus.NOT_FOUND),
    SESSION_CLOSED("session-closed", HttpStatus.CONFLICT),
    INVALID_TRANSITION("invalid-transition", HttpStatus.CONFLICT),
    RATE_LIMITED("rate-limited", HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL("internal-error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String wireName;
    private final HttpStatus httpStatus;

    ErrorCode(String wireName, HttpStatus httpStatus) {
        this.wireName = wireName;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getWireName() { return wireName; }
    public HttpStatus getHttpStatus() { return httpStatus; }
}
