package com.example.proctorstream.auth;

/**
 * Handshake refusal. Terminal for the connection, unlike {@code ProctorException}.
 */
public class CredentialRejectedException extends RuntimeException {

    public enum Reason {
        MISSING_TOKEN("missing-token"),
        INVALID_TOKEN("invalid-token"),
        EXPIRED_TOKEN("expired-token");

        private final String wireName;

        Reason(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() { return wireName; }
    }

    private final Reason reason;

    public CredentialRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CredentialRejectedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
