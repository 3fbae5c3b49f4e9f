package com.shortly.backend.modules.auth.application;

/**
 * Raised when a token cannot be trusted. Callers treat every reason as "not authenticated";
 * the reason exists for logging.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        INVALID_SIGNATURE,
        EXPIRED,
        MALFORMED,
        WRONG_TYPE
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
