package com.wellsfargo.compliance.error;

/**
 * The reasoning step was unavailable, timed out, failed, or answered with data
 * that does not match the expected schema.
 * 
 * Always recovered locally through deterministic fallback; never surfaced to
 * the caller as a hard error.
 */
public class ExtractionFailureException extends ComplianceException {

    public enum Reason {
        UNAVAILABLE,
        TIMEOUT,
        CALL_FAILED,
        INVALID_RESPONSE
    }

    private final Reason reason;

    public ExtractionFailureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExtractionFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
