package com.wellsfargo.compliance.error;

/**
 * Thrown when an inbound payload cannot be normalized into any recognised shape.
 */
public class MalformedRecordException extends ComplianceException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
