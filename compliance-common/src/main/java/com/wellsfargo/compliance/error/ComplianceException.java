package com.wellsfargo.compliance.error;

/**
 * Base class of the classified, recoverable compliance errors.
 * 
 * Subclasses are checked: callers either surface them (malformed input,
 * unusable rulebook text) or recover locally (extraction failures).
 */
public abstract class ComplianceException extends Exception {

    protected ComplianceException(String message) {
        super(message);
    }

    protected ComplianceException(String message, Throwable cause) {
        super(message, cause);
    }
}
