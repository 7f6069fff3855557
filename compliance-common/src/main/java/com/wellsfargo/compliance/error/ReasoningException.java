package com.wellsfargo.compliance.error;

/**
 * Raised by a reasoning collaborator when a call cannot be completed.
 */
public class ReasoningException extends ComplianceException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
