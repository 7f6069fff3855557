package com.wellsfargo.compliance.error;

/**
 * Thrown when document bytes cannot be decoded into text.
 */
public class DocumentDecodeException extends ComplianceException {

    public DocumentDecodeException(String message) {
        super(message);
    }

    public DocumentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
