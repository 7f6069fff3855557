package com.wellsfargo.compliance.error;

/**
 * Thrown when rulebook text is too short to be usable. The rulebook is not stored.
 */
public class InsufficientDocumentTextException extends ComplianceException {

    private final int textLength;
    private final int minimumLength;

    public InsufficientDocumentTextException(int textLength, int minimumLength) {
        super("Rulebook text too short: " + textLength + " characters, at least "
            + minimumLength + " required. Ensure the document is not a scanned image.");
        this.textLength = textLength;
        this.minimumLength = minimumLength;
    }

    public int getTextLength() {
        return textLength;
    }

    public int getMinimumLength() {
        return minimumLength;
    }
}
