package com.wellsfargo.compliance.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a stored rule came from.
 */
public enum RuleProvenance {
    EXTRACTED_FROM_DOCUMENT("extracted-from-document"),  // Structured extraction from an uploaded rulebook
    DEFAULT("default"),                                  // Built-in curated rule set
    MANUAL("manual");                                    // Added by an operator

    private final String value;

    RuleProvenance(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
