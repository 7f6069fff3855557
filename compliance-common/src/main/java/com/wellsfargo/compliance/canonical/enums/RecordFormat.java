package com.wellsfargo.compliance.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of the inbound payload a canonical record was normalized from.
 */
public enum RecordFormat {
    FIELD_MAP("FIELD_MAP"),                  // Free-form key/value or JSON object
    ISO20022_PACS008("ISO20022_PACS008");    // ISO 20022 Customer Credit Transfer XML

    private final String value;

    RecordFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
