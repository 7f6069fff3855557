package com.wellsfargo.compliance.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of evaluating one record.
 */
public enum ComplianceStatus {
    COMPLIANT("compliant"),
    NON_COMPLIANT("non-compliant");

    private final String value;

    ComplianceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ComplianceStatus fromViolationCount(int violations) {
        return violations == 0 ? COMPLIANT : NON_COMPLIANT;
    }
}
