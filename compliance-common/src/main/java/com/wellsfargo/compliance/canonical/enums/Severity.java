package com.wellsfargo.compliance.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a compliance rule or a detected violation.
 * 
 * Only three levels exist. Values coming from external sources are coerced
 * into one of them; anything unrecognised becomes MEDIUM.
 */
public enum Severity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Coerce a free-text severity into the enumerated levels.
     * 
     * Accepts the canonical values case-insensitively plus a few common
     * synonyms ("critical", "major", "minor", "info").
     * 
     * @param raw severity text, may be null
     * @return matching severity, MEDIUM when absent or unrecognised
     */
    public static Severity coerce(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return MEDIUM;
        }
        switch (raw.trim().toLowerCase()) {
            case "high":
            case "critical":
            case "major":
                return HIGH;
            case "low":
            case "minor":
            case "info":
                return LOW;
            default:
                return MEDIUM;
        }
    }
}
