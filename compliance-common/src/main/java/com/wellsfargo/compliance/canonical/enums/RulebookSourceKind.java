package com.wellsfargo.compliance.canonical.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rule source that produced a compliance result, in descending order of trust.
 * 
 * The declaration order is significant: confidence assigned to a result must
 * never increase when moving down this list.
 */
public enum RulebookSourceKind {
    UPLOADED_DOCUMENT("uploaded-document"),
    RULE_LIBRARY("rule-library"),
    DEFAULT_RULEBOOK("default-rulebook"),
    RULE_BASED("rule-based"),
    FALLBACK_RULES("fallback-rules");

    private final String value;

    RulebookSourceKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Render the provenance tag carried on a result.
     * 
     * @param label document name, only used for UPLOADED_DOCUMENT
     * @return e.g. "uploaded-document:sepa_rulebook.pdf" or "rule-library"
     */
    public String tag(String label) {
        if (this == UPLOADED_DOCUMENT) {
            return value + ":" + (label != null ? label : "unnamed");
        }
        return value;
    }
}
