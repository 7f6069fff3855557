package com.wellsfargo.compliance.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wellsfargo.compliance.canonical.enums.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * One detected non-conformance of a record against a rule.
 * 
 * Has no identity beyond its position in a result's violation list.
 * Immutable, so a violation can be shared between result snapshots.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Violation {
    @NotNull
    @Builder.Default
    Severity severity = Severity.MEDIUM;

    /**
     * Rule reference (rule id or free-text rulebook section).
     */
    @NotBlank
    String rule;

    /**
     * What is wrong with the record.
     */
    @NotBlank
    String issue;

    /**
     * Business impact (delay, rejection, cost).
     */
    @NotBlank
    String impact;

    /**
     * Remediation suggestion.
     */
    @NotBlank
    String suggestion;

    /**
     * Optional structural path of the offending field.
     */
    String path;
}
