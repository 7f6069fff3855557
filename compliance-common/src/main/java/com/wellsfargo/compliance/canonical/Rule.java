package com.wellsfargo.compliance.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wellsfargo.compliance.canonical.enums.RuleProvenance;
import com.wellsfargo.compliance.canonical.enums.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

/**
 * A single compliance rule belonging to a scheme.
 * 
 * Identity is (scheme, id). Rules are never mutated in place; re-ingestion
 * produces new Rule instances with a new version.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Rule {
    /**
     * Rule identifier, unique within its scheme (e.g., "AT-T001", "SEPA_003").
     */
    @NotBlank
    String id;

    /**
     * Upper-case scheme name.
     */
    @NotBlank
    String scheme;

    /**
     * Grouping category (e.g., "Amount Validation", "IBAN Validation").
     */
    @NotBlank
    String category;

    @NotBlank
    String title;

    @NotBlank
    String description;

    @NotNull
    Severity severity;

    /**
     * Optional pointer into the record schema (e.g., "CdtTrfTxInf/ChrgBr").
     */
    String path;

    /**
     * Optional example of a non-conforming payment.
     */
    String example;

    @NotNull
    RuleProvenance provenance;

    /**
     * Rulebook version the rule was taken from.
     */
    String version;

    /**
     * ISO 8601 timestamp of when the rule was created.
     */
    String createdAt;
}
