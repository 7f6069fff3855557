package com.wellsfargo.compliance.canonical;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wellsfargo.compliance.canonical.enums.ComplianceStatus;
import com.wellsfargo.compliance.canonical.enums.RulebookSourceKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of evaluating one canonical record against a scheme's rules.
 * 
 * Status is COMPLIANT if and only if the violation list is empty.
 * The rulebook source tag records which rule source produced the result
 * so every outcome can be audited.
 *
 * Immutable: queue snapshots hand out the stored instance, so derived
 * values (e.g. the queue position) are applied with {@code toBuilder()}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceResult {
    @NotBlank
    String recordId;

    @NotBlank
    String scheme;

    /**
     * Amount echoed as a plain decimal string ("0.00" when absent).
     */
    String amount;

    String currency;

    String sender;

    String receiver;

    @NotNull
    ComplianceStatus status;

    List<Violation> violations;

    /**
     * Wall time spent evaluating, in milliseconds.
     */
    long elapsedMillis;

    /**
     * Confidence score assigned by provenance tier.
     */
    double confidence;

    /**
     * True when violations were proposed by the reasoning collaborator.
     */
    boolean aiPowered;

    /**
     * Provenance tag, e.g. "uploaded-document:sepa.pdf", "default-rulebook", "fallback-rules".
     */
    @NotBlank
    String rulebookSource;

    @NotNull
    RulebookSourceKind rulebookSourceKind;

    /**
     * Position in the validation queue, set only for queued evaluations.
     */
    Integer queuePosition;

    /**
     * ISO 8601 timestamp of when the evaluation finished.
     */
    String evaluatedAt;

    @Builder(toBuilder = true)
    private ComplianceResult(String recordId, String scheme, String amount, String currency, String sender,
                             String receiver, ComplianceStatus status, List<Violation> violations,
                             long elapsedMillis, double confidence, boolean aiPowered, String rulebookSource,
                             RulebookSourceKind rulebookSourceKind, Integer queuePosition, String evaluatedAt) {
        this.recordId = recordId;
        this.scheme = scheme;
        this.amount = amount;
        this.currency = currency;
        this.sender = sender;
        this.receiver = receiver;
        this.status = status;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
        this.elapsedMillis = elapsedMillis;
        this.confidence = confidence;
        this.aiPowered = aiPowered;
        this.rulebookSource = rulebookSource;
        this.rulebookSourceKind = rulebookSourceKind;
        this.queuePosition = queuePosition;
        this.evaluatedAt = evaluatedAt;
    }
}
