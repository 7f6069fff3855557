package com.wellsfargo.compliance.engine.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellsfargo.compliance.canonical.CanonicalPaymentRecord;
import com.wellsfargo.compliance.canonical.ComplianceResult;
import com.wellsfargo.compliance.canonical.Violation;
import com.wellsfargo.compliance.canonical.enums.ComplianceStatus;
import com.wellsfargo.compliance.canonical.enums.RulebookSourceKind;
import com.wellsfargo.compliance.canonical.enums.Severity;
import com.wellsfargo.compliance.engine.reasoning.ReasoningGateway;
import com.wellsfargo.compliance.engine.reasoning.ReasoningResponseParser;
import com.wellsfargo.compliance.engine.reasoning.dto.ViolationCandidate;
import com.wellsfargo.compliance.engine.rules.DefaultRulebookCatalog;
import com.wellsfargo.compliance.error.EvaluationFailureException;
import com.wellsfargo.compliance.error.ExtractionFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Compliance Evaluator.
 *
 * Evaluates one canonical record against the most trusted rule source of
 * its scheme:
 * 1. Selects the rule text (uploaded rulebook, rule library, default rulebook)
 * 2. Asks the reasoning collaborator for violations when it is available
 * 3. Falls back to {@link DeterministicComplianceChecks} when the collaborator
 *    is disabled, fails, times out or answers with invalid data
 * 4. Tags the result with the rule source that actually produced the violations
 *
 * Provenance tags:
 * - collaborator answered: the selected source tag
 * - collaborator failed: fallback-rules
 * - collaborator disabled: default-rulebook for catalogued schemes, rule-based otherwise
 */
@Service
public class ComplianceEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEvaluator.class);

    static final String DEFAULT_SCHEME = "SEPA";
    static final String ABSENT_AMOUNT = "0.00";

    static final String DEFAULT_RULE = "Rulebook requirement";
    static final String DEFAULT_ISSUE = "Compliance issue detected";
    static final String DEFAULT_IMPACT = "May cause processing issues";
    static final String DEFAULT_SUGGESTION = "Review payment details";

    private final RuleSourceSelector ruleSourceSelector;
    private final DefaultRulebookCatalog catalog;
    private final ReasoningGateway reasoningGateway;
    private final ReasoningResponseParser responseParser;
    private final DeterministicComplianceChecks deterministicChecks;
    private final ConfidencePolicy confidencePolicy;
    private final ObjectMapper objectMapper;

    public ComplianceEvaluator(RuleSourceSelector ruleSourceSelector,
                               DefaultRulebookCatalog catalog,
                               ReasoningGateway reasoningGateway,
                               ReasoningResponseParser responseParser,
                               DeterministicComplianceChecks deterministicChecks,
                               ConfidencePolicy confidencePolicy,
                               ObjectMapper objectMapper) {
        this.ruleSourceSelector = ruleSourceSelector;
        this.catalog = catalog;
        this.reasoningGateway = reasoningGateway;
        this.responseParser = responseParser;
        this.deterministicChecks = deterministicChecks;
        this.confidencePolicy = confidencePolicy;
        this.objectMapper = objectMapper;
    }

    /**
     * Evaluate a record.
     *
     * @param record canonical record
     * @param scheme scheme to evaluate against; null falls back to the record's scheme, then SEPA
     * @return the compliance result, never null
     * @throws EvaluationFailureException on unexpected errors
     */
    public ComplianceResult evaluate(CanonicalPaymentRecord record, String scheme) {
        if (record == null) {
            throw new IllegalArgumentException("Record is required for evaluation");
        }
        long start = System.nanoTime();
        String schemeKey = resolveScheme(record, scheme);

        SelectedRuleSource selected = ruleSourceSelector.select(schemeKey);
        List<Violation> violations;
        RulebookSourceKind kind;
        String tag;
        boolean aiPowered = false;

        if (reasoningGateway.isAvailable()) {
            try {
                violations = reasonViolations(schemeKey, selected, record);
                kind = selected.getKind();
                tag = selected.getTag();
                aiPowered = true;
            } catch (ExtractionFailureException e) {
                log.warn("Reasoning unavailable for record {} ({}), using fallback rules: {}",
                    record.getIdentifier(), e.getReason(), e.getMessage());
                violations = deterministicChecks.check(record, schemeKey);
                kind = RulebookSourceKind.FALLBACK_RULES;
                tag = kind.tag(null);
            }
        } else {
            violations = deterministicChecks.check(record, schemeKey);
            kind = catalog.hasScheme(schemeKey) ? RulebookSourceKind.DEFAULT_RULEBOOK : RulebookSourceKind.RULE_BASED;
            tag = kind.tag(null);
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        ComplianceResult result = ComplianceResult.builder()
            .recordId(record.getIdentifier())
            .scheme(schemeKey)
            .amount(echoAmount(record))
            .currency(record.getCurrency())
            .sender(record.getSenderReference())
            .receiver(record.getReceiverReference())
            .status(ComplianceStatus.fromViolationCount(violations.size()))
            .violations(violations)
            .elapsedMillis(elapsedMillis)
            .confidence(confidencePolicy.confidenceFor(kind))
            .aiPowered(aiPowered)
            .rulebookSource(tag)
            .rulebookSourceKind(kind)
            .evaluatedAt(Instant.now().toString())
            .build();

        log.debug("Evaluated record {} against {}: status={}, violations={}, source={}, {} ms",
            record.getIdentifier(), schemeKey, result.getStatus().getValue(), violations.size(), tag, elapsedMillis);
        return result;
    }

    private List<Violation> reasonViolations(String schemeKey, SelectedRuleSource selected,
                                             CanonicalPaymentRecord record) throws ExtractionFailureException {
        String recordJson;
        try {
            recordJson = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new EvaluationFailureException("Cannot serialize record " + record.getIdentifier(), e);
        }

        String response = reasoningGateway.proposeViolations(schemeKey, selected.getRuleText(), recordJson);
        List<ViolationCandidate> candidates = responseParser.parseViolations(response);

        List<Violation> violations = new ArrayList<>(candidates.size());
        for (ViolationCandidate candidate : candidates) {
            violations.add(Violation.builder()
                .severity(Severity.coerce(candidate.getSeverity()))
                .rule(orDefault(candidate.getRule(), DEFAULT_RULE))
                .issue(orDefault(candidate.getIssue(), DEFAULT_ISSUE))
                .impact(orDefault(candidate.getImpact(), DEFAULT_IMPACT))
                .suggestion(orDefault(candidate.getSuggestion(), DEFAULT_SUGGESTION))
                .path(candidate.getPath())
                .build());
        }
        return violations;
    }

    static String resolveScheme(CanonicalPaymentRecord record, String scheme) {
        if (scheme != null && !scheme.trim().isEmpty()) {
            return scheme.trim().toUpperCase();
        }
        if (record.getScheme() != null && !record.getScheme().trim().isEmpty()) {
            return record.getScheme().trim().toUpperCase();
        }
        return DEFAULT_SCHEME;
    }

    /**
     * Plain decimal text of the parsed amount, "0.00" when the record has none.
     */
    static String echoAmount(CanonicalPaymentRecord record) {
        return record.getAmount() != null ? record.getAmount().toPlainString() : ABSENT_AMOUNT;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value;
    }
}
