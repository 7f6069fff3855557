package com.wellsfargo.compliance.engine.evaluation;

import com.wellsfargo.compliance.canonical.enums.RulebookSourceKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Confidence score per rule source.
 *
 * Scores are percentages. Uploaded documents must score strictly above the
 * rule library, the rule library strictly above the default rulebook, and the
 * default rulebook strictly above fallback rules. Rule-based sits between the
 * default rulebook and fallback and may tie with either. A policy breaking
 * that order is rejected.
 */
public class ConfidencePolicy {

    private final Map<RulebookSourceKind, Double> scores;

    public ConfidencePolicy(double uploadedDocument, double ruleLibrary, double defaultRulebook,
                            double ruleBased, double fallbackRules) {
        Map<RulebookSourceKind, Double> byKind = new EnumMap<>(RulebookSourceKind.class);
        byKind.put(RulebookSourceKind.UPLOADED_DOCUMENT, uploadedDocument);
        byKind.put(RulebookSourceKind.RULE_LIBRARY, ruleLibrary);
        byKind.put(RulebookSourceKind.DEFAULT_RULEBOOK, defaultRulebook);
        byKind.put(RulebookSourceKind.RULE_BASED, ruleBased);
        byKind.put(RulebookSourceKind.FALLBACK_RULES, fallbackRules);

        for (RulebookSourceKind kind : RulebookSourceKind.values()) {
            double score = byKind.get(kind);
            if (score < 0.0 || score > 100.0) {
                throw new IllegalArgumentException("Confidence for " + kind.getValue()
                    + " must be within 0..100, got " + score);
            }
        }
        requireAbove(byKind, RulebookSourceKind.UPLOADED_DOCUMENT, RulebookSourceKind.RULE_LIBRARY);
        requireAbove(byKind, RulebookSourceKind.RULE_LIBRARY, RulebookSourceKind.DEFAULT_RULEBOOK);
        requireAbove(byKind, RulebookSourceKind.DEFAULT_RULEBOOK, RulebookSourceKind.FALLBACK_RULES);
        requireAtLeast(byKind, RulebookSourceKind.DEFAULT_RULEBOOK, RulebookSourceKind.RULE_BASED);
        requireAtLeast(byKind, RulebookSourceKind.RULE_BASED, RulebookSourceKind.FALLBACK_RULES);
        this.scores = Collections.unmodifiableMap(byKind);
    }

    public static ConfidencePolicy defaults() {
        return new ConfidencePolicy(99.5, 99.3, 99.0, 95.0, 90.0);
    }

    public double confidenceFor(RulebookSourceKind kind) {
        return scores.get(kind);
    }

    private static void requireAbove(Map<RulebookSourceKind, Double> byKind,
                                     RulebookSourceKind higher, RulebookSourceKind lower) {
        if (byKind.get(higher) <= byKind.get(lower)) {
            throw new IllegalArgumentException("Confidence for " + higher.getValue() + " ("
                + byKind.get(higher) + ") must be greater than for " + lower.getValue()
                + " (" + byKind.get(lower) + ")");
        }
    }

    private static void requireAtLeast(Map<RulebookSourceKind, Double> byKind,
                                       RulebookSourceKind higher, RulebookSourceKind lower) {
        if (byKind.get(higher) < byKind.get(lower)) {
            throw new IllegalArgumentException("Confidence for " + lower.getValue() + " ("
                + byKind.get(lower) + ") exceeds the confidence of " + higher.getValue()
                + " (" + byKind.get(higher) + ")");
        }
    }
}
