package com.wellsfargo.compliance.engine.reasoning;

import com.wellsfargo.compliance.error.ReasoningException;

/**
 * Reasoning client used when no collaborator is configured.
 *
 * Reports itself unavailable, so evaluation runs the deterministic checks
 * and ingestion falls back to the default rule sets.
 */
public class DisabledReasoningClient implements ReasoningClient {

    private static final String DISABLED = "Reasoning collaborator is disabled";

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String proposeViolations(String scheme, String ruleText, String recordJson) throws ReasoningException {
        throw new ReasoningException(DISABLED);
    }

    @Override
    public String proposeRules(String scheme, String ruleText) throws ReasoningException {
        throw new ReasoningException(DISABLED);
    }

    @Override
    public String summarize(String text) throws ReasoningException {
        throw new ReasoningException(DISABLED);
    }
}
