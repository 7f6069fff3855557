package com.wellsfargo.compliance.engine.reasoning;

import com.wellsfargo.compliance.error.ReasoningException;

/**
 * External reasoning collaborator used to find violations, extract rules and
 * summarize rulebooks.
 *
 * Implementations return the raw JSON text of the answer; validation is done
 * by {@link ReasoningResponseParser}. Calls may be slow; callers go through
 * {@link ReasoningGateway}, which bounds every call with a timeout.
 */
public interface ReasoningClient {

    /**
     * Whether calls can be made at all. A disabled client is never called.
     */
    boolean isAvailable();

    /**
     * Propose violations of a record against rule text.
     *
     * @param scheme upper-case scheme name
     * @param ruleText rulebook or rendered rule text
     * @param recordJson canonical record serialized as JSON
     * @return raw JSON expected to match {@code {"violations":[...]}}
     */
    String proposeViolations(String scheme, String ruleText, String recordJson) throws ReasoningException;

    /**
     * Propose structured rules found in a chunk of rulebook text.
     *
     * @return raw JSON expected to match {@code {"rules":[...]}}
     */
    String proposeRules(String scheme, String ruleText) throws ReasoningException;

    /**
     * Summarize rulebook text in a few sentences.
     */
    String summarize(String text) throws ReasoningException;
}
