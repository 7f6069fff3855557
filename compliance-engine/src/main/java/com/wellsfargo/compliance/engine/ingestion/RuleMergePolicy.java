package com.wellsfargo.compliance.engine.ingestion;

/**
 * How rules from a new ingestion are combined with the rules already stored
 * for the scheme.
 */
public enum RuleMergePolicy {
    /**
     * Add the new rules next to the existing ones.
     */
    APPEND,
    /**
     * Drop the scheme's existing rules and keep only the new ones.
     */
    REPLACE
}
