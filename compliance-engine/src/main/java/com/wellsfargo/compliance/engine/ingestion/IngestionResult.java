package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.canonical.Rule;
import com.wellsfargo.compliance.canonical.RulebookSource;
import com.wellsfargo.compliance.canonical.enums.RuleProvenance;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one rulebook ingestion.
 */
@Value
@Builder
public class IngestionResult {
    RulebookSource source;

    /**
     * Rules added to the repository by this ingestion.
     */
    List<Rule> rules;

    /**
     * EXTRACTED_FROM_DOCUMENT when the collaborator produced the rules,
     * DEFAULT when the scheme's default rule set was used instead.
     */
    RuleProvenance provenance;

    /**
     * Why extraction was not used; null when rules were extracted.
     */
    String fallbackReason;

    public boolean isFallback() {
        return provenance == RuleProvenance.DEFAULT;
    }
}
