package com.wellsfargo.compliance.engine.evaluation;

import com.wellsfargo.compliance.canonical.enums.RulebookSourceKind;
import lombok.Value;

/**
 * Rule text chosen for an evaluation, together with where it came from.
 */
@Value
public class SelectedRuleSource {
    RulebookSourceKind kind;

    /**
     * Provenance tag, e.g. "uploaded-document:sepa.pdf".
     */
    String tag;

    /**
     * Rule text handed to the reasoning collaborator; may be empty for schemes without any rules.
     */
    String ruleText;
}
