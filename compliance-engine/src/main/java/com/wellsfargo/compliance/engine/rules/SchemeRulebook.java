package com.wellsfargo.compliance.engine.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rulebook of one scheme: the static rule text used when nothing
 * was uploaded, and the curated rule set used when extraction is unavailable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemeRulebook {
    private String scheme;

    private String version;

    @JsonProperty("rulebook_text")
    private String rulebookText;

    @Builder.Default
    private List<DefaultRuleDefinition> rules = new ArrayList<>();
}
