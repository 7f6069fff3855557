package com.wellsfargo.compliance.engine.rules;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the default rulebook catalogue file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefaultRulebookConfig {
    private String version;

    @Builder.Default
    private List<SchemeRulebook> rulebooks = new ArrayList<>();
}
