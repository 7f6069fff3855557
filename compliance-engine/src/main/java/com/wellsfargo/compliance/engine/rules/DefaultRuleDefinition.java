package com.wellsfargo.compliance.engine.rules;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One curated rule as declared in the default rulebook catalogue file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefaultRuleDefinition {
    private String id;

    private String category;

    private String title;

    private String description;

    private String severity;

    private String path;

    private String example;
}
