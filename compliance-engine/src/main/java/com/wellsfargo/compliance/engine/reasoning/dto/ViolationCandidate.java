package com.wellsfargo.compliance.engine.reasoning.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One violation as proposed by the reasoning collaborator. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViolationCandidate {
    private String severity;
    private String rule;
    private String issue;
    private String impact;
    private String suggestion;

    @JsonAlias({"xmlPath", "xml_path", "field"})
    private String path;
}
