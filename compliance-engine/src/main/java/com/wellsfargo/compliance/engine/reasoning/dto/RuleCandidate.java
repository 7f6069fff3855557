package com.wellsfargo.compliance.engine.reasoning.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One rule as proposed by the reasoning collaborator.
 *
 * Missing fields are defaulted during ingestion; the id is always
 * re-assigned so that ids are unique within the scheme.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCandidate {
    private String id;
    private String category;
    private String title;
    private String description;
    private String severity;

    @JsonAlias({"xmlPath", "xml_path"})
    private String path;

    private String example;
}
