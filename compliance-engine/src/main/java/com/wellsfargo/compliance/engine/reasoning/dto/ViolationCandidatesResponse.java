package com.wellsfargo.compliance.engine.reasoning.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Expected shape: {@code {"violations":[...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViolationCandidatesResponse {

    @NotNull
    private List<@NotNull @Valid ViolationCandidate> violations;
}
