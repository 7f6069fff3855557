package com.wellsfargo.compliance.engine.reasoning.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Expected shape: {@code {"rules":[...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleCandidatesResponse {

    @NotNull
    private List<@NotNull @Valid RuleCandidate> rules;
}
