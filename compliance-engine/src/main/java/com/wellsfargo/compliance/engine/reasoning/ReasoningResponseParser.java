package com.wellsfargo.compliance.engine.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wellsfargo.compliance.engine.reasoning.dto.RuleCandidate;
import com.wellsfargo.compliance.engine.reasoning.dto.RuleCandidatesResponse;
import com.wellsfargo.compliance.engine.reasoning.dto.ViolationCandidate;
import com.wellsfargo.compliance.engine.reasoning.dto.ViolationCandidatesResponse;
import com.wellsfargo.compliance.error.ExtractionFailureException;
import com.wellsfargo.compliance.error.ExtractionFailureException.Reason;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Strict validation of reasoning answers.
 *
 * The whole answer must be one JSON object of the expected shape. Prose,
 * markdown fences, trailing content, unknown properties and missing arrays
 * are all rejected as {@link Reason#INVALID_RESPONSE}.
 */
@Component
public class ReasoningResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ReasoningResponseParser.class);

    private final ObjectMapper strictMapper;
    private final Validator validator;

    public ReasoningResponseParser(ObjectMapper objectMapper, Validator validator) {
        this.strictMapper = objectMapper.copy()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.validator = validator;
    }

    public List<ViolationCandidate> parseViolations(String response) throws ExtractionFailureException {
        return parse(response, ViolationCandidatesResponse.class).getViolations();
    }

    public List<RuleCandidate> parseRules(String response) throws ExtractionFailureException {
        return parse(response, RuleCandidatesResponse.class).getRules();
    }

    private <T> T parse(String response, Class<T> type) throws ExtractionFailureException {
        if (response == null || response.trim().isEmpty()) {
            throw new ExtractionFailureException(Reason.INVALID_RESPONSE, "Reasoning response is empty");
        }
        T parsed;
        try {
            parsed = strictMapper.readValue(response.trim(), type);
        } catch (JsonProcessingException e) {
            log.warn("Reasoning response does not match {}: {}", type.getSimpleName(), e.getOriginalMessage());
            throw new ExtractionFailureException(Reason.INVALID_RESPONSE,
                "Reasoning response does not match " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
        if (parsed == null) {
            throw new ExtractionFailureException(Reason.INVALID_RESPONSE, "Reasoning response is JSON null");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(parsed);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            throw new ExtractionFailureException(Reason.INVALID_RESPONSE,
                "Reasoning response failed validation: " + details);
        }
        return parsed;
    }
}
