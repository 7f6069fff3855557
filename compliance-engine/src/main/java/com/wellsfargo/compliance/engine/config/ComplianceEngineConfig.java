package com.wellsfargo.compliance.engine.config;

import com.wellsfargo.compliance.engine.evaluation.ConfidencePolicy;
import com.wellsfargo.compliance.engine.ingestion.DocumentTextExtractor;
import com.wellsfargo.compliance.engine.ingestion.IngestionSettings;
import com.wellsfargo.compliance.engine.ingestion.PdfDocumentExtractor;
import com.wellsfargo.compliance.engine.ingestion.PlainTextDocumentExtractor;
import com.wellsfargo.compliance.engine.ingestion.RoutingDocumentTextExtractor;
import com.wellsfargo.compliance.engine.ingestion.RuleMergePolicy;
import com.wellsfargo.compliance.engine.reasoning.DisabledReasoningClient;
import com.wellsfargo.compliance.engine.reasoning.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring of the pluggable collaborators and the tunables of the engine.
 *
 * Configuration Properties:
 * - compliance.ingestion.min-text-length: shortest usable rulebook text (default: 100)
 * - compliance.ingestion.chunk-size: characters per extraction chunk (default: 12000)
 * - compliance.ingestion.max-chunks: chunks sent for extraction (default: 2)
 * - compliance.ingestion.rule-merge-policy: APPEND or REPLACE (default: APPEND)
 * - compliance.confidence.*: confidence per rule source, must not increase with lower trust
 *
 * The reasoning collaborator defaults to {@link DisabledReasoningClient}; a
 * deployment provides its own {@link ReasoningClient} bean marked primary.
 */
@Configuration
public class ComplianceEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEngineConfig.class);

    @Bean
    public ReasoningClient reasoningClient() {
        log.info("No reasoning collaborator configured, evaluations use deterministic checks");
        return new DisabledReasoningClient();
    }

    @Bean
    public DocumentTextExtractor documentTextExtractor() {
        return new RoutingDocumentTextExtractor(new PdfDocumentExtractor(), new PlainTextDocumentExtractor());
    }

    @Bean
    public IngestionSettings ingestionSettings(
            @Value("${compliance.ingestion.min-text-length:100}") int minTextLength,
            @Value("${compliance.ingestion.chunk-size:12000}") int chunkSize,
            @Value("${compliance.ingestion.max-chunks:2}") int maxChunks,
            @Value("${compliance.ingestion.rule-merge-policy:APPEND}") RuleMergePolicy mergePolicy) {
        if (minTextLength < 0 || chunkSize < 1 || maxChunks < 1) {
            throw new IllegalArgumentException("Invalid ingestion settings: minTextLength=" + minTextLength
                + ", chunkSize=" + chunkSize + ", maxChunks=" + maxChunks);
        }
        return IngestionSettings.builder()
            .minTextLength(minTextLength)
            .chunkSize(chunkSize)
            .maxChunks(maxChunks)
            .mergePolicy(mergePolicy)
            .build();
    }

    @Bean
    public ConfidencePolicy confidencePolicy(
            @Value("${compliance.confidence.uploaded-document:99.5}") double uploadedDocument,
            @Value("${compliance.confidence.rule-library:99.3}") double ruleLibrary,
            @Value("${compliance.confidence.default-rulebook:99.0}") double defaultRulebook,
            @Value("${compliance.confidence.rule-based:95.0}") double ruleBased,
            @Value("${compliance.confidence.fallback-rules:90.0}") double fallbackRules) {
        return new ConfidencePolicy(uploadedDocument, ruleLibrary, defaultRulebook, ruleBased, fallbackRules);
    }
}
