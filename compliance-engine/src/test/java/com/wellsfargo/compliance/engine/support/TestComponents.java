package com.wellsfargo.compliance.engine.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wellsfargo.compliance.engine.evaluation.ComplianceEvaluator;
import com.wellsfargo.compliance.engine.evaluation.ConfidencePolicy;
import com.wellsfargo.compliance.engine.evaluation.DeterministicComplianceChecks;
import com.wellsfargo.compliance.engine.evaluation.RuleSourceSelector;
import com.wellsfargo.compliance.engine.ingestion.IngestionSettings;
import com.wellsfargo.compliance.engine.ingestion.PlainTextDocumentExtractor;
import com.wellsfargo.compliance.engine.ingestion.RulebookIngestionCoordinator;
import com.wellsfargo.compliance.engine.ingestion.RulebookSourceStore;
import com.wellsfargo.compliance.engine.reasoning.ReasoningClient;
import com.wellsfargo.compliance.engine.reasoning.ReasoningGateway;
import com.wellsfargo.compliance.engine.reasoning.ReasoningResponseParser;
import com.wellsfargo.compliance.engine.rules.DefaultRulebookCatalog;
import com.wellsfargo.compliance.engine.rules.RuleRepository;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

/**
 * Hand-wired engine components for tests that do not start Spring.
 */
public class TestComponents {

    private static final DefaultRulebookCatalog CATALOG = new DefaultRulebookCatalog();
    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    public final RuleRepository ruleRepository = new RuleRepository(VALIDATOR);
    public final RulebookSourceStore sourceStore = new RulebookSourceStore();
    public final DefaultRulebookCatalog catalog = CATALOG;
    public final ReasoningGateway gateway;
    public final ReasoningResponseParser parser = new ReasoningResponseParser(objectMapper, VALIDATOR);
    public final RulebookIngestionCoordinator ingestion;
    public final ComplianceEvaluator evaluator;

    public TestComponents(ReasoningClient client) {
        this(client, 2_000, IngestionSettings.defaults());
    }

    public TestComponents(ReasoningClient client, long timeoutMillis, IngestionSettings settings) {
        this.gateway = new ReasoningGateway(client, timeoutMillis);
        this.ingestion = new RulebookIngestionCoordinator(sourceStore, ruleRepository, catalog, gateway, parser,
            new PlainTextDocumentExtractor(), settings);
        this.evaluator = new ComplianceEvaluator(new RuleSourceSelector(sourceStore, ruleRepository, catalog),
            catalog, gateway, parser, new DeterministicComplianceChecks(), ConfidencePolicy.defaults(), objectMapper);
    }

    public static Validator validator() {
        return VALIDATOR;
    }
}
