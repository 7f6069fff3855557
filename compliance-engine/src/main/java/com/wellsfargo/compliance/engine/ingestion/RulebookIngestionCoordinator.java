package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.canonical.Rule;
import com.wellsfargo.compliance.canonical.RulebookSource;
import com.wellsfargo.compliance.canonical.enums.RuleProvenance;
import com.wellsfargo.compliance.canonical.enums.Severity;
import com.wellsfargo.compliance.engine.reasoning.ReasoningGateway;
import com.wellsfargo.compliance.engine.reasoning.ReasoningResponseParser;
import com.wellsfargo.compliance.engine.reasoning.dto.RuleCandidate;
import com.wellsfargo.compliance.engine.rules.DefaultRulebookCatalog;
import com.wellsfargo.compliance.engine.rules.RuleRepository;
import com.wellsfargo.compliance.error.DocumentDecodeException;
import com.wellsfargo.compliance.error.ExtractionFailureException;
import com.wellsfargo.compliance.error.InsufficientDocumentTextException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rulebook Ingestion Coordinator.
 *
 * Turns an uploaded rulebook into a stored {@link RulebookSource} plus a set
 * of rules in the {@link RuleRepository}:
 * 1. Rejects text below the minimum length (nothing is stored)
 * 2. Summarizes the text, or keeps a leading excerpt
 * 3. Stores the rulebook, replacing the scheme's previous one
 * 4. Extracts structured rules chunk by chunk through the reasoning gateway
 * 5. Falls back to the scheme's default rule set when extraction is disabled,
 *    fails, or finds nothing
 * 6. Merges the rules into the repository (append or replace)
 *
 * Extraction failures are logged and counted, never propagated.
 */
@Service
public class RulebookIngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RulebookIngestionCoordinator.class);

    static final int SUMMARY_EXCERPT_LENGTH = 500;
    static final int LINES_PER_PAGE = 50;

    private static final String DEFAULT_CATEGORY = "General";
    private static final String DEFAULT_DESCRIPTION = "No description provided";

    private final RulebookSourceStore sourceStore;
    private final RuleRepository ruleRepository;
    private final DefaultRulebookCatalog catalog;
    private final ReasoningGateway reasoningGateway;
    private final ReasoningResponseParser responseParser;
    private final DocumentTextExtractor documentTextExtractor;
    private final IngestionSettings settings;

    private final AtomicLong extractionFailures = new AtomicLong();

    public RulebookIngestionCoordinator(RulebookSourceStore sourceStore,
                                        RuleRepository ruleRepository,
                                        DefaultRulebookCatalog catalog,
                                        ReasoningGateway reasoningGateway,
                                        ReasoningResponseParser responseParser,
                                        DocumentTextExtractor documentTextExtractor,
                                        IngestionSettings settings) {
        this.sourceStore = sourceStore;
        this.ruleRepository = ruleRepository;
        this.catalog = catalog;
        this.reasoningGateway = reasoningGateway;
        this.responseParser = responseParser;
        this.documentTextExtractor = documentTextExtractor;
        this.settings = settings;
        log.info("Rulebook ingestion initialized: minTextLength={}, chunkSize={}, maxChunks={}, mergePolicy={}",
            settings.getMinTextLength(), settings.getChunkSize(), settings.getMaxChunks(), settings.getMergePolicy());
    }

    /**
     * Decode an uploaded document and ingest its text.
     */
    public IngestionResult ingestDocument(String scheme, String filename, byte[] content)
            throws DocumentDecodeException, InsufficientDocumentTextException {
        String text = documentTextExtractor.extractText(content);
        return ingest(scheme, filename, text);
    }

    /**
     * Ingest raw rulebook text for a scheme.
     *
     * @param scheme scheme name (case-insensitive)
     * @param filename name or origin label of the document
     * @param rawDocumentText extracted document text
     * @return the stored source and the rules added to the repository
     * @throws InsufficientDocumentTextException if the text is too short to be a rulebook
     */
    public IngestionResult ingest(String scheme, String filename, String rawDocumentText)
            throws InsufficientDocumentTextException {
        if (scheme == null || scheme.trim().isEmpty()) {
            throw new IllegalArgumentException("Scheme is required for rulebook ingestion");
        }
        String schemeKey = scheme.trim().toUpperCase();
        String text = rawDocumentText == null ? "" : rawDocumentText;

        int usableLength = text.trim().length();
        if (usableLength < settings.getMinTextLength()) {
            log.warn("Rejected rulebook {} for scheme {}: {} characters, minimum {}",
                filename, schemeKey, usableLength, settings.getMinTextLength());
            throw new InsufficientDocumentTextException(usableLength, settings.getMinTextLength());
        }

        RulebookSource source = RulebookSource.builder()
            .scheme(schemeKey)
            .filename(filename)
            .text(text)
            .uploadedAt(Instant.now().toString())
            .pages(estimatePages(text))
            .textLength(text.length())
            .summary(summarize(schemeKey, text))
            .build();

        Optional<RulebookSource> replaced = sourceStore.put(source);
        log.info("Stored rulebook {} for scheme {} ({} characters, ~{} pages){}",
            filename, schemeKey, source.getTextLength(), source.getPages(),
            replaced.map(previous -> ", replacing " + previous.getFilename()).orElse(""));

        List<Rule> rules;
        RuleProvenance provenance;
        String fallbackReason = null;
        try {
            rules = extractRules(schemeKey, source);
            provenance = RuleProvenance.EXTRACTED_FROM_DOCUMENT;
            if (rules.isEmpty()) {
                fallbackReason = "Extraction found no rules";
            }
        } catch (ExtractionFailureException e) {
            rules = List.of();
            provenance = RuleProvenance.DEFAULT;
            fallbackReason = e.getMessage();
            if (e.getReason() != ExtractionFailureException.Reason.UNAVAILABLE) {
                extractionFailures.incrementAndGet();
                log.warn("Rule extraction failed for scheme {} ({}): {}", schemeKey, e.getReason(), e.getMessage());
            }
        }

        if (rules.isEmpty()) {
            rules = catalog.createDefaultRules(schemeKey);
            provenance = RuleProvenance.DEFAULT;
            log.info("Using {} default rules for scheme {}: {}", rules.size(), schemeKey, fallbackReason);
        }

        if (settings.getMergePolicy() == RuleMergePolicy.REPLACE) {
            ruleRepository.replaceRules(schemeKey, rules);
        } else {
            ruleRepository.addRules(rules);
        }

        log.info("Ingested rulebook {} for scheme {}: {} rules, provenance={}",
            filename, schemeKey, rules.size(), provenance.getValue());
        return IngestionResult.builder()
            .source(source)
            .rules(List.copyOf(rules))
            .provenance(provenance)
            .fallbackReason(fallbackReason)
            .build();
    }

    public List<RulebookSource> listSources() {
        return sourceStore.list();
    }

    public Optional<RulebookSource> getSource(String scheme) {
        return sourceStore.get(scheme);
    }

    /**
     * Remove the uploaded rulebook of a scheme. Rules already in the repository are kept.
     */
    public Optional<RulebookSource> deleteSource(String scheme) {
        Optional<RulebookSource> removed = sourceStore.remove(scheme);
        removed.ifPresent(source -> log.info("Deleted rulebook {} for scheme {}", source.getFilename(), source.getScheme()));
        return removed;
    }

    /**
     * Number of extraction attempts that failed since startup. Disabled extraction is not counted.
     */
    public long extractionFailures() {
        return extractionFailures.get();
    }

    private List<Rule> extractRules(String schemeKey, RulebookSource source) throws ExtractionFailureException {
        List<String> chunks = chunk(source.getText(), settings.getChunkSize(), settings.getMaxChunks());
        List<Rule> rules = new ArrayList<>();
        String createdAt = Instant.now().toString();
        int sequence = 0;

        for (int i = 0; i < chunks.size(); i++) {
            String response = reasoningGateway.proposeRules(schemeKey, chunks.get(i));
            List<RuleCandidate> candidates = responseParser.parseRules(response);
            log.debug("Chunk {}/{} of scheme {} yielded {} rule candidates", i + 1, chunks.size(), schemeKey,
                candidates.size());

            for (RuleCandidate candidate : candidates) {
                sequence++;
                String id = String.format("%s_%03d", schemeKey, sequence);
                rules.add(Rule.builder()
                    .id(id)
                    .scheme(schemeKey)
                    .category(orDefault(candidate.getCategory(), DEFAULT_CATEGORY))
                    .title(orDefault(candidate.getTitle(), "Rule " + id))
                    .description(orDefault(candidate.getDescription(), DEFAULT_DESCRIPTION))
                    .severity(Severity.coerce(candidate.getSeverity()))
                    .path(blankToNull(candidate.getPath()))
                    .example(blankToNull(candidate.getExample()))
                    .provenance(RuleProvenance.EXTRACTED_FROM_DOCUMENT)
                    .version(source.getFilename())
                    .createdAt(createdAt)
                    .build());
            }
        }
        return rules;
    }

    private String summarize(String schemeKey, String text) {
        try {
            return reasoningGateway.summarize(text).trim();
        } catch (ExtractionFailureException e) {
            if (e.getReason() != ExtractionFailureException.Reason.UNAVAILABLE) {
                log.warn("Summary failed for scheme {}, keeping excerpt: {}", schemeKey, e.getMessage());
            }
            return excerpt(text);
        }
    }

    static String excerpt(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= SUMMARY_EXCERPT_LENGTH ? trimmed : trimmed.substring(0, SUMMARY_EXCERPT_LENGTH);
    }

    static int estimatePages(String text) {
        int lines = text.split("\n", -1).length;
        return Math.max(1, lines / LINES_PER_PAGE);
    }

    /**
     * Split text into consecutive chunks of at most {@code chunkSize} characters, keeping the first {@code maxChunks}.
     */
    static List<String> chunk(String text, int chunkSize, int maxChunks) {
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < text.length() && chunks.size() < maxChunks; start += chunkSize) {
            chunks.add(text.substring(start, Math.min(text.length(), start + chunkSize)));
        }
        return chunks;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
