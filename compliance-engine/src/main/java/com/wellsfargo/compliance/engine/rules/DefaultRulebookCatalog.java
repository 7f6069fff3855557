package com.wellsfargo.compliance.engine.rules;

import com.wellsfargo.compliance.canonical.Rule;
import com.wellsfargo.compliance.canonical.enums.RuleProvenance;
import com.wellsfargo.compliance.canonical.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in, hand-curated rulebooks per scheme.
 *
 * Provides the static rule text used for evaluation when no rulebook has
 * been uploaded and the repository holds no rules, and the fixed default
 * rule set used by ingestion when structured extraction is unavailable.
 *
 * Immutable after construction; thread-safe.
 */
@Service
public class DefaultRulebookCatalog {

    private static final Logger log = LoggerFactory.getLogger(DefaultRulebookCatalog.class);

    private final Map<String, SchemeRulebook> rulebooks;

    public DefaultRulebookCatalog() {
        this(new DefaultRulebookLoader().load());
    }

    public DefaultRulebookCatalog(DefaultRulebookConfig config) {
        Map<String, SchemeRulebook> byScheme = new LinkedHashMap<>();
        if (config.getRulebooks() != null) {
            for (SchemeRulebook rulebook : config.getRulebooks()) {
                if (rulebook.getScheme() == null) {
                    log.warn("Skipping default rulebook without scheme");
                    continue;
                }
                byScheme.put(rulebook.getScheme().toUpperCase(), rulebook);
            }
        }
        this.rulebooks = Collections.unmodifiableMap(byScheme);
    }

    public boolean hasScheme(String scheme) {
        return scheme != null && rulebooks.containsKey(scheme.toUpperCase());
    }

    public Set<String> schemes() {
        return rulebooks.keySet();
    }

    /**
     * Static rule text of a scheme.
     *
     * @return the text, or empty when the scheme has no built-in rulebook
     */
    public Optional<String> getRulebookText(String scheme) {
        if (!hasScheme(scheme)) {
            return Optional.empty();
        }
        return Optional.ofNullable(rulebooks.get(scheme.toUpperCase()).getRulebookText());
    }

    /**
     * Create the fixed default rule set of a scheme.
     *
     * Each call returns fresh Rule instances stamped with the current time and
     * provenance DEFAULT. Unknown schemes yield an empty list.
     *
     * @param scheme scheme name (case-insensitive)
     * @return default rules in catalogue order
     */
    public List<Rule> createDefaultRules(String scheme) {
        if (!hasScheme(scheme)) {
            return Collections.emptyList();
        }

        String schemeKey = scheme.toUpperCase();
        SchemeRulebook rulebook = rulebooks.get(schemeKey);
        String createdAt = Instant.now().toString();
        List<Rule> rules = new ArrayList<>();

        for (DefaultRuleDefinition definition : rulebook.getRules()) {
            rules.add(Rule.builder()
                .id(definition.getId())
                .scheme(schemeKey)
                .category(definition.getCategory())
                .title(definition.getTitle())
                .description(definition.getDescription())
                .severity(Severity.coerce(definition.getSeverity()))
                .path(definition.getPath())
                .example(definition.getExample())
                .provenance(RuleProvenance.DEFAULT)
                .version(rulebook.getVersion())
                .createdAt(createdAt)
                .build());
        }

        log.debug("Created {} default rules for scheme {}", rules.size(), schemeKey);
        return rules;
    }
}
