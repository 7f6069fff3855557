package com.wellsfargo.compliance.engine.evaluation;

import com.wellsfargo.compliance.canonical.RulebookSource;
import com.wellsfargo.compliance.canonical.enums.RulebookSourceKind;
import com.wellsfargo.compliance.engine.ingestion.RulebookSourceStore;
import com.wellsfargo.compliance.engine.rules.DefaultRulebookCatalog;
import com.wellsfargo.compliance.engine.rules.RuleRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the most trusted rule text available for a scheme:
 * uploaded rulebook, then the rule library, then the built-in default rulebook.
 */
@Component
public class RuleSourceSelector {

    private final RulebookSourceStore sourceStore;
    private final RuleRepository ruleRepository;
    private final DefaultRulebookCatalog catalog;

    public RuleSourceSelector(RulebookSourceStore sourceStore, RuleRepository ruleRepository,
                              DefaultRulebookCatalog catalog) {
        this.sourceStore = sourceStore;
        this.ruleRepository = ruleRepository;
        this.catalog = catalog;
    }

    public SelectedRuleSource select(String scheme) {
        Optional<RulebookSource> uploaded = sourceStore.get(scheme);
        if (uploaded.isPresent()) {
            RulebookSource source = uploaded.get();
            return new SelectedRuleSource(RulebookSourceKind.UPLOADED_DOCUMENT,
                RulebookSourceKind.UPLOADED_DOCUMENT.tag(source.getFilename()), source.getText());
        }

        if (ruleRepository.hasRules(scheme)) {
            return new SelectedRuleSource(RulebookSourceKind.RULE_LIBRARY,
                RulebookSourceKind.RULE_LIBRARY.tag(null), ruleRepository.renderAsText(scheme));
        }

        return new SelectedRuleSource(RulebookSourceKind.DEFAULT_RULEBOOK,
            RulebookSourceKind.DEFAULT_RULEBOOK.tag(null), catalog.getRulebookText(scheme).orElse(""));
    }
}
