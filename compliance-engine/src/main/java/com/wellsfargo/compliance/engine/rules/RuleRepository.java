package com.wellsfargo.compliance.engine.rules;

import com.wellsfargo.compliance.canonical.Rule;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * In-memory store of rules, keyed by scheme then category.
 *
 * Writers take the write lock; readers take the read lock and receive
 * immutable copies, so a reader never observes a partially applied
 * {@link #addRules} or {@link #replaceRules}. Scheme keys are upper-cased.
 * Appending never de-duplicates; use {@link #findRule} first when needed.
 *
 * Every rule is checked against its bean constraints before anything is
 * stored; a missing category becomes "General". A batch containing one
 * invalid rule is rejected as a whole.
 */
@Repository
public class RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

    private static final Comparator<Rule> RULE_ORDER =
        Comparator.comparing(Rule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final String DEFAULT_CATEGORY = "General";

    private final Map<String, Map<String, List<Rule>>> rulesByScheme = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Validator validator;

    public RuleRepository(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws IllegalArgumentException if the rule violates its constraints
     */
    public void addRule(Rule rule) {
        addRules(Collections.singletonList(rule));
    }

    /**
     * Append rules in one atomic step. Each rule lands in the bucket of its own scheme.
     */
    public void addRules(Collection<Rule> rules) {
        if (rules == null || rules.isEmpty()) {
            return;
        }
        List<Rule> checked = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            checked.add(checkRule(rule));
        }
        lock.writeLock().lock();
        try {
            for (Rule rule : checked) {
                appendLocked(rule);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added {} rules", rules.size());
    }

    /**
     * Swap every rule of a scheme for the given rules in one atomic step.
     * Rules whose own scheme differs from {@code scheme} are re-keyed to it.
     */
    public void replaceRules(String scheme, Collection<Rule> rules) {
        String key = schemeKey(scheme);
        List<Rule> checked = new ArrayList<>();
        if (rules != null) {
            for (Rule rule : rules) {
                if (rule == null) {
                    throw new IllegalArgumentException("Rule is required");
                }
                checked.add(checkRule(key.equals(rule.getScheme()) ? rule : rule.toBuilder().scheme(key).build()));
            }
        }
        lock.writeLock().lock();
        try {
            rulesByScheme.remove(key);
            for (Rule rule : checked) {
                appendLocked(rule);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Replaced rules of scheme {} with {} rules", key, rules == null ? 0 : rules.size());
    }

    /**
     * Snapshot of a scheme's rules grouped by category, in insertion order.
     *
     * @return immutable map, empty when the scheme has no rules
     */
    public Map<String, List<Rule>> getRules(String scheme) {
        String key = schemeKey(scheme);
        lock.readLock().lock();
        try {
            Map<String, List<Rule>> categories = rulesByScheme.get(key);
            if (categories == null) {
                return Collections.emptyMap();
            }
            Map<String, List<Rule>> copy = new LinkedHashMap<>();
            categories.forEach((category, bucket) -> copy.put(category, List.copyOf(bucket)));
            return Collections.unmodifiableMap(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Every stored rule across all schemes. Each rule carries its scheme.
     */
    public List<Rule> getAllRules() {
        lock.readLock().lock();
        try {
            List<Rule> all = new ArrayList<>();
            for (Map<String, List<Rule>> categories : rulesByScheme.values()) {
                categories.values().forEach(all::addAll);
            }
            return Collections.unmodifiableList(all);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasRules(String scheme) {
        String key = schemeKey(scheme);
        lock.readLock().lock();
        try {
            Map<String, List<Rule>> categories = rulesByScheme.get(key);
            return categories != null && categories.values().stream().anyMatch(bucket -> !bucket.isEmpty());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * First rule of a scheme with the given id, in insertion order.
     */
    public Optional<Rule> findRule(String scheme, String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = schemeKey(scheme);
        lock.readLock().lock();
        try {
            Map<String, List<Rule>> categories = rulesByScheme.get(key);
            if (categories == null) {
                return Optional.empty();
            }
            return categories.values().stream()
                .flatMap(List::stream)
                .filter(rule -> id.equals(rule.getId()))
                .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int countRules() {
        lock.readLock().lock();
        try {
            int count = 0;
            for (Map<String, List<Rule>> categories : rulesByScheme.values()) {
                for (List<Rule> bucket : categories.values()) {
                    count += bucket.size();
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove all rules of a scheme.
     *
     * @return number of rules removed
     */
    public int deleteScheme(String scheme) {
        String key = schemeKey(scheme);
        lock.writeLock().lock();
        try {
            Map<String, List<Rule>> removed = rulesByScheme.remove(key);
            int count = removed == null ? 0 : removed.values().stream().mapToInt(List::size).sum();
            log.info("Deleted {} rules of scheme {}", count, key);
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            rulesByScheme.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Render a scheme's rules as plain text for the reasoning prompt.
     *
     * Categories are sorted alphabetically, rules by id and then by creation
     * order, so identical stored state always renders identical text.
     *
     * @return rendered text, or empty string when the scheme has no rules
     */
    public String renderAsText(String scheme) {
        Map<String, List<Rule>> sorted = new TreeMap<>(getRules(scheme));
        if (sorted.isEmpty()) {
            return "";
        }

        StringBuilder text = new StringBuilder();
        text.append(schemeKey(scheme)).append(" Compliance Rules\n\n");
        for (Map.Entry<String, List<Rule>> entry : sorted.entrySet()) {
            text.append("## ").append(entry.getKey()).append('\n');
            List<Rule> rules = new ArrayList<>(entry.getValue());
            // stable sort keeps creation order among equal ids
            rules.sort(RULE_ORDER);
            for (Rule rule : rules) {
                text.append("- [").append(rule.getId()).append("] ")
                    .append(rule.getTitle())
                    .append(" (").append(rule.getSeverity().getValue()).append("): ")
                    .append(rule.getDescription());
                if (rule.getPath() != null) {
                    text.append(" Path: ").append(rule.getPath());
                }
                text.append('\n');
            }
            text.append('\n');
        }
        return text.toString();
    }

    private Rule checkRule(Rule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("Rule is required");
        }
        Rule candidate = rule.getCategory() == null || rule.getCategory().trim().isEmpty()
            ? rule.toBuilder().category(DEFAULT_CATEGORY).build()
            : rule;
        Set<ConstraintViolation<Rule>> violations = validator.validate(candidate);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid rule " + rule.getId() + ": " + details);
        }
        return candidate;
    }

    private void appendLocked(Rule rule) {
        rulesByScheme
            .computeIfAbsent(schemeKey(rule.getScheme()), k -> new LinkedHashMap<>())
            .computeIfAbsent(rule.getCategory(), c -> new ArrayList<>())
            .add(rule);
    }

    static String schemeKey(String scheme) {
        return scheme == null ? "" : scheme.trim().toUpperCase();
    }
}
