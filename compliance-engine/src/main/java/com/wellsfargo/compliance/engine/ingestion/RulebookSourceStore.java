package com.wellsfargo.compliance.engine.ingestion;

import com.wellsfargo.compliance.canonical.RulebookSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The active uploaded rulebook per scheme. A new upload replaces the old one in a single put.
 */
@Component
public class RulebookSourceStore {

    private final Map<String, RulebookSource> sources = new ConcurrentHashMap<>();

    /**
     * @return the rulebook that was replaced, if any
     */
    public Optional<RulebookSource> put(RulebookSource source) {
        return Optional.ofNullable(sources.put(key(source.getScheme()), source));
    }

    public Optional<RulebookSource> get(String scheme) {
        if (scheme == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sources.get(key(scheme)));
    }

    public List<RulebookSource> list() {
        List<RulebookSource> all = new ArrayList<>(sources.values());
        all.sort(Comparator.comparing(RulebookSource::getScheme));
        return all;
    }

    public Optional<RulebookSource> remove(String scheme) {
        if (scheme == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sources.remove(key(scheme)));
    }

    public void clear() {
        sources.clear();
    }

    private static String key(String scheme) {
        return scheme.trim().toUpperCase();
    }
}
