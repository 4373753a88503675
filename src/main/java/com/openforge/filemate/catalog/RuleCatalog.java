package com.openforge.filemate.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only rule table: categories in declaration order, the ordered list of
 * "generic" fallback folder names, and the classification strategy.
 *
 * Loaded once per run by {@link RuleCatalogLoader}; never mutated afterwards.
 */
public final class RuleCatalog {

    private final Map<String, Category> categories;
    private final List<String>          fallbackFolders;
    private final ClassificationStrategy strategy;

    public RuleCatalog(Collection<Category> categories,
                       List<String> fallbackFolders,
                       ClassificationStrategy strategy) {
        Map<String, Category> byName = new LinkedHashMap<>();
        for (Category category : categories) {
            byName.put(category.name(), category);
        }
        this.categories      = Collections.unmodifiableMap(byName);
        this.fallbackFolders = fallbackFolders == null ? List.of() : List.copyOf(fallbackFolders);
        this.strategy        = strategy == null ? ClassificationStrategy.defaults() : strategy;
    }

    public Collection<Category> categories() {
        return categories.values();
    }

    public Optional<Category> category(String name) {
        return Optional.ofNullable(categories.get(name));
    }

    public List<String> fallbackFolders() {
        return fallbackFolders;
    }

    public ClassificationStrategy strategy() {
        return strategy;
    }

    public int size() {
        return categories.size();
    }

    /**
     * Best category whose score reaches the strategy threshold.
     * Equal scores are broken by priority, then by declaration order.
     */
    public Optional<CategoryMatch> bestMatch(String subject) {
        return bestMatch(subject, strategy.semanticThreshold());
    }

    /** Same as {@link #bestMatch(String)} with an explicit threshold; at least one keyword must hit. */
    public Optional<CategoryMatch> bestMatch(String subject, double threshold) {
        CategoryMatch best = null;
        for (Category category : categories.values()) {
            CategoryMatch match = category.score(subject);
            if (match.matchedKeywords() == 0 || match.score() < threshold) {
                continue;
            }
            if (match.outranks(best)) {
                best = match;
            }
        }
        return Optional.ofNullable(best);
    }
}
