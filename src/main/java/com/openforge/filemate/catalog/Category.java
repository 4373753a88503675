package com.openforge.filemate.catalog;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * One classification category of the rule catalog.
 *
 * keywords       — matched as case-insensitive substrings of a document subject
 * targetPatterns — folder-name fragments, in preference order; the first one is
 *                  also the folder name used when the category has to create a folder
 * priority       — tie breaker between equally scored categories; lower wins
 */
public record Category(
        String name,
        List<String> keywords,
        List<String> targetPatterns,
        int priority
) {

    public static final int DEFAULT_PRIORITY = 99;

    public Category {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("category name must not be blank");
        }
        keywords       = distinctNonBlank(keywords);
        targetPatterns = distinctNonBlank(targetPatterns);
    }

    /**
     * Scores a subject against this category: matched keywords / total keywords.
     * A category without keywords never matches.
     */
    public CategoryMatch score(String subject) {
        if (keywords.isEmpty() || subject == null || subject.isBlank()) {
            return new CategoryMatch(this, 0.0, 0);
        }
        String haystack = subject.toLowerCase(Locale.ROOT);
        int matched = 0;
        for (String keyword : keywords) {
            if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                matched++;
            }
        }
        return new CategoryMatch(this, (double) matched / keywords.size(), matched);
    }

    /** True if at least one keyword occurs in the subject. */
    public boolean anyKeywordIn(String subject) {
        return score(subject).matchedKeywords() > 0;
    }

    /** First target pattern, used as the folder name for a brand-new category folder. */
    public String primaryPattern() {
        return targetPatterns.isEmpty() ? null : targetPatterns.get(0);
    }

    private static List<String> distinctNonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value.trim());
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }
}
