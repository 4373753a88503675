package com.openforge.filemate.catalog;

/**
 * Result of scoring one subject against one {@link Category}.
 */
public record CategoryMatch(
        Category category,
        double score,
        int matchedKeywords
) {

    /** Higher score wins; equal scores fall back to the lower priority value. */
    public boolean outranks(CategoryMatch other) {
        if (other == null) return true;
        int byScore = Double.compare(score, other.score);
        if (byScore != 0) return byScore > 0;
        return category.priority() < other.category.priority();
    }
}
