package com.openforge.filemate.catalog;

/**
 * The {@code strategy} block of the rule catalog.
 *
 * @param semanticThreshold minimum keyword score for a category to qualify (0..1)
 * @param allowNewFolders   whether a qualifying category may create its own folder
 *                          when the catalog has none matching its patterns
 * @param forceExisting     instructs the oracle that only existing folders are acceptable;
 *                          reported in structure.md
 */
public record ClassificationStrategy(
        double semanticThreshold,
        boolean allowNewFolders,
        boolean forceExisting
) {

    public static final double DEFAULT_SEMANTIC_THRESHOLD = 0.3;

    public static ClassificationStrategy defaults() {
        return new ClassificationStrategy(DEFAULT_SEMANTIC_THRESHOLD, true, true);
    }

    public ClassificationStrategy {
        if (Double.isNaN(semanticThreshold) || semanticThreshold < 0.0 || semanticThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "semantic_threshold must be within [0, 1], got " + semanticThreshold);
        }
    }
}
