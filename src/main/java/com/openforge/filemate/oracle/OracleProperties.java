package com.openforge.filemate.oracle;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Prompt budgets for oracle requests, in characters of document text.
 *
 * filemate:
 *   oracle:
 *     content-budget: 3000      # subject extraction
 *     similarity-budget: 2000   # per side of a content comparison
 *     similarity-threshold: 0.7
 */
@Validated
@ConfigurationProperties(prefix = "filemate.oracle")
public record OracleProperties(
        @DefaultValue("3000") @Min(100) int contentBudget,
        @DefaultValue("2000") @Min(100) int similarityBudget,
        @DefaultValue("0.7") double similarityThreshold
) {

    public static OracleProperties defaults() {
        return new OracleProperties(3000, 2000, 0.7);
    }
}
