package com.openforge.filemate.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param confidence       0..1 as reported by the model
 * @param suggestedFolder  optional folder hint; informational only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubjectSuggestion(
        @JsonProperty("subject")          String subject,
        @JsonProperty("confidence")       double confidence,
        @JsonProperty("reasoning")        String reasoning,
        @JsonProperty("suggested_folder") String suggestedFolder
) {}
