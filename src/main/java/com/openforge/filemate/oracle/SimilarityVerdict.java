package com.openforge.filemate.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SimilarityVerdict(
        @JsonProperty("is_similar")       boolean similar,
        @JsonProperty("similarity_score") double  score,
        @JsonProperty("reasoning")        String  reasoning
) {}
