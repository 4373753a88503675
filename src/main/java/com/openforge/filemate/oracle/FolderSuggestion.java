package com.openforge.filemate.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FolderSuggestion(
        @JsonProperty("suggested_path") String  suggestedPath,
        @JsonProperty("create_new")     boolean createNew,
        @JsonProperty("reasoning")      String  reasoning
) {}
