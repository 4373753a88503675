package com.openforge.filemate.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location of the classification rule file.
 *
 * application.yml:
 *
 * filemate:
 *   rules:
 *     location: config/classification_rules.yaml
 */
@ConfigurationProperties(prefix = "filemate.rules")
public record RulesProperties(
        @DefaultValue("config/classification_rules.yaml") String location
) {}
