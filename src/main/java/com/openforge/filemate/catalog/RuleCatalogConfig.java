package com.openforge.filemate.catalog;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * The rule catalog is read once at startup and shared read-only by every
 * classification decision of the run.
 */
@Configuration
@EnableConfigurationProperties(RulesProperties.class)
public class RuleCatalogConfig {

    @Bean
    public RuleCatalog ruleCatalog(RulesProperties properties) {
        return new RuleCatalogLoader().load(Path.of(properties.location()));
    }

    @Bean
    public GenericRuleTable genericRuleTable() {
        return GenericRuleTable.standard();
    }
}
