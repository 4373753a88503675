package com.openforge.filemate.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads classification_rules.yaml into a {@link RuleCatalog}.
 *
 * File layout:
 *
 *   classification_rules:
 *     运维管理:
 *       keywords: [运维, 部署, 监控]
 *       target_patterns: [DevOps运维, 运维]     # "targetPatterns" is accepted too
 *       priority: 1
 *   fallback_folders: [文档, 其他, misc]
 *   strategy:
 *     semantic_threshold: 0.3
 *     allow_new_folders: true
 *     force_existing: true
 *
 * A missing file yields the built-in rule set.  A file that exists but cannot be
 * parsed also falls back to the built-in set, with an error in the log; sections
 * that are absent from a valid file are filled from the built-in defaults.
 */
@Slf4j
public class RuleCatalogLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public RuleCatalog load(Path location) {
        if (location == null || !Files.isRegularFile(location)) {
            log.warn("[Rules] Rule file {} not found — using built-in rules", location);
            return DefaultRuleCatalog.create();
        }
        try (InputStream in = Files.newInputStream(location)) {
            RuleCatalog catalog = parse(in);
            log.info("[Rules] Loaded {} categories from {}", catalog.size(), location);
            return catalog;
        } catch (IOException | RuntimeException e) {
            log.error("[Rules] Failed to load {}: {} — using built-in rules", location, e.getMessage());
            return DefaultRuleCatalog.create();
        }
    }

    /**
     * Parses a rule document. Errors are thrown as {@link RuleCatalogException};
     * only {@link #load(Path)} converts them into the built-in fallback.
     */
    public RuleCatalog parse(InputStream in) {
        RuleDocument document;
        try {
            document = yamlMapper.readValue(in, RuleDocument.class);
        } catch (IOException e) {
            throw new RuleCatalogException("Malformed rule document: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new RuleCatalogException("Rule document is empty");
        }

        List<Category> categories = new ArrayList<>();
        if (document.classificationRules() == null || document.classificationRules().isEmpty()) {
            categories.addAll(DefaultRuleCatalog.categories());
        } else {
            document.classificationRules().forEach((name, rule) -> {
                if (rule == null) {
                    log.warn("[Rules] Category {} has no body — skipped", name);
                    return;
                }
                categories.add(new Category(name,
                        rule.keywords(),
                        rule.targetPatterns(),
                        rule.priority() == null ? Category.DEFAULT_PRIORITY : rule.priority()));
            });
        }

        List<String> fallbackFolders = document.fallbackFolders() == null
                ? DefaultRuleCatalog.fallbackFolders()
                : document.fallbackFolders();

        ClassificationStrategy defaults = ClassificationStrategy.defaults();
        StrategyBlock block = document.strategy();
        ClassificationStrategy strategy = block == null ? defaults : new ClassificationStrategy(
                block.semanticThreshold() == null ? defaults.semanticThreshold() : block.semanticThreshold(),
                block.allowNewFolders()   == null ? defaults.allowNewFolders()   : block.allowNewFolders(),
                block.forceExisting()     == null ? defaults.forceExisting()     : block.forceExisting());

        return new RuleCatalog(categories, fallbackFolders, strategy);
    }

    // ── Wire format ──────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleDocument(
            @JsonProperty("classification_rules") LinkedHashMap<String, RuleBody> classificationRules,
            @JsonProperty("fallback_folders")     List<String> fallbackFolders,
            @JsonProperty("strategy")             StrategyBlock strategy
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleBody(
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("target_patterns") @JsonAlias("targetPatterns") List<String> targetPatterns,
            @JsonProperty("priority") Integer priority
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StrategyBlock(
            @JsonProperty("semantic_threshold") Double semanticThreshold,
            @JsonProperty("allow_new_folders")  Boolean allowNewFolders,
            @JsonProperty("force_existing")     Boolean forceExisting
    ) {}
}
