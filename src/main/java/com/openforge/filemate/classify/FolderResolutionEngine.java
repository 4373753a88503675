package com.openforge.filemate.classify;

import com.openforge.filemate.catalog.Category;
import com.openforge.filemate.catalog.CategoryMatch;
import com.openforge.filemate.catalog.GenericRuleTable;
import com.openforge.filemate.catalog.RuleCatalog;
import com.openforge.filemate.naming.FilenameSanitizer;
import com.openforge.filemate.naming.NamingProperties;
import com.openforge.filemate.oracle.FolderSuggestion;
import com.openforge.filemate.oracle.OracleAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses the archive folder for a subject.
 *
 * Stages, first decision wins:
 *
 *   1. EXACT_MATCH          folder name appears in the subject
 *   2. CATEGORY_MATCH       best keyword category → folder matching one of its target patterns
 *   3. CATEGORY_NEW_FOLDER  category found but no folder; only if new folders are allowed
 *   4. SIMILARITY_MATCH     substring / shared-token score against folder names
 *   5. ORACLE               external suggestion, accepted only if it names an existing folder
 *   6. FORCED_*             generic rules, fallback folders, or a folder made from the subject
 *
 * Decisions depend only on subject, catalog, rule catalog and the oracle's
 * answer; the engine keeps no state between calls.
 */
@Slf4j
@Component
@EnableConfigurationProperties(NamingProperties.class)
public class FolderResolutionEngine {

    static final double SIMILARITY_CONTAINMENT = 0.8;
    static final double SIMILARITY_TOKENS      = 0.6;
    static final double SIMILARITY_THRESHOLD   = 0.6;

    private final RuleCatalog      rules;
    private final GenericRuleTable genericRules;
    private final String           fallbackSubject;

    public FolderResolutionEngine(RuleCatalog rules, GenericRuleTable genericRules, NamingProperties naming) {
        this.rules           = rules;
        this.genericRules    = genericRules;
        this.fallbackSubject = naming.fallbackSubject();
    }

    public ClassificationDecision resolveFolder(String subject, FolderCatalog catalog) {
        return resolveFolder(subject, catalog, null, null);
    }

    public ClassificationDecision resolveFolder(String subject, FolderCatalog catalog, OracleAdapter oracle) {
        return resolveFolder(subject, catalog, oracle, null);
    }

    /**
     * @param oracle            may be null; consulted only when enabled and the catalog is not empty
     * @param structureOverview folder tree excerpt passed to the oracle; may be null
     */
    public ClassificationDecision resolveFolder(String subject,
                                                FolderCatalog catalog,
                                                OracleAdapter oracle,
                                                String structureOverview) {
        FolderCatalog folders = catalog == null ? FolderCatalog.empty() : catalog;
        String text = subject == null ? "" : subject.strip();

        Optional<ClassificationDecision> decision = Optional.empty();
        if (!text.isEmpty()) {
            decision = exactMatch(text, folders)
                    .or(() -> categoryMatch(text, folders))
                    .or(() -> similarityMatch(text, folders))
                    .or(() -> askOracle(text, folders, oracle, structureOverview));
        }
        ClassificationDecision result = decision.orElseGet(() -> forced(text, folders));

        log.info("[Resolver] '{}' → {} ({}{})", text, result.suggestedPath(), result.stage(),
                result.createNew() ? ", new folder" : "");
        return result;
    }

    // ── Stage 1 ──────────────────────────────────────────────────────────────

    private Optional<ClassificationDecision> exactMatch(String subject, FolderCatalog folders) {
        String lower = subject.toLowerCase(Locale.ROOT);
        Set<String> tokens = tokens(lower);
        for (String folder : folders.folders()) {
            String leaf = FolderCatalog.leaf(folder).toLowerCase(Locale.ROOT);
            if (leaf.isEmpty()) continue;
            if (lower.contains(leaf) || tokens.contains(leaf)) {
                return Optional.of(ClassificationDecision.existing(folder, ResolutionStage.EXACT_MATCH,
                        "Folder name '" + FolderCatalog.leaf(folder) + "' appears in the subject"));
            }
        }
        return Optional.empty();
    }

    // ── Stages 2 and 3 ───────────────────────────────────────────────────────

    private Optional<ClassificationDecision> categoryMatch(String subject, FolderCatalog folders) {
        Optional<CategoryMatch> best = rules.bestMatch(subject);
        if (best.isEmpty()) {
            return Optional.empty();
        }
        CategoryMatch match = best.get();
        Category category = match.category();

        Optional<String> folder = findByPatterns(category.targetPatterns(), folders);
        if (folder.isPresent()) {
            return Optional.of(ClassificationDecision.existing(folder.get(), ResolutionStage.CATEGORY_MATCH,
                    String.format(Locale.ROOT, "Category '%s' matched %d keyword(s), score %.2f",
                            category.name(), match.matchedKeywords(), match.score())));
        }

        String pattern = category.primaryPattern();
        if (pattern == null || !rules.strategy().allowNewFolders()) {
            log.debug("[Resolver] Category '{}' has no folder and may not create one", category.name());
            return Optional.empty();
        }
        return Optional.of(ClassificationDecision.newFolder(pattern, ResolutionStage.CATEGORY_NEW_FOLDER,
                "Category '" + category.name() + "' has no folder yet"));
    }

    // ── Stage 4 ──────────────────────────────────────────────────────────────

    private Optional<ClassificationDecision> similarityMatch(String subject, FolderCatalog folders) {
        String lower = subject.toLowerCase(Locale.ROOT);
        Set<String> subjectTokens = tokens(lower);

        String bestFolder = null;
        double bestScore  = 0.0;
        for (String folder : folders.folders()) {
            String leaf = FolderCatalog.leaf(folder).toLowerCase(Locale.ROOT);
            if (leaf.isEmpty()) continue;

            double score = 0.0;
            if (lower.contains(leaf) || leaf.contains(lower)) {
                score += SIMILARITY_CONTAINMENT;
            }
            Set<String> shared = tokens(leaf);
            shared.retainAll(subjectTokens);
            if (!shared.isEmpty()) {
                score += SIMILARITY_TOKENS;
            }
            if (score > bestScore) {
                bestScore  = score;
                bestFolder = folder;
            }
        }
        if (bestFolder == null || bestScore < SIMILARITY_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(ClassificationDecision.existing(bestFolder, ResolutionStage.SIMILARITY_MATCH,
                String.format(Locale.ROOT, "Folder name similarity %.1f", bestScore)));
    }

    // ── Stage 5 ──────────────────────────────────────────────────────────────

    private Optional<ClassificationDecision> askOracle(String subject,
                                                       FolderCatalog folders,
                                                       OracleAdapter oracle,
                                                       String structureOverview) {
        if (oracle == null || folders.isEmpty()) {
            return Optional.empty();
        }
        Optional<FolderSuggestion> suggestion;
        try {
            if (!oracle.isEnabled()) {
                return Optional.empty();
            }
            suggestion = oracle.suggestFolder(subject, folders, structureOverview);
        } catch (RuntimeException e) {
            log.warn("[Resolver] Oracle failed for '{}': {}", subject, e.getMessage());
            return Optional.empty();
        }
        if (suggestion.isEmpty() || suggestion.get().suggestedPath() == null) {
            return Optional.empty();
        }

        if (suggestion.get().createNew()) {
            log.warn("[Resolver] Oracle proposed a new folder '{}' — ignored", suggestion.get().suggestedPath());
            return Optional.empty();
        }
        String path = FolderCatalog.normalize(suggestion.get().suggestedPath());
        if (!folders.contains(path)) {
            log.warn("[Resolver] Oracle suggested '{}' which is not an existing folder — ignored", path);
            return Optional.empty();
        }
        String reasoning = suggestion.get().reasoning();
        return Optional.of(ClassificationDecision.existing(path, ResolutionStage.ORACLE,
                reasoning == null || reasoning.isBlank() ? "Suggested by oracle" : reasoning));
    }

    // ── Stage 6 ──────────────────────────────────────────────────────────────

    private ClassificationDecision forced(String subject, FolderCatalog folders) {
        return folders.isEmpty() ? forcedNew(subject) : forcedExisting(subject, folders);
    }

    private ClassificationDecision forcedExisting(String subject, FolderCatalog folders) {
        for (Category group : genericRules.hits(subject)) {
            Optional<String> folder = findByPatterns(group.targetPatterns(), folders);
            if (folder.isPresent()) {
                return ClassificationDecision.existing(folder.get(), ResolutionStage.FORCED_CATEGORY,
                        "Generic '" + group.name() + "' rule matched an existing folder");
            }
        }

        for (String name : rules.fallbackFolders()) {
            String needle = name.toLowerCase(Locale.ROOT);
            for (String folder : folders.folders()) {
                if (folder.toLowerCase(Locale.ROOT).contains(needle)) {
                    return ClassificationDecision.existing(folder, ResolutionStage.FORCED_GENERIC,
                            "Fallback folder '" + name + "'");
                }
            }
        }

        List<String> topLevel = folders.topLevel();
        String folder = topLevel.isEmpty() ? folders.folders().get(0) : topLevel.get(0);
        return ClassificationDecision.existing(folder, ResolutionStage.FORCED_GENERIC,
                "No rule matched; first available folder");
    }

    private ClassificationDecision forcedNew(String subject) {
        if (!subject.isEmpty()) {
            Optional<Category> category = rules.bestMatch(subject, 0.0)
                    .map(CategoryMatch::category)
                    .filter(c -> c.primaryPattern() != null)
                    .or(() -> genericRules.firstHit(subject).filter(c -> c.primaryPattern() != null));
            if (category.isPresent()) {
                return ClassificationDecision.newFolder(category.get().primaryPattern(),
                        ResolutionStage.FORCED_CATEGORY_NEW,
                        "Empty archive; new folder for category '" + category.get().name() + "'");
            }
        }
        String name = subject.isEmpty() ? fallbackSubject : subject;
        return ClassificationDecision.newFolder(FilenameSanitizer.sanitize(name), ResolutionStage.FORCED_FROM_SUBJECT,
                "Empty archive; new folder named after the subject");
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** First folder containing a pattern, trying patterns in preference order. */
    private static Optional<String> findByPatterns(List<String> patterns, FolderCatalog folders) {
        for (String pattern : patterns) {
            String needle = pattern.toLowerCase(Locale.ROOT);
            for (String folder : folders.folders()) {
                if (folder.toLowerCase(Locale.ROOT).contains(needle)) {
                    return Optional.of(folder);
                }
            }
        }
        return Optional.empty();
    }

    private static Set<String> tokens(String lower) {
        Set<String> tokens = new HashSet<>(Arrays.asList(lower.split("\\s+")));
        tokens.remove("");
        return tokens;
    }
}
