package com.openforge.filemate.archive;

import com.openforge.filemate.catalog.Category;
import com.openforge.filemate.catalog.ClassificationStrategy;
import com.openforge.filemate.catalog.RuleCatalog;
import com.openforge.filemate.classify.FolderCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * Maintains {@code structure.md} at the archive root: a human-readable map of
 * the folders, the rules that feed them, and a few counts.
 *
 * The folder tree section doubles as context for oracle folder prompts, see
 * {@link #overview()}.
 */
@Slf4j
@Component
@EnableConfigurationProperties(ArchiveProperties.class)
public class ArchiveStructureReporter {

    static final String TREE_HEADING     = "## Folder structure";
    static final String RULES_HEADING    = "## Classification rules";
    static final String STRATEGY_HEADING = "## Strategy";
    static final String STATS_HEADING    = "## Statistics";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ArchiveScanner    scanner;
    private final RuleCatalog       rules;
    private final ArchiveProperties properties;
    private final Clock             clock;

    public ArchiveStructureReporter(ArchiveScanner scanner,
                                    RuleCatalog rules,
                                    ArchiveProperties properties,
                                    Clock clock) {
        this.scanner    = scanner;
        this.rules      = rules;
        this.properties = properties;
        this.clock      = clock;
    }

    public boolean isEnabled() {
        return properties.structureReport();
    }

    /** Writes structure.md; failures are logged, the report is never worth failing a move over. */
    public Optional<Path> write() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Path file = scanner.root().resolve(properties.structureFile());
        try {
            Files.createDirectories(scanner.root());
            Files.writeString(file, render(), StandardCharsets.UTF_8);
            log.info("[Structure] Updated {}", file);
            return Optional.of(file);
        } catch (IOException | ArchiveOperationException e) {
            log.error("[Structure] Failed to update {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Folder tree of the current archive, as it appears in the report. */
    public String overview() {
        FolderCatalog catalog = scanner.scanCatalog();
        return TREE_HEADING + "\n\n" + tree(catalog);
    }

    public String render() {
        FolderCatalog catalog = scanner.scanCatalog();
        StringBuilder md = new StringBuilder();
        md.append("# Knowledge Base Structure\n\n");
        md.append("> Last updated: ").append(LocalDateTime.now(clock).format(STAMP)).append("\n\n");

        md.append(TREE_HEADING).append("\n\n").append(tree(catalog)).append('\n');

        md.append(RULES_HEADING).append("\n\n");
        if (rules.size() == 0) {
            md.append("_No categories configured._\n");
        }
        for (Category category : rules.categories()) {
            md.append("### ").append(category.name())
              .append(" (priority ").append(category.priority()).append(")\n\n")
              .append("- Keywords: ").append(String.join(", ", category.keywords())).append('\n')
              .append("- Target folders: ").append(String.join(", ", category.targetPatterns())).append("\n\n");
        }
        if (!rules.fallbackFolders().isEmpty()) {
            md.append("Fallback folders: ").append(String.join(", ", rules.fallbackFolders())).append("\n\n");
        }

        ClassificationStrategy strategy = rules.strategy();
        md.append(STRATEGY_HEADING).append("\n\n")
          .append(String.format(Locale.ROOT, "- Semantic threshold: %.2f\n", strategy.semanticThreshold()))
          .append("- New folders allowed: ").append(strategy.allowNewFolders() ? "yes" : "no").append('\n')
          .append("- Existing folders enforced: ").append(strategy.forceExisting() ? "yes" : "no").append("\n\n");

        long files = scanner.countFiles("");
        int  depth = catalog.folders().stream().mapToInt(f -> f.split("/").length).max().orElse(0);
        md.append(STATS_HEADING).append("\n\n")
          .append("- Folders: ").append(catalog.size()).append('\n')
          .append("- Documents: ").append(files).append('\n')
          .append("- Deepest level: ").append(depth).append('\n');
        return md.toString();
    }

    private String tree(FolderCatalog catalog) {
        if (catalog.isEmpty()) {
            return "_The archive has no folders yet._\n";
        }
        StringBuilder sb = new StringBuilder();
        for (String folder : catalog.folders()) {
            int level = folder.split("/").length - 1;
            sb.append("  ".repeat(level))
              .append("- ").append(FolderCatalog.leaf(folder)).append('/')
              .append(" (").append(scanner.countFiles(folder)).append(" files)");
            describe(folder).ifPresent(d -> sb.append(" — ").append(d));
            sb.append('\n');
        }
        return sb.toString();
    }

    /** The category whose target patterns name this folder, if any. */
    private Optional<String> describe(String folder) {
        String leaf = FolderCatalog.leaf(folder).toLowerCase(Locale.ROOT);
        for (Category category : rules.categories()) {
            for (String pattern : category.targetPatterns()) {
                if (leaf.contains(pattern.toLowerCase(Locale.ROOT))) {
                    return Optional.of(category.name());
                }
            }
        }
        return Optional.empty();
    }
}
