package com.openforge.filemate.archive;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Archive ("knowledge base") and inbox locations.
 *
 * filemate:
 *   archive:
 *     root: knowledge_base
 *     inbox: inbox
 *     max-depth: 5             # folder levels scanned below the root
 *     structure-report: true   # keep structure.md up to date after each move
 *     structure-file: structure.md
 */
@Validated
@ConfigurationProperties(prefix = "filemate.archive")
public record ArchiveProperties(
        @DefaultValue("knowledge_base") @NotBlank String root,
        @DefaultValue("inbox") @NotBlank String inbox,
        @DefaultValue("5") @Min(1) @Max(32) int maxDepth,
        @DefaultValue("true") boolean structureReport,
        @DefaultValue("structure.md") @NotBlank String structureFile
) {

    public Path rootPath() {
        return Path.of(root).toAbsolutePath().normalize();
    }

    public Path inboxPath() {
        return Path.of(inbox).toAbsolutePath().normalize();
    }

    public static ArchiveProperties of(Path root, Path inbox) {
        return new ArchiveProperties(root.toString(), inbox.toString(), 5, true, "structure.md");
    }
}
