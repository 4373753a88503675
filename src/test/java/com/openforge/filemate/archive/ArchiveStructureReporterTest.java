package com.openforge.filemate.archive;

import com.openforge.filemate.catalog.DefaultRuleCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveStructureReporterTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path root;
    private ArchiveStructureReporter reporter;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("kb");
        ArchiveProperties properties = ArchiveProperties.of(root, tempDir.resolve("inbox"));
        reporter = new ArchiveStructureReporter(
                new ArchiveScanner(properties), DefaultRuleCatalog.create(), properties, clock);
    }

    @Test
    void overviewOfEmptyArchive() {
        assertThat(reporter.overview())
                .startsWith(ArchiveStructureReporter.TREE_HEADING)
                .contains("no folders yet");
    }

    @Test
    void treeShowsCountsAndCategories() throws IOException {
        Files.createDirectories(root.resolve("技术方案/DevOps运维"));
        Files.writeString(root.resolve("技术方案/DevOps运维/a_v1.0.md"), "a");
        Files.writeString(root.resolve("技术方案/DevOps运维/b_v1.0.md"), "b");

        String overview = reporter.overview();

        assertThat(overview)
                .contains("- 技术方案/ (2 files) — 技术开发\n")
                .contains("  - DevOps运维/ (2 files) — 运维管理\n");
    }

    @Test
    void writeProducesFullReport() throws IOException {
        Files.createDirectories(root.resolve("项目文档"));
        Files.writeString(root.resolve("项目文档/plan_v1.0.md"), "p");

        Path file = reporter.write().orElseThrow();

        assertThat(file).isEqualTo(root.resolve("structure.md"));
        String report = Files.readString(file);
        assertThat(report)
                .startsWith("# Knowledge Base Structure")
                .contains("> Last updated: 2024-06-01 10:15:30")
                .contains(ArchiveStructureReporter.RULES_HEADING)
                .contains("### 运维管理 (priority 1)")
                .contains("- Semantic threshold: 0.30\n")
                .contains("- Existing folders enforced: yes")
                .contains("- Folders: 1\n")
                .contains("- Documents: 1\n");
    }

    @Test
    void reportIsNotCountedAsADocument() throws IOException {
        Files.createDirectories(root.resolve("a"));
        reporter.write();

        assertThat(reporter.render()).contains("- Documents: 0\n");
    }

    @Test
    void disabledReporterWritesNothing() {
        ArchiveProperties properties = new ArchiveProperties(root.toString(), "inbox", 5, false, "structure.md");
        ArchiveStructureReporter disabled = new ArchiveStructureReporter(
                new ArchiveScanner(properties), DefaultRuleCatalog.create(), properties, clock);

        assertThat(disabled.write()).isEmpty();
        assertThat(root.resolve("structure.md")).doesNotExist();
    }
}
