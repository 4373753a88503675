package com.openforge.filemate.archive;

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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveMoverTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path root;
    private Path inbox;
    private ArchiveMover mover;

    @BeforeEach
    void setUp() throws IOException {
        root  = tempDir.resolve("kb").toAbsolutePath().normalize();
        inbox = Files.createDirectories(tempDir.resolve("inbox"));
        mover = new ArchiveMover(ArchiveProperties.of(root, inbox), clock);
    }

    @Test
    void movesIntoNewFolder() throws IOException {
        Path source = Files.writeString(inbox.resolve("draft.txt"), "content");
        Path target = root.resolve("Q3 Report/Q3 Report_20240601_v1.0.txt");

        MoveResult result = mover.move(source, target);

        assertThat(result.target()).isEqualTo(target);
        assertThat(result.createdFolder()).isTrue();
        assertThat(result.backupPath()).isEmpty();
        assertThat(source).doesNotExist();
        assertThat(target).hasContent("content");
    }

    @Test
    void existingTargetIsBackedUpNotOverwritten() throws IOException {
        Path folder = Files.createDirectories(root.resolve("项目文档"));
        Path target = Files.writeString(folder.resolve("plan_v1.0.md"), "old");
        Path source = Files.writeString(inbox.resolve("plan.md"), "new");

        MoveResult result = mover.move(source, target);

        assertThat(result.createdFolder()).isFalse();
        assertThat(result.backupPath()).contains(folder.resolve("plan_v1.0_backup_20240601_101530.md"));
        assertThat(folder.resolve("plan_v1.0_backup_20240601_101530.md")).hasContent("old");
        assertThat(target).hasContent("new");
    }

    @Test
    void backupNameAvoidsCollisions() throws IOException {
        Path folder = Files.createDirectories(root.resolve("x"));
        Path target = folder.resolve("plan.md");
        Files.writeString(folder.resolve("plan_backup_20240601_101530.md"), "earlier");

        assertThat(mover.backupPathFor(target)).isEqualTo(folder.resolve("plan_backup_20240601_101530_2.md"));
    }

    @Test
    void targetOutsideRootIsRefused() throws IOException {
        Path source = Files.writeString(inbox.resolve("a.txt"), "a");

        assertThatThrownBy(() -> mover.move(source, tempDir.resolve("elsewhere/a.txt")))
                .isInstanceOf(ArchiveOperationException.class);
        assertThatThrownBy(() -> mover.move(source, root.resolve("../kb2/a.txt")))
                .isInstanceOf(ArchiveOperationException.class);
        assertThat(source).exists();
    }

    @Test
    void vanishedSourceIsAnOperationFailure() {
        assertThatThrownBy(() -> mover.move(inbox.resolve("gone.txt"), root.resolve("a/gone.txt")))
                .isInstanceOf(ArchiveOperationException.class)
                .isNotInstanceOf(ArchiveUnavailableException.class);
    }

    @Test
    void rootThatIsAFileIsUnavailable() throws IOException {
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "file");
        ArchiveMover broken = new ArchiveMover(ArchiveProperties.of(blocked, inbox), clock);

        assertThatThrownBy(broken::ensureWritableRoot).isInstanceOf(ArchiveUnavailableException.class);
    }
}
