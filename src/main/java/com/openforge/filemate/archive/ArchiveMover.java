package com.openforge.filemate.archive;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Puts a document into the archive.
 *
 * The target folder is created before the move returns, so the next catalog
 * scan sees it.  A file already sitting at the target is renamed to
 * {@code {stem}_backup_{yyyyMMdd_HHmmss}{ext}} first; nothing is overwritten.
 */
@Slf4j
@Component
@EnableConfigurationProperties(ArchiveProperties.class)
public class ArchiveMover {

    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path  root;
    private final Clock clock;

    public ArchiveMover(ArchiveProperties properties, Clock clock) {
        this.root  = properties.rootPath();
        this.clock = clock;
    }

    /**
     * @param source     the inbox file
     * @param targetPath absolute destination inside the archive root
     * @throws ArchiveUnavailableException the archive root cannot be created or written
     * @throws ArchiveOperationException   the folder, backup or move failed
     */
    public MoveResult move(Path source, Path targetPath) {
        ensureWritableRoot();

        Path target = targetPath.toAbsolutePath().normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new ArchiveOperationException("Target " + target + " is outside the archive root " + root);
        }
        if (!Files.isRegularFile(source)) {
            throw new ArchiveOperationException("Source " + source + " no longer exists");
        }

        Path folder = target.getParent();
        boolean created = false;
        if (!Files.isDirectory(folder)) {
            try {
                Files.createDirectories(folder);
                created = true;
                log.info("[Archive] Created folder {}", root.relativize(folder));
            } catch (IOException e) {
                throw new ArchiveOperationException("Cannot create folder " + folder + ": " + e.getMessage(), e);
            }
        }

        Path backup = null;
        if (Files.exists(target)) {
            backup = backupPathFor(target);
            try {
                Files.move(target, backup);
                log.info("[Archive] Existing {} backed up as {}", target.getFileName(), backup.getFileName());
            } catch (IOException e) {
                throw new ArchiveOperationException("Cannot back up " + target + ": " + e.getMessage(), e);
            }
        }

        try {
            Files.move(source, target);
        } catch (IOException e) {
            throw new ArchiveOperationException("Cannot move " + source + " to " + target + ": " + e.getMessage(), e);
        }
        log.info("[Archive] {} → {}", source.getFileName(), root.relativize(target));
        return new MoveResult(target, backup, created);
    }

    /** Creates the archive root if needed and checks it can be written. */
    public void ensureWritableRoot() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new ArchiveUnavailableException("Cannot create archive root " + root + ": " + e.getMessage(), e);
        }
        if (!Files.isWritable(root)) {
            throw new ArchiveUnavailableException("Archive root " + root + " is not writable");
        }
    }

    Path backupPathFor(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String ext  = dot > 0 ? name.substring(dot) : "";
        String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);

        Path candidate = target.resolveSibling(stem + "_backup_" + stamp + ext);
        for (int i = 2; Files.exists(candidate); i++) {
            candidate = target.resolveSibling(stem + "_backup_" + stamp + "_" + i + ext);
        }
        return candidate;
    }
}
