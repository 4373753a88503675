package com.openforge.filemate.archive;

import com.openforge.filemate.classify.FolderCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the archive layout from disk.  Nothing is cached: every call sees the
 * folders and files as they are right now.
 */
@Slf4j
@Component
@EnableConfigurationProperties(ArchiveProperties.class)
public class ArchiveScanner {

    private final Path   root;
    private final int    maxDepth;
    private final String structureFile;

    public ArchiveScanner(ArchiveProperties properties) {
        this.root          = properties.rootPath();
        this.maxDepth      = properties.maxDepth();
        this.structureFile = properties.structureFile();
    }

    public Path root() {
        return root;
    }

    /** All non-hidden folders below the root, as "/"-joined relative paths. */
    public FolderCatalog scanCatalog() {
        if (!Files.isDirectory(root)) {
            log.debug("[Archive] Root {} does not exist yet — empty catalog", root);
            return FolderCatalog.empty();
        }
        List<String> folders = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(root, maxDepth)) {
            walk.filter(Files::isDirectory)
                .filter(dir -> !dir.equals(root))
                .map(root::relativize)
                .filter(ArchiveScanner::notHidden)
                .forEach(rel -> folders.add(toCatalogPath(rel)));
        } catch (IOException | UncheckedIOException e) {
            throw new ArchiveUnavailableException("Cannot scan archive " + root + ": " + e.getMessage(), e);
        }
        FolderCatalog catalog = FolderCatalog.of(folders);
        log.debug("[Archive] Scanned {} folders under {}", catalog.size(), root);
        return catalog;
    }

    /** Regular, non-hidden files directly inside one archive folder, sorted by name. */
    public List<Path> listFiles(String folder) {
        Path dir = resolve(folder);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(f -> !f.getFileName().toString().startsWith("."))
                    .filter(f -> !f.getFileName().toString().equals(structureFile))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ArchiveOperationException("Cannot list " + dir + ": " + e.getMessage(), e);
        }
    }

    /** Number of archived documents in a folder and all its subfolders. */
    public long countFiles(String folder) {
        Path dir = resolve(folder);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(f -> notHidden(root.relativize(f)))
                    .filter(f -> !f.getFileName().toString().equals(structureFile))
                    .count();
        } catch (IOException | UncheckedIOException e) {
            log.warn("[Archive] Cannot count files in {}: {}", dir, e.getMessage());
            return 0;
        }
    }

    /**
     * Absolute path of a catalog folder.
     *
     * @throws ArchiveOperationException if the path escapes the archive root
     */
    public Path resolve(String folder) {
        String normalized = FolderCatalog.normalize(folder);
        Path resolved = normalized.isEmpty() ? root : root.resolve(normalized).normalize();
        if (!resolved.startsWith(root)) {
            throw new ArchiveOperationException("Folder '" + folder + "' is outside the archive root");
        }
        return resolved;
    }

    static String toCatalogPath(Path relative) {
        List<String> parts = new ArrayList<>();
        relative.forEach(part -> parts.add(part.toString()));
        return String.join("/", parts);
    }

    private static boolean notHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return false;
            }
        }
        return true;
    }
}
