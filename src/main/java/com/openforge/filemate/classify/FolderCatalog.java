package com.openforge.filemate.classify;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Snapshot of the archive's folders as "/"-joined paths relative to the
 * archive root, sorted so that "first in catalog order" is reproducible.
 *
 * A catalog is built fresh before every decision and never updated in place.
 */
public final class FolderCatalog {

    private static final FolderCatalog EMPTY = new FolderCatalog(List.of());

    private final List<String> folders;

    private FolderCatalog(Collection<String> folders) {
        TreeSet<String> sorted = new TreeSet<>();
        for (String folder : folders) {
            String normalized = normalize(folder);
            if (!normalized.isEmpty()) {
                sorted.add(normalized);
            }
        }
        this.folders = List.copyOf(sorted);
    }

    public static FolderCatalog of(Collection<String> folders) {
        return folders == null || folders.isEmpty() ? EMPTY : new FolderCatalog(folders);
    }

    public static FolderCatalog of(String... folders) {
        return of(List.of(folders));
    }

    public static FolderCatalog empty() {
        return EMPTY;
    }

    /** Backslashes become "/", surrounding whitespace and slashes are dropped. */
    public static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String p = path.strip().replace('\\', '/');
        while (p.contains("//")) {
            p = p.replace("//", "/");
        }
        int start = 0;
        int end   = p.length();
        while (start < end && p.charAt(start) == '/') start++;
        while (end > start && p.charAt(end - 1) == '/') end--;
        return p.substring(start, end).strip();
    }

    /** Last path segment. */
    public static String leaf(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    public boolean contains(String path) {
        return Collections.binarySearch(folders, normalize(path)) >= 0;
    }

    public List<String> folders() {
        return folders;
    }

    public List<String> topLevel() {
        return folders.stream().filter(f -> f.indexOf('/') < 0).toList();
    }

    public boolean isEmpty() {
        return folders.isEmpty();
    }

    public int size() {
        return folders.size();
    }

    @Override
    public String toString() {
        return "FolderCatalog" + folders;
    }
}
