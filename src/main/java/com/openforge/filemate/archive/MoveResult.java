package com.openforge.filemate.archive;

import java.nio.file.Path;
import java.util.Optional;

/**
 * @param target        where the document now lives
 * @param backup        previous file at the target, renamed aside; null when there was none
 * @param createdFolder true if the target folder had to be created
 */
public record MoveResult(Path target, Path backup, boolean createdFolder) {

    public Optional<Path> backupPath() {
        return Optional.ofNullable(backup);
    }
}
