package com.openforge.filemate.archive;

/** A folder could not be created or a file could not be backed up or moved. */
public class ArchiveOperationException extends RuntimeException {

    public ArchiveOperationException(String message) {
        super(message);
    }

    public ArchiveOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
