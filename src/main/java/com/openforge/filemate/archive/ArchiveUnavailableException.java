package com.openforge.filemate.archive;

/**
 * The archive root itself cannot be created or written.  Nothing can be filed
 * until this is fixed, so it ends the whole run instead of a single document.
 */
public class ArchiveUnavailableException extends ArchiveOperationException {

    public ArchiveUnavailableException(String message) {
        super(message);
    }

    public ArchiveUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
