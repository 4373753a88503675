package com.openforge.filemate.document;

import java.nio.file.Path;

/**
 * A single input document could not be turned into a {@link NormalizedDocument}.
 * Reported per document; never stops a batch.
 */
public class DocumentException extends RuntimeException {

    private final Path path;

    public DocumentException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public DocumentException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
