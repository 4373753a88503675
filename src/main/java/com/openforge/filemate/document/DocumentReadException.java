package com.openforge.filemate.document;

import java.nio.file.Path;

/** The file exists and has a supported type but its content could not be extracted. */
public class DocumentReadException extends DocumentException {

    public DocumentReadException(Path path, String message, Throwable cause) {
        super(path, message, cause);
    }

    public DocumentReadException(Path path, String message) {
        super(path, message);
    }
}
