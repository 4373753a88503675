package com.openforge.filemate.document;

import java.nio.file.Path;

/** No reader is registered for the file's extension. */
public class UnsupportedDocumentException extends DocumentException {

    public UnsupportedDocumentException(Path path, String extension) {
        super(path, "Unsupported document type '" + extension + "': " + path.getFileName());
    }
}
