package com.openforge.filemate.document;

import java.nio.file.Path;
import java.util.Set;

/**
 * Text extraction for one family of file formats.
 */
public interface DocumentReader {

    /** Lower-case extensions with leading dot, e.g. ".docx". */
    Set<String> extensions();

    /**
     * @throws DocumentReadException if the file cannot be parsed
     */
    ExtractedText read(Path file);
}
