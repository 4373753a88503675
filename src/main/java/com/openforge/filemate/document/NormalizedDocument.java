package com.openforge.filemate.document;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Format-independent view of one input file: identity, timestamps, extracted
 * text and whatever metadata the reader could recover (title, author, ...).
 *
 * @param name             file name including extension
 * @param extension        lower-case extension with leading dot, e.g. ".docx"; empty if none
 * @param creationTime     may be null when the filesystem does not report it
 * @param modificationTime may be null
 * @param content          extracted text, never null
 * @param metadata         never null
 */
@Builder
public record NormalizedDocument(
        String                name,
        String                extension,
        long                  sizeBytes,
        LocalDateTime         creationTime,
        LocalDateTime         modificationTime,
        String                content,
        Map<String, String>   metadata
) {

    public NormalizedDocument {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("document name must not be blank");
        }
        extension = extension == null ? "" : extension;
        content   = content == null ? "" : content;
        metadata  = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** File name without its extension. */
    public String stem() {
        if (!extension.isEmpty() && name.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT))) {
            return name.substring(0, name.length() - extension.length());
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String metadataValue(String key) {
        String value = metadata.get(key);
        return value == null || value.isBlank() ? null : value.strip();
    }
}
