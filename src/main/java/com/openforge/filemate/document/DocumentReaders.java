package com.openforge.filemate.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Picks the {@link DocumentReader} for a file by extension and wraps the
 * extracted text together with the file's size and timestamps.
 */
@Slf4j
@Component
public class DocumentReaders {

    private final Map<String, DocumentReader> byExtension;
    private final Clock clock;

    public DocumentReaders(List<DocumentReader> readers, Clock clock) {
        Map<String, DocumentReader> map = new TreeMap<>();
        for (DocumentReader reader : readers) {
            for (String extension : reader.extensions()) {
                DocumentReader previous = map.put(extension.toLowerCase(Locale.ROOT), reader);
                if (previous != null) {
                    log.warn("[Reader] {} replaces {} for {}", reader.getClass().getSimpleName(),
                            previous.getClass().getSimpleName(), extension);
                }
            }
        }
        this.byExtension = Collections.unmodifiableMap(map);
        this.clock       = clock;
    }

    public Set<String> supportedExtensions() {
        return byExtension.keySet();
    }

    public boolean supports(Path file) {
        return byExtension.containsKey(extensionOf(file));
    }

    /**
     * @throws UnsupportedDocumentException no reader for the extension
     * @throws DocumentReadException        the file is missing or its content cannot be extracted
     */
    public NormalizedDocument read(Path file) {
        String extension = extensionOf(file);
        DocumentReader reader = byExtension.get(extension);
        if (reader == null) {
            throw new UnsupportedDocumentException(file, extension.isEmpty() ? "(none)" : extension);
        }
        if (!Files.isRegularFile(file)) {
            throw new DocumentReadException(file, "Not a readable file: " + file);
        }

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new DocumentReadException(file, "Cannot stat " + file + ": " + e.getMessage(), e);
        }

        ExtractedText text = reader.read(file);
        log.debug("[Reader] {} → {} chars, metadata {}", file.getFileName(), text.content().length(),
                text.metadata().keySet());

        return NormalizedDocument.builder()
                .name(file.getFileName().toString())
                .extension(extension)
                .sizeBytes(attributes.size())
                .creationTime(toLocal(attributes.creationTime()))
                .modificationTime(toLocal(attributes.lastModifiedTime()))
                .content(text.content())
                .metadata(text.metadata())
                .build();
    }

    /** Lower-case extension with leading dot; empty when the name has none. */
    public static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    private LocalDateTime toLocal(FileTime time) {
        return time == null ? null : LocalDateTime.ofInstant(time.toInstant(), clock.getZone());
    }
}
