package com.openforge.filemate.document;

import java.util.Map;

/** What a format reader recovers from a file: its text and document properties. */
public record ExtractedText(String content, Map<String, String> metadata) {

    public ExtractedText {
        content  = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
