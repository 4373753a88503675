package com.openforge.filemate.pipeline;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Inbox processing settings.
 *
 * filemate:
 *   processing:
 *     extensions: [.txt, .md, .docx, .xlsx, .pdf]
 *     debounce-millis: 1000      # watch mode: quiet time before a new file is read
 *     similarity-check: true     # ask the oracle before treating a same-named file as an earlier version
 */
@Validated
@ConfigurationProperties(prefix = "filemate.processing")
public record ProcessingProperties(
        @DefaultValue({".txt", ".md", ".docx", ".xlsx", ".pdf"}) @NotEmpty List<String> extensions,
        @DefaultValue("1000") @Min(0) long debounceMillis,
        @DefaultValue("true") boolean similarityCheck
) {

    public static ProcessingProperties defaults() {
        return new ProcessingProperties(List.of(".txt", ".md", ".docx", ".xlsx", ".pdf"), 1000, true);
    }

    /** Accepts "docx", ".DOCX" and ".docx" alike. */
    public boolean accepts(String extension) {
        if (extension == null || extension.isBlank()) {
            return false;
        }
        String ext = extension.startsWith(".") ? extension : "." + extension;
        return extensions.stream()
                .map(e -> e.startsWith(".") ? e : "." + e)
                .anyMatch(e -> e.equalsIgnoreCase(ext.toLowerCase(Locale.ROOT)));
    }
}
