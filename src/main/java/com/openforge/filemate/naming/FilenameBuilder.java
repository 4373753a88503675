package com.openforge.filemate.naming;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds archive file names of the form {@code {subject}[_{date}]_{version}{ext}}.
 *
 * The date is left out when it is blank or when the subject already carries a
 * calendar-valid yyyyMMdd run.  Only the subject is ever shortened to honour
 * the length limit; the date, version and extension suffix is kept intact.
 */
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(NamingProperties.class)
public class FilenameBuilder {

    private static final Pattern EIGHT_DIGITS = Pattern.compile("(?<!\\d)\\d{8}(?!\\d)");

    private static final DateTimeFormatter COMPACT_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private final NamingProperties properties;

    public String buildFilename(String subject, String date, VersionTag version, String extension) {
        return buildFilename(subject, date, version.toString(), extension);
    }

    public String buildFilename(String subject, String date, String version, String extension) {
        String safeSubject = FilenameSanitizer.sanitize(subject);

        StringBuilder suffix = new StringBuilder();
        if (date != null && !date.isBlank() && !containsDate(safeSubject)) {
            suffix.append('_').append(FilenameSanitizer.replaceIllegal(date.strip()));
        }
        suffix.append('_').append(version);
        suffix.append(normalizeExtension(extension));

        int maxLength = properties.maxLength();
        int suffixLength = suffix.codePointCount(0, suffix.length());
        int subjectLength = safeSubject.codePointCount(0, safeSubject.length());
        if (subjectLength + suffixLength > maxLength) {
            safeSubject = truncate(safeSubject, Math.max(1, maxLength - suffixLength));
        }
        return safeSubject + suffix;
    }

    /** True if the text holds an isolated 8-digit run that is a real yyyyMMdd date. */
    static boolean containsDate(String text) {
        Matcher m = EIGHT_DIGITS.matcher(text);
        while (m.find()) {
            try {
                LocalDate.parse(m.group(), COMPACT_DATE);
                return true;
            } catch (DateTimeParseException e) {
                // not a date, keep looking
            }
        }
        return false;
    }

    static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "";
        }
        String ext = extension.strip();
        return ext.startsWith(".") ? ext : "." + ext;
    }

    private static String truncate(String subject, int codePoints) {
        int end = subject.offsetByCodePoints(0, codePoints);
        String cut = subject.substring(0, end).stripTrailing();
        return cut.isEmpty() ? subject.substring(0, subject.offsetByCodePoints(0, 1)) : cut;
    }
}
