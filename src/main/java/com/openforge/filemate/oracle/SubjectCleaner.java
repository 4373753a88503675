package com.openforge.filemate.oracle;

import com.openforge.filemate.document.NormalizedDocument;
import com.openforge.filemate.naming.FilenameSanitizer;

/**
 * Turns a raw subject (model answer, document title, file stem) into
 * something usable as the base of a file name.
 */
public final class SubjectCleaner {

    public static final int MAX_LENGTH = 100;

    private static final String QUOTES   = "\"'“”‘’「」『』`";
    private static final String TRAILING = ".,_ ，。";

    private SubjectCleaner() {}

    /** Cleaned subject, or null when nothing usable remains. */
    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String s = strip(raw.strip(), QUOTES);
        s = FilenameSanitizer.replaceIllegal(s).strip();
        s = stripTrailing(s);
        if (s.codePointCount(0, s.length()) > MAX_LENGTH) {
            s = stripTrailing(s.substring(0, s.offsetByCodePoints(0, MAX_LENGTH)));
        }
        return s.isEmpty() ? null : s;
    }

    /** Metadata title, then file stem, then the configured fallback. */
    public static String fallback(NormalizedDocument document, String fallbackSubject) {
        String title = clean(document.metadataValue("title"));
        if (title != null) {
            return title;
        }
        String stem = clean(document.stem());
        return stem != null ? stem : fallbackSubject;
    }

    private static String strip(String s, String chars) {
        int start = 0;
        int end   = s.length();
        while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(start, end).strip();
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && TRAILING.indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(0, end);
    }
}
