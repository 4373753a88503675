package com.openforge.filemate.naming;

import java.util.Map;

/**
 * Makes arbitrary text safe as a file or folder name on every common filesystem.
 *
 * Reserved characters are swapped for their full-width look-alikes rather than
 * dropped, so Chinese titles such as {@code 方案<草稿>} stay readable.
 */
public final class FilenameSanitizer {

    public static final String EMPTY_NAME = "untitled";

    private static final Map<Character, Character> FULL_WIDTH = Map.of(
            '<', '《',
            '>', '》',
            ':', '：',
            '"', '＂',
            '|', '｜',
            '?', '？',
            '*', '＊',
            '/', '／',
            '\\', '＼');

    private FilenameSanitizer() {}

    /** Sanitized, trimmed text; {@value #EMPTY_NAME} when nothing usable remains. */
    public static String sanitize(String text) {
        String cleaned = replaceIllegal(text).strip();
        return cleaned.isEmpty() ? EMPTY_NAME : cleaned;
    }

    /** Replacement only, no trimming and no empty-name substitution. */
    public static String replaceIllegal(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isISOControl(cp)) {
                out.append(' ');
            } else if (cp < 0x80 && FULL_WIDTH.containsKey((char) cp)) {
                out.append(FULL_WIDTH.get((char) cp));
            } else {
                out.appendCodePoint(cp);
            }
        });
        return out.toString();
    }
}
