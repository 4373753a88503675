package com.openforge.filemate.date;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognized in-text date notations, declared in precedence order.
 */
enum DatePattern {

    /** 2024-05-29, 2024/5/29 */
    ISO("(?<!\\d)(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})(?!\\d)", 0.9, Order.YMD),

    /** 2024年5月29日 */
    LOCALIZED("(\\d{4})年(\\d{1,2})月(\\d{1,2})日", 0.9, Order.YMD),

    /** 05/29/2024 */
    US("(?<!\\d)(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4})(?!\\d)", 0.7, Order.MDY),

    /** 29.05.2024 */
    EU("(?<!\\d)(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})(?!\\d)", 0.7, Order.DMY),

    /** 20240529 */
    COMPACT("(?<!\\d)(\\d{4})(\\d{2})(\\d{2})(?!\\d)", 0.8, Order.YMD);

    private enum Order { YMD, MDY, DMY }

    private final Pattern regex;
    private final double  confidence;
    private final Order   order;

    DatePattern(String regex, double confidence, Order order) {
        this.regex      = Pattern.compile(regex);
        this.confidence = confidence;
        this.order      = order;
    }

    double confidence() {
        return confidence;
    }

    /**
     * All calendar-valid matches in the text: pattern order first, then position.
     * Impossible dates such as 2024-13-45 are skipped.
     */
    static List<Match> findAll(String text) {
        List<Match> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matches;
        }
        for (DatePattern pattern : values()) {
            Matcher m = pattern.regex.matcher(text);
            while (m.find()) {
                LocalDate date = pattern.toDate(m);
                if (date != null) {
                    matches.add(new Match(date, pattern, m.group()));
                }
            }
        }
        return matches;
    }

    private LocalDate toDate(Matcher m) {
        int a = Integer.parseInt(m.group(1));
        int b = Integer.parseInt(m.group(2));
        int c = Integer.parseInt(m.group(3));
        try {
            return switch (order) {
                case YMD -> LocalDate.of(a, b, c);
                case MDY -> LocalDate.of(c, a, b);
                case DMY -> LocalDate.of(c, b, a);
            };
        } catch (DateTimeException e) {
            return null;
        }
    }

    record Match(LocalDate date, DatePattern pattern, String raw) {}
}
