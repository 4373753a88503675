package com.openforge.filemate.date;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * A date pattern written in strftime notation ("%Y%m%d", "%Y年%m月%d日"),
 * translated once into a strict {@link DateTimeFormatter}.
 *
 * Supported directives: %Y %y %m %d %H %M %S %j %b %B %%.
 * Everything else outside a directive is literal text.
 */
public final class StrftimeFormat {

    private final String            pattern;
    private final DateTimeFormatter formatter;

    private StrftimeFormat(String pattern, DateTimeFormatter formatter) {
        this.pattern   = pattern;
        this.formatter = formatter;
    }

    public static StrftimeFormat of(String strftimePattern) {
        if (strftimePattern == null || strftimePattern.isEmpty()) {
            throw new IllegalArgumentException("date format must not be empty");
        }
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(translate(strftimePattern), Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
        return new StrftimeFormat(strftimePattern, formatter);
    }

    public String format(LocalDateTime dateTime) {
        return formatter.format(dateTime);
    }

    /** True if the text parses under exactly this pattern (calendar-checked). */
    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        try {
            formatter.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    public String pattern() {
        return pattern;
    }

    static String translate(String strftime) {
        StringBuilder out     = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < strftime.length(); i++) {
            char ch = strftime.charAt(i);
            if (ch != '%') {
                literal.append(ch);
                continue;
            }
            if (i + 1 >= strftime.length()) {
                throw new IllegalArgumentException("dangling '%' in date format: " + strftime);
            }
            char directive = strftime.charAt(++i);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            flushLiteral(out, literal);
            out.append(switch (directive) {
                case 'Y' -> "uuuu";
                case 'y' -> "uu";
                case 'm' -> "MM";
                case 'd' -> "dd";
                case 'H' -> "HH";
                case 'M' -> "mm";
                case 'S' -> "ss";
                case 'j' -> "DDD";
                case 'b' -> "MMM";
                case 'B' -> "MMMM";
                default -> throw new IllegalArgumentException(
                        "unsupported directive %" + directive + " in date format: " + strftime);
            });
        }
        flushLiteral(out, literal);
        return out.toString();
    }

    private static void flushLiteral(StringBuilder out, StringBuilder literal) {
        if (literal.length() == 0) return;
        out.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}
