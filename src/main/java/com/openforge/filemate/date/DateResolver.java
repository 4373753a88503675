package com.openforge.filemate.date;

import com.openforge.filemate.document.NormalizedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Best-effort date for a document.
 *
 * Sources are tried in the configured priority order and the first one that
 * yields a date wins.  A source that throws is logged and skipped, so
 * {@link #extractDate} never fails: when nothing produced a date the clock is
 * used with {@link DateSource#FALLBACK} confidence.
 */
@Slf4j
@Service
@EnableConfigurationProperties(DateProperties.class)
public class DateResolver {

    static final double KEYWORD_BONUS        = 0.3;
    static final double CREATION_CONFIDENCE  = 0.7;
    static final double MODIFIED_CONFIDENCE  = 0.6;
    static final double CURRENT_CONFIDENCE   = 0.5;
    static final double FALLBACK_CONFIDENCE  = 0.1;

    /** Lines mentioning one of these carry the document's own date. */
    static final List<String> DATE_KEYWORDS = List.of(
            "日期", "时间", "创建时间", "修改时间", "撰写时间", "会议时间", "报告时间", "记录时间", "发布时间",
            "生效日期", "签署日期");

    /** Latin keywords only count as whole words, so "timeline" is not "time". */
    static final Pattern LATIN_DATE_KEYWORDS = Pattern.compile(
            "\\b(?:date|time|created|modified|meeting time|published|effective date)\\b",
            Pattern.CASE_INSENSITIVE);

    private final DateProperties properties;
    private final StrftimeFormat outputFormat;
    private final Clock          clock;

    public DateResolver(DateProperties properties, Clock clock) {
        this.properties   = properties;
        this.outputFormat = StrftimeFormat.of(properties.format());
        this.clock        = clock;
    }

    public DateExtractionResult extractDate(NormalizedDocument document) {
        for (DateSource source : properties.priority()) {
            if (source == DateSource.FALLBACK) {
                continue;
            }
            try {
                DateExtractionResult result = fromSource(source, document);
                if (result.isPresent()) {
                    log.debug("[Date] {} → {} via {} ({})",
                            document.name(), result.date(), source, result.confidence());
                    return result;
                }
            } catch (RuntimeException e) {
                log.warn("[Date] Source {} failed for {}: {}", source, document.name(), e.getMessage());
            }
        }
        LocalDateTime now = LocalDateTime.now(clock);
        return new DateExtractionResult(format(now), DateSource.FALLBACK, FALLBACK_CONFIDENCE, now.toString());
    }

    /** Formats with the configured output pattern. */
    public String format(LocalDate date) {
        return format(date.atStartOfDay());
    }

    public String format(LocalDateTime dateTime) {
        return outputFormat.format(dateTime);
    }

    /** True if the text parses strictly under the configured output pattern. */
    public boolean isValidDate(String text) {
        return outputFormat.matches(text);
    }

    private DateExtractionResult fromSource(DateSource source, NormalizedDocument document) {
        return switch (source) {
            case CONTENT      -> fromContent(document.content());
            case CREATION     -> fromTimestamp(document.creationTime(), DateSource.CREATION, CREATION_CONFIDENCE);
            case MODIFICATION -> fromTimestamp(document.modificationTime(), DateSource.MODIFICATION, MODIFIED_CONFIDENCE);
            case CURRENT      -> fromTimestamp(LocalDateTime.now(clock), DateSource.CURRENT, CURRENT_CONFIDENCE);
            case FALLBACK     -> DateExtractionResult.absent(DateSource.FALLBACK);
        };
    }

    DateExtractionResult fromContent(String content) {
        if (content == null || content.isBlank()) {
            return DateExtractionResult.absent(DateSource.CONTENT);
        }

        DatePattern.Match best = null;
        double bestConfidence  = 0.0;
        for (String line : content.split("\\R")) {
            if (line.isBlank() || !mentionsDate(line)) {
                continue;
            }
            for (DatePattern.Match match : DatePattern.findAll(line)) {
                // uncapped here, capped when reported
                double confidence = match.pattern().confidence() + KEYWORD_BONUS;
                if (confidence > bestConfidence) {
                    best           = match;
                    bestConfidence = confidence;
                }
            }
        }
        if (best != null) {
            return new DateExtractionResult(
                    format(best.date()), DateSource.CONTENT, Math.min(1.0, bestConfidence), best.raw());
        }

        String head = content.length() > properties.contentScanLimit()
                ? content.substring(0, properties.contentScanLimit())
                : content;
        List<DatePattern.Match> matches = DatePattern.findAll(head);
        if (matches.isEmpty()) {
            return DateExtractionResult.absent(DateSource.CONTENT);
        }
        DatePattern.Match first = matches.get(0);
        return new DateExtractionResult(
                format(first.date()), DateSource.CONTENT, first.pattern().confidence(), first.raw());
    }

    private DateExtractionResult fromTimestamp(LocalDateTime timestamp, DateSource source, double confidence) {
        if (timestamp == null) {
            return DateExtractionResult.absent(source);
        }
        return new DateExtractionResult(format(timestamp), source, confidence, timestamp.toString());
    }

    private static boolean mentionsDate(String line) {
        return DATE_KEYWORDS.stream().anyMatch(line::contains)
                || LATIN_DATE_KEYWORDS.matcher(line).find();
    }
}
