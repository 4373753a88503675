package com.openforge.filemate.naming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the version tag for a document about to be archived.
 *
 * Among the given archive files, those whose stem shares a keyword with the
 * subject (and, when a {@link SimilarityJudge} is supplied, that it confirms)
 * are considered earlier copies.  The highest tag among them is advanced in
 * the configured {@link VersionFormat}; with no earlier copy the configured
 * initial version is used.
 */
@Slf4j
@Component
@EnableConfigurationProperties(NamingProperties.class)
public class VersionResolver {

    private static final Pattern WORD = Pattern.compile("[\\u4e00-\\u9fff]+|[a-zA-Z]+");

    private static final Set<String> STOP_WORDS =
            Set.of("的", "是", "在", "和", "与", "及", "或", "等", "了", "中", "对", "于");

    private final VersionFormat format;
    private final VersionTag    initial;

    public VersionResolver(NamingProperties properties) {
        this.format  = properties.versionFormat();
        this.initial = properties.initialTag();
    }

    public VersionTag determineVersion(String subject, Collection<Path> archiveFiles) {
        return determineVersion(subject, archiveFiles, null);
    }

    public VersionTag determineVersion(String subject, Collection<Path> archiveFiles, SimilarityJudge judge) {
        List<String> keywords = keywords(subject);
        if (keywords.isEmpty() || archiveFiles == null || archiveFiles.isEmpty()) {
            return initial;
        }

        VersionTag highest = null;
        for (Path file : archiveFiles) {
            String stem = stem(file);
            if (!sharesKeyword(stem, keywords)) {
                continue;
            }
            Optional<VersionTag> tag = VersionTag.findIn(stem);
            if (tag.isEmpty()) {
                continue;
            }
            if (!tag.get().canAdvance(format)) {
                log.warn("[Version] Ignoring {}: {} cannot be advanced", file.getFileName(), tag.get());
                continue;
            }
            if (!confirmedBy(judge, file)) {
                continue;
            }
            if (highest == null || tag.get().compareTo(highest) > 0) {
                highest = tag.get();
            }
        }

        if (highest == null) {
            return initial;
        }
        VersionTag next = highest.next(format);
        log.debug("[Version] '{}' highest {} → {}", subject, highest, next);
        return next;
    }

    /** CJK runs and Latin words longer than one character, minus stop words. */
    static List<String> keywords(String subject) {
        List<String> keywords = new ArrayList<>();
        if (subject == null) {
            return keywords;
        }
        Matcher m = WORD.matcher(subject);
        while (m.find()) {
            String word = m.group();
            if (word.length() > 1 && !STOP_WORDS.contains(word) && !keywords.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    private static boolean sharesKeyword(String stem, List<String> keywords) {
        String lower = stem.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
    }

    private static boolean confirmedBy(SimilarityJudge judge, Path file) {
        if (judge == null) {
            return true;
        }
        try {
            return judge.isSameDocument(file);
        } catch (RuntimeException e) {
            log.debug("[Version] Similarity check failed for {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
