package com.openforge.filemate.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.filemate.classify.FolderCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads model answers that are supposed to be a JSON object but often are not.
 *
 * Each answer goes through the same chain, first success wins:
 *   1. the whole answer is the object
 *   2. the object sits in a ```json fenced block
 *   3. a flat {...} containing the expected key is embedded in prose
 *   4. keyword scan of "key: value" lines (and, for folders, any catalog
 *      path mentioned in the text)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OracleResponseParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private static final List<String> PATH_LABELS    = List.of("suggested_path", "path", "路径", "文件夹");
    private static final List<String> SUBJECT_LABELS = List.of("subject", "主体", "主题");

    private final ObjectMapper objectMapper;

    public Optional<FolderSuggestion> parseFolder(String response, FolderCatalog catalog) {
        return this.<FolderSuggestion>jsonChain(response, "suggested_path", FolderSuggestion.class)
                .filter(s -> s.suggestedPath() != null && !s.suggestedPath().isBlank())
                .or(() -> scanFolder(response, catalog));
    }

    public Optional<SubjectSuggestion> parseSubject(String response) {
        return this.<SubjectSuggestion>jsonChain(response, "subject", SubjectSuggestion.class)
                .filter(s -> s.subject() != null && !s.subject().isBlank())
                .or(() -> labelledValue(response, SUBJECT_LABELS)
                        .map(subject -> new SubjectSuggestion(subject, 0.3, "extracted from free text", null)));
    }

    public Optional<SimilarityVerdict> parseSimilarity(String response) {
        return jsonChain(response, "is_similar", SimilarityVerdict.class);
    }

    // ── JSON layers ──────────────────────────────────────────────────────────

    private <T> Optional<T> jsonChain(String response, String requiredKey, Class<T> type) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        List<Function<String, Optional<String>>> layers = List.of(
                r -> Optional.of(r.strip()),
                OracleResponseParser::fencedBlock,
                r -> looseObject(r, requiredKey));

        for (Function<String, Optional<String>> layer : layers) {
            Optional<T> value = layer.apply(response)
                    .flatMap(json -> readObject(json, requiredKey, type));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private <T> Optional<T> readObject(String json, String requiredKey, Class<T> type) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject() || !node.hasNonNull(requiredKey)) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.treeToValue(node, type));
        } catch (JsonProcessingException e) {
            log.debug("[Oracle] Not a usable {} object: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> fencedBlock(String response) {
        Matcher m = FENCED.matcher(response);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static Optional<String> looseObject(String response, String key) {
        Matcher m = Pattern.compile("\\{[^{}]*\"" + Pattern.quote(key) + "\"[^{}]*}", Pattern.DOTALL)
                .matcher(response);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    // ── Keyword scan ─────────────────────────────────────────────────────────

    private static Optional<FolderSuggestion> scanFolder(String response, FolderCatalog catalog) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Optional<String> labelled = labelledValue(response, PATH_LABELS);
        if (labelled.isPresent()) {
            String path = FolderCatalog.normalize(labelled.get());
            boolean known = catalog != null && catalog.contains(path);
            return Optional.of(new FolderSuggestion(path, !known, "extracted from free text"));
        }
        if (catalog == null) {
            return Optional.empty();
        }
        return catalog.folders().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .filter(response::contains)
                .findFirst()
                .map(path -> new FolderSuggestion(path, false, "folder mentioned in free text"));
    }

    /** Value of the first "label: value" line whose label matches, quotes and commas removed. */
    static Optional<String> labelledValue(String response, List<String> labels) {
        if (response == null) {
            return Optional.empty();
        }
        for (String rawLine : response.split("\\R")) {
            String line = rawLine.strip();
            int colon = indexOfColon(line);
            if (colon <= 0) continue;

            String label = line.substring(0, colon).replaceAll("[\"'*\\-\\s]", "").toLowerCase(Locale.ROOT);
            if (labels.stream().noneMatch(label::equals)) continue;

            String value = line.substring(colon + 1).strip()
                    .replaceAll("^[\"'“”]+", "")
                    .replaceAll("[\"'“”,，]+$", "")
                    .strip();
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static int indexOfColon(String line) {
        int ascii = line.indexOf(':');
        int wide  = line.indexOf('：');
        if (ascii < 0) return wide;
        if (wide < 0) return ascii;
        return Math.min(ascii, wide);
    }
}
