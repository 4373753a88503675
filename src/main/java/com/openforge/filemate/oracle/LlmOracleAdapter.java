package com.openforge.filemate.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.filemate.catalog.RuleCatalog;
import com.openforge.filemate.classify.FolderCatalog;
import com.openforge.filemate.document.NormalizedDocument;
import com.openforge.filemate.llm.LlmRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * {@link OracleAdapter} backed by the configured LLM providers.
 *
 * Every call is a single system + user exchange through {@link LlmRouter};
 * the answer is read with {@link OracleResponseParser}.  Transport errors,
 * timeouts and unreadable answers are logged and reported as empty.
 */
@Slf4j
@Component
@EnableConfigurationProperties(OracleProperties.class)
public class LlmOracleAdapter implements OracleAdapter {

    private static final String SYSTEM_PROMPT =
            "You are a document archiving assistant. Answer with a single JSON object only, no markdown, no explanation.";

    private static final String FOLDER_PROMPT = """
        Choose the archive folder for a document whose subject is "%s".

        Current archive structure:
        %s

        Existing folders (complete list):
        %s

        Requirements:
        1. suggested_path must be exactly one entry of the list above.
        2. %s
        3. Pick the folder whose topic fits the subject best.

        Reply as:
        {"suggested_path": "<an existing folder>", "create_new": false, "reasoning": "<why this folder>"}
        """;

    private static final String SUBJECT_PROMPT = """
        Extract the core subject of the document below. The subject becomes the base of its file name,
        so keep it short and descriptive and write it in the document's own language.

        File name: %s
        File type: %s

        Metadata:
        %s

        Content:
        %s

        Reply as:
        {"subject": "<subject>", "suggested_folder": "<topic folder, / separated>", "confidence": 0.85, "reasoning": "<why>"}
        """;

    private static final String SIMILARITY_PROMPT = """
        Decide whether the two documents below are versions of the same document: same topic, project or event,
        even when their wording differs. Score topical closeness, not textual overlap; 0.7 or more means same document.

        Document 1:
        %s

        Document 2:
        %s

        Reply as:
        {"is_similar": true, "similarity_score": 0.0, "reasoning": "<why>"}
        """;

    private final LlmRouter            router;
    private final OracleResponseParser parser;
    private final OracleProperties     properties;
    private final RuleCatalog          rules;
    private final ObjectMapper         objectMapper;

    public LlmOracleAdapter(LlmRouter router,
                            OracleResponseParser parser,
                            OracleProperties properties,
                            RuleCatalog rules,
                            ObjectMapper objectMapper) {
        this.router       = router;
        this.parser       = parser;
        this.properties   = properties;
        this.rules        = rules;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isEnabled() {
        return router.isAvailable();
    }

    @Override
    public Optional<FolderSuggestion> suggestFolder(String subject, FolderCatalog catalog, String structureOverview) {
        if (!isEnabled() || catalog == null || catalog.isEmpty()) {
            return Optional.empty();
        }
        String folders = catalog.folders().stream()
                .map(f -> "- " + f)
                .collect(Collectors.joining("\n"));
        String overview = structureOverview == null || structureOverview.isBlank()
                ? "(no structure report yet)"
                : structureOverview;
        String rule = rules.strategy().forceExisting()
                ? "Never invent a new folder: create_new must be false."
                : "Prefer an existing folder; only existing folders are accepted.";

        String prompt = FOLDER_PROMPT.formatted(subject, overview, folders, rule);
        return ask("folder", subject, prompt).flatMap(answer -> parser.parseFolder(answer, catalog));
    }

    @Override
    public Optional<SubjectSuggestion> suggestSubject(NormalizedDocument document) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String prompt = SUBJECT_PROMPT.formatted(
                document.name(),
                document.extension(),
                metadataJson(document),
                head(document.content(), properties.contentBudget()));
        return ask("subject", document.name(), prompt)
                .flatMap(parser::parseSubject)
                .flatMap(suggestion -> {
                    String subject = SubjectCleaner.clean(suggestion.subject());
                    return subject == null
                            ? Optional.empty()
                            : Optional.of(new SubjectSuggestion(subject, suggestion.confidence(),
                                    suggestion.reasoning(), suggestion.suggestedFolder()));
                });
    }

    @Override
    public Optional<SimilarityVerdict> compareContent(String first, String second) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String prompt = SIMILARITY_PROMPT.formatted(
                head(first, properties.similarityBudget()),
                head(second, properties.similarityBudget()));
        return ask("similarity", "content comparison", prompt).flatMap(parser::parseSimilarity);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Optional<String> ask(String kind, String about, String prompt) {
        try {
            String answer = router.complete(SYSTEM_PROMPT, prompt);
            log.debug("[Oracle] {} answer for '{}': {}", kind, about, answer);
            return Optional.ofNullable(answer).filter(a -> !a.isBlank());
        } catch (RuntimeException e) {
            log.warn("[Oracle] {} request for '{}' failed: {}", kind, about, e.getMessage());
            return Optional.empty();
        }
    }

    private String metadataJson(NormalizedDocument document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new TreeMap<>(document.metadata()));
        } catch (JsonProcessingException e) {
            log.debug("[Oracle] Metadata of {} not serializable: {}", document.name(), e.getOriginalMessage());
            return "{}";
        }
    }

    private static String head(String text, int budget) {
        if (text == null) return "";
        return text.length() <= budget ? text : text.substring(0, budget);
    }
}
