package com.openforge.filemate.pipeline;

import com.openforge.filemate.document.NormalizedDocument;
import com.openforge.filemate.naming.NamingProperties;
import com.openforge.filemate.oracle.OracleAdapter;
import com.openforge.filemate.oracle.SubjectCleaner;
import com.openforge.filemate.oracle.SubjectSuggestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The subject a document is filed under: the oracle's reading of the content
 * when available, otherwise its title property, file stem, or the configured
 * fallback subject.
 */
@Slf4j
@Component
public class SubjectExtractor {

    private final OracleAdapter oracle;
    private final String        fallbackSubject;

    public SubjectExtractor(OracleAdapter oracle, NamingProperties naming) {
        this.oracle          = oracle;
        this.fallbackSubject = naming.fallbackSubject();
    }

    public String extract(NormalizedDocument document) {
        if (oracle != null && oracle.isEnabled()) {
            Optional<SubjectSuggestion> suggestion = oracle.suggestSubject(document);
            if (suggestion.isPresent()) {
                log.info("[Subject] {} → '{}' (oracle, confidence {})",
                        document.name(), suggestion.get().subject(), suggestion.get().confidence());
                return suggestion.get().subject();
            }
            log.info("[Subject] Oracle gave no subject for {} — using fallback", document.name());
        }
        String subject = SubjectCleaner.fallback(document, fallbackSubject);
        log.info("[Subject] {} → '{}'", document.name(), subject);
        return subject;
    }
}
