package com.openforge.filemate.pipeline;

import com.openforge.filemate.document.DocumentException;
import com.openforge.filemate.document.DocumentReaders;
import com.openforge.filemate.naming.SimilarityJudge;
import com.openforge.filemate.oracle.OracleAdapter;
import com.openforge.filemate.oracle.SimilarityVerdict;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Asks the oracle whether an archived file holds the same document as the one
 * being filed.  An unreadable file or a missing verdict counts as "different".
 */
@Slf4j
class ContentSimilarityJudge implements SimilarityJudge {

    private final DocumentReaders readers;
    private final OracleAdapter   oracle;
    private final String          content;
    private final double          threshold;

    ContentSimilarityJudge(DocumentReaders readers, OracleAdapter oracle, String content, double threshold) {
        this.readers   = readers;
        this.oracle    = oracle;
        this.content   = content;
        this.threshold = threshold;
    }

    @Override
    public boolean isSameDocument(Path archivedFile) {
        if (!readers.supports(archivedFile)) {
            return false;
        }
        String archived;
        try {
            archived = readers.read(archivedFile).content();
        } catch (DocumentException e) {
            log.debug("[Version] Cannot read {} for comparison: {}", archivedFile.getFileName(), e.getMessage());
            return false;
        }
        Optional<SimilarityVerdict> verdict = oracle.compareContent(content, archived);
        boolean same = verdict.map(v -> v.similar() && v.score() >= threshold).orElse(false);
        log.debug("[Version] {} same document: {}", archivedFile.getFileName(), same);
        return same;
    }
}
