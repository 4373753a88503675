package com.openforge.filemate.oracle;

import com.openforge.filemate.classify.FolderCatalog;
import com.openforge.filemate.document.NormalizedDocument;

import java.util.Optional;

/**
 * External judgment used where keyword rules run out: placing a document in
 * an existing folder, naming its subject, and telling whether two texts are
 * versions of the same document.
 *
 * Implementations never throw: a failed, timed-out or unusable answer is an
 * empty Optional and the caller carries on with its own fallback.
 */
public interface OracleAdapter {

    boolean isEnabled();

    Optional<FolderSuggestion> suggestFolder(String subject, FolderCatalog catalog, String structureOverview);

    Optional<SubjectSuggestion> suggestSubject(NormalizedDocument document);

    Optional<SimilarityVerdict> compareContent(String first, String second);
}
