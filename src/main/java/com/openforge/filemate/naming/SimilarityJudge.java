package com.openforge.filemate.naming;

import java.nio.file.Path;

/**
 * Second opinion on whether an archived file is an earlier copy of the
 * document being filed.  Consulted only for files whose name already shares
 * a keyword with the new subject.
 */
@FunctionalInterface
public interface SimilarityJudge {

    boolean isSameDocument(Path archivedFile);
}
