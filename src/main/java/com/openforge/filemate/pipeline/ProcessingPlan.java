package com.openforge.filemate.pipeline;

import com.openforge.filemate.classify.ClassificationDecision;
import com.openforge.filemate.date.DateExtractionResult;
import com.openforge.filemate.document.NormalizedDocument;
import com.openforge.filemate.naming.VersionTag;
import lombok.Builder;

import java.nio.file.Path;

/**
 * Everything decided about one inbox document before anything is moved.
 *
 * @param targetFolder absolute folder inside the archive
 * @param targetPath   targetFolder + filename
 * @param warning      set when a file already exists at targetPath; it will be backed up
 */
@Builder
public record ProcessingPlan(
        Path                   source,
        NormalizedDocument     document,
        String                 subject,
        DateExtractionResult   date,
        VersionTag             version,
        String                 filename,
        ClassificationDecision decision,
        Path                   targetFolder,
        Path                   targetPath,
        String                 warning
) {

    public boolean hasWarning() {
        return warning != null;
    }
}
