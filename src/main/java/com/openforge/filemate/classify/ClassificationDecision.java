package com.openforge.filemate.classify;

/**
 * Where a document goes.
 *
 * @param suggestedPath "/"-joined path relative to the archive root
 * @param createNew     true only when the folder is not in the catalog yet
 * @param reasoning     human-readable explanation, logged and shown in dry runs
 * @param stage         the resolution step that decided
 */
public record ClassificationDecision(
        String          suggestedPath,
        boolean         createNew,
        String          reasoning,
        ResolutionStage stage
) {

    public ClassificationDecision {
        suggestedPath = FolderCatalog.normalize(suggestedPath);
        if (suggestedPath.isEmpty()) {
            throw new IllegalArgumentException("suggested path must not be empty");
        }
        if (createNew && !stage.createsFolders()) {
            throw new IllegalArgumentException("stage " + stage + " cannot create folders");
        }
    }

    static ClassificationDecision existing(String path, ResolutionStage stage, String reasoning) {
        return new ClassificationDecision(path, false, reasoning, stage);
    }

    static ClassificationDecision newFolder(String path, ResolutionStage stage, String reasoning) {
        return new ClassificationDecision(path, true, reasoning, stage);
    }
}
