package com.openforge.filemate.classify;

/**
 * Which step of {@link FolderResolutionEngine} produced a decision.
 * Only the stages flagged {@code createsFolders} may propose a folder that
 * does not exist yet.
 */
public enum ResolutionStage {

    EXACT_MATCH(false),
    CATEGORY_MATCH(false),
    CATEGORY_NEW_FOLDER(true),
    SIMILARITY_MATCH(false),
    ORACLE(false),
    FORCED_CATEGORY(false),
    FORCED_GENERIC(false),
    FORCED_CATEGORY_NEW(true),
    FORCED_FROM_SUBJECT(true);

    private final boolean createsFolders;

    ResolutionStage(boolean createsFolders) {
        this.createsFolders = createsFolders;
    }

    public boolean createsFolders() {
        return createsFolders;
    }
}
