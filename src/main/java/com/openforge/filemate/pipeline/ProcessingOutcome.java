package com.openforge.filemate.pipeline;

import java.nio.file.Path;

/**
 * Result of handling one inbox file.
 *
 * @param plan   null when the file failed before a plan existed, or was skipped
 * @param backup null unless an existing archive file was renamed aside
 */
public record ProcessingOutcome(
        Status         status,
        Path           source,
        ProcessingPlan plan,
        Path           backup,
        String         message
) {

    public enum Status { PLANNED, ARCHIVED, FAILED, SKIPPED }

    public static ProcessingOutcome planned(ProcessingPlan plan) {
        return new ProcessingOutcome(Status.PLANNED, plan.source(), plan, null,
                "would archive as " + plan.decision().suggestedPath() + "/" + plan.filename());
    }

    public static ProcessingOutcome archived(ProcessingPlan plan, Path backup) {
        return new ProcessingOutcome(Status.ARCHIVED, plan.source(), plan, backup,
                "archived as " + plan.decision().suggestedPath() + "/" + plan.filename());
    }

    public static ProcessingOutcome failed(Path source, ProcessingPlan plan, String message) {
        return new ProcessingOutcome(Status.FAILED, source, plan, null, message);
    }

    public static ProcessingOutcome skipped(Path source, String reason) {
        return new ProcessingOutcome(Status.SKIPPED, source, null, null, reason);
    }

    public boolean succeeded() {
        return status == Status.PLANNED || status == Status.ARCHIVED;
    }
}
