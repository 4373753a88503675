package com.openforge.filemate.pipeline;

import java.util.List;

/** Counts for one inbox run; dry-run plans count as succeeded. */
public record BatchSummary(int total, int succeeded, int failed, int skipped, List<ProcessingOutcome> outcomes) {

    public static BatchSummary of(List<ProcessingOutcome> outcomes) {
        int succeeded = 0;
        int failed    = 0;
        int skipped   = 0;
        for (ProcessingOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case PLANNED, ARCHIVED -> succeeded++;
                case FAILED            -> failed++;
                case SKIPPED           -> skipped++;
            }
        }
        return new BatchSummary(outcomes.size(), succeeded, failed, skipped, List.copyOf(outcomes));
    }

    public static BatchSummary empty() {
        return of(List.of());
    }
}
