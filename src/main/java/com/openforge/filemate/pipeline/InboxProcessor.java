package com.openforge.filemate.pipeline;

import com.openforge.filemate.archive.ArchiveUnavailableException;
import com.openforge.filemate.document.DocumentReaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Runs every document currently in an inbox through the pipeline, one at a
 * time in name order.  A failing document is recorded and the batch goes on;
 * only an unusable archive stops it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboxProcessor {

    private final DocumentPipeline     pipeline;
    private final DocumentReaders      readers;
    private final ProcessingProperties processing;

    public BatchSummary processAll(Path inbox, boolean dryRun) {
        if (!Files.isDirectory(inbox)) {
            try {
                Files.createDirectories(inbox);
                log.info("[Inbox] Created inbox {}", inbox);
            } catch (IOException e) {
                log.error("[Inbox] Inbox {} is missing and cannot be created: {}", inbox, e.getMessage());
            }
            return BatchSummary.empty();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(inbox)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(f -> !f.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("[Inbox] Cannot list {}: {}", inbox, e.getMessage());
            return BatchSummary.empty();
        }
        log.info("[Inbox] {} file(s) in {}{}", files.size(), inbox, dryRun ? " (dry run)" : "");

        List<ProcessingOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            ProcessingOutcome outcome;
            try {
                outcome = processOne(file, dryRun);
            } catch (ArchiveUnavailableException e) {
                log.error("[Inbox] Archive unavailable, stopping batch: {}", e.getMessage());
                throw e;
            }
            outcomes.add(outcome);
        }

        BatchSummary summary = BatchSummary.of(outcomes);
        log.info("[Inbox] Done: {} total, {} succeeded, {} failed, {} skipped",
                summary.total(), summary.succeeded(), summary.failed(), summary.skipped());
        return summary;
    }

    /** Single file, with the same skip rules as a batch. */
    public ProcessingOutcome processOne(Path file, boolean dryRun) {
        String reason = skipReason(file);
        if (reason != null) {
            log.debug("[Inbox] Skipping {}: {}", file.getFileName(), reason);
            return ProcessingOutcome.skipped(file, reason);
        }
        ProcessingOutcome outcome = pipeline.process(file, dryRun);
        log.info("[Inbox] {} {}: {}", outcome.status(), file.getFileName(), outcome.message());
        return outcome;
    }

    String skipReason(Path file) {
        String name = file.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).startsWith("readme")) {
            return "readme";
        }
        String extension = DocumentReaders.extensionOf(file);
        if (!processing.accepts(extension) || !readers.supports(file)) {
            return "unsupported type " + (extension.isEmpty() ? "(none)" : extension);
        }
        return null;
    }
}
