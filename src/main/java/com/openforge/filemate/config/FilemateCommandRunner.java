package com.openforge.filemate.config;

import com.openforge.filemate.archive.ArchiveMover;
import com.openforge.filemate.archive.ArchiveProperties;
import com.openforge.filemate.archive.ArchiveScanner;
import com.openforge.filemate.archive.ArchiveStructureReporter;
import com.openforge.filemate.document.DocumentReaders;
import com.openforge.filemate.oracle.OracleAdapter;
import com.openforge.filemate.pipeline.BatchSummary;
import com.openforge.filemate.pipeline.InboxProcessor;
import com.openforge.filemate.pipeline.InboxWatcher;
import com.openforge.filemate.pipeline.ProcessingOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 *
 *   (no options)      file everything in the configured inbox once
 *   --folder=<dir>    use another inbox
 *   --watch           keep running and file documents as they arrive
 *   --dry-run         plan only, move nothing
 *   --check           verify configuration, archive and oracle, then exit
 *   <file> ...        file just these documents
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
public class FilemateCommandRunner implements ApplicationRunner {

    private final ArchiveProperties        archive;
    private final InboxProcessor           inboxProcessor;
    private final InboxWatcher             watcher;
    private final ArchiveMover             mover;
    private final ArchiveScanner           scanner;
    private final ArchiveStructureReporter reporter;
    private final DocumentReaders          readers;
    private final OracleAdapter            oracle;

    @Override
    public void run(ApplicationArguments args) {
        boolean dryRun = args.containsOption("dry-run");
        Path inbox = args.containsOption("folder") && !args.getOptionValues("folder").isEmpty()
                ? Path.of(args.getOptionValues("folder").get(0)).toAbsolutePath().normalize()
                : archive.inboxPath();

        if (args.containsOption("check")) {
            check(inbox);
            return;
        }

        mover.ensureWritableRoot();
        if (!dryRun && reporter.isEnabled()) {
            reporter.write();
        }

        if (!args.getNonOptionArgs().isEmpty()) {
            List<ProcessingOutcome> outcomes = new ArrayList<>();
            for (String file : args.getNonOptionArgs()) {
                outcomes.add(inboxProcessor.processOne(Path.of(file).toAbsolutePath().normalize(), dryRun));
            }
            report(BatchSummary.of(outcomes));
            return;
        }

        if (args.containsOption("watch")) {
            try {
                watcher.watch(inbox, dryRun);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot watch " + inbox, e);
            }
            return;
        }

        report(inboxProcessor.processAll(inbox, dryRun));
    }

    private void check(Path inbox) {
        mover.ensureWritableRoot();
        log.info("[Check] Archive root  : {} ({} folders)", scanner.root(), scanner.scanCatalog().size());
        log.info("[Check] Inbox         : {}", inbox);
        log.info("[Check] Readers       : {}", readers.supportedExtensions());
        log.info("[Check] Oracle        : {}", oracle.isEnabled() ? "enabled" : "disabled");
        log.info("[Check] Configuration OK");
    }

    private static void report(BatchSummary summary) {
        for (ProcessingOutcome outcome : summary.outcomes()) {
            log.info("  {} {} — {}", outcome.status(), outcome.source().getFileName(), outcome.message());
        }
        log.info("[Run] {} document(s): {} succeeded, {} failed, {} skipped",
                summary.total(), summary.succeeded(), summary.failed(), summary.skipped());
    }
}
