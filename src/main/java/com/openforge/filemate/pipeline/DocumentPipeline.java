package com.openforge.filemate.pipeline;

import com.openforge.filemate.archive.ArchiveMover;
import com.openforge.filemate.archive.ArchiveOperationException;
import com.openforge.filemate.archive.ArchiveScanner;
import com.openforge.filemate.archive.ArchiveStructureReporter;
import com.openforge.filemate.archive.ArchiveUnavailableException;
import com.openforge.filemate.archive.MoveResult;
import com.openforge.filemate.classify.ClassificationDecision;
import com.openforge.filemate.classify.FolderCatalog;
import com.openforge.filemate.classify.FolderResolutionEngine;
import com.openforge.filemate.date.DateExtractionResult;
import com.openforge.filemate.date.DateResolver;
import com.openforge.filemate.document.DocumentException;
import com.openforge.filemate.document.DocumentReaders;
import com.openforge.filemate.document.NormalizedDocument;
import com.openforge.filemate.naming.FilenameBuilder;
import com.openforge.filemate.naming.SimilarityJudge;
import com.openforge.filemate.naming.VersionResolver;
import com.openforge.filemate.naming.VersionTag;
import com.openforge.filemate.oracle.OracleAdapter;
import com.openforge.filemate.oracle.OracleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Files one document: read → subject → date → folder → version → name → move.
 *
 * {@link #plan} decides without touching the archive, {@link #execute}
 * performs the move.  The folder catalog is scanned afresh for every plan,
 * so a folder created for the previous document is already visible.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@EnableConfigurationProperties({ProcessingProperties.class, OracleProperties.class})
public class DocumentPipeline {

    private final DocumentReaders          readers;
    private final SubjectExtractor         subjectExtractor;
    private final DateResolver             dateResolver;
    private final ArchiveScanner           scanner;
    private final FolderResolutionEngine   resolutionEngine;
    private final VersionResolver          versionResolver;
    private final FilenameBuilder          filenameBuilder;
    private final ArchiveMover             mover;
    private final ArchiveStructureReporter reporter;
    private final OracleAdapter            oracle;
    private final ProcessingProperties     processing;
    private final OracleProperties         oracleProperties;

    /**
     * Plans and, unless {@code dryRun}, executes.  Any per-document problem,
     * expected or not, becomes a FAILED outcome.
     *
     * @throws ArchiveUnavailableException the archive root is unusable; the caller should stop
     */
    public ProcessingOutcome process(Path source, boolean dryRun) {
        ProcessingPlan plan = null;
        try {
            plan = plan(source);
            return dryRun ? ProcessingOutcome.planned(plan) : execute(plan);
        } catch (ArchiveUnavailableException e) {
            throw e;
        } catch (DocumentException | ArchiveOperationException e) {
            log.error("[Pipeline] {} failed: {}", source.getFileName(), e.getMessage());
            return ProcessingOutcome.failed(source, plan, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Pipeline] {} failed unexpectedly: {}", source.getFileName(), e.getMessage(), e);
            return ProcessingOutcome.failed(source, plan, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public ProcessingPlan plan(Path source) {
        log.info("[Pipeline] Planning {}", source.getFileName());

        NormalizedDocument document = readers.read(source);
        String subject = subjectExtractor.extract(document);
        DateExtractionResult date = dateResolver.extractDate(document);

        FolderCatalog catalog = scanner.scanCatalog();
        String overview = oracle.isEnabled() && !catalog.isEmpty() ? reporter.overview() : null;
        ClassificationDecision decision = resolutionEngine.resolveFolder(subject, catalog, oracle, overview);

        Path targetFolder = scanner.resolve(decision.suggestedPath());
        List<Path> neighbours = decision.createNew() ? List.of() : scanner.listFiles(decision.suggestedPath());
        VersionTag version = versionResolver.determineVersion(subject, neighbours, judgeFor(document));

        String filename = filenameBuilder.buildFilename(subject, date.date(), version, document.extension());
        Path targetPath = targetFolder.resolve(filename);

        String warning = null;
        if (Files.exists(targetPath)) {
            warning = "Target " + filename + " already exists and will be backed up";
            log.warn("[Pipeline] {}", warning);
        }

        ProcessingPlan plan = ProcessingPlan.builder()
                .source(source)
                .document(document)
                .subject(subject)
                .date(date)
                .version(version)
                .filename(filename)
                .decision(decision)
                .targetFolder(targetFolder)
                .targetPath(targetPath)
                .warning(warning)
                .build();
        log.info("[Pipeline] {} → {}/{} ({}, date {} from {})", source.getFileName(),
                decision.suggestedPath(), filename, decision.stage(), date.date(), date.source());
        return plan;
    }

    public ProcessingOutcome execute(ProcessingPlan plan) {
        MoveResult result = mover.move(plan.source(), plan.targetPath());
        reporter.write();
        return ProcessingOutcome.archived(plan, result.backup());
    }

    private SimilarityJudge judgeFor(NormalizedDocument document) {
        if (!processing.similarityCheck() || !oracle.isEnabled()) {
            return null;
        }
        return new ContentSimilarityJudge(readers, oracle, document.content(), oracleProperties.similarityThreshold());
    }
}
