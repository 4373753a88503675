package com.openforge.filemate.pipeline;

import com.openforge.filemate.archive.ArchiveUnavailableException;
import com.openforge.filemate.classify.FolderCatalog;
import com.openforge.filemate.classify.ResolutionStage;
import com.openforge.filemate.date.DateSource;
import com.openforge.filemate.oracle.FolderSuggestion;
import com.openforge.filemate.oracle.OracleAdapter;
import com.openforge.filemate.oracle.SimilarityVerdict;
import com.openforge.filemate.oracle.SubjectSuggestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentPipelineTest {

    @TempDir
    Path tempDir;

    @Mock
    private OracleAdapter oracle;

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        lenient().when(oracle.isEnabled()).thenReturn(false);
        fixture = new PipelineFixture(tempDir.resolve("kb"), Files.createDirectories(tempDir.resolve("inbox")), oracle);
    }

    @Test
    void dryRunPlansWithoutTouchingAnything() throws IOException {
        Files.createDirectories(fixture.root.resolve("技术方案/DevOps运维"));
        Path source = inboxFile("运维部署方案.txt", "会议时间：2024年3月15日\n部署步骤");

        ProcessingOutcome outcome = fixture.pipeline.process(source, true);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.PLANNED);
        ProcessingPlan plan = outcome.plan();
        assertThat(plan.subject()).isEqualTo("运维部署方案");
        assertThat(plan.date().date()).isEqualTo("20240315");
        assertThat(plan.date().source()).isEqualTo(DateSource.CONTENT);
        assertThat(plan.decision().stage()).isEqualTo(ResolutionStage.CATEGORY_MATCH);
        assertThat(plan.filename()).isEqualTo("运维部署方案_20240315_v1.0.txt");
        assertThat(plan.targetPath()).isEqualTo(fixture.root.resolve("技术方案/DevOps运维/运维部署方案_20240315_v1.0.txt"));
        assertThat(outcome.message()).isEqualTo("would archive as 技术方案/DevOps运维/运维部署方案_20240315_v1.0.txt");
        assertThat(source).exists();
        assertThat(plan.targetPath()).doesNotExist();
        assertThat(fixture.root.resolve("structure.md")).doesNotExist();
    }

    @Test
    void executeMovesAndRefreshesStructureReport() throws IOException {
        Files.createDirectories(fixture.root.resolve("技术方案/DevOps运维"));
        Path source = inboxFile("运维部署方案.txt", "日期: 2024-03-15\n部署步骤");

        ProcessingOutcome outcome = fixture.pipeline.process(source, false);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.ARCHIVED);
        assertThat(source).doesNotExist();
        assertThat(fixture.root.resolve("技术方案/DevOps运维/运维部署方案_20240315_v1.0.txt"))
                .usingCharset(StandardCharsets.UTF_8)
                .hasContent("日期: 2024-03-15\n部署步骤");
        assertThat(Files.readString(fixture.root.resolve("structure.md"))).contains("- DevOps运维/ (1 files)");
    }

    @Test
    void earlierVersionInTargetFolderIsAdvanced() throws IOException {
        Path folder = Files.createDirectories(fixture.root.resolve("技术方案/DevOps运维"));
        Files.writeString(folder.resolve("运维部署方案_20240101_v1.0.txt"), "old");
        Files.writeString(folder.resolve("运维部署方案_20240201_v1.1.txt"), "older");
        Path source = inboxFile("运维部署方案.txt", "date 2024-03-15");

        ProcessingPlan plan = fixture.pipeline.plan(source);

        assertThat(plan.version()).hasToString("v1.2");
        assertThat(plan.filename()).isEqualTo("运维部署方案_20240315_v1.2.txt");
    }

    @Test
    void folderCreatedForOneDocumentIsSeenByTheNext() throws IOException {
        Path first = inboxFile("Q3 Report.txt", "Date: 2024-05-31\nnumbers");
        Path second = inboxFile("Q3 Report (copy).txt", "Date: 2024-05-31\nmore numbers");

        ProcessingOutcome one = fixture.pipeline.process(first, false);
        ProcessingOutcome two = fixture.pipeline.process(second, false);

        assertThat(one.plan().decision().stage()).isEqualTo(ResolutionStage.FORCED_FROM_SUBJECT);
        assertThat(one.plan().decision().createNew()).isTrue();
        assertThat(one.plan().filename()).isEqualTo("Q3 Report_20240531_v1.0.txt");

        assertThat(two.plan().decision().stage()).isEqualTo(ResolutionStage.EXACT_MATCH);
        assertThat(two.plan().decision().suggestedPath()).isEqualTo("Q3 Report");
        assertThat(two.plan().decision().createNew()).isFalse();
        assertThat(two.plan().filename()).isEqualTo("Q3 Report (copy)_20240531_v1.1.txt");
        assertThat(fixture.root.resolve("Q3 Report")).isDirectoryContaining(p -> p.getFileName().toString().endsWith("v1.1.txt"));
    }

    @Test
    void oracleSubjectFolderAndSimilarityAreUsedWhenEnabled() throws IOException {
        Path folder = Files.createDirectories(fixture.root.resolve("技术方案/DevOps运维"));
        Files.writeString(folder.resolve("部署手册_20240101_v1.0.txt"), "旧版手册");
        Path source = inboxFile("scan_0001.txt", "发布时间 2024-04-02\n新版手册");

        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestSubject(any())).thenReturn(Optional.of(new SubjectSuggestion("部署手册", 0.9, "", null)));
        when(oracle.suggestFolder(eq("部署手册"), any(FolderCatalog.class), anyString()))
                .thenReturn(Optional.of(new FolderSuggestion("技术方案/DevOps运维", false, "ops manual")));
        when(oracle.compareContent(anyString(), eq("旧版手册")))
                .thenReturn(Optional.of(new SimilarityVerdict(true, 0.9, "same manual")));

        ProcessingPlan plan = fixture.pipeline.plan(source);

        assertThat(plan.subject()).isEqualTo("部署手册");
        assertThat(plan.decision().stage()).isEqualTo(ResolutionStage.ORACLE);
        assertThat(plan.filename()).isEqualTo("部署手册_20240402_v1.1.txt");
    }

    @Test
    void dissimilarContentStartsAtInitialVersion() throws IOException {
        Path folder = Files.createDirectories(fixture.root.resolve("技术方案/DevOps运维"));
        Files.writeString(folder.resolve("部署手册_20240101_v1.0.txt"), "unrelated");
        Path source = inboxFile("scan_0001.txt", "发布时间 2024-04-02\n新版手册");

        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestSubject(any())).thenReturn(Optional.of(new SubjectSuggestion("部署手册", 0.9, "", null)));
        when(oracle.suggestFolder(anyString(), any(FolderCatalog.class), anyString()))
                .thenReturn(Optional.of(new FolderSuggestion("技术方案/DevOps运维", false, "ops manual")));
        when(oracle.compareContent(anyString(), anyString()))
                .thenReturn(Optional.of(new SimilarityVerdict(true, 0.5, "weak")));

        assertThat(fixture.pipeline.plan(source).version()).hasToString("v1.0");
    }

    @Test
    void unsupportedDocumentIsAFailedOutcome() throws IOException {
        Path source = inboxFile("slides.pptx", "binary");

        ProcessingOutcome outcome = fixture.pipeline.process(source, false);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.FAILED);
        assertThat(outcome.plan()).isNull();
        assertThat(outcome.message()).contains(".pptx");
        assertThat(source).exists();
    }

    @Test
    void archivedTagThatCannotAdvanceIsIgnored() throws IOException {
        Files.createDirectories(fixture.root.resolve("plan"));
        Files.writeString(fixture.root.resolve("plan/plan_v1.2147483647.txt"), "old");
        Path source = inboxFile("plan.txt", "notes");

        ProcessingOutcome outcome = fixture.pipeline.process(source, true);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.PLANNED);
        assertThat(outcome.plan().decision().suggestedPath()).isEqualTo("plan");
        assertThat(outcome.plan().version()).hasToString("v1.0");
    }

    @Test
    void unexpectedFailureIsAFailedOutcome() throws IOException {
        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestSubject(any())).thenThrow(new IllegalStateException("boom"));
        Path source = inboxFile("notes.txt", "notes");

        ProcessingOutcome outcome = fixture.pipeline.process(source, false);

        assertThat(outcome.status()).isEqualTo(ProcessingOutcome.Status.FAILED);
        assertThat(outcome.message()).isEqualTo("IllegalStateException: boom");
        assertThat(source).exists();
    }

    @Test
    void unusableArchiveRootStopsProcessing() throws IOException {
        Path blocked = Files.writeString(tempDir.resolve("blocked"), "not a folder");
        PipelineFixture broken = new PipelineFixture(blocked, fixture.inbox, oracle);
        Path source = inboxFile("Q3 Report.txt", "numbers");

        assertThatThrownBy(() -> broken.pipeline.process(source, false))
                .isInstanceOf(ArchiveUnavailableException.class);
        assertThat(source).exists();
    }

    private Path inboxFile(String name, String content) throws IOException {
        return Files.writeString(fixture.inbox.resolve(name), content);
    }
}
