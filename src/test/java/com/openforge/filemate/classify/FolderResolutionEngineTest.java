package com.openforge.filemate.classify;

import com.openforge.filemate.catalog.ClassificationStrategy;
import com.openforge.filemate.catalog.DefaultRuleCatalog;
import com.openforge.filemate.catalog.GenericRuleTable;
import com.openforge.filemate.catalog.RuleCatalog;
import com.openforge.filemate.naming.NamingProperties;
import com.openforge.filemate.oracle.FolderSuggestion;
import com.openforge.filemate.oracle.OracleAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FolderResolutionEngineTest {

    private final FolderResolutionEngine engine = new FolderResolutionEngine(
            DefaultRuleCatalog.create(), GenericRuleTable.standard(), NamingProperties.defaults());

    @Mock
    private OracleAdapter oracle;

    @Test
    void categoryKeywordsSelectExistingFolderByPattern() {
        FolderCatalog catalog = FolderCatalog.of("技术方案/DevOps运维", "项目文档");

        ClassificationDecision decision = engine.resolveFolder("运维部署方案", catalog);

        assertThat(decision.suggestedPath()).isEqualTo("技术方案/DevOps运维");
        assertThat(decision.createNew()).isFalse();
        assertThat(decision.stage()).isEqualTo(ResolutionStage.CATEGORY_MATCH);
    }

    @Test
    void emptyArchiveGetsFolderNamedAfterSubject() {
        ClassificationDecision decision = engine.resolveFolder("Q3 Report", FolderCatalog.empty());

        assertThat(decision.suggestedPath()).isEqualTo("Q3 Report");
        assertThat(decision.createNew()).isTrue();
        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_FROM_SUBJECT);
    }

    @Test
    void folderNameInSubjectIsAnExactMatch() {
        FolderCatalog catalog = FolderCatalog.of("项目文档", "技术方案/DevOps运维");

        ClassificationDecision decision = engine.resolveFolder("项目文档整理清单", catalog);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.EXACT_MATCH);
        assertThat(decision.suggestedPath()).isEqualTo("项目文档");
    }

    @Test
    void qualifyingCategoryWithoutFolderCreatesItsPrimaryPattern() {
        FolderCatalog catalog = FolderCatalog.of("财务");

        ClassificationDecision decision = engine.resolveFolder("docker 容器 升级", catalog);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.CATEGORY_NEW_FOLDER);
        assertThat(decision.suggestedPath()).isEqualTo("容器化部署");
        assertThat(decision.createNew()).isTrue();
    }

    @Test
    void newCategoryFolderIsNotProposedWhenDisallowed() {
        RuleCatalog noNewFolders = new RuleCatalog(
                DefaultRuleCatalog.create().categories(),
                List.of("其他"),
                new ClassificationStrategy(0.3, false, true));
        FolderResolutionEngine strict = new FolderResolutionEngine(
                noNewFolders, GenericRuleTable.standard(), NamingProperties.defaults());

        ClassificationDecision decision = strict.resolveFolder("docker 容器 升级", FolderCatalog.of("财务"));

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_GENERIC);
        assertThat(decision.suggestedPath()).isEqualTo("财务");
        assertThat(decision.createNew()).isFalse();
    }

    @Test
    void folderNameContainingTheSubjectIsASimilarityMatch() {
        FolderCatalog catalog = FolderCatalog.of("Sales Reports", "zeta");

        ClassificationDecision decision = engine.resolveFolder("sales", catalog);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.SIMILARITY_MATCH);
        assertThat(decision.suggestedPath()).isEqualTo("Sales Reports");
    }

    @Test
    void sharedTokenAloneReachesTheSimilarityThreshold() {
        FolderCatalog catalog = FolderCatalog.of("Sales Team", "zeta");

        ClassificationDecision decision = engine.resolveFolder("weekly sales sync", catalog);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.SIMILARITY_MATCH);
        assertThat(decision.suggestedPath()).isEqualTo("Sales Team");
    }

    @Test
    void oracleSuggestionForExistingFolderIsAccepted() {
        FolderCatalog catalog = FolderCatalog.of("archive/misc", "zeta");
        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestFolder(eq("random words"), eq(catalog), any()))
                .thenReturn(Optional.of(new FolderSuggestion("/zeta/", false, "closest fit")));

        ClassificationDecision decision = engine.resolveFolder("random words", catalog, oracle, "## tree");

        assertThat(decision.stage()).isEqualTo(ResolutionStage.ORACLE);
        assertThat(decision.suggestedPath()).isEqualTo("zeta");
        assertThat(decision.reasoning()).isEqualTo("closest fit");
        assertThat(decision.createNew()).isFalse();
    }

    @Test
    void oracleSuggestionOutsideCatalogIsIgnored() {
        FolderCatalog catalog = FolderCatalog.of("archive/misc", "zeta");
        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestFolder(anyString(), any(), any()))
                .thenReturn(Optional.of(new FolderSuggestion("brand/new", true, "invented")));

        ClassificationDecision decision = engine.resolveFolder("random words", catalog, oracle);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_GENERIC);
        assertThat(decision.suggestedPath()).isEqualTo("archive/misc");
        assertThat(decision.createNew()).isFalse();
    }

    @Test
    void oracleAnswerFlaggedAsNewFolderIsIgnoredEvenForCatalogPath() {
        FolderCatalog catalog = FolderCatalog.of("archive/misc", "zeta");
        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestFolder(anyString(), any(), any()))
                .thenReturn(Optional.of(new FolderSuggestion("zeta", true, "start over")));

        ClassificationDecision decision = engine.resolveFolder("random words", catalog, oracle);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_GENERIC);
        assertThat(decision.suggestedPath()).isEqualTo("archive/misc");
    }

    @Test
    void forcedResolutionTriesEveryGenericGroupWithAKeywordHit() {
        // "系统" hits the technology group first, but only the meetings group has a folder
        FolderCatalog catalog = FolderCatalog.of("aaa", "会议记录");

        ClassificationDecision decision = engine.resolveFolder("系统会议", catalog);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_CATEGORY);
        assertThat(decision.suggestedPath()).isEqualTo("会议记录");
        assertThat(decision.createNew()).isFalse();
    }

    @Test
    void failingOracleFallsThroughToForcedResolution() {
        FolderCatalog catalog = FolderCatalog.of("archive/misc", "zeta");
        when(oracle.isEnabled()).thenReturn(true);
        when(oracle.suggestFolder(anyString(), any(), any())).thenThrow(new IllegalStateException("timeout"));

        ClassificationDecision decision = engine.resolveFolder("random words", catalog, oracle);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_GENERIC);
        assertThat(decision.suggestedPath()).isEqualTo("archive/misc");
    }

    @Test
    void disabledOracleIsNotAsked() {
        when(oracle.isEnabled()).thenReturn(false);

        engine.resolveFolder("random words", FolderCatalog.of("zeta"), oracle);

        verify(oracle, never()).suggestFolder(anyString(), any(), any());
    }

    @Test
    void oracleIsNotAskedForAnEmptyArchive() {
        ClassificationDecision decision = engine.resolveFolder("random words", FolderCatalog.empty(), oracle);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_FROM_SUBJECT);
        verify(oracle, never()).isEnabled();
    }

    @Test
    void genericRuleFindsFolderWhenCategoryScoreIsTooLow() {
        FolderCatalog catalog = FolderCatalog.of("其他", "技术");

        ClassificationDecision decision = engine.resolveFolder("代码评审", catalog);

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_CATEGORY);
        assertThat(decision.suggestedPath()).isEqualTo("技术");
    }

    @Test
    void emptyArchiveUsesWeakCategoryMatchForNewFolder() {
        ClassificationDecision decision = engine.resolveFolder("代码评审", FolderCatalog.empty());

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_CATEGORY_NEW);
        assertThat(decision.suggestedPath()).isEqualTo("技术方案");
        assertThat(decision.createNew()).isTrue();
    }

    @Test
    void blankSubjectOnEmptyArchiveUsesFallbackSubject() {
        ClassificationDecision decision = engine.resolveFolder("   ", FolderCatalog.empty());

        assertThat(decision.suggestedPath()).isEqualTo("未分类文档");
        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_FROM_SUBJECT);
    }

    @Test
    void blankSubjectPrefersTopLevelFolder() {
        ClassificationDecision decision = engine.resolveFolder(null, FolderCatalog.of("a/b", "z"));

        assertThat(decision.stage()).isEqualTo(ResolutionStage.FORCED_GENERIC);
        assertThat(decision.suggestedPath()).isEqualTo("z");
    }

    @Test
    void subjectIsSanitizedWhenItBecomesAFolder() {
        ClassificationDecision decision = engine.resolveFolder("A/B: plan?", FolderCatalog.empty());

        assertThat(decision.suggestedPath()).isEqualTo("A／B： plan？");
    }

    @Test
    void nonEmptyCatalogOnlyYieldsNewFoldersFromCreatingStages() {
        FolderCatalog catalog = FolderCatalog.of("技术方案/DevOps运维", "项目文档", "其他", "Sales Team");
        List<String> subjects = List.of(
                "运维部署方案", "docker 容器", "weekly sales sync", "random words",
                "代码评审", "年度预算", "", "项目计划 v2");

        for (String subject : subjects) {
            ClassificationDecision decision = engine.resolveFolder(subject, catalog);
            if (decision.createNew()) {
                assertThat(decision.stage().createsFolders()).isTrue();
            } else {
                assertThat(catalog.contains(decision.suggestedPath()))
                        .as("existing folder for '%s'", subject)
                        .isTrue();
            }
        }
    }

    @Test
    void repeatedCallsGiveTheSameDecision() {
        FolderCatalog catalog = FolderCatalog.of("技术方案/DevOps运维", "项目文档");

        assertThat(engine.resolveFolder("运维部署方案", catalog))
                .isEqualTo(engine.resolveFolder("运维部署方案", catalog));
        assertThat(engine.resolveFolder("Q3 Report", FolderCatalog.empty()))
                .isEqualTo(engine.resolveFolder("Q3 Report", FolderCatalog.empty()));
    }
}
