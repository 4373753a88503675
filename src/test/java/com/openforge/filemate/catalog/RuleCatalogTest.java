package com.openforge.filemate.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RuleCatalogTest {

    @Test
    void scoreIsMatchedOverTotalKeywords() {
        Category category = new Category("ops", List.of("运维", "部署", "Docker", "k8s"), List.of("ops"), 1);

        CategoryMatch match = category.score("docker 部署手册");

        assertThat(match.matchedKeywords()).isEqualTo(2);
        assertThat(match.score()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void categoryDropsBlankAndDuplicateEntries() {
        Category category = new Category("x", List.of("a", " a ", "", "b"), null, 1);

        assertThat(category.keywords()).containsExactly("a", "b");
        assertThat(category.targetPatterns()).isEmpty();
        assertThat(category.primaryPattern()).isNull();
    }

    @Test
    void bestMatchRespectsThreshold() {
        RuleCatalog catalog = DefaultRuleCatalog.create();

        assertThat(catalog.bestMatch("代码评审")).isEmpty();
        assertThat(catalog.bestMatch("代码评审", 0.0)).get()
                .extracting(m -> m.category().name()).isEqualTo("技术开发");
    }

    @Test
    void thresholdZeroStillNeedsAKeywordHit() {
        assertThat(DefaultRuleCatalog.create().bestMatch("Q3 Report", 0.0)).isEmpty();
    }

    @Test
    void equalScoresAreBrokenByPriority() {
        RuleCatalog catalog = new RuleCatalog(List.of(
                new Category("late", List.of("alpha", "beta"), List.of("Late"), 5),
                new Category("early", List.of("alpha", "gamma"), List.of("Early"), 2)),
                List.of(), ClassificationStrategy.defaults());

        assertThat(catalog.bestMatch("alpha")).get()
                .extracting(m -> m.category().name()).isEqualTo("early");
    }

    @Test
    void equalScoreAndPriorityKeepsDeclarationOrder() {
        RuleCatalog catalog = new RuleCatalog(List.of(
                new Category("first", List.of("alpha"), List.of("A"), 1),
                new Category("second", List.of("alpha"), List.of("B"), 1)),
                List.of(), ClassificationStrategy.defaults());

        assertThat(catalog.bestMatch("alpha")).get()
                .extracting(m -> m.category().name()).isEqualTo("first");
    }

    @Test
    void strategyThresholdMustBeAFraction() {
        assertThatThrownBy(() -> new ClassificationStrategy(1.2, true, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void genericTableFiresOnSingleKeyword() {
        GenericRuleTable table = GenericRuleTable.standard();

        assertThat(table.firstHit("年度预算")).get().extracting(Category::name).isEqualTo("finance");
        assertThat(table.firstHit("项目代码")).get().extracting(Category::name).isEqualTo("technology");
        assertThat(table.firstHit("zzz")).isEmpty();
    }
}
