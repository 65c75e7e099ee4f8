package com.faqchat.service.search;

import com.faqchat.config.ChatbotConfig;
import com.faqchat.dto.internal.MatchResult;
import com.faqchat.exception.DatasetException;
import com.faqchat.service.data.DataLoaderService;
import com.faqchat.support.TestFixtures;
import com.faqchat.util.TextNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.faqchat.support.TestFixtures.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FuzzyMatchServiceTest {

    private final ChatbotConfig config = TestFixtures.chatbotConfig();
    private final DataLoaderService loader = TestFixtures.loadedTestDataset();
    private final FuzzyMatchService service = new FuzzyMatchService(loader, new TextNormalizer(), config);

    @Test
    void exactQuestionScoresHighestAndFirst() {
        List<MatchResult> results = service.search("PIP-Makerとは何ですか？", null);

        assertThat(results).isNotEmpty();
        MatchResult best = results.get(0);
        assertThat(best.getEntry().getId()).isEqualTo(1);
        assertThat(best.getEntry().getCategory()).isEqualTo("general");
        assertThat(best.getScore()).isGreaterThanOrEqualTo(0.9);
        assertThat(best.getMatchedTerms()).contains("pip", "maker");
    }

    @Test
    void caseAndPunctuationDoNotMatter() {
        List<MatchResult> results = service.search("pip maker とは何ですか", null);

        assertThat(results.get(0).getEntry().getId()).isEqualTo(1);
        assertThat(results.get(0).getScore()).isGreaterThanOrEqualTo(0.9);
    }

    @Test
    void blankQueryYieldsNoResults() {
        assertThat(service.search("", null)).isEmpty();
        assertThat(service.search("   ", null)).isEmpty();
        assertThat(service.search("？？", null)).isEmpty();
    }

    @Test
    void resultsAreSortedAndWithinBounds() {
        List<MatchResult> results = service.search("対応言語", null, 0.0, 10);

        assertThat(results).hasSize(5);
        assertThat(results).allSatisfy(r -> assertThat(r.getScore()).isBetween(0.0, 1.0));
        for (int i = 1; i < results.size(); i++) {
            assertThat(results.get(i - 1).getScore()).isGreaterThanOrEqualTo(results.get(i).getScore());
        }
    }

    @Test
    void raisingThresholdOnlyRemovesResults() {
        String query = "料金プランを教えて";
        List<Integer> loose = ids(service.search(query, null, 0.05, 10));
        List<Integer> strict = ids(service.search(query, null, 0.3, 10));

        assertThat(loose).containsAll(strict);
        assertThat(loose.subList(0, strict.size())).isEqualTo(strict);
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> service.search("q", null, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.search("q", null, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void topKBoundsResultCount() {
        assertThat(service.search("アバター", null, 0.0, 2)).hasSize(2);
        assertThat(service.search("アバター", null, 0.0, 0)).isEmpty();
    }

    @Test
    void categoryFilterNarrowsCandidates() {
        List<MatchResult> results = service.search("何ですか", "FEATURES", 0.0, 10);

        assertThat(results).isNotEmpty()
                .allSatisfy(r -> assertThat(r.getEntry().getCategory()).isEqualTo("features"));
    }

    @Test
    void unknownCategoryFallsBackToAllEntries() {
        List<MatchResult> results = service.search("PIP-Makerとは何ですか？", "pricing");

        assertThat(results).isNotEmpty();
        assertThat(results.get(0).getEntry().getId()).isEqualTo(1);
    }

    @Test
    void tiesKeepDatasetOrder() {
        DataLoaderService duplicates = TestFixtures.loader("classpath:qa_test.csv");
        duplicates.install(List.of(
                entry(1, "導入の流れ", "first", "general"),
                entry(2, "導入の流れ", "second", "general"),
                entry(3, "導入の流れ", "third", "other")), "inline");
        FuzzyMatchService duplicateService = new FuzzyMatchService(duplicates, new TextNormalizer(), config);

        for (int run = 0; run < 3; run++) {
            assertThat(ids(duplicateService.search("導入の流れ", null)))
                    .containsExactly(1, 2, 3);
        }
    }

    @Test
    void indexFollowsReloadedSnapshot() {
        assertThat(service.search("PIP-Makerとは何ですか？", null)).isNotEmpty();

        loader.install(List.of(entry(1, "新しい質問です", "new", "general")), "inline");

        assertThat(service.search("新しい質問です", null))
                .singleElement()
                .satisfies(r -> assertThat(r.getEntry().getAnswer()).isEqualTo("new"));
    }

    @Test
    void missingDatasetIsReportedNotSwallowed() {
        FuzzyMatchService unloaded = new FuzzyMatchService(
                TestFixtures.loader("classpath:qa_test.csv"), new TextNormalizer(), config);

        assertThatThrownBy(() -> unloaded.search("anything", null))
                .isInstanceOf(DatasetException.class);
    }

    private static List<Integer> ids(List<MatchResult> results) {
        return results.stream().map(r -> r.getEntry().getId()).collect(Collectors.toList());
    }
}
