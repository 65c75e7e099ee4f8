package com.faqchat.service.citation;

import com.faqchat.dto.internal.Citation;
import com.faqchat.dto.internal.CitationSet;
import com.faqchat.dto.internal.MatchResult;
import com.faqchat.dto.internal.SourceType;
import com.faqchat.model.QaEntry;
import com.faqchat.support.TestFixtures;
import com.faqchat.util.TextTruncator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class CitationServiceTest {

    private final CitationService service = new CitationService(TestFixtures.chatbotConfig());

    @Test
    void boundsItemsAndReportsMore() {
        List<MatchResult> matches = IntStream.rangeClosed(1, 5)
                .mapToObj(i -> match(entry(i, null, null), 1.0 - i * 0.1))
                .collect(Collectors.toList());

        CitationSet set = service.compose(matches, 3);

        assertThat(set.getTotalSources()).isEqualTo(5);
        assertThat(set.getShowing()).isEqualTo(3);
        assertThat(set.isHasMore()).isTrue();
        assertThat(set.getItems()).extracting(Citation::getId).containsExactly("source_1", "source_2", "source_3");
        assertThat(set.getItems()).extracting(Citation::getEntryId).containsExactly(1, 2, 3);
    }

    @Test
    void duplicateEntriesCountOnce() {
        QaEntry a = entry(1, null, null);
        QaEntry b = entry(2, null, null);

        CitationSet set = service.compose(List.of(match(a, 0.9), match(b, 0.8), match(a, 0.7)), 3);

        assertThat(set.getTotalSources()).isEqualTo(2);
        assertThat(set.getShowing()).isEqualTo(2);
        assertThat(set.isHasMore()).isFalse();
        assertThat(set.getItems().get(0).getConfidence()).isEqualTo(0.9);
    }

    @Test
    void noMatchesGiveEmptySet() {
        CitationSet set = service.compose(List.of());

        assertThat(set.getItems()).isEmpty();
        assertThat(set.getTotalSources()).isZero();
        assertThat(set.isHasMore()).isFalse();
    }

    @Test
    void excerptIsTruncatedToConfiguredLength() {
        String longAnswer = "あ".repeat(250);
        QaEntry entry = QaEntry.builder().id(1).question("Q").answer(longAnswer).build();

        Citation citation = service.toCitation(match(entry, 0.5), 1);

        assertThat(citation.getExcerpt()).hasSize(200 + TextTruncator.ELLIPSIS.length()).endsWith("...");
        assertThat(service.toCitation(match(entry(2, null, null), 0.5), 1).getExcerpt()).isEqualTo("answer 2");
    }

    @Test
    void officialPageWithLabel() {
        Citation citation = service.toCitation(
                match(entry(1, "公式サイト - https://www.pip-maker.com/product", null), 0.8), 1);

        assertThat(citation.getSourceType()).isEqualTo(SourceType.OFFICIAL_WEBSITE);
        assertThat(citation.getUrl()).isEqualTo("https://www.pip-maker.com/product");
        assertThat(citation.getSourceLabel()).isEqualTo("公式サイト");
        assertThat(citation.isVerified()).isTrue();
        assertThat(citation.getTitle()).isEqualTo("question 1");
        assertThat(citation.getSection()).isEqualTo("general");
    }

    @Test
    void classifiesByUrlAndRemarks() {
        assertThat(typeOf("https://info.pip-maker.com/manual/pdf/creator.pdf", null)).isEqualTo(SourceType.PDF_MANUAL);
        assertThat(typeOf("https://www.pip-maker.com/docs/start", null)).isEqualTo(SourceType.DOCUMENTATION);
        assertThat(typeOf("https://www.pip-maker.com/blog/2024", null)).isEqualTo(SourceType.BLOG_POST);
        assertThat(typeOf("https://www.pip-maker.com/product", "よくある質問")).isEqualTo(SourceType.FAQ);
        assertThat(typeOf("https://example.com/pip-maker.com/faq", null)).isEqualTo(SourceType.UNKNOWN);
    }

    @Test
    void referenceWithoutUrlIsInternalData() {
        Citation withNote = service.toCitation(match(entry(1, "社内資料 v2", null), 0.4), 1);
        assertThat(withNote.getSourceType()).isEqualTo(SourceType.INTERNAL_DATA);
        assertThat(withNote.getSourceLabel()).isEqualTo("社内資料 v2");
        assertThat(withNote.isVerified()).isTrue();

        Citation bare = service.toCitation(match(entry(2, null, null), 0.4), 1);
        assertThat(bare.getUrl()).isNull();
        assertThat(bare.getSourceLabel()).isEqualTo(SourceType.INTERNAL_DATA.label());
        assertThat(bare.isVerified()).isFalse();
    }

    @Test
    void trailingPunctuationIsNotPartOfTheUrl() {
        Citation citation = service.toCitation(
                match(entry(1, "詳しくは（https://www.pip-maker.com/features）。", null), 0.4), 1);

        assertThat(citation.getUrl()).isEqualTo("https://www.pip-maker.com/features");
        assertThat(citation.getSourceLabel()).isEqualTo("詳しくは");
    }

    private SourceType typeOf(String reference, String remarks) {
        return service.toCitation(match(entry(1, reference, remarks), 0.5), 1).getSourceType();
    }

    private static QaEntry entry(int id, String reference, String remarks) {
        return QaEntry.builder()
                .id(id)
                .question("question " + id)
                .answer("answer " + id)
                .category("general")
                .reference(reference)
                .remarks(remarks)
                .build();
    }

    private static MatchResult match(QaEntry entry, double score) {
        return MatchResult.builder().entry(entry).score(score).matchedTerms(Set.of()).build();
    }
}
