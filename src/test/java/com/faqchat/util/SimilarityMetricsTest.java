package com.faqchat.util;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityMetricsTest {

    @Test
    void jaccardIsSharedOverUnion() {
        assertThat(SimilarityMetrics.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(SimilarityMetrics.jaccard(Set.of("a"), Set.of("a"))).isEqualTo(1.0);
        assertThat(SimilarityMetrics.jaccard(Set.of("a"), Set.of())).isEqualTo(0.0);
        assertThat(SimilarityMetrics.jaccard(Set.of(), Set.of())).isEqualTo(0.0);
    }

    @Test
    void levenshteinRatioUsesLongerLength() {
        assertThat(SimilarityMetrics.levenshteinRatio("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7, within(1e-9));
        assertThat(SimilarityMetrics.levenshteinRatio("same", "same")).isEqualTo(1.0);
        assertThat(SimilarityMetrics.levenshteinRatio("", "")).isEqualTo(1.0);
        assertThat(SimilarityMetrics.levenshteinRatio("abc", "")).isEqualTo(0.0);
    }

    @Test
    void levenshteinCountsCodePointsNotChars() {
        // U+20BB7 is a surrogate pair in UTF-16
        assertThat(SimilarityMetrics.levenshteinRatio("𠮷a", "𠮷b")).isEqualTo(0.5);
    }
}
