package com.faqchat.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextTruncatorTest {

    @Test
    void appendsEllipsisOnlyWhenCut() {
        assertThat(TextTruncator.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(TextTruncator.truncate("abc", 3)).isEqualTo("abc");
        assertThat(TextTruncator.truncate(null, 3)).isNull();
    }

    @Test
    void neverSplitsASurrogatePair() {
        String text = "𠮷𠮷𠮷";
        assertThat(TextTruncator.truncate(text, 2)).isEqualTo("𠮷𠮷...");
    }
}
