package com.pos.completion.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WordContainmentTest {

    @Test
    @DisplayName("should compile each needle's pattern once")
    void reusesCompiledPattern() {
        assertThat(WordContainment.wordPattern("hcm0042")).isSameAs(WordContainment.wordPattern("hcm0042"));
    }

    @Test
    @DisplayName("should match only whole words")
    void wholeWordsOnly() {
        assertThat(WordContainment.containsWord("mobile world hcm0042 q3", "hcm0042", 4)).isTrue();
        assertThat(WordContainment.containsWord("mobile world hcm00421", "hcm0042", 4)).isFalse();
    }

    @Test
    @DisplayName("should ignore short needles and haystacks no longer than the needle")
    void lengthGuards() {
        assertThat(WordContainment.containsWord("shop s12 center", "s12", 4)).isFalse();
        assertThat(WordContainment.containsWord("hcm0042", "hcm0042", 4)).isFalse();
    }

    @Test
    @DisplayName("should treat regex metacharacters in the needle literally")
    void quotesNeedle() {
        assertThat(WordContainment.containsWord("store a.b1 center", "a.b1", 4)).isTrue();
        assertThat(WordContainment.containsWord("store axb1 center", "a.b1", 4)).isFalse();
    }
}
