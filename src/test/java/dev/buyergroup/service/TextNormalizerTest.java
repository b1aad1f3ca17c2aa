package dev.buyergroup.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "'Director, Sales/Ops.', director sales ops",
            "'  VP   of   Sales ', vp of sales",
            "'Dell EMC', dell emc"
    })
    void shouldNormalize(String input, String expected) {
        assertThat(TextNormalizer.normalize(input)).isEqualTo(expected);
    }

    @Test
    void shouldNormalizeNullToEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void containsWordShouldRespectWordBoundaries() {
        assertThat(TextNormalizer.containsWord("Director of Sales", "cto")).isFalse();
        assertThat(TextNormalizer.containsWord("CTO", "cto")).isTrue();
        assertThat(TextNormalizer.containsWord("Former ex-Employee", "ex-")).isTrue();
    }

    @Test
    void containsPhraseShouldAlignToWords() {
        assertThat(TextNormalizer.containsPhrase("dellwood partners", "dell")).isFalse();
        assertThat(TextNormalizer.containsPhrase("dell technologies", "dell")).isTrue();
    }

    @Test
    void containsAnyShouldMatchFirstTerm() {
        assertThat(TextNormalizer.containsAny("Inside Sales Rep", List.of("territory", "inside sales"))).isTrue();
        assertThat(TextNormalizer.containsAny("Chief Revenue Officer", List.of("territory"))).isFalse();
    }
}
