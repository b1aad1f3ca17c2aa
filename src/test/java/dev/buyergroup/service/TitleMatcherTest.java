package dev.buyergroup.service;

import dev.buyergroup.service.TitleMatcher.MatchTier;
import dev.buyergroup.service.TitleMatcher.TitleMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TitleMatcherTest {

    private final TitleMatcher matcher = new TitleMatcher();

    @Nested
    @DisplayName("Match tiers")
    class TierTests {

        @ParameterizedTest
        @CsvSource({
                "Chief Revenue Officer, chief revenue officer, EXACT",
                "CTO, cto, EXACT",
                "Director - Sales Operations, director sales operations, NORMALIZED",
                "Sr Director Sales, senior director sales, ABBREVIATION",
                "SVP Sales, senior vice president sales, ABBREVIATION",
                "Sales Operations Director, director sales operations, WORD_SET",
                "Director of IT Infrastructure, it director, WORD_SET"
        })
        void shouldReachExpectedTier(String title, String pattern, MatchTier expected) {
            assertThat(matcher.matchTier(title, pattern)).contains(expected);
        }

        @ParameterizedTest
        @CsvSource({
                "Software Engineer, vp sales",
                "Director, cto",
                "Head of IT, it director"
        })
        void shouldNotMatch(String title, String pattern) {
            assertThat(matcher.matchTier(title, pattern)).isEmpty();
        }

        @Test
        void strengthsShouldDecreaseByTier() {
            assertThat(MatchTier.EXACT.strength()).isGreaterThan(MatchTier.NORMALIZED.strength());
            assertThat(MatchTier.NORMALIZED.strength()).isGreaterThan(MatchTier.ABBREVIATION.strength());
            assertThat(MatchTier.ABBREVIATION.strength()).isGreaterThan(MatchTier.WORD_SET.strength());
        }
    }

    @Nested
    @DisplayName("SVP and VP handling")
    class SvpTests {

        @Test
        @DisplayName("SVP titles should match a VP pattern only through its SVP form")
        void svpTitleShouldMatchThroughSibling() {
            Optional<TitleMatch> match = matcher.match("Senior Vice President, Sales", List.of("vice president sales"));

            assertThat(match).isPresent();
            assertThat(match.get().svpSibling()).isTrue();
            assertThat(match.get().tier()).isEqualTo(MatchTier.NORMALIZED);
        }

        @Test
        void vpTitleShouldMatchPlainPattern() {
            Optional<TitleMatch> match = matcher.match("Vice President, Sales", List.of("vice president sales"));

            assertThat(match).isPresent();
            assertThat(match.get().svpSibling()).isFalse();
            assertThat(match.get().tier()).isEqualTo(MatchTier.NORMALIZED);
        }

        @Test
        void abbreviatedSvpShouldMatchAbbreviatedPatternExactly() {
            Optional<TitleMatch> match = matcher.match("SVP Sales", List.of("vp sales"));

            assertThat(match).isPresent();
            assertThat(match.get().tier()).isEqualTo(MatchTier.EXACT);
            assertThat(match.get().svpSibling()).isTrue();
            assertThat(match.get().pattern()).isEqualTo("vp sales");
        }

        @Test
        void evpShouldMatchThroughExecutiveForm() {
            Optional<TitleMatch> match = matcher.match("Executive Vice President", List.of("vp"));

            assertThat(match).isPresent();
            assertThat(match.get().svpSibling()).isTrue();
            assertThat(match.get().tier()).isEqualTo(MatchTier.EXACT);
        }

        @ParameterizedTest
        @CsvSource({
                "SVP Sales, vp sales",
                "Senior VP Sales, vp sales",
                "Sr. VP Sales, vp sales",
                "Senior Vice President Sales, vp sales",
                "EVP Sales, vp sales",
                "SVP Sales, vice president sales",
                "Sr. VP Sales, vice president sales",
                "Senior Vice President Sales, vice president sales"
        })
        @DisplayName("Any SVP spelling should reach the tier of the pattern's own VP spelling")
        void svpSpellingsShouldMatchAtPatternTier(String title, String pattern) {
            Optional<TitleMatch> match = matcher.match(title, List.of(pattern));

            assertThat(match).isPresent();
            assertThat(match.get().svpSibling()).isTrue();
            assertThat(match.get().tier()).isEqualTo(MatchTier.EXACT);
        }

        @Test
        void plainVpShouldNotMatchSvpForms() {
            Optional<TitleMatch> match = matcher.match("VP Sales", List.of("vp sales"));

            assertThat(match).isPresent();
            assertThat(match.get().svpSibling()).isFalse();
            assertThat(match.get().tier()).isEqualTo(MatchTier.EXACT);
        }

        @Test
        void shouldRewriteSvpSpanInPatternStyle() {
            assertThat(TitleMatcher.asVpTitle("senior vp sales", "vice president sales"))
                    .isEqualTo("vice president sales");
            assertThat(TitleMatcher.asVpTitle("sr. vice president, marketing", "vp marketing"))
                    .isEqualTo("vp, marketing");
            assertThat(TitleMatcher.asVpTitle("evp sales", "vp sales")).isEqualTo("vp sales");
        }

        @Test
        void shouldClassifyPatternFamilies() {
            assertThat(TitleMatcher.isSvpFamily("svp sales")).isTrue();
            assertThat(TitleMatcher.isSvpFamily("executive vp")).isTrue();
            assertThat(TitleMatcher.isVpFamily("vp sales")).isTrue();
            assertThat(TitleMatcher.isVpFamily("svp sales")).isFalse();
            assertThat(TitleMatcher.isVpFamily("director sales")).isFalse();
        }
    }

    @Test
    void shouldExpandAbbreviations() {
        assertThat(TitleMatcher.expand("sr vp sales")).isEqualTo("senior vice president sales");
        assertThat(TitleMatcher.expand("dir it")).isEqualTo("director it");
    }

    @Test
    @DisplayName("Should keep the strongest match across patterns")
    void shouldKeepStrongestMatch() {
        Optional<TitleMatch> match = matcher.match("Director, Sales Operations",
                List.of("sales operations director", "director sales operations"));

        assertThat(match).isPresent();
        assertThat(match.get().pattern()).isEqualTo("director sales operations");
        assertThat(match.get().strength()).isEqualTo(0.85);
    }

    @Test
    void shouldReturnEmptyForMissingInput() {
        assertThat(matcher.match(null, List.of("vp sales"))).isEmpty();
        assertThat(matcher.match("VP Sales", List.of())).isEmpty();
    }
}
