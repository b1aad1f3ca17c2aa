package dev.buyergroup.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches a job title against role title patterns in four tiers of decreasing strength.
 * SVP-family patterns are tried before VP-family ones, and VP-family patterns never see
 * the SVP part of a title.
 */
@Component
public class TitleMatcher {

    private static final Pattern SVP_SPAN = Pattern.compile(
            "\\b(senior|sr|executive|exec)\\.?\\s+(vice[\\s-]+president|vp)\\b|\\b(svp|evp)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final String MASK = "xsvpx";

    private static final Set<String> SHORT_SIGNIFICANT = Set.of("it", "hr", "ai", "pr");

    public enum MatchTier {
        EXACT(1.0),
        NORMALIZED(0.85),
        ABBREVIATION(0.8),
        WORD_SET(0.6);

        private final double strength;

        MatchTier(double strength) {
            this.strength = strength;
        }

        public double strength() {
            return strength;
        }
    }

    /**
     * A successful match.
     *
     * @param pattern    Configured pattern that matched
     * @param tier       Strongest tier reached
     * @param svpSibling Whether the match came through the derived SVP form of a VP pattern
     */
    public record TitleMatch(String pattern, MatchTier tier, boolean svpSibling) {

        public double strength() {
            return tier.strength();
        }

        public String describe() {
            return "title matched '" + pattern + "'" + (svpSibling ? " (svp form)" : "")
                    + " at " + tier.name().toLowerCase() + " tier";
        }
    }

    /**
     * Which form of the title a pattern is matched against.
     */
    private enum TitleForm {
        AS_WRITTEN,
        SVP_MASKED,
        SVP_AS_VP
    }

    private record Candidate(String pattern, TitleForm form, boolean svpSibling) {
    }

    /**
     * Find the strongest match of a title against a role's patterns.
     * Ties keep evaluation order: SVP forms, then plain patterns, then masked VP patterns.
     * The SVP form of a VP pattern is the pattern itself matched against the title with its
     * SVP span written as the pattern's VP token, so "Sr. VP Sales" reaches "vp sales" at the
     * same tier as "VP Sales" does.
     */
    public Optional<TitleMatch> match(String title, List<String> patterns) {
        if (title == null || title.isBlank() || patterns == null || patterns.isEmpty()) {
            return Optional.empty();
        }
        String lowerTitle = title.toLowerCase().trim();
        boolean svpTitle = SVP_SPAN.matcher(lowerTitle).find();
        String maskedTitle = SVP_SPAN.matcher(lowerTitle).replaceAll(MASK);

        TitleMatch best = null;
        for (Candidate candidate : evaluationOrder(patterns)) {
            String subject = switch (candidate.form()) {
                case AS_WRITTEN -> lowerTitle;
                case SVP_MASKED -> maskedTitle;
                case SVP_AS_VP -> svpTitle ? asVpTitle(lowerTitle, candidate.pattern()) : null;
            };
            if (subject == null) {
                continue;
            }
            Optional<MatchTier> tier = matchTier(subject, candidate.pattern());
            if (tier.isPresent() && (best == null || tier.get().strength() > best.strength())) {
                best = new TitleMatch(candidate.pattern(), tier.get(), candidate.svpSibling());
                if (best.tier() == MatchTier.EXACT) {
                    break;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Strongest tier at which a single pattern matches a single title, first hit wins.
     */
    public Optional<MatchTier> matchTier(String title, String pattern) {
        if (title == null || pattern == null || pattern.isBlank()) {
            return Optional.empty();
        }
        if (TextNormalizer.containsWord(title.toLowerCase(), pattern.toLowerCase().trim())) {
            return Optional.of(MatchTier.EXACT);
        }

        String normalizedTitle = TextNormalizer.normalize(title);
        String normalizedPattern = TextNormalizer.normalize(pattern);
        if (normalizedPattern.isEmpty()) {
            return Optional.empty();
        }
        if (TextNormalizer.containsPhrase(normalizedTitle, normalizedPattern)) {
            return Optional.of(MatchTier.NORMALIZED);
        }

        String expandedTitle = expand(normalizedTitle);
        String expandedPattern = expand(normalizedPattern);
        if (TextNormalizer.containsPhrase(expandedTitle, expandedPattern)) {
            return Optional.of(MatchTier.ABBREVIATION);
        }

        List<String> significant = significantWords(expandedPattern);
        if (!significant.isEmpty() && TextNormalizer.words(expandedTitle).containsAll(significant)) {
            return Optional.of(MatchTier.WORD_SET);
        }
        return Optional.empty();
    }

    /**
     * Expand common title abbreviations on normalized text: "sr vp" becomes "senior vice president".
     */
    static String expand(String normalized) {
        if (normalized.isEmpty()) {
            return normalized;
        }
        List<String> out = new ArrayList<>();
        for (String token : normalized.split(" ")) {
            out.add(switch (token) {
                case "svp" -> "senior vice president";
                case "evp" -> "executive vice president";
                case "vp" -> "vice president";
                case "sr" -> "senior";
                case "exec" -> "executive";
                case "dir" -> "director";
                case "mgr" -> "manager";
                default -> token;
            });
        }
        return String.join(" ", out);
    }

    static boolean isSvpFamily(String pattern) {
        String expanded = expand(TextNormalizer.normalize(pattern));
        return TextNormalizer.containsPhrase(expanded, "senior vice president")
                || TextNormalizer.containsPhrase(expanded, "executive vice president");
    }

    static boolean isVpFamily(String pattern) {
        return !isSvpFamily(pattern)
                && TextNormalizer.containsPhrase(expand(TextNormalizer.normalize(pattern)), "vice president");
    }

    private List<Candidate> evaluationOrder(List<String> patterns) {
        List<Candidate> svp = new ArrayList<>();
        List<Candidate> plain = new ArrayList<>();
        List<Candidate> vp = new ArrayList<>();
        for (String pattern : patterns) {
            if (isSvpFamily(pattern)) {
                svp.add(new Candidate(pattern, TitleForm.AS_WRITTEN, false));
            } else if (isVpFamily(pattern)) {
                svp.add(new Candidate(pattern, TitleForm.SVP_AS_VP, true));
                vp.add(new Candidate(pattern, TitleForm.SVP_MASKED, false));
            } else {
                plain.add(new Candidate(pattern, TitleForm.AS_WRITTEN, false));
            }
        }
        List<Candidate> ordered = new ArrayList<>(svp);
        ordered.addAll(plain);
        ordered.addAll(vp);
        return ordered;
    }

    /**
     * Lower-case title with every SVP span replaced by the VP token the pattern is written with:
     * "senior vp sales" against "vice president sales" becomes "vice president sales".
     */
    static String asVpTitle(String lowerTitle, String vpPattern) {
        String token = TextNormalizer.words(TextNormalizer.normalize(vpPattern)).contains("vp")
                ? "vp" : "vice president";
        return SVP_SPAN.matcher(lowerTitle).replaceAll(token);
    }

    private List<String> significantWords(String normalizedText) {
        return TextNormalizer.words(normalizedText).stream()
                .filter(word -> word.length() > 2 || SHORT_SIGNIFICANT.contains(word))
                .toList();
    }
}
