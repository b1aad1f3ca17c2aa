package dev.buyergroup.service;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Shared text helpers for titles, departments and company names.
 */
public final class TextNormalizer {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private TextNormalizer() {
    }

    /**
     * Lower-case, replace punctuation with spaces and collapse whitespace.
     * "Director, Sales/Ops." becomes "director sales ops".
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NON_ALNUM.matcher(text.toLowerCase()).replaceAll(" ").trim();
    }

    /**
     * Check if text contains a word or phrase with word boundaries (case-insensitive).
     */
    public static boolean containsWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return false;
        }
        // Use word boundaries to avoid matching "cto" inside "director"
        String lowerWord = word.toLowerCase().trim();
        String regex = (Character.isLetterOrDigit(lowerWord.charAt(0)) ? "\\b" : "")
                + Pattern.quote(lowerWord)
                + (Character.isLetterOrDigit(lowerWord.charAt(lowerWord.length() - 1)) ? "\\b" : "");
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, k -> Pattern.compile(k, Pattern.CASE_INSENSITIVE));
        return pattern.matcher(text).find();
    }

    /**
     * Phrase containment on already-normalized text, aligned to word boundaries.
     */
    public static boolean containsPhrase(String normalizedText, String normalizedPhrase) {
        if (normalizedText == null || normalizedPhrase == null || normalizedPhrase.isBlank()) {
            return false;
        }
        return (" " + normalizedText + " ").contains(" " + normalizedPhrase + " ");
    }

    /**
     * Check if any of the terms appears in the text as a word or phrase.
     */
    public static boolean containsAny(String text, Iterable<String> terms) {
        for (String term : terms) {
            if (containsWord(text, term)) {
                return true;
            }
        }
        return false;
    }

    public static Set<String> words(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(normalizedText.split(" ")));
    }
}
