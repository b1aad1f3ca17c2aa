package dev.buyergroup.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Company identity helpers: legal-suffix stripping, name variations and alias-aware matching.
 */
public final class CompanyNames {

    static final int MAX_VARIATIONS = 8;

    private static final Pattern LEGAL_SUFFIX = Pattern.compile(
            ",?\\s+(inc|incorporated|corp|corporation|llc|ltd|limited|company|co|group|enterprises"
                    + "|systems|solutions|technologies|tech|plc|gmbh|ag|sa)\\.?$",
            Pattern.CASE_INSENSITIVE);

    private CompanyNames() {
    }

    /**
     * Strip trailing legal or corporate suffixes: "Dell Technologies Inc." becomes "Dell".
     */
    public static String baseName(String companyName) {
        if (companyName == null) {
            return "";
        }
        String current = companyName.trim();
        for (int i = 0; i < 3; i++) {
            String stripped = LEGAL_SUFFIX.matcher(current).replaceFirst("").trim();
            if (stripped.equals(current) || stripped.isEmpty()) {
                break;
            }
            current = stripped;
        }
        return current;
    }

    /**
     * Acronym for 2-4 word names, built from words longer than two characters.
     */
    public static String acronym(String name) {
        String[] words = Arrays.stream(name.trim().split("\\s+"))
                .filter(word -> word.length() > 2)
                .toArray(String[]::new);
        if (words.length < 2 || words.length > 4) {
            return "";
        }
        StringBuilder acronym = new StringBuilder();
        for (String word : words) {
            acronym.append(Character.toUpperCase(word.charAt(0)));
        }
        return acronym.toString();
    }

    /**
     * Ordered, de-duplicated search variations: the name, its aliases, the suffix-stripped
     * base name, the base name with "Inc", and an acronym. Capped at {@value #MAX_VARIATIONS}.
     */
    public static List<String> variations(String companyName, List<String> aliases) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        addVariation(companyName, seen, result);
        for (String alias : aliases) {
            addVariation(alias, seen, result);
        }

        String base = baseName(companyName);
        if (!base.equalsIgnoreCase(companyName.trim())) {
            addVariation(base, seen, result);
            addVariation(base + " Inc", seen, result);
        }
        addVariation(acronym(base), seen, result);

        return result.size() > MAX_VARIATIONS ? List.copyOf(result.subList(0, MAX_VARIATIONS)) : List.copyOf(result);
    }

    /**
     * Normalized names a candidate's current company is allowed to contain.
     * Acronyms are left out because short tokens match unrelated employers.
     */
    public static List<String> identityKeys(String companyName, List<String> aliases) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(TextNormalizer.normalize(companyName));
        String base = TextNormalizer.normalize(baseName(companyName));
        if (base.length() >= 3) {
            keys.add(base);
        }
        for (String alias : aliases) {
            String normalized = TextNormalizer.normalize(alias);
            if (!normalized.isEmpty()) {
                keys.add(normalized);
            }
        }
        keys.remove("");
        return List.copyOf(keys);
    }

    /**
     * Alias-aware identity match: the normalized company text must contain one of the keys.
     */
    public static boolean matches(String candidateCompany, List<String> identityKeys) {
        String normalized = TextNormalizer.normalize(candidateCompany);
        if (normalized.isEmpty()) {
            return false;
        }
        for (String key : identityKeys) {
            if (TextNormalizer.containsPhrase(normalized, key)) {
                return true;
            }
        }
        return false;
    }

    private static void addVariation(String value, Set<String> seen, List<String> result) {
        if (value == null || value.isBlank()) {
            return;
        }
        String trimmed = value.trim();
        if (seen.add(trimmed.toLowerCase())) {
            result.add(trimmed);
        }
    }
}
