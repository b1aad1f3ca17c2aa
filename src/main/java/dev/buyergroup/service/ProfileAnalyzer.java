package dev.buyergroup.service;

import dev.buyergroup.config.RulesConfig;
import dev.buyergroup.model.Experience;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.model.SeniorityLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Service that turns raw collected profiles into canonical candidates and applies the
 * quality filters. Filters are inclusive: a profile is only dropped for a concrete reason,
 * never for its department. Titles an Introducer override claims skip the seniority floor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileAnalyzer {

    private static final Pattern PRESIDENT = Pattern.compile("\\bpresident\\b");
    private static final Pattern VICE_PRESIDENT = Pattern.compile("\\bvice\\s+president\\b");

    // Staff roles that carry a C-level word without the authority
    private static final List<String> STAFF_TERMS = List.of("chief of staff");
    private static final List<String> C_LEVEL_TERMS = List.of(
            "chief", "ceo", "cfo", "cto", "coo", "cro", "cio", "ciso", "cmo", "founder", "co founder",
            "owner", "general counsel");
    private static final List<String> SVP_TERMS = List.of(
            "svp", "senior vice president", "senior vp", "sr vp", "evp", "executive vice president",
            "executive vp");
    private static final List<String> VP_TERMS = List.of("vp", "vice president");
    private static final List<String> SENIOR_DIRECTOR_TERMS = List.of("senior director", "sr director");
    private static final List<String> DIRECTOR_TERMS = List.of("director", "head of", "head");
    private static final List<String> MANAGER_TERMS = List.of("manager", "lead", "supervisor");

    // Title keyword -> department, first hit wins
    private static final Map<String, String> DEPARTMENT_KEYWORDS = new LinkedHashMap<>();

    static {
        DEPARTMENT_KEYWORDS.put("general counsel", "legal");
        DEPARTMENT_KEYWORDS.put("legal", "legal");
        DEPARTMENT_KEYWORDS.put("counsel", "legal");
        DEPARTMENT_KEYWORDS.put("attorney", "legal");
        DEPARTMENT_KEYWORDS.put("procurement", "procurement");
        DEPARTMENT_KEYWORDS.put("purchasing", "procurement");
        DEPARTMENT_KEYWORDS.put("sourcing", "procurement");
        DEPARTMENT_KEYWORDS.put("ciso", "security");
        DEPARTMENT_KEYWORDS.put("security", "security");
        DEPARTMENT_KEYWORDS.put("compliance", "compliance");
        DEPARTMENT_KEYWORDS.put("risk", "risk");
        DEPARTMENT_KEYWORDS.put("cfo", "finance");
        DEPARTMENT_KEYWORDS.put("finance", "finance");
        DEPARTMENT_KEYWORDS.put("financial", "finance");
        DEPARTMENT_KEYWORDS.put("controller", "finance");
        DEPARTMENT_KEYWORDS.put("accounting", "finance");
        DEPARTMENT_KEYWORDS.put("revenue operations", "sales");
        DEPARTMENT_KEYWORDS.put("sales operations", "sales");
        DEPARTMENT_KEYWORDS.put("cro", "sales");
        DEPARTMENT_KEYWORDS.put("sales", "sales");
        DEPARTMENT_KEYWORDS.put("revenue", "sales");
        DEPARTMENT_KEYWORDS.put("account executive", "sales");
        DEPARTMENT_KEYWORDS.put("business development", "sales");
        DEPARTMENT_KEYWORDS.put("customer success", "customer success");
        DEPARTMENT_KEYWORDS.put("cmo", "marketing");
        DEPARTMENT_KEYWORDS.put("marketing", "marketing");
        DEPARTMENT_KEYWORDS.put("human resources", "hr");
        DEPARTMENT_KEYWORDS.put("hr", "hr");
        DEPARTMENT_KEYWORDS.put("people", "hr");
        DEPARTMENT_KEYWORDS.put("talent", "hr");
        DEPARTMENT_KEYWORDS.put("cio", "it");
        DEPARTMENT_KEYWORDS.put("information technology", "it");
        DEPARTMENT_KEYWORDS.put("it", "it");
        DEPARTMENT_KEYWORDS.put("cto", "engineering");
        DEPARTMENT_KEYWORDS.put("engineering", "engineering");
        DEPARTMENT_KEYWORDS.put("software", "engineering");
        DEPARTMENT_KEYWORDS.put("product", "product");
        DEPARTMENT_KEYWORDS.put("coo", "operations");
        DEPARTMENT_KEYWORDS.put("operations", "operations");
    }

    private final RulesConfig rulesConfig;
    private final EnterpriseOverrides enterpriseOverrides;
    private final Clock clock;

    /**
     * Target company identity used by the company-match filter.
     *
     * @param companyName    Target name as requested
     * @param normalizedName Punctuation-stripped lower-case name
     * @param identityKeys   Names a current employer may contain to count as the target
     */
    public record Target(String companyName, String normalizedName, List<String> identityKeys) {

        public static Target of(String companyName, List<String> aliases) {
            return new Target(companyName, TextNormalizer.normalize(companyName),
                    CompanyNames.identityKeys(companyName, aliases));
        }
    }

    /**
     * Result of analysing one profile.
     *
     * @param profile         Profile with derived fields filled in
     * @param accepted        Whether the profile reaches the classifier
     * @param exclusionReason First failing filter, null when accepted
     */
    public record AnalysisResult(PersonProfile profile, boolean accepted, String exclusionReason) {

        public static AnalysisResult accepted(PersonProfile profile) {
            return new AnalysisResult(profile, true, null);
        }

        public static AnalysisResult excluded(PersonProfile profile, String reason) {
            return new AnalysisResult(profile, false, reason);
        }
    }

    /**
     * Derive the canonical fields of a profile and run the quality filters.
     *
     * @param raw           Profile as collected
     * @param target        Target company identity
     * @param sellerProfile Seller profile providing the seniority floor
     * @return AnalysisResult with the enriched copy of the profile
     */
    public AnalysisResult analyze(PersonProfile raw, Target target, SellerProfile sellerProfile) {
        PersonProfile profile = deriveCanonical(raw);
        String title = profile.getCurrentTitle();

        if (title == null || title.isBlank()) {
            // Without a current experience there is no current title either
            return exclude(profile, profile.getCurrentCompany() == null ? "no current experience" : "missing title");
        }

        for (String term : rulesConfig.getExcludedTitleTerms()) {
            if (TextNormalizer.containsWord(title, term)) {
                return exclude(profile, "excluded title term: " + term);
            }
        }

        if (profile.getCurrentCompany() == null) {
            return exclude(profile, "no current experience");
        }

        if (!CompanyNames.matches(profile.getCurrentCompany(), target.identityKeys())) {
            return exclude(profile, "current company '" + profile.getCurrentCompany() + "' is not " + target.companyName());
        }

        String normalizedCompany = TextNormalizer.normalize(profile.getCurrentCompany());
        for (String term : rulesConfig.getNonCorporateTerms()) {
            String normalizedTerm = TextNormalizer.normalize(term);
            if (TextNormalizer.containsPhrase(normalizedCompany, normalizedTerm)
                    && !TextNormalizer.containsPhrase(target.normalizedName(), normalizedTerm)) {
                return exclude(profile, "non-corporate employer: " + profile.getCurrentCompany());
            }
        }

        SeniorityLevel floor = seniorityFloor(profile.getCurrentDepartment(), sellerProfile.getMinimumSeniority());
        if (!profile.getSeniorityLevel().isAtLeast(floor) && !enterpriseOverrides.forcesIntroducer(profile)) {
            return exclude(profile, "seniority " + profile.getSeniorityLevel() + " below " + floor);
        }

        return AnalysisResult.accepted(profile);
    }

    /**
     * Fill in current title, department, company, seniority and tenure on a copy of the profile.
     */
    public PersonProfile deriveCanonical(PersonProfile raw) {
        PersonProfile profile = raw.toBuilder().build();
        Optional<Experience> current = currentExperience(raw.getExperiences());

        String title = current.map(Experience::getTitle).map(String::trim).orElse(null);
        profile.setCurrentTitle(title);
        profile.setCurrentCompany(current.map(Experience::getCompany).orElse(null));
        profile.setCurrentDepartment(current
                .map(Experience::getDepartment)
                .filter(department -> !department.isBlank())
                .map(department -> department.trim().toLowerCase())
                .orElseGet(() -> inferDepartment(title)));
        profile.setSeniorityLevel(seniorityOf(title));
        profile.setTenureMonths(current.map(this::tenureMonths).orElse(0));
        return profile;
    }

    /**
     * Pick the current experience.
     * Explicitly current or open-ended entries win, latest start first. Otherwise the most
     * recent entry by end date then start date counts only if it has not ended yet.
     * Ties keep list order.
     */
    public Optional<Experience> currentExperience(List<Experience> experiences) {
        if (experiences == null || experiences.isEmpty()) {
            return Optional.empty();
        }

        Experience best = null;
        for (Experience experience : experiences) {
            if (!experience.isExplicitlyCurrent() && !experience.isOpenEnded()) {
                continue;
            }
            if (best == null || compareDates(experience.getStartDate(), best.getStartDate()) > 0) {
                best = experience;
            }
        }
        if (best != null) {
            return Optional.of(best);
        }

        Comparator<Experience> recency = Comparator
                .comparing(Experience::getEndDate, ProfileAnalyzer::compareDates)
                .thenComparing(Experience::getStartDate, ProfileAnalyzer::compareDates);
        Experience latest = null;
        for (Experience experience : experiences) {
            if (latest == null || recency.compare(experience, latest) > 0) {
                latest = experience;
            }
        }
        LocalDate today = LocalDate.now(clock);
        if (latest.getEndDate() != null && latest.getEndDate().isBefore(today)) {
            return Optional.empty();
        }
        if (Boolean.FALSE.equals(latest.getCurrent()) && latest.getEndDate() == null) {
            return Optional.empty();
        }
        return Optional.of(latest);
    }

    /**
     * Seniority scale from title text. Assistant titles are always IC, chief of staff titles MANAGER.
     */
    public SeniorityLevel seniorityOf(String title) {
        if (title == null || title.isBlank()) {
            return SeniorityLevel.IC;
        }
        String normalized = TextNormalizer.normalize(title);

        if (TextNormalizer.containsAny(title, rulesConfig.getAssistantTerms())
                || TextNormalizer.containsPhrase(normalized, "assistant")) {
            return SeniorityLevel.IC;
        }
        if (containsAnyPhrase(normalized, STAFF_TERMS)) {
            return SeniorityLevel.MANAGER;
        }
        if (containsAnyPhrase(normalized, C_LEVEL_TERMS) || isPresident(normalized)) {
            return SeniorityLevel.C_LEVEL;
        }
        if (containsAnyPhrase(normalized, SVP_TERMS)) {
            return SeniorityLevel.SVP;
        }
        if (containsAnyPhrase(normalized, VP_TERMS)) {
            return SeniorityLevel.VP;
        }
        if (containsAnyPhrase(normalized, SENIOR_DIRECTOR_TERMS)) {
            return SeniorityLevel.SENIOR_DIRECTOR;
        }
        if (containsAnyPhrase(normalized, DIRECTOR_TERMS)) {
            return SeniorityLevel.DIRECTOR;
        }
        if (containsAnyPhrase(normalized, MANAGER_TERMS)) {
            return SeniorityLevel.MANAGER;
        }
        return SeniorityLevel.IC;
    }

    public String inferDepartment(String title) {
        String normalized = TextNormalizer.normalize(title);
        if (normalized.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, String> entry : DEPARTMENT_KEYWORDS.entrySet()) {
            if (TextNormalizer.containsPhrase(normalized, entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean isGatekeepingDepartment(String department) {
        if (department == null || department.isBlank()) {
            return false;
        }
        String normalized = TextNormalizer.normalize(department);
        return rulesConfig.getGatekeepingDepartments().stream()
                .anyMatch(gate -> TextNormalizer.containsPhrase(normalized, TextNormalizer.normalize(gate)));
    }

    /**
     * The profile's floor, capped at MANAGER for gatekeeping departments so their
     * directors and managers always reach the classifier.
     */
    SeniorityLevel seniorityFloor(String department, SeniorityLevel minimum) {
        if (isGatekeepingDepartment(department) && minimum.isAtLeast(SeniorityLevel.MANAGER)) {
            return SeniorityLevel.MANAGER;
        }
        return minimum;
    }

    private int tenureMonths(Experience experience) {
        if (experience.getStartDate() == null) {
            return 0;
        }
        LocalDate end = LocalDate.now(clock);
        if (experience.getEndDate() != null && experience.getEndDate().isBefore(end)) {
            end = experience.getEndDate();
        }
        return (int) Math.max(0, ChronoUnit.MONTHS.between(experience.getStartDate(), end));
    }

    private boolean isPresident(String normalizedTitle) {
        return PRESIDENT.matcher(normalizedTitle).find() && !VICE_PRESIDENT.matcher(normalizedTitle).find();
    }

    private boolean containsAnyPhrase(String normalizedText, List<String> phrases) {
        for (String phrase : phrases) {
            if (TextNormalizer.containsPhrase(normalizedText, phrase)) {
                return true;
            }
        }
        return false;
    }

    private AnalysisResult exclude(PersonProfile profile, String reason) {
        log.debug("Profile {} ({}) excluded: {}", profile.getId(), profile.getCurrentTitle(), reason);
        return AnalysisResult.excluded(profile, reason);
    }

    private static int compareDates(LocalDate a, LocalDate b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }
}
