package dev.buyergroup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Term lists for profile quality filters and enterprise override rules.
 * Loaded from rules.yml under 'rules' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "rules")
public class RulesConfig {

    // Quality filters
    private List<String> excludedTitleTerms = new ArrayList<>(List.of(
            "intern", "internship", "apprentice", "trainee", "student"));
    private List<String> excludedHeadlineTerms = new ArrayList<>(List.of(
            "former", "ex-", "retired", "intern"));
    private List<String> nonCorporateTerms = new ArrayList<>(List.of(
            "university", "college", "school", "hospital", "police", "government", "department of"));

    // Departments that must always reach the classifier and feed the Blocker role
    private List<String> gatekeepingDepartments = new ArrayList<>(List.of(
            "legal", "procurement", "purchasing", "sourcing", "finance", "security",
            "compliance", "risk"));

    // Enterprise overrides
    private List<String> assistantTerms = new ArrayList<>(List.of(
            "executive assistant", "assistant to", "administrative assistant", "chief of staff assistant"));
    private List<String> frontLineTerms = new ArrayList<>(List.of(
            "account executive", "sales representative", "sales rep", "territory", "outside sales",
            "inside sales", "field sales", "sdr", "bdr", "business development representative",
            "sales development representative"));
    private List<String> regionalTerms = new ArrayList<>(List.of(
            "canada", "anz", "emea", "apac", "apj", "latam", "dach", "nordics", "benelux", "uk",
            "regional", "region"));
    private List<String> processTerms = new ArrayList<>(List.of(
            "operations", "ops", "process", "enablement"));
}
