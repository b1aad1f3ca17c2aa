package dev.buyergroup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named seller profile definitions as written in seller-profiles.yml.
 * Raw and mutable; the registry validates and freezes them into SellerProfile instances.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "seller-profiles")
public class SellerProfilesConfig {

    /** Optional JSON file with additional profiles, keyed by profile name. */
    private String externalFile = "";

    private Map<String, Definition> profiles = new LinkedHashMap<>();

    @Data
    public static class Definition {
        private String productName;
        private String solutionCategory;
        private Map<String, List<String>> rolePatterns = new LinkedHashMap<>();
        private List<String> targetDepartments = new ArrayList<>();
        private List<String> adjacentDepartments = new ArrayList<>();
        private List<String> companyAliases = new ArrayList<>();
        private String dealSizeClass;
        private Long dealSizeUsd;
        private Map<String, Integer> minRoleTargets = new LinkedHashMap<>();
        private Map<String, Integer> roleCaps = new LinkedHashMap<>();
        private int maxBuyerGroupSize;
        private String minimumSeniority;
    }
}
