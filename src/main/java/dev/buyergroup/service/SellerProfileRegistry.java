package dev.buyergroup.service;

import dev.buyergroup.config.SellerProfilesConfig.Definition;
import dev.buyergroup.model.DealSizeClass;
import dev.buyergroup.model.Role;
import dev.buyergroup.model.SellerProfile;
import dev.buyergroup.model.SeniorityLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only lookup of seller profiles by name.
 * Definitions are validated and frozen on first lookup; a malformed definition
 * surfaces as {@link InvalidSellerProfileException}.
 */
@Slf4j
public class SellerProfileRegistry {

    static final Map<Role, Integer> DEFAULT_ROLE_CAPS = Map.of(
            Role.DECISION, 3,
            Role.CHAMPION, 3,
            Role.STAKEHOLDER, 4,
            Role.BLOCKER, 2,
            Role.INTRODUCER, 2);

    private final Map<String, Definition> definitions;
    private final Map<String, SellerProfile> frozen = new ConcurrentHashMap<>();

    public SellerProfileRegistry(Map<String, Definition> definitions) {
        this.definitions = new LinkedHashMap<>(definitions);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    /**
     * Look up a profile by name.
     *
     * @throws InvalidSellerProfileException if the name is unknown or the definition is malformed
     */
    public SellerProfile get(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidSellerProfileException(String.valueOf(name), "profile name is required");
        }
        Definition definition = definitions.get(name);
        if (definition == null) {
            throw new InvalidSellerProfileException(name, "unknown profile (known: " + definitions.keySet() + ")");
        }
        return frozen.computeIfAbsent(name, key -> freeze(key, definition));
    }

    private SellerProfile freeze(String name, Definition definition) {
        SellerProfile.SellerProfileBuilder builder = SellerProfile.builder()
                .name(name)
                .productName(definition.getProductName())
                .solutionCategory(definition.getSolutionCategory())
                .dealSizeClass(resolveDealSize(name, definition))
                .minimumSeniority(resolveSeniority(name, definition.getMinimumSeniority()));

        // 1. Role patterns
        Map<Role, List<String>> patterns = new EnumMap<>(Role.class);
        orEmpty(definition.getRolePatterns()).forEach((key, values) -> {
            Role role = parseRole(name, key);
            List<String> cleaned = new ArrayList<>();
            for (String pattern : values == null ? List.<String>of() : values) {
                if (pattern == null || pattern.isBlank()) {
                    throw new InvalidSellerProfileException(name, "blank title pattern for role " + role);
                }
                cleaned.add(pattern.trim().toLowerCase());
            }
            patterns.put(role, List.copyOf(cleaned));
        });
        if (patterns.getOrDefault(Role.DECISION, List.of()).isEmpty()) {
            throw new InvalidSellerProfileException(name, "at least one Decision title pattern is required");
        }
        patterns.forEach(builder::rolePattern);

        // 2. Departments and aliases
        departments(name, "targetDepartments", definition.getTargetDepartments()).forEach(builder::targetDepartment);
        departments(name, "adjacentDepartments", definition.getAdjacentDepartments()).forEach(builder::adjacentDepartment);
        orEmpty(definition.getCompanyAliases()).stream()
                .filter(alias -> alias != null && !alias.isBlank())
                .forEach(alias -> builder.companyAlias(alias.trim()));

        // 3. Size limits
        int maxSize = definition.getMaxBuyerGroupSize();
        if (maxSize <= 0) {
            throw new InvalidSellerProfileException(name, "maxBuyerGroupSize must be positive");
        }
        builder.maxBuyerGroupSize(maxSize);

        Map<Role, Integer> caps = new EnumMap<>(DEFAULT_ROLE_CAPS);
        orEmpty(definition.getRoleCaps()).forEach((key, cap) ->
                caps.put(parseRole(name, key), required(name, "roleCaps", key, cap)));
        Map<Role, Integer> mins = new EnumMap<>(Role.class);
        orEmpty(definition.getMinRoleTargets()).forEach((key, min) ->
                mins.put(parseRole(name, key), required(name, "minRoleTargets", key, min)));

        int minSum = 0;
        for (Role role : Role.values()) {
            int cap = caps.get(role);
            int min = mins.getOrDefault(role, 0);
            if (cap < 0 || min < 0) {
                throw new InvalidSellerProfileException(name, "negative cap or minimum for role " + role);
            }
            if (min > cap) {
                throw new InvalidSellerProfileException(name,
                        "minimum " + min + " exceeds cap " + cap + " for role " + role);
            }
            minSum += min;
            builder.roleCap(role, cap);
            builder.minRoleTarget(role, min);
        }
        if (minSum > maxSize) {
            throw new InvalidSellerProfileException(name,
                    "minimum role targets (" + minSum + ") exceed maxBuyerGroupSize (" + maxSize + ")");
        }

        SellerProfile profile = builder.build();
        log.info("Loaded seller profile '{}' ({} roles with patterns, deal size {})",
                name, patterns.size(), profile.getDealSizeClass());
        return profile;
    }

    private static List<String> departments(String name, String field, List<String> values) {
        List<String> cleaned = new ArrayList<>();
        for (String department : orEmpty(values)) {
            if (department == null || department.isBlank()) {
                throw new InvalidSellerProfileException(name, "blank entry in " + field);
            }
            cleaned.add(department.trim().toLowerCase());
        }
        return cleaned;
    }

    private static int required(String name, String field, String key, Integer value) {
        if (value == null) {
            throw new InvalidSellerProfileException(name, field + "." + key + " has no value");
        }
        return value;
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> values) {
        return values == null ? Map.of() : values;
    }

    private DealSizeClass resolveDealSize(String name, Definition definition) {
        if (definition.getDealSizeClass() != null && !definition.getDealSizeClass().isBlank()) {
            try {
                return DealSizeClass.valueOf(definition.getDealSizeClass().trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new InvalidSellerProfileException(name, "unknown deal size class " + definition.getDealSizeClass());
            }
        }
        if (definition.getDealSizeUsd() != null) {
            return DealSizeClass.forDealSize(definition.getDealSizeUsd());
        }
        throw new InvalidSellerProfileException(name, "dealSizeClass or dealSizeUsd is required");
    }

    private SeniorityLevel resolveSeniority(String name, String value) {
        if (value == null || value.isBlank()) {
            return SeniorityLevel.IC;
        }
        try {
            return SeniorityLevel.valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidSellerProfileException(name, "unknown seniority level " + value);
        }
    }

    private Role parseRole(String name, String key) {
        try {
            return Role.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new InvalidSellerProfileException(name, "unknown role '" + key + "'");
        }
    }
}
