package dev.buyergroup.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final buying committee. Every role key is always present, possibly with an empty list,
 * and {@code totalMembers} always equals the sum of the per-role list sizes.
 */
@Value
public class BuyerGroup {
    String companyName;
    Map<Role, List<RoleAssignment>> roles;
    int totalMembers;
    GroupDynamics dynamics;

    public BuyerGroup(String companyName, Map<Role, List<RoleAssignment>> roles, GroupDynamics dynamics) {
        EnumMap<Role, List<RoleAssignment>> copy = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            copy.put(role, List.copyOf(roles.getOrDefault(role, List.of())));
        }
        this.companyName = companyName;
        this.roles = Collections.unmodifiableMap(copy);
        this.totalMembers = copy.values().stream().mapToInt(List::size).sum();
        this.dynamics = dynamics;
    }

    public static BuyerGroup empty(String companyName) {
        return new BuyerGroup(companyName, Map.of(), GroupDynamics.empty());
    }

    public List<RoleAssignment> members(Role role) {
        return roles.get(role);
    }

    public int count(Role role) {
        return roles.get(role).size();
    }

    public boolean isEmpty() {
        return totalMembers == 0;
    }
}
