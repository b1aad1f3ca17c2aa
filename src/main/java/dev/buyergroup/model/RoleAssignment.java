package dev.buyergroup.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A person's role in the buyer group with the score that placed them there and
 * the audit trail explaining why.
 */
@Value
@Builder(toBuilder = true)
public class RoleAssignment {
    String personId;
    String fullName;
    String title;
    String department;
    SeniorityLevel seniorityLevel;
    Role role;
    double score;

    @Singular("reason")
    List<String> rationale;
}
