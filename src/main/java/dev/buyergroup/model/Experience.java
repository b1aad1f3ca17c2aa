package dev.buyergroup.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One job entry of a person's work history.
 * A null end date with a start date means the role is open-ended.
 */
@Value
@Builder
public class Experience {
    String company;
    String title;
    String department;
    LocalDate startDate;
    LocalDate endDate;
    Boolean current;

    public boolean isExplicitlyCurrent() {
        return Boolean.TRUE.equals(current);
    }

    public boolean isOpenEnded() {
        return endDate == null && startDate != null && !Boolean.FALSE.equals(current);
    }
}
