package dev.buyergroup.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class PersonProfile {
    private String id;
    private String fullName;
    private String linkedinUrl;
    private String headline;
    private String location;

    @Builder.Default
    private List<Experience> experiences = new ArrayList<>();

    // Derived by ProfileAnalyzer
    private String currentTitle;
    private String currentDepartment;
    private String currentCompany;
    private SeniorityLevel seniorityLevel;
    private int tenureMonths;
}
