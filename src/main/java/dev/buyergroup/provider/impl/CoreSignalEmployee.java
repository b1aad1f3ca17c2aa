package dev.buyergroup.provider.impl;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.buyergroup.model.Experience;
import dev.buyergroup.model.PersonProfile;
import dev.buyergroup.provider.CandidateUnavailableException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Raw collect payload. Field names differ between provider datasets, so each field
 * accepts the known aliases and everything else is ignored.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
class CoreSignalEmployee {

    private static final List<DateTimeFormatter> MONTH_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH));

    private String id;

    @JsonProperty("full_name")
    @JsonAlias({"name", "fullName"})
    private String fullName;

    @JsonProperty("professional_network_url")
    @JsonAlias({"linkedin_url", "url"})
    private String linkedinUrl;

    private String headline;

    @JsonProperty("location_full")
    @JsonAlias({"location"})
    private String location;

    @JsonAlias({"experiences"})
    private List<Job> experience = new ArrayList<>();

    PersonProfile toProfile(String requestedId) {
        if (fullName == null && (experience == null || experience.isEmpty())) {
            throw new CandidateUnavailableException(requestedId, "record has neither name nor experience");
        }
        List<Experience> experiences = new ArrayList<>();
        if (experience != null) {
            experience.forEach(job -> experiences.add(job.toExperience()));
        }
        return PersonProfile.builder()
                .id(id != null && !id.isBlank() ? id : requestedId)
                .fullName(fullName)
                .linkedinUrl(linkedinUrl)
                .headline(headline)
                .location(location)
                .experiences(experiences)
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Job {

        @JsonProperty("company_name")
        @JsonAlias({"company"})
        private String companyName;

        @JsonProperty("position_title")
        @JsonAlias({"title"})
        private String title;

        @JsonAlias({"active_experience_department", "department_name"})
        private String department;

        @JsonProperty("date_from")
        @JsonAlias({"start_date"})
        private String dateFrom;

        @JsonProperty("date_to")
        @JsonAlias({"end_date"})
        private String dateTo;

        /** 1/0, true/false or absent. */
        @JsonProperty("active_experience")
        @JsonAlias({"is_current"})
        private JsonNode active;

        Experience toExperience() {
            return Experience.builder()
                    .company(companyName)
                    .title(title)
                    .department(department)
                    .startDate(parseDate(dateFrom))
                    .endDate(parseDate(dateTo))
                    .current(parseFlag(active))
                    .build();
        }
    }

    static Boolean parseFlag(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.intValue() != 0;
        }
        String text = node.asText().trim().toLowerCase(Locale.ROOT);
        return text.equals("1") || text.equals("true") || text.equals("yes");
    }

    /**
     * Lenient date parsing: ISO dates, ISO datetimes, year-month, "January 2020" and bare years.
     * Month precision resolves to the first day of the month.
     */
    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank() || value.equalsIgnoreCase("present")) {
            return null;
        }
        String text = value.trim();
        if (text.length() >= 10 && text.charAt(4) == '-' && text.charAt(7) == '-') {
            try {
                return LocalDate.parse(text.substring(0, 10));
            } catch (DateTimeParseException e) {
                log.debug("Unparseable date '{}': {}", value, e.getMessage());
                return null;
            }
        }
        for (DateTimeFormatter format : MONTH_FORMATS) {
            try {
                return YearMonth.parse(text, format).atDay(1);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", text, format);
            }
        }
        if (text.matches("\\d{4}")) {
            return LocalDate.of(Integer.parseInt(text), 1, 1);
        }
        log.debug("Unparseable date '{}'", value);
        return null;
    }
}
