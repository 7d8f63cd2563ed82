package com.delta.jobmatcher.match.model;

import java.util.List;
import java.util.Locale;

public record Preferences(
    List<String> targetRoles,
    String experienceLevel,
    String location,
    Integer salaryMin,
    Integer salaryMax,
    String salaryCurrency
) {
    public static final String DEFAULT_CURRENCY = "SGD";

    public Preferences {
        targetRoles = targetRoles == null ? List.of() : List.copyOf(targetRoles);
        salaryCurrency = salaryCurrency == null || salaryCurrency.isBlank() ? DEFAULT_CURRENCY : salaryCurrency.trim();
    }

    public static Preferences none() {
        return new Preferences(List.of(), null, null, null, null, DEFAULT_CURRENCY);
    }

    /**
     * Human readable salary expectation, e.g. {@code SGD 5,000-7,000} or {@code SGD 5,000+}.
     */
    public String salaryText() {
        if (salaryMin != null && salaryMax != null) {
            return String.format(Locale.ROOT, "%s %,d-%,d", salaryCurrency, salaryMin, salaryMax);
        }
        if (salaryMin != null) {
            return String.format(Locale.ROOT, "%s %,d+", salaryCurrency, salaryMin);
        }
        if (salaryMax != null) {
            return String.format(Locale.ROOT, "%s up to %,d", salaryCurrency, salaryMax);
        }
        return "Not specified";
    }
}
