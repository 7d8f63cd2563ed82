package com.delta.jobmatcher.match.model;

public record EducationRecord(
    String institution,
    String degree,
    String field,
    String year
) {
}
