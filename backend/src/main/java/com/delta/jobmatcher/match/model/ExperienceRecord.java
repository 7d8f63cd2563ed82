package com.delta.jobmatcher.match.model;

public record ExperienceRecord(
    String company,
    String title,
    String duration,
    String responsibilities
) {
}
