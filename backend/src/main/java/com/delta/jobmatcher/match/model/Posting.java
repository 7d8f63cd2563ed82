package com.delta.jobmatcher.match.model;

public record Posting(
    String id,
    String title,
    String company,
    String location,
    String salaryText,
    String category,
    String description,
    String url
) {
}
