package com.delta.jobmatcher.match.stage;

import com.delta.jobmatcher.match.model.ItemFailure;
import com.delta.jobmatcher.match.model.Posting;
import com.delta.jobmatcher.match.model.StageResult;
import com.delta.jobmatcher.match.util.HashUtils;
import com.delta.jobmatcher.match.util.ReasonCodeClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.delta.jobmatcher.match.util.JsonNodes.firstText;
import static com.delta.jobmatcher.match.util.JsonNodes.text;

/**
 * Turns raw posting records of varying shape into {@link Posting} values. Records without an
 * id (or URL to derive one from), title or description are dropped, as are repeated ids.
 */
@Component
public class PostingNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PostingNormalizer.class);
    private static final Set<String> MARKUP_TAGS = Set.of(
        "p", "br", "hr", "ul", "ol", "li", "div", "span", "strong", "em", "b", "i", "u", "a",
        "h1", "h2", "h3", "h4", "h5", "h6", "table", "tr", "td", "th", "section", "article"
    );
    private static final Set<String> VOID_TAGS = Set.of("br", "hr");

    public StageResult<List<Posting>> normalize(List<JsonNode> rawPostings) {
        if (rawPostings == null || rawPostings.isEmpty()) {
            return StageResult.of(List.of());
        }
        List<Posting> postings = new ArrayList<>();
        List<ItemFailure> failures = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < rawPostings.size(); i++) {
            JsonNode raw = rawPostings.get(i);
            try {
                Posting posting = normalizeOne(raw, i);
                if (!seenIds.add(posting.id())) {
                    throw new PostingValidationException(
                        posting.id(),
                        ReasonCodeClassifier.DUPLICATE_ID,
                        "Duplicate posting id " + posting.id()
                    );
                }
                postings.add(posting);
            } catch (PostingValidationException e) {
                log.warn("Dropping posting {}: {}", e.itemRef(), e.getMessage());
                failures.add(new ItemFailure(e.itemRef(), e.reasonCode(), e.getMessage()));
            }
        }
        log.info("Normalized {} of {} raw postings", postings.size(), rawPostings.size());
        return new StageResult<>(postings, failures);
    }

    Posting normalizeOne(JsonNode raw, int index) {
        String ref = "raw[" + index + "]";
        if (raw == null || !raw.isObject()) {
            throw new PostingValidationException(ref, ReasonCodeClassifier.VALIDATION_FAILED, "Posting record is not an object");
        }
        String url = firstText(raw, "url", "job_url", "jobUrl", "link", "source_url", "sourceUrl");
        String id = firstText(raw, "id", "job_id", "jobId", "uuid");
        if (id == null && url != null) {
            id = HashUtils.shortId("url-", url);
        }
        if (id != null) {
            ref = id;
        }
        String title = firstText(raw, "title", "job_title", "jobTitle", "name");
        String description = extractDescription(raw);

        List<String> missing = new ArrayList<>();
        if (id == null) {
            missing.add("id");
        }
        if (title == null) {
            missing.add("title");
        }
        if (description == null) {
            missing.add("description");
        }
        if (!missing.isEmpty()) {
            throw new PostingValidationException(
                ref,
                ReasonCodeClassifier.VALIDATION_FAILED,
                "Missing required field(s): " + String.join(", ", missing)
            );
        }

        return new Posting(
            id,
            title,
            extractCompany(raw),
            extractLocation(raw),
            extractSalary(raw),
            extractCategory(raw),
            description,
            url
        );
    }

    private String extractDescription(JsonNode raw) {
        String description = firstText(raw, "description", "job_description", "jobDescription", "descriptionText");
        if (description == null) {
            return null;
        }
        if (looksLikeHtml(description)) {
            String text = Jsoup.parse(description).text();
            return text.isBlank() ? null : text.trim();
        }
        return description;
    }

    /**
     * Markup only when jsoup finds a common formatting tag that is closed (or void), so
     * plain text such as {@code List<String>} stays untouched.
     */
    static boolean looksLikeHtml(String text) {
        if (text.indexOf('<') < 0) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Element element : Jsoup.parseBodyFragment(text).body().getAllElements()) {
            String name = element.normalName();
            if (!MARKUP_TAGS.contains(name)) {
                continue;
            }
            if (VOID_TAGS.contains(name) || lower.contains("</" + name)) {
                return true;
            }
        }
        return false;
    }

    private String extractCompany(JsonNode raw) {
        String company = firstText(raw, "company", "company_name", "companyName", "employer");
        if (company != null) {
            return company;
        }
        String nested = text(raw.path("company"), "name");
        if (nested != null) {
            return nested;
        }
        return text(raw.path("hiringOrganization"), "name");
    }

    private String extractLocation(JsonNode raw) {
        String location = firstText(raw, "location", "location_text", "locationText");
        if (location != null) {
            return location;
        }
        JsonNode locations = raw.get("locations");
        if (locations != null && locations.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode node : locations) {
                String value = node.isTextual() ? node.asText().trim() : firstText(node, "name", "city");
                if (value != null && !value.isBlank()) {
                    values.add(value);
                }
            }
            return values.isEmpty() ? null : String.join(", ", values);
        }
        JsonNode address = raw.get("address");
        if (address != null && address.isObject()) {
            List<String> parts = new ArrayList<>();
            for (String field : List.of("addressLocality", "addressRegion", "addressCountry")) {
                String value = text(address, field);
                if (value != null) {
                    parts.add(value);
                }
            }
            return parts.isEmpty() ? null : String.join(", ", parts);
        }
        return null;
    }

    private String extractSalary(JsonNode raw) {
        String salary = firstText(raw, "salary_text", "salaryText", "salary");
        if (salary != null) {
            return salary;
        }
        String min = firstText(raw, "salary_min", "salaryMin");
        String max = firstText(raw, "salary_max", "salaryMax");
        if (min == null && max == null) {
            return null;
        }
        String currency = firstText(raw, "salary_currency", "currency");
        String range;
        if (min != null && max != null) {
            range = min + "-" + max;
        } else if (min != null) {
            range = min + "+";
        } else {
            range = "up to " + max;
        }
        return currency == null ? range : currency + " " + range;
    }

    private String extractCategory(JsonNode raw) {
        String category = firstText(raw, "category");
        if (category != null) {
            return category;
        }
        JsonNode categories = raw.get("categories");
        if (categories != null && categories.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode node : categories) {
                String value = node.isTextual() ? node.asText().trim() : firstText(node, "name", "category");
                if (value != null && !value.isBlank()) {
                    values.add(value);
                }
            }
            return values.isEmpty() ? null : String.join(", ", values);
        }
        return null;
    }
}
