package com.delta.jobmatcher.match.util;

import java.util.Arrays;
import java.util.List;

public final class TextUtils {
    private TextUtils() {
    }

    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (maxChars <= 0 || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }

    public static String truncateWords(String value, int maxWords) {
        if (value == null || value.isBlank()) {
            return value;
        }
        String[] words = value.trim().split("\\s+");
        if (words.length <= maxWords) {
            return value.trim();
        }
        return String.join(" ", Arrays.asList(words).subList(0, maxWords));
    }

    public static String joinOrDefault(List<String> values, String fallback) {
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        return String.join(", ", values);
    }

    public static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
