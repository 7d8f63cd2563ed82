package com.delta.jobmatcher.match.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class JsonPayloadExtractor {
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public JsonPayloadExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode extract(String modelId, String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new MalformedResponseException(modelId, "Empty response from model " + modelId, rawText);
        }
        String body = stripFence(rawText);
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode() || node.isNull()) {
                throw new MalformedResponseException(modelId, "Response from model " + modelId + " has no JSON payload", rawText);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(
                modelId,
                "Failed to parse JSON response from model " + modelId + ": " + e.getOriginalMessage(),
                rawText,
                e
            );
        }
    }

    static String stripFence(String rawText) {
        String text = rawText.trim();
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return text;
        }
        int start = open + FENCE.length();
        int newline = text.indexOf('\n', start);
        if (newline >= 0 && isLanguageTag(text.substring(start, newline).trim())) {
            start = newline + 1;
        } else if (text.regionMatches(true, start, "json", 0, 4)) {
            start += 4;
        }
        int close = text.indexOf(FENCE, start);
        if (close < 0) {
            close = text.length();
        }
        return text.substring(start, close).trim();
    }

    private static boolean isLanguageTag(String candidate) {
        if (candidate.isEmpty()) {
            return true;
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '-' && c != '_') {
                return false;
            }
        }
        return true;
    }
}
