package com.delta.jobmatcher.match.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Validates a decoded model payload and maps it onto a typed value. Implementations throw
 * {@link IllegalArgumentException} when the payload does not have the expected shape; the
 * invoker turns that into a {@link MalformedResponseException} carrying the raw response.
 */
@FunctionalInterface
public interface PayloadReader<T> {

    T read(JsonNode payload);
}
