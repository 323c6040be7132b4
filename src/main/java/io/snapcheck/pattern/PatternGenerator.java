package io.snapcheck.pattern;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Produces candidate expectations for a captured value, most preferred first.
 */
public interface PatternGenerator {
    List<String> candidates(JsonNode value);
}
