package io.snapcheck.capture;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.snapcheck.model.AssertionOptions;

/**
 * One captured value, as written by the test harness: a line of the capture file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaptureRecord(
        String file,
        Integer line,
        String group,
        String test,
        String code,
        JsonNode value,
        AssertionOptions options
) {
    public static final String DEFAULT_GROUP = "default";

    public String groupOrDefault() {
        return group == null || group.isBlank() ? DEFAULT_GROUP : group;
    }

    public String testOrDefault() {
        return test == null || test.isBlank() ? "line " + line : test;
    }
}
