package io.snapcheck.pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.snapcheck.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * Expresses a value as JSON text: compact first, then pretty-printed for non-empty containers.
 */
public final class JsonPatternGenerator implements PatternGenerator {
    private static final ObjectMapper PRETTY = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public List<String> candidates(JsonNode value) {
        JsonNode node = value == null ? Jsons.compactMapper().nullNode() : value;
        List<String> out = new ArrayList<>(2);
        out.add(Jsons.toCompactJson(node));
        if (node.isContainerNode() && node.size() > 0) {
            String pretty = pretty(node);
            if (!out.contains(pretty)) {
                out.add(pretty);
            }
        }
        return out;
    }

    private static String pretty(JsonNode node) {
        try {
            return PRETTY.writeValueAsString(node).replace("\r\n", "\n");
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be rendered as JSON", e);
        }
    }
}
