package io.snapcheck.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.snapcheck.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAndTokenLikeValuesRecursively() {
        JsonNode value = Jsons.readTreeOrNull("""
                {"user":"ann","password":"hunter2",
                 "nested":[{"Authorization":"Bearer x"},"eyJhbGciOiJIUzI1NiJ9.payload.signature"]}
                """);

        JsonNode masked = SensitiveDataMasker.masked(value);

        Assertions.assertEquals("ann", masked.path("user").asText());
        Assertions.assertEquals("***", masked.path("password").asText());
        Assertions.assertEquals("***", masked.path("nested").path(0).path("Authorization").asText());
        Assertions.assertEquals("***", masked.path("nested").path(1).asText());
        Assertions.assertEquals("hunter2", value.path("password").asText());
    }

    @Test
    void previewIsCompactAndCapped() {
        Assertions.assertEquals("{\"a\":1}", SensitiveDataMasker.preview(Jsons.readTreeOrNull("{ \"a\" : 1 }")));
        Assertions.assertEquals("null", SensitiveDataMasker.preview(null));

        String longText = "\"" + "word ".repeat(200) + "\"";
        String preview = SensitiveDataMasker.preview(Jsons.readTreeOrNull(longText));
        Assertions.assertTrue(preview.endsWith("chars)"), preview);
        Assertions.assertTrue(preview.length() < 600);
    }
}
