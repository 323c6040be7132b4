package io.snapcheck.pattern;

import io.snapcheck.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class JsonPatternGeneratorTest {
    private final JsonPatternGenerator generator = new JsonPatternGenerator();

    @Test
    void scalarsHaveSingleCompactCandidate() {
        Assertions.assertEquals(List.of("42"), generator.candidates(Jsons.readTreeOrNull("42")));
        Assertions.assertEquals(List.of("\"hi\""), generator.candidates(Jsons.readTreeOrNull("\"hi\"")));
        Assertions.assertEquals(List.of("null"), generator.candidates(null));
        Assertions.assertEquals(List.of("[]"), generator.candidates(Jsons.readTreeOrNull("[]")));
    }

    @Test
    void containersOfferPrettyAlternative() {
        List<String> candidates = generator.candidates(Jsons.readTreeOrNull("{\"a\":1,\"b\":[true]}"));

        Assertions.assertEquals(2, candidates.size());
        Assertions.assertEquals("{\"a\":1,\"b\":[true]}", candidates.get(0));
        Assertions.assertTrue(candidates.get(1).startsWith("{\n  \"a\" : 1,"));
        Assertions.assertFalse(candidates.get(1).contains("\r"));
        Assertions.assertEquals(Jsons.readTreeOrNull(candidates.get(0)), Jsons.readTreeOrNull(candidates.get(1)));
    }
}
