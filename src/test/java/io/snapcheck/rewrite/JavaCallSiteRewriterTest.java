package io.snapcheck.rewrite;

import io.snapcheck.model.Target;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class JavaCallSiteRewriterTest {
    private final JavaCallSiteRewriter rewriter = new JavaCallSiteRewriter();

    @Test
    void parsesBareCallSite() {
        CallSite site = rewriter.parse("        AutoAssert.that(service.call(\"a)\", 'x')); // note");

        Assertions.assertEquals("        ", site.prefix());
        Assertions.assertEquals("service.call(\"a)\", 'x')", site.valueExpression());
        Assertions.assertFalse(site.hasExpectation());
        Assertions.assertEquals("; // note", site.suffix());
        Assertions.assertEquals("        ", site.indent());
    }

    @Test
    void parsesEscapedStringExpectation() {
        CallSite site = rewriter.parse("    var r = AutoAssert.that(x).matches(\"{\\\"a\\\":\\\"b\\\\n\\\"}\");");

        Assertions.assertEquals("    var r = ", site.prefix());
        Assertions.assertEquals("{\"a\":\"b\\n\"}", site.expected());
        Assertions.assertEquals(";", site.suffix());
    }

    @Test
    void parsesTextBlockExpectation() {
        String code = String.join("\n",
                "        AutoAssert.that(x).matches(\"\"\"",
                "                {",
                "                  \"a\" : 1",
                "                }\"\"\");"
        );
        CallSite site = rewriter.parse(code);

        Assertions.assertEquals("{\n  \"a\" : 1\n}", site.expected());
        Assertions.assertEquals(";", site.suffix());
    }

    @Test
    void rewritesExpectationKeepingSurroundings() {
        String code = "        AutoAssert.that(value).matches(\"1\"); // keep";

        Assertions.assertEquals(
                "        AutoAssert.that(value).matches(\"2\"); // keep",
                rewriter.rewrite(code, "2", Target.AUTO_ASSERT)
        );
        Assertions.assertEquals(
                "        assertEquals(\"[\\\"q\\\"]\", AutoAssert.json(value)); // keep",
                rewriter.rewrite(code, "[\"q\"]", Target.ASSERT)
        );
    }

    @Test
    void multiLinePatternBecomesTextBlockThatParsesBack() {
        String pattern = "{\n  \"path\" : \"C:\\\\tmp\"\n}";
        String rewritten = rewriter.rewrite("    AutoAssert.that(v);", pattern, Target.AUTO_ASSERT);

        Assertions.assertTrue(rewritten.startsWith("    AutoAssert.that(v).matches(\"\"\"\n            {\n"), rewritten);
        Assertions.assertTrue(rewritten.endsWith("\n            \"\"\");"), rewritten);
        Assertions.assertEquals(pattern + "\n", rewriter.parse(rewritten).expected());
    }

    @Test
    void rejectsCodeWithoutCallSite() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> rewriter.parse("assertEquals(1, x);"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> rewriter.parse("AutoAssert.that(x"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> rewriter.parse("AutoAssert.that()"));
    }
}
