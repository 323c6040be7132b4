package io.snapcheck.prompt;

import io.snapcheck.model.Assertion;
import io.snapcheck.model.Decision;
import io.snapcheck.model.DecisionRecord;
import io.snapcheck.model.Stage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

final class TerminalPrompterTest {

    @Test
    void rendersHeaderHistoryAndDiffThenReadsChoice() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        TerminalPrompter prompter = prompter("maybe\n  Y \n", buffer);
        DecisionRecord past = new DecisionRecord(
                "/src/SampleTest.java", 7, "works", "SampleTest", "update", "rejected", null, "run-1", 3L, 0L
        );

        Decision decision = prompter.prompt(view(Stage.UPDATE, 1, List.of(past)));

        Assertions.assertEquals(Decision.ACCEPT, decision);
        String out = buffer.toString(StandardCharsets.UTF_8);
        Assertions.assertTrue(out.contains("| Changed - autoAssert"), out);
        Assertions.assertTrue(out.contains("SampleTest.java:7"), out);
        Assertions.assertTrue(out.contains("| SampleTest > works"), out);
        Assertions.assertTrue(out.contains("| history: rejected (1970-01-01T00:00:00Z)"), out);
        Assertions.assertTrue(out.contains("|   -   AutoAssert.that(x);"), out);
        Assertions.assertTrue(out.contains("Value has changed! Update to new value? [y]es [n]o [s]kip"), out);
        Assertions.assertTrue(out.contains("| Unrecognized choice: maybe"), out);
    }

    @Test
    void navigationIsOfferedOnlyWithAlternatives() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Decision decision = prompter("j\n", buffer).prompt(view(Stage.NEW, 2, List.of()));

        Assertions.assertEquals(Decision.NEXT, decision);
        String out = buffer.toString(StandardCharsets.UTF_8);
        Assertions.assertTrue(out.contains("Accept new assertion? (1 of 2) [y]es [n]o [s]kip [j] next [k] previous"), out);

        Assertions.assertNull(TerminalPrompter.parse("k", false));
        Assertions.assertEquals(Decision.PREVIOUS, TerminalPrompter.parse("previous", true));
        Assertions.assertEquals(Decision.REJECT, TerminalPrompter.parse("N", false));
    }

    @Test
    void endOfInputSkips() {
        Decision decision = prompter("", new ByteArrayOutputStream()).prompt(view(Stage.NEW, 1, List.of()));
        Assertions.assertEquals(Decision.SKIP, decision);
    }

    private static TerminalPrompter prompter(String input, ByteArrayOutputStream buffer) {
        return new TerminalPrompter(
                new BufferedReader(new StringReader(input)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8)
        );
    }

    private static PromptView view(Stage stage, int candidates, List<DecisionRecord> history) {
        Assertion assertion = Assertion.builder()
                .file("/src/SampleTest.java")
                .line(7)
                .testName("works")
                .groupId("SampleTest")
                .stage(stage)
                .code("AutoAssert.that(x);")
                .build();
        String diff = "  -   AutoAssert.that(x);\n  +   AutoAssert.that(x).matches(\"1\");";
        return new PromptView(assertion, assertion.code(), "AutoAssert.that(x).matches(\"1\");", diff, 0, candidates, history);
    }
}
