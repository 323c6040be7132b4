package io.snapcheck.runtime;

import io.snapcheck.config.ReconcileSettings;
import io.snapcheck.coordinator.ReconcileCoordinator;
import io.snapcheck.model.Action;
import io.snapcheck.model.Assertion;
import io.snapcheck.model.AssertionOptions;
import io.snapcheck.model.ErrorKind;
import io.snapcheck.model.PatchOutcome;
import io.snapcheck.model.SelectionOrder;
import io.snapcheck.model.Stage;
import io.snapcheck.model.Target;
import io.snapcheck.staging.CommitResult;
import io.snapcheck.staging.PatchStagingStore;
import io.snapcheck.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

final class AutoAssertTest {

    @Test
    void newAssertionPassesWhenAcceptedOrSkipped() {
        try (ReconcileCoordinator coordinator = coordinator(a -> a.testName().equals("skip")
                ? PatchOutcome.skipped(a)
                : PatchOutcome.ok(a.withRegeneratedCode("done")))) {
            AutoAssert autoAssert = new AutoAssert(coordinator);
            Assertions.assertTrue(autoAssert.check(assertion("accept", Stage.NEW, null, "1")).isOk());
            Assertions.assertTrue(autoAssert.check(assertion("skip", Stage.NEW, null, "1")).is(ErrorKind.SKIPPED));
        }
    }

    @Test
    void newAssertionFailsWhenRejected() {
        try (ReconcileCoordinator coordinator = coordinator(PatchOutcome::rejected)) {
            AutoAssertionError error = Assertions.assertThrows(
                    AutoAssertionError.class,
                    () -> new AutoAssert(coordinator).check(assertion("reject", Stage.NEW, null, "1"))
            );
            Assertions.assertTrue(error.outcome().is(ErrorKind.REJECTED));
        }
    }

    @Test
    void matchingUpdateNeverReachesCoordinator() {
        List<String> seen = new ArrayList<>();
        try (ReconcileCoordinator coordinator = coordinator(a -> {
            seen.add(a.testName());
            return PatchOutcome.ok(a.withRegeneratedCode("x"));
        })) {
            PatchOutcome outcome = new AutoAssert(coordinator)
                    .check(assertion("same", Stage.UPDATE, "{\"a\": [1, 2]}", "{\"a\":[1,2]}"));
            Assertions.assertTrue(outcome.isOk());
            Assertions.assertTrue(seen.isEmpty());
        }
    }

    @Test
    void matchingUpdateWithAssertTargetIsConvertedOrLeftPassing() {
        Assertion matching = Assertion.builder()
                .file("src/test/java/sample/SampleTest.java")
                .line(3)
                .testName("convert")
                .groupId("SampleTest")
                .stage(Stage.UPDATE)
                .code("AutoAssert.that(v).matches(\"1\");")
                .value(Jsons.readTreeOrNull("1"))
                .expected("1")
                .options(new AssertionOptions(null, "assert", null))
                .build();

        try (ReconcileCoordinator coordinator = coordinator(a -> PatchOutcome.ok(a.withRegeneratedCode("assertEquals(\"1\", AutoAssert.json(v));")))) {
            PatchOutcome outcome = new AutoAssert(coordinator).check(matching);
            Assertions.assertEquals("assertEquals(\"1\", AutoAssert.json(v));", outcome.assertion().regeneratedCode());
            Assertions.assertEquals(1L, coordinator.stats().updated());
        }
        try (ReconcileCoordinator coordinator = coordinator(PatchOutcome::rejected)) {
            PatchOutcome outcome = new AutoAssert(coordinator).check(matching);
            Assertions.assertTrue(outcome.is(ErrorKind.REJECTED));
            Assertions.assertEquals(1L, coordinator.stats().rejected());
        }
    }

    @Test
    void mismatchedUpdateIsPatchedWhenAccepted() {
        try (ReconcileCoordinator coordinator = coordinator(a -> PatchOutcome.ok(a.withRegeneratedCode("patched")))) {
            PatchOutcome outcome = new AutoAssert(coordinator).check(assertion("changed", Stage.UPDATE, "1", "2"));
            Assertions.assertEquals("patched", outcome.assertion().regeneratedCode());
            Assertions.assertEquals(1L, coordinator.stats().updated());
        }
    }

    @Test
    void mismatchedUpdateFailsWithOriginalComparisonWhenRejected() {
        try (ReconcileCoordinator coordinator = coordinator(PatchOutcome::rejected)) {
            AutoAssertionError error = Assertions.assertThrows(
                    AutoAssertionError.class,
                    () -> new AutoAssert(coordinator).check(assertion("changed", Stage.UPDATE, "1", "2"))
            );
            Assertions.assertEquals("expected: <1> but was: <2>", error.getMessage());
            Assertions.assertEquals(1L, coordinator.stats().rejected());
        }
    }

    @Test
    void fileChangedFailsTheTest() {
        try (ReconcileCoordinator coordinator = coordinator(a -> PatchOutcome.fileChanged(a, "moved"))) {
            AutoAssertionError error = Assertions.assertThrows(
                    AutoAssertionError.class,
                    () -> new AutoAssert(coordinator).check(assertion("changed", Stage.UPDATE, "1", "2"))
            );
            Assertions.assertTrue(error.getMessage().contains("file_changed"));
        }
    }

    @Test
    void jsonRendersCompactly() {
        Assertions.assertEquals("{\"k\":[1,2]}", AutoAssert.json(Map.of("k", List.of(1, 2))));
        Assertions.assertEquals("\"s\"", AutoAssert.json("s"));
        Assertions.assertEquals("{\"a\":1}", AutoAssert.json(Jsons.readTreeOrNull("{ \"a\" : 1 }")));
    }

    private static ReconcileCoordinator coordinator(Function<Assertion, PatchOutcome> decide) {
        PatchStagingStore store = new PatchStagingStore() {
            @Override
            public PatchOutcome patch(Assertion assertion, long seq) {
                return decide.apply(assertion);
            }

            @Override
            public CommitResult commit() {
                return new CommitResult(List.of(), Set.of(), false);
            }
        };
        ReconcileSettings settings = new ReconcileSettings(
                Action.PROMPT, Target.AUTO_ASSERT, false, false, SelectionOrder.LIFO, 1, 0, 1
        );
        return new ReconcileCoordinator(
                store, settings, null, null,
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)
        );
    }

    private static Assertion assertion(String name, Stage stage, String expected, String valueJson) {
        return Assertion.builder()
                .file("src/test/java/sample/SampleTest.java")
                .line(3)
                .testName(name)
                .groupId("SampleTest")
                .stage(stage)
                .code(expected == null ? "AutoAssert.that(v);" : "AutoAssert.that(v).matches(\"" + expected + "\");")
                .value(Jsons.readTreeOrNull(valueJson))
                .expected(expected)
                .build();
    }
}
