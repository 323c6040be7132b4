package io.snapcheck.config;

import io.snapcheck.model.Action;
import io.snapcheck.model.SelectionOrder;
import io.snapcheck.model.Target;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class ReconcileSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("snapcheck-settings-");
        try {
            SnapcheckConfig config = SnapcheckConfig.fromRoot(root.toString());
            ReconcileSettings settings = ReconcileSettings.load(config.settingsFile());

            Assertions.assertEquals(ReconcileSettings.defaults(), settings);
            Assertions.assertEquals(Action.PROMPT, settings.action());
            Assertions.assertEquals(SelectionOrder.LIFO, settings.selection());
            Assertions.assertEquals(1, settings.failureExitStatus());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreReadAndSanitized() throws Exception {
        Path root = Files.createTempDirectory("snapcheck-settings-");
        try {
            SnapcheckConfig config = SnapcheckConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "action": "accept",
                      "target": "assert",
                      "dryRun": true,
                      "selection": "fifo",
                      "failureExitStatus": 0,
                      "historyLimit": -3,
                      "parallelism": 8,
                      "somethingElse": "ignored"
                    }
                    """, StandardCharsets.UTF_8);

            ReconcileSettings settings = ReconcileSettings.load(config.settingsFile());

            Assertions.assertEquals(Action.ACCEPT, settings.action());
            Assertions.assertEquals(Target.ASSERT, settings.target());
            Assertions.assertFalse(settings.forceUpdate());
            Assertions.assertTrue(settings.dryRun());
            Assertions.assertEquals(SelectionOrder.FIFO, settings.selection());
            Assertions.assertEquals(1, settings.failureExitStatus());
            Assertions.assertEquals(0, settings.historyLimit());
            Assertions.assertEquals(8, settings.parallelism());
            Assertions.assertEquals(
                    List.of("action", "target", "dryRun", "selection", "historyLimit", "parallelism"),
                    settings.diff(ReconcileSettings.defaults())
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("snapcheck-settings-");
        try {
            Path file = root.resolve(SnapcheckConfig.SETTINGS_FILE);
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
            RuntimeException error = Assertions.assertThrows(RuntimeException.class, () -> ReconcileSettings.load(file));
            Assertions.assertTrue(error.getMessage().startsWith("Failed to load settings"));

            Files.writeString(file, "{\"action\":\"sometimes\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> ReconcileSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void overridesReplaceSingleFields() {
        ReconcileSettings base = ReconcileSettings.defaults();
        ReconcileSettings changed = base
                .withAction(Action.REJECT)
                .withForceUpdate(true)
                .withParallelism(0);

        Assertions.assertEquals(Action.REJECT, changed.action());
        Assertions.assertTrue(changed.forceUpdate());
        Assertions.assertEquals(1, changed.parallelism());
        Assertions.assertSame(base, base.withTarget(null));
    }

    @Test
    void relativeSourcesResolveAgainstSourceRoot() {
        SnapcheckConfig config = SnapcheckConfig.fromRoot("data", "/work/project");
        Assertions.assertEquals(
                Path.of("/work/project/src/test/java/A.java").toAbsolutePath().normalize(),
                config.resolveSource("src/test/java/../java/A.java")
        );
        Assertions.assertTrue(config.dbFile().endsWith(Path.of("data", "snapcheck.db")));
        Assertions.assertTrue(config.journalFile().endsWith(Path.of("data", "audit", "decisions.log")));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
