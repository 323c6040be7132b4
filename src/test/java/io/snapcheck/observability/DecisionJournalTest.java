package io.snapcheck.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.snapcheck.observability.DecisionJournal.JournalEvent;
import io.snapcheck.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class DecisionJournalTest {

    @Test
    void chainsRowsAcrossInstancesAndVerifies() throws Exception {
        Path root = Files.createTempDirectory("snapcheck-journal-");
        try {
            Path file = root.resolve("audit").resolve("decisions.log");
            DecisionJournal first = new DecisionJournal(file, "run-1");
            first.log(JournalEvent.of("settings.load", "settings", "ok", Map.of("action", "accept")));
            first.log(JournalEvent.of("assertion.decision", "A.java:3", "new", Map.of("seq", 1)));

            DecisionJournal second = new DecisionJournal(file, "run-2");
            Assertions.assertEquals(first.currentHash(), second.currentHash());
            second.log(JournalEvent.of("suite.commit", "suite", "ok", null));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            JsonNode last = Jsons.readTreeOrNull(lines.get(2));
            Assertions.assertEquals("run-2", last.path("run_id").asText());
            Assertions.assertEquals(Jsons.readTreeOrNull(lines.get(1)).path("hash").asText(), last.path("prev_hash").asText());

            DecisionJournal.VerifyResult result = second.verify();
            Assertions.assertTrue(result.ok());
            Assertions.assertEquals(3, result.rows());
            Assertions.assertEquals(second.currentHash(), result.lastHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void detectsTamperedRow() throws Exception {
        Path root = Files.createTempDirectory("snapcheck-journal-");
        try {
            Path file = root.resolve("decisions.log");
            DecisionJournal journal = new DecisionJournal(file, "run-1");
            journal.log(JournalEvent.of("assertion.decision", "A.java:3", "rejected", Map.of("seq", 1)));
            journal.log(JournalEvent.of("assertion.decision", "A.java:9", "new", Map.of("seq", 2)));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Files.write(file, List.of(lines.get(0).replace("\"rejected\"", "\"new\""), lines.get(1)), StandardCharsets.UTF_8);

            DecisionJournal.VerifyResult result = journal.verify();
            Assertions.assertFalse(result.ok());
            Assertions.assertEquals(1, result.brokenLine());
            Assertions.assertEquals("hash mismatch", result.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void masksSecretsInDetails() throws Exception {
        Path root = Files.createTempDirectory("snapcheck-journal-");
        try {
            Path file = root.resolve("decisions.log");
            DecisionJournal journal = new DecisionJournal(file, "run-1");
            journal.log(JournalEvent.of("assertion.decision", "A.java:3", "new",
                    Map.of("apiToken", "abc", "note", "visible")));

            String line = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(line.contains("abc"));
            Assertions.assertTrue(line.contains("\"apiToken\":\"***\""));
            Assertions.assertTrue(line.contains("visible"));
            Assertions.assertTrue(journal.verify().ok());
        } finally {
            deleteRecursively(root);
        }
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
