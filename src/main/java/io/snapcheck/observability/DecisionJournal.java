package io.snapcheck.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.snapcheck.security.SensitiveDataMasker;
import io.snapcheck.util.Hashing;
import io.snapcheck.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines journal of reconciliation events. Each row carries the hash of the
 * previous row, so truncation or in-place edits are detected by {@link #verify()}.
 */
public final class DecisionJournal {
    private final Path journalFile;
    private final String runId;
    private String previousHash;

    public DecisionJournal(Path journalFile, String runId) {
        this.journalFile = journalFile;
        this.runId = runId == null || runId.isBlank() ? "unknown" : runId.trim();
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize decision journal: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public String runId() {
        return runId;
    }

    public Path file() {
        return journalFile;
    }

    public synchronized void log(JournalEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("run_id", runId);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write decision journal", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-walks the whole chain and stops at the first row whose hash or back-link does not match.
     */
    public synchronized VerifyResult verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read decision journal", e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            int lineNo = i + 1;
            JsonNode parsed = Jsons.readTreeOrNull(line);
            if (!(parsed instanceof ObjectNode node)) {
                return VerifyResult.broken(rows, lineNo, "row is not a JSON object");
            }
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return VerifyResult.broken(rows, lineNo, "prev_hash does not link to the previous row");
            }
            node.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(node)))) {
                return VerifyResult.broken(rows, lineNo, "hash mismatch");
            }
            expectedPrev = hash;
            rows++;
        }
        return new VerifyResult(true, rows, 0, null, expectedPrev);
    }

    private String loadLastHash() {
        List<String> lines;
        try {
            lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read decision journal", e);
        }
        String last = "";
        for (String line : lines) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        JsonNode node = Jsons.readTreeOrNull(last);
        return node == null ? "" : node.path("hash").asText("");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record JournalEvent(
            String action,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static JournalEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new JournalEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyResult(
            boolean ok,
            int rows,
            int brokenLine,
            String reason,
            String lastHash
    ) {
        static VerifyResult broken(int rows, int line, String reason) {
            return new VerifyResult(false, rows, line, reason, null);
        }
    }
}
