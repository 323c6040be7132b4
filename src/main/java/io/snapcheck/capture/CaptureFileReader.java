package io.snapcheck.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.snapcheck.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON-lines capture file. Blank lines are ignored; any other malformed line rejects the file.
 */
public final class CaptureFileReader {
    private CaptureFileReader() {
    }

    public static List<CaptureRecord> read(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read captures: " + file, e);
        }
        List<CaptureRecord> out = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            out.add(parse(line, i + 1));
        }
        return out;
    }

    static CaptureRecord parse(String line, int lineNo) {
        CaptureRecord record;
        try {
            record = Jsons.mapper().readValue(line, CaptureRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid capture at line " + lineNo + ": " + e.getOriginalMessage(), e);
        }
        if (record.file() == null || record.file().isBlank()) {
            throw new IllegalArgumentException("Capture at line " + lineNo + " has no file");
        }
        if (record.line() == null || record.line() < 1) {
            throw new IllegalArgumentException("Capture at line " + lineNo + " has no valid line number");
        }
        if (record.code() == null || record.code().isBlank()) {
            throw new IllegalArgumentException("Capture at line " + lineNo + " has no code");
        }
        return record;
    }
}
