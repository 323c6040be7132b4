package io.snapcheck.staging;

import io.snapcheck.util.Hashing;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory image of one source file plus the replacements staged against it.
 *
 * <p>Replacements address byte ranges of the baseline content, so any number of them compose
 * regardless of the order they were accepted in. Only replacement text is encoded; bytes outside
 * the replaced ranges, line separators and non-UTF-8 sequences included, are written back as read.
 */
final class StagedFile {
    enum Status {
        PENDING,
        COMMITTED,
        CONFLICTED
    }

    enum StageResult {
        STAGED,
        REGION_MISMATCH,
        OVERLAP
    }

    private static final byte LF = '\n';
    private static final byte CR = '\r';

    private final Path path;
    private final TreeMap<Long, Replacement> edits = new TreeMap<>();
    private String fingerprint;
    private byte[] content;
    private int[] lineStarts;
    private String separator;
    private Status status;
    private boolean conflictReported;

    private StagedFile(Path path, byte[] content) {
        this.path = path;
        reset(content);
    }

    static StagedFile open(Path path, byte[] content) {
        return new StagedFile(path, content);
    }

    Path path() {
        return path;
    }

    Status status() {
        return status;
    }

    String fingerprint() {
        return fingerprint;
    }

    boolean hasEdits() {
        return !edits.isEmpty();
    }

    int editCount() {
        return edits.size();
    }

    boolean matchesBaseline(byte[] current) {
        return fingerprint.equals(Hashing.sha256Hex(current));
    }

    /**
     * Drops every staged edit; the file stays conflicted until the next run.
     */
    void conflict() {
        edits.clear();
        status = Status.CONFLICTED;
    }

    boolean conflictReported() {
        return conflictReported;
    }

    void markConflictReported() {
        conflictReported = true;
    }

    StageResult stage(long seq, int line, String code, String replacement) {
        List<String> expected = lines(code);
        int first = line - 1;
        int last = first + expected.size() - 1;
        if (first < 0 || last >= lineStarts.length) {
            return StageResult.REGION_MISMATCH;
        }
        int start = lineStarts[first];
        int end = lineEnd(last);
        String region = new String(content, start, end - start, StandardCharsets.UTF_8);
        if (!lines(region).equals(expected)) {
            return StageResult.REGION_MISMATCH;
        }
        for (Replacement existing : edits.values()) {
            if (start < existing.end() && existing.start() < end) {
                return StageResult.OVERLAP;
            }
        }
        String normalized = stripTrailingNewline(replacement.replace("\r\n", "\n"));
        byte[] bytes = normalized.replace("\n", separator).getBytes(StandardCharsets.UTF_8);
        edits.put(seq, new Replacement(seq, start, end, bytes));
        return StageResult.STAGED;
    }

    byte[] render() {
        List<Replacement> ordered = new ArrayList<>(edits.values());
        ordered.sort(Comparator.comparingInt(Replacement::start));
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length);
        int position = 0;
        for (Replacement r : ordered) {
            out.write(content, position, r.start() - position);
            out.writeBytes(r.bytes());
            position = r.end();
        }
        out.write(content, position, content.length - position);
        return out.toByteArray();
    }

    Map<Long, Replacement> edits() {
        return edits;
    }

    /**
     * Makes {@code written} the new baseline after a successful write.
     */
    void committed(byte[] written) {
        reset(written);
        status = Status.COMMITTED;
    }

    private void reset(byte[] content) {
        this.fingerprint = Hashing.sha256Hex(content);
        this.content = Arrays.copyOf(content, content.length);
        this.separator = containsCrlf(content) ? "\r\n" : "\n";
        this.lineStarts = computeLineStarts(content);
        this.edits.clear();
        this.status = Status.PENDING;
        this.conflictReported = false;
    }

    // End of the line's content, before its terminator.
    private int lineEnd(int lineIndex) {
        int end = lineIndex + 1 < lineStarts.length ? lineStarts[lineIndex + 1] : content.length;
        if (end > lineStarts[lineIndex] && content[end - 1] == LF) {
            end--;
            if (end > lineStarts[lineIndex] && content[end - 1] == CR) {
                end--;
            }
        }
        return end;
    }

    private static boolean containsCrlf(byte[] content) {
        for (int i = 1; i < content.length; i++) {
            if (content[i] == LF && content[i - 1] == CR) {
                return true;
            }
        }
        return false;
    }

    private static int[] computeLineStarts(byte[] content) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length; i++) {
            if (content[i] == LF && i + 1 < content.length) {
                starts.add(i + 1);
            }
        }
        int[] out = new int[starts.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = starts.get(i);
        }
        return out;
    }

    private static List<String> lines(String raw) {
        String normalized = stripTrailingNewline(raw.replace("\r\n", "\n"));
        return List.of(normalized.split("\n", -1));
    }

    private static String stripTrailingNewline(String value) {
        return value.endsWith("\n") ? value.substring(0, value.length() - 1) : value;
    }

    record Replacement(long seq, int start, int end, byte[] bytes) {
    }
}
