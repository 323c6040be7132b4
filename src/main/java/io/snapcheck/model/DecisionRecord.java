package io.snapcheck.model;

/**
 * A past outcome recorded for the same call site.
 */
public record DecisionRecord(
        String file,
        int line,
        String testName,
        String groupId,
        String stage,
        String outcome,
        String pattern,
        String runId,
        long seq,
        long decidedAtMs
) {
}
