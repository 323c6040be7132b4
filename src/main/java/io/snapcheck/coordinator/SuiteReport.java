package io.snapcheck.coordinator;

import io.snapcheck.model.RunStats;

import java.util.List;

/**
 * End-of-run summary. {@code committed} lists the files written (or, in a dry run, the files
 * that would have been written); {@code aborted} is set when the run was closed before the
 * suite finished and nothing was committed.
 */
public record SuiteReport(
        RunStats stats,
        List<String> notSaved,
        List<String> committed,
        boolean dryRun,
        boolean aborted,
        int exitStatus
) {
    public boolean failed() {
        return exitStatus != 0;
    }
}
