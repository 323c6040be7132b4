package io.snapcheck.staging;

import io.snapcheck.model.Assertion;
import io.snapcheck.model.PatchOutcome;

/**
 * Holds accepted edits in memory until the run commits them in one pass.
 */
public interface PatchStagingStore {
    /**
     * Obtains a decision for {@code assertion} and, when accepted, stages the edit under {@code seq}.
     */
    PatchOutcome patch(Assertion assertion, long seq);

    /**
     * Writes every file with pending edits. Files that could not be written are reported, not thrown.
     */
    CommitResult commit();
}
