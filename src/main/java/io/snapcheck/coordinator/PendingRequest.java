package io.snapcheck.coordinator;

import io.snapcheck.model.Assertion;
import io.snapcheck.model.PatchOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * A suspended worker waiting for its assertion to be reconciled.
 */
record PendingRequest(
        Assertion assertion,
        CompletableFuture<PatchOutcome> reply,
        long insertion
) {
    boolean eligibleUnder(String activeGroup) {
        return activeGroup == null || activeGroup.equals(assertion.groupId());
    }
}
