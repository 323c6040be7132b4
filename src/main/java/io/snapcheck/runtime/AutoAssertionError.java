package io.snapcheck.runtime;

import io.snapcheck.model.PatchOutcome;

/**
 * Test failure raised by {@link AutoAssert}. Carries the reconciliation outcome when the failure
 * came from a decision rather than a plain comparison.
 */
public final class AutoAssertionError extends AssertionError {
    private final transient PatchOutcome outcome;

    public AutoAssertionError(String message, PatchOutcome outcome) {
        super(message);
        this.outcome = outcome;
    }

    public PatchOutcome outcome() {
        return outcome;
    }
}
