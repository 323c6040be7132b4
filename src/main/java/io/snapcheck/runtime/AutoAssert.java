package io.snapcheck.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.snapcheck.coordinator.ReconcileCoordinator;
import io.snapcheck.model.Assertion;
import io.snapcheck.model.ErrorKind;
import io.snapcheck.model.PatchOutcome;
import io.snapcheck.model.Stage;
import io.snapcheck.util.Jsons;

/**
 * Worker side of a reconciliation point.
 *
 * <p>A new assertion passes once it is accepted or skipped. An existing assertion is compared
 * against its expectation first and only goes to the coordinator on mismatch, unless forced
 * reconciliation or the {@code assert} target applies to it.
 */
public final class AutoAssert {
    private final ReconcileCoordinator coordinator;

    public AutoAssert(ReconcileCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Compact JSON rendering of {@code value}, the form expectations are written in.
     */
    public static String json(Object value) {
        if (value instanceof JsonNode node) {
            return Jsons.toCompactJson(node);
        }
        return Jsons.toCompactJson(value);
    }

    public static boolean matches(Assertion assertion) {
        JsonNode expected = Jsons.readTreeOrNull(assertion.expected());
        JsonNode actual = assertion.value() == null ? NullNode.getInstance() : assertion.value();
        return expected != null && expected.equals(actual);
    }

    public PatchOutcome check(Assertion assertion) {
        PatchOutcome registered = coordinator.register(assertion);
        if (assertion.stage() == Stage.NEW) {
            if (registered.isOk() || registered.is(ErrorKind.SKIPPED)) {
                return registered;
            }
            throw failure(registered);
        }
        if (registered.assertion().regeneratedCode() != null) {
            return registered;
        }
        boolean matched = matches(assertion);
        if (!registered.isOk()) {
            return settle(registered, matched, assertion);
        }
        if (matched) {
            return registered;
        }
        return settle(coordinator.requestPatch(assertion), false, assertion);
    }

    private static PatchOutcome settle(PatchOutcome outcome, boolean matched, Assertion assertion) {
        if (outcome.isOk() || outcome.is(ErrorKind.SKIPPED)) {
            return outcome;
        }
        if (outcome.is(ErrorKind.REJECTED)) {
            if (matched) {
                return outcome;
            }
            throw new AutoAssertionError(
                    "expected: <" + assertion.expected() + "> but was: <" + json(assertion.value()) + ">",
                    outcome
            );
        }
        throw failure(outcome);
    }

    private static AutoAssertionError failure(PatchOutcome outcome) {
        return new AutoAssertionError(
                outcome.assertion().location() + ": " + outcome.label() + " (" + outcome.message() + ")",
                outcome
        );
    }
}
