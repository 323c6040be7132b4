package io.snapcheck.model;

/**
 * Terminal outcome of one reconciliation round. {@code error == null} means the assertion was
 * materialized and {@link #assertion()} carries the regenerated code.
 */
public record PatchOutcome(
        Assertion assertion,
        ErrorKind error,
        String message
) {
    public static PatchOutcome ok(Assertion assertion) {
        return new PatchOutcome(assertion, null, null);
    }

    public static PatchOutcome error(Assertion assertion, ErrorKind kind, String message) {
        return new PatchOutcome(assertion, kind, message);
    }

    public static PatchOutcome skipped(Assertion assertion) {
        return error(assertion, ErrorKind.SKIPPED, "skipped");
    }

    public static PatchOutcome rejected(Assertion assertion) {
        return error(assertion, ErrorKind.REJECTED, "rejected");
    }

    public static PatchOutcome fileChanged(Assertion assertion, String message) {
        return error(assertion, ErrorKind.FILE_CHANGED, message);
    }

    public static PatchOutcome failed(Assertion assertion, String message) {
        return error(assertion, ErrorKind.FAILED, message);
    }

    public static PatchOutcome aborted(Assertion assertion) {
        return error(assertion, ErrorKind.ABORTED, "aborted before a decision was made");
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean is(ErrorKind kind) {
        return error == kind;
    }

    public String label() {
        if (error == null) {
            return assertion.stage() == Stage.NEW ? "new" : "updated";
        }
        return error.name().toLowerCase();
    }
}
