package io.snapcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-assertion overrides; a {@code null} field falls back to the run settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssertionOptions(
        String action,
        String target,
        Boolean forceUpdate
) {
    public static final AssertionOptions NONE = new AssertionOptions(null, null, null);

    public Action resolveAction(Action fallback) {
        return action == null || action.isBlank() ? fallback : Action.fromString(action);
    }

    public Target resolveTarget(Target fallback) {
        return target == null || target.isBlank() ? fallback : Target.fromString(target);
    }

    public boolean resolveForceUpdate(boolean fallback) {
        return forceUpdate == null ? fallback : forceUpdate;
    }
}
