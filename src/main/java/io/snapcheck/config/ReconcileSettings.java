package io.snapcheck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.snapcheck.model.Action;
import io.snapcheck.model.SelectionOrder;
import io.snapcheck.model.Target;
import io.snapcheck.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public record ReconcileSettings(
        Action action,
        Target target,
        boolean forceUpdate,
        boolean dryRun,
        SelectionOrder selection,
        int failureExitStatus,
        int historyLimit,
        int parallelism
) {
    public static final int DEFAULT_FAILURE_EXIT_STATUS = 1;
    public static final int DEFAULT_HISTORY_LIMIT = 5;
    public static final int DEFAULT_PARALLELISM = 4;

    public static ReconcileSettings defaults() {
        return new ReconcileSettings(
                Action.PROMPT,
                Target.AUTO_ASSERT,
                false,
                false,
                SelectionOrder.LIFO,
                DEFAULT_FAILURE_EXIT_STATUS,
                DEFAULT_HISTORY_LIMIT,
                DEFAULT_PARALLELISM
        );
    }

    /**
     * Reads {@code file} when present, otherwise returns the defaults.
     */
    public static ReconcileSettings load(Path file) {
        ReconcileSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static ReconcileSettings fromFile(SettingsFile file, ReconcileSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new ReconcileSettings(
                file.action() == null ? defaults.action() : Action.fromString(file.action()),
                file.target() == null ? defaults.target() : Target.fromString(file.target()),
                sanitizeBoolean(file.forceUpdate(), defaults.forceUpdate()),
                sanitizeBoolean(file.dryRun(), defaults.dryRun()),
                file.selection() == null ? defaults.selection() : SelectionOrder.fromString(file.selection()),
                sanitizeInt(file.failureExitStatus(), defaults.failureExitStatus(), 1),
                sanitizeInt(file.historyLimit(), defaults.historyLimit(), 0),
                sanitizeInt(file.parallelism(), defaults.parallelism(), 1)
        );
    }

    public ReconcileSettings withAction(Action value) {
        return value == null ? this : new ReconcileSettings(
                value, target, forceUpdate, dryRun, selection, failureExitStatus, historyLimit, parallelism);
    }

    public ReconcileSettings withTarget(Target value) {
        return value == null ? this : new ReconcileSettings(
                action, value, forceUpdate, dryRun, selection, failureExitStatus, historyLimit, parallelism);
    }

    public ReconcileSettings withForceUpdate(boolean value) {
        return new ReconcileSettings(
                action, target, value, dryRun, selection, failureExitStatus, historyLimit, parallelism);
    }

    public ReconcileSettings withDryRun(boolean value) {
        return new ReconcileSettings(
                action, target, forceUpdate, value, selection, failureExitStatus, historyLimit, parallelism);
    }

    public ReconcileSettings withSelection(SelectionOrder value) {
        return value == null ? this : new ReconcileSettings(
                action, target, forceUpdate, dryRun, value, failureExitStatus, historyLimit, parallelism);
    }

    public ReconcileSettings withParallelism(int value) {
        return new ReconcileSettings(
                action, target, forceUpdate, dryRun, selection, failureExitStatus, historyLimit, Math.max(1, value));
    }

    /**
     * Names of the fields whose value differs between {@code this} and {@code other}.
     */
    public List<String> diff(ReconcileSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (action != other.action) {
            changed.add("action");
        }
        if (target != other.target) {
            changed.add("target");
        }
        if (forceUpdate != other.forceUpdate) {
            changed.add("forceUpdate");
        }
        if (dryRun != other.dryRun) {
            changed.add("dryRun");
        }
        if (selection != other.selection) {
            changed.add("selection");
        }
        if (failureExitStatus != other.failureExitStatus) {
            changed.add("failureExitStatus");
        }
        if (historyLimit != other.historyLimit) {
            changed.add("historyLimit");
        }
        if (parallelism != other.parallelism) {
            changed.add("parallelism");
        }
        return changed;
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            String action,
            String target,
            Boolean forceUpdate,
            Boolean dryRun,
            String selection,
            Integer failureExitStatus,
            Integer historyLimit,
            Integer parallelism
    ) {
    }
}
