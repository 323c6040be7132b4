package io.snapcheck.runtime;

import io.snapcheck.config.ReconcileSettings;
import io.snapcheck.config.SnapcheckConfig;
import io.snapcheck.coordinator.ReconcileCoordinator;
import io.snapcheck.diff.LineDiffRenderer;
import io.snapcheck.model.DecisionRecord;
import io.snapcheck.observability.DecisionJournal;
import io.snapcheck.observability.DecisionJournal.JournalEvent;
import io.snapcheck.pattern.JsonPatternGenerator;
import io.snapcheck.prompt.Prompter;
import io.snapcheck.rewrite.JavaCallSiteRewriter;
import io.snapcheck.staging.FileStagingStore;
import io.snapcheck.storage.Database;
import io.snapcheck.storage.DecisionHistoryStore;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class SnapcheckRuntime {
    private final SnapcheckConfig config;
    private final Database database;

    public SnapcheckRuntime(SnapcheckConfig config) {
        this.config = config;
        this.database = new Database(config);
    }

    public SnapcheckConfig config() {
        return config;
    }

    public void init() {
        database.init();
    }

    /**
     * Settings from {@code snapcheck-settings.json} under the data root, or the defaults.
     */
    public ReconcileSettings loadSettings() {
        return ReconcileSettings.load(config.settingsFile());
    }

    /**
     * Wires one run: a fresh journal run id, history, staging store and coordinator.
     */
    public Run openRun(ReconcileSettings settings, Prompter interactive, PrintStream out) {
        String runId = "run-" + UUID.randomUUID();
        DecisionJournal journal = new DecisionJournal(config.journalFile(), runId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("settings", settings);
        details.put("overridden", settings.diff(ReconcileSettings.defaults()));
        details.put("settings_file", config.settingsFile().toString());
        journal.log(JournalEvent.of("settings.load", "settings", "ok", details));

        DecisionHistoryStore history = new DecisionHistoryStore(database, runId);
        FileStagingStore stagingStore = new FileStagingStore(
                settings,
                new JsonPatternGenerator(),
                new JavaCallSiteRewriter(),
                new LineDiffRenderer(),
                interactive,
                history
        );
        ReconcileCoordinator coordinator = new ReconcileCoordinator(stagingStore, settings, history, journal, out);
        return new Run(runId, settings, coordinator, stagingStore);
    }

    public List<DecisionRecord> history(String file, int limit) {
        return new DecisionHistoryStore(database, "query").forFile(config.resolveSource(file).toString(), limit);
    }

    public DecisionJournal.VerifyResult verifyJournal() {
        return new DecisionJournal(config.journalFile(), "verify").verify();
    }

    public record Run(
            String runId,
            ReconcileSettings settings,
            ReconcileCoordinator coordinator,
            FileStagingStore stagingStore
    ) {
    }
}
