package io.snapcheck.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.snapcheck.capture.CaptureFileReader;
import io.snapcheck.capture.CaptureRecord;
import io.snapcheck.capture.CaptureReplayRunner;
import io.snapcheck.config.ReconcileSettings;
import io.snapcheck.config.SnapcheckConfig;
import io.snapcheck.coordinator.ReconcileCoordinator;
import io.snapcheck.model.Action;
import io.snapcheck.model.DecisionRecord;
import io.snapcheck.model.SelectionOrder;
import io.snapcheck.model.Target;
import io.snapcheck.observability.DecisionJournal;
import io.snapcheck.prompt.TerminalPrompter;
import io.snapcheck.rewrite.JavaCallSiteRewriter;
import io.snapcheck.runtime.SnapcheckRuntime;
import io.snapcheck.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "snapcheck",
        mixinStandardHelpOptions = true,
        description = "Reconcile captured test values with the assertions in test sources",
        subcommands = {
                SnapcheckCommand.ReconcileCommand.class,
                SnapcheckCommand.HistoryCommand.class,
                SnapcheckCommand.SettingsCommand.class,
                SnapcheckCommand.AuditVerifyCommand.class
        }
)
public final class SnapcheckCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = SnapcheckConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: reconcile | history | settings | audit-verify");
    }

    SnapcheckRuntime runtime(String sourceRoot) {
        return new SnapcheckRuntime(SnapcheckConfig.fromRoot(root, sourceRoot));
    }

    @Command(name = "reconcile", description = "Replay captured values and reconcile their assertions")
    static final class ReconcileCommand implements Callable<Integer> {
        @ParentCommand
        SnapcheckCommand parent;

        @Option(names = {"--captures"}, required = true, description = "JSON-lines capture file")
        String captures;

        @Option(names = {"--source-root"}, description = "Directory relative source paths resolve against")
        String sourceRoot;

        @Option(names = {"--action"}, description = "prompt|accept|reject")
        String action;

        @Option(names = {"--target"}, description = "auto_assert|assert")
        String target;

        @Option(names = {"--force-update"}, description = "Reconcile existing assertions even when they match")
        boolean forceUpdate;

        @Option(names = {"--dry-run"}, description = "Decide but do not write source files")
        boolean dryRun;

        @Option(names = {"--fifo"}, description = "Offer pending requests oldest first")
        boolean fifo;

        @Option(names = {"--parallelism"}, description = "Replay worker threads")
        Integer parallelism;

        @Override
        public Integer call() {
            SnapcheckRuntime runtime = parent.runtime(sourceRoot);
            runtime.init();
            ReconcileSettings settings = effectiveSettings(runtime.loadSettings());
            List<CaptureRecord> records = CaptureFileReader.read(Path.of(captures));
            SnapcheckRuntime.Run run = runtime.openRun(settings, TerminalPrompter.system(), System.out);
            try (ReconcileCoordinator coordinator = run.coordinator()) {
                CaptureReplayRunner runner = new CaptureReplayRunner(
                        coordinator,
                        new JavaCallSiteRewriter(),
                        runtime.config(),
                        settings.parallelism(),
                        settings.failureExitStatus()
                );
                CaptureReplayRunner.ReplayResult result = runner.run(records);
                System.out.println("[snapcheck] " + result.passed() + " passed, " + result.failed() + " failed");
                return result.exitStatus();
            }
        }

        ReconcileSettings effectiveSettings(ReconcileSettings fromFile) {
            ReconcileSettings settings = fromFile;
            if (action != null) {
                settings = settings.withAction(Action.fromString(action));
            }
            if (target != null) {
                settings = settings.withTarget(Target.fromString(target));
            }
            if (forceUpdate) {
                settings = settings.withForceUpdate(true);
            }
            if (dryRun) {
                settings = settings.withDryRun(true);
            }
            if (fifo) {
                settings = settings.withSelection(SelectionOrder.FIFO);
            }
            if (parallelism != null) {
                settings = settings.withParallelism(parallelism);
            }
            return settings;
        }
    }

    @Command(name = "history", description = "Show recorded decisions for a source file")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        SnapcheckCommand parent;

        @Option(names = {"--file"}, required = true, description = "Source file path")
        String file;

        @Option(names = {"--source-root"}, description = "Directory a relative --file resolves against")
        String sourceRoot;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            SnapcheckRuntime runtime = parent.runtime(sourceRoot);
            runtime.init();
            List<DecisionRecord> rows = runtime.history(file, limit);
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective reconciliation settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        SnapcheckCommand parent;

        @Override
        public Integer call() {
            SnapcheckRuntime runtime = parent.runtime(null);
            ReconcileSettings settings = runtime.loadSettings();
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("settingsFile", runtime.config().settingsFile().toString());
            out.set("settings", Jsons.mapper().valueToTree(settings));
            out.set("overridden", Jsons.mapper().valueToTree(settings.diff(ReconcileSettings.defaults())));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the decision journal hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SnapcheckCommand parent;

        @Override
        public Integer call() {
            SnapcheckRuntime runtime = parent.runtime(null);
            runtime.init();
            DecisionJournal.VerifyResult result = runtime.verifyJournal();
            System.out.println(Jsons.toJson(result));
            return result.ok() ? 0 : 2;
        }
    }
}
