package io.snapcheck.coordinator;

import io.snapcheck.config.ReconcileSettings;
import io.snapcheck.model.Assertion;
import io.snapcheck.model.AssertionOptions;
import io.snapcheck.model.PatchOutcome;
import io.snapcheck.model.RunStats;
import io.snapcheck.model.RunnerEvent;
import io.snapcheck.model.SelectionOrder;
import io.snapcheck.model.Stage;
import io.snapcheck.model.Target;
import io.snapcheck.observability.DecisionJournal;
import io.snapcheck.observability.DecisionJournal.JournalEvent;
import io.snapcheck.security.SensitiveDataMasker;
import io.snapcheck.staging.CommitResult;
import io.snapcheck.staging.PatchStagingStore;
import io.snapcheck.storage.DecisionHistory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single decision point for a run.
 *
 * <p>Workers call {@link #register} or {@link #requestPatch} and block on a reply. Every
 * decision is taken on one dedicated coordinator thread, which owns the pending queue, the
 * active group and the buffered runner output. Once a request of group G is resolved, only
 * requests of G are offered until the runner reports G finished and none of G's requests
 * remain queued.
 */
public final class ReconcileCoordinator implements AutoCloseable {
    static final String PREFIX = "[snapcheck] ";
    static final String NOT_SAVED_HEADER = "The following files could not be saved. Their content may have changed.";
    static final String RETRY_HINT = "You may need to run these tests again.";

    private final PatchStagingStore stagingStore;
    private final ReconcileSettings settings;
    private final DecisionHistory history;
    private final DecisionJournal journal;
    private final PrintStream out;
    private final ExecutorService loop;
    private final CompletableFuture<SuiteReport> report = new CompletableFuture<>();

    // Confined to the coordinator thread.
    private final List<PendingRequest> pending = new ArrayList<>();
    private final StringBuilder captured = new StringBuilder();
    private long insertions;
    private long decisions;
    private boolean suiteFinished;

    private final Set<String> notSaved = new ConcurrentSkipListSet<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong newCount = new AtomicLong();
    private final AtomicLong updated = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private volatile String activeGroup;

    public ReconcileCoordinator(
            PatchStagingStore stagingStore,
            ReconcileSettings settings,
            DecisionHistory history,
            DecisionJournal journal,
            PrintStream out
    ) {
        this.stagingStore = stagingStore;
        this.settings = settings;
        this.history = history == null ? DecisionHistory.NONE : history;
        this.journal = journal;
        this.out = out;
        this.loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "snapcheck-coordinator");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * New assertions always wait for a decision. Update assertions wait only when forced
     * reconciliation applies to them or their target is {@code assert}, which converts the call
     * site even when it matches; otherwise they are returned unchanged at once.
     */
    public PatchOutcome register(Assertion assertion) {
        if (assertion.stage() == Stage.UPDATE && !needsDecision(assertion)) {
            return PatchOutcome.ok(assertion);
        }
        return enqueue(assertion).join();
    }

    /**
     * Called after a mismatch; always waits for a decision.
     */
    public PatchOutcome requestPatch(Assertion assertion) {
        return enqueue(assertion).join();
    }

    public void notify(RunnerEvent event) {
        post(() -> handle(event));
    }

    /**
     * Side-channel output from the runner. Held back while a group is active.
     */
    public void runnerOutput(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (!post(() -> emit(text))) {
            out.print(text);
            out.flush();
        }
    }

    public RunStats stats() {
        return new RunStats(total.get(), newCount.get(), updated.get(), rejected.get(), skipped.get());
    }

    /**
     * Group whose requests are currently offered exclusively, or {@code null}.
     */
    public String activeGroup() {
        return activeGroup;
    }

    public int pendingCount() {
        return pendingCount.get();
    }

    public SuiteReport awaitReport() {
        return report.join();
    }

    public CompletableFuture<SuiteReport> report() {
        return report;
    }

    /**
     * Fails every still-pending request with {@code aborted}. A run closed before
     * {@code suiteFinished} commits nothing.
     */
    @Override
    public void close() {
        if (loop.isShutdown()) {
            return;
        }
        post(this::abandon);
        loop.shutdown();
    }

    private boolean needsDecision(Assertion assertion) {
        AssertionOptions options = assertion.options();
        return options.resolveForceUpdate(settings.forceUpdate())
                || options.resolveTarget(settings.target()) == Target.ASSERT;
    }

    private CompletableFuture<PatchOutcome> enqueue(Assertion assertion) {
        CompletableFuture<PatchOutcome> reply = new CompletableFuture<>();
        boolean accepted = post(() -> {
            if (suiteFinished) {
                reply.complete(settle(PatchOutcome.aborted(assertion), 0L));
                return;
            }
            pending.add(new PendingRequest(assertion, reply, ++insertions));
            pendingCount.incrementAndGet();
            drain();
        });
        if (!accepted) {
            PatchOutcome aborted = PatchOutcome.aborted(assertion);
            classify(aborted);
            reply.complete(aborted);
        }
        return reply;
    }

    private boolean post(Runnable task) {
        try {
            loop.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private void handle(RunnerEvent event) {
        switch (event.type()) {
            case TEST_STARTED -> drain();
            case GROUP_FINISHED -> {
                if (event.id() != null && event.id().equals(activeGroup) && !hasPendingFor(event.id())) {
                    activeGroup = null;
                    flush();
                }
                drain();
            }
            case SUITE_FINISHED -> finishSuite();
            default -> throw new IllegalStateException("Unhandled runner event: " + event.type());
        }
    }

    private void drain() {
        while (!suiteFinished) {
            PendingRequest next = pollEligible();
            if (next == null) {
                return;
            }
            resolve(next);
        }
    }

    private PendingRequest pollEligible() {
        String group = activeGroup;
        int chosen = -1;
        if (settings.selection() == SelectionOrder.FIFO) {
            for (int i = 0; i < pending.size(); i++) {
                if (pending.get(i).eligibleUnder(group)) {
                    chosen = i;
                    break;
                }
            }
        } else {
            for (int i = pending.size() - 1; i >= 0; i--) {
                if (pending.get(i).eligibleUnder(group)) {
                    chosen = i;
                    break;
                }
            }
        }
        if (chosen < 0) {
            return null;
        }
        pendingCount.decrementAndGet();
        return pending.remove(chosen);
    }

    private boolean hasPendingFor(String group) {
        for (PendingRequest request : pending) {
            if (group.equals(request.assertion().groupId())) {
                return true;
            }
        }
        return false;
    }

    private void resolve(PendingRequest request) {
        Assertion assertion = request.assertion();
        long seq = ++decisions;
        PatchOutcome outcome;
        try {
            outcome = stagingStore.patch(assertion, seq);
        } catch (RuntimeException e) {
            outcome = PatchOutcome.failed(assertion, "Reconciliation failed: " + e.getMessage());
        }
        if (outcome == null) {
            outcome = PatchOutcome.failed(assertion, "Staging store returned no outcome");
        }
        activeGroup = assertion.groupId();
        request.reply().complete(settle(outcome, seq));
    }

    // Counts the outcome, then records it; recording failures are reported but never lose the reply.
    private PatchOutcome settle(PatchOutcome outcome, long seq) {
        classify(outcome);
        String pattern = outcome.isOk() && !outcome.assertion().patterns().isEmpty()
                ? outcome.assertion().patterns().get(0)
                : null;
        try {
            history.record(outcome, pattern, seq);
        } catch (RuntimeException e) {
            out.println(PREFIX + "Failed to record decision history: " + e.getMessage());
        }
        journal(JournalEvent.of(
                "assertion.decision",
                outcome.assertion().location(),
                outcome.label(),
                decisionDetails(outcome, seq)
        ));
        return outcome;
    }

    private void classify(PatchOutcome outcome) {
        total.incrementAndGet();
        if (outcome.isOk()) {
            if (outcome.assertion().stage() == Stage.NEW) {
                newCount.incrementAndGet();
            } else {
                updated.incrementAndGet();
            }
            return;
        }
        switch (outcome.error()) {
            case REJECTED -> rejected.incrementAndGet();
            case FILE_CHANGED -> {
                skipped.incrementAndGet();
                notSaved.add(normalize(outcome.assertion().file()));
            }
            case SKIPPED, FAILED, ABORTED -> skipped.incrementAndGet();
            default -> throw new IllegalStateException("Unhandled outcome: " + outcome.error());
        }
    }

    private void emit(String text) {
        if (activeGroup != null) {
            captured.append(text);
        } else {
            out.print(text);
            out.flush();
        }
    }

    private void flush() {
        if (captured.length() > 0) {
            out.print(captured);
            captured.setLength(0);
        }
        out.flush();
    }

    private void abortPending() {
        for (PendingRequest request : pending) {
            request.reply().complete(settle(PatchOutcome.aborted(request.assertion()), 0L));
        }
        pending.clear();
        pendingCount.set(0);
    }

    private void finishSuite() {
        if (suiteFinished) {
            return;
        }
        suiteFinished = true;
        abortPending();

        CommitResult commit = null;
        try {
            commit = stagingStore.commit();
        } catch (RuntimeException e) {
            out.println(PREFIX + "Failed to commit staged changes: " + e.getMessage());
        }
        if (commit != null) {
            commit.notSaved().forEach(file -> notSaved.add(normalize(file)));
        }
        activeGroup = null;
        flush();

        RunStats stats = stats();
        boolean failed = commit == null || !notSaved.isEmpty() || stats.skipped() > 0;
        int exitStatus = failed ? settings.failureExitStatus() : 0;
        String summary = stats.summary();
        if (!summary.isEmpty()) {
            out.println();
            out.println(PREFIX + summary);
        }
        if (!notSaved.isEmpty()) {
            out.println(PREFIX + NOT_SAVED_HEADER);
            for (String file : notSaved) {
                out.println(PREFIX + "  * " + file);
            }
            out.println(PREFIX + RETRY_HINT);
        }
        List<String> committed = commit == null ? List.of() : commit.committed();
        boolean dryRun = commit != null && commit.dryRun();
        if (dryRun && !committed.isEmpty()) {
            out.println(PREFIX + "Dry run: " + committed.size() + " file(s) left unchanged");
        }
        out.flush();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stats", stats);
        details.put("committed", committed);
        details.put("not_saved", List.copyOf(notSaved));
        details.put("dry_run", dryRun);
        details.put("exit_status", exitStatus);
        journal(JournalEvent.of("suite.commit", "suite", failed ? "failed" : "ok", details));

        report.complete(new SuiteReport(stats, List.copyOf(notSaved), committed, dryRun, false, exitStatus));
    }

    private void abandon() {
        abortPending();
        if (!report.isDone()) {
            suiteFinished = true;
            activeGroup = null;
            flush();
            report.complete(new SuiteReport(
                    stats(), List.copyOf(notSaved), List.of(), settings.dryRun(), true, settings.failureExitStatus()
            ));
        }
    }

    private void journal(JournalEvent event) {
        if (journal == null) {
            return;
        }
        try {
            journal.log(event);
        } catch (RuntimeException e) {
            out.println(PREFIX + "Failed to write decision journal: " + e.getMessage());
        }
    }

    private static Map<String, Object> decisionDetails(PatchOutcome outcome, long seq) {
        Assertion a = outcome.assertion();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("seq", seq);
        details.put("stage", a.stage().name().toLowerCase());
        details.put("group", a.groupId());
        details.put("test", a.testName());
        details.put("candidates", a.patterns().size());
        details.put("value", SensitiveDataMasker.preview(a.value()));
        if (!outcome.isOk()) {
            details.put("message", outcome.message());
        }
        return details;
    }

    private static String normalize(String file) {
        return Path.of(file).toAbsolutePath().normalize().toString();
    }
}
