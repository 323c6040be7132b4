package io.snapcheck.capture;

import com.fasterxml.jackson.databind.node.NullNode;
import io.snapcheck.config.SnapcheckConfig;
import io.snapcheck.coordinator.ReconcileCoordinator;
import io.snapcheck.coordinator.SuiteReport;
import io.snapcheck.model.Assertion;
import io.snapcheck.model.RunnerEvent;
import io.snapcheck.model.Stage;
import io.snapcheck.rewrite.CallSite;
import io.snapcheck.rewrite.CallSiteRewriter;
import io.snapcheck.runtime.AutoAssert;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plays captured values back as a test suite.
 *
 * <p>Each group runs on one pool thread, its tests in capture order. A group's thread is the
 * only source of that group's requests, so the group holding the coordinator is always running
 * and a pool smaller than the number of groups cannot stall.
 */
public final class CaptureReplayRunner {
    private final ReconcileCoordinator coordinator;
    private final CallSiteRewriter rewriter;
    private final SnapcheckConfig config;
    private final int parallelism;
    private final int failureExitStatus;
    private final AutoAssert autoAssert;

    public CaptureReplayRunner(
            ReconcileCoordinator coordinator,
            CallSiteRewriter rewriter,
            SnapcheckConfig config,
            int parallelism,
            int failureExitStatus
    ) {
        this.coordinator = coordinator;
        this.rewriter = rewriter;
        this.config = config;
        this.parallelism = Math.max(1, parallelism);
        this.failureExitStatus = failureExitStatus;
        this.autoAssert = new AutoAssert(coordinator);
    }

    public ReplayResult run(List<CaptureRecord> captures) {
        Map<String, List<CaptureRecord>> groups = new LinkedHashMap<>();
        for (CaptureRecord capture : captures) {
            groups.computeIfAbsent(capture.groupOrDefault(), k -> new ArrayList<>()).add(capture);
        }
        AtomicInteger passed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(
                Math.max(1, Math.min(parallelism, groups.size())),
                r -> {
                    Thread t = new Thread(r, "snapcheck-replay-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (Map.Entry<String, List<CaptureRecord>> group : groups.entrySet()) {
                futures.add(pool.submit(() -> runGroup(group.getKey(), group.getValue(), passed, failed)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while replaying captures", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Replay worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }

        coordinator.notify(RunnerEvent.suiteFinished());
        SuiteReport report = coordinator.awaitReport();
        int exitStatus = report.exitStatus() != 0
                ? report.exitStatus()
                : failed.get() > 0 ? failureExitStatus : 0;
        return new ReplayResult(report, passed.get(), failed.get(), exitStatus);
    }

    // groupFinished must reach the coordinator even if a test blows up, or the group stays active.
    private void runGroup(String group, List<CaptureRecord> records, AtomicInteger passed, AtomicInteger failed) {
        try {
            for (CaptureRecord record : records) {
                String testId = group + " > " + record.testOrDefault();
                coordinator.notify(RunnerEvent.testStarted(testId));
                try {
                    autoAssert.check(toAssertion(record, group));
                    passed.incrementAndGet();
                    coordinator.runnerOutput("  ok    " + testId + "\n");
                } catch (AssertionError e) {
                    failed.incrementAndGet();
                    coordinator.runnerOutput("  FAIL  " + testId + ": " + e.getMessage() + "\n");
                } catch (RuntimeException e) {
                    failed.incrementAndGet();
                    coordinator.runnerOutput("  ERROR " + testId + ": " + e.getMessage() + "\n");
                }
            }
        } finally {
            coordinator.notify(RunnerEvent.groupFinished(group));
        }
    }

    Assertion toAssertion(CaptureRecord record, String group) {
        CallSite site = rewriter.parse(record.code());
        return Assertion.builder()
                .file(config.resolveSource(record.file()).toString())
                .line(record.line())
                .testName(record.testOrDefault())
                .groupId(group)
                .stage(site.hasExpectation() ? Stage.UPDATE : Stage.NEW)
                .code(record.code())
                .value(record.value() == null ? NullNode.getInstance() : record.value())
                .expected(site.expected())
                .options(record.options())
                .build();
    }

    public record ReplayResult(
            SuiteReport report,
            int passed,
            int failed,
            int exitStatus
    ) {
    }
}
