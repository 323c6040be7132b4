package io.snapcheck.staging;

import io.snapcheck.config.ReconcileSettings;
import io.snapcheck.diff.DiffRenderer;
import io.snapcheck.model.Assertion;
import io.snapcheck.model.Decision;
import io.snapcheck.model.DecisionRecord;
import io.snapcheck.model.ErrorKind;
import io.snapcheck.model.PatchOutcome;
import io.snapcheck.model.Target;
import io.snapcheck.pattern.PatternGenerator;
import io.snapcheck.prompt.PolicyPrompter;
import io.snapcheck.prompt.PromptView;
import io.snapcheck.prompt.Prompter;
import io.snapcheck.rewrite.CallSiteRewriter;
import io.snapcheck.storage.DecisionHistory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Staging store backed by the source files on disk.
 *
 * <p>The SHA-256 fingerprint of a file is captured the first time an edit is staged for it and
 * re-checked on every later staging step and once more at commit time. Any divergence marks the
 * file conflicted, drops its staged edits and reports it instead of overwriting.
 */
public final class FileStagingStore implements PatchStagingStore {
    private final ReconcileSettings settings;
    private final PatternGenerator patternGenerator;
    private final CallSiteRewriter rewriter;
    private final DiffRenderer diffRenderer;
    private final Prompter interactive;
    private final DecisionHistory history;
    private final Map<Path, StagedFile> files = new LinkedHashMap<>();

    public FileStagingStore(
            ReconcileSettings settings,
            PatternGenerator patternGenerator,
            CallSiteRewriter rewriter,
            DiffRenderer diffRenderer,
            Prompter interactive,
            DecisionHistory history
    ) {
        this.settings = settings;
        this.patternGenerator = patternGenerator;
        this.rewriter = rewriter;
        this.diffRenderer = diffRenderer;
        this.interactive = interactive;
        this.history = history == null ? DecisionHistory.NONE : history;
    }

    @Override
    public synchronized PatchOutcome patch(Assertion assertion, long seq) {
        List<String> candidates;
        try {
            candidates = assertion.patterns().isEmpty()
                    ? patternGenerator.candidates(assertion.value())
                    : assertion.patterns();
        } catch (RuntimeException e) {
            return PatchOutcome.failed(assertion, "Failed to generate a pattern: " + e.getMessage());
        }
        if (candidates == null || candidates.isEmpty()) {
            return PatchOutcome.failed(assertion, "No pattern could be generated for the value");
        }
        Assertion subject = assertion.withPatterns(candidates);
        Target target = subject.options().resolveTarget(settings.target());
        Prompter prompter = PolicyPrompter.forAction(subject.options().resolveAction(settings.action()), interactive);
        List<DecisionRecord> past = history.recent(subject.file(), subject.testName(), settings.historyLimit());

        int index = 0;
        while (true) {
            String original = subject.code();
            String proposed;
            String diff;
            try {
                proposed = rewriter.rewrite(original, candidates.get(index), target);
                diff = diffRenderer.render(original, proposed);
            } catch (RuntimeException e) {
                return PatchOutcome.failed(subject, "Failed to render the proposed change: " + e.getMessage());
            }
            Decision decision = prompter.prompt(
                    new PromptView(subject, original, proposed, diff, index, candidates.size(), past)
            );
            switch (decision) {
                case NEXT -> index = (index + 1) % candidates.size();
                case PREVIOUS -> index = (index - 1 + candidates.size()) % candidates.size();
                case REJECT -> {
                    return PatchOutcome.rejected(subject);
                }
                case SKIP -> {
                    return PatchOutcome.skipped(subject);
                }
                case ACCEPT -> {
                    List<String> chosen = new ArrayList<>(candidates);
                    if (index != 0) {
                        chosen.add(0, chosen.remove(index));
                    }
                    return stage(subject.withPatterns(chosen), proposed, seq);
                }
                default -> throw new IllegalStateException("Unhandled decision: " + decision);
            }
        }
    }

    private PatchOutcome stage(Assertion assertion, String proposed, long seq) {
        Path path = Path.of(assertion.file()).toAbsolutePath().normalize();
        byte[] current;
        try {
            current = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            conflict(path);
            return PatchOutcome.fileChanged(assertion, "File no longer exists: " + path);
        } catch (IOException e) {
            conflict(path);
            return PatchOutcome.fileChanged(assertion, "Failed to read " + path + ": " + e.getMessage());
        }

        StagedFile staged = files.get(path);
        if (staged == null || staged.status() == StagedFile.Status.COMMITTED) {
            staged = StagedFile.open(path, current);
            files.put(path, staged);
        } else if (staged.status() == StagedFile.Status.CONFLICTED) {
            return PatchOutcome.fileChanged(assertion, "File changed earlier in this run: " + path);
        } else if (!staged.matchesBaseline(current)) {
            staged.conflict();
            return PatchOutcome.fileChanged(assertion, "File changed on disk since staging began: " + path);
        }

        StagedFile.StageResult result = staged.stage(seq, assertion.line(), assertion.code(), proposed);
        return switch (result) {
            case STAGED -> PatchOutcome.ok(assertion.withRegeneratedCode(proposed));
            case REGION_MISMATCH -> {
                staged.conflict();
                yield PatchOutcome.fileChanged(
                        assertion,
                        "Call site at " + assertion.location() + " no longer matches the captured source"
                );
            }
            case OVERLAP -> PatchOutcome.error(
                    assertion,
                    ErrorKind.SKIPPED,
                    "Call site at " + assertion.location() + " already has a staged change in this run"
            );
        };
    }

    private void conflict(Path path) {
        StagedFile staged = files.get(path);
        if (staged != null) {
            staged.conflict();
        }
    }

    @Override
    public synchronized CommitResult commit() {
        List<String> committed = new ArrayList<>();
        Set<String> notSaved = new TreeSet<>();
        for (StagedFile staged : files.values()) {
            if (staged.status() == StagedFile.Status.CONFLICTED) {
                if (!staged.conflictReported()) {
                    staged.markConflictReported();
                    notSaved.add(staged.path().toString());
                }
                continue;
            }
            if (staged.status() == StagedFile.Status.COMMITTED || !staged.hasEdits()) {
                continue;
            }
            byte[] current = readIfPresent(staged.path());
            if (current == null || !staged.matchesBaseline(current)) {
                staged.conflict();
                staged.markConflictReported();
                notSaved.add(staged.path().toString());
                continue;
            }
            byte[] rendered = staged.render();
            if (!settings.dryRun()) {
                try {
                    writeAtomically(staged.path(), rendered);
                } catch (IOException e) {
                    staged.conflict();
                    staged.markConflictReported();
                    notSaved.add(staged.path().toString());
                    continue;
                }
                staged.committed(rendered);
            } else {
                staged.committed(current);
            }
            committed.add(staged.path().toString());
        }
        return new CommitResult(List.copyOf(committed), Collections.unmodifiableSet(notSaved), settings.dryRun());
    }

    /**
     * Number of edits currently staged and not yet committed for {@code file}.
     */
    public synchronized int stagedEdits(String file) {
        StagedFile staged = files.get(Path.of(file).toAbsolutePath().normalize());
        return staged == null || staged.status() != StagedFile.Status.PENDING ? 0 : staged.editCount();
    }

    // A file that vanished or became unreadable between staging and commit counts as changed.
    private static byte[] readIfPresent(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            return null;
        }
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".snapcheck.tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicUnsupported) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
