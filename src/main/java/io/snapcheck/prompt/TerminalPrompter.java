package io.snapcheck.prompt;

import io.snapcheck.model.Assertion;
import io.snapcheck.model.Decision;
import io.snapcheck.model.DecisionRecord;
import io.snapcheck.model.Stage;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;

/**
 * Line-based prompter for an interactive terminal. End of input counts as a skip.
 */
public final class TerminalPrompter implements Prompter {
    private static final String PREFIX = "| ";

    private final BufferedReader in;
    private final PrintStream out;
    private final Path workingDir;

    public TerminalPrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
        this.workingDir = Path.of("").toAbsolutePath();
    }

    public static TerminalPrompter system() {
        return new TerminalPrompter(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out
        );
    }

    @Override
    public Decision prompt(PromptView view) {
        out.println();
        out.println(render(view));
        while (true) {
            out.print(PREFIX + question(view) + " ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read decision from terminal", e);
            }
            if (line == null) {
                out.println();
                return Decision.SKIP;
            }
            Decision decision = parse(line, view.hasAlternatives());
            if (decision != null) {
                return decision;
            }
            out.println(PREFIX + "Unrecognized choice: " + line.trim());
        }
    }

    String render(PromptView view) {
        Assertion assertion = view.assertion();
        StringBuilder sb = new StringBuilder();
        sb.append(PREFIX).append(assertion.stage() == Stage.NEW ? "New" : "Changed").append(" - autoAssert\n");
        sb.append(PREFIX).append(displayPath(assertion.file())).append(':').append(assertion.line()).append('\n');
        sb.append(PREFIX).append(assertion.groupId()).append(" > ").append(assertion.testName()).append('\n');
        if (!view.history().isEmpty()) {
            sb.append(PREFIX).append("history:");
            for (DecisionRecord record : view.history()) {
                sb.append(' ').append(record.outcome())
                        .append(" (").append(Instant.ofEpochMilli(record.decidedAtMs())).append(')');
            }
            sb.append('\n');
        }
        sb.append(PREFIX).append('\n');
        for (String line : view.diff().split("\n", -1)) {
            sb.append(PREFIX).append(line).append('\n');
        }
        sb.append(PREFIX);
        return sb.toString();
    }

    private static String question(PromptView view) {
        String base = view.assertion().stage() == Stage.NEW
                ? "Accept new assertion?"
                : "Value has changed! Update to new value?";
        String choices = " [y]es [n]o [s]kip";
        if (view.hasAlternatives()) {
            return base + " (" + (view.candidateIndex() + 1) + " of " + view.candidateCount() + ")"
                    + choices + " [j] next [k] previous";
        }
        return base + choices;
    }

    static Decision parse(String raw, boolean alternatives) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "y", "yes" -> Decision.ACCEPT;
            case "n", "no" -> Decision.REJECT;
            case "s", "skip" -> Decision.SKIP;
            case "j", "next" -> alternatives ? Decision.NEXT : null;
            case "k", "prev", "previous" -> alternatives ? Decision.PREVIOUS : null;
            default -> null;
        };
    }

    private String displayPath(String file) {
        try {
            Path path = Path.of(file).toAbsolutePath().normalize();
            if (path.startsWith(workingDir)) {
                return workingDir.relativize(path).toString();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            return file;
        }
    }
}
