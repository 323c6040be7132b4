package io.snapcheck;

import io.snapcheck.cli.SnapcheckCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SnapcheckCommand()).execute(args);
        System.exit(code);
    }
}
