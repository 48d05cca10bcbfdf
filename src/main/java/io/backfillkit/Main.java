package io.backfillkit;

import io.backfillkit.cli.BackfillCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BackfillCommand()).execute(args);
        System.exit(code);
    }
}
