package io.kothsync;

import io.kothsync.cli.KothSyncCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new KothSyncCommand()).execute(args);
        System.exit(code);
    }
}
