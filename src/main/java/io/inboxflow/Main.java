package io.inboxflow;

import io.inboxflow.cli.InboxflowCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new InboxflowCommand()).execute(args);
        System.exit(code);
    }
}
