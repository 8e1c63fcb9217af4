package io.taskdesk;

import io.taskdesk.cli.TaskDeskCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskDeskCommand()).execute(args);
        System.exit(code);
    }
}
