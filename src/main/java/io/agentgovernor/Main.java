package io.agentgovernor;

import io.agentgovernor.cli.GovernorCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GovernorCommand()).execute(args);
        System.exit(code);
    }
}
