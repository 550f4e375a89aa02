package io.sessioncast;

import io.sessioncast.cli.SessionCastCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SessionCastCommand()).execute(args);
        System.exit(code);
    }
}
