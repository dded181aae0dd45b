package io.giantt;

import io.giantt.cli.GianttCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = GianttCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
