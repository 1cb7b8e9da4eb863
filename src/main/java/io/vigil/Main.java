package io.vigil;

import io.vigil.cli.VigilCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = VigilCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
