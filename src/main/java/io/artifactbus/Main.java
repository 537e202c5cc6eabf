package io.artifactbus;

import io.artifactbus.cli.ArtifactBusCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ArtifactBusCommand()).execute(args);
        System.exit(code);
    }
}
