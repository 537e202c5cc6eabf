package io.artifactbus.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.artifactbus.util.Jsons;
import io.artifactbus.util.MoreFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class ArtifactBusCommandTest {

    @Test
    void submitThenDaemonOnceShouldExposeLatestArtifact() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-cli-");
        try {
            String rootArg = root.toString();
            Result init = run("--root", rootArg, "init");
            Assertions.assertEquals(0, init.exitCode());
            Assertions.assertTrue(init.json().path("freshCatalog").asBoolean());

            Path data = root.resolve("quotes.parquet");
            Files.writeString(data, "PAR1 quotes", StandardCharsets.UTF_8);
            Result submit = run("--root", rootArg, "submit",
                    "--run-id", "r7", "--producer", "sim", "--kind", "quotes", "--artifact-id", "q1",
                    "--data", data.toString(), "--rows", "12", "--meta", "venue=xnys");
            Assertions.assertEquals(0, submit.exitCode());
            Assertions.assertEquals(64, submit.json().path("contentHash").asText().length());

            Result daemon = run("--root", rootArg, "daemon", "--once");
            Assertions.assertEquals(0, daemon.exitCode());
            Assertions.assertEquals(1, daemon.json().path("committed").asInt());

            Result latest = run("--root", rootArg, "latest", "--producer", "sim");
            Assertions.assertEquals(0, latest.exitCode());
            Assertions.assertEquals(1, latest.json().size());
            Assertions.assertEquals("r7", latest.json().get(0).path("runId").asText());
            Assertions.assertEquals(12L, latest.json().get(0).path("rows").asLong());

            Result health = run("--root", rootArg, "health");
            Assertions.assertEquals(0, health.exitCode());
            Assertions.assertEquals(0, health.json().path("pendingJobs").asInt());

            Result verify = run("--root", rootArg, "audit-verify");
            Assertions.assertEquals(0, verify.exitCode());
            Assertions.assertTrue(verify.json().path("rows").asInt() >= 1);
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void submitWithUnreadableDataShouldFail() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-cli-submit-");
        try {
            Result submit = run("--root", root.toString(), "submit",
                    "--run-id", "r1", "--producer", "sim", "--kind", "quotes", "--artifact-id", "q1",
                    "--data", root.resolve("missing.parquet").toString());
            Assertions.assertEquals(1, submit.exitCode());
            Assertions.assertTrue(submit.json().path("error").asText().contains("missing.parquet"));
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void missingRequiredOptionShouldBeAUsageError() {
        Result result = run("--root", "unused", "submit", "--run-id", "r1");
        Assertions.assertEquals(2, result.exitCode());
    }

    private static Result run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int exitCode;
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            exitCode = new CommandLine(new ArtifactBusCommand())
                    .setErr(new PrintWriter(new ByteArrayOutputStream(), true))
                    .execute(args);
        } finally {
            System.setOut(original);
        }
        return new Result(exitCode, buffer.toString(StandardCharsets.UTF_8));
    }

    private record Result(int exitCode, String stdout) {
        JsonNode json() throws Exception {
            return Jsons.mapper().readTree(stdout);
        }
    }
}
