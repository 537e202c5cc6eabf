package io.artifactbus.cli;

import io.artifactbus.config.ArtifactBusConfig;
import io.artifactbus.daemon.RecoveryOutcome;
import io.artifactbus.daemon.ScanOutcome;
import io.artifactbus.export.ExportRunOutcome;
import io.artifactbus.model.ArtifactSpec;
import io.artifactbus.model.LatestArtifact;
import io.artifactbus.producer.SubmissionException;
import io.artifactbus.producer.SubmitOutcome;
import io.artifactbus.runtime.ArtifactBusRuntime;
import io.artifactbus.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "artifactbus",
        mixinStandardHelpOptions = true,
        description = "Write-once artifact bus: inbox ingestion, catalog and golden exports",
        subcommands = {
                ArtifactBusCommand.InitCommand.class,
                ArtifactBusCommand.SubmitCommand.class,
                ArtifactBusCommand.DaemonCommand.class,
                ArtifactBusCommand.RecoverCommand.class,
                ArtifactBusCommand.LatestCommand.class,
                ArtifactBusCommand.ExportCommand.class,
                ArtifactBusCommand.ExportStatusCommand.class,
                ArtifactBusCommand.RejectedCommand.class,
                ArtifactBusCommand.HealthCommand.class,
                ArtifactBusCommand.SchemaMigrationsCommand.class,
                ArtifactBusCommand.AuditTailCommand.class,
                ArtifactBusCommand.AuditVerifyCommand.class
        }
)
public final class ArtifactBusCommand implements Runnable {
    @Option(names = {"--root"}, description = "Bus root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | submit | daemon | recover | latest | export | export-status | rejected | health | schema-migrations | audit-tail | audit-verify");
    }

    ArtifactBusRuntime runtime() {
        return new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Create the directory layout and catalog schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.init()));
            }
            return 0;
        }
    }

    @Command(name = "submit", description = "Submit a data file as an artifact job")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--producer"}, required = true, description = "Producer name")
        String producer;

        @Option(names = {"--kind"}, required = true, description = "Artifact kind")
        String kind;

        @Option(names = {"--artifact-id"}, required = true, description = "Artifact id, unique within run/producer/kind")
        String artifactId;

        @Option(names = {"--data"}, required = true, description = "Path of the data file")
        Path data;

        @Option(names = {"--schema-hint"}, description = "Schema hint known to the catalog")
        String schemaHint;

        @Option(names = {"--rows"}, defaultValue = "0", description = "Row count")
        long rows;

        @Option(names = {"--meta"}, description = "Metadata entry key=value, repeatable")
        Map<String, String> meta;

        @Override
        public Integer call() {
            Map<String, Object> metaValues = new LinkedHashMap<>();
            if (meta != null) {
                metaValues.putAll(meta);
            }
            ArtifactSpec spec = new ArtifactSpec(runId, producer, kind, artifactId, data, schemaHint, rows, metaValues);
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                SubmitOutcome outcome = runtime.submit(spec);
                System.out.println(Jsons.toJson(outcome));
                return 0;
            } catch (SubmissionException e) {
                System.out.println(Jsons.toJson(Map.of("error", e.getMessage())));
                return 1;
            }
        }
    }

    @Command(name = "daemon", description = "Run the ingestion daemon loop or a single cycle")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run only one cycle")
        boolean once;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                runtime.init();
                if (once) {
                    RecoveryOutcome recovery = runtime.recover();
                    if (!recovery.clean()) {
                        System.out.println(Jsons.toJson(recovery));
                    }
                    ScanOutcome outcome = runtime.daemonOnce();
                    System.out.println(Jsons.toJson(outcome));
                    return 0;
                }
                AtomicBoolean running = new AtomicBoolean(true);
                Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false), "artifactbus-shutdown-hook"));
                runtime.runDaemon(running::get);
            }
            return 0;
        }
    }

    @Command(name = "recover", description = "Replay commit markers and report catalog/store inconsistencies")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                runtime.init();
                RecoveryOutcome outcome = runtime.recover();
                System.out.println(Jsons.toJson(outcome));
                return outcome.corruptEntries().isEmpty() ? 0 : 2;
            }
        }
    }

    @Command(name = "latest", description = "Latest committed artifact per producer/kind")
    static final class LatestCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Option(names = {"--producer"}, description = "Filter by producer")
        String producer;

        @Option(names = {"--kind"}, description = "Filter by kind")
        String kind;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                List<LatestArtifact> rows = runtime.latest(producer, kind);
                System.out.println(Jsons.toJson(rows));
            }
            return 0;
        }
    }

    @Command(name = "export", description = "Regenerate golden files for every producer/kind")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                ExportRunOutcome outcome = runtime.exportAll();
                System.out.println(Jsons.toJson(outcome));
                return outcome.failed() == 0 ? 0 : 1;
            }
        }
    }

    @Command(name = "export-status", description = "Show the export status ledger")
    static final class ExportStatusCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.exportStatus()));
            }
            return 0;
        }
    }

    @Command(name = "rejected", description = "List rejected jobs with their reasons")
    static final class RejectedCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.rejected()));
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Check catalog, directories, backlog and export errors")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                ArtifactBusRuntime.HealthOutcome outcome = runtime.health();
                System.out.println(Jsons.toJson(outcome));
                return outcome.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied catalog schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.schemaMigrations(limit)));
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show the last audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Option(names = {"--lines"}, defaultValue = "20", description = "Number of rows")
        int lines;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.auditTail(lines)));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactBusCommand parent;

        @Override
        public Integer call() {
            try (ArtifactBusRuntime runtime = parent.runtime()) {
                int rows = runtime.verifyAudit();
                System.out.println(Jsons.toJson(Map.of("ok", true, "rows", rows)));
                return 0;
            } catch (IllegalStateException e) {
                System.out.println(Jsons.toJson(Map.of("ok", false, "error", e.getMessage())));
                return 1;
            }
        }
    }
}
