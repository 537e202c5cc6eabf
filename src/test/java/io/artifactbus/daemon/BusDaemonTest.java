package io.artifactbus.daemon;

import io.artifactbus.TestArtifacts;
import io.artifactbus.bus.Rejection;
import io.artifactbus.config.ArtifactBusConfig;
import io.artifactbus.config.BusSettings;
import io.artifactbus.export.ExportStatus;
import io.artifactbus.lock.CatalogLock;
import io.artifactbus.lock.FileCatalogLock;
import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.model.ArtifactRecord;
import io.artifactbus.model.ArtifactSpec;
import io.artifactbus.model.LatestArtifact;
import io.artifactbus.model.Manifest;
import io.artifactbus.producer.SubmitOutcome;
import io.artifactbus.runtime.ArtifactBusRuntime;
import io.artifactbus.storage.CatalogReader;
import io.artifactbus.util.Jsons;
import io.artifactbus.util.MoreFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

final class BusDaemonTest {

    @Test
    void submittedArtifactShouldBeStoredCatalogedAndExported() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-commit-");
        try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root.toString()))) {
            runtime.init();
            Path data = writeData(root, "trades.parquet", "PAR1 trades v1");
            SubmitOutcome submitted = runtime.submit(new ArtifactSpec("r1", "sim", "trades", "a1", data, null, 42L,
                    Map.of("strategy", "ichimoku")));

            ScanOutcome outcome = runtime.daemonOnce();
            Assertions.assertEquals(1, outcome.committed());
            Assertions.assertEquals(1, outcome.exportsRefreshed());

            ArtifactBusConfig config = runtime.config();
            Path canonical = config.storeRoot().resolve("producer=sim/kind=trades/run_id=r1/a1.parquet");
            Assertions.assertEquals("PAR1 trades v1", Files.readString(canonical, StandardCharsets.UTF_8));
            Assertions.assertFalse(Files.exists(Path.of(submitted.jobPath())));
            Assertions.assertEquals(0, countEntries(config.rejectedRoot()));

            List<LatestArtifact> latest = runtime.latest("sim", "trades");
            Assertions.assertEquals(1, latest.size());
            Assertions.assertEquals(canonical.toString(), latest.get(0).canonicalPath());
            Assertions.assertEquals(42L, latest.get(0).rows());
            Assertions.assertEquals(submitted.contentHash(), latest.get(0).contentHash());
            ArtifactRecord record = runtime.catalog().findArtifact(ArtifactIdentity.of("r1", "sim", "trades", "a1"))
                    .orElseThrow();
            Assertions.assertEquals("ichimoku", CatalogReader.parseMeta(record.metaJson()).get("strategy"));

            Path golden = config.exportRoot().resolve("sim").resolve("trades.parquet");
            Assertions.assertEquals("PAR1 trades v1", Files.readString(golden, StandardCharsets.UTF_8));
            ExportStatus status = runtime.exportStatus().entry("sim", "trades");
            Assertions.assertEquals(ExportStatus.OK, status.status());
            Assertions.assertEquals(submitted.contentHash(), status.contentHash());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void rerunningDaemonShouldNotAddRows() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-idempotent-");
        try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root.toString()))) {
            runtime.init();
            Path data = writeData(root, "a.parquet", "payload");
            ArtifactSpec spec = new ArtifactSpec("r1", "sim", "trades", "a1", data, null, 1L, null);
            runtime.submit(spec);
            runtime.daemonOnce();
            ScanOutcome idle = runtime.daemonOnce();
            Assertions.assertEquals(0, idle.scanned());

            runtime.submit(spec);
            ScanOutcome duplicate = runtime.daemonOnce();
            Assertions.assertEquals(1, duplicate.alreadyCommitted());
            Assertions.assertEquals(1, runtime.catalog().countEntries());
            Assertions.assertEquals(1, runtime.catalog().countArtifacts());
            Assertions.assertEquals(0, runtime.rejected().size());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void jobWithoutManifestShouldBeSkippedUntilManifestAppears() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-partial-");
        try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root.toString()))) {
            runtime.init();
            ArtifactBusConfig config = runtime.config();
            byte[] payload = TestArtifacts.bytes("partial-job");
            Path job = Files.createDirectories(config.inboxRoot().resolve("0000000000001_manual"));
            Files.write(job.resolve(Manifest.DEFAULT_DATA_FILE), payload);

            ScanOutcome first = runtime.daemonOnce();
            Assertions.assertEquals(1, first.incompleteSkipped());
            Assertions.assertEquals(0, first.rejected());
            Assertions.assertTrue(Files.exists(job.resolve(Manifest.DEFAULT_DATA_FILE)));
            Assertions.assertEquals(0, runtime.catalog().countEntries());

            Manifest manifest = TestArtifacts.manifest("r1", "sim", "trades", "manual", payload);
            Files.writeString(job.resolve(Manifest.FILE_NAME), Jsons.toJson(manifest), StandardCharsets.UTF_8);

            ScanOutcome second = runtime.daemonOnce();
            Assertions.assertEquals(1, second.committed());
            Assertions.assertEquals(1, runtime.catalog().countEntries());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void unknownSchemaHintShouldMoveJobIntactToRejected() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-hint-");
        try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root.toString()))) {
            runtime.init();
            Path data = writeData(root, "x.parquet", "unknown-hint");
            SubmitOutcome submitted = runtime.submit(new ArtifactSpec("r1", "sim", "trades", "a1", data,
                    "not_registered_v3", 1L, null));

            ScanOutcome outcome = runtime.daemonOnce();
            Assertions.assertEquals(1, outcome.rejected());

            Path rejectedDir = runtime.config().rejectedRoot().resolve(submitted.jobId());
            Assertions.assertTrue(Files.isRegularFile(rejectedDir.resolve(Manifest.FILE_NAME)));
            Assertions.assertEquals("unknown-hint",
                    Files.readString(rejectedDir.resolve(Manifest.DEFAULT_DATA_FILE), StandardCharsets.UTF_8));
            Rejection rejection = Jsons.read(rejectedDir.resolve(Rejection.FILE_NAME), Rejection.class);
            Assertions.assertEquals(ValidationException.UNKNOWN_SCHEMA_HINT, rejection.code());
            Assertions.assertTrue(rejection.reason().contains("unknown schema_hint"));
            Assertions.assertEquals(0, runtime.catalog().countEntries());
            Assertions.assertEquals(0, countEntries(runtime.config().storeRoot()));
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void tamperedDataShouldBeRejectedWithHashMismatch() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-tamper-");
        try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root.toString()))) {
            runtime.init();
            Path data = writeData(root, "x.parquet", "original!");
            SubmitOutcome submitted = runtime.submit(new ArtifactSpec("r1", "sim", "trades", "a1", data, null, 1L, null));
            Files.writeString(Path.of(submitted.jobPath()).resolve(Manifest.DEFAULT_DATA_FILE), "tampered!",
                    StandardCharsets.UTF_8);

            ScanOutcome outcome = runtime.daemonOnce();
            Assertions.assertEquals(ValidationException.HASH_MISMATCH, outcome.jobs().get(0).code());
            Assertions.assertEquals(1, runtime.rejected().size());
            Assertions.assertEquals(0, runtime.catalog().countEntries());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void concurrentProducersShouldAllBeCommittedExactlyOnce() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-concurrent-");
        int producers = 8;
        int perProducer = 5;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(ArtifactBusConfig.fromRoot(root.toString()))) {
            runtime.init();
            List<Future<List<SubmitOutcome>>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                String producer = "prod" + p;
                futures.add(pool.submit(() -> {
                    List<SubmitOutcome> out = new ArrayList<>();
                    for (int i = 0; i < perProducer; i++) {
                        Path data = writeData(root, producer + "-" + i + ".parquet", producer + ":" + i);
                        out.add(runtime.submit(new ArtifactSpec("run" + i, producer, "fills", "part-" + i, data,
                                null, i, null)));
                    }
                    return out;
                }));
            }
            Set<String> jobIds = new HashSet<>();
            for (Future<List<SubmitOutcome>> future : futures) {
                for (SubmitOutcome outcome : future.get()) {
                    jobIds.add(outcome.jobId());
                }
            }
            Assertions.assertEquals(producers * perProducer, jobIds.size());

            int committed = 0;
            for (int cycle = 0; cycle < 5 && committed < producers * perProducer; cycle++) {
                committed += runtime.daemonOnce().committed();
            }
            Assertions.assertEquals(producers * perProducer, committed);
            Assertions.assertEquals(producers * perProducer, runtime.catalog().countEntries());
            Assertions.assertEquals(producers, runtime.latest(null, "fills").size());
            Assertions.assertEquals(0, runtime.rejected().size());
            Assertions.assertEquals(producers * perProducer, countFiles(runtime.config().storeRoot()));
        } finally {
            pool.shutdownNow();
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void lockHeldElsewhereShouldBoundCommitAndLeaveJobPending() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-daemon-lock-");
        try {
            ArtifactBusConfig base = ArtifactBusConfig.fromRoot(root.toString());
            ArtifactBusConfig config = base.withSettings(BusSettings.defaults().withLockTimeoutS(1L));
            try (ArtifactBusRuntime runtime = new ArtifactBusRuntime(config)) {
                runtime.init();
                Path data = writeData(root, "x.parquet", "locked-out");
                runtime.submit(new ArtifactSpec("r1", "sim", "trades", "a1", data, null, 1L, null));

                FileCatalogLock intruder = new FileCatalogLock(config.lockFile(), 5L, 20L, 600_000L);
                long start = System.nanoTime();
                try (CatalogLock.Lease ignored = intruder.acquire(Duration.ofSeconds(1))) {
                    ScanOutcome blocked = runtime.daemonOnce();
                    Assertions.assertEquals(1, blocked.deferred());
                }
                long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
                Assertions.assertTrue(elapsedMs < 10_000L, "commit attempt not bounded: " + elapsedMs + "ms");
                Assertions.assertEquals(0, runtime.catalog().countEntries());
                Assertions.assertEquals(1, countEntries(config.markersRoot()));

                ScanOutcome resumed = runtime.daemonOnce();
                Assertions.assertEquals(1, resumed.markersReplayed());
                Assertions.assertEquals(1, runtime.catalog().countEntries());
                Assertions.assertEquals(0, countEntries(config.markersRoot()));
                // only .incoming/ is left
                Assertions.assertEquals(1, countEntries(config.inboxRoot()));
            }
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    private static Path writeData(Path root, String name, String content) throws Exception {
        Path dir = Files.createDirectories(root.resolve("producer-out"));
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static int countEntries(Path dir) throws Exception {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> list = Files.list(dir)) {
            return (int) list.count();
        }
    }

    private static int countFiles(Path dir) throws Exception {
        try (Stream<Path> walk = Files.walk(dir)) {
            return (int) walk.filter(Files::isRegularFile).count();
        }
    }
}
