package io.artifactbus.bus;

import io.artifactbus.config.ArtifactBusConfig;
import io.artifactbus.config.BusSettings;
import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.util.MoreFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FileSystemInboxTest {

    @Test
    void scanShouldClassifyJobDirectoriesAndSkipIncomingArea() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-inbox-scan-");
        try {
            ArtifactBusConfig config = new ArtifactBusConfig(root, BusSettings.defaults());
            FileSystemInbox inbox = new FileSystemInbox(config);
            inbox.init();

            Path complete = Files.createDirectories(config.inboxRoot().resolve("0000000000002_b"));
            Files.writeString(complete.resolve("manifest.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(complete.resolve("data.parquet"), "x", StandardCharsets.UTF_8);
            Path older = Files.createDirectories(config.inboxRoot().resolve("0000000000001_a"));
            Files.writeString(older.resolve("manifest.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(older.resolve("data.parquet"), "x", StandardCharsets.UTF_8);
            Path dataOnly = Files.createDirectories(config.inboxRoot().resolve("0000000000003_c"));
            Files.writeString(dataOnly.resolve("data.parquet"), "x", StandardCharsets.UTF_8);
            Files.createDirectories(config.inboxRoot().resolve("0000000000004_d"));
            Path staging = Files.createDirectories(config.incomingDir().resolve("half-written"));
            Files.writeString(staging.resolve("data.parquet"), "x", StandardCharsets.UTF_8);

            ScanResult scan = inbox.scan(10);
            Assertions.assertEquals(List.of("0000000000001_a", "0000000000002_b"), scan.complete());
            Assertions.assertEquals(List.of("0000000000003_c"), scan.incomplete());
            Assertions.assertEquals(List.of("0000000000004_d"), scan.empty());

            Assertions.assertEquals(List.of("0000000000001_a"), inbox.scan(1).complete());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void statDataShouldRefuseNamesOutsideTheJob() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-inbox-stat-");
        try {
            ArtifactBusConfig config = new ArtifactBusConfig(root, BusSettings.defaults());
            FileSystemInbox inbox = new FileSystemInbox(config);
            inbox.init();
            Path job = Files.createDirectories(config.inboxRoot().resolve("0000000000001_a"));
            Files.writeString(job.resolve("data.parquet"), "abc", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("secret.txt"), "nope", StandardCharsets.UTF_8);

            DataStat stat = inbox.statData("0000000000001_a", "data.parquet").orElseThrow();
            Assertions.assertEquals(3L, stat.sizeBytes());
            Assertions.assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", stat.sha256());
            Assertions.assertTrue(inbox.statData("0000000000001_a", "../../secret.txt").isEmpty());
            Assertions.assertTrue(inbox.statData("0000000000001_a", "missing.parquet").isEmpty());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void commitShouldPlaceDataAtCanonicalKeyAndRefuseOverwrite() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-inbox-commit-");
        try {
            ArtifactBusConfig config = new ArtifactBusConfig(root, BusSettings.defaults());
            FileSystemInbox inbox = new FileSystemInbox(config);
            inbox.init();
            String key = CanonicalPaths.keyFor(ArtifactIdentity.of("r1", "sim", "trades", "a1"));
            Assertions.assertEquals("producer=sim/kind=trades/run_id=r1/a1.parquet", key);

            for (String jobId : List.of("0000000000001_a", "0000000000002_b")) {
                Path job = Files.createDirectories(config.inboxRoot().resolve(jobId));
                Files.writeString(job.resolve("data.parquet"), jobId, StandardCharsets.UTF_8);
            }
            inbox.commit("0000000000001_a", "data.parquet", key);

            Path stored = config.storeRoot().resolve(key);
            Assertions.assertEquals(stored.toString(), inbox.locate(key));
            Assertions.assertEquals("0000000000001_a", Files.readString(stored, StandardCharsets.UTF_8));
            Assertions.assertEquals(List.of(key), inbox.listStoreKeys());
            Assertions.assertThrows(FileAlreadyExistsException.class,
                    () -> inbox.commit("0000000000002_b", "data.parquet", key));
            Assertions.assertEquals("0000000000001_a", Files.readString(stored, StandardCharsets.UTF_8));
            Assertions.assertThrows(IllegalArgumentException.class, () -> inbox.locate("../escape.parquet"));
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void rejectShouldMoveWholeJobAndWriteSidecar() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-inbox-reject-");
        try {
            ArtifactBusConfig config = new ArtifactBusConfig(root, BusSettings.defaults());
            FileSystemInbox inbox = new FileSystemInbox(config);
            inbox.init();
            Path job = Files.createDirectories(config.inboxRoot().resolve("0000000000001_a"));
            Files.writeString(job.resolve("manifest.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(job.resolve("data.parquet"), "abc", StandardCharsets.UTF_8);

            inbox.reject("0000000000001_a", new Rejection("HASH_MISMATCH", "bad hash", "0000000000001_a", null, 5L));

            Path rejected = config.rejectedRoot().resolve("0000000000001_a");
            Assertions.assertFalse(Files.exists(job));
            Assertions.assertTrue(Files.exists(rejected.resolve("manifest.json")));
            Assertions.assertEquals("abc", Files.readString(rejected.resolve("data.parquet"), StandardCharsets.UTF_8));
            List<Rejection> rejections = inbox.listRejections();
            Assertions.assertEquals(1, rejections.size());
            Assertions.assertEquals("HASH_MISMATCH", rejections.get(0).code());
            Assertions.assertEquals(1, inbox.countRejected());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }

    @Test
    void interruptedRejectShouldLeaveReasonWithTheJob() throws Exception {
        Path root = Files.createTempDirectory("artifactbus-test-inbox-reject-interrupted-");
        try {
            ArtifactBusConfig config = new ArtifactBusConfig(root, BusSettings.defaults());
            FileSystemInbox inbox = new FileSystemInbox(config);
            inbox.init();
            Path job = Files.createDirectories(config.inboxRoot().resolve("0000000000001_a"));
            Files.writeString(job.resolve("manifest.json"), "{}", StandardCharsets.UTF_8);
            Files.writeString(job.resolve("data.parquet"), "abc", StandardCharsets.UTF_8);
            Files.createDirectories(config.rejectedRoot().resolve("0000000000001_a"));

            Assertions.assertThrows(FileAlreadyExistsException.class, () -> inbox.reject("0000000000001_a",
                    new Rejection("SIZE_MISMATCH", "size differs", "0000000000001_a", null, 5L)));

            Assertions.assertTrue(Files.exists(job.resolve("data.parquet")));
            Assertions.assertTrue(Files.readString(job.resolve(Rejection.FILE_NAME), StandardCharsets.UTF_8)
                    .contains("SIZE_MISMATCH"));
            try (Stream<Path> listing = Files.list(job)) {
                Assertions.assertEquals(3L, listing.count());
            }

            Files.delete(job.resolve("data.parquet"));
            ScanResult scan = inbox.scan(10);
            Assertions.assertEquals(List.of("0000000000001_a"), scan.incomplete());
            Assertions.assertTrue(scan.complete().isEmpty());
        } finally {
            MoreFiles.deleteRecursively(root);
        }
    }
}
