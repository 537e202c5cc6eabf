package io.artifactbus.producer;

import io.artifactbus.config.ArtifactBusConfig;
import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.model.ArtifactSpec;
import io.artifactbus.model.Manifest;
import io.artifactbus.util.Hashing;
import io.artifactbus.util.Jsons;
import io.artifactbus.util.MoreFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.UUID;

/**
 * Library entry point for producers. Places a job in the inbox and returns; it never opens
 * the catalog or touches the store.
 *
 * <p>The job is assembled under {@code inbox/.incoming/<uuid>/} and published with one
 * directory rename, so the daemon sees either a complete job or nothing.
 */
public final class ProducerClient {
    private static final Logger LOG = LoggerFactory.getLogger(ProducerClient.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final ArtifactBusConfig config;
    private final Clock clock;

    public ProducerClient(ArtifactBusConfig config) {
        this(config, Clock.systemUTC());
    }

    public ProducerClient(ArtifactBusConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public SubmitOutcome submitArtifact(ArtifactSpec spec) {
        if (spec == null) {
            throw new SubmissionException("artifact spec is required");
        }
        ArtifactIdentity identity = spec.identity();
        String problem = identity.problem();
        if (problem != null) {
            throw new SubmissionException(problem);
        }
        if (spec.rows() < 0) {
            throw new SubmissionException("rows must be >= 0, got " + spec.rows());
        }
        Path source = spec.dataPath();
        if (source == null || !Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new SubmissionException("data file is not readable: " + source);
        }

        long createdAtMs = clock.millis();
        String uuid = UUID.randomUUID().toString().replace("-", "");
        String jobId = String.format(Locale.ROOT, "%013d_%s", createdAtMs, uuid);
        Path staging = config.incomingDir().resolve(uuid);
        Path published = config.inboxRoot().resolve(jobId);
        try {
            Files.createDirectories(staging);
            Path data = staging.resolve(Manifest.DEFAULT_DATA_FILE);
            CopyResult copied = copyAndHash(source, data);
            Manifest manifest = new Manifest(
                    Manifest.SCHEMA_VERSION,
                    spec.runId(),
                    spec.producer(),
                    spec.kind(),
                    spec.artifactId(),
                    blankToNull(spec.schemaHint()),
                    spec.rows(),
                    new LinkedHashMap<>(spec.meta()),
                    copied.sha256(),
                    Hashing.SHA256,
                    copied.sizeBytes(),
                    Manifest.DEFAULT_DATA_FILE,
                    createdAtMs
            );
            Files.writeString(staging.resolve(Manifest.FILE_NAME), Jsons.toJson(manifest), StandardCharsets.UTF_8);
            MoreFiles.moveAtomically(staging, published, false);
            LOG.debug("Submitted {} as job {}", identity.label(), jobId);
            return new SubmitOutcome(jobId, published.toString(), copied.sha256(), copied.sizeBytes());
        } catch (IOException e) {
            cleanup(staging);
            throw new SubmissionException("Failed to submit " + identity.label() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            cleanup(staging);
            throw e;
        }
    }

    private CopyResult copyAndHash(Path source, Path target) throws IOException {
        MessageDigest digest = Hashing.newSha256();
        byte[] buffer = new byte[BUFFER_SIZE];
        long size = 0L;
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            int read;
            while ((read = in.read(buffer)) > 0) {
                digest.update(buffer, 0, read);
                out.write(buffer, 0, read);
                size += read;
            }
        }
        return new CopyResult(size, Hashing.hex(digest));
    }

    private void cleanup(Path staging) {
        try {
            MoreFiles.deleteRecursively(staging);
        } catch (IOException e) {
            LOG.warn("Could not remove staging directory {}", staging, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record CopyResult(long sizeBytes, String sha256) {
    }
}
