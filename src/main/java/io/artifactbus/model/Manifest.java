package io.artifactbus.model;

import java.util.Map;

/**
 * Descriptor written next to a job's data file. Carries enough integrity metadata for the
 * daemon to validate a job before it is committed. {@code rows} and {@code sizeBytes} are
 * boxed so that a manifest omitting them reads as {@code null}, not zero.
 */
public record Manifest(
        String schemaVersion,
        String runId,
        String producer,
        String kind,
        String artifactId,
        String schemaHint,
        Long rows,
        Map<String, Object> meta,
        String contentHash,
        String hashAlgo,
        Long sizeBytes,
        String dataFile,
        long createdAtMs
) {
    public static final String SCHEMA_VERSION = "artifactbus.manifest.v1";
    public static final String FILE_NAME = "manifest.json";
    public static final String DEFAULT_DATA_FILE = "data.parquet";

    public Manifest {
        meta = meta == null ? Map.of() : meta;
    }

    public ArtifactIdentity identity() {
        return new ArtifactIdentity(runId, producer, kind, artifactId);
    }

    public Manifest withSchemaHint(String hint) {
        return new Manifest(schemaVersion, runId, producer, kind, artifactId, hint, rows, meta,
                contentHash, hashAlgo, sizeBytes, dataFile, createdAtMs);
    }
}
