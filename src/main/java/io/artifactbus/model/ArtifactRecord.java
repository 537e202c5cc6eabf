package io.artifactbus.model;

public record ArtifactRecord(
        ArtifactIdentity identity,
        String canonicalPath,
        String contentHash,
        String schemaHint,
        long rows,
        String metaJson,
        long committedAtMs
) {
}
