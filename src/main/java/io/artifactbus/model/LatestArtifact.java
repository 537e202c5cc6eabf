package io.artifactbus.model;

public record LatestArtifact(
        String producer,
        String kind,
        String runId,
        String artifactId,
        String canonicalPath,
        String contentHash,
        long rows,
        String schemaHint,
        long createdAtMs,
        long lastSeenAtMs
) {
    public String exportKey() {
        return producer + "/" + kind;
    }
}
