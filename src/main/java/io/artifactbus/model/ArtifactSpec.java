package io.artifactbus.model;

import java.nio.file.Path;
import java.util.Map;

public record ArtifactSpec(
        String runId,
        String producer,
        String kind,
        String artifactId,
        Path dataPath,
        String schemaHint,
        long rows,
        Map<String, Object> meta
) {
    public ArtifactSpec {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public ArtifactIdentity identity() {
        return new ArtifactIdentity(runId, producer, kind, artifactId);
    }
}
