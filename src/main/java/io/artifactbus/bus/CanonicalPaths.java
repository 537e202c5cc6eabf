package io.artifactbus.bus;

import io.artifactbus.model.ArtifactIdentity;

public final class CanonicalPaths {
    public static final String EXTENSION = ".parquet";

    private CanonicalPaths() {
    }

    /**
     * Store-relative key of an artifact. Depends only on the identity, so reprocessing a
     * duplicate job always lands on the same key.
     */
    public static String keyFor(ArtifactIdentity identity) {
        String problem = identity.problem();
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return "producer=" + identity.producer()
                + "/kind=" + identity.kind()
                + "/run_id=" + identity.runId()
                + "/" + identity.artifactId() + EXTENSION;
    }
}
