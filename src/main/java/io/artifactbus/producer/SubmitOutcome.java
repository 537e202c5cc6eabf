package io.artifactbus.producer;

public record SubmitOutcome(
        String jobId,
        String jobPath,
        String contentHash,
        long sizeBytes
) {
}
