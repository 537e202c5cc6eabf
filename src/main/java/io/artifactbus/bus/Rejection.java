package io.artifactbus.bus;

/**
 * Reason sidecar stored next to a rejected job as {@code rejection.json}.
 */
public record Rejection(
        String code,
        String reason,
        String jobId,
        String identity,
        long rejectedAtMs
) {
    public static final String FILE_NAME = "rejection.json";
}
