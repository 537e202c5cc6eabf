package io.artifactbus.daemon;

/**
 * What one daemon cycle did with one job. {@code code} and {@code reason} are set for
 * rejected and deferred jobs.
 */
public record JobResult(
        String jobId,
        JobOutcome outcome,
        String identity,
        String canonicalPath,
        String code,
        String reason
) {
    static JobResult of(String jobId, JobOutcome outcome, String identity, String canonicalPath) {
        return new JobResult(jobId, outcome, identity, canonicalPath, null, null);
    }

    static JobResult failed(String jobId, JobOutcome outcome, String identity, String code, String reason) {
        return new JobResult(jobId, outcome, identity, null, code, reason);
    }
}
