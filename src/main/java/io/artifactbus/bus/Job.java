package io.artifactbus.bus;

import io.artifactbus.model.JobState;
import io.artifactbus.model.Manifest;

/**
 * One inbox job as it moves through the daemon. Transitions return a new instance and
 * refuse illegal moves, so a job can never go from {@code REJECTED} back to work, or commit
 * without having been validated.
 */
public record Job(String jobId, JobState state, Manifest manifest, String canonicalKey, Rejection rejection) {

    public static Job incoming(String jobId) {
        return new Job(jobId, JobState.INCOMING, null, null, null);
    }

    public Job validated(Manifest validManifest, String key) {
        require(JobState.INCOMING);
        return new Job(jobId, JobState.VALIDATED, validManifest, key, null);
    }

    public Job committed() {
        require(JobState.VALIDATED);
        return new Job(jobId, JobState.COMMITTED, manifest, canonicalKey, null);
    }

    public Job rejected(Rejection reason) {
        if (state == JobState.COMMITTED || state == JobState.REJECTED) {
            throw new IllegalStateException("Job " + jobId + " cannot be rejected from " + state);
        }
        return new Job(jobId, JobState.REJECTED, manifest, canonicalKey, reason);
    }

    private void require(JobState expected) {
        if (state != expected) {
            throw new IllegalStateException("Job " + jobId + " expected state " + expected + " but was " + state);
        }
    }
}
