package io.artifactbus.daemon;

public enum JobOutcome {
    COMMITTED,
    ALREADY_COMMITTED,
    REJECTED,
    DEFERRED_LOCK_TIMEOUT,
    DEFERRED_PENDING_COMMIT,
    DEFERRED_IO
}
