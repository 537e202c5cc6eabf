package io.artifactbus.model;

/**
 * Lifecycle of an inbox job. A job that cannot finish in the current scan (lock timeout,
 * transient I/O failure, missing half of the pair) simply keeps its current state and is
 * picked up again by the next scan.
 */
public enum JobState {
    INCOMING,
    VALIDATED,
    COMMITTED,
    REJECTED
}
