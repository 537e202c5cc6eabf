package io.artifactbus.daemon;

/**
 * Moving a validated data file into the store failed. The job stays in the inbox and is
 * picked up again by the next scan.
 */
public final class CommitIOException extends RuntimeException {
    private final String jobId;

    public CommitIOException(String jobId, String message, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
