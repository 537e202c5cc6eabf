package io.artifactbus.producer;

/**
 * Raised when a producer submission cannot be placed in the inbox. Nothing is left behind
 * in the inbox when this is thrown.
 */
public final class SubmissionException extends RuntimeException {
    public SubmissionException(String reason) {
        super(reason);
    }

    public SubmissionException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
