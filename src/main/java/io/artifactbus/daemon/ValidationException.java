package io.artifactbus.daemon;

/**
 * A job failed validation and will be moved to {@code rejected/}. Never retried.
 */
public final class ValidationException extends RuntimeException {
    public static final String MALFORMED_MANIFEST = "MALFORMED_MANIFEST";
    public static final String UNSUPPORTED_SCHEMA_VERSION = "UNSUPPORTED_SCHEMA_VERSION";
    public static final String INVALID_IDENTITY = "INVALID_IDENTITY";
    public static final String NEGATIVE_ROWS = "NEGATIVE_ROWS";
    public static final String UNSUPPORTED_HASH_ALGO = "UNSUPPORTED_HASH_ALGO";
    public static final String INVALID_CONTENT_HASH = "INVALID_CONTENT_HASH";
    public static final String UNKNOWN_SCHEMA_HINT = "UNKNOWN_SCHEMA_HINT";
    public static final String INVALID_DATA_FILE = "INVALID_DATA_FILE";
    public static final String DATA_FILE_MISSING = "DATA_FILE_MISSING";
    public static final String SIZE_MISMATCH = "SIZE_MISMATCH";
    public static final String HASH_MISMATCH = "HASH_MISMATCH";
    public static final String WRITE_ONCE_VIOLATION = "WRITE_ONCE_VIOLATION";

    private final String code;
    private final String reason;

    public ValidationException(String code, String reason) {
        super(code + ": " + reason);
        this.code = code;
        this.reason = reason;
    }

    public String code() {
        return code;
    }

    public String reason() {
        return reason;
    }
}
