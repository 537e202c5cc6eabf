package io.artifactbus.export;

/**
 * Regenerating one golden file failed. Recorded in the export ledger; never propagated to
 * ingestion.
 */
public final class ExportException extends RuntimeException {
    private final String exportKey;

    public ExportException(String exportKey, String message, Throwable cause) {
        super(message, cause);
        this.exportKey = exportKey;
    }

    public String exportKey() {
        return exportKey;
    }
}
