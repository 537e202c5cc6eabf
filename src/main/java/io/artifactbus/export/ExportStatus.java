package io.artifactbus.export;

/**
 * Ledger entry for one (producer, kind) golden file.
 */
public record ExportStatus(
        String producer,
        String kind,
        String status,
        long atMs,
        String canonicalPath,
        String goldenPath,
        String contentHash,
        long rows,
        String error
) {
    public static final String OK = "ok";
    public static final String ERROR = "error";

    public boolean ok() {
        return OK.equals(status);
    }
}
