package io.artifactbus.daemon;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.artifactbus.bus.CanonicalPaths;
import io.artifactbus.bus.DataStat;
import io.artifactbus.bus.InboxStorage;
import io.artifactbus.bus.Job;
import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.model.Manifest;
import io.artifactbus.util.Hashing;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Checks one inbox job against its manifest. Safe to call from several threads: it only
 * reads the job directory and the catalog's schema hints.
 */
public final class JobValidator {
    public static final String UNTYPED_HINT = "untyped";
    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-f]{64}");

    private final InboxStorage storage;
    private final Predicate<String> knownSchemaHint;

    public JobValidator(InboxStorage storage, Predicate<String> knownSchemaHint) {
        this.storage = storage;
        this.knownSchemaHint = knownSchemaHint;
    }

    /**
     * Returns the job in state {@code VALIDATED} with its canonical store key.
     *
     * @throws ValidationException when the job must be rejected
     * @throws IOException         on a transient read failure; the job is left for the next scan
     */
    public Job validate(Job job) throws IOException {
        Manifest manifest = readManifest(job.jobId());
        if (!Manifest.SCHEMA_VERSION.equals(manifest.schemaVersion())) {
            throw new ValidationException(ValidationException.UNSUPPORTED_SCHEMA_VERSION,
                    "unsupported manifest schemaVersion: " + manifest.schemaVersion());
        }
        requirePresent("rows", manifest.rows());
        requirePresent("sizeBytes", manifest.sizeBytes());
        ArtifactIdentity identity = manifest.identity();
        String problem = identity.problem();
        if (problem != null) {
            throw new ValidationException(ValidationException.INVALID_IDENTITY, problem);
        }
        if (manifest.rows() < 0) {
            throw new ValidationException(ValidationException.NEGATIVE_ROWS,
                    "rows must be >= 0, got " + manifest.rows());
        }
        if (manifest.hashAlgo() == null || !Hashing.SHA256.equals(manifest.hashAlgo().toLowerCase(Locale.ROOT))) {
            throw new ValidationException(ValidationException.UNSUPPORTED_HASH_ALGO,
                    "unsupported hashAlgo: " + manifest.hashAlgo());
        }
        String expectedHash = manifest.contentHash() == null ? "" : manifest.contentHash();
        if (!SHA256_HEX.matcher(expectedHash).matches()) {
            throw new ValidationException(ValidationException.INVALID_CONTENT_HASH,
                    "contentHash is not a lowercase sha256 hex digest: " + manifest.contentHash());
        }
        String schemaHint = checkSchemaHint(manifest.schemaHint());

        String dataFile = manifest.dataFile() == null ? Manifest.DEFAULT_DATA_FILE : manifest.dataFile();
        if (dataFile.isBlank() || dataFile.startsWith(".") || dataFile.contains("/") || dataFile.contains("\\")
                || Manifest.FILE_NAME.equals(dataFile)) {
            throw new ValidationException(ValidationException.INVALID_DATA_FILE, "invalid dataFile: " + dataFile);
        }
        Optional<DataStat> stat = storage.statData(job.jobId(), dataFile);
        if (stat.isEmpty()) {
            throw new ValidationException(ValidationException.DATA_FILE_MISSING, "data file not found: " + dataFile);
        }
        if (stat.get().sizeBytes() != manifest.sizeBytes()) {
            throw new ValidationException(ValidationException.SIZE_MISMATCH,
                    "size mismatch: manifest=" + manifest.sizeBytes() + " actual=" + stat.get().sizeBytes());
        }
        if (!expectedHash.equals(stat.get().sha256())) {
            throw new ValidationException(ValidationException.HASH_MISMATCH,
                    "content hash mismatch: manifest=" + expectedHash + " actual=" + stat.get().sha256());
        }
        return job.validated(manifest.withSchemaHint(schemaHint), CanonicalPaths.keyFor(identity));
    }

    private Manifest readManifest(String jobId) throws IOException {
        try {
            Manifest manifest = storage.readManifest(jobId);
            if (manifest == null) {
                throw new ValidationException(ValidationException.MALFORMED_MANIFEST, "manifest is empty");
            }
            return manifest;
        } catch (JsonProcessingException e) {
            throw new ValidationException(ValidationException.MALFORMED_MANIFEST,
                    "manifest is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static void requirePresent(String field, Object value) {
        if (value == null) {
            throw new ValidationException(ValidationException.MALFORMED_MANIFEST, "manifest field missing: " + field);
        }
    }

    /**
     * Returns the hint as it is recorded in the catalog: trimmed, or null when absent.
     */
    private String checkSchemaHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String trimmed = hint.trim();
        if (!UNTYPED_HINT.equals(trimmed) && !knownSchemaHint.test(trimmed)) {
            throw new ValidationException(ValidationException.UNKNOWN_SCHEMA_HINT, "unknown schema_hint: " + hint);
        }
        return trimmed;
    }
}
