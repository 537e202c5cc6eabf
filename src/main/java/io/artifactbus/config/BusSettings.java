package io.artifactbus.config;

import io.artifactbus.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Daemon settings, read once at startup from {@code artifactbus-settings.json}.
 *
 * <p>Every field of the file is optional. Missing or out-of-range values fall back to the
 * defaults below, so an empty object (or no file at all) is a valid configuration.
 */
public record BusSettings(
        long lockTimeoutS,
        long lockRetryBaseMs,
        long lockRetryMaxMs,
        long lockStaleAfterMs,
        String inboxRoot,
        String storeRoot,
        String exportRoot,
        List<String> knownSchemaHints,
        int validationThreads,
        int maxJobsPerScan,
        long scanIntervalMs
) {
    public static final long DEFAULT_LOCK_TIMEOUT_S = 30L;
    public static final long DEFAULT_LOCK_RETRY_BASE_MS = 10L;
    public static final long DEFAULT_LOCK_RETRY_MAX_MS = 500L;
    public static final long DEFAULT_LOCK_STALE_AFTER_MS = 10L * 60L * 1000L;
    public static final int DEFAULT_VALIDATION_THREADS = 4;
    public static final int DEFAULT_MAX_JOBS_PER_SCAN = 256;
    public static final long DEFAULT_SCAN_INTERVAL_MS = 1_000L;

    public BusSettings {
        knownSchemaHints = knownSchemaHints == null ? List.of() : List.copyOf(knownSchemaHints);
    }

    public static BusSettings defaults() {
        return new BusSettings(
                DEFAULT_LOCK_TIMEOUT_S,
                DEFAULT_LOCK_RETRY_BASE_MS,
                DEFAULT_LOCK_RETRY_MAX_MS,
                DEFAULT_LOCK_STALE_AFTER_MS,
                "inbox",
                "store",
                "exports",
                List.of(),
                DEFAULT_VALIDATION_THREADS,
                DEFAULT_MAX_JOBS_PER_SCAN,
                DEFAULT_SCAN_INTERVAL_MS
        );
    }

    public static BusSettings load(Path settingsFile) {
        if (!Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            return fromFile(Jsons.read(settingsFile, SettingsFile.class), defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    public Duration lockTimeout() {
        return Duration.ofSeconds(lockTimeoutS);
    }

    public BusSettings withLockTimeoutS(long seconds) {
        return new BusSettings(Math.max(0L, seconds), lockRetryBaseMs, lockRetryMaxMs, lockStaleAfterMs,
                inboxRoot, storeRoot, exportRoot, knownSchemaHints, validationThreads, maxJobsPerScan, scanIntervalMs);
    }

    public BusSettings withKnownSchemaHints(List<String> hints) {
        return new BusSettings(lockTimeoutS, lockRetryBaseMs, lockRetryMaxMs, lockStaleAfterMs,
                inboxRoot, storeRoot, exportRoot, sanitizeHints(hints), validationThreads, maxJobsPerScan, scanIntervalMs);
    }

    static BusSettings fromFile(SettingsFile file, BusSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long lockTimeout = sanitizeLong(file.lockTimeoutS(), defaults.lockTimeoutS(), 0L);
        long retryBase = sanitizeLong(file.lockRetryBaseMs(), defaults.lockRetryBaseMs(), 1L);
        long retryMax = sanitizeLong(file.lockRetryMaxMs(), defaults.lockRetryMaxMs(), retryBase);
        if (retryMax < retryBase) {
            retryMax = retryBase;
        }
        long staleAfter = sanitizeLong(file.lockStaleAfterMs(), defaults.lockStaleAfterMs(), 1_000L);
        return new BusSettings(
                lockTimeout,
                retryBase,
                retryMax,
                staleAfter,
                sanitizePath(file.inboxRoot(), defaults.inboxRoot()),
                sanitizePath(file.storeRoot(), defaults.storeRoot()),
                sanitizePath(file.exportRoot(), defaults.exportRoot()),
                sanitizeHints(file.knownSchemaHints()),
                sanitizeInt(file.validationThreads(), defaults.validationThreads(), 1),
                sanitizeInt(file.maxJobsPerScan(), defaults.maxJobsPerScan(), 1),
                sanitizeLong(file.scanIntervalMs(), defaults.scanIntervalMs(), 10L)
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static String sanitizePath(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static List<String> sanitizeHints(List<String> hints) {
        if (hints == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String hint : hints) {
            if (hint != null && !hint.isBlank()) {
                out.add(hint.trim());
            }
        }
        return new ArrayList<>(out);
    }

    record SettingsFile(
            Long lockTimeoutS,
            Long lockRetryBaseMs,
            Long lockRetryMaxMs,
            Long lockStaleAfterMs,
            String inboxRoot,
            String storeRoot,
            String exportRoot,
            List<String> knownSchemaHints,
            Integer validationThreads,
            Integer maxJobsPerScan,
            Long scanIntervalMs
    ) {
    }
}
