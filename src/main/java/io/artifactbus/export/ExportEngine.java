package io.artifactbus.export;

import io.artifactbus.model.LatestArtifact;
import io.artifactbus.storage.CatalogReader;
import io.artifactbus.util.MoreFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps one golden file per (producer, kind) in step with the catalog's latest view.
 *
 * <p>A golden file is a byte copy of the latest canonical artifact, replaced by rename so
 * readers never see a partial file. Runs outside the catalog lock and reads the catalog
 * read-only; a failed export is written to the ledger and logged, and ingestion carries on.
 */
public final class ExportEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExportEngine.class);
    static final String GOLDEN_EXTENSION = ".parquet";

    private final Path exportRoot;
    private final Path statusFile;
    private final CatalogReader reader;
    private final Clock clock;
    private final Set<String> pending = new LinkedHashSet<>();

    public ExportEngine(Path exportRoot, Path statusFile, CatalogReader reader, Clock clock) {
        this.exportRoot = exportRoot.toAbsolutePath().normalize();
        this.statusFile = statusFile;
        this.reader = reader;
        this.clock = clock;
    }

    public synchronized void requestRefresh(String producer, String kind) {
        pending.add(producer + "/" + kind);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized ExportRunOutcome runPending() {
        List<String> keys = new ArrayList<>(pending);
        pending.clear();
        return refresh(keys);
    }

    public synchronized ExportRunOutcome refreshAll() {
        List<String> keys = new ArrayList<>();
        for (LatestArtifact latest : reader.latestArtifacts(null, null)) {
            keys.add(latest.exportKey());
        }
        pending.clear();
        return refresh(keys);
    }

    public ExportLedger status() {
        try {
            return ExportLedger.load(statusFile);
        } catch (IOException e) {
            throw new ExportException(null, "Failed to read export ledger: " + statusFile, e);
        }
    }

    public Path goldenPath(String producer, String kind) {
        return exportRoot.resolve(producer).resolve(kind + GOLDEN_EXTENSION);
    }

    private ExportRunOutcome refresh(List<String> keys) {
        if (keys.isEmpty()) {
            return new ExportRunOutcome(0, 0, 0, List.of());
        }
        ExportLedger ledger;
        try {
            ledger = ExportLedger.load(statusFile);
        } catch (IOException e) {
            LOG.warn("Export ledger {} unreadable, starting a new one", statusFile, e);
            ledger = ExportLedger.empty();
        }
        int refreshed = 0;
        int skipped = 0;
        int failed = 0;
        List<ExportStatus> touched = new ArrayList<>();
        for (String key : keys) {
            int slash = key.indexOf('/');
            String producer = key.substring(0, slash);
            String kind = key.substring(slash + 1);
            long nowMs = clock.millis();
            ExportStatus status;
            try {
                Optional<LatestArtifact> latest = reader.latestArtifact(producer, kind);
                if (latest.isEmpty()) {
                    continue;
                }
                ExportStatus previous = ledger.entry(producer, kind);
                Path golden = goldenPath(producer, kind);
                if (isCurrent(previous, latest.get(), golden)) {
                    skipped++;
                    continue;
                }
                writeGolden(key, Path.of(latest.get().canonicalPath()), golden);
                status = new ExportStatus(producer, kind, ExportStatus.OK, nowMs, latest.get().canonicalPath(),
                        golden.toString(), latest.get().contentHash(), latest.get().rows(), null);
                refreshed++;
                LOG.info("Exported {} from {}", key, latest.get().canonicalPath());
            } catch (RuntimeException e) {
                failed++;
                status = new ExportStatus(producer, kind, ExportStatus.ERROR, nowMs, null,
                        goldenPath(producer, kind).toString(), null, 0L, e.getMessage());
                LOG.error("Export of {} failed", key, e);
            }
            ledger = ledger.with(status, nowMs);
            touched.add(status);
        }
        try {
            ledger.save(statusFile);
        } catch (IOException e) {
            LOG.error("Failed to write export ledger {}", statusFile, e);
        }
        return new ExportRunOutcome(refreshed, skipped, failed, touched);
    }

    private boolean isCurrent(ExportStatus previous, LatestArtifact latest, Path golden) {
        return previous != null
                && previous.ok()
                && latest.canonicalPath().equals(previous.canonicalPath())
                && latest.contentHash().equals(previous.contentHash())
                && Files.isRegularFile(golden);
    }

    private void writeGolden(String key, Path source, Path golden) {
        if (!Files.isRegularFile(source)) {
            throw new ExportException(key, "canonical file missing: " + source, null);
        }
        Path temp = golden.resolveSibling("." + golden.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Files.createDirectories(golden.getParent());
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            MoreFiles.moveAtomically(temp, golden, true);
        } catch (IOException e) {
            throw new ExportException(key, "failed to write golden file " + golden + ": " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOG.warn("Could not remove export temp file {}", temp, e);
            }
        }
    }
}
