package io.artifactbus.daemon;

import io.artifactbus.bus.CommitMarker;
import io.artifactbus.bus.InboxStorage;
import io.artifactbus.bus.Job;
import io.artifactbus.bus.Rejection;
import io.artifactbus.bus.ScanResult;
import io.artifactbus.config.BusSettings;
import io.artifactbus.export.ExportEngine;
import io.artifactbus.export.ExportRunOutcome;
import io.artifactbus.lock.CatalogLock;
import io.artifactbus.lock.LockTimeoutException;
import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.model.ArtifactRecord;
import io.artifactbus.model.Manifest;
import io.artifactbus.observability.AuditLogger;
import io.artifactbus.storage.CatalogReader;
import io.artifactbus.storage.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * The single writer of the catalog.
 *
 * <p>One cycle replays pending commit markers, scans the inbox, validates complete jobs in
 * parallel, then commits them one at a time: marker, store move, catalog upsert under the
 * lock, export request, job cleanup. The lock is held only for the upsert transaction.
 */
public final class BusDaemon implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BusDaemon.class);

    private final InboxStorage storage;
    private final CatalogStore catalogStore;
    private final CatalogReader catalogReader;
    private final CatalogLock lock;
    private final ExportEngine exports;
    private final AuditLogger audit;
    private final BusSettings settings;
    private final Clock clock;
    private final JobValidator validator;
    private final ExecutorService validationPool;

    public BusDaemon(
            InboxStorage storage,
            CatalogStore catalogStore,
            CatalogReader catalogReader,
            CatalogLock lock,
            ExportEngine exports,
            AuditLogger audit,
            BusSettings settings,
            Clock clock
    ) {
        this.storage = storage;
        this.catalogStore = catalogStore;
        this.catalogReader = catalogReader;
        this.lock = lock;
        this.exports = exports;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
        this.validator = new JobValidator(storage, catalogReader::isKnownSchemaHint);
        AtomicInteger threadIds = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "artifactbus-validate-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.validationPool = Executors.newFixedThreadPool(Math.max(1, settings.validationThreads()), tf);
    }

    /**
     * Registers the schema hints listed in settings so manifests may reference them.
     */
    public int registerConfiguredSchemaHints() {
        int added = 0;
        for (String hint : settings.knownSchemaHints()) {
            try (CatalogLock.Lease ignored = lock.acquire(settings.lockTimeout())) {
                if (catalogStore.registerSchemaHint(hint, "settings", clock.millis())) {
                    added++;
                }
            }
        }
        if (added > 0) {
            LOG.info("Registered {} schema hint(s) from settings", added);
        }
        return added;
    }

    public ScanOutcome runOnce() {
        long startMs = clock.millis();
        List<JobResult> results = new ArrayList<>();
        int replayed = replayMarkers().replayed();

        ScanResult scan = storage.scan(settings.maxJobsPerScan());
        int emptyRemoved = 0;
        for (String jobId : scan.empty()) {
            try {
                storage.remove(jobId);
                emptyRemoved++;
            } catch (IOException e) {
                LOG.warn("Could not remove empty job directory {}", jobId, e);
            }
        }
        if (!scan.incomplete().isEmpty()) {
            LOG.debug("Skipping {} incomplete job(s): {}", scan.incomplete().size(), scan.incomplete());
        }

        List<Future<Validation>> validations = new ArrayList<>();
        for (String jobId : scan.complete()) {
            Job job = Job.incoming(jobId);
            validations.add(validationPool.submit(() -> validate(job)));
        }
        for (Future<Validation> future : validations) {
            Validation validation = await(future);
            if (validation.transientError() != null) {
                LOG.warn("Job {} could not be read, retrying next cycle: {}",
                        validation.job().jobId(), validation.transientError().getMessage());
                results.add(JobResult.failed(validation.job().jobId(), JobOutcome.DEFERRED_IO, null,
                        "READ_FAILED", validation.transientError().getMessage()));
            } else if (validation.failure() != null) {
                results.add(reject(validation.job(), validation.failure()));
            } else {
                results.add(commit(validation.job()));
            }
        }

        ExportRunOutcome exported = exports.runPending();
        ScanOutcome outcome = ScanOutcome.from(replayed, scan.complete().size(), scan.incomplete().size(),
                emptyRemoved, exported.refreshed(), clock.millis() - startMs, results);
        if (!results.isEmpty() || replayed > 0) {
            LOG.info("Cycle done: committed={} already={} rejected={} deferred={} replayed={} exports={}",
                    outcome.committed(), outcome.alreadyCommitted(), outcome.rejected(), outcome.deferred(),
                    replayed, exported.refreshed());
        }
        return outcome;
    }

    /**
     * Startup recovery. Settles every commit marker, then cross-checks the catalog history
     * against the store: missing store files are reported as corruption, unknown store files
     * as orphans. Neither is repaired automatically.
     */
    public RecoveryOutcome recover() {
        MarkerReplay replay = replayMarkers();
        List<String> corrupt = new ArrayList<>();
        Set<String> catalogued = new HashSet<>();
        for (ArtifactRecord record : catalogReader.listArtifacts()) {
            catalogued.add(record.canonicalPath());
            if (!storage.existsAt(record.canonicalPath())) {
                corrupt.add(record.identity().label());
                LOG.error("Catalog entry {} points at missing store file {}",
                        record.identity().label(), record.canonicalPath());
                audit("catalog.corruption", record.identity().label(), "missing_store_file", null,
                        Map.of("canonical_path", record.canonicalPath(), "content_hash", record.contentHash()));
            }
        }
        List<String> orphans = new ArrayList<>();
        try {
            Set<String> marked = new HashSet<>();
            for (CommitMarker marker : storage.listMarkers()) {
                marked.add(marker.canonicalKey());
            }
            for (String key : storage.listStoreKeys()) {
                if (!catalogued.contains(storage.locate(key)) && !marked.contains(key)) {
                    orphans.add(key);
                    LOG.warn("Store file {} has no catalog entry", key);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to scan store for orphans", e);
        }
        exports.runPending();
        RecoveryOutcome outcome = new RecoveryOutcome(replay.replayed(), replay.cleared(), replay.pending(), corrupt, orphans);
        LOG.info("Recovery done: replayed={} cleared={} pending={} corrupt={} orphans={}",
                outcome.markersReplayed(), outcome.markersCleared(), outcome.markersPending(),
                corrupt.size(), orphans.size());
        return outcome;
    }

    /**
     * Runs cycles until {@code running} turns false, sleeping {@code scanIntervalMs} between
     * them. A failed cycle is logged and the loop continues.
     */
    public void runLoop(BooleanSupplier running) {
        recover();
        while (running.getAsBoolean()) {
            try {
                runOnce();
            } catch (RuntimeException e) {
                LOG.error("Daemon cycle failed", e);
            }
            try {
                Thread.sleep(settings.scanIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Override
    public void close() {
        validationPool.shutdownNow();
    }

    private Validation validate(Job job) {
        try {
            return new Validation(validator.validate(job), null, null);
        } catch (ValidationException e) {
            return new Validation(job, e, null);
        } catch (IOException e) {
            return new Validation(job, null, e);
        }
    }

    private Validation await(Future<Validation> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while validating jobs", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Job validation failed unexpectedly", e.getCause());
        }
    }

    private JobResult commit(Job job) {
        Manifest manifest = job.manifest();
        ArtifactIdentity identity = manifest.identity();
        String key = job.canonicalKey();
        String location = storage.locate(key);
        try {
            Optional<ArtifactRecord> existing = catalogReader.findArtifact(identity);
            if (existing.isPresent() && !existing.get().contentHash().equals(manifest.contentHash())) {
                return reject(job, writeOnceViolation(identity, existing.get().contentHash(), manifest.contentHash()));
            }
            Optional<String> stored = storage.storedHash(key);
            if (stored.isPresent() && !stored.get().equals(manifest.contentHash())) {
                return reject(job, writeOnceViolation(identity, stored.get(), manifest.contentHash()));
            }
            Optional<CommitMarker> pending = storage.readMarker(identity.digest());
            if (pending.isPresent() && !pending.get().jobId().equals(job.jobId())) {
                LOG.info("Job {} waits for pending commit of {} by job {}", job.jobId(), identity.label(),
                        pending.get().jobId());
                return JobResult.failed(job.jobId(), JobOutcome.DEFERRED_PENDING_COMMIT, identity.label(),
                        "COMMIT_PENDING", "commit of " + identity.label() + " by job " + pending.get().jobId()
                                + " not yet settled");
            }
            if (stored.isPresent() && existing.isPresent()) {
                storage.remove(job.jobId());
                LOG.info("Job {} duplicates committed artifact {}", job.jobId(), identity.label());
                return JobResult.of(job.jobId(), JobOutcome.ALREADY_COMMITTED, identity.label(), location);
            }

            CommitMarker marker = new CommitMarker(identity.digest(), job.jobId(), key, location, manifest, clock.millis());
            storage.writeMarker(marker);
            if (stored.isEmpty()) {
                try {
                    storage.commit(job.jobId(), dataFileOf(manifest), key);
                } catch (IOException e) {
                    storage.clearMarker(marker.markerId());
                    throw new CommitIOException(job.jobId(), "Failed to move " + identity.label() + " into the store", e);
                }
            }
            Job committed = job.committed();
            if (!upsertUnderLock(marker)) {
                return JobResult.failed(committed.jobId(), JobOutcome.DEFERRED_LOCK_TIMEOUT, identity.label(),
                        "LOCK_TIMEOUT", "catalog lock not acquired within " + settings.lockTimeoutS() + "s");
            }
            finish(marker);
            LOG.info("Committed {} to {}", identity.label(), key);
            return JobResult.of(committed.jobId(), JobOutcome.COMMITTED, identity.label(), location);
        } catch (CommitIOException e) {
            LOG.warn("{}; job {} left for retry", e.getMessage(), job.jobId(), e.getCause());
            return JobResult.failed(job.jobId(), JobOutcome.DEFERRED_IO, identity.label(), "COMMIT_IO", e.getMessage());
        } catch (IOException e) {
            LOG.warn("I/O failure committing job {}; left for retry", job.jobId(), e);
            return JobResult.failed(job.jobId(), JobOutcome.DEFERRED_IO, identity.label(), "COMMIT_IO", e.getMessage());
        }
    }

    /**
     * Acquires the catalog lock and writes the catalog rows for a stored artifact. Returns
     * false when the lock is not available in time; the marker stays for the next cycle.
     */
    private boolean upsertUnderLock(CommitMarker marker) {
        Manifest manifest = marker.manifest();
        try (CatalogLock.Lease ignored = lock.acquire(settings.lockTimeout())) {
            catalogStore.upsert(
                    manifest.identity(),
                    marker.canonicalLocation(),
                    manifest.contentHash(),
                    manifest.schemaHint(),
                    manifest.rows(),
                    manifest.meta(),
                    clock.millis()
            );
            return true;
        } catch (LockTimeoutException e) {
            LOG.warn("Catalog lock timeout for {} after {}ms (holder={}); retrying next cycle",
                    manifest.identity().label(), e.waited().toMillis(), e.holder());
            return false;
        }
    }

    private void finish(CommitMarker marker) throws IOException {
        Manifest manifest = marker.manifest();
        exports.requestRefresh(manifest.producer(), manifest.kind());
        if (storage.jobExists(marker.jobId())) {
            storage.remove(marker.jobId());
        }
        storage.clearMarker(marker.markerId());
        audit("artifact.commit", manifest.identity().label(), "ok", marker.jobId(), details(manifest, marker.canonicalLocation()));
    }

    private MarkerReplay replayMarkers() {
        List<CommitMarker> markers;
        try {
            markers = storage.listMarkers();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list commit markers", e);
        }
        int replayed = 0;
        int cleared = 0;
        int pending = 0;
        for (CommitMarker marker : markers) {
            String label = marker.manifest().identity().label();
            try {
                Optional<String> stored = storage.storedHash(marker.canonicalKey());
                if (stored.isEmpty()) {
                    storage.clearMarker(marker.markerId());
                    cleared++;
                    LOG.info("Cleared marker for {}: store move never happened, job {} will be rescanned",
                            label, marker.jobId());
                    continue;
                }
                if (!stored.get().equals(marker.manifest().contentHash())) {
                    storage.clearMarker(marker.markerId());
                    cleared++;
                    LOG.error("Marker for {} does not match stored content (marker={}, stored={}); store file kept",
                            label, marker.manifest().contentHash(), stored.get());
                    continue;
                }
                if (!upsertUnderLock(marker)) {
                    pending++;
                    continue;
                }
                finish(marker);
                replayed++;
                LOG.info("Replayed catalog upsert for {}", label);
            } catch (IOException e) {
                pending++;
                LOG.warn("Could not replay marker for {}", label, e);
            }
        }
        return new MarkerReplay(replayed, cleared, pending);
    }

    private JobResult reject(Job job, ValidationException failure) {
        Manifest manifest = job.manifest();
        String identity = manifest == null ? null : manifest.identity().label();
        Rejection rejection = new Rejection(failure.code(), failure.reason(), job.jobId(), identity, clock.millis());
        Job rejected = job.rejected(rejection);
        try {
            storage.reject(rejected.jobId(), rejection);
        } catch (IOException e) {
            LOG.error("Failed to move rejected job {} to rejected/", job.jobId(), e);
            return JobResult.failed(job.jobId(), JobOutcome.DEFERRED_IO, identity, failure.code(), failure.reason());
        }
        LOG.warn("Rejected job {} ({}): {}", job.jobId(), failure.code(), failure.reason());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", failure.code());
        details.put("reason", failure.reason());
        audit("artifact.reject", identity, "rejected", job.jobId(), details);
        return JobResult.failed(rejected.jobId(), JobOutcome.REJECTED, identity, failure.code(), failure.reason());
    }

    private ValidationException writeOnceViolation(ArtifactIdentity identity, String existingHash, String newHash) {
        return new ValidationException(ValidationException.WRITE_ONCE_VIOLATION,
                identity.label() + " already committed with hash " + existingHash + ", resubmitted with " + newHash);
    }

    private void audit(String action, String resource, String result, String jobId, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, "daemon", resource, result, jobId, details));
        } catch (RuntimeException e) {
            LOG.warn("Failed to append audit event {}", action, e);
        }
    }

    private static Map<String, Object> details(Manifest manifest, String location) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("canonical_path", location);
        details.put("content_hash", manifest.contentHash());
        details.put("rows", manifest.rows());
        details.put("schema_hint", manifest.schemaHint());
        details.put("meta", manifest.meta());
        return details;
    }

    private static String dataFileOf(Manifest manifest) {
        return manifest.dataFile() == null ? Manifest.DEFAULT_DATA_FILE : manifest.dataFile();
    }

    private record Validation(Job job, ValidationException failure, IOException transientError) {
    }

    private record MarkerReplay(int replayed, int cleared, int pending) {
    }
}
