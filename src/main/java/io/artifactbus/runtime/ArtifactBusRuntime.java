package io.artifactbus.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.artifactbus.bus.FileSystemInbox;
import io.artifactbus.bus.InboxStorage;
import io.artifactbus.bus.Rejection;
import io.artifactbus.bus.ScanResult;
import io.artifactbus.config.ArtifactBusConfig;
import io.artifactbus.config.BusSettings;
import io.artifactbus.daemon.BusDaemon;
import io.artifactbus.daemon.RecoveryOutcome;
import io.artifactbus.daemon.ScanOutcome;
import io.artifactbus.export.ExportEngine;
import io.artifactbus.export.ExportLedger;
import io.artifactbus.export.ExportRunOutcome;
import io.artifactbus.export.ExportStatus;
import io.artifactbus.lock.CatalogLock;
import io.artifactbus.lock.FileCatalogLock;
import io.artifactbus.lock.LockOwner;
import io.artifactbus.model.ArtifactSpec;
import io.artifactbus.model.LatestArtifact;
import io.artifactbus.observability.AuditLogger;
import io.artifactbus.producer.ProducerClient;
import io.artifactbus.producer.SubmitOutcome;
import io.artifactbus.storage.CatalogReader;
import io.artifactbus.storage.CatalogStore;
import io.artifactbus.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Wires every component from one {@link ArtifactBusConfig}. The CLI talks only to this class.
 *
 * <p>Producers need nothing but {@link #submit(ArtifactSpec)}; the daemon entry points
 * ({@link #init()}, {@link #daemonOnce()}, {@link #recover()}) are the only ones that write the
 * catalog.
 */
public final class ArtifactBusRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ArtifactBusRuntime.class);

    private final ArtifactBusConfig config;
    private final Clock clock;
    private final Database database;
    private final InboxStorage inbox;
    private final FileCatalogLock lock;
    private final CatalogStore catalogStore;
    private final CatalogReader catalogReader;
    private final ExportEngine exports;
    private final AuditLogger auditLogger;
    private final ProducerClient producer;
    private final BusDaemon daemon;

    public ArtifactBusRuntime(ArtifactBusConfig config) {
        this(config, Clock.systemUTC());
    }

    public ArtifactBusRuntime(ArtifactBusConfig config, Clock clock) {
        BusSettings settings = config.settings();
        this.config = config;
        this.clock = clock;
        this.database = new Database(config.catalogFile());
        this.inbox = new FileSystemInbox(config);
        this.lock = new FileCatalogLock(config.lockFile(), settings.lockRetryBaseMs(),
                settings.lockRetryMaxMs(), settings.lockStaleAfterMs());
        this.catalogStore = new CatalogStore(database);
        this.catalogReader = new CatalogReader(database);
        this.exports = new ExportEngine(config.exportRoot(), config.exportStatusFile(), catalogReader, clock);
        this.auditLogger = new AuditLogger(config.auditRoot().resolve("audit.log"));
        this.producer = new ProducerClient(config, clock);
        this.daemon = new BusDaemon(inbox, catalogStore, catalogReader, lock, exports, auditLogger, settings, clock);
    }

    public ArtifactBusConfig config() {
        return config;
    }

    /**
     * Creates the directory layout, brings the catalog schema up to date under the catalog
     * lock and registers the schema hints listed in settings.
     */
    public InitOutcome init() {
        inbox.init();
        try {
            Files.createDirectories(config.exportRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create export directory: " + config.exportRoot(), e);
        }
        Database.InitOutcome schema;
        try (CatalogLock.Lease ignored = lock.acquire(config.settings().lockTimeout())) {
            schema = database.init();
        }
        if (schema.selfHealed()) {
            LOG.warn("Catalog schema self-healed, recreated {}", schema.missingTables());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("missing_tables", schema.missingTables());
            auditLogger.log(AuditLogger.AuditEvent.of("catalog.self_heal", "daemon", "catalog", "healed", null, details));
        }
        int hints = daemon.registerConfiguredSchemaHints();
        return new InitOutcome(config.rootDir().toString(), schema.freshCatalog(), schema.missingTables(),
                schema.appliedMigrations(), hints);
    }

    public SubmitOutcome submit(ArtifactSpec spec) {
        return producer.submitArtifact(spec);
    }

    public ScanOutcome daemonOnce() {
        return daemon.runOnce();
    }

    public RecoveryOutcome recover() {
        return daemon.recover();
    }

    public void runDaemon(BooleanSupplier running) {
        daemon.runLoop(running);
    }

    public List<LatestArtifact> latest(String producerName, String kind) {
        return catalogReader.latestArtifacts(producerName, kind);
    }

    public CatalogReader catalog() {
        return catalogReader;
    }

    public ExportRunOutcome exportAll() {
        return exports.refreshAll();
    }

    public ExportLedger exportStatus() {
        return exports.status();
    }

    public List<Rejection> rejected() {
        try {
            return inbox.listRejections();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list rejected jobs", e);
        }
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public List<JsonNode> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public int verifyAudit() {
        return auditLogger.verifyChain();
    }

    public HealthOutcome health() {
        boolean catalogOk;
        int entries = -1;
        try (Connection ignored = database.openReadOnlyConnection()) {
            entries = catalogReader.countEntries();
            catalogOk = database.exists();
        } catch (Exception e) {
            LOG.warn("Catalog health check failed", e);
            catalogOk = false;
        }
        boolean inboxOk = Files.isDirectory(config.inboxRoot()) && Files.isDirectory(config.incomingDir());
        boolean storeOk = Files.isDirectory(config.storeRoot());
        boolean exportsOk = Files.isDirectory(config.exportRoot());
        ScanResult scan = inbox.scan(Integer.MAX_VALUE);
        int pendingMarkers;
        try {
            pendingMarkers = inbox.listMarkers().size();
        } catch (IOException e) {
            LOG.warn("Could not list commit markers", e);
            pendingMarkers = -1;
        }
        int exportErrors = 0;
        for (ExportStatus status : exports.status().entries().values()) {
            if (!status.ok()) {
                exportErrors++;
            }
        }
        LockOwner holder = lock.currentOwner().orElse(null);
        boolean ok = catalogOk && inboxOk && storeOk && exportsOk && exportErrors == 0;
        return new HealthOutcome(
                ok,
                catalogOk,
                inboxOk,
                storeOk,
                exportsOk,
                entries,
                scan.complete().size() + scan.incomplete().size(),
                pendingMarkers,
                inbox.countRejected(),
                exportErrors,
                holder,
                Instant.ofEpochMilli(clock.millis()).toString()
        );
    }

    @Override
    public void close() {
        daemon.close();
    }

    public record InitOutcome(
            String rootDir,
            boolean freshCatalog,
            List<String> missingTables,
            List<String> appliedMigrations,
            int schemaHintsRegistered
    ) {
    }

    public record HealthOutcome(
            boolean ok,
            boolean catalogOk,
            boolean inboxDirOk,
            boolean storeDirOk,
            boolean exportDirOk,
            int catalogEntries,
            int pendingJobs,
            int pendingMarkers,
            int rejectedJobs,
            int exportErrors,
            LockOwner lockHolder,
            String checkedAt
    ) {
    }
}
