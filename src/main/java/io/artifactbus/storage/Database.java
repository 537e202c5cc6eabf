package io.artifactbus.storage;

import org.sqlite.SQLiteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Owner of the catalog's SQLite file and its schema.
 *
 * <p>Only the daemon calls {@link #init()}: it creates missing tables, applies versioned
 * migrations and never drops or rewrites existing rows. Everything else opens the catalog
 * through {@link #openReadOnlyConnection()}.
 */
public final class Database {
    private static final Logger LOG = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "artifactbus.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;
    static final List<String> CORE_TABLES = List.of(
            "runs_d", "artifacts", "schema_hints", "schema_migrations", "latest_artifacts_v");

    private final Path catalogFile;
    private final String jdbcUrl;

    public Database(Path catalogFile) {
        this.catalogFile = catalogFile.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.catalogFile;
    }

    public Path catalogFile() {
        return catalogFile;
    }

    public InitOutcome init() {
        try {
            Files.createDirectories(catalogFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create catalog directory: " + catalogFile.getParent(), e);
        }
        applyPragmas();
        return initSchema();
    }

    public Connection openConnection() throws SQLException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        cfg.enforceForeignKeys(true);
        return DriverManager.getConnection(jdbcUrl, cfg.toProperties());
    }

    public Connection openReadOnlyConnection() throws SQLException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setReadOnly(true);
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, cfg.toProperties());
    }

    public boolean exists() {
        return Files.isRegularFile(catalogFile);
    }

    private InitOutcome initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            Set<String> before = existingTables(conn);
            List<String> missing = new ArrayList<>();
            for (String table : CORE_TABLES) {
                if (!before.contains(table)) {
                    missing.add(table);
                }
            }
            if (!before.isEmpty() && !missing.isEmpty()) {
                LOG.warn("Catalog {} is missing tables {}; recreating them", catalogFile, missing);
            }

            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs_d (
                        run_id TEXT NOT NULL,
                        producer TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        artifact_id TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        last_seen_at_ms INTEGER NOT NULL,
                        canonical_path TEXT NOT NULL,
                        content_hash TEXT NOT NULL,
                        schema_hint TEXT,
                        row_count INTEGER NOT NULL,
                        meta_json TEXT NOT NULL DEFAULT '{}',
                        PRIMARY KEY(run_id, producer, kind)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS artifacts (
                        run_id TEXT NOT NULL,
                        producer TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        artifact_id TEXT NOT NULL,
                        canonical_path TEXT NOT NULL UNIQUE,
                        content_hash TEXT NOT NULL,
                        schema_hint TEXT,
                        row_count INTEGER NOT NULL,
                        meta_json TEXT NOT NULL DEFAULT '{}',
                        committed_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(run_id, producer, kind, artifact_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_hints (
                        hint TEXT PRIMARY KEY,
                        source TEXT NOT NULL,
                        registered_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureRunsColumns(conn);
            st.execute("""
                    CREATE VIEW IF NOT EXISTS latest_artifacts_v AS
                    SELECT run_id, producer, kind, artifact_id, created_at_ms, last_seen_at_ms,
                           canonical_path, content_hash, schema_hint, row_count, meta_json
                    FROM (
                        SELECT r.*, ROW_NUMBER() OVER (
                            PARTITION BY r.producer, r.kind
                            ORDER BY r.last_seen_at_ms DESC, r.created_at_ms DESC, r.run_id DESC
                        ) AS rn
                        FROM runs_d r
                    )
                    WHERE rn = 1
                    """);
            st.execute("INSERT OR IGNORE INTO schema_hints(hint,source,registered_at_ms) VALUES('untyped','builtin',0)");
            ensureSchemaMigrationsTable(conn);
            List<String> applied = applyVersionedMigrations(conn);
            return new InitOutcome(before.isEmpty(), missing, applied);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize catalog schema", e);
        }
    }

    private Set<String> existingTables(Connection conn) throws SQLException {
        Set<String> tables = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT name FROM sqlite_master WHERE type IN ('table','view')")) {
            while (rs.next()) {
                tables.add(rs.getString(1).toLowerCase(Locale.ROOT));
            }
        }
        return tables;
    }

    // Catalogs created before content hashes were tracked get the column with an empty default.
    private void ensureRunsColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(runs_d)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("content_hash")) {
                st.execute("ALTER TABLE runs_d ADD COLUMN content_hash TEXT NOT NULL DEFAULT ''");
            }
            if (!columns.contains("meta_json")) {
                st.execute("ALTER TABLE runs_d ADD COLUMN meta_json TEXT NOT NULL DEFAULT '{}'");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private List<String> applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_runs_d_lookup_index",
                "Index runs_d by (producer, kind, last_seen_at_ms) for the latest view",
                List.of("CREATE INDEX IF NOT EXISTS idx_runs_d_producer_kind_seen ON runs_d(producer, kind, last_seen_at_ms)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_artifact_history_indexes",
                "Lookup indexes for artifact history",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_artifacts_producer_kind ON artifacts(producer, kind)",
                        "CREATE INDEX IF NOT EXISTS idx_artifacts_committed ON artifacts(committed_at_ms)"
                )
        ));
        List<String> applied = new ArrayList<>();
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            applied.add(step.version());
        }
        return applied;
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement ps = conn.prepareStatement(
                     "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
            conn.commit();
            LOG.info("Applied catalog migration {}", step.version());
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private void applyPragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=FULL");
            try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                String mode = rs.next() ? rs.getString(1) : null;
                if (mode == null || !mode.equalsIgnoreCase("wal")) {
                    throw new IllegalStateException("PRAGMA journal_mode mismatch, expected=wal, actual=" + mode);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openReadOnlyConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    /**
     * Result of {@link #init()}. {@code missingTables} lists core tables that had to be
     * created; on an existing catalog that means the schema had been damaged or was older.
     */
    public record InitOutcome(boolean freshCatalog, List<String> missingTables, List<String> appliedMigrations) {
        public boolean selfHealed() {
            return !freshCatalog && !missingTables.isEmpty();
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
