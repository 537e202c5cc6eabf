package io.artifactbus.storage;

import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

/**
 * Write side of the catalog. Held only by the daemon; every call here must run inside a
 * catalog lock lease.
 */
public final class CatalogStore {
    private final Database database;

    public CatalogStore(Database database) {
        this.database = database;
    }

    /**
     * Records a committed artifact: inserts or refreshes the {@code runs_d} row of its
     * (run, producer, kind) and adds it to the artifact history. Both writes share one
     * transaction, so a failure leaves the catalog exactly as it was.
     */
    public UpsertResult upsert(
            ArtifactIdentity identity,
            String canonicalPath,
            String contentHash,
            String schemaHint,
            long rows,
            Map<String, Object> meta,
            long nowMs
    ) {
        String metaJson = Jsons.toCompactJson(meta == null ? Map.of() : meta);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement existing = c.prepareStatement(
                    "SELECT 1 FROM runs_d WHERE run_id=? AND producer=? AND kind=?");
                 PreparedStatement runs = c.prepareStatement("""
                         INSERT INTO runs_d(run_id,producer,kind,artifact_id,created_at_ms,last_seen_at_ms,
                                            canonical_path,content_hash,schema_hint,row_count,meta_json)
                         VALUES(?,?,?,?,?,?,?,?,?,?,?)
                         ON CONFLICT(run_id,producer,kind) DO UPDATE SET
                             artifact_id=excluded.artifact_id,
                             last_seen_at_ms=excluded.last_seen_at_ms,
                             canonical_path=excluded.canonical_path,
                             content_hash=excluded.content_hash,
                             schema_hint=excluded.schema_hint,
                             row_count=excluded.row_count,
                             meta_json=excluded.meta_json
                         """);
                 PreparedStatement history = c.prepareStatement("""
                         INSERT OR IGNORE INTO artifacts(run_id,producer,kind,artifact_id,canonical_path,content_hash,
                                                         schema_hint,row_count,meta_json,committed_at_ms)
                         VALUES(?,?,?,?,?,?,?,?,?,?)
                         """)) {
                existing.setString(1, identity.runId());
                existing.setString(2, identity.producer());
                existing.setString(3, identity.kind());
                boolean created;
                try (ResultSet rs = existing.executeQuery()) {
                    created = !rs.next();
                }

                runs.setString(1, identity.runId());
                runs.setString(2, identity.producer());
                runs.setString(3, identity.kind());
                runs.setString(4, identity.artifactId());
                runs.setLong(5, nowMs);
                runs.setLong(6, nowMs);
                runs.setString(7, canonicalPath);
                runs.setString(8, contentHash);
                runs.setString(9, schemaHint);
                runs.setLong(10, rows);
                runs.setString(11, metaJson);
                runs.executeUpdate();

                history.setString(1, identity.runId());
                history.setString(2, identity.producer());
                history.setString(3, identity.kind());
                history.setString(4, identity.artifactId());
                history.setString(5, canonicalPath);
                history.setString(6, contentHash);
                history.setString(7, schemaHint);
                history.setLong(8, rows);
                history.setString(9, metaJson);
                history.setLong(10, nowMs);
                boolean firstCommit = history.executeUpdate() > 0;

                c.commit();
                return new UpsertResult(created, firstCommit);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert catalog entry: " + identity.label(), e);
        }
    }

    public boolean registerSchemaHint(String hint, String source, long nowMs) {
        if (hint == null || hint.isBlank()) {
            throw new IllegalArgumentException("schema hint must not be blank");
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR IGNORE INTO schema_hints(hint,source,registered_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, hint.trim());
            ps.setString(2, source == null ? "settings" : source);
            ps.setLong(3, nowMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register schema hint: " + hint, e);
        }
    }

    /**
     * @param entryCreated   a new {@code runs_d} row was inserted rather than refreshed
     * @param artifactAdded  the full identity was recorded in the history for the first time
     */
    public record UpsertResult(boolean entryCreated, boolean artifactAdded) {
    }
}
