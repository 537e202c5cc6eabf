package io.artifactbus.storage;

import io.artifactbus.model.ArtifactIdentity;
import io.artifactbus.model.ArtifactRecord;
import io.artifactbus.model.LatestArtifact;
import io.artifactbus.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the catalog. Never takes the catalog lock: SQLite's WAL mode gives
 * each query a consistent snapshot, so a reader sees a commit either entirely or not at all.
 */
public final class CatalogReader {
    private final Database database;

    public CatalogReader(Database database) {
        this.database = database;
    }

    /**
     * Most recent committed entry per (producer, kind). Either filter may be {@code null}.
     */
    public List<LatestArtifact> latestArtifacts(String producer, String kind) {
        StringBuilder sql = new StringBuilder("""
                SELECT run_id,producer,kind,artifact_id,canonical_path,content_hash,row_count,schema_hint,
                       created_at_ms,last_seen_at_ms
                FROM latest_artifacts_v WHERE 1=1
                """);
        List<String> args = new ArrayList<>();
        if (producer != null && !producer.isBlank()) {
            sql.append(" AND producer=?");
            args.add(producer.trim());
        }
        if (kind != null && !kind.isBlank()) {
            sql.append(" AND kind=?");
            args.add(kind.trim());
        }
        sql.append(" ORDER BY producer, kind");
        List<LatestArtifact> out = new ArrayList<>();
        try (Connection c = database.openReadOnlyConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                ps.setString(i + 1, args.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new LatestArtifact(
                            rs.getString("producer"),
                            rs.getString("kind"),
                            rs.getString("run_id"),
                            rs.getString("artifact_id"),
                            rs.getString("canonical_path"),
                            rs.getString("content_hash"),
                            rs.getLong("row_count"),
                            rs.getString("schema_hint"),
                            rs.getLong("created_at_ms"),
                            rs.getLong("last_seen_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query latest artifacts", e);
        }
    }

    public Optional<LatestArtifact> latestArtifact(String producer, String kind) {
        if (producer == null || producer.isBlank() || kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("producer and kind are required");
        }
        List<LatestArtifact> rows = latestArtifacts(producer, kind);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<ArtifactRecord> findArtifact(ArtifactIdentity identity) {
        String sql = """
                SELECT run_id,producer,kind,artifact_id,canonical_path,content_hash,schema_hint,row_count,meta_json,committed_at_ms
                FROM artifacts WHERE run_id=? AND producer=? AND kind=? AND artifact_id=?
                """;
        try (Connection c = database.openReadOnlyConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, identity.runId());
            ps.setString(2, identity.producer());
            ps.setString(3, identity.kind());
            ps.setString(4, identity.artifactId());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read artifact: " + identity.label(), e);
        }
    }

    public List<ArtifactRecord> listArtifacts() {
        String sql = """
                SELECT run_id,producer,kind,artifact_id,canonical_path,content_hash,schema_hint,row_count,meta_json,committed_at_ms
                FROM artifacts ORDER BY committed_at_ms, run_id, producer, kind, artifact_id
                """;
        List<ArtifactRecord> out = new ArrayList<>();
        try (Connection c = database.openReadOnlyConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(toRecord(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list artifacts", e);
        }
    }

    public int countEntries() {
        return count("SELECT COUNT(*) FROM runs_d");
    }

    public int countArtifacts() {
        return count("SELECT COUNT(*) FROM artifacts");
    }

    public boolean isKnownSchemaHint(String hint) {
        if (hint == null) {
            return false;
        }
        try (Connection c = database.openReadOnlyConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM schema_hints WHERE hint=? LIMIT 1")) {
            ps.setString(1, hint.trim());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up schema hint: " + hint, e);
        }
    }

    public List<String> knownSchemaHints() {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openReadOnlyConnection();
             PreparedStatement ps = c.prepareStatement("SELECT hint FROM schema_hints ORDER BY hint");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(rs.getString(1));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema hints", e);
        }
    }

    public static Map<String, Object> parseMeta(String metaJson) {
        if (metaJson == null || metaJson.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(metaJson, Jsons.MAP_TYPE);
        } catch (IOException e) {
            throw new RuntimeException("Corrupt meta_json in catalog: " + metaJson, e);
        }
    }

    private int count(String sql) {
        try (Connection c = database.openReadOnlyConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count catalog rows", e);
        }
    }

    private ArtifactRecord toRecord(ResultSet rs) throws SQLException {
        return new ArtifactRecord(
                new ArtifactIdentity(
                        rs.getString("run_id"),
                        rs.getString("producer"),
                        rs.getString("kind"),
                        rs.getString("artifact_id")
                ),
                rs.getString("canonical_path"),
                rs.getString("content_hash"),
                rs.getString("schema_hint"),
                rs.getLong("row_count"),
                rs.getString("meta_json"),
                rs.getLong("committed_at_ms")
        );
    }
}
