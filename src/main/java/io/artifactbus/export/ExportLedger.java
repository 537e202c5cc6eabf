package io.artifactbus.export;

import io.artifactbus.util.Jsons;
import io.artifactbus.util.MoreFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Contents of {@code export-status.json}, keyed by {@code "<producer>/<kind>"}.
 */
public record ExportLedger(String schemaVersion, long lastRunAtMs, Map<String, ExportStatus> entries) {
    public static final String SCHEMA_VERSION = "artifactbus.export-status.v1";

    public ExportLedger {
        entries = entries == null ? new TreeMap<>() : new TreeMap<>(entries);
    }

    public static ExportLedger empty() {
        return new ExportLedger(SCHEMA_VERSION, 0L, new TreeMap<>());
    }

    public static ExportLedger load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return empty();
        }
        ExportLedger ledger = Jsons.read(file, ExportLedger.class);
        return ledger == null ? empty() : ledger;
    }

    public void save(Path file) throws IOException {
        MoreFiles.writeStringAtomically(file, Jsons.toJson(this));
    }

    public ExportLedger with(ExportStatus status, long nowMs) {
        Map<String, ExportStatus> next = new TreeMap<>(entries);
        next.put(status.producer() + "/" + status.kind(), status);
        return new ExportLedger(SCHEMA_VERSION, nowMs, next);
    }

    public ExportStatus entry(String producer, String kind) {
        return entries.get(producer + "/" + kind);
    }
}
