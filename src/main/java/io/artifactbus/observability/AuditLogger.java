package io.artifactbus.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.artifactbus.util.Hashing;
import io.artifactbus.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail of catalog-affecting events. Each row carries the hash of
 * the previous row, so truncation or in-place edits break the chain and show up in
 * {@link #verifyChain()}.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    LOG.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("job_id", event.jobId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(parse(line));
        }
        return out;
    }

    /**
     * Recomputes every row hash and checks the links. Returns the number of verified rows.
     *
     * @throws IllegalStateException at the first row that does not match
     */
    public int verifyChain() {
        String expectedPrev = "";
        int index = 0;
        for (String line : readLines()) {
            index++;
            JsonNode node = parse(line);
            String prev = node.path("prev_hash").asText("");
            if (!expectedPrev.equals(prev)) {
                throw new IllegalStateException("Audit chain broken at row " + index + ": prev_hash mismatch");
            }
            String hash = node.path("hash").asText("");
            Map<String, Object> body = Jsons.mapper().convertValue(node, Jsons.MAP_TYPE);
            body.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(body)).equals(hash)) {
                throw new IllegalStateException("Audit chain broken at row " + index + ": hash mismatch");
            }
            expectedPrev = hash;
        }
        return index;
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt audit row: " + line, e);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return parse(lines.get(lines.size() - 1)).path("hash").asText("");
    }

    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        return Jsons.mapper().convertValue(MetaMasker.masked(node), Jsons.MAP_TYPE);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String jobId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String jobId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, jobId, details == null ? Map.of() : details);
        }
    }
}
