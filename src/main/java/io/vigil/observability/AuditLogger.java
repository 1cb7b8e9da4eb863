package io.vigil.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.vigil.security.SensitiveDataMasker;
import io.vigil.util.Hashing;
import io.vigil.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSON-lines log of supervisor decisions: transitions, conflicts, reaps, alerts and
 * settings reloads. Each row carries the previous row's hash; with a signing secret the row hash
 * is also HMAC-signed.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", now.toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("instance_id", event.instanceId());
        row.put("execution_id", event.executionId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
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
    public synchronized List<JsonNode> tail(int limit) {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<JsonNode> out = new ArrayList<>();
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            for (String line : lines.subList(from, lines.size())) {
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    /**
     * Recomputes every row hash and checks the prev_hash links.
     */
    public synchronized IntegrityReport verify() {
        try {
            String expectedPrev = "";
            int checked = 0;
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                checked++;
                JsonNode node = Jsons.mapper().readTree(line);
                Map<String, Object> row = new LinkedHashMap<>();
                node.fields().forEachRemaining(e -> {
                    if (!"hash".equals(e.getKey()) && !"signature".equals(e.getKey())) {
                        row.put(e.getKey(), e.getValue());
                    }
                });
                String recorded = node.path("hash").asText("");
                if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                    return new IntegrityReport(false, checked, "prev_hash mismatch at row " + checked);
                }
                if (!recorded.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return new IntegrityReport(false, checked, "hash mismatch at row " + checked);
                }
                expectedPrev = recorded;
            }
            return new IntegrityReport(true, checked, null);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String instanceId,
            String executionId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String instanceId,
                String executionId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, instanceId, executionId,
                    details == null ? Map.of() : details);
        }
    }

    public record IntegrityReport(boolean ok, int checkedRows, String error) {
    }
}
