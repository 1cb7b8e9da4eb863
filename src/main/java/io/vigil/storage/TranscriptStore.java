package io.vigil.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.error.StoreUnavailableException;
import io.vigil.model.AssertionOutcome;
import io.vigil.model.AssertionRecord;
import io.vigil.model.EntryType;
import io.vigil.model.ExecutionRecord;
import io.vigil.model.InstanceStatus;
import io.vigil.model.ToolResultStatus;
import io.vigil.model.ToolUseRecord;
import io.vigil.model.TranscriptEntry;
import io.vigil.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only transcript storage with per-execution sequencing and the typed tool-use and
 * assertion projections written alongside their entries.
 */
public final class TranscriptStore {
    public static final int SUMMARY_MAX_CHARS = 200;
    private static final String ENTRY_COLUMNS =
            "entry_id,execution_id,instance_id,task_id,sequence,entry_type,category,summary,payload,committed_at_ms";

    private final Database database;

    public TranscriptStore(Database database) {
        this.database = database;
    }

    /**
     * Appends one entry. The sequence is computed by the insert itself as one past the current
     * maximum for the execution, so it is gap-free and unique even across processes.
     */
    public TranscriptEntry append(NewEntry entry, long nowMs) {
        validate(entry);
        String owner = """
                SELECT e.instance_id,e.task_id,i.status
                FROM executions e JOIN instances i ON i.instance_id=e.instance_id
                WHERE e.execution_id=?
                """;
        String insert = """
                INSERT INTO transcript_entries(entry_id,execution_id,instance_id,task_id,sequence,entry_type,category,summary,payload,committed_at_ms)
                SELECT ?,?,?,?,COALESCE(MAX(sequence),0)+1,?,?,?,?,?
                FROM transcript_entries WHERE execution_id=?
                """;
        String readSequence = "SELECT sequence FROM transcript_entries WHERE entry_id=?";
        String entryId = "ent_" + UUID.randomUUID();
        String summary = truncate(entry.summary());
        ObjectNode payload = entry.payload() == null ? Jsons.mapper().createObjectNode() : entry.payload();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psOwner = c.prepareStatement(owner);
                 PreparedStatement psInsert = c.prepareStatement(insert);
                 PreparedStatement psSeq = c.prepareStatement(readSequence)) {
                psOwner.setString(1, entry.executionId());
                try (ResultSet rs = psOwner.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalArgumentException("Unknown execution: " + entry.executionId());
                    }
                    String instanceId = rs.getString("instance_id");
                    String taskId = rs.getString("task_id");
                    InstanceStatus status = InstanceStatus.fromString(rs.getString("status"));
                    if (!instanceId.equals(entry.instanceId())) {
                        throw new IllegalArgumentException("Execution " + entry.executionId()
                                + " belongs to instance " + instanceId + ", not " + entry.instanceId());
                    }
                    if (!taskId.equals(entry.taskId())) {
                        throw new IllegalArgumentException("Execution " + entry.executionId()
                                + " belongs to task " + taskId + ", not " + entry.taskId());
                    }
                    if (status.isTerminal()) {
                        throw new InstanceTerminatedException(instanceId, status);
                    }
                }

                psInsert.setString(1, entryId);
                psInsert.setString(2, entry.executionId());
                psInsert.setString(3, entry.instanceId());
                psInsert.setString(4, entry.taskId());
                psInsert.setString(5, entry.entryType().name());
                psInsert.setString(6, entry.category());
                psInsert.setString(7, summary);
                psInsert.setString(8, Jsons.toCompactJson(payload));
                psInsert.setLong(9, nowMs);
                psInsert.setString(10, entry.executionId());
                psInsert.executeUpdate();

                long sequence;
                psSeq.setString(1, entryId);
                try (ResultSet rs = psSeq.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalStateException("Inserted entry not visible: " + entryId);
                    }
                    sequence = rs.getLong(1);
                }

                if (entry.entryType() == EntryType.TOOL_USE) {
                    insertToolUse(c, entry, entryId, sequence, payload, nowMs);
                } else if (entry.entryType() == EntryType.ASSERTION) {
                    insertAssertion(c, entry, entryId, sequence, summary, payload, nowMs);
                }
                c.commit();
                return new TranscriptEntry(
                        entryId,
                        entry.executionId(),
                        entry.instanceId(),
                        entry.taskId(),
                        sequence,
                        entry.entryType(),
                        entry.category(),
                        summary,
                        payload,
                        nowMs
                );
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to append transcript entry for " + entry.executionId(), e);
        }
    }

    /**
     * Entries of one execution with {@code sequence >= fromSequence}, in sequence order.
     */
    public List<TranscriptEntry> readTranscript(String executionId, long fromSequence, int limit) {
        String sql = "SELECT " + ENTRY_COLUMNS + " FROM transcript_entries WHERE execution_id=? AND sequence>=? ORDER BY sequence ASC LIMIT ?";
        List<TranscriptEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            ps.setLong(2, Math.max(1L, fromSequence));
            ps.setInt(3, limit <= 0 ? Integer.MAX_VALUE : limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapEntry(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read transcript for " + executionId, e);
        }
    }

    public List<ToolUseRecord> listToolUses(String executionId, boolean errorsOnly) {
        String sql = """
                SELECT tool_use_id,execution_id,entry_id,sequence,tool,tool_category,input,input_summary,result_status,
                       output,error_message,duration_ms,recorded_at_ms
                FROM tool_uses WHERE execution_id=?
                """ + (errorsOnly ? " AND result_status<>'DONE'" : "") + " ORDER BY sequence ASC";
        List<ToolUseRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ToolUseRecord(
                            rs.getString("tool_use_id"),
                            rs.getString("execution_id"),
                            rs.getString("entry_id"),
                            rs.getLong("sequence"),
                            rs.getString("tool"),
                            rs.getString("tool_category"),
                            readNode(rs.getString("input")),
                            rs.getString("input_summary"),
                            ToolResultStatus.valueOf(rs.getString("result_status")),
                            readNode(rs.getString("output")),
                            rs.getString("error_message"),
                            InstanceStore.nullableLong(rs, "duration_ms"),
                            rs.getLong("recorded_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list tool uses for " + executionId, e);
        }
    }

    public List<AssertionRecord> listAssertions(String executionId, AssertionOutcome result) {
        String sql = """
                SELECT assertion_id,execution_id,entry_id,sequence,category,description,result,evidence,chain_id,recorded_at_ms
                FROM assertion_results WHERE execution_id=?
                """ + (result != null ? " AND result=?" : "") + " ORDER BY sequence ASC";
        List<AssertionRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            if (result != null) {
                ps.setString(2, result.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AssertionRecord(
                            rs.getString("assertion_id"),
                            rs.getString("execution_id"),
                            rs.getString("entry_id"),
                            rs.getLong("sequence"),
                            rs.getString("category"),
                            rs.getString("description"),
                            AssertionOutcome.valueOf(rs.getString("result")),
                            readNode(rs.getString("evidence")),
                            rs.getString("chain_id"),
                            rs.getLong("recorded_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list assertions for " + executionId, e);
        }
    }

    public Optional<ExecutionRecord> findExecution(String executionId) {
        String sql = """
                SELECT e.execution_id,e.instance_id,e.task_id,e.started_at_ms,e.completed_at_ms,e.outcome,e.dropped_events,
                       (SELECT COUNT(*) FROM transcript_entries t WHERE t.execution_id=e.execution_id) AS entry_count,
                       (SELECT COALESCE(MAX(sequence),0) FROM transcript_entries t WHERE t.execution_id=e.execution_id) AS last_sequence
                FROM executions e WHERE e.execution_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ExecutionRecord(
                        rs.getString("execution_id"),
                        rs.getString("instance_id"),
                        rs.getString("task_id"),
                        rs.getLong("started_at_ms"),
                        InstanceStore.nullableLong(rs, "completed_at_ms"),
                        rs.getString("outcome"),
                        rs.getLong("dropped_events"),
                        rs.getLong("entry_count"),
                        rs.getLong("last_sequence")
                ));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read execution " + executionId, e);
        }
    }

    /**
     * Adds to the execution's explicit gap counter and returns the new total.
     */
    public long addDroppedEvents(String executionId, long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("dropped count must be positive");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(
                    "UPDATE executions SET dropped_events=dropped_events+? WHERE execution_id=?");
                 PreparedStatement sel = c.prepareStatement(
                         "SELECT dropped_events FROM executions WHERE execution_id=?")) {
                up.setLong(1, count);
                up.setString(2, executionId);
                if (up.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Unknown execution: " + executionId);
                }
                sel.setString(1, executionId);
                long total;
                try (ResultSet rs = sel.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
                c.commit();
                return total;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to record dropped events for " + executionId, e);
        }
    }

    public long countEntries() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM transcript_entries");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count transcript entries", e);
        }
    }

    private void insertToolUse(Connection c, NewEntry entry, String entryId, long sequence, ObjectNode payload, long nowMs)
            throws SQLException {
        String sql = """
                INSERT INTO tool_uses(tool_use_id,execution_id,entry_id,sequence,tool,tool_category,input,input_summary,
                                      result_status,output,error_message,duration_ms,recorded_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        boolean isError = payload.path("isError").asBoolean(false);
        boolean isBlocked = payload.path("isBlocked").asBoolean(false);
        JsonNode input = payload.get("input");
        JsonNode output = payload.get("output");
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, "tu_" + UUID.randomUUID());
            ps.setString(2, entry.executionId());
            ps.setString(3, entryId);
            ps.setLong(4, sequence);
            ps.setString(5, payload.path("tool").asText());
            ps.setString(6, textOr(payload, "toolCategory", entry.category()));
            ps.setString(7, input == null ? null : Jsons.toCompactJson(input));
            ps.setString(8, input == null ? null : truncate(input.isTextual() ? input.asText() : Jsons.toCompactJson(input)));
            ps.setString(9, ToolResultStatus.of(isError, isBlocked).name());
            ps.setString(10, output == null ? null : Jsons.toCompactJson(output));
            ps.setString(11, textOr(payload, "errorMessage", null));
            InstanceStore.setNullableLong(ps, 12, payload.hasNonNull("durationMs") ? payload.get("durationMs").asLong() : null);
            ps.setLong(13, nowMs);
            ps.executeUpdate();
        }
    }

    private void insertAssertion(Connection c, NewEntry entry, String entryId, long sequence, String summary,
                                 ObjectNode payload, long nowMs) throws SQLException {
        String sql = """
                INSERT INTO assertion_results(assertion_id,execution_id,entry_id,sequence,category,description,result,
                                              evidence,chain_id,recorded_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        JsonNode evidence = payload.get("evidence");
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, "as_" + UUID.randomUUID());
            ps.setString(2, entry.executionId());
            ps.setString(3, entryId);
            ps.setLong(4, sequence);
            ps.setString(5, entry.category());
            ps.setString(6, textOr(payload, "description", summary));
            ps.setString(7, AssertionOutcome.fromString(payload.path("result").asText()).name());
            ps.setString(8, evidence == null ? null : Jsons.toCompactJson(evidence));
            ps.setString(9, textOr(payload, "chainId", null));
            ps.setLong(10, nowMs);
            ps.executeUpdate();
        }
    }

    private static void validate(NewEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        requireText(entry.executionId(), "executionId");
        requireText(entry.instanceId(), "instanceId");
        requireText(entry.taskId(), "taskId");
        requireText(entry.category(), "category");
        if (entry.entryType() == null) {
            throw new IllegalArgumentException("entryType must not be null");
        }
        if (entry.summary() == null) {
            throw new IllegalArgumentException("summary must not be null");
        }
        ObjectNode payload = entry.payload();
        if (entry.entryType() == EntryType.TOOL_USE
                && (payload == null || payload.path("tool").asText("").isBlank())) {
            throw new IllegalArgumentException("tool_use payload requires a 'tool' field");
        }
        if (entry.entryType() == EntryType.ASSERTION) {
            if (payload == null || payload.path("result").asText("").isBlank()) {
                throw new IllegalArgumentException("assertion payload requires a 'result' field");
            }
            AssertionOutcome.fromString(payload.path("result").asText());
        }
    }

    private static TranscriptEntry mapEntry(ResultSet rs) throws SQLException {
        return new TranscriptEntry(
                rs.getString("entry_id"),
                rs.getString("execution_id"),
                rs.getString("instance_id"),
                rs.getString("task_id"),
                rs.getLong("sequence"),
                EntryType.valueOf(rs.getString("entry_type")),
                rs.getString("category"),
                rs.getString("summary"),
                Jsons.readObject(rs.getString("payload")),
                rs.getLong("committed_at_ms")
        );
    }

    private static JsonNode readNode(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            return Jsons.mapper().getNodeFactory().textNode(raw);
        }
    }

    private static String textOr(ObjectNode payload, String field, String fallback) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        String text = node.asText();
        return text.isBlank() ? fallback : text;
    }

    static String truncate(String value) {
        if (value == null || value.length() <= SUMMARY_MAX_CHARS) {
            return value;
        }
        return value.substring(0, SUMMARY_MAX_CHARS - 3) + "...";
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    public record NewEntry(
            String executionId,
            String instanceId,
            String taskId,
            EntryType entryType,
            String category,
            String summary,
            ObjectNode payload
    ) {
    }
}
