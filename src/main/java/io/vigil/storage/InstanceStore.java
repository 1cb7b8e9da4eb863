package io.vigil.storage;

import io.vigil.error.ConflictingTransitionException;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.error.InvalidTransitionException;
import io.vigil.error.StoreUnavailableException;
import io.vigil.model.AgentInstance;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Authoritative lifecycle state for agent instances and their executions.
 *
 * <p>Every status change is a guarded {@code UPDATE ... WHERE status=?}. A zero update count means
 * another writer moved the row first; the method then re-reads the winner and resolves against it.
 */
public final class InstanceStore {
    private static final String INSTANCE_COLUMNS = """
            instance_id,task_id,task_list_id,execution_id,status,pid,created_at_ms,started_at_ms,
            last_heartbeat_at_ms,terminated_at_ms,termination_reason,archived
            """;
    private static final int MAX_CAS_ROUNDS = 8;

    private final Database database;

    public InstanceStore(Database database) {
        this.database = database;
    }

    public InstanceHandle createInstance(String taskId, String taskListId, Long pid, long nowMs) {
        requireText(taskId, "taskId");
        requireText(taskListId, "taskListId");
        String instanceId = "ins_" + UUID.randomUUID();
        String executionId = "exe_" + UUID.randomUUID();
        String insertInstance = """
                INSERT INTO instances(instance_id,task_id,task_list_id,execution_id,status,pid,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """;
        String insertExecution = "INSERT INTO executions(execution_id,instance_id,task_id,started_at_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(insertInstance);
                 PreparedStatement exe = c.prepareStatement(insertExecution)) {
                ins.setString(1, instanceId);
                ins.setString(2, taskId.trim());
                ins.setString(3, taskListId.trim());
                ins.setString(4, executionId);
                ins.setString(5, InstanceStatus.PENDING.name());
                setNullableLong(ins, 6, pid);
                ins.setLong(7, nowMs);
                ins.setLong(8, nowMs);
                ins.executeUpdate();

                exe.setString(1, executionId);
                exe.setString(2, instanceId);
                exe.setString(3, taskId.trim());
                exe.setLong(4, nowMs);
                exe.executeUpdate();
                c.commit();
                return new InstanceHandle(instanceId, executionId, taskId.trim(), nowMs);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to create instance for task " + taskId, e);
        }
    }

    public Optional<AgentInstance> findInstance(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return Optional.empty();
        }
        try (Connection c = database.openConnection()) {
            return readInstance(c, instanceId.trim());
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read instance " + instanceId, e);
        }
    }

    /**
     * Records the OS process handle of a spawned worker. Allowed until the instance is terminal.
     */
    public AgentInstance attachProcess(String instanceId, long pid, long nowMs) {
        if (pid <= 0) {
            throw new IllegalArgumentException("pid must be positive");
        }
        String update = "UPDATE instances SET pid=?,updated_at_ms=? WHERE instance_id=? AND status IN (?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update)) {
                AgentInstance current = requireInstance(c, instanceId);
                if (current.status().isTerminal()) {
                    throw new InstanceTerminatedException(current.instanceId(), current.status());
                }
                ps.setLong(1, pid);
                ps.setLong(2, nowMs);
                ps.setString(3, current.instanceId());
                ps.setString(4, InstanceStatus.PENDING.name());
                ps.setString(5, InstanceStatus.RUNNING.name());
                ps.executeUpdate();
                AgentInstance updated = requireInstance(c, current.instanceId());
                c.commit();
                return updated;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to attach process to " + instanceId, e);
        }
    }

    public TransitionResult markRunning(String instanceId, long nowMs) {
        String update = "UPDATE instances SET status=?,started_at_ms=?,updated_at_ms=? WHERE instance_id=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update)) {
                for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
                    AgentInstance current = requireInstance(c, instanceId);
                    if (current.status() != InstanceStatus.PENDING) {
                        throw new InvalidTransitionException(current.instanceId(), current.status(), InstanceStatus.RUNNING);
                    }
                    ps.setString(1, InstanceStatus.RUNNING.name());
                    ps.setLong(2, nowMs);
                    ps.setLong(3, nowMs);
                    ps.setString(4, current.instanceId());
                    ps.setString(5, InstanceStatus.PENDING.name());
                    if (ps.executeUpdate() == 1) {
                        c.commit();
                        return new TransitionResult(
                                current.instanceId(),
                                InstanceStatus.PENDING,
                                InstanceStatus.RUNNING,
                                null,
                                TransitionOutcome.APPLIED
                        );
                    }
                }
                throw new IllegalStateException("markRunning did not converge for " + instanceId);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to mark running: " + instanceId, e);
        }
    }

    /**
     * Applies a liveness signal. A pending instance is promoted to running; a running instance
     * only moves its heartbeat forward.
     */
    public HeartbeatOutcome recordHeartbeat(String instanceId, long heartbeatMs, long nowMs) {
        String start = """
                UPDATE instances SET status=?,started_at_ms=?,last_heartbeat_at_ms=?,updated_at_ms=?
                WHERE instance_id=? AND status=?
                """;
        String advance = """
                UPDATE instances SET last_heartbeat_at_ms=?,updated_at_ms=?
                WHERE instance_id=? AND status=? AND (last_heartbeat_at_ms IS NULL OR last_heartbeat_at_ms<?)
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psStart = c.prepareStatement(start);
                 PreparedStatement psAdvance = c.prepareStatement(advance)) {
                for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
                    AgentInstance current = requireInstance(c, instanceId);
                    InstanceStatus status = current.status();
                    if (status.isTerminal()) {
                        throw new InstanceTerminatedException(current.instanceId(), status);
                    }
                    if (status == InstanceStatus.PENDING) {
                        psStart.setString(1, InstanceStatus.RUNNING.name());
                        psStart.setLong(2, nowMs);
                        psStart.setLong(3, heartbeatMs);
                        psStart.setLong(4, nowMs);
                        psStart.setString(5, current.instanceId());
                        psStart.setString(6, InstanceStatus.PENDING.name());
                        if (psStart.executeUpdate() == 1) {
                            c.commit();
                            return new HeartbeatOutcome(
                                    current.instanceId(),
                                    HeartbeatResult.STARTED,
                                    InstanceStatus.PENDING,
                                    InstanceStatus.RUNNING,
                                    heartbeatMs
                            );
                        }
                        continue;
                    }
                    Long last = current.lastHeartbeatAtMs();
                    if (last != null && heartbeatMs <= last) {
                        c.commit();
                        return new HeartbeatOutcome(
                                current.instanceId(),
                                HeartbeatResult.IGNORED_NOT_NEWER,
                                status,
                                status,
                                last
                        );
                    }
                    psAdvance.setLong(1, heartbeatMs);
                    psAdvance.setLong(2, nowMs);
                    psAdvance.setString(3, current.instanceId());
                    psAdvance.setString(4, InstanceStatus.RUNNING.name());
                    psAdvance.setLong(5, heartbeatMs);
                    if (psAdvance.executeUpdate() == 1) {
                        c.commit();
                        return new HeartbeatOutcome(
                                current.instanceId(),
                                HeartbeatResult.ADVANCED,
                                status,
                                status,
                                heartbeatMs
                        );
                    }
                }
                throw new IllegalStateException("heartbeat did not converge for " + instanceId);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed heartbeat: " + instanceId, e);
        }
    }

    /**
     * Moves a running instance to a terminal status and closes its execution in the same transaction.
     *
     * <p>Repeating the exact stored terminal value is a no-op. Any other value on a terminal row is
     * recorded in {@code transition_conflicts} and rejected.
     */
    public TransitionResult markTerminal(String instanceId, InstanceStatus status, String reason, long nowMs, String source) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal: " + status);
        }
        String normalizedReason = normalizeReason(status, reason);
        String update = """
                UPDATE instances SET status=?,terminated_at_ms=?,termination_reason=?,updated_at_ms=?
                WHERE instance_id=? AND status=?
                """;
        String closeExecution = "UPDATE executions SET completed_at_ms=?,outcome=? WHERE instance_id=? AND completed_at_ms IS NULL";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update);
                 PreparedStatement exe = c.prepareStatement(closeExecution)) {
                for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
                    AgentInstance current = requireInstance(c, instanceId);
                    if (current.status() == InstanceStatus.PENDING) {
                        throw new InvalidTransitionException(current.instanceId(), current.status(), status);
                    }
                    if (current.status().isTerminal()) {
                        if (current.status() == status && Objects.equals(current.terminationReason(), normalizedReason)) {
                            c.commit();
                            return new TransitionResult(
                                    current.instanceId(),
                                    current.status(),
                                    current.status(),
                                    current.terminationReason(),
                                    TransitionOutcome.ALREADY_APPLIED
                            );
                        }
                        recordConflict(c, current, status, normalizedReason, source, nowMs);
                        c.commit();
                        throw new ConflictingTransitionException(
                                current.instanceId(),
                                current.status(),
                                current.terminationReason(),
                                status,
                                normalizedReason
                        );
                    }
                    ps.setString(1, status.name());
                    ps.setLong(2, nowMs);
                    ps.setString(3, normalizedReason);
                    ps.setLong(4, nowMs);
                    ps.setString(5, current.instanceId());
                    ps.setString(6, InstanceStatus.RUNNING.name());
                    if (ps.executeUpdate() == 1) {
                        exe.setLong(1, nowMs);
                        exe.setString(2, status.wireName());
                        exe.setString(3, current.instanceId());
                        exe.executeUpdate();
                        c.commit();
                        return new TransitionResult(
                                current.instanceId(),
                                InstanceStatus.RUNNING,
                                status,
                                normalizedReason,
                                TransitionOutcome.APPLIED
                        );
                    }
                }
                throw new IllegalStateException("markTerminal did not converge for " + instanceId);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed terminal transition: " + instanceId, e);
        }
    }

    /**
     * Running instances whose last sign of life (heartbeat, or start time before the first
     * heartbeat) is strictly older than {@code cutoffMs}.
     */
    public List<StaleCandidate> findStaleRunning(long cutoffMs, int limit) {
        String sql = """
                SELECT instance_id,task_id,execution_id,pid,COALESCE(last_heartbeat_at_ms,started_at_ms,created_at_ms) AS last_seen_ms
                FROM instances
                WHERE status=? AND COALESCE(last_heartbeat_at_ms,started_at_ms,created_at_ms)<?
                ORDER BY last_seen_ms ASC
                LIMIT ?
                """;
        List<StaleCandidate> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, InstanceStatus.RUNNING.name());
            ps.setLong(2, cutoffMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StaleCandidate(
                            rs.getString("instance_id"),
                            rs.getString("task_id"),
                            rs.getString("execution_id"),
                            nullableLong(rs, "pid"),
                            rs.getLong("last_seen_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed stale instance scan", e);
        }
    }

    /**
     * Terminates a stale candidate only if it is still running with the exact last-seen value the
     * scan observed. Returns false when a heartbeat or another reaper got there first.
     */
    public boolean terminateIfStillStale(StaleCandidate candidate, String reason, long nowMs) {
        String update = """
                UPDATE instances SET status=?,terminated_at_ms=?,termination_reason=?,updated_at_ms=?
                WHERE instance_id=? AND status=? AND COALESCE(last_heartbeat_at_ms,started_at_ms,created_at_ms)=?
                """;
        String closeExecution = "UPDATE executions SET completed_at_ms=?,outcome=? WHERE instance_id=? AND completed_at_ms IS NULL";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(update);
                 PreparedStatement exe = c.prepareStatement(closeExecution)) {
                ps.setString(1, InstanceStatus.TERMINATED.name());
                ps.setLong(2, nowMs);
                ps.setString(3, reason);
                ps.setLong(4, nowMs);
                ps.setString(5, candidate.instanceId());
                ps.setString(6, InstanceStatus.RUNNING.name());
                ps.setLong(7, candidate.lastSeenMs());
                if (ps.executeUpdate() == 0) {
                    c.commit();
                    return false;
                }
                exe.setLong(1, nowMs);
                exe.setString(2, InstanceStatus.TERMINATED.wireName());
                exe.setString(3, candidate.instanceId());
                exe.executeUpdate();
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed stale termination: " + candidate.instanceId(), e);
        }
    }

    public List<AgentInstance> listInstances(InstanceFilter filter, long staleCutoffMs) {
        InstanceFilter f = filter == null ? InstanceFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT ").append(INSTANCE_COLUMNS).append(" FROM instances WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (!f.includeArchived()) {
            sql.append(" AND archived=0");
        }
        if (f.status() != null) {
            sql.append(" AND status=?");
            args.add(f.status().name());
        }
        if (f.taskListId() != null && !f.taskListId().isBlank()) {
            sql.append(" AND task_list_id=?");
            args.add(f.taskListId().trim());
        }
        if (f.taskId() != null && !f.taskId().isBlank()) {
            sql.append(" AND task_id=?");
            args.add(f.taskId().trim());
        }
        if (f.staleOnly()) {
            sql.append(" AND status=? AND COALESCE(last_heartbeat_at_ms,started_at_ms,created_at_ms)<?");
            args.add(InstanceStatus.RUNNING.name());
            args.add(staleCutoffMs);
        }
        sql.append(" ORDER BY created_at_ms DESC, instance_id ASC LIMIT ?");
        args.add(f.limit() <= 0 ? 500 : f.limit());

        List<AgentInstance> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                Object arg = args.get(i);
                if (arg instanceof Long l) {
                    ps.setLong(i + 1, l);
                } else if (arg instanceof Integer n) {
                    ps.setInt(i + 1, n);
                } else {
                    ps.setString(i + 1, String.valueOf(arg));
                }
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapInstance(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list instances", e);
        }
    }

    public Map<String, Integer> countByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (InstanceStatus status : InstanceStatus.values()) {
            out.put(status.wireName(), 0);
        }
        String sql = "SELECT status, COUNT(*) AS n FROM instances GROUP BY status";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(InstanceStatus.fromString(rs.getString("status")).wireName(), rs.getInt("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count instances", e);
        }
    }

    public int countStaleRunning(long cutoffMs) {
        String sql = "SELECT COUNT(*) FROM instances WHERE status=? AND COALESCE(last_heartbeat_at_ms,started_at_ms,created_at_ms)<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, InstanceStatus.RUNNING.name());
            ps.setLong(2, cutoffMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count stale instances", e);
        }
    }

    /**
     * Flags terminal instances older than the cutoff as archived. Rows are kept; they only drop
     * out of default listings.
     */
    public int archiveTerminalBefore(long cutoffMs, long nowMs) {
        String sql = """
                UPDATE instances SET archived=1,updated_at_ms=?
                WHERE archived=0 AND status IN (?,?,?) AND terminated_at_ms IS NOT NULL AND terminated_at_ms<?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, InstanceStatus.COMPLETED.name());
            ps.setString(3, InstanceStatus.FAILED.name());
            ps.setString(4, InstanceStatus.TERMINATED.name());
            ps.setLong(5, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to archive instances", e);
        }
    }

    public long countTransitionConflicts() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM transition_conflicts");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to count transition conflicts", e);
        }
    }

    private void recordConflict(Connection c,
                                AgentInstance current,
                                InstanceStatus attemptedStatus,
                                String attemptedReason,
                                String source,
                                long nowMs) throws SQLException {
        String sql = """
                INSERT INTO transition_conflicts(instance_id,source,stored_status,stored_reason,attempted_status,attempted_reason,occurred_at_ms)
                VALUES(?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, current.instanceId());
            ps.setString(2, source == null || source.isBlank() ? "unknown" : source);
            ps.setString(3, current.status().name());
            ps.setString(4, current.terminationReason());
            ps.setString(5, attemptedStatus.name());
            ps.setString(6, attemptedReason);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        }
    }

    private AgentInstance requireInstance(Connection c, String instanceId) throws SQLException {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be blank");
        }
        return readInstance(c, instanceId.trim())
                .orElseThrow(() -> new IllegalArgumentException("Unknown instance: " + instanceId));
    }

    private Optional<AgentInstance> readInstance(Connection c, String instanceId) throws SQLException {
        String sql = "SELECT " + INSTANCE_COLUMNS + " FROM instances WHERE instance_id=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapInstance(rs));
            }
        }
    }

    private static AgentInstance mapInstance(ResultSet rs) throws SQLException {
        return new AgentInstance(
                rs.getString("instance_id"),
                rs.getString("task_id"),
                rs.getString("task_list_id"),
                rs.getString("execution_id"),
                InstanceStatus.fromString(rs.getString("status")),
                nullableLong(rs, "pid"),
                rs.getLong("created_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "last_heartbeat_at_ms"),
                nullableLong(rs, "terminated_at_ms"),
                rs.getString("termination_reason"),
                rs.getInt("archived") == 1
        );
    }

    private static String normalizeReason(InstanceStatus status, String reason) {
        if (status == InstanceStatus.COMPLETED) {
            return null;
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("terminationReason is required for " + status.wireName());
        }
        return reason.trim();
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    public enum TransitionOutcome {
        APPLIED,
        ALREADY_APPLIED
    }

    public enum HeartbeatResult {
        STARTED,
        ADVANCED,
        IGNORED_NOT_NEWER
    }

    public record TransitionResult(
            String instanceId,
            InstanceStatus previousStatus,
            InstanceStatus currentStatus,
            String terminationReason,
            TransitionOutcome outcome
    ) {
    }

    public record HeartbeatOutcome(
            String instanceId,
            HeartbeatResult result,
            InstanceStatus previousStatus,
            InstanceStatus currentStatus,
            long lastHeartbeatAtMs
    ) {
        public boolean accepted() {
            return result != HeartbeatResult.IGNORED_NOT_NEWER;
        }
    }

    public record StaleCandidate(String instanceId, String taskId, String executionId, Long pid, long lastSeenMs) {

        /**
         * True while the instance is still running with the last-seen time this candidate was
         * scanned with.
         */
        public boolean matches(AgentInstance current) {
            if (current == null || current.status() != InstanceStatus.RUNNING) {
                return false;
            }
            Long seen = current.lastHeartbeatAtMs() != null ? current.lastHeartbeatAtMs() : current.startedAtMs();
            return (seen == null ? current.createdAtMs() : seen) == lastSeenMs;
        }
    }
}
