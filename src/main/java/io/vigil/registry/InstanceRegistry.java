package io.vigil.registry;

import io.vigil.error.ConflictingTransitionException;
import io.vigil.model.AgentInstance;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;
import io.vigil.observability.AuditLogger;
import io.vigil.storage.InstanceStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle entry points for the orchestrator and workers. All state changes go through
 * {@link InstanceStore}'s compare-and-swap updates; this layer stamps time and audits.
 */
public final class InstanceRegistry {
    private final InstanceStore store;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public InstanceRegistry(InstanceStore store, AuditLogger auditLogger, Clock clock) {
        this.store = store;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public InstanceHandle createInstance(String taskId, String taskListId, Long pid) {
        InstanceHandle handle = store.createInstance(taskId, taskListId, pid, clock.millis());
        audit("instance.create", "orchestrator", handle.instanceId(), handle.executionId(), "ok", Map.of(
                "task_id", handle.taskId(),
                "task_list_id", taskListId.trim()
        ));
        return handle;
    }

    public AgentInstance attachProcess(String instanceId, long pid) {
        AgentInstance updated = store.attachProcess(instanceId, pid, clock.millis());
        audit("instance.attach_process", "orchestrator", updated.instanceId(), updated.executionId(), "ok",
                Map.of("pid", pid));
        return updated;
    }

    public InstanceStore.TransitionResult markRunning(String instanceId) {
        InstanceStore.TransitionResult result = store.markRunning(instanceId, clock.millis());
        audit("instance.running", "worker", result.instanceId(), null, "ok", Map.of());
        return result;
    }

    /**
     * Moves a running instance to completed, failed or terminated. Repeating the stored value is a
     * no-op; a different value on a terminal instance raises {@link ConflictingTransitionException}.
     */
    public InstanceStore.TransitionResult markTerminal(String instanceId, InstanceStatus status, String reason, String actor) {
        String source = actor == null || actor.isBlank() ? "worker" : actor.trim();
        try {
            InstanceStore.TransitionResult result = store.markTerminal(instanceId, status, reason, clock.millis(), source);
            if (result.outcome() == InstanceStore.TransitionOutcome.APPLIED) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("status", status.wireName());
                if (result.terminationReason() != null) {
                    details.put("reason", result.terminationReason());
                }
                audit("instance.terminal", source, result.instanceId(), null, "ok", details);
            }
            return result;
        } catch (ConflictingTransitionException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stored_status", e.storedStatus().wireName());
            details.put("stored_reason", e.storedReason() == null ? "" : e.storedReason());
            details.put("attempted_status", e.attemptedStatus().wireName());
            details.put("attempted_reason", e.attemptedReason() == null ? "" : e.attemptedReason());
            audit("instance.terminal", source, e.instanceId(), null, "conflict", details);
            throw e;
        }
    }

    public Optional<AgentInstance> findInstance(String instanceId) {
        return store.findInstance(instanceId);
    }

    /**
     * Archives terminal instances whose termination is older than {@code retentionMs}.
     */
    public int archiveTerminal(long retentionMs) {
        long now = clock.millis();
        int archived = store.archiveTerminalBefore(now - Math.max(0L, retentionMs), now);
        if (archived > 0) {
            audit("instance.archive", "system", null, null, "ok", Map.of(
                    "archived", archived,
                    "retention_ms", retentionMs
            ));
        }
        return archived;
    }

    private void audit(String action, String actor, String instanceId, String executionId, String result,
                       Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                actor,
                instanceId == null ? "instances" : "instances/" + instanceId,
                result,
                instanceId,
                executionId,
                details
        ));
    }
}
