package io.vigil.query;

import io.vigil.config.SupervisorSettings;
import io.vigil.model.AgentInstance;
import io.vigil.model.AssertionOutcome;
import io.vigil.model.AssertionRecord;
import io.vigil.model.EffectiveStatus;
import io.vigil.model.ExecutionRecord;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceStatus;
import io.vigil.model.ToolUseRecord;
import io.vigil.model.TranscriptEntry;
import io.vigil.storage.InstanceStore;
import io.vigil.storage.TranscriptStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read path for every consumer. Staleness is computed at read time from the stored heartbeat, so
 * a dead worker shows as stale before the reaper has run.
 */
public final class ReconciledStateQuery {
    private final InstanceStore instanceStore;
    private final TranscriptStore transcriptStore;
    private final Clock clock;
    private final Supplier<SupervisorSettings> settings;

    public ReconciledStateQuery(InstanceStore instanceStore,
                                TranscriptStore transcriptStore,
                                Clock clock,
                                Supplier<SupervisorSettings> settings) {
        this.instanceStore = instanceStore;
        this.transcriptStore = transcriptStore;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Never throws for an unknown id: the result has {@code found=false} instead.
     */
    public EffectiveStatus effectiveStatus(String instanceId) {
        Optional<AgentInstance> instance = instanceStore.findInstance(instanceId);
        if (instance.isEmpty()) {
            return EffectiveStatus.notFound(instanceId);
        }
        return reconcile(instance.get(), clock.millis(), settings.get().staleTimeoutMs());
    }

    public List<EffectiveStatus> listInstances(InstanceFilter filter) {
        long now = clock.millis();
        long timeout = settings.get().staleTimeoutMs();
        List<AgentInstance> rows = instanceStore.listInstances(filter, now - timeout);
        List<EffectiveStatus> out = new ArrayList<>(rows.size());
        for (AgentInstance row : rows) {
            out.add(reconcile(row, now, timeout));
        }
        return out;
    }

    public TranscriptPage getTranscript(String executionId, long fromSequence, int limit) {
        Optional<ExecutionRecord> execution = transcriptStore.findExecution(executionId);
        if (execution.isEmpty()) {
            return new TranscriptPage(false, executionId, List.of(), 0L, 0L);
        }
        List<TranscriptEntry> entries = transcriptStore.readTranscript(executionId, fromSequence, limit);
        return new TranscriptPage(
                true,
                executionId,
                entries,
                execution.get().lastSequence(),
                execution.get().droppedEvents()
        );
    }

    public Optional<ExecutionRecord> getExecution(String executionId) {
        return transcriptStore.findExecution(executionId);
    }

    public List<ToolUseRecord> listToolUses(String executionId, boolean errorsOnly) {
        return transcriptStore.listToolUses(executionId, errorsOnly);
    }

    public List<AssertionRecord> listAssertions(String executionId, AssertionOutcome result) {
        return transcriptStore.listAssertions(executionId, result);
    }

    /**
     * Reconciled counts for dashboards: running instances are split into live and stale.
     */
    public StatusSummary summary() {
        long now = clock.millis();
        long timeout = settings.get().staleTimeoutMs();
        Map<String, Integer> counts = instanceStore.countByStatus();
        int stale = instanceStore.countStaleRunning(now - timeout);
        int running = counts.getOrDefault(InstanceStatus.RUNNING.wireName(), 0);
        return new StatusSummary(
                counts.getOrDefault(InstanceStatus.PENDING.wireName(), 0),
                running - stale,
                stale,
                counts.getOrDefault(InstanceStatus.COMPLETED.wireName(), 0),
                counts.getOrDefault(InstanceStatus.FAILED.wireName(), 0),
                counts.getOrDefault(InstanceStatus.TERMINATED.wireName(), 0),
                timeout,
                now
        );
    }

    static EffectiveStatus reconcile(AgentInstance instance, long nowMs, long staleTimeoutMs) {
        Long lastSeen = instance.lastHeartbeatAtMs() != null
                ? instance.lastHeartbeatAtMs()
                : instance.startedAtMs();
        Long ago = lastSeen == null ? null : Math.max(0L, nowMs - lastSeen);
        boolean stale = instance.status() == InstanceStatus.RUNNING
                && nowMs - (lastSeen == null ? instance.createdAtMs() : lastSeen) > staleTimeoutMs;
        return new EffectiveStatus(
                true,
                instance.instanceId(),
                instance.status(),
                stale,
                ago,
                instance.terminationReason(),
                instance.taskId(),
                instance.taskListId(),
                instance.executionId(),
                instance.archived()
        );
    }

    public record TranscriptPage(
            boolean found,
            String executionId,
            List<TranscriptEntry> entries,
            long lastSequence,
            long droppedEvents
    ) {
    }

    public record StatusSummary(
            int pending,
            int runningLive,
            int runningStale,
            int completed,
            int failed,
            int terminated,
            long staleTimeoutMs,
            long generatedAtMs
    ) {
    }
}
