package io.vigil.liveness;

import io.vigil.config.SupervisorSettings;
import io.vigil.observability.AuditLogger;
import io.vigil.storage.InstanceStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Periodic scan that demotes running instances with no recent heartbeat to
 * {@code terminated/stale_heartbeat}. The OS process is signalled first when it still exists, but
 * the transition happens whatever the signal outcome.
 *
 * <p>Overlapping ticks, or reapers in other processes, are safe: each candidate is terminated by a
 * guarded update keyed on the last-seen time the scan observed, so exactly one of them wins.
 */
public final class LivenessReaper {
    public static final String STALE_REASON = "stale_heartbeat";

    private final InstanceStore store;
    private final ProcessProbe probe;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Supplier<SupervisorSettings> settings;
    private final AtomicLong reapedTotal;
    private final AtomicLong tickFailuresTotal;
    private final AtomicLong probeFailuresTotal;
    private final AtomicInteger consecutiveFailures;
    private volatile boolean alerting;
    private volatile long lastTickAtMs;
    private volatile String lastError;

    public LivenessReaper(InstanceStore store,
                          ProcessProbe probe,
                          AuditLogger auditLogger,
                          Clock clock,
                          Supplier<SupervisorSettings> settings) {
        this.store = store;
        this.probe = probe;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.settings = settings;
        this.reapedTotal = new AtomicLong(0L);
        this.tickFailuresTotal = new AtomicLong(0L);
        this.probeFailuresTotal = new AtomicLong(0L);
        this.consecutiveFailures = new AtomicInteger(0);
        this.alerting = false;
        this.lastTickAtMs = 0L;
        this.lastError = null;
    }

    /**
     * One reaper pass. Store failures do not escape: they are counted and the next tick retries.
     */
    public ReapSummary tick() {
        SupervisorSettings s = settings.get();
        long now = clock.millis();
        lastTickAtMs = now;
        long cutoff = now - s.staleTimeoutMs();
        int scanned = 0;
        int reaped = 0;
        int lostRace = 0;
        int signalled = 0;
        int probeFailures = 0;
        try {
            List<InstanceStore.StaleCandidate> candidates = store.findStaleRunning(cutoff, s.reaperBatchLimit());
            for (InstanceStore.StaleCandidate candidate : candidates) {
                scanned++;
                if (!candidate.matches(store.findInstance(candidate.instanceId()).orElse(null))) {
                    lostRace++;
                    continue;
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("task_id", candidate.taskId());
                details.put("last_seen_ms", candidate.lastSeenMs());
                details.put("silent_for_ms", now - candidate.lastSeenMs());
                details.put("reason", STALE_REASON);
                details.put("pid", candidate.pid());
                boolean alive = false;
                boolean processTerminated = false;
                if (candidate.pid() != null) {
                    try {
                        alive = probe.isAlive(candidate.pid());
                        if (alive) {
                            signalled++;
                            processTerminated = probe.terminate(candidate.pid(), s.processKillGraceMs());
                        }
                    } catch (RuntimeException e) {
                        probeFailures++;
                        probeFailuresTotal.incrementAndGet();
                        details.put("probe_error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                        System.err.println("WARN process probe failed for pid=" + candidate.pid()
                                + " instance=" + candidate.instanceId() + ": " + e.getMessage());
                    }
                }
                details.put("alive", alive);
                details.put("signalled", alive);
                details.put("terminated", processTerminated);
                if (store.terminateIfStillStale(candidate, STALE_REASON, now)) {
                    reaped++;
                    reapedTotal.incrementAndGet();
                    audit("instance.reaped", "ok", candidate.instanceId(), candidate.executionId(), details);
                } else {
                    lostRace++;
                }
            }
        } catch (RuntimeException e) {
            return recordFailure(e, scanned, reaped, lostRace, signalled, probeFailures);
        }
        consecutiveFailures.set(0);
        lastError = null;
        if (alerting) {
            alerting = false;
            audit("reaper.alert_cleared", "ok", null, null, Map.of());
        }
        return new ReapSummary(scanned, reaped, lostRace, signalled, probeFailures, false, 0, false, now);
    }

    public long reapedTotal() {
        return reapedTotal.get();
    }

    public long tickFailuresTotal() {
        return tickFailuresTotal.get();
    }

    public long probeFailuresTotal() {
        return probeFailuresTotal.get();
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public boolean alerting() {
        return alerting;
    }

    public long lastTickAtMs() {
        return lastTickAtMs;
    }

    public String lastError() {
        return lastError;
    }

    private ReapSummary recordFailure(RuntimeException e, int scanned, int reaped, int lostRace, int signalled,
                                      int probeFailures) {
        tickFailuresTotal.incrementAndGet();
        int failures = consecutiveFailures.incrementAndGet();
        lastError = e.getMessage();
        System.err.println("WARN reaper tick failed (" + failures + " consecutive): " + e.getMessage());
        int threshold = settings.get().reaperAlertAfterFailures();
        if (failures >= threshold && !alerting) {
            alerting = true;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("consecutive_failures", failures);
            details.put("threshold", threshold);
            details.put("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            try {
                audit("reaper.alert", "raised", null, null, details);
            } catch (RuntimeException auditError) {
                System.err.println("WARN failed to audit reaper alert: " + auditError.getMessage());
            }
        }
        return new ReapSummary(scanned, reaped, lostRace, signalled, probeFailures, true, failures, alerting, lastTickAtMs);
    }

    private void audit(String action, String result, String instanceId, String executionId, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                "reaper",
                instanceId == null ? "reaper" : "instances/" + instanceId,
                result,
                instanceId,
                executionId,
                details
        ));
    }

    public record ReapSummary(
            int scanned,
            int reaped,
            int lostRace,
            int signalled,
            int probeFailures,
            boolean failed,
            int consecutiveFailures,
            boolean alerting,
            long tickAtMs
    ) {
    }
}
