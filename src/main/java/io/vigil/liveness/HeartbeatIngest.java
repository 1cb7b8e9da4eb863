package io.vigil.liveness;

import io.vigil.config.SupervisorSettings;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.observability.AuditLogger;
import io.vigil.storage.InstanceStore;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * The only way an instance reports that it is alive. The first heartbeat of a pending instance
 * promotes it to running; later heartbeats only move {@code lastHeartbeatAt} forward. A reported
 * time more than one heartbeat interval ahead of the supervisor clock is rejected, since it would
 * keep the instance from ever looking stale.
 */
public final class HeartbeatIngest {
    private final InstanceStore store;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Supplier<SupervisorSettings> settings;
    private final AtomicLong accepted;
    private final AtomicLong ignored;
    private final AtomicLong rejectedTerminal;

    public HeartbeatIngest(InstanceStore store,
                           AuditLogger auditLogger,
                           Clock clock,
                           Supplier<SupervisorSettings> settings) {
        this.store = store;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.settings = settings;
        this.accepted = new AtomicLong(0L);
        this.ignored = new AtomicLong(0L);
        this.rejectedTerminal = new AtomicLong(0L);
    }

    public InstanceStore.HeartbeatOutcome heartbeat(String instanceId) {
        return heartbeat(instanceId, null);
    }

    /**
     * @param timestampMs worker-reported time of the heartbeat; null means "now"
     * @throws InstanceTerminatedException if the instance is already terminal
     * @throws IllegalArgumentException if the timestamp is too far ahead of the supervisor clock
     */
    public InstanceStore.HeartbeatOutcome heartbeat(String instanceId, Long timestampMs) {
        long now = clock.millis();
        long ts = timestampMs == null ? now : timestampMs;
        long maxAhead = settings.get().heartbeatIntervalMs();
        if (ts > now + maxAhead) {
            System.err.println("WARN rejected heartbeat for instance=" + instanceId + ": timestamp " + ts
                    + " is " + (ts - now) + "ms ahead of the supervisor clock");
            throw new IllegalArgumentException("heartbeat timestamp " + ts + " is more than " + maxAhead
                    + "ms ahead of the supervisor clock (" + now + ")");
        }
        InstanceStore.HeartbeatOutcome outcome;
        try {
            outcome = store.recordHeartbeat(instanceId, ts, now);
        } catch (InstanceTerminatedException e) {
            rejectedTerminal.incrementAndGet();
            throw e;
        }
        if (outcome.result() == InstanceStore.HeartbeatResult.IGNORED_NOT_NEWER) {
            ignored.incrementAndGet();
        } else {
            accepted.incrementAndGet();
        }
        if (outcome.result() == InstanceStore.HeartbeatResult.STARTED && auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "instance.running",
                    "heartbeat",
                    "instances/" + outcome.instanceId(),
                    "ok",
                    outcome.instanceId(),
                    null,
                    Map.of("heartbeat_at_ms", ts)
            ));
        }
        return outcome;
    }

    public long acceptedTotal() {
        return accepted.get();
    }

    public long ignoredTotal() {
        return ignored.get();
    }

    public long rejectedTerminalTotal() {
        return rejectedTerminal.get();
    }
}
