package io.vigil.transcript;

import io.vigil.model.EmitReceipt;
import io.vigil.model.TranscriptEntry;
import io.vigil.storage.TranscriptStore;
import io.vigil.stream.TranscriptFanout;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The only write path for telemetry. Callers never pick a sequence or a table: the emitter
 * serializes writers per execution, appends through {@link TranscriptStore}, then hands the
 * committed entry to the fan-out before releasing the execution's lock.
 */
public final class TranscriptEmitter {
    private static final int LOCK_STRIPES = 64;

    private final TranscriptStore store;
    private final TranscriptFanout fanout;
    private final Clock clock;
    private final Object[] locks;
    private final AtomicLong emittedTotal;

    public TranscriptEmitter(TranscriptStore store, TranscriptFanout fanout, Clock clock) {
        this.store = store;
        this.fanout = fanout;
        this.clock = clock;
        this.locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        this.emittedTotal = new AtomicLong(0L);
    }

    /**
     * Durably appends one entry and returns its assigned sequence.
     *
     * @throws io.vigil.error.InstanceTerminatedException if the owning instance is terminal
     * @throws io.vigil.error.StoreUnavailableException if the store did not answer in time
     */
    public EmitReceipt emit(EmitRequest request) {
        if (request == null || request.executionId() == null || request.executionId().isBlank()) {
            throw new IllegalArgumentException("executionId must not be blank");
        }
        TranscriptStore.NewEntry entry = new TranscriptStore.NewEntry(
                request.executionId().trim(),
                request.instanceId() == null ? null : request.instanceId().trim(),
                request.taskId() == null ? null : request.taskId().trim(),
                request.entryType(),
                request.category(),
                request.summary(),
                request.payload()
        );
        synchronized (lockFor(entry.executionId())) {
            TranscriptEntry committed = store.append(entry, clock.millis());
            emittedTotal.incrementAndGet();
            if (fanout != null) {
                fanout.publish(committed);
            }
            return new EmitReceipt(committed.entryId(), committed.executionId(), committed.sequence(), committed.committedAtMs());
        }
    }

    /**
     * Records that the caller lost {@code count} events for the execution. The transcript read
     * path reports this counter so consumers see the gap explicitly.
     */
    public long reportDroppedEvents(String executionId, long count) {
        return store.addDroppedEvents(executionId, count);
    }

    public long emittedTotal() {
        return emittedTotal.get();
    }

    private Object lockFor(String executionId) {
        return locks[Math.floorMod(executionId.hashCode(), LOCK_STRIPES)];
    }
}
