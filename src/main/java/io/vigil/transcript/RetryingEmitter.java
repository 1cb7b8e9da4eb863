package io.vigil.transcript;

import io.vigil.config.SupervisorSettings;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.error.StoreUnavailableException;
import io.vigil.model.EmitReceipt;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Worker-side wrapper around {@link TranscriptEmitter}. Transient store failures are retried with
 * exponential backoff; once retries run out the event waits in a bounded local backlog instead of
 * being dropped. Events that do not fit in the backlog are counted per execution and reported as
 * dropped on the next successful flush.
 */
public final class RetryingEmitter {
    private final TranscriptEmitter delegate;
    private final Supplier<SupervisorSettings> settings;
    private final Sleeper sleeper;
    private final Deque<EmitRequest> backlog;
    private final Map<String, Long> overflowByExecution;

    public RetryingEmitter(TranscriptEmitter delegate, Supplier<SupervisorSettings> settings, Sleeper sleeper) {
        this.delegate = delegate;
        this.settings = settings;
        this.sleeper = sleeper == null ? Thread::sleep : sleeper;
        this.backlog = new ArrayDeque<>();
        this.overflowByExecution = new LinkedHashMap<>();
    }

    /**
     * Emits with retries. Queued events keep their order: while the backlog is not empty, new
     * events go behind it.
     */
    public synchronized EmitResult emit(EmitRequest request) throws InterruptedException {
        if (!backlog.isEmpty()) {
            flush();
            if (!backlog.isEmpty()) {
                enqueue(request);
                return new EmitResult(EmitStatus.QUEUED, null, backlog.size());
            }
        }
        SupervisorSettings s = settings.get();
        int maxAttempts = s.storeRetryMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                EmitReceipt receipt = delegate.emit(request);
                return new EmitResult(EmitStatus.COMMITTED, receipt, backlog.size());
            } catch (InstanceTerminatedException e) {
                return new EmitResult(EmitStatus.REJECTED_TERMINATED, null, backlog.size());
            } catch (StoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    enqueue(request);
                    return new EmitResult(EmitStatus.QUEUED, null, backlog.size());
                }
                sleeper.sleep(computeBackoffMs(attempt, s.storeRetryBaseBackoffMs(), s.storeRetryMaxBackoffMs()));
            }
        }
    }

    /**
     * Re-emits the backlog in order, stopping at the first store failure. Events whose instance has
     * since terminated, or that the store rejects as invalid, are discarded.
     */
    public synchronized FlushResult flush() {
        int committed = 0;
        int discarded = 0;
        while (!backlog.isEmpty()) {
            EmitRequest head = backlog.peekFirst();
            try {
                delegate.emit(head);
                committed++;
            } catch (InstanceTerminatedException | IllegalArgumentException e) {
                discarded++;
            } catch (StoreUnavailableException e) {
                return new FlushResult(committed, discarded, backlog.size(), false);
            }
            backlog.pollFirst();
        }
        if (!overflowByExecution.isEmpty()) {
            for (Map.Entry<String, Long> e : Map.copyOf(overflowByExecution).entrySet()) {
                try {
                    delegate.reportDroppedEvents(e.getKey(), e.getValue());
                    overflowByExecution.remove(e.getKey());
                } catch (StoreUnavailableException ex) {
                    return new FlushResult(committed, discarded, backlog.size(), false);
                }
            }
        }
        return new FlushResult(committed, discarded, 0, true);
    }

    public synchronized int backlogSize() {
        return backlog.size();
    }

    public synchronized long pendingDroppedCount() {
        long total = 0L;
        for (long v : overflowByExecution.values()) {
            total += v;
        }
        return total;
    }

    private void enqueue(EmitRequest request) {
        if (backlog.size() >= settings.get().localBacklogCapacity()) {
            overflowByExecution.merge(request.executionId(), 1L, Long::sum);
            return;
        }
        backlog.addLast(request);
    }

    static long computeBackoffMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public enum EmitStatus {
        COMMITTED,
        QUEUED,
        REJECTED_TERMINATED
    }

    public record EmitResult(EmitStatus status, EmitReceipt receipt, int backlogSize) {
    }

    public record FlushResult(int committed, int discarded, int remaining, boolean drained) {
    }
}
