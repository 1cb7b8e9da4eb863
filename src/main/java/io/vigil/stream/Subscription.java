package io.vigil.stream;

import io.vigil.model.TranscriptEntry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * A single consumer's view of the transcript stream.
 *
 * <p>With a replay source the subscription first pages committed entries out of the store, then
 * switches to the live queue. Live entries are buffered from the moment of subscription, and any
 * entry already delivered by replay is skipped, so the seam neither loses nor repeats entries.
 *
 * <p>{@link #poll} is meant for one consumer thread; {@link #offer} may be called from any publisher.
 */
public final class Subscription implements AutoCloseable {
    private static final int REPLAY_PAGE_SIZE = 256;

    private final String id;
    private final String executionId;
    private final BlockingQueue<TranscriptEntry> live;
    private final BiFunction<Long, Integer, List<TranscriptEntry>> replaySource;
    private final TranscriptFanout owner;
    private final Map<String, Long> missedFrom;
    private final Map<String, Long> lastDelivered;
    private final Deque<TranscriptEntry> replayBuffer;
    private volatile boolean overflowed;
    private volatile boolean closed;
    private boolean replaying;
    private boolean finished;

    Subscription(String id,
                 String executionId,
                 int capacity,
                 long fromSequence,
                 BiFunction<Long, Integer, List<TranscriptEntry>> replaySource,
                 TranscriptFanout owner) {
        this.id = id;
        this.executionId = executionId;
        this.live = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.replaySource = replaySource;
        this.owner = owner;
        this.missedFrom = new ConcurrentHashMap<>();
        this.lastDelivered = new HashMap<>();
        this.replayBuffer = new ArrayDeque<>();
        this.replaying = replaySource != null;
        if (replaySource != null) {
            lastDelivered.put(executionId, Math.max(0L, fromSequence - 1L));
        }
    }

    public String id() {
        return id;
    }

    public String executionId() {
        return executionId;
    }

    /**
     * Next item, waiting up to the timeout for live entries. Returns null on timeout or once the
     * subscription has finished; after a gap notice nothing more is delivered.
     */
    public StreamItem poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (finished || closed) {
            return null;
        }
        if (replaying) {
            StreamItem replayed = nextReplayed();
            if (replayed != null) {
                return replayed;
            }
        }
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            TranscriptEntry entry = live.poll();
            if (entry == null) {
                if (overflowed) {
                    finished = true;
                    return StreamItem.gap(resumePoints());
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return null;
                }
                entry = live.poll(remaining, TimeUnit.NANOSECONDS);
                if (entry == null) {
                    continue;
                }
            }
            if (alreadyDelivered(entry)) {
                continue;
            }
            lastDelivered.put(entry.executionId(), entry.sequence());
            return StreamItem.entry(entry);
        }
    }

    public boolean isFinished() {
        return finished || closed;
    }

    public boolean isOverflowed() {
        return overflowed;
    }

    @Override
    public void close() {
        closed = true;
        owner.unsubscribe(this);
    }

    /**
     * Non-blocking hand-off from a publisher. Returns false when the queue is full; the subscriber
     * is then marked as overflowed and receives no further entries.
     */
    boolean offer(TranscriptEntry entry) {
        if (closed || overflowed) {
            return false;
        }
        if (live.offer(entry)) {
            return true;
        }
        missedFrom.putIfAbsent(entry.executionId(), entry.sequence());
        overflowed = true;
        return false;
    }

    private StreamItem nextReplayed() {
        if (replayBuffer.isEmpty()) {
            long next = lastDelivered.getOrDefault(executionId, 0L) + 1L;
            List<TranscriptEntry> page = replaySource.apply(next, REPLAY_PAGE_SIZE);
            if (page.isEmpty()) {
                replaying = false;
                return null;
            }
            replayBuffer.addAll(page);
        }
        TranscriptEntry entry = replayBuffer.pollFirst();
        lastDelivered.put(entry.executionId(), entry.sequence());
        return StreamItem.entry(entry);
    }

    private Map<String, Long> resumePoints() {
        Map<String, Long> out = new HashMap<>();
        for (Map.Entry<String, Long> e : missedFrom.entrySet()) {
            long next = lastDelivered.getOrDefault(e.getKey(), 0L) + 1L;
            out.put(e.getKey(), Math.max(e.getValue(), next));
        }
        return out;
    }

    private boolean alreadyDelivered(TranscriptEntry entry) {
        Long last = lastDelivered.get(entry.executionId());
        return last != null && entry.sequence() <= last;
    }
}
