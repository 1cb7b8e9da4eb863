package io.vigil.stream;

import io.vigil.model.TranscriptEntry;
import io.vigil.storage.TranscriptStore;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Pushes committed transcript entries to live subscribers. Publishing never blocks: a subscriber
 * whose bounded queue is full is disconnected and gets a gap notice instead.
 */
public final class TranscriptFanout {
    public static final String ALL_EXECUTIONS = "*";

    private final TranscriptStore store;
    private final IntSupplier queueCapacity;
    private final ConcurrentMap<String, Set<Subscription>> subscribers;
    private final AtomicLong publishedTotal;
    private final AtomicLong disconnectedTotal;

    public TranscriptFanout(TranscriptStore store, IntSupplier queueCapacity) {
        this.store = store;
        this.queueCapacity = queueCapacity;
        this.subscribers = new ConcurrentHashMap<>();
        this.publishedTotal = new AtomicLong(0L);
        this.disconnectedTotal = new AtomicLong(0L);
    }

    /**
     * Subscribes to one execution, or to every execution with {@link #ALL_EXECUTIONS}. When
     * {@code fromSequence} is set, committed entries from that sequence are replayed first.
     */
    public Subscription subscribe(String executionId, Long fromSequence) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId must not be blank");
        }
        String key = executionId.trim();
        boolean wildcard = ALL_EXECUTIONS.equals(key);
        if (wildcard && fromSequence != null) {
            throw new IllegalArgumentException("replay requires a single execution id");
        }
        Subscription subscription = new Subscription(
                "sub_" + UUID.randomUUID(),
                key,
                queueCapacity.getAsInt(),
                fromSequence == null ? 0L : Math.max(1L, fromSequence),
                fromSequence == null ? null : (from, limit) -> store.readTranscript(key, from, limit),
                this
        );
        subscribers.compute(key, (k, set) -> {
            Set<Subscription> target = set == null ? ConcurrentHashMap.newKeySet() : set;
            target.add(subscription);
            return target;
        });
        return subscription;
    }

    /**
     * Called by the emission path after commit, while it still holds the execution's lock, so
     * delivery order matches commit order.
     */
    public void publish(TranscriptEntry entry) {
        publishedTotal.incrementAndGet();
        deliver(subscribers.get(entry.executionId()), entry);
        deliver(subscribers.get(ALL_EXECUTIONS), entry);
    }

    public int subscriberCount() {
        int total = 0;
        for (Set<Subscription> set : subscribers.values()) {
            total += set.size();
        }
        return total;
    }

    public long publishedTotal() {
        return publishedTotal.get();
    }

    public long disconnectedTotal() {
        return disconnectedTotal.get();
    }

    void unsubscribe(Subscription subscription) {
        remove(subscription);
    }

    /**
     * Executions (and the wildcard) that currently have at least one subscriber.
     */
    int trackedKeys() {
        return subscribers.size();
    }

    private boolean remove(Subscription subscription) {
        boolean[] removed = new boolean[1];
        subscribers.computeIfPresent(subscription.executionId(), (k, set) -> {
            removed[0] = set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    private void deliver(Set<Subscription> set, TranscriptEntry entry) {
        if (set == null || set.isEmpty()) {
            return;
        }
        for (Subscription subscription : set) {
            if (!subscription.offer(entry)) {
                if (remove(subscription)) {
                    disconnectedTotal.incrementAndGet();
                }
            }
        }
    }
}
