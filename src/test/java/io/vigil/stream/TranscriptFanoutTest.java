package io.vigil.stream;

import io.vigil.config.VigilConfig;
import io.vigil.model.EntryType;
import io.vigil.model.InstanceHandle;
import io.vigil.storage.Database;
import io.vigil.storage.InstanceStore;
import io.vigil.storage.TranscriptStore;
import io.vigil.support.ManualClock;
import io.vigil.transcript.EmitRequest;
import io.vigil.transcript.TranscriptEmitter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.vigil.support.TestDirs.deleteRecursively;

final class TranscriptFanoutTest {

    @Test
    void lateSubscriberGetsReplayThenLiveWithoutDuplicates() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-fanout-replay-");
        try {
            Fixture fx = new Fixture(root, 64);
            for (int i = 1; i <= 3; i++) {
                fx.emit("before " + i);
            }
            Subscription replaying = fx.fanout.subscribe(fx.handle.executionId(), 1L);
            Subscription fromTwo = fx.fanout.subscribe(fx.handle.executionId(), 2L);
            for (int i = 4; i <= 5; i++) {
                fx.emit("after " + i);
            }

            Assertions.assertEquals(List.of(1L, 2L, 3L, 4L, 5L), drain(replaying));
            Assertions.assertEquals(List.of(2L, 3L, 4L, 5L), drain(fromTwo));

            fx.emit("later 6");
            StreamItem next = replaying.poll(1, TimeUnit.SECONDS);
            Assertions.assertNotNull(next);
            Assertions.assertEquals(6L, next.entry().sequence());
            Assertions.assertEquals("later 6", next.entry().summary());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void slowSubscriberIsCutOffWithGapWhileOthersKeepUp() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-fanout-slow-");
        try {
            Fixture fx = new Fixture(root, 2);
            Subscription slow = fx.fanout.subscribe(fx.handle.executionId(), null);
            fx.capacity.set(100);
            Subscription fast = fx.fanout.subscribe(fx.handle.executionId(), null);

            for (int i = 1; i <= 5; i++) {
                fx.emit("entry " + i);
            }

            Assertions.assertEquals(List.of(1L, 2L, 3L, 4L, 5L), drain(fast));

            Assertions.assertEquals(1L, slow.poll(1, TimeUnit.SECONDS).entry().sequence());
            Assertions.assertEquals(2L, slow.poll(1, TimeUnit.SECONDS).entry().sequence());
            StreamItem gap = slow.poll(1, TimeUnit.SECONDS);
            Assertions.assertTrue(gap.isGap());
            Assertions.assertEquals(Map.of(fx.handle.executionId(), 3L), gap.resumeFrom());
            Assertions.assertNull(slow.poll(10, TimeUnit.MILLISECONDS));
            Assertions.assertTrue(slow.isFinished());
            Assertions.assertTrue(slow.isOverflowed());

            Assertions.assertEquals(1L, fx.fanout.disconnectedTotal());
            Assertions.assertEquals(1, fx.fanout.subscriberCount());
            Assertions.assertEquals(5L, fx.fanout.publishedTotal());

            Subscription resumed = fx.fanout.subscribe(fx.handle.executionId(), gap.resumeFrom().get(fx.handle.executionId()));
            Assertions.assertEquals(List.of(3L, 4L, 5L), drain(resumed));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wildcardSeesAllExecutionsButCannotReplay() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-fanout-wildcard-");
        try {
            Fixture fx = new Fixture(root, 64);
            InstanceHandle other = fx.instances.createInstance("task-2", "list-1", null, 1_000L);
            fx.instances.markRunning(other.instanceId(), 1_000L);

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.fanout.subscribe(TranscriptFanout.ALL_EXECUTIONS, 1L));
            Subscription all = fx.fanout.subscribe(TranscriptFanout.ALL_EXECUTIONS, null);

            fx.emit("first");
            fx.emitter.emit(new EmitRequest(other.executionId(), other.instanceId(), other.taskId(),
                    EntryType.LIFECYCLE, "lifecycle", "other", null));

            StreamItem a = all.poll(1, TimeUnit.SECONDS);
            StreamItem b = all.poll(1, TimeUnit.SECONDS);
            Assertions.assertEquals(fx.handle.executionId(), a.entry().executionId());
            Assertions.assertEquals(other.executionId(), b.entry().executionId());
            Assertions.assertEquals(1L, b.entry().sequence());

            all.close();
            Assertions.assertEquals(0, fx.fanout.subscriberCount());
            Assertions.assertNull(all.poll(10, TimeUnit.MILLISECONDS));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void executionKeysAreDroppedWhenLastSubscriberLeaves() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-fanout-keys-");
        try {
            Fixture fx = new Fixture(root, 1);
            InstanceHandle other = fx.instances.createInstance("task-2", "list-1", null, 1_000L);

            Subscription first = fx.fanout.subscribe(fx.handle.executionId(), null);
            Subscription second = fx.fanout.subscribe(fx.handle.executionId(), null);
            Subscription third = fx.fanout.subscribe(other.executionId(), null);
            Assertions.assertEquals(2, fx.fanout.trackedKeys());

            first.close();
            Assertions.assertEquals(2, fx.fanout.trackedKeys());
            second.close();
            Assertions.assertEquals(1, fx.fanout.trackedKeys());
            third.close();
            Assertions.assertEquals(0, fx.fanout.trackedKeys());

            Subscription slow = fx.fanout.subscribe(fx.handle.executionId(), null);
            fx.emit("one");
            fx.emit("two");
            Assertions.assertEquals(0, fx.fanout.trackedKeys());
            Assertions.assertEquals(1L, fx.fanout.disconnectedTotal());
            slow.close();
            Assertions.assertEquals(0, fx.fanout.trackedKeys());
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<Long> drain(Subscription subscription) throws InterruptedException {
        List<Long> out = new ArrayList<>();
        while (true) {
            StreamItem item = subscription.poll(200, TimeUnit.MILLISECONDS);
            if (item == null || item.isGap()) {
                return out;
            }
            out.add(item.entry().sequence());
        }
    }

    private static final class Fixture {
        final AtomicInteger capacity;
        final InstanceStore instances;
        final TranscriptFanout fanout;
        final TranscriptEmitter emitter;
        final InstanceHandle handle;

        Fixture(Path root, int queueCapacity) {
            Database db = new Database(VigilConfig.fromRoot(root.toString()), 5_000L);
            db.init();
            this.capacity = new AtomicInteger(queueCapacity);
            this.instances = new InstanceStore(db);
            TranscriptStore store = new TranscriptStore(db);
            this.fanout = new TranscriptFanout(store, capacity::get);
            this.emitter = new TranscriptEmitter(store, fanout, new ManualClock(2_000L));
            this.handle = instances.createInstance("task-1", "list-1", null, 1_000L);
            instances.markRunning(handle.instanceId(), 1_000L);
        }

        void emit(String summary) {
            emitter.emit(new EmitRequest(handle.executionId(), handle.instanceId(), handle.taskId(),
                    EntryType.LIFECYCLE, "lifecycle", summary, null));
        }
    }
}
