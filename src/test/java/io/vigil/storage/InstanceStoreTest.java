package io.vigil.storage;

import io.vigil.config.VigilConfig;
import io.vigil.error.ConflictingTransitionException;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.error.InvalidTransitionException;
import io.vigil.model.AgentInstance;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.vigil.support.TestDirs.deleteRecursively;

final class InstanceStoreTest {

    @Test
    void createInstanceStartsPendingWithOpenExecution() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-create-");
        try {
            InstanceStore store = newStore(root);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, 1_000L);

            AgentInstance instance = store.findInstance(handle.instanceId()).orElseThrow();
            Assertions.assertEquals(InstanceStatus.PENDING, instance.status());
            Assertions.assertEquals(handle.executionId(), instance.executionId());
            Assertions.assertNull(instance.pid());
            Assertions.assertNull(instance.lastHeartbeatAtMs());
            Assertions.assertTrue(handle.instanceId().startsWith("ins_"));
            Assertions.assertTrue(handle.executionId().startsWith("exe_"));
            Assertions.assertTrue(store.findInstance("ins_missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void firstHeartbeatPromotesPendingAndLaterOnesOnlyMoveForward() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-heartbeat-");
        try {
            InstanceStore store = newStore(root);
            InstanceHandle handle = store.createInstance("task-1", "list-1", 4242L, 1_000L);

            InstanceStore.HeartbeatOutcome first = store.recordHeartbeat(handle.instanceId(), 2_000L, 2_000L);
            Assertions.assertEquals(InstanceStore.HeartbeatResult.STARTED, first.result());
            Assertions.assertEquals(InstanceStatus.RUNNING, first.currentStatus());

            InstanceStore.HeartbeatOutcome second = store.recordHeartbeat(handle.instanceId(), 5_000L, 5_000L);
            Assertions.assertEquals(InstanceStore.HeartbeatResult.ADVANCED, second.result());

            InstanceStore.HeartbeatOutcome late = store.recordHeartbeat(handle.instanceId(), 4_000L, 6_000L);
            Assertions.assertEquals(InstanceStore.HeartbeatResult.IGNORED_NOT_NEWER, late.result());
            Assertions.assertEquals(5_000L, late.lastHeartbeatAtMs());

            InstanceStore.HeartbeatOutcome equal = store.recordHeartbeat(handle.instanceId(), 5_000L, 6_000L);
            Assertions.assertEquals(InstanceStore.HeartbeatResult.IGNORED_NOT_NEWER, equal.result());

            AgentInstance instance = store.findInstance(handle.instanceId()).orElseThrow();
            Assertions.assertEquals(5_000L, instance.lastHeartbeatAtMs());
            Assertions.assertEquals(2_000L, instance.startedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalTransitionsAreOneWay() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-terminal-");
        try {
            InstanceStore store = newStore(root);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, 1_000L);

            Assertions.assertThrows(InvalidTransitionException.class, () ->
                    store.markTerminal(handle.instanceId(), InstanceStatus.COMPLETED, null, 1_500L, "test"));

            store.markRunning(handle.instanceId(), 2_000L);
            Assertions.assertThrows(InvalidTransitionException.class, () -> store.markRunning(handle.instanceId(), 2_100L));

            InstanceStore.TransitionResult done = store.markTerminal(
                    handle.instanceId(), InstanceStatus.COMPLETED, "ignored", 3_000L, "test");
            Assertions.assertEquals(InstanceStore.TransitionOutcome.APPLIED, done.outcome());
            Assertions.assertNull(done.terminationReason());

            InstanceStore.TransitionResult again = store.markTerminal(
                    handle.instanceId(), InstanceStatus.COMPLETED, null, 3_500L, "test");
            Assertions.assertEquals(InstanceStore.TransitionOutcome.ALREADY_APPLIED, again.outcome());

            ConflictingTransitionException conflict = Assertions.assertThrows(ConflictingTransitionException.class, () ->
                    store.markTerminal(handle.instanceId(), InstanceStatus.FAILED, "exit_code_1", 4_000L, "test"));
            Assertions.assertEquals(InstanceStatus.COMPLETED, conflict.storedStatus());
            Assertions.assertEquals(InstanceStatus.FAILED, conflict.attemptedStatus());
            Assertions.assertEquals(1L, store.countTransitionConflicts());

            Assertions.assertThrows(InstanceTerminatedException.class, () ->
                    store.recordHeartbeat(handle.instanceId(), 9_000L, 9_000L));
            Assertions.assertThrows(InstanceTerminatedException.class, () ->
                    store.attachProcess(handle.instanceId(), 77L, 9_000L));

            AgentInstance instance = store.findInstance(handle.instanceId()).orElseThrow();
            Assertions.assertEquals(InstanceStatus.COMPLETED, instance.status());
            Assertions.assertEquals(3_000L, instance.terminatedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedAndTerminatedRequireReason() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-reason-");
        try {
            InstanceStore store = newStore(root);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, 1_000L);
            store.markRunning(handle.instanceId(), 2_000L);

            Assertions.assertThrows(IllegalArgumentException.class, () ->
                    store.markTerminal(handle.instanceId(), InstanceStatus.FAILED, " ", 3_000L, "test"));
            Assertions.assertThrows(IllegalArgumentException.class, () ->
                    store.markTerminal(handle.instanceId(), InstanceStatus.RUNNING, "x", 3_000L, "test"));
            Assertions.assertThrows(IllegalArgumentException.class, () ->
                    store.markTerminal("ins_unknown", InstanceStatus.FAILED, "x", 3_000L, "test"));

            store.markTerminal(handle.instanceId(), InstanceStatus.FAILED, "build_broken", 3_000L, "test");
            Assertions.assertEquals("build_broken",
                    store.findInstance(handle.instanceId()).orElseThrow().terminationReason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentTerminalWritersProduceOneWinner() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-terminal-race-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            InstanceStore store = newStore(root);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, 1_000L);
            store.markRunning(handle.instanceId(), 2_000L);

            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> futures = new ArrayList<>();
            InstanceStatus[] statuses = {InstanceStatus.COMPLETED, InstanceStatus.FAILED, InstanceStatus.TERMINATED};
            for (InstanceStatus status : statuses) {
                Callable<String> attempt = () -> {
                    start.await();
                    try {
                        store.markTerminal(handle.instanceId(), status, "reason_" + status.wireName(), 3_000L, "test");
                        return "applied";
                    } catch (ConflictingTransitionException e) {
                        return "conflict";
                    }
                };
                futures.add(pool.submit(attempt));
            }
            start.countDown();

            int applied = 0;
            int conflicts = 0;
            for (Future<String> f : futures) {
                String outcome = f.get(30, TimeUnit.SECONDS);
                if ("applied".equals(outcome)) {
                    applied++;
                } else {
                    conflicts++;
                }
            }
            Assertions.assertEquals(1, applied);
            Assertions.assertEquals(2, conflicts);
            Assertions.assertTrue(store.findInstance(handle.instanceId()).orElseThrow().status().isTerminal());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void staleTerminationIsFencedByLastSeenValue() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-stale-fence-");
        try {
            InstanceStore store = newStore(root);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, 1_000L);
            store.recordHeartbeat(handle.instanceId(), 2_000L, 2_000L);

            List<InstanceStore.StaleCandidate> candidates = store.findStaleRunning(10_000L, 10);
            Assertions.assertEquals(1, candidates.size());
            Assertions.assertEquals(2_000L, candidates.get(0).lastSeenMs());

            store.recordHeartbeat(handle.instanceId(), 9_500L, 9_500L);
            Assertions.assertFalse(store.terminateIfStillStale(candidates.get(0), "stale_heartbeat", 10_000L));
            Assertions.assertEquals(InstanceStatus.RUNNING, store.findInstance(handle.instanceId()).orElseThrow().status());

            InstanceStore.StaleCandidate fresh = store.findStaleRunning(20_000L, 10).get(0);
            Assertions.assertTrue(store.terminateIfStillStale(fresh, "stale_heartbeat", 20_000L));
            Assertions.assertFalse(store.terminateIfStillStale(fresh, "stale_heartbeat", 20_001L));

            AgentInstance instance = store.findInstance(handle.instanceId()).orElseThrow();
            Assertions.assertEquals(InstanceStatus.TERMINATED, instance.status());
            Assertions.assertEquals("stale_heartbeat", instance.terminationReason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listingFiltersAndArchival() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-listing-");
        try {
            InstanceStore store = newStore(root);
            InstanceHandle a = store.createInstance("task-a", "list-1", null, 1_000L);
            InstanceHandle b = store.createInstance("task-b", "list-1", null, 1_100L);
            InstanceHandle c = store.createInstance("task-c", "list-2", null, 1_200L);
            store.recordHeartbeat(b.instanceId(), 2_000L, 2_000L);
            store.recordHeartbeat(c.instanceId(), 2_000L, 2_000L);
            store.markTerminal(c.instanceId(), InstanceStatus.COMPLETED, null, 3_000L, "test");

            Assertions.assertEquals(3, store.listInstances(InstanceFilter.all(), 0L).size());
            Assertions.assertEquals(2, store.listInstances(InstanceFilter.all().withTaskListId("list-1"), 0L).size());
            List<AgentInstance> running = store.listInstances(InstanceFilter.all().withStatus(InstanceStatus.RUNNING), 0L);
            Assertions.assertEquals(1, running.size());
            Assertions.assertEquals(b.instanceId(), running.get(0).instanceId());
            Assertions.assertEquals(1, store.listInstances(InstanceFilter.all().staleOnly(true), 5_000L).size());
            Assertions.assertEquals(0, store.listInstances(InstanceFilter.all().staleOnly(true), 1_500L).size());

            Assertions.assertEquals(1, store.countByStatus().get("pending"));
            Assertions.assertEquals(1, store.countStaleRunning(5_000L));

            Assertions.assertEquals(1, store.archiveTerminalBefore(4_000L, 4_000L));
            Assertions.assertEquals(2, store.listInstances(InstanceFilter.all(), 0L).size());
            InstanceFilter withArchived = new InstanceFilter(null, null, null, false, true, 100);
            Assertions.assertEquals(3, store.listInstances(withArchived, 0L).size());
            Assertions.assertTrue(store.findInstance(c.instanceId()).orElseThrow().archived());
            Assertions.assertTrue(store.findInstance(a.instanceId()).isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    private static InstanceStore newStore(Path root) {
        Database db = new Database(VigilConfig.fromRoot(root.toString()), 5_000L);
        db.init();
        return new InstanceStore(db);
    }
}
