package io.vigil.liveness;

import com.fasterxml.jackson.databind.JsonNode;
import io.vigil.config.SupervisorSettings;
import io.vigil.config.VigilConfig;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;
import io.vigil.observability.AuditLogger;
import io.vigil.storage.Database;
import io.vigil.storage.InstanceStore;
import io.vigil.support.ManualClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.vigil.support.TestDirs.deleteRecursively;

final class HeartbeatIngestTest {

    @Test
    void heartbeatDefaultsToClockAndCountsOutcomes() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-heartbeat-ingest-");
        try {
            ManualClock clock = new ManualClock(10_000L);
            VigilConfig config = VigilConfig.fromRoot(root.toString());
            Database db = new Database(config, 5_000L);
            db.init();
            InstanceStore store = new InstanceStore(db);
            AuditLogger audit = new AuditLogger(config.auditFile(), "test-secret", clock);
            HeartbeatIngest ingest = new HeartbeatIngest(store, audit, clock, SupervisorSettings::defaults);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, clock.millis());

            InstanceStore.HeartbeatOutcome first = ingest.heartbeat(handle.instanceId());
            Assertions.assertEquals(InstanceStore.HeartbeatResult.STARTED, first.result());
            Assertions.assertEquals(10_000L, first.lastHeartbeatAtMs());

            clock.advance(5_000L);
            ingest.heartbeat(handle.instanceId());
            ingest.heartbeat(handle.instanceId(), 12_000L);

            Assertions.assertEquals(2L, ingest.acceptedTotal());
            Assertions.assertEquals(1L, ingest.ignoredTotal());
            Assertions.assertEquals(15_000L, store.findInstance(handle.instanceId()).orElseThrow().lastHeartbeatAtMs());

            List<JsonNode> rows = audit.tail(10);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals("instance.running", rows.get(0).path("action").asText());
            Assertions.assertEquals(handle.instanceId(), rows.get(0).path("instance_id").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heartbeatOnTerminalInstanceIsRejectedWithoutRevivingIt() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-heartbeat-terminal-");
        try {
            ManualClock clock = new ManualClock(10_000L);
            Database db = new Database(VigilConfig.fromRoot(root.toString()), 5_000L);
            db.init();
            InstanceStore store = new InstanceStore(db);
            HeartbeatIngest ingest = new HeartbeatIngest(store, null, clock, SupervisorSettings::defaults);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, clock.millis());
            ingest.heartbeat(handle.instanceId());
            store.markTerminal(handle.instanceId(), InstanceStatus.TERMINATED, "stale_heartbeat", 11_000L, "test");

            clock.advance(5_000L);
            InstanceTerminatedException e = Assertions.assertThrows(InstanceTerminatedException.class,
                    () -> ingest.heartbeat(handle.instanceId()));
            Assertions.assertEquals("instance_terminated", e.code());
            Assertions.assertEquals(1L, ingest.rejectedTerminalTotal());
            Assertions.assertEquals(InstanceStatus.TERMINATED, store.findInstance(handle.instanceId()).orElseThrow().status());

            Assertions.assertThrows(IllegalArgumentException.class, () -> ingest.heartbeat("ins_unknown"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timestampFarAheadOfClockIsRejected() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-heartbeat-future-");
        try {
            ManualClock clock = new ManualClock(10_000L);
            Database db = new Database(VigilConfig.fromRoot(root.toString()), 5_000L);
            db.init();
            InstanceStore store = new InstanceStore(db);
            HeartbeatIngest ingest = new HeartbeatIngest(store, null, clock, SupervisorSettings::defaults);
            InstanceHandle handle = store.createInstance("task-1", "list-1", null, clock.millis());
            ingest.heartbeat(handle.instanceId());
            long interval = SupervisorSettings.defaults().heartbeatIntervalMs();

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> ingest.heartbeat(handle.instanceId(), clock.millis() * 1_000L));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> ingest.heartbeat(handle.instanceId(), clock.millis() + interval + 1L));
            Assertions.assertEquals(10_000L, store.findInstance(handle.instanceId()).orElseThrow().lastHeartbeatAtMs());

            InstanceStore.HeartbeatOutcome slightlyAhead = ingest.heartbeat(handle.instanceId(), clock.millis() + interval);
            Assertions.assertEquals(InstanceStore.HeartbeatResult.ADVANCED, slightlyAhead.result());
        } finally {
            deleteRecursively(root);
        }
    }
}
