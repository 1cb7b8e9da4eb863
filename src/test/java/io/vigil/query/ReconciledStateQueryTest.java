package io.vigil.query;

import io.vigil.config.SupervisorSettings;
import io.vigil.config.VigilConfig;
import io.vigil.model.EffectiveStatus;
import io.vigil.model.EntryType;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;
import io.vigil.storage.Database;
import io.vigil.storage.InstanceStore;
import io.vigil.storage.TranscriptStore;
import io.vigil.support.ManualClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.vigil.support.TestDirs.deleteRecursively;

final class ReconciledStateQueryTest {
    private static final long START = 500_000L;

    @Test
    void unknownIdIsNotFoundRatherThanTerminated() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-query-notfound-");
        try {
            Fixture fx = new Fixture(root);
            EffectiveStatus missing = fx.query.effectiveStatus("ins_does_not_exist");
            Assertions.assertFalse(missing.found());
            Assertions.assertNull(missing.status());
            Assertions.assertFalse(missing.isStale());

            InstanceHandle handle = fx.instances.createInstance("task-1", "list-1", null, START);
            fx.instances.markRunning(handle.instanceId(), START);
            fx.instances.markTerminal(handle.instanceId(), InstanceStatus.TERMINATED, "operator_cancelled", START + 1L, "test");
            EffectiveStatus terminated = fx.query.effectiveStatus(handle.instanceId());
            Assertions.assertTrue(terminated.found());
            Assertions.assertEquals(InstanceStatus.TERMINATED, terminated.status());
            Assertions.assertEquals("operator_cancelled", terminated.terminationReason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleIsComputedAtReadTimeBeforeReaperRuns() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-query-stale-");
        try {
            Fixture fx = new Fixture(root);
            long timeout = SupervisorSettings.defaults().staleTimeoutMs();
            InstanceHandle silent = fx.instances.createInstance("task-s", "list-1", null, START);
            fx.instances.recordHeartbeat(silent.instanceId(), START, START);
            InstanceHandle neverBeat = fx.instances.createInstance("task-n", "list-1", null, START);
            fx.instances.markRunning(neverBeat.instanceId(), START);
            InstanceHandle pending = fx.instances.createInstance("task-p", "list-1", null, START);

            fx.clock.advance(timeout);
            Assertions.assertFalse(fx.query.effectiveStatus(silent.instanceId()).isStale());

            fx.clock.advance(1L);
            EffectiveStatus stale = fx.query.effectiveStatus(silent.instanceId());
            Assertions.assertEquals(InstanceStatus.RUNNING, stale.status());
            Assertions.assertTrue(stale.isStale());
            Assertions.assertEquals(timeout + 1L, stale.lastSeenAgoMs());
            Assertions.assertTrue(fx.query.effectiveStatus(neverBeat.instanceId()).isStale());
            Assertions.assertFalse(fx.query.effectiveStatus(pending.instanceId()).isStale());

            List<EffectiveStatus> staleOnly = fx.query.listInstances(InstanceFilter.all().staleOnly(true));
            Assertions.assertEquals(2, staleOnly.size());
            Assertions.assertTrue(staleOnly.stream().allMatch(EffectiveStatus::isStale));

            ReconciledStateQuery.StatusSummary summary = fx.query.summary();
            Assertions.assertEquals(1, summary.pending());
            Assertions.assertEquals(0, summary.runningLive());
            Assertions.assertEquals(2, summary.runningStale());
            Assertions.assertEquals(timeout, summary.staleTimeoutMs());

            fx.instances.recordHeartbeat(silent.instanceId(), fx.clock.millis(), fx.clock.millis());
            Assertions.assertFalse(fx.query.effectiveStatus(silent.instanceId()).isStale());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void transcriptPageReportsGapCounterAndMissingExecution() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-query-transcript-");
        try {
            Fixture fx = new Fixture(root);
            InstanceHandle handle = fx.instances.createInstance("task-1", "list-1", null, START);
            fx.instances.markRunning(handle.instanceId(), START);
            for (int i = 0; i < 4; i++) {
                fx.transcripts.append(new TranscriptStore.NewEntry(handle.executionId(), handle.instanceId(), handle.taskId(),
                        EntryType.LIFECYCLE, "lifecycle", "step " + i, null), START + i);
            }
            fx.transcripts.addDroppedEvents(handle.executionId(), 7L);

            ReconciledStateQuery.TranscriptPage page = fx.query.getTranscript(handle.executionId(), 3L, 10);
            Assertions.assertTrue(page.found());
            Assertions.assertEquals(2, page.entries().size());
            Assertions.assertEquals(3L, page.entries().get(0).sequence());
            Assertions.assertEquals(4L, page.lastSequence());
            Assertions.assertEquals(7L, page.droppedEvents());

            ReconciledStateQuery.TranscriptPage missing = fx.query.getTranscript("exe_missing", 1L, 10);
            Assertions.assertFalse(missing.found());
            Assertions.assertTrue(missing.entries().isEmpty());
            Assertions.assertTrue(fx.query.getExecution("exe_missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final ManualClock clock;
        final InstanceStore instances;
        final TranscriptStore transcripts;
        final ReconciledStateQuery query;

        Fixture(Path root) {
            Database db = new Database(VigilConfig.fromRoot(root.toString()), 5_000L);
            db.init();
            this.clock = new ManualClock(START);
            this.instances = new InstanceStore(db);
            this.transcripts = new TranscriptStore(db);
            this.query = new ReconciledStateQuery(instances, transcripts, clock, SupervisorSettings::defaults);
        }
    }
}
