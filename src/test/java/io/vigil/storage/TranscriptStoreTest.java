package io.vigil.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vigil.config.VigilConfig;
import io.vigil.error.InstanceTerminatedException;
import io.vigil.model.AssertionOutcome;
import io.vigil.model.AssertionRecord;
import io.vigil.model.EntryType;
import io.vigil.model.ExecutionRecord;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;
import io.vigil.model.ToolResultStatus;
import io.vigil.model.ToolUseRecord;
import io.vigil.model.TranscriptEntry;
import io.vigil.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.vigil.support.TestDirs.deleteRecursively;

final class TranscriptStoreTest {

    @Test
    void sequencesArePerExecutionAndContiguous() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-sequence-");
        try {
            Database db = newDatabase(root);
            InstanceStore instances = new InstanceStore(db);
            TranscriptStore store = new TranscriptStore(db);
            InstanceHandle a = instances.createInstance("task-a", "list-1", null, 1_000L);
            InstanceHandle b = instances.createInstance("task-b", "list-1", null, 1_000L);

            for (int i = 0; i < 3; i++) {
                store.append(lifecycle(a, "step " + i), 2_000L + i);
            }
            TranscriptEntry firstOfB = store.append(lifecycle(b, "boot"), 2_100L);
            Assertions.assertEquals(1L, firstOfB.sequence());

            List<TranscriptEntry> all = store.readTranscript(a.executionId(), 1L, 0);
            Assertions.assertEquals(List.of(1L, 2L, 3L), all.stream().map(TranscriptEntry::sequence).toList());
            Assertions.assertEquals("step 0", all.get(0).summary());

            List<TranscriptEntry> tail = store.readTranscript(a.executionId(), 2L, 1);
            Assertions.assertEquals(1, tail.size());
            Assertions.assertEquals(2L, tail.get(0).sequence());

            ExecutionRecord execution = store.findExecution(a.executionId()).orElseThrow();
            Assertions.assertEquals(3L, execution.entryCount());
            Assertions.assertEquals(3L, execution.lastSequence());
            Assertions.assertEquals(4L, store.countEntries());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void longSummariesAreTruncated() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-truncate-");
        try {
            Database db = newDatabase(root);
            InstanceHandle handle = new InstanceStore(db).createInstance("task-a", "list-1", null, 1_000L);
            TranscriptStore store = new TranscriptStore(db);

            TranscriptEntry entry = store.append(lifecycle(handle, "x".repeat(500)), 2_000L);
            Assertions.assertEquals(TranscriptStore.SUMMARY_MAX_CHARS, entry.summary().length());
            Assertions.assertTrue(entry.summary().endsWith("..."));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void toolUseAndAssertionEntriesFeedProjections() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-projections-");
        try {
            Database db = newDatabase(root);
            InstanceHandle handle = new InstanceStore(db).createInstance("task-a", "list-1", null, 1_000L);
            TranscriptStore store = new TranscriptStore(db);

            ObjectNode okTool = Jsons.mapper().createObjectNode();
            okTool.put("tool", "Bash");
            okTool.put("input", "mvn -q test");
            okTool.put("durationMs", 1200L);
            store.append(entry(handle, EntryType.TOOL_USE, "tool", "ran tests", okTool), 2_000L);

            ObjectNode failedTool = Jsons.mapper().createObjectNode();
            failedTool.put("tool", "Edit");
            failedTool.put("isError", true);
            failedTool.put("errorMessage", "file not found");
            store.append(entry(handle, EntryType.TOOL_USE, "tool", "edit failed", failedTool), 2_100L);

            ObjectNode assertion = Jsons.mapper().createObjectNode();
            assertion.put("result", "fail");
            assertion.put("description", "unit tests pass");
            assertion.putObject("evidence").put("failures", 2);
            store.append(entry(handle, EntryType.ASSERTION, "test", "unit tests", assertion), 2_200L);

            List<ToolUseRecord> tools = store.listToolUses(handle.executionId(), false);
            Assertions.assertEquals(2, tools.size());
            Assertions.assertEquals("Bash", tools.get(0).tool());
            Assertions.assertEquals(ToolResultStatus.DONE, tools.get(0).resultStatus());
            Assertions.assertEquals(1200L, tools.get(0).durationMs());

            List<ToolUseRecord> errors = store.listToolUses(handle.executionId(), true);
            Assertions.assertEquals(1, errors.size());
            Assertions.assertEquals(ToolResultStatus.ERROR, errors.get(0).resultStatus());
            Assertions.assertEquals("file not found", errors.get(0).errorMessage());
            Assertions.assertEquals(2L, errors.get(0).sequence());

            List<AssertionRecord> failed = store.listAssertions(handle.executionId(), AssertionOutcome.FAIL);
            Assertions.assertEquals(1, failed.size());
            Assertions.assertEquals("unit tests pass", failed.get(0).description());
            Assertions.assertEquals(2, failed.get(0).evidence().path("failures").asInt());
            Assertions.assertTrue(store.listAssertions(handle.executionId(), AssertionOutcome.PASS).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void appendRejectsMalformedOrForeignEntries() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-append-validation-");
        try {
            Database db = newDatabase(root);
            InstanceHandle handle = new InstanceStore(db).createInstance("task-a", "list-1", null, 1_000L);
            TranscriptStore store = new TranscriptStore(db);

            Assertions.assertThrows(IllegalArgumentException.class, () ->
                    store.append(entry(handle, EntryType.TOOL_USE, "tool", "no tool", Jsons.mapper().createObjectNode()), 2_000L));
            ObjectNode badResult = Jsons.mapper().createObjectNode().put("result", "maybe");
            Assertions.assertThrows(IllegalArgumentException.class, () ->
                    store.append(entry(handle, EntryType.ASSERTION, "test", "bad", badResult), 2_000L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.append(new TranscriptStore.NewEntry(
                    "exe_missing", handle.instanceId(), handle.taskId(), EntryType.LIFECYCLE, "lifecycle", "x", null
            ), 2_000L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.append(new TranscriptStore.NewEntry(
                    handle.executionId(), "ins_other", handle.taskId(), EntryType.LIFECYCLE, "lifecycle", "x", null
            ), 2_000L));
            Assertions.assertEquals(0L, store.countEntries());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalInstanceRejectsNewEntriesAndKeepsDroppedCounter() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-append-terminal-");
        try {
            Database db = newDatabase(root);
            InstanceStore instances = new InstanceStore(db);
            InstanceHandle handle = instances.createInstance("task-a", "list-1", null, 1_000L);
            TranscriptStore store = new TranscriptStore(db);
            instances.markRunning(handle.instanceId(), 1_500L);
            store.append(lifecycle(handle, "started"), 2_000L);
            instances.markTerminal(handle.instanceId(), InstanceStatus.FAILED, "crashed", 3_000L, "test");

            InstanceTerminatedException rejected = Assertions.assertThrows(InstanceTerminatedException.class, () ->
                    store.append(lifecycle(handle, "late"), 4_000L));
            Assertions.assertEquals(InstanceStatus.FAILED, rejected.status());

            Assertions.assertEquals(3L, store.addDroppedEvents(handle.executionId(), 3L));
            Assertions.assertEquals(5L, store.addDroppedEvents(handle.executionId(), 2L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.addDroppedEvents(handle.executionId(), 0L));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.addDroppedEvents("exe_missing", 1L));

            ExecutionRecord execution = store.findExecution(handle.executionId()).orElseThrow();
            Assertions.assertEquals(5L, execution.droppedEvents());
            Assertions.assertEquals("failed", execution.outcome());
            Assertions.assertEquals(3_000L, execution.completedAtMs());
            Assertions.assertEquals(1L, execution.entryCount());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Database newDatabase(Path root) {
        Database db = new Database(VigilConfig.fromRoot(root.toString()), 5_000L);
        db.init();
        return db;
    }

    private static TranscriptStore.NewEntry lifecycle(InstanceHandle handle, String summary) {
        return entry(handle, EntryType.LIFECYCLE, "lifecycle", summary, null);
    }

    private static TranscriptStore.NewEntry entry(InstanceHandle handle,
                                                  EntryType type,
                                                  String category,
                                                  String summary,
                                                  ObjectNode payload) {
        return new TranscriptStore.NewEntry(
                handle.executionId(),
                handle.instanceId(),
                handle.taskId(),
                type,
                category,
                summary,
                payload
        );
    }
}
