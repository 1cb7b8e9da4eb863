package io.vigil.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.vigil.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.vigil.support.TestDirs.deleteRecursively;

final class VigilCommandTest {

    @Test
    void lifecycleThroughCommands() throws Exception {
        Path root = Files.createTempDirectory("vigil-test-cli-");
        try {
            String r = root.toString();
            Assertions.assertEquals(0, run(r, "init").code());

            Result created = run(r, "create", "--task-id", "task-7", "--task-list-id", "list-1");
            Assertions.assertEquals(0, created.code());
            JsonNode handle = Jsons.mapper().readTree(created.out());
            String instanceId = handle.path("instanceId").asText();
            String executionId = handle.path("executionId").asText();

            Assertions.assertEquals(0, run(r, "heartbeat", instanceId).code());
            Result emitted = run(r, "emit", executionId,
                    "--instance-id", instanceId,
                    "--task-id", "task-7",
                    "--type", "tool_use",
                    "--category", "tool",
                    "--summary", "ran build",
                    "--payload", "{\"tool\":\"Bash\",\"isError\":true}");
            Assertions.assertEquals(0, emitted.code(), emitted.err());
            Assertions.assertEquals(1L, Jsons.mapper().readTree(emitted.out()).path("sequence").asLong());

            Result tools = run(r, "tool-uses", executionId, "--errors-only");
            Assertions.assertEquals(1, Jsons.mapper().readTree(tools.out()).size());

            Result status = run(r, "status", instanceId);
            Assertions.assertEquals("running", Jsons.mapper().readTree(status.out()).path("status").asText());

            Assertions.assertEquals(0, run(r, "terminal", instanceId, "--status", "failed", "--reason", "exit_code_2").code());
            Result conflict = run(r, "terminal", instanceId, "--status", "completed");
            Assertions.assertEquals(3, conflict.code());
            Assertions.assertTrue(conflict.err().contains("conflicting_transition"));

            Result late = run(r, "heartbeat", instanceId);
            Assertions.assertEquals(3, late.code());
            Assertions.assertTrue(late.err().contains("instance_terminated"));

            Assertions.assertEquals(1, run(r, "status", "ins_unknown").code());
            Assertions.assertEquals(2, run(r, "heartbeat", "ins_unknown").code());

            Result metrics = run(r, "metrics");
            Assertions.assertTrue(metrics.out().contains("vigil_instances{status=\"failed\"} 1"));
            Assertions.assertEquals(0, run(r, "audit-verify").code());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root;
        System.arraycopy(args, 0, full, 2, args.length);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StringWriter err = new StringWriter();
        PrintStream previous = System.out;
        int code;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            CommandLine commandLine = VigilCommand.newCommandLine();
            commandLine.setErr(new PrintWriter(err, true));
            code = commandLine.execute(full);
        } finally {
            System.setOut(previous);
        }
        return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString());
    }

    private record Result(int code, String out, String err) {
    }
}
