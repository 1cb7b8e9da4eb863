package io.vigil.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vigil.config.VigilConfig;
import io.vigil.error.SupervisorException;
import io.vigil.model.AssertionOutcome;
import io.vigil.model.EffectiveStatus;
import io.vigil.model.EntryType;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceStatus;
import io.vigil.observability.AuditLogger;
import io.vigil.query.ReconciledStateQuery;
import io.vigil.runtime.VigilRuntime;
import io.vigil.transcript.EmitRequest;
import io.vigil.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "vigil",
        mixinStandardHelpOptions = true,
        description = "Build-agent supervisor CLI",
        subcommands = {
                VigilCommand.InitCommand.class,
                VigilCommand.CreateCommand.class,
                VigilCommand.AttachCommand.class,
                VigilCommand.HeartbeatCommand.class,
                VigilCommand.TerminalCommand.class,
                VigilCommand.EmitCommand.class,
                VigilCommand.DroppedCommand.class,
                VigilCommand.StatusCommand.class,
                VigilCommand.InstancesCommand.class,
                VigilCommand.TranscriptCommand.class,
                VigilCommand.ToolUsesCommand.class,
                VigilCommand.AssertionsCommand.class,
                VigilCommand.SummaryCommand.class,
                VigilCommand.ReapCommand.class,
                VigilCommand.ArchiveCommand.class,
                VigilCommand.ReloadSettingsCommand.class,
                VigilCommand.StatsCommand.class,
                VigilCommand.MetricsCommand.class,
                VigilCommand.HealthCommand.class,
                VigilCommand.AuditTailCommand.class,
                VigilCommand.AuditVerifyCommand.class,
                VigilCommand.SchemaMigrationsCommand.class,
                VigilCommand.ServeCommand.class
        }
)
public final class VigilCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | attach | heartbeat | terminal | emit | dropped | status | instances | transcript | tool-uses | assertions | summary | reap | archive | reload-settings | stats | metrics | health | audit-tail | audit-verify | schema-migrations | serve");
    }

    VigilRuntime runtime() {
        return new VigilRuntime(VigilConfig.fromRoot(root));
    }

    /**
     * Builds the command line with supervisor errors rendered as JSON on stderr. Exit code 3 marks
     * a rejected transition or write, 4 an unavailable store.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new VigilCommand());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof SupervisorException supervisorError) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", supervisorError.code());
                body.put("message", supervisorError.getMessage());
                cmd.getErr().println(Jsons.toJson(body));
                return "store_unavailable".equals(supervisorError.code()) ? 4 : 3;
            }
            if (ex instanceof IllegalArgumentException) {
                cmd.getErr().println(Jsons.toJson(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage()))));
                return 2;
            }
            throw ex;
        });
        return commandLine;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized vigil at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "create", description = "Register a new agent instance and its execution")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Option(names = {"--task-id"}, required = true, description = "Task the agent works on")
        String taskId;

        @Option(names = {"--task-list-id"}, required = true, description = "Owning task list")
        String taskListId;

        @Option(names = {"--pid"}, description = "OS process id, when already spawned")
        Long pid;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.createInstance(taskId, taskListId, pid)));
            return 0;
        }
    }

    @Command(name = "attach", description = "Record the OS process id of an instance")
    static final class AttachCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Instance id")
        String instanceId;

        @Option(names = {"--pid"}, required = true, description = "OS process id")
        long pid;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.attachProcess(instanceId, pid)));
            return 0;
        }
    }

    @Command(name = "heartbeat", description = "Record a liveness signal for an instance")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Instance id")
        String instanceId;

        @Option(names = {"--timestamp"}, description = "Heartbeat time in epoch ms (defaults to now)")
        Long timestamp;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.heartbeat(instanceId, timestamp)));
            return 0;
        }
    }

    @Command(name = "terminal", description = "Move an instance to completed, failed or terminated")
    static final class TerminalCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Instance id")
        String instanceId;

        @Option(names = {"--status"}, required = true, description = "completed | failed | terminated")
        String status;

        @Option(names = {"--reason"}, description = "Termination reason (required unless completed)")
        String reason;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.markTerminal(instanceId, InstanceStatus.fromString(status), reason)));
            return 0;
        }
    }

    @Command(name = "emit", description = "Append one transcript entry to an execution")
    static final class EmitCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Option(names = {"--instance-id"}, required = true, description = "Emitting instance id")
        String instanceId;

        @Option(names = {"--task-id"}, required = true, description = "Task id of the execution")
        String taskId;

        @Option(names = {"--type"}, required = true, description = "lifecycle | tool_use | error | heartbeat | assertion")
        String entryType;

        @Option(names = {"--category"}, required = true, description = "Entry category, e.g. build or test")
        String category;

        @Option(names = {"--summary"}, required = true, description = "Short human-readable summary")
        String summary;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "Payload JSON object")
        String payloadJson;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            ObjectNode payload = Jsons.readObject(payloadJson);
            EmitRequest request = new EmitRequest(
                    executionId,
                    instanceId,
                    taskId,
                    EntryType.fromString(entryType),
                    category,
                    summary,
                    payload
            );
            System.out.println(Jsons.toJson(runtime.emit(request)));
            return 0;
        }
    }

    @Command(name = "dropped", description = "Report transcript events a worker had to discard")
    static final class DroppedCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Option(names = {"--count"}, required = true, description = "Number of dropped events")
        long count;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            long total = runtime.reportDroppedEvents(executionId, count);
            System.out.println(Jsons.toJson(Map.of("executionId", executionId, "droppedEvents", total)));
            return 0;
        }
    }

    @Command(name = "status", description = "Show the reconciled status of one instance")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Instance id")
        String instanceId;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            EffectiveStatus status = runtime.effectiveStatus(instanceId);
            System.out.println(Jsons.toJson(status));
            return status.found() ? 0 : 1;
        }
    }

    @Command(name = "instances", description = "List instances with reconciled status")
    static final class InstancesCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Option(names = {"--status"}, description = "Filter by stored status")
        String status;

        @Option(names = {"--task-list-id"}, description = "Filter by task list")
        String taskListId;

        @Option(names = {"--task-id"}, description = "Filter by task")
        String taskId;

        @Option(names = {"--stale"}, description = "Only running instances past the stale timeout")
        boolean staleOnly;

        @Option(names = {"--include-archived"}, description = "Include archived terminal instances")
        boolean includeArchived;

        @Option(names = {"--limit"}, defaultValue = "500", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            InstanceFilter filter = new InstanceFilter(
                    status == null ? null : InstanceStatus.fromString(status),
                    taskListId,
                    taskId,
                    staleOnly,
                    includeArchived,
                    limit
            );
            List<EffectiveStatus> rows = runtime.listInstances(filter);
            System.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "transcript", description = "Read the ordered transcript of an execution")
    static final class TranscriptCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Option(names = {"--from"}, defaultValue = "1", description = "First sequence to include")
        long fromSequence;

        @Option(names = {"--limit"}, defaultValue = "1000", description = "Max entries (0 for all)")
        int limit;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            ReconciledStateQuery.TranscriptPage page = runtime.getTranscript(executionId, fromSequence, limit);
            System.out.println(Jsons.toJson(page));
            return page.found() ? 0 : 1;
        }
    }

    @Command(name = "tool-uses", description = "List tool invocations of an execution")
    static final class ToolUsesCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Option(names = {"--errors-only"}, description = "Only failed tool calls")
        boolean errorsOnly;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.listToolUses(executionId, errorsOnly)));
            return 0;
        }
    }

    @Command(name = "assertions", description = "List assertion results of an execution")
    static final class AssertionsCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Option(names = {"--result"}, description = "pass | fail | skip | warn")
        String result;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            AssertionOutcome outcome = result == null ? null : AssertionOutcome.fromString(result);
            System.out.println(Jsons.toJson(runtime.listAssertions(executionId, outcome)));
            return 0;
        }
    }

    @Command(name = "summary", description = "Reconciled instance counts by status")
    static final class SummaryCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.summary()));
            return 0;
        }
    }

    @Command(name = "reap", description = "Run one liveness reaper pass")
    static final class ReapCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            var out = runtime.reapOnce();
            System.out.println(Jsons.toJson(out));
            return out.failed() ? 1 : 0;
        }
    }

    @Command(name = "archive", description = "Hide old terminal instances from default listings")
    static final class ArchiveCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Option(names = {"--older-than-ms"}, description = "Retention window (defaults to archiveAfterMs setting)")
        Long olderThanMs;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            int archived = runtime.archive(olderThanMs);
            System.out.println(Jsons.toJson(Map.of("archived", archived)));
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload vigil-settings.json and report changed fields")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.reloadSettings()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show runtime counters as JSON")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.stats()));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus text metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.print(runtime.metricsText());
            return 0;
        }
    }

    @Command(name = "health", description = "Check store, audit directory and reaper alert state")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            VigilRuntime.HealthOutcome out = runtime.health();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            for (JsonNode row : runtime.auditLogger().tail(lines)) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            AuditLogger.IntegrityReport out = runtime.auditLogger().verify();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Override
        public Integer call() {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.schemaMigrations()));
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the HTTP API with the background reaper")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        VigilCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind host")
        String host;

        @Option(names = {"--port"}, defaultValue = "8787", description = "Bind port")
        int port;

        @Option(names = {"--threads"}, defaultValue = "16", description = "HTTP worker threads")
        int threads;

        @Option(names = {"--max-streams"}, defaultValue = "256", description = "Open event streams allowed at once")
        int maxStreams;

        @Override
        public Integer call() throws Exception {
            VigilRuntime runtime = parent.runtime();
            runtime.init();
            SupervisorHttpApi api = new SupervisorHttpApi(runtime);
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                running.set(false);
                api.close();
                runtime.close();
            }, "vigil-shutdown"));
            int bound = api.start(host, port, threads, maxStreams);
            runtime.startBackground();
            System.out.println("Supervisor API listening on http://" + host + ":" + bound);
            while (running.get()) {
                Thread.sleep(1_000L);
            }
            return 0;
        }
    }
}
