package io.vigil.runtime;

import io.vigil.config.SupervisorSettings;
import io.vigil.config.VigilConfig;
import io.vigil.liveness.HeartbeatIngest;
import io.vigil.liveness.LivenessReaper;
import io.vigil.liveness.OsProcessProbe;
import io.vigil.liveness.ProcessProbe;
import io.vigil.model.AgentInstance;
import io.vigil.model.AssertionOutcome;
import io.vigil.model.AssertionRecord;
import io.vigil.model.EffectiveStatus;
import io.vigil.model.EmitReceipt;
import io.vigil.model.ExecutionRecord;
import io.vigil.model.InstanceFilter;
import io.vigil.model.InstanceHandle;
import io.vigil.model.InstanceStatus;
import io.vigil.model.ToolUseRecord;
import io.vigil.observability.AuditLogger;
import io.vigil.observability.PrometheusFormatter;
import io.vigil.query.ReconciledStateQuery;
import io.vigil.registry.InstanceRegistry;
import io.vigil.storage.Database;
import io.vigil.storage.InstanceStore;
import io.vigil.storage.TranscriptStore;
import io.vigil.stream.Subscription;
import io.vigil.stream.TranscriptFanout;
import io.vigil.transcript.EmitRequest;
import io.vigil.transcript.RetryingEmitter;
import io.vigil.transcript.TranscriptEmitter;
import io.vigil.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the supervisor together and owns the background reaper loop.
 */
public final class VigilRuntime implements AutoCloseable {
    private static final long SETTINGS_RELOAD_INTERVAL_MS = 10_000L;

    private final VigilConfig config;
    private final Clock clock;
    private final Database database;
    private final InstanceStore instanceStore;
    private final TranscriptStore transcriptStore;
    private final AuditLogger auditLogger;
    private final InstanceRegistry registry;
    private final HeartbeatIngest heartbeatIngest;
    private final LivenessReaper reaper;
    private final TranscriptFanout fanout;
    private final TranscriptEmitter emitter;
    private final ReconciledStateQuery query;
    private final Object settingsLock;
    private volatile SupervisorSettings settings;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;
    private ScheduledExecutorService scheduler;

    public VigilRuntime(VigilConfig config) {
        this(config, Clock.systemUTC(), new OsProcessProbe());
    }

    public VigilRuntime(VigilConfig config, Clock clock, ProcessProbe probe) {
        this.config = config;
        this.clock = clock;
        this.settings = SupervisorSettings.defaults();
        this.settingsFileMtimeMs = Long.MIN_VALUE;
        this.lastSettingsCheckMs = 0L;
        this.settingsLock = new Object();
        this.database = new Database(config, settings.storeBusyTimeoutMs());
        this.instanceStore = new InstanceStore(database);
        this.transcriptStore = new TranscriptStore(database);
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key")),
                clock
        );
        this.registry = new InstanceRegistry(instanceStore, auditLogger, clock);
        this.heartbeatIngest = new HeartbeatIngest(instanceStore, auditLogger, clock, this::settings);
        this.reaper = new LivenessReaper(instanceStore, probe, auditLogger, clock, this::settings);
        this.fanout = new TranscriptFanout(transcriptStore, () -> settings().subscriberQueueCapacity());
        this.emitter = new TranscriptEmitter(transcriptStore, fanout, clock);
        this.query = new ReconciledStateQuery(instanceStore, transcriptStore, clock, this::settings);
    }

    public void init() {
        database.init();
        loadSettings(true);
    }

    public SupervisorSettings settings() {
        return settings;
    }

    public VigilConfig config() {
        return config;
    }

    public InstanceHandle createInstance(String taskId, String taskListId, Long pid) {
        return registry.createInstance(taskId, taskListId, pid);
    }

    public AgentInstance attachProcess(String instanceId, long pid) {
        return registry.attachProcess(instanceId, pid);
    }

    public InstanceStore.TransitionResult markRunning(String instanceId) {
        return registry.markRunning(instanceId);
    }

    public InstanceStore.TransitionResult markTerminal(String instanceId, InstanceStatus status, String reason) {
        return registry.markTerminal(instanceId, status, reason, "worker");
    }

    public InstanceStore.HeartbeatOutcome heartbeat(String instanceId, Long timestampMs) {
        return heartbeatIngest.heartbeat(instanceId, timestampMs);
    }

    public EmitReceipt emit(EmitRequest request) {
        return emitter.emit(request);
    }

    public long reportDroppedEvents(String executionId, long count) {
        return emitter.reportDroppedEvents(executionId, count);
    }

    /**
     * A caller-side emitter that retries and buffers on store outages. Each worker owns its own.
     */
    public RetryingEmitter newRetryingEmitter(RetryingEmitter.Sleeper sleeper) {
        return new RetryingEmitter(emitter, this::settings, sleeper);
    }

    public EffectiveStatus effectiveStatus(String instanceId) {
        return query.effectiveStatus(instanceId);
    }

    public List<EffectiveStatus> listInstances(InstanceFilter filter) {
        return query.listInstances(filter);
    }

    public ReconciledStateQuery.TranscriptPage getTranscript(String executionId, long fromSequence, int limit) {
        return query.getTranscript(executionId, fromSequence, limit);
    }

    public Optional<ExecutionRecord> getExecution(String executionId) {
        return query.getExecution(executionId);
    }

    public List<ToolUseRecord> listToolUses(String executionId, boolean errorsOnly) {
        return query.listToolUses(executionId, errorsOnly);
    }

    public List<AssertionRecord> listAssertions(String executionId, AssertionOutcome result) {
        return query.listAssertions(executionId, result);
    }

    public ReconciledStateQuery.StatusSummary summary() {
        return query.summary();
    }

    public Subscription subscribe(String executionId, Long fromSequence) {
        return fanout.subscribe(executionId, fromSequence);
    }

    public LivenessReaper.ReapSummary reapOnce() {
        return reaper.tick();
    }

    public int archive(Long retentionMs) {
        return registry.archiveTerminal(retentionMs == null ? settings.archiveAfterMs() : retentionMs);
    }

    /**
     * Starts the reaper loop. The delay is re-read from settings before each tick, so a reloaded
     * {@code reaperTickMs} takes effect without a restart.
     */
    public synchronized void startBackground() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "vigil-reaper");
            t.setDaemon(true);
            return t;
        });
        scheduleNextTick(scheduler);
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                System.err.println("WARN reaper loop did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    private void scheduleNextTick(ScheduledExecutorService executor) {
        if (executor.isShutdown()) {
            return;
        }
        executor.schedule(() -> {
            try {
                maybeReloadSettings(SETTINGS_RELOAD_INTERVAL_MS);
                reaper.tick();
            } catch (RuntimeException e) {
                System.err.println("WARN background tick failed: " + e.getMessage());
            } finally {
                scheduleNextTick(executor);
            }
        }, settings.reaperTickMs(), TimeUnit.MILLISECONDS);
    }

    public StatsOutcome stats() {
        ReconciledStateQuery.StatusSummary summary = query.summary();
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        byStatus.put("pending", summary.pending());
        byStatus.put("running", summary.runningLive());
        byStatus.put("stale", summary.runningStale());
        byStatus.put("completed", summary.completed());
        byStatus.put("failed", summary.failed());
        byStatus.put("terminated", summary.terminated());
        return new StatsOutcome(
                byStatus,
                summary.runningStale(),
                transcriptStore.countEntries(),
                emitter.emittedTotal(),
                heartbeatIngest.acceptedTotal(),
                heartbeatIngest.ignoredTotal(),
                heartbeatIngest.rejectedTerminalTotal(),
                reaper.reapedTotal(),
                reaper.tickFailuresTotal(),
                reaper.consecutiveFailures(),
                reaper.alerting() ? 1 : 0,
                reaper.probeFailuresTotal(),
                instanceStore.countTransitionConflicts(),
                fanout.subscriberCount(),
                fanout.disconnectedTotal(),
                fanout.publishedTotal()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public HealthOutcome health() {
        boolean dbOk;
        String dbError = null;
        try (Connection ignored = database.openConnection()) {
            dbOk = true;
        } catch (SQLException e) {
            dbOk = false;
            dbError = e.getMessage();
        }
        boolean auditOk = Files.isDirectory(config.auditRoot());
        boolean reaperAlert = reaper.alerting();
        boolean ok = dbOk && auditOk && !reaperAlert;
        return new HealthOutcome(
                ok,
                dbOk,
                dbError,
                auditOk,
                reaperAlert,
                reaper.consecutiveFailures(),
                reaper.lastTickAtMs(),
                reaper.lastError(),
                Instant.ofEpochMilli(clock.millis()).toString()
        );
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadSettings(true);
    }

    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = clock.millis();
        if ((nowMs - lastSettingsCheckMs) < Math.max(1_000L, minIntervalMs)) {
            return new SettingsReloadOutcome(
                    false,
                    settingsFileMtimeMs >= 0L,
                    config.settingsFile().toString(),
                    settings,
                    "skip_interval",
                    nowMs,
                    List.of()
            );
        }
        return loadSettings(false);
    }

    private SettingsReloadOutcome loadSettings(boolean force) {
        synchronized (settingsLock) {
            Path cfg = config.settingsFile();
            long checkedAtMs = clock.millis();
            lastSettingsCheckMs = checkedAtMs;
            long mtime = resolveFileMtimeMs(cfg);
            if (!force && mtime == settingsFileMtimeMs) {
                return new SettingsReloadOutcome(false, mtime >= 0L, cfg.toString(), settings, "unchanged", checkedAtMs, List.of());
            }
            SupervisorSettings defaults = SupervisorSettings.defaults();
            SupervisorSettings resolved;
            String source;
            if (mtime < 0L) {
                resolved = defaults;
                source = "defaults";
            } else {
                try {
                    SupervisorSettings.SettingsFile file = Jsons.mapper().readValue(cfg.toFile(), SupervisorSettings.SettingsFile.class);
                    resolved = SupervisorSettings.fromFile(file, defaults);
                    source = "file";
                } catch (IOException e) {
                    throw new RuntimeException("Failed to load supervisor settings: " + cfg, e);
                }
            }
            SupervisorSettings previous = settings;
            settings = resolved;
            settingsFileMtimeMs = mtime;
            database.updateBusyTimeout(resolved.storeBusyTimeoutMs());
            boolean changed = !resolved.equals(previous);
            List<String> changedFields = changed ? SupervisorSettings.diffFields(previous, resolved) : List.of();
            if (changed || "file".equals(source)) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "runtime.settings.load",
                        "system",
                        "runtime/settings",
                        changed ? "reloaded" : "ok",
                        null,
                        null,
                        Map.of(
                                "config", cfg.toString(),
                                "source", source,
                                "changed_count", changedFields.size(),
                                "changed_fields", changedFields
                        )
                ));
            }
            return new SettingsReloadOutcome(
                    changed,
                    mtime >= 0L,
                    cfg.toString(),
                    resolved,
                    changed ? "reloaded" : ("defaults".equals(source) ? "defaults" : "unchanged_content"),
                    checkedAtMs,
                    changedFields
            );
        }
    }

    private long resolveFileMtimeMs(Path path) {
        if (!Files.exists(path)) {
            return -1L;
        }
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings mtime: " + path, e);
        }
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            SupervisorSettings settings,
            String message,
            long checkedAtMs,
            List<String> changedFields
    ) {
    }

    public record StatsOutcome(
            Map<String, Integer> instancesByStatus,
            int staleRunning,
            long transcriptEntries,
            long emittedTotal,
            long heartbeatsAccepted,
            long heartbeatsIgnored,
            long heartbeatsRejectedTerminal,
            long reapedTotal,
            long reaperTickFailuresTotal,
            int reaperConsecutiveFailures,
            int reaperAlerting,
            long probeFailuresTotal,
            long conflictingTransitionsTotal,
            int streamSubscribers,
            long streamDisconnectsTotal,
            long streamPublishedTotal
    ) {
    }

    public record HealthOutcome(
            boolean ok,
            boolean dbOk,
            String dbError,
            boolean auditDirOk,
            boolean reaperAlert,
            int reaperConsecutiveFailures,
            long reaperLastTickAtMs,
            String reaperLastError,
            String checkedAt
    ) {
    }
}
