package io.vigil.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolved supervisor tuning. Every liveness and retry threshold in the runtime is read from here;
 * nothing downstream hard-codes an interval.
 */
public record SupervisorSettings(
        long heartbeatIntervalMs,
        int staleTimeoutMultiplier,
        long reaperTickMs,
        int reaperBatchLimit,
        int reaperAlertAfterFailures,
        long processKillGraceMs,
        long storeBusyTimeoutMs,
        int storeRetryMaxAttempts,
        long storeRetryBaseBackoffMs,
        long storeRetryMaxBackoffMs,
        int localBacklogCapacity,
        int subscriberQueueCapacity,
        long archiveAfterMs
) {
    public static SupervisorSettings defaults() {
        return new SupervisorSettings(
                VigilConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                VigilConfig.DEFAULT_STALE_TIMEOUT_MULTIPLIER,
                VigilConfig.DEFAULT_REAPER_TICK_MS,
                VigilConfig.DEFAULT_REAPER_BATCH_LIMIT,
                VigilConfig.DEFAULT_REAPER_ALERT_AFTER_FAILURES,
                VigilConfig.DEFAULT_PROCESS_KILL_GRACE_MS,
                VigilConfig.DEFAULT_STORE_BUSY_TIMEOUT_MS,
                VigilConfig.DEFAULT_STORE_RETRY_MAX_ATTEMPTS,
                VigilConfig.DEFAULT_STORE_RETRY_BASE_BACKOFF_MS,
                VigilConfig.DEFAULT_STORE_RETRY_MAX_BACKOFF_MS,
                VigilConfig.DEFAULT_LOCAL_BACKLOG_CAPACITY,
                VigilConfig.DEFAULT_SUBSCRIBER_QUEUE_CAPACITY,
                VigilConfig.DEFAULT_ARCHIVE_AFTER_MS
        );
    }

    /**
     * A running instance is stale once its last heartbeat is older than this.
     */
    public long staleTimeoutMs() {
        return heartbeatIntervalMs * staleTimeoutMultiplier;
    }

    public static SupervisorSettings fromFile(SettingsFile file, SupervisorSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long heartbeatInterval = sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 1L);
        int multiplier = sanitizeInt(file.staleTimeoutMultiplier(), defaults.staleTimeoutMultiplier(), 1);
        long staleTimeout = heartbeatInterval * multiplier;
        long reaperTick = sanitizeLong(file.reaperTickMs(), defaults.reaperTickMs(), 1L);
        // Tick must stay below the stale timeout.
        if (reaperTick >= staleTimeout) {
            reaperTick = Math.max(1L, staleTimeout / 2L);
        }
        int batchLimit = sanitizeInt(file.reaperBatchLimit(), defaults.reaperBatchLimit(), 1);
        int alertAfter = sanitizeInt(file.reaperAlertAfterFailures(), defaults.reaperAlertAfterFailures(), 1);
        long killGrace = sanitizeLong(file.processKillGraceMs(), defaults.processKillGraceMs(), 0L);
        long busyTimeout = sanitizeLong(file.storeBusyTimeoutMs(), defaults.storeBusyTimeoutMs(), 0L);
        int retryAttempts = sanitizeInt(file.storeRetryMaxAttempts(), defaults.storeRetryMaxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.storeRetryBaseBackoffMs(), defaults.storeRetryBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.storeRetryMaxBackoffMs(), defaults.storeRetryMaxBackoffMs(), baseBackoff);
        int backlog = sanitizeInt(file.localBacklogCapacity(), defaults.localBacklogCapacity(), 1);
        int subscriberQueue = sanitizeInt(file.subscriberQueueCapacity(), defaults.subscriberQueueCapacity(), 1);
        long archiveAfter = sanitizeLong(file.archiveAfterMs(), defaults.archiveAfterMs(), 0L);
        return new SupervisorSettings(
                heartbeatInterval,
                multiplier,
                reaperTick,
                batchLimit,
                alertAfter,
                killGrace,
                busyTimeout,
                retryAttempts,
                baseBackoff,
                maxBackoff,
                backlog,
                subscriberQueue,
                archiveAfter
        );
    }

    public static List<String> diffFields(SupervisorSettings before, SupervisorSettings after) {
        if (before == null || after == null) {
            return List.of();
        }
        List<String> changed = new ArrayList<>();
        if (before.heartbeatIntervalMs() != after.heartbeatIntervalMs()) changed.add("heartbeatIntervalMs");
        if (before.staleTimeoutMultiplier() != after.staleTimeoutMultiplier()) changed.add("staleTimeoutMultiplier");
        if (before.reaperTickMs() != after.reaperTickMs()) changed.add("reaperTickMs");
        if (before.reaperBatchLimit() != after.reaperBatchLimit()) changed.add("reaperBatchLimit");
        if (before.reaperAlertAfterFailures() != after.reaperAlertAfterFailures()) changed.add("reaperAlertAfterFailures");
        if (before.processKillGraceMs() != after.processKillGraceMs()) changed.add("processKillGraceMs");
        if (before.storeBusyTimeoutMs() != after.storeBusyTimeoutMs()) changed.add("storeBusyTimeoutMs");
        if (before.storeRetryMaxAttempts() != after.storeRetryMaxAttempts()) changed.add("storeRetryMaxAttempts");
        if (before.storeRetryBaseBackoffMs() != after.storeRetryBaseBackoffMs()) changed.add("storeRetryBaseBackoffMs");
        if (before.storeRetryMaxBackoffMs() != after.storeRetryMaxBackoffMs()) changed.add("storeRetryMaxBackoffMs");
        if (before.localBacklogCapacity() != after.localBacklogCapacity()) changed.add("localBacklogCapacity");
        if (before.subscriberQueueCapacity() != after.subscriberQueueCapacity()) changed.add("subscriberQueueCapacity");
        if (before.archiveAfterMs() != after.archiveAfterMs()) changed.add("archiveAfterMs");
        return changed;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    /**
     * On-disk shape of {@code vigil-settings.json}; absent keys fall back to defaults.
     */
    public record SettingsFile(
            Long heartbeatIntervalMs,
            Integer staleTimeoutMultiplier,
            Long reaperTickMs,
            Integer reaperBatchLimit,
            Integer reaperAlertAfterFailures,
            Long processKillGraceMs,
            Long storeBusyTimeoutMs,
            Integer storeRetryMaxAttempts,
            Long storeRetryBaseBackoffMs,
            Long storeRetryMaxBackoffMs,
            Integer localBacklogCapacity,
            Integer subscriberQueueCapacity,
            Long archiveAfterMs
    ) {
    }
}
