package io.vigil.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class VigilConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "vigil-settings.json";

    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_STALE_TIMEOUT_MULTIPLIER = 3;
    public static final long DEFAULT_REAPER_TICK_MS = 10_000L;
    public static final int DEFAULT_REAPER_BATCH_LIMIT = 256;
    public static final int DEFAULT_REAPER_ALERT_AFTER_FAILURES = 3;
    public static final long DEFAULT_PROCESS_KILL_GRACE_MS = 2_000L;
    public static final long DEFAULT_STORE_BUSY_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_STORE_RETRY_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_STORE_RETRY_BASE_BACKOFF_MS = 200L;
    public static final long DEFAULT_STORE_RETRY_MAX_BACKOFF_MS = 10_000L;
    public static final int DEFAULT_LOCAL_BACKLOG_CAPACITY = 10_000;
    public static final int DEFAULT_SUBSCRIBER_QUEUE_CAPACITY = 1_024;
    public static final long DEFAULT_ARCHIVE_AFTER_MS = 30L * 24L * 60L * 60L * 1000L;

    private final Path rootDir;

    public VigilConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static VigilConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new VigilConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("vigil.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }
}
