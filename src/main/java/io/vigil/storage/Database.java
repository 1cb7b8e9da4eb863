package io.vigil.storage;

import io.vigil.config.VigilConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "vigil.schema.migration.v1";
    private final VigilConfig config;
    private final String jdbcUrl;
    private volatile long busyTimeoutMs;

    public Database(VigilConfig config, long busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = Math.max(0L, busyTimeoutMs);
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Every connection waits at most {@link #busyTimeoutMs()} for a competing writer, so no store
     * call blocks indefinitely. Transactions begin IMMEDIATE: a read-then-write sequence holds the
     * write lock from its first statement.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Long.toString(busyTimeoutMs));
        props.setProperty("foreign_keys", "true");
        props.setProperty("transaction_mode", "IMMEDIATE");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public long busyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void updateBusyTimeout(long busyTimeoutMs) {
        this.busyTimeoutMs = Math.max(0L, busyTimeoutMs);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS instances (
                        instance_id TEXT PRIMARY KEY,
                        task_id TEXT NOT NULL,
                        task_list_id TEXT NOT NULL,
                        execution_id TEXT NOT NULL UNIQUE,
                        status TEXT NOT NULL,
                        pid INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        last_heartbeat_at_ms INTEGER,
                        terminated_at_ms INTEGER,
                        termination_reason TEXT,
                        archived INTEGER NOT NULL DEFAULT 0,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS executions (
                        execution_id TEXT PRIMARY KEY,
                        instance_id TEXT NOT NULL UNIQUE,
                        task_id TEXT NOT NULL,
                        started_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        outcome TEXT,
                        dropped_events INTEGER NOT NULL DEFAULT 0,
                        FOREIGN KEY(instance_id) REFERENCES instances(instance_id)
                    )
                    """);
            ensureInstanceColumns(conn);
            ensureExecutionColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS transcript_entries (
                        entry_id TEXT PRIMARY KEY,
                        execution_id TEXT NOT NULL,
                        instance_id TEXT NOT NULL,
                        task_id TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        entry_type TEXT NOT NULL,
                        category TEXT NOT NULL,
                        summary TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        committed_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(execution_id) REFERENCES executions(execution_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tool_uses (
                        tool_use_id TEXT PRIMARY KEY,
                        execution_id TEXT NOT NULL,
                        entry_id TEXT NOT NULL UNIQUE,
                        sequence INTEGER NOT NULL,
                        tool TEXT NOT NULL,
                        tool_category TEXT NOT NULL,
                        input TEXT,
                        input_summary TEXT,
                        result_status TEXT NOT NULL,
                        output TEXT,
                        error_message TEXT,
                        duration_ms INTEGER,
                        recorded_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(entry_id) REFERENCES transcript_entries(entry_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS assertion_results (
                        assertion_id TEXT PRIMARY KEY,
                        execution_id TEXT NOT NULL,
                        entry_id TEXT NOT NULL UNIQUE,
                        sequence INTEGER NOT NULL,
                        category TEXT NOT NULL,
                        description TEXT NOT NULL,
                        result TEXT NOT NULL,
                        evidence TEXT,
                        chain_id TEXT,
                        recorded_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(entry_id) REFERENCES transcript_entries(entry_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS transition_conflicts (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        instance_id TEXT NOT NULL,
                        source TEXT NOT NULL,
                        stored_status TEXT,
                        stored_reason TEXT,
                        attempted_status TEXT,
                        attempted_reason TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_entries_execution_sequence ON transcript_entries(execution_id, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_instances_status_heartbeat ON instances(status, last_heartbeat_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_instances_task ON instances(task_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tool_uses_execution ON tool_uses(execution_id, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_assertions_execution ON assertion_results(execution_id, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_transition_conflicts_time ON transition_conflicts(occurred_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureInstanceColumns(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "instances");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("archived")) {
                st.execute("ALTER TABLE instances ADD COLUMN archived INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void ensureExecutionColumns(Connection conn) throws SQLException {
        Set<String> columns = tableColumns(conn, "executions");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("dropped_events")) {
                st.execute("ALTER TABLE executions ADD COLUMN dropped_events INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private Set<String> tableColumns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        return columns;
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_listing_indexes",
                "Add task-list and archive indexes used by reconciled listings",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_instances_task_list ON instances(task_list_id, created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_instances_archived_status ON instances(archived, status)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version";
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
