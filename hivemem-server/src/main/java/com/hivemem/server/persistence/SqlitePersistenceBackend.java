/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.hivemem.server.persistence;

import com.hivemem.core.exception.BackendUnavailableException;
import com.hivemem.core.exception.HiveMemTimeoutException;
import com.hivemem.core.exception.ResourceExhaustedException;
import com.hivemem.core.model.DataType;
import com.hivemem.core.model.EntryMetadata;
import com.hivemem.core.model.KeyFilter;
import com.hivemem.core.model.MemoryEntry;
import com.hivemem.core.model.MemoryEvent;
import com.hivemem.core.model.MemoryLock;
import com.hivemem.core.model.VersionRecord;
import com.hivemem.core.util.JsonUtils;
import com.hivemem.core.util.KeyPattern;
import com.hivemem.core.util.ValueCodec;
import com.hivemem.server.config.HiveMemProperties;
import com.hivemem.server.config.ProjectPaths;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite implementation of PersistenceBackend.
 * Entry data lives in {@code memory.db}; the agent access log and event log live in {@code hive.db}.
 * Each database is reached through its own HikariCP pool.
 */
@Slf4j
public class SqlitePersistenceBackend extends AbstractPersistenceBackend {

    private static final String MEMORY_POOL = "memory";
    private static final String HIVE_POOL = "hive";

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final HiveMemProperties.Sqlite config;
    private final Path memoryDbPath;
    private final Path hiveDbPath;

    private HikariDataSource memoryPool;
    private HikariDataSource hivePool;

    private volatile boolean alreadyShutdown = false;

    public SqlitePersistenceBackend(HiveMemProperties properties, ProjectPaths paths) {
        super(properties.getPersistence().getAsyncQueueCapacity());
        this.config = properties.getPersistence().getSqlite();
        this.memoryDbPath = paths.memoryDatabase();
        this.hiveDbPath = paths.hiveDatabase();
    }

    @Override
    public PersistenceType getType() {
        return PersistenceType.SQLITE;
    }

    @Override
    public void initialize() {
        log.info("Initializing SQLite persistence backend at: {}", memoryDbPath.getParent());

        try {
            Files.createDirectories(memoryDbPath.getParent());

            memoryPool = createPool(MEMORY_POOL, memoryDbPath);
            hivePool = createPool(HIVE_POOL, hiveDbPath);

            createMemoryTables();
            createHiveTables();

            available = true;
            log.info("SQLite persistence backend initialized (pool size {}-{})",
                    config.getMinPoolSize(), config.getMaxPoolSize());
        } catch (Exception e) {
            log.error("Failed to initialize SQLite persistence backend: {}", e.getMessage(), e);
            available = false;
            closePools();
        }
    }

    private HikariDataSource createPool(String name, Path dbPath) {
        HikariConfig hikari = new HikariConfig();
        hikari.setDriverClassName("org.sqlite.JDBC");
        hikari.setJdbcUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setMinimumIdle(Math.min(config.getMinPoolSize(), config.getMaxPoolSize()));
        hikari.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikari.setPoolName("hivemem-" + name + "-pool");
        hikari.addDataSourceProperty("journal_mode", "WAL");
        hikari.addDataSourceProperty("synchronous", "NORMAL");
        hikari.addDataSourceProperty("busy_timeout", "5000");
        return new HikariDataSource(hikari);
    }

    @Override
    public boolean probe() {
        if (!available) {
            return false;
        }
        try {
            execute(memoryPool, MEMORY_POOL, "probe", conn -> selectOne(conn));
            execute(hivePool, HIVE_POOL, "probe", conn -> selectOne(conn));
            return true;
        } catch (RuntimeException e) {
            log.warn("SQLite probe failed: {}", e.getMessage());
            return false;
        }
    }

    private static int selectOne(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT 1")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    @Override
    public void healthCheck() {
        logPoolStats(memoryPool);
        logPoolStats(hivePool);
    }

    private void logPoolStats(HikariDataSource pool) {
        if (pool == null || pool.isClosed()) {
            return;
        }
        HikariPoolMXBean stats = pool.getHikariPoolMXBean();
        if (stats != null) {
            log.debug("{}: active={}, idle={}, total={}, waiting={}", pool.getPoolName(),
                    stats.getActiveConnections(), stats.getIdleConnections(),
                    stats.getTotalConnections(), stats.getThreadsAwaitingConnection());
        }
    }

    @Override
    public void shutdown() {
        if (alreadyShutdown) {
            log.debug("SQLite shutdown already completed - skipping duplicate shutdown call");
            return;
        }
        alreadyShutdown = true;

        log.info("Shutting down SQLite persistence backend...");
        shutdownAsyncExecutor();
        available = false;
        closePools();
        log.info("SQLite persistence backend shut down");
    }

    private void closePools() {
        if (memoryPool != null && !memoryPool.isClosed()) {
            memoryPool.close();
        }
        if (hivePool != null && !hivePool.isClosed()) {
            hivePool.close();
        }
    }

    private void createMemoryTables() throws SQLException {
        try (Connection conn = memoryPool.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS shared_memory (
                    key TEXT PRIMARY KEY,
                    namespace TEXT NOT NULL,
                    data_type TEXT NOT NULL,
                    value TEXT,
                    metadata TEXT,
                    version INTEGER NOT NULL,
                    created_at INTEGER,
                    updated_at INTEGER,
                    expires_at INTEGER,
                    size_bytes INTEGER DEFAULT 0,
                    access_count INTEGER DEFAULT 0,
                    last_accessed INTEGER
                )
            """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memory_versions (
                    key TEXT NOT NULL,
                    version INTEGER NOT NULL,
                    value TEXT,
                    metadata TEXT,
                    created_at INTEGER,
                    PRIMARY KEY (key, version)
                )
            """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memory_locks (
                    key TEXT PRIMARY KEY,
                    agent_id TEXT NOT NULL,
                    lock_type TEXT NOT NULL,
                    acquired_at INTEGER,
                    expires_at INTEGER
                )
            """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memory_tombstones (
                    key TEXT PRIMARY KEY,
                    last_version INTEGER NOT NULL,
                    deleted_at INTEGER
                )
            """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memory_namespace ON shared_memory(namespace)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memory_data_type ON shared_memory(data_type)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memory_expires ON shared_memory(expires_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memory_last_accessed ON shared_memory(last_accessed)");
        }
    }

    private void createHiveTables() throws SQLException {
        try (Connection conn = hivePool.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS agent_memory (
                    agent_id TEXT NOT NULL,
                    memory_key TEXT NOT NULL,
                    access_type TEXT NOT NULL,
                    timestamp INTEGER,
                    PRIMARY KEY (agent_id, memory_key)
                )
            """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memory_events (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    event_type TEXT NOT NULL,
                    memory_key TEXT NOT NULL,
                    agent_id TEXT,
                    timestamp INTEGER,
                    data TEXT
                )
            """);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_agent_memory_agent ON agent_memory(agent_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memory_events_key ON memory_events(memory_key)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memory_events_timestamp ON memory_events(timestamp)");
        }
    }

    // ==================== Entry Operations ====================

    @Override
    public void saveEntry(MemoryEntry entry) {
        String sql = """
            INSERT OR REPLACE INTO shared_memory
            (key, namespace, data_type, value, metadata, version, created_at, updated_at,
             expires_at, size_bytes, access_count, last_accessed)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

        execute(memoryPool, MEMORY_POOL, "save entry " + entry.getKey(), conn -> {
            try (PreparedStatement stmt = prepare(conn, sql)) {
                EntryMetadata metadata = entry.getMetadata();
                stmt.setString(1, entry.getKey());
                stmt.setString(2, entry.getNamespace());
                stmt.setString(3, entry.getDataType().getValue());
                stmt.setString(4, ValueCodec.encode(entry.getValue(), metadata.isCompressed()));
                stmt.setString(5, JsonUtils.toJson(metadata));
                stmt.setLong(6, entry.getVersion());
                setInstant(stmt, 7, metadata.getCreatedAt());
                setInstant(stmt, 8, metadata.getUpdatedAt());
                setInstant(stmt, 9, metadata.getExpiresAt());
                stmt.setLong(10, metadata.getSizeBytes());
                stmt.setLong(11, metadata.getAccessCount());
                setInstant(stmt, 12, metadata.getLastAccessed());
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public MemoryEntry loadEntry(String key) {
        return execute(memoryPool, MEMORY_POOL, "load entry " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn, "SELECT * FROM shared_memory WHERE key = ?")) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? resultSetToEntry(rs) : null;
                }
            }
        });
    }

    @Override
    public List<MemoryEntry> loadActiveEntries(Instant now) {
        String sql = """
            SELECT * FROM shared_memory
            WHERE expires_at IS NULL OR expires_at >= ?
            ORDER BY COALESCE(last_accessed, created_at) DESC
        """;

        return execute(memoryPool, MEMORY_POOL, "load active entries", conn -> {
            List<MemoryEntry> entries = new ArrayList<>();
            try (PreparedStatement stmt = prepare(conn, sql)) {
                stmt.setLong(1, now.toEpochMilli());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        entries.add(resultSetToEntry(rs));
                    }
                }
            }
            log.info("Loaded {} active entries from SQLite", entries.size());
            return entries;
        });
    }

    @Override
    public boolean deleteEntry(String key, boolean purgeVersions, long lastVersion) {
        return execute(memoryPool, MEMORY_POOL, "delete entry " + key, conn -> inTransaction(conn, () -> {
            int deleted;
            try (PreparedStatement stmt = prepare(conn, "DELETE FROM shared_memory WHERE key = ?")) {
                stmt.setString(1, key);
                deleted = stmt.executeUpdate();
            }
            writeTombstone(conn, key, lastVersion, Instant.now());
            if (purgeVersions) {
                deleteVersions(conn, key);
            }
            return deleted > 0;
        }));
    }

    private void writeTombstone(Connection conn, String key, long lastVersion, Instant at) throws SQLException {
        String sql = """
            INSERT INTO memory_tombstones (key, last_version, deleted_at) VALUES (?, ?, ?)
            ON CONFLICT(key) DO UPDATE SET
                last_version = MAX(last_version, excluded.last_version),
                deleted_at = excluded.deleted_at
        """;
        try (PreparedStatement stmt = prepare(conn, sql)) {
            stmt.setString(1, key);
            stmt.setLong(2, lastVersion);
            stmt.setLong(3, at.toEpochMilli());
            stmt.executeUpdate();
        }
    }

    @Override
    public void updateAccessStats(String key, long accessCount, Instant lastAccessed) {
        execute(memoryPool, MEMORY_POOL, "update access stats " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn,
                    "UPDATE shared_memory SET access_count = ?, last_accessed = ? WHERE key = ?")) {
                stmt.setLong(1, accessCount);
                setInstant(stmt, 2, lastAccessed);
                stmt.setString(3, key);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public List<String> findKeys(KeyFilter filter, Instant now) {
        StringBuilder sql = new StringBuilder("SELECT key FROM shared_memory WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.getNamespace() != null) {
            sql.append(" AND namespace = ?");
            params.add(filter.getNamespace());
        }
        if (filter.getDataType() != null) {
            sql.append(" AND data_type = ?");
            params.add(filter.getDataType().getValue());
        }
        if (filter.getAgentId() != null) {
            sql.append(" AND json_extract(metadata, '$.agentId') = ?");
            params.add(filter.getAgentId());
        }
        if (!filter.isIncludeExpired()) {
            sql.append(" AND (expires_at IS NULL OR expires_at >= ?)");
            params.add(now.toEpochMilli());
        }
        sql.append(" ORDER BY key");

        KeyPattern pattern = filter.compiledPattern();
        return execute(memoryPool, MEMORY_POOL, "find keys", conn -> {
            List<String> keys = new ArrayList<>();
            try (PreparedStatement stmt = prepare(conn, sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        String key = rs.getString(1);
                        if (pattern.matches(key)) {
                            keys.add(key);
                        }
                    }
                }
            }
            return keys;
        });
    }

    @Override
    public int deleteExpiredEntries(Instant now) {
        String tombstones = """
            INSERT INTO memory_tombstones (key, last_version, deleted_at)
            SELECT key, version, ? FROM shared_memory WHERE expires_at IS NOT NULL AND expires_at < ?
            ON CONFLICT(key) DO UPDATE SET
                last_version = MAX(last_version, excluded.last_version),
                deleted_at = excluded.deleted_at
        """;

        return execute(memoryPool, MEMORY_POOL, "delete expired entries", conn -> inTransaction(conn, () -> {
            try (PreparedStatement stmt = prepare(conn, tombstones)) {
                stmt.setLong(1, now.toEpochMilli());
                stmt.setLong(2, now.toEpochMilli());
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = prepare(conn,
                    "DELETE FROM shared_memory WHERE expires_at IS NOT NULL AND expires_at < ?")) {
                stmt.setLong(1, now.toEpochMilli());
                int deleted = stmt.executeUpdate();
                if (deleted > 0) {
                    log.debug("Deleted {} expired entries from SQLite", deleted);
                }
                return deleted;
            }
        }));
    }

    @Override
    public Map<String, Long> loadVersionFloors() {
        String sql = """
            SELECT key, MAX(v) AS floor FROM (
                SELECT key, version AS v FROM shared_memory
                UNION ALL SELECT key, last_version AS v FROM memory_tombstones
                UNION ALL SELECT key, version AS v FROM memory_versions
            ) GROUP BY key
        """;

        return execute(memoryPool, MEMORY_POOL, "load version floors", conn -> {
            Map<String, Long> floors = new HashMap<>();
            try (PreparedStatement stmt = prepare(conn, sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    floors.put(rs.getString("key"), rs.getLong("floor"));
                }
            }
            return floors;
        });
    }

    // ==================== Version Operations ====================

    @Override
    public boolean appendVersion(VersionRecord record) {
        String sql = """
            INSERT OR IGNORE INTO memory_versions (key, version, value, metadata, created_at)
            VALUES (?, ?, ?, ?, ?)
        """;

        return execute(memoryPool, MEMORY_POOL, "append version " + record.getKey(), conn -> {
            try (PreparedStatement stmt = prepare(conn, sql)) {
                boolean compressed = record.getMetadata() != null && record.getMetadata().isCompressed();
                stmt.setString(1, record.getKey());
                stmt.setLong(2, record.getVersion());
                stmt.setString(3, ValueCodec.encode(record.getValue(), compressed));
                stmt.setString(4, record.getMetadata() != null ? JsonUtils.toJson(record.getMetadata()) : null);
                setInstant(stmt, 5, record.getCreatedAt());
                return stmt.executeUpdate() == 1;
            }
        });
    }

    @Override
    public VersionRecord loadVersion(String key, long version) {
        return execute(memoryPool, MEMORY_POOL, "load version " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn,
                    "SELECT * FROM memory_versions WHERE key = ? AND version = ?")) {
                stmt.setString(1, key);
                stmt.setLong(2, version);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? resultSetToVersion(rs) : null;
                }
            }
        });
    }

    @Override
    public List<VersionRecord> loadVersions(String key) {
        return execute(memoryPool, MEMORY_POOL, "load versions " + key, conn -> {
            List<VersionRecord> records = new ArrayList<>();
            try (PreparedStatement stmt = prepare(conn,
                    "SELECT * FROM memory_versions WHERE key = ? ORDER BY version ASC")) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        records.add(resultSetToVersion(rs));
                    }
                }
            }
            return records;
        });
    }

    @Override
    public int purgeVersions(String key) {
        return execute(memoryPool, MEMORY_POOL, "purge versions " + key, conn -> deleteVersions(conn, key));
    }

    private int deleteVersions(Connection conn, String key) throws SQLException {
        try (PreparedStatement stmt = prepare(conn, "DELETE FROM memory_versions WHERE key = ?")) {
            stmt.setString(1, key);
            return stmt.executeUpdate();
        }
    }

    // ==================== Lock Mirror ====================

    @Override
    public void saveLock(MemoryLock lock) {
        String sql = """
            INSERT OR REPLACE INTO memory_locks (key, agent_id, lock_type, acquired_at, expires_at)
            VALUES (?, ?, ?, ?, ?)
        """;
        execute(memoryPool, MEMORY_POOL, "save lock " + lock.getKey(), conn -> {
            try (PreparedStatement stmt = prepare(conn, sql)) {
                stmt.setString(1, lock.getKey());
                stmt.setString(2, lock.getHolder());
                stmt.setString(3, lock.getMode().name().toLowerCase());
                setInstant(stmt, 4, lock.getAcquiredAt());
                setInstant(stmt, 5, lock.getExpiresAt());
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void removeLock(String key) {
        execute(memoryPool, MEMORY_POOL, "remove lock " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn, "DELETE FROM memory_locks WHERE key = ?")) {
                stmt.setString(1, key);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public int clearLocks() {
        return execute(memoryPool, MEMORY_POOL, "clear locks", conn -> {
            try (PreparedStatement stmt = prepare(conn, "DELETE FROM memory_locks")) {
                return stmt.executeUpdate();
            }
        });
    }

    // ==================== Access Log and Events ====================

    @Override
    public void logAgentAccess(String agentId, String key, String accessType, Instant at) {
        String sql = """
            INSERT OR REPLACE INTO agent_memory (agent_id, memory_key, access_type, timestamp)
            VALUES (?, ?, ?, ?)
        """;
        execute(hivePool, HIVE_POOL, "log agent access " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn, sql)) {
                stmt.setString(1, agentId);
                stmt.setString(2, key);
                stmt.setString(3, accessType);
                setInstant(stmt, 4, at);
                return stmt.executeUpdate();
            }
        });
    }

    @Override
    public void recordEvent(MemoryEvent event) {
        if (!config.isRecordEvents()) {
            return;
        }
        String sql = """
            INSERT INTO memory_events (event_type, memory_key, agent_id, timestamp, data)
            VALUES (?, ?, ?, ?, ?)
        """;
        execute(hivePool, HIVE_POOL, "record event " + event.getKey(), conn -> {
            try (PreparedStatement stmt = prepare(conn, sql)) {
                stmt.setString(1, event.getEventType().getValue());
                stmt.setString(2, event.getKey());
                stmt.setString(3, event.getAgentId());
                setInstant(stmt, 4, event.getTimestamp());
                stmt.setString(5, JsonUtils.toJson(event));
                return stmt.executeUpdate();
            }
        });
    }

    /**
     * Number of recorded events for a key.
     */
    public int countEvents(String key) {
        return execute(hivePool, HIVE_POOL, "count events " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn, "SELECT COUNT(*) FROM memory_events WHERE memory_key = ?")) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    /**
     * Last recorded access type of an agent on a key, or null.
     */
    public String lastAccessType(String agentId, String key) {
        return execute(hivePool, HIVE_POOL, "load agent access " + key, conn -> {
            try (PreparedStatement stmt = prepare(conn,
                    "SELECT access_type FROM agent_memory WHERE agent_id = ? AND memory_key = ?")) {
                stmt.setString(1, agentId);
                stmt.setString(2, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getString(1) : null;
                }
            }
        });
    }

    /**
     * SQLite commits every statement durably; nothing is buffered.
     */
    @Override
    public void flush() {
        log.debug("SQLite flush called - no action needed");
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlStep<T> {
        T run() throws SQLException;
    }

    /**
     * Run work on a pooled connection, retrying SQLITE_BUSY with bounded backoff and
     * translating failures into the store's error taxonomy.
     */
    private <T> T execute(HikariDataSource pool, String poolName, String operation, SqlWork<T> work) {
        if (pool == null || !available) {
            throw new BackendUnavailableException("SQLite backend is not available for " + operation);
        }
        int attempt = 0;
        while (true) {
            try (Connection conn = pool.getConnection()) {
                return work.run(conn);
            } catch (SQLTransientConnectionException e) {
                throw ResourceExhaustedException.poolExhausted(poolName, e);
            } catch (SQLTimeoutException e) {
                throw new HiveMemTimeoutException("SQLite query timed out during " + operation, e);
            } catch (SQLException e) {
                if (isBusy(e) && attempt < config.getBusyRetries()) {
                    attempt++;
                    log.debug("SQLite busy during {}, retry {}/{}", operation, attempt, config.getBusyRetries());
                    backoff(attempt);
                    continue;
                }
                log.error("SQLite {} failed: {}", operation, e.getMessage());
                throw new BackendUnavailableException("SQLite " + operation + " failed: " + e.getMessage(), e);
            }
        }
    }

    private <T> T inTransaction(Connection conn, SqlStep<T> step) throws SQLException {
        conn.setAutoCommit(false);
        try {
            T result = step.run();
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private static boolean isBusy(SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        return primary == SQLITE_BUSY || primary == SQLITE_LOCKED;
    }

    private static void backoff(int attempt) {
        try {
            Thread.sleep(Math.min(50L << attempt, 1000L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HiveMemTimeoutException("Interrupted while waiting for a busy SQLite database", e);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        stmt.setQueryTimeout((int) Math.max(1, config.getQueryTimeoutMs() / 1000));
        return stmt;
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value != null) {
            stmt.setLong(index, value.toEpochMilli());
        } else {
            stmt.setNull(index, Types.INTEGER);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private MemoryEntry resultSetToEntry(ResultSet rs) throws SQLException {
        String storedValue = rs.getString("value");
        String metadataJson = rs.getString("metadata");
        EntryMetadata metadata = metadataJson != null
                ? JsonUtils.fromJson(metadataJson, EntryMetadata.class)
                : new EntryMetadata();

        // Columns are authoritative; access stats are updated there directly
        metadata.setCreatedAt(getInstant(rs, "created_at"));
        metadata.setUpdatedAt(getInstant(rs, "updated_at"));
        metadata.setExpiresAt(getInstant(rs, "expires_at"));
        metadata.setSizeBytes(rs.getLong("size_bytes"));
        metadata.setAccessCount(rs.getLong("access_count"));
        metadata.setLastAccessed(getInstant(rs, "last_accessed"));
        metadata.setCompressed(ValueCodec.isCompressed(storedValue));

        return MemoryEntry.builder()
                .key(rs.getString("key"))
                .namespace(rs.getString("namespace"))
                .dataType(DataType.fromValue(rs.getString("data_type")))
                .value(ValueCodec.decode(storedValue))
                .version(rs.getLong("version"))
                .metadata(metadata)
                .build();
    }

    private VersionRecord resultSetToVersion(ResultSet rs) throws SQLException {
        String metadataJson = rs.getString("metadata");
        return VersionRecord.builder()
                .key(rs.getString("key"))
                .version(rs.getLong("version"))
                .value(ValueCodec.decode(rs.getString("value")))
                .metadata(metadataJson != null ? JsonUtils.fromJson(metadataJson, EntryMetadata.class) : null)
                .createdAt(getInstant(rs, "created_at"))
                .build();
    }
}
