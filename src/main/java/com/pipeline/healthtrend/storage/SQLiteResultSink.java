package com.pipeline.healthtrend.storage;

import com.pipeline.healthtrend.core.ResultSink;
import com.pipeline.healthtrend.exception.CollaboratorUnavailableException;
import com.pipeline.healthtrend.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 基于SQLite的结果存储实现。
 *
 * 核心设计：
 * - 聚合值、已并入记录标识、异常各一张表，均以 (metric_name, bucket_start) 为主键
 * - 已并入记录标识随桶持久化，重启后幂等性依然成立
 * - 时间戳以纪元毫秒存储，按桶起点B-tree索引
 * - WAL模式，单连接串行写入
 */
public class SQLiteResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(SQLiteResultSink.class);

    private static final String DB_FILE = "healthtrend.db";

    /** 存储根目录 */
    private final String storageRoot;

    private final Connection connection;

    public SQLiteResultSink(String storageRoot) {
        this.storageRoot = storageRoot;

        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new IllegalStateException("Failed to create storage directory: " + storageRoot);
        }

        String dbPath = storageRoot + File.separator + DB_FILE;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            initSchema();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize result database at " + dbPath, e);
        }
        log.info("SQLiteResultSink initialized at: {}", dbPath);
    }

    // ==================== 聚合值 ====================

    @Override
    public synchronized Optional<Aggregate> getAggregate(String metricName, Instant bucketStart) {
        String sql = "SELECT * FROM aggregate WHERE metric_name = ? AND bucket_start = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, metricName);
            stmt.setLong(2, bucketStart.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Set<String> ids = loadAppliedIds(metricName, bucketStart);
                return Optional.of(mapAggregate(rs, ids));
            }
        } catch (SQLException e) {
            throw unavailable("read aggregate " + metricName + "@" + bucketStart, e);
        }
    }

    @Override
    public synchronized void putAggregate(Aggregate aggregate) {
        String upsert = "INSERT OR REPLACE INTO aggregate (metric_name, bucket_start, bucket_width_ms, "
                + "count, sum, sum_sq, min_value, max_value, mean, m2) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        String insertId = "INSERT OR IGNORE INTO aggregate_record (metric_name, bucket_start, record_id) "
                + "VALUES (?, ?, ?)";
        long bucket = aggregate.getBucketStart().toEpochMilli();
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement stmt = connection.prepareStatement(upsert)) {
                stmt.setString(1, aggregate.getMetricName());
                stmt.setLong(2, bucket);
                stmt.setLong(3, aggregate.getBucketWidth().toMillis());
                stmt.setLong(4, aggregate.getCount());
                stmt.setDouble(5, aggregate.getSum());
                stmt.setDouble(6, aggregate.getSumSq());
                stmt.setDouble(7, aggregate.getMin());
                stmt.setDouble(8, aggregate.getMax());
                stmt.setDouble(9, aggregate.getMean());
                stmt.setDouble(10, aggregate.getM2());
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = connection.prepareStatement(insertId)) {
                for (String id : aggregate.getAppliedRecordIds()) {
                    stmt.setString(1, aggregate.getMetricName());
                    stmt.setLong(2, bucket);
                    stmt.setString(3, id);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            rollbackQuietly();
            throw unavailable("write aggregate " + aggregate.key(), e);
        } finally {
            restoreAutoCommit();
        }
    }

    @Override
    public List<Aggregate> listSeries(String metricName, Instant since) {
        return querySeries(metricName, since.toEpochMilli(), Long.MAX_VALUE);
    }

    @Override
    public List<Aggregate> listSeries(String metricName, TimeRange range) {
        return querySeries(metricName, range.getStart().toEpochMilli(), range.getEnd().toEpochMilli());
    }

    @Override
    public synchronized List<Aggregate> listSeriesBefore(String metricName, Instant before, int limit) {
        String sql = "SELECT MIN(bucket_start) AS earliest FROM (SELECT bucket_start FROM aggregate "
                + "WHERE metric_name = ? AND bucket_start < ? ORDER BY bucket_start DESC LIMIT ?)";
        long earliest;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, metricName);
            stmt.setLong(2, before.toEpochMilli());
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return new ArrayList<>();
                }
                earliest = rs.getLong("earliest");
                if (rs.wasNull()) {
                    return new ArrayList<>();
                }
            }
        } catch (SQLException e) {
            throw unavailable("list series of " + metricName + " before " + before, e);
        }
        return querySeries(metricName, earliest, before.toEpochMilli());
    }

    private synchronized List<Aggregate> querySeries(String metricName, long fromMs, long toMsExclusive) {
        String sql = "SELECT * FROM aggregate WHERE metric_name = ? AND bucket_start >= ? AND bucket_start < ? "
                + "ORDER BY bucket_start ASC";
        String idSql = "SELECT bucket_start, record_id FROM aggregate_record "
                + "WHERE metric_name = ? AND bucket_start >= ? AND bucket_start < ?";
        try {
            Map<Long, Set<String>> idsByBucket = new HashMap<>();
            try (PreparedStatement stmt = connection.prepareStatement(idSql)) {
                stmt.setString(1, metricName);
                stmt.setLong(2, fromMs);
                stmt.setLong(3, toMsExclusive);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        idsByBucket.computeIfAbsent(rs.getLong("bucket_start"), k -> new HashSet<>())
                                .add(rs.getString("record_id"));
                    }
                }
            }

            List<Aggregate> series = new ArrayList<>();
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, metricName);
                stmt.setLong(2, fromMs);
                stmt.setLong(3, toMsExclusive);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        Set<String> ids = idsByBucket.getOrDefault(rs.getLong("bucket_start"), Set.of());
                        series.add(mapAggregate(rs, ids));
                    }
                }
            }
            return series;
        } catch (SQLException e) {
            throw unavailable("list series of " + metricName, e);
        }
    }

    // ==================== 异常 ====================

    @Override
    public synchronized void putAnomaly(Anomaly anomaly) {
        String sql = "INSERT OR REPLACE INTO anomaly (metric_name, bucket_start, observed_value, expected_value, "
                + "deviation_score, severity, detected_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, anomaly.getMetricName());
            stmt.setLong(2, anomaly.getBucketStart().toEpochMilli());
            stmt.setDouble(3, anomaly.getObservedValue());
            stmt.setDouble(4, anomaly.getExpectedValue());
            stmt.setDouble(5, anomaly.getDeviationScore());
            stmt.setString(6, anomaly.getSeverity().name());
            stmt.setLong(7, anomaly.getDetectedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("write anomaly " + anomaly.key(), e);
        }
    }

    @Override
    public synchronized void deleteAnomaly(String metricName, Instant bucketStart) {
        String sql = "DELETE FROM anomaly WHERE metric_name = ? AND bucket_start = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, metricName);
            stmt.setLong(2, bucketStart.toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("delete anomaly " + metricName + "@" + bucketStart, e);
        }
    }

    @Override
    public synchronized List<Anomaly> listAnomalies(Instant since) {
        String sql = "SELECT * FROM anomaly WHERE bucket_start >= ? ORDER BY bucket_start ASC, metric_name ASC";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, since.toEpochMilli());
            List<Anomaly> anomalies = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    anomalies.add(new Anomaly(
                            rs.getString("metric_name"),
                            Instant.ofEpochMilli(rs.getLong("bucket_start")),
                            rs.getDouble("observed_value"),
                            rs.getDouble("expected_value"),
                            rs.getDouble("deviation_score"),
                            Severity.valueOf(rs.getString("severity")),
                            Instant.ofEpochMilli(rs.getLong("detected_at"))));
                }
            }
            return anomalies;
        } catch (SQLException e) {
            throw unavailable("list anomalies", e);
        }
    }

    // ==================== 内部工具方法 ====================

    private void initSchema() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");

            stmt.execute("CREATE TABLE IF NOT EXISTS aggregate ("
                    + "metric_name TEXT NOT NULL, "
                    + "bucket_start INTEGER NOT NULL, "
                    + "bucket_width_ms INTEGER NOT NULL, "
                    + "count INTEGER NOT NULL, "
                    + "sum REAL, "
                    + "sum_sq REAL, "
                    + "min_value REAL, "
                    + "max_value REAL, "
                    + "mean REAL, "
                    + "m2 REAL, "
                    + "PRIMARY KEY (metric_name, bucket_start))");
            stmt.execute("CREATE TABLE IF NOT EXISTS aggregate_record ("
                    + "metric_name TEXT NOT NULL, "
                    + "bucket_start INTEGER NOT NULL, "
                    + "record_id TEXT NOT NULL, "
                    + "PRIMARY KEY (metric_name, bucket_start, record_id))");
            stmt.execute("CREATE TABLE IF NOT EXISTS anomaly ("
                    + "metric_name TEXT NOT NULL, "
                    + "bucket_start INTEGER NOT NULL, "
                    + "observed_value REAL, "
                    + "expected_value REAL, "
                    + "deviation_score REAL, "
                    + "severity TEXT NOT NULL, "
                    + "detected_at INTEGER NOT NULL, "
                    + "PRIMARY KEY (metric_name, bucket_start))");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_anomaly_bucket ON anomaly (bucket_start)");
        }
    }

    private Set<String> loadAppliedIds(String metricName, Instant bucketStart) throws SQLException {
        String sql = "SELECT record_id FROM aggregate_record WHERE metric_name = ? AND bucket_start = ?";
        Set<String> ids = new HashSet<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, metricName);
            stmt.setLong(2, bucketStart.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("record_id"));
                }
            }
        }
        return ids;
    }

    private Aggregate mapAggregate(ResultSet rs, Set<String> appliedIds) throws SQLException {
        return new Aggregate(
                rs.getString("metric_name"),
                Instant.ofEpochMilli(rs.getLong("bucket_start")),
                Duration.ofMillis(rs.getLong("bucket_width_ms")),
                rs.getLong("count"),
                rs.getDouble("sum"),
                rs.getDouble("sum_sq"),
                rs.getDouble("min_value"),
                rs.getDouble("max_value"),
                rs.getDouble("mean"),
                rs.getDouble("m2"),
                appliedIds);
    }

    private CollaboratorUnavailableException unavailable(String operation, SQLException e) {
        log.error("Failed to {}: {}", operation, e.getMessage(), e);
        return new CollaboratorUnavailableException("Result store failed to " + operation + ": " + e.getMessage(), e);
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }

    public String getStorageRoot() {
        return storageRoot;
    }

    /** 关闭数据库连接 */
    public synchronized void shutdown() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close result database: {}", e.getMessage());
        }
        log.info("SQLiteResultSink shut down.");
    }
}
