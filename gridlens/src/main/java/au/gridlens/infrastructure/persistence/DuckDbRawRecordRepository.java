package au.gridlens.infrastructure.persistence;

import au.gridlens.application.port.output.RawRecordRepository;
import au.gridlens.domain.common.StorageException;
import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.*;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DuckDB implementation of RawRecordRepository.
 *
 * One columnar table per (domain, cadence) partition:
 * raw_{domain}_{minutes}m (ts TIMESTAMP, entity_id VARCHAR, value DOUBLE), keyed by (entity_id, ts).
 * Timestamps are stored as UTC wall time and exchanged as epoch milliseconds.
 */
public final class DuckDbRawRecordRepository implements RawRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(DuckDbRawRecordRepository.class);

    private final DataSource dataSource;
    private final Set<String> knownTables = ConcurrentHashMap.newKeySet();

    public DuckDbRawRecordRepository(DataSource dataSource) {
        this.dataSource = dataSource;
        loadExistingTables();
    }

    @Override
    public void appendBatch(Partition partition, List<IntervalRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        for (IntervalRecord record : records) {
            if (record.nativeCadence() != partition.cadence()) {
                throw new ValidationException("nativeCadence", String.format(
                        "Record %s @ %s has cadence %s, partition %s",
                        record.entityId(), record.timestamp(), record.nativeCadence(), partition.tableName()));
            }
        }
        ensureTable(partition);

        String sql = "INSERT INTO " + partition.tableName()
                + " (ts, entity_id, value) VALUES (epoch_ms(CAST(? AS BIGINT)), ?, ?)";

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (IntervalRecord record : records) {
                    ps.setLong(1, record.timestamp().toEpochMilli());
                    ps.setString(2, record.entityId());
                    ps.setDouble(3, record.value());
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
            log.debug("Appended {} records to {}", records.size(), partition.tableName());

        } catch (SQLException e) {
            log.error("Failed to append batch to {}: {}", partition.tableName(), e.getMessage());
            throw new StorageException("Failed to append batch to " + partition.tableName(), e);
        }
    }

    @Override
    public List<IntervalRecord> findRange(Partition partition, String entityId, Instant from, Instant to) {
        List<IntervalRecord> result = new ArrayList<>();
        for (Map.Entry<Instant, Double> e : findValues(partition, entityId, from, to).entrySet()) {
            result.add(new IntervalRecord(entityId, e.getKey(), e.getValue(), partition.cadence()));
        }
        return result;
    }

    @Override
    public NavigableMap<Instant, Double> findValues(Partition partition, String entityId, Instant from, Instant to) {
        NavigableMap<Instant, Double> result = new TreeMap<>();
        if (!knownTables.contains(partition.tableName()) || !from.isBefore(to)) {
            return result;
        }
        String sql = """
            SELECT epoch_ms(ts) AS ts_ms, value
            FROM %s
            WHERE entity_id = ? AND ts >= epoch_ms(CAST(? AS BIGINT)) AND ts < epoch_ms(CAST(? AS BIGINT))
            ORDER BY ts ASC
            """.formatted(partition.tableName());

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entityId);
            ps.setLong(2, from.toEpochMilli());
            ps.setLong(3, to.toEpochMilli());

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.put(Instant.ofEpochMilli(rs.getLong("ts_ms")), rs.getDouble("value"));
                }
            }
            return result;

        } catch (SQLException e) {
            log.error("Failed to read {} from {}: {}", entityId, partition.tableName(), e.getMessage());
            throw new StorageException("Failed to read " + entityId + " from " + partition.tableName(), e);
        }
    }

    @Override
    public int countDistinctTimestamps(Partition partition, String entityId, Instant from, Instant to) {
        if (!knownTables.contains(partition.tableName()) || !from.isBefore(to)) {
            return 0;
        }
        String sql = "SELECT COUNT(DISTINCT ts) FROM " + partition.tableName()
                + " WHERE ts >= epoch_ms(CAST(? AS BIGINT)) AND ts < epoch_ms(CAST(? AS BIGINT))"
                + (entityId != null ? " AND entity_id = ?" : "");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, from.toEpochMilli());
            ps.setLong(2, to.toEpochMilli());
            if (entityId != null) {
                ps.setString(3, entityId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }

        } catch (SQLException e) {
            log.error("Failed to count timestamps in {}: {}", partition.tableName(), e.getMessage());
            throw new StorageException("Failed to count timestamps in " + partition.tableName(), e);
        }
    }

    @Override
    public List<IntervalRecord> findAll(Partition partition) {
        List<IntervalRecord> result = new ArrayList<>();
        if (!knownTables.contains(partition.tableName())) {
            return result;
        }
        String sql = "SELECT entity_id, epoch_ms(ts) AS ts_ms, value FROM " + partition.tableName()
                + " ORDER BY entity_id, ts";

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {

            while (rs.next()) {
                result.add(new IntervalRecord(
                        rs.getString("entity_id"),
                        Instant.ofEpochMilli(rs.getLong("ts_ms")),
                        rs.getDouble("value"),
                        partition.cadence()));
            }
            return result;

        } catch (SQLException e) {
            log.error("Failed to scan {}: {}", partition.tableName(), e.getMessage());
            throw new StorageException("Failed to scan " + partition.tableName(), e);
        }
    }

    @Override
    public long count(Partition partition) {
        if (!knownTables.contains(partition.tableName())) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + partition.tableName())) {
            return rs.next() ? rs.getLong(1) : 0;

        } catch (SQLException e) {
            throw new StorageException("Failed to count " + partition.tableName(), e);
        }
    }

    @Override
    public Set<Partition> partitions() {
        Set<Partition> result = new HashSet<>();
        for (DataDomain domain : DataDomain.values()) {
            for (Cadence cadence : Cadence.values()) {
                Partition partition = new Partition(domain, cadence);
                if (knownTables.contains(partition.tableName())) {
                    result.add(partition);
                }
            }
        }
        return result;
    }

    /**
     * Write one partition to a Parquet file, ordered by entity and timestamp.
     */
    @Override
    public void exportPartition(Partition partition, Path target) {
        if (!knownTables.contains(partition.tableName())) {
            throw new ValidationException("partition", "No data stored for " + partition.tableName());
        }
        String file = target.toAbsolutePath().toString().replace("'", "''");
        String sql = "COPY (SELECT ts, entity_id, value FROM " + partition.tableName()
                + " ORDER BY entity_id, ts) TO '" + file + "' (FORMAT PARQUET)";

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(sql);
            log.info("Exported {} to {}", partition.tableName(), target);

        } catch (SQLException e) {
            log.error("Failed to export {}: {}", partition.tableName(), e.getMessage());
            throw new StorageException("Failed to export " + partition.tableName(), e);
        }
    }

    private void ensureTable(Partition partition) {
        String table = partition.tableName();
        if (knownTables.contains(table)) {
            return;
        }
        String ddl = """
            CREATE TABLE IF NOT EXISTS %s (
                ts TIMESTAMP NOT NULL,
                entity_id VARCHAR NOT NULL,
                value DOUBLE NOT NULL,
                PRIMARY KEY (entity_id, ts)
            )
            """.formatted(table);

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute(ddl);
            knownTables.add(table);
            log.info("Created partition table {}", table);

        } catch (SQLException e) {
            throw new StorageException("Failed to create " + table, e);
        }
    }

    private void loadExistingTables() {
        String sql = "SELECT table_name FROM information_schema.tables WHERE table_name LIKE 'raw_%'";
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                knownTables.add(rs.getString(1));
            }
            if (!knownTables.isEmpty()) {
                log.info("Found {} existing partition tables", knownTables.size());
            }

        } catch (SQLException e) {
            throw new StorageException("Failed to list partition tables", e);
        }
    }
}
