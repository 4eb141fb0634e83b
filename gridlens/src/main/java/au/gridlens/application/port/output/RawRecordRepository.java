package au.gridlens.application.port.output;

import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.Partition;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Append-only storage of raw interval records, partitioned by (domain, cadence).
 *
 * Implementations never update or delete rows. Deduplication is the caller's job; an
 * append that repeats an existing (entity, timestamp) key in a partition is rejected.
 */
public interface RawRecordRepository {

    /**
     * Append records to a partition. Every record's cadence must match the partition.
     */
    void appendBatch(Partition partition, List<IntervalRecord> records);

    /**
     * Records of one entity with timestamps in [from, to), ordered by timestamp.
     */
    List<IntervalRecord> findRange(Partition partition, String entityId, Instant from, Instant to);

    /**
     * Stored values of one entity keyed by timestamp in [from, to).
     */
    NavigableMap<Instant, Double> findValues(Partition partition, String entityId, Instant from, Instant to);

    /**
     * Distinct timestamps in [from, to) for one entity, or across the partition when entityId is null.
     */
    int countDistinctTimestamps(Partition partition, String entityId, Instant from, Instant to);

    /**
     * Every record of a partition, ordered by entity then timestamp.
     */
    List<IntervalRecord> findAll(Partition partition);

    long count(Partition partition);

    Set<Partition> partitions();

    /**
     * Write one partition to a Parquet file.
     */
    void exportPartition(Partition partition, Path target);
}
