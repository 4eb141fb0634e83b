package au.gridlens.infrastructure.persistence;

import au.gridlens.application.port.output.RawRecordRepository;
import au.gridlens.domain.common.DataIntegrityViolationException;
import au.gridlens.domain.common.StorageException;
import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.Partition;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-memory implementation of RawRecordRepository.
 *
 * Used when no on-disk store is configured, and in tests.
 */
public final class InMemoryRawRecordRepository implements RawRecordRepository {

    // partition -> entity -> timestamp -> value
    private final Map<Partition, Map<String, ConcurrentSkipListMap<Instant, Double>>> data = new ConcurrentHashMap<>();

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
        Map<String, ConcurrentSkipListMap<Instant, Double>> entities =
                data.computeIfAbsent(partition, k -> new ConcurrentHashMap<>());
        for (IntervalRecord record : records) {
            ConcurrentSkipListMap<Instant, Double> series =
                    entities.computeIfAbsent(record.entityId(), k -> new ConcurrentSkipListMap<>());
            Double previous = series.putIfAbsent(record.timestamp(), record.value());
            if (previous != null) {
                throw new DataIntegrityViolationException(record.key(), previous, record.value());
            }
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
        ConcurrentSkipListMap<Instant, Double> series = series(partition, entityId);
        if (series == null || !from.isBefore(to)) {
            return new TreeMap<>();
        }
        return new TreeMap<>(series.subMap(from, true, to, false));
    }

    @Override
    public int countDistinctTimestamps(Partition partition, String entityId, Instant from, Instant to) {
        if (!from.isBefore(to)) {
            return 0;
        }
        if (entityId != null) {
            ConcurrentSkipListMap<Instant, Double> series = series(partition, entityId);
            return series == null ? 0 : series.subMap(from, true, to, false).size();
        }
        Map<String, ConcurrentSkipListMap<Instant, Double>> entities = data.get(partition);
        if (entities == null) {
            return 0;
        }
        Set<Instant> distinct = new HashSet<>();
        for (ConcurrentSkipListMap<Instant, Double> series : entities.values()) {
            distinct.addAll(series.subMap(from, true, to, false).keySet());
        }
        return distinct.size();
    }

    @Override
    public List<IntervalRecord> findAll(Partition partition) {
        Map<String, ConcurrentSkipListMap<Instant, Double>> entities = data.get(partition);
        if (entities == null) {
            return List.of();
        }
        List<IntervalRecord> result = new ArrayList<>();
        for (String entityId : new TreeSet<>(entities.keySet())) {
            for (Map.Entry<Instant, Double> e : entities.get(entityId).entrySet()) {
                result.add(new IntervalRecord(entityId, e.getKey(), e.getValue(), partition.cadence()));
            }
        }
        return result;
    }

    @Override
    public long count(Partition partition) {
        Map<String, ConcurrentSkipListMap<Instant, Double>> entities = data.get(partition);
        if (entities == null) {
            return 0;
        }
        return entities.values().stream().mapToLong(Map::size).sum();
    }

    @Override
    public Set<Partition> partitions() {
        return Set.copyOf(data.keySet());
    }

    @Override
    public void exportPartition(Partition partition, Path target) {
        throw new StorageException("Parquet export needs the DuckDB store; " + partition.tableName() + " is held in memory");
    }

    private ConcurrentSkipListMap<Instant, Double> series(Partition partition, String entityId) {
        Map<String, ConcurrentSkipListMap<Instant, Double>> entities = data.get(partition);
        return entities == null ? null : entities.get(entityId);
    }
}
