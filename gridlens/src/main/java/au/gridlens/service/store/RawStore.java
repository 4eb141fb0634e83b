package au.gridlens.service.store;

import au.gridlens.application.port.output.RawRecordRepository;
import au.gridlens.domain.common.DataIntegrityViolationException;
import au.gridlens.domain.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Raw Store - Append-only interval records with deduplicating merge.
 *
 * Writes for one entity are serialized (one lock per entity id); different entities
 * merge in parallel. A merge appends only records whose (entity, timestamp, cadence)
 * key is not stored yet. An incoming value that disagrees with the stored one rejects
 * that entity's whole batch and quarantines the entity until an operator releases it.
 */
public final class RawStore {
    private static final Logger log = LoggerFactory.getLogger(RawStore.class);

    private final RawRecordRepository repository;
    private final Map<String, ReentrantLock> entityLocks = new ConcurrentHashMap<>();
    private final Map<String, DataIntegrityViolationException> quarantined = new ConcurrentHashMap<>();
    private final List<MergeListener> listeners = new CopyOnWriteArrayList<>();

    public RawStore(RawRecordRepository repository) {
        this.repository = repository;
    }

    public void addListener(MergeListener listener) {
        listeners.add(listener);
    }

    /**
     * Merge records into the domain's partitions.
     *
     * Entities are processed independently: a conflict for one entity does not stop the others.
     */
    public MergeResult merge(DataDomain domain, List<IntervalRecord> records) {
        if (records == null || records.isEmpty()) {
            return MergeResult.empty();
        }

        Map<String, List<IntervalRecord>> byEntity = records.stream()
                .collect(Collectors.groupingBy(IntervalRecord::entityId, TreeMap::new, Collectors.toList()));

        int written = 0;
        int duplicates = 0;
        List<DataIntegrityViolationException> violations = new ArrayList<>();

        for (Map.Entry<String, List<IntervalRecord>> entry : byEntity.entrySet()) {
            try {
                EntityMerge merge = mergeEntity(domain, entry.getKey(), entry.getValue());
                written += merge.written;
                duplicates += merge.duplicates;
            } catch (DataIntegrityViolationException e) {
                violations.add(e);
            }
        }

        if (written > 0 || !violations.isEmpty()) {
            log.info("Merged {} records into {} ({} new, {} duplicates, {} entity violations)",
                    records.size(), domain, written, duplicates, violations.size());
        }
        return new MergeResult(written, duplicates, List.copyOf(violations));
    }

    private EntityMerge mergeEntity(DataDomain domain, String entityId, List<IntervalRecord> records) {
        ReentrantLock lock = entityLocks.computeIfAbsent(entityId, k -> new ReentrantLock());
        List<MergeEvent> events = new ArrayList<>();
        int written = 0;
        int duplicates = 0;

        lock.lock();
        try {
            DataIntegrityViolationException blocked = quarantined.get(entityId);
            if (blocked != null) {
                throw new DataIntegrityViolationException(entityId,
                        "Write path quarantined pending operator resolution: " + blocked.getMessage());
            }

            // Validate every cadence group first so a conflict leaves nothing written
            Map<Cadence, List<IntervalRecord>> byCadence = records.stream()
                    .collect(Collectors.groupingBy(IntervalRecord::nativeCadence, TreeMap::new, Collectors.toList()));
            Map<Cadence, List<IntervalRecord>> toAppend = new TreeMap<>();

            for (Map.Entry<Cadence, List<IntervalRecord>> group : byCadence.entrySet()) {
                Partition partition = new Partition(domain, group.getKey());
                NavigableMap<Instant, Double> incoming = new TreeMap<>();
                for (IntervalRecord record : group.getValue()) {
                    Double previous = incoming.putIfAbsent(record.timestamp(), record.value());
                    if (previous != null) {
                        if (Double.compare(previous, record.value()) != 0) {
                            throw quarantine(new DataIntegrityViolationException(record.key(), previous, record.value()));
                        }
                        duplicates++;
                    }
                }

                Instant from = incoming.firstKey();
                Instant to = incoming.lastKey().plusSeconds(group.getKey().getSeconds());
                NavigableMap<Instant, Double> stored = repository.findValues(partition, entityId, from, to);

                List<IntervalRecord> fresh = new ArrayList<>();
                for (Map.Entry<Instant, Double> e : incoming.entrySet()) {
                    Double existing = stored.get(e.getKey());
                    if (existing == null) {
                        fresh.add(new IntervalRecord(entityId, e.getKey(), e.getValue(), group.getKey()));
                    } else if (Double.compare(existing, e.getValue()) == 0) {
                        duplicates++;
                    } else {
                        throw quarantine(new DataIntegrityViolationException(
                                new RecordKey(entityId, e.getKey(), group.getKey()), existing, e.getValue()));
                    }
                }
                if (!fresh.isEmpty()) {
                    toAppend.put(group.getKey(), fresh);
                }
            }

            for (Map.Entry<Cadence, List<IntervalRecord>> group : toAppend.entrySet()) {
                List<IntervalRecord> fresh = group.getValue();
                repository.appendBatch(new Partition(domain, group.getKey()), fresh);
                written += fresh.size();
                events.add(new MergeEvent(domain, entityId, group.getKey(),
                        fresh.get(0).timestamp(),
                        fresh.get(fresh.size() - 1).timestamp().plusSeconds(group.getKey().getSeconds()),
                        List.copyOf(fresh)));
            }
        } finally {
            lock.unlock();
        }

        for (MergeEvent event : events) {
            notifyListeners(event);
        }
        return new EntityMerge(written, duplicates);
    }

    private DataIntegrityViolationException quarantine(DataIntegrityViolationException violation) {
        quarantined.put(violation.getEntityId(), violation);
        log.error("[INTEGRITY] Quarantined {}: {}", violation.getEntityId(), violation.getMessage());
        return violation;
    }

    private void notifyListeners(MergeEvent event) {
        for (MergeListener listener : listeners) {
            try {
                listener.onMerge(event);
            } catch (RuntimeException e) {
                log.error("Merge listener failed for {} [{} - {}): {}",
                        event.entityId(), event.from(), event.to(), e.getMessage(), e);
            }
        }
    }

    /**
     * Re-open an entity's write path after an operator has resolved its conflict.
     */
    public boolean releaseQuarantine(String entityId) {
        DataIntegrityViolationException removed = quarantined.remove(entityId);
        if (removed != null) {
            log.warn("[INTEGRITY] Quarantine released for {}", entityId);
        }
        return removed != null;
    }

    public boolean isQuarantined(String entityId) {
        return quarantined.containsKey(entityId);
    }

    public Map<String, DataIntegrityViolationException> getQuarantined() {
        return Map.copyOf(quarantined);
    }

    /**
     * Records of one entity at one cadence in [from, to), ordered by timestamp.
     */
    public List<IntervalRecord> find(DataDomain domain, String entityId, Cadence cadence, Instant from, Instant to) {
        return repository.findRange(new Partition(domain, cadence), entityId, from, to);
    }

    public int countDistinctTimestamps(Partition partition, String entityIdOrNull, Instant from, Instant to) {
        return repository.countDistinctTimestamps(partition, entityIdOrNull, from, to);
    }

    public List<IntervalRecord> findAll(Partition partition) {
        return repository.findAll(partition);
    }

    public Set<Partition> partitions() {
        return repository.partitions();
    }

    /**
     * Write one (domain, cadence) partition to a Parquet file.
     */
    public void exportPartition(DataDomain domain, Cadence cadence, Path target) {
        repository.exportPartition(new Partition(domain, cadence), target);
    }

    public long count(Partition partition) {
        return repository.count(partition);
    }

    /**
     * Total records across every partition.
     */
    public long totalCount() {
        return repository.partitions().stream().mapToLong(repository::count).sum();
    }

    public String getStats() {
        return String.format("Partitions: %d, Total records: %d, Quarantined entities: %d",
                repository.partitions().size(), totalCount(), quarantined.size());
    }

    private record EntityMerge(int written, int duplicates) {
    }
}
