package au.gridlens.service.query;

import au.gridlens.config.StorageMode;
import au.gridlens.domain.model.*;
import au.gridlens.service.store.MergeEvent;
import au.gridlens.service.store.MergeListener;
import au.gridlens.service.store.RawStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * EAGER strategy: the whole Raw Store held in memory, kept current by merge events.
 *
 * Fast slices at the cost of memory proportional to the store.
 */
public final class ResidentSeriesSource implements SeriesSource, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(ResidentSeriesSource.class);

    // entity -> cadence -> timestamp -> value
    private final Map<String, Map<Cadence, ConcurrentSkipListMap<Instant, Double>>> samples = new ConcurrentHashMap<>();

    /**
     * Preload every partition and subscribe to later merges.
     */
    public static ResidentSeriesSource preload(RawStore rawStore) {
        ResidentSeriesSource source = new ResidentSeriesSource();
        rawStore.addListener(source);
        long loaded = 0;
        for (Partition partition : rawStore.partitions()) {
            List<IntervalRecord> records = rawStore.findAll(partition);
            records.forEach(source::put);
            loaded += records.size();
        }
        log.info("Resident series source loaded {} records from {} partitions", loaded, rawStore.partitions().size());
        return source;
    }

    @Override
    public void onMerge(MergeEvent event) {
        event.appended().forEach(this::put);
    }

    private void put(IntervalRecord record) {
        samples.computeIfAbsent(record.entityId(), k -> new ConcurrentHashMap<>())
                .computeIfAbsent(record.nativeCadence(), k -> new ConcurrentSkipListMap<>())
                .put(record.timestamp(), record.value());
    }

    @Override
    public List<NativeSeries> load(EntityDescriptor entity, Instant from, Instant to) {
        Map<Cadence, ConcurrentSkipListMap<Instant, Double>> byCadence = samples.getOrDefault(entity.entityId(), Map.of());
        List<NativeSeries> result = new ArrayList<>();
        for (Map.Entry<Cadence, ConcurrentSkipListMap<Instant, Double>> entry : new TreeMap<>(byCadence).entrySet()) {
            List<IntervalRecord> records = new ArrayList<>();
            entry.getValue().subMap(from, true, to, false).forEach((ts, value) ->
                    records.add(new IntervalRecord(entity.entityId(), ts, value, entry.getKey())));
            if (!records.isEmpty()) {
                result.add(new NativeSeries(entity.entityId(), entry.getKey(), records));
            }
        }
        if (result.isEmpty()) {
            result.add(new NativeSeries(entity.entityId(), entity.nativeCadence(), List.of()));
        }
        return result;
    }

    public long size() {
        return samples.values().stream()
                .flatMap(m -> m.values().stream())
                .mapToLong(Map::size)
                .sum();
    }

    @Override
    public StorageMode mode() {
        return StorageMode.EAGER;
    }
}
