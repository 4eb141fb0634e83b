package au.gridlens.service.query;

import au.gridlens.config.StorageMode;
import au.gridlens.domain.model.*;
import au.gridlens.service.store.RawStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * LAZY strategy: every query reads just its slice from the Raw Store's backing repository
 * (DuckDB on disk in production).
 */
public final class LazySeriesSource implements SeriesSource {

    private final RawStore rawStore;

    public LazySeriesSource(RawStore rawStore) {
        this.rawStore = rawStore;
    }

    @Override
    public List<NativeSeries> load(EntityDescriptor entity, Instant from, Instant to) {
        List<Partition> partitions = rawStore.partitions().stream()
                .filter(p -> p.domain() == entity.domain())
                .sorted(Comparator.comparingInt(p -> p.cadence().getMinutes()))
                .toList();

        List<NativeSeries> result = new ArrayList<>();
        for (Partition partition : partitions) {
            List<IntervalRecord> records = rawStore.find(entity.domain(), entity.entityId(), partition.cadence(), from, to);
            if (!records.isEmpty()) {
                result.add(new NativeSeries(entity.entityId(), partition.cadence(), records));
            }
        }
        if (result.isEmpty()) {
            result.add(new NativeSeries(entity.entityId(), entity.nativeCadence(), List.of()));
        }
        return result;
    }

    @Override
    public StorageMode mode() {
        return StorageMode.LAZY;
    }
}
