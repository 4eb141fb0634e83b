package au.gridlens.domain.model;

import java.util.List;

/**
 * Raw samples of one entity at its native cadence, as loaded from the Raw Store.
 */
public record NativeSeries(String entityId, Cadence nativeCadence, List<IntervalRecord> records) {

    public NativeSeries {
        records = List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
