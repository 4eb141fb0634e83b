package au.gridlens.domain.query;

import au.gridlens.domain.model.Cadence;

import java.time.Instant;
import java.util.List;

/**
 * Analytical query as received from consumers (charting layer, HTTP clients).
 */
public record QueryRequest(
        List<String> entities,
        Instant start,
        Instant end,
        Cadence targetCadence,
        SmoothingMethod smoothingMethod,
        double smoothingParam,
        int referenceYearDays,
        double unitScale) {

    public QueryRequest withTargetCadence(Cadence cadence) {
        return new QueryRequest(entities, start, end, cadence, smoothingMethod, smoothingParam,
                referenceYearDays, unitScale);
    }

    /**
     * Validate every field and build the cache key. Invalid input fails here, before any computation.
     */
    public QueryKey toKey() {
        return new QueryKey(
                entities,
                start,
                end,
                targetCadence,
                SmoothingConfig.of(smoothingMethod, smoothingParam),
                new AnnualisationConfig(referenceYearDays, unitScale));
    }
}
