package au.gridlens.domain.query;

import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.model.SeriesPoint;

import java.util.List;

/**
 * Ordered (timestamp, value) points with coverage and cache provenance.
 *
 * coverageStatus reflects the unified input, so an interpolated LOESS value never hides a gap.
 */
public record QueryResponse(
        QueryKey key,
        List<SeriesPoint> points,
        CoverageStatus coverageStatus,
        CacheStatus cacheStatus) {
}
