package au.gridlens.service.store;

import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.model.IntervalRecord;

import java.time.Instant;
import java.util.List;

/**
 * Net-new records appended for one entity. Covers [from, to) where to is the end of the last interval.
 */
public record MergeEvent(
        DataDomain domain,
        String entityId,
        Cadence cadence,
        Instant from,
        Instant to,
        List<IntervalRecord> appended) {
}
