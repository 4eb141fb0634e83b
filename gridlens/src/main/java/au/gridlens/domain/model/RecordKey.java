package au.gridlens.domain.model;

import java.time.Instant;

/**
 * Uniqueness key of a raw interval record.
 */
public record RecordKey(String entityId, Instant timestamp, Cadence nativeCadence) {
}
