package au.gridlens.domain.model;

import au.gridlens.domain.common.ValidationException;

import java.time.Instant;

/**
 * One raw interval sample as published by the market operator.
 *
 * value is a rate (MW) or a price ($/MWh); it is never an energy total.
 */
public record IntervalRecord(
        String entityId,
        Instant timestamp,
        double value,
        Cadence nativeCadence) {

    public IntervalRecord {
        if (entityId == null || entityId.isBlank()) {
            throw new ValidationException("entityId", "Entity id must not be blank");
        }
        if (timestamp == null) {
            throw new ValidationException("timestamp", "Timestamp must not be null for " + entityId);
        }
        if (nativeCadence == null) {
            throw new ValidationException("nativeCadence", "Native cadence must not be null for " + entityId);
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException("value",
                    String.format("Value must be finite for %s @ %s: %s", entityId, timestamp, value));
        }
    }

    public static IntervalRecord of(String entityId, Instant timestamp, double value, Cadence nativeCadence) {
        return new IntervalRecord(entityId, timestamp, value, nativeCadence);
    }

    public RecordKey key() {
        return new RecordKey(entityId, timestamp, nativeCadence);
    }
}
