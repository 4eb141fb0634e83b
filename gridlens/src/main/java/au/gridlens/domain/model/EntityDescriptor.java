package au.gridlens.domain.model;

/**
 * Catalog entry for a telemetry entity (a generating unit, a region price, an interconnector).
 */
public record EntityDescriptor(
        String entityId,
        DataDomain domain,
        Cadence nativeCadence,
        String region,
        String fuel) {
}
