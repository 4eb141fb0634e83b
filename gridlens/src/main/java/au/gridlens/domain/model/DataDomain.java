package au.gridlens.domain.model;

/**
 * Telemetry domains. Each domain is stored in its own Raw Store partitions.
 */
public enum DataDomain {
    GENERATION,
    PRICE,
    INTERCONNECTOR,
    ROOFTOP;

    /**
     * Lower-case token used in partition and table names.
     */
    public String token() {
        return name().toLowerCase();
    }
}
