package au.gridlens.domain.model;

/**
 * An archive source. Every source feeds exactly one (domain, cadence) Raw Store partition.
 */
public record SourceDescriptor(
        String sourceId,
        DataDomain domain,
        Cadence cadence) {
}
