package au.gridlens.domain.model;

/**
 * Raw Store partition: one domain at one native cadence.
 */
public record Partition(DataDomain domain, Cadence cadence) {

    /**
     * Storage name, e.g. raw_generation_5m.
     */
    public String tableName() {
        return "raw_" + domain.token() + "_" + cadence.getMinutes() + "m";
    }
}
