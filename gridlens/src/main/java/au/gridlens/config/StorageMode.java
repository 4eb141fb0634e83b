package au.gridlens.config;

/**
 * How query computations obtain raw data.
 */
public enum StorageMode {
    /**
     * Whole Raw Store held resident in memory; slices served from memory.
     */
    EAGER,

    /**
     * Only the requested slice is read from the on-disk columnar store per computation.
     */
    LAZY
}
