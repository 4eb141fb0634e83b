package au.gridlens.service.query;

import au.gridlens.config.StorageMode;
import au.gridlens.service.store.RawStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the series source for the configured storage mode.
 */
public final class SeriesSourceFactory {
    private static final Logger log = LoggerFactory.getLogger(SeriesSourceFactory.class);

    private SeriesSourceFactory() {
    }

    public static SeriesSource create(StorageMode mode, RawStore rawStore) {
        log.info("Series source strategy: {}", mode);
        return switch (mode) {
            case EAGER -> ResidentSeriesSource.preload(rawStore);
            case LAZY -> new LazySeriesSource(rawStore);
        };
    }
}
