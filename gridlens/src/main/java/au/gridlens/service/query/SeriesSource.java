package au.gridlens.service.query;

import au.gridlens.config.StorageMode;
import au.gridlens.domain.model.EntityDescriptor;
import au.gridlens.domain.model.NativeSeries;

import java.time.Instant;
import java.util.List;

/**
 * Where the query pipeline reads native samples from.
 */
public interface SeriesSource {

    /**
     * Native series of one entity with samples in [from, to), one per native cadence stored.
     * An entity without samples yields a single empty series at its declared cadence.
     */
    List<NativeSeries> load(EntityDescriptor entity, Instant from, Instant to);

    StorageMode mode();
}
