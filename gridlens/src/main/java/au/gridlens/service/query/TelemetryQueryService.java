package au.gridlens.service.query;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.*;
import au.gridlens.domain.query.*;
import au.gridlens.service.annualise.AnnualisationCalculator;
import au.gridlens.service.annualise.EnergySeries;
import au.gridlens.service.cache.AggregationCache;
import au.gridlens.service.cache.CacheComputationException;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.resample.ResolutionUnifier;
import au.gridlens.service.smoothing.SmoothedSeries;
import au.gridlens.service.smoothing.SmoothingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers analytical queries: unify, smooth in the power domain, annualise, behind the cache.
 *
 * The stage order is fixed here; callers only choose parameters.
 */
public final class TelemetryQueryService {
    private static final Logger log = LoggerFactory.getLogger(TelemetryQueryService.class);

    private final EntityCatalog catalog;
    private final SeriesSource seriesSource;
    private final ResolutionUnifier unifier;
    private final SmoothingEngine smoothingEngine;
    private final AnnualisationCalculator annualisationCalculator;
    private final AggregationCache<PipelineResult> cache;
    private final ResolutionAdvisor resolutionAdvisor;

    public TelemetryQueryService(
            EntityCatalog catalog,
            SeriesSource seriesSource,
            ResolutionUnifier unifier,
            SmoothingEngine smoothingEngine,
            AnnualisationCalculator annualisationCalculator,
            AggregationCache<PipelineResult> cache,
            ResolutionAdvisor resolutionAdvisor) {
        this.catalog = catalog;
        this.seriesSource = seriesSource;
        this.unifier = unifier;
        this.smoothingEngine = smoothingEngine;
        this.annualisationCalculator = annualisationCalculator;
        this.cache = cache;
        this.resolutionAdvisor = resolutionAdvisor;
    }

    /**
     * Smoothed annual energy for the requested entities.
     *
     * A request without a target cadence gets one from the resolution advisor.
     *
     * @throws ValidationException        for invalid parameters or unknown entities, before any computation
     * @throws CacheComputationException if the pipeline failed
     */
    public QueryResponse query(QueryRequest request) {
        QueryRequest resolved = request;
        if (request.targetCadence() == null && request.start() != null && request.end() != null) {
            int entityCount = request.entities() == null ? 0 : request.entities().size();
            resolved = request.withTargetCadence(
                    resolutionAdvisor.advise(request.start(), request.end(), entityCount, null));
        }
        QueryKey requested = resolved.toKey();
        // Output starts at the first bucket, so identity and invalidation use the aligned start
        QueryKey key = requested.withStart(unifier.alignedStart(requested.start(), requested.targetCadence()));
        List<EntityDescriptor> entities = key.entities().stream().map(catalog::requireEntity).toList();

        CacheResult<PipelineResult> result;
        try {
            result = cache.getOrCompute(key, () -> compute(key, entities));
        } catch (CacheComputationException e) {
            if (e.getCause() instanceof ValidationException validation) {
                throw validation;
            }
            throw e;
        }
        PipelineResult value = result.value();
        log.debug("Query {} {} -> {} points, {} ({})",
                key.label(), key.targetCadence().getLabel(), value.energy().size(), value.coverage(), result.status());
        return new QueryResponse(key, value.energy().points(), value.coverage(), result.status());
    }

    /**
     * Unified power without smoothing or annualisation. Not cached.
     */
    public CanonicalSeries unifiedPower(List<String> entityIds, Instant start, Instant end, Cadence target) {
        List<EntityDescriptor> entities = entityIds.stream().map(catalog::requireEntity).toList();
        return unify(entities, start, end, target);
    }

    PipelineResult compute(QueryKey key, List<EntityDescriptor> entities) {
        CanonicalSeries unified = unify(entities, key.start(), key.end(), key.targetCadence());
        SmoothedSeries smoothed = smoothingEngine.smooth(unified, key.smoothing());
        EnergySeries energy = annualisationCalculator.annualise(smoothed, key.annualisation());
        return new PipelineResult(energy, unified.coverage());
    }

    private CanonicalSeries unify(List<EntityDescriptor> entities, Instant start, Instant end, Cadence target) {
        Instant from = unifier.alignedStart(start, target);
        List<NativeSeries> natives = new ArrayList<>();
        for (EntityDescriptor entity : entities) {
            natives.addAll(usable(seriesSource.load(entity, from, end), target));
        }
        return unifier.unify(natives, target, start, end);
    }

    /**
     * Drop stored cadences that cannot be resampled to target, unless nothing else is left,
     * in which case the unifier reports the mismatch.
     */
    private static List<NativeSeries> usable(List<NativeSeries> series, Cadence target) {
        List<NativeSeries> fitting = series.stream()
                .filter(s -> s.nativeCadence().isFinerOrEqual(target) && s.nativeCadence().divides(target))
                .toList();
        return fitting.isEmpty() ? series : fitting;
    }

    public SeriesSource getSeriesSource() {
        return seriesSource;
    }

    public AggregationCache<PipelineResult> getCache() {
        return cache;
    }
}
