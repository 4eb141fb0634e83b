package au.gridlens.service.ingest;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.*;
import au.gridlens.infrastructure.metrics.PipelineMetrics;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.store.MergeResult;
import au.gridlens.service.store.RawStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Live ingestion: records pushed by collectors for one source go through the same
 * deduplicating merge as backfill, so cache invalidation and conflict detection apply.
 */
public final class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final RawStore rawStore;
    private final EntityCatalog catalog;
    private final CadenceDetector cadenceDetector;
    private final PipelineMetrics metrics;

    public IngestionService(RawStore rawStore, EntityCatalog catalog, CadenceDetector cadenceDetector,
                            PipelineMetrics metrics) {
        this.rawStore = rawStore;
        this.catalog = catalog;
        this.cadenceDetector = cadenceDetector;
        this.metrics = metrics;
    }

    /**
     * Merge a freshly collected batch.
     *
     * @throws ValidationException if the source is unknown, a record carries a cadence other than
     *                             the source's, or a catalogued entity belongs to another domain
     */
    public MergeResult ingest(String sourceId, List<IntervalRecord> records) {
        SourceDescriptor source = catalog.requireSource(sourceId);
        if (records == null || records.isEmpty()) {
            return MergeResult.empty();
        }

        for (IntervalRecord record : records) {
            if (record.nativeCadence() != source.cadence()) {
                throw new ValidationException("nativeCadence", String.format(
                        "Record for %s @ %s is %s but source %s publishes %s",
                        record.entityId(), record.timestamp(), record.nativeCadence().getLabel(),
                        sourceId, source.cadence().getLabel()));
            }
            catalog.findEntity(record.entityId())
                    .filter(entity -> entity.domain() != source.domain())
                    .ifPresent(entity -> {
                        throw new ValidationException("entityId", String.format(
                                "Entity %s is %s, source %s is %s",
                                entity.entityId(), entity.domain(), sourceId, source.domain()));
                    });
        }
        warnOnCadenceDrift(source, records);

        MergeResult result = rawStore.merge(source.domain(), records);
        metrics.recordRecordsMerged(source.domain(), result.written());
        if (result.hasViolations()) {
            log.error("Ingest {}: {} entities rejected for conflicting values", sourceId, result.violations().size());
        } else {
            log.debug("Ingest {}: {} new, {} duplicate", sourceId, result.written(), result.duplicates());
        }
        return result;
    }

    private void warnOnCadenceDrift(SourceDescriptor source, List<IntervalRecord> records) {
        Map<String, List<IntervalRecord>> byEntity = records.stream()
                .collect(Collectors.groupingBy(IntervalRecord::entityId));
        for (Map.Entry<String, List<IntervalRecord>> entry : byEntity.entrySet()) {
            if (entry.getValue().size() < 3) {
                continue;
            }
            Cadence observed = detectOrNull(entry.getValue());
            if (observed != null && observed != source.cadence()) {
                log.warn("Ingest {}: {} samples look like {} but source declares {}",
                        source.sourceId(), entry.getKey(), observed.getLabel(), source.cadence().getLabel());
            }
        }
    }

    private Cadence detectOrNull(List<IntervalRecord> records) {
        try {
            return cadenceDetector.detect(records.stream().map(IntervalRecord::timestamp).toList());
        } catch (ValidationException e) {
            log.debug("Cadence not detectable: {}", e.getMessage());
            return null;
        }
    }
}
