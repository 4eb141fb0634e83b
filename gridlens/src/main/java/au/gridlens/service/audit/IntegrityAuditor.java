package au.gridlens.service.audit;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.*;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.clock.MarketClock;
import au.gridlens.service.store.RawStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Integrity Auditor - Compares stored record counts against the expected count per market day.
 *
 * Expected count is minutes per day over the declared cadence (288 at 5m, 48 at 30m).
 * Read only: never touches the store's write path.
 */
public final class IntegrityAuditor {
    private static final Logger log = LoggerFactory.getLogger(IntegrityAuditor.class);

    private final RawStore rawStore;
    private final EntityCatalog catalog;
    private final MarketClock marketClock;

    public IntegrityAuditor(RawStore rawStore, EntityCatalog catalog, MarketClock marketClock) {
        this.rawStore = rawStore;
        this.catalog = catalog;
        this.marketClock = marketClock;
    }

    /**
     * Audit an entity or a source for one market day. Source ids take precedence.
     *
     * @throws ValidationException if the id is neither a known source nor a known entity
     */
    public IntegrityReport audit(String entityOrSourceId, LocalDate day) {
        if (catalog.isSource(entityOrSourceId)) {
            return auditSource(entityOrSourceId, day);
        }
        if (catalog.findEntity(entityOrSourceId).isPresent()) {
            return auditEntity(entityOrSourceId, day);
        }
        throw new ValidationException("id", "Unknown entity or source: " + entityOrSourceId);
    }

    public IntegrityReport auditEntity(String entityId, LocalDate day) {
        EntityDescriptor entity = catalog.requireEntity(entityId);
        Partition partition = new Partition(entity.domain(), entity.nativeCadence());
        int actual = count(partition, entityId, day);
        IntegrityReport report = IntegrityReport.of(entityId, AuditTargetKind.ENTITY, day, entity.nativeCadence(), actual);
        log.debug("[AUDIT] {} {}: {}/{} {}", entityId, day, actual, report.expectedCount(), report.status());
        return report;
    }

    /**
     * Audit a source partition: distinct timestamps across all of its entities.
     */
    public IntegrityReport auditSource(String sourceId, LocalDate day) {
        SourceDescriptor source = catalog.requireSource(sourceId);
        Partition partition = new Partition(source.domain(), source.cadence());
        int actual = count(partition, null, day);
        IntegrityReport report = IntegrityReport.of(sourceId, AuditTargetKind.SOURCE, day, source.cadence(), actual);
        log.debug("[AUDIT] source {} {}: {}/{} {}", sourceId, day, actual, report.expectedCount(), report.status());
        return report;
    }

    /**
     * One report per market day in [from, toInclusive].
     */
    public List<IntegrityReport> auditRange(String entityOrSourceId, LocalDate from, LocalDate toInclusive) {
        if (toInclusive.isBefore(from)) {
            throw new ValidationException("toInclusive",
                    String.format("Audit range end %s is before start %s", toInclusive, from));
        }
        List<IntegrityReport> reports = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(toInclusive); day = day.plusDays(1)) {
            reports.add(audit(entityOrSourceId, day));
        }
        long complete = reports.stream().filter(IntegrityReport::isComplete).count();
        log.info("[AUDIT] {} {}..{}: {}/{} days complete", entityOrSourceId, from, toInclusive, complete, reports.size());
        return reports;
    }

    /**
     * Reports for every catalogued entity on one day.
     */
    public List<IntegrityReport> auditAllEntities(LocalDate day) {
        List<IntegrityReport> reports = new ArrayList<>();
        for (EntityDescriptor entity : catalog.entities()) {
            reports.add(auditEntity(entity.entityId(), day));
        }
        return reports;
    }

    private int count(Partition partition, String entityIdOrNull, LocalDate day) {
        Instant from = marketClock.dayStart(day);
        Instant to = marketClock.dayEnd(day);
        return rawStore.countDistinctTimestamps(partition, entityIdOrNull, from, to);
    }
}
