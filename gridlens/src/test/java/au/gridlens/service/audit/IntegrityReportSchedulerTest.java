package au.gridlens.service.audit;

import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.model.IntegrityReport;
import au.gridlens.infrastructure.metrics.PipelineMetrics;
import au.gridlens.infrastructure.persistence.InMemoryRawRecordRepository;
import au.gridlens.service.store.RawStore;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.ArrayList;
import java.util.List;

import static au.gridlens.support.TelemetryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IntegrityReportSchedulerTest {

    private final List<List<IntegrityReport>> delivered = new ArrayList<>();

    private IntegrityReportScheduler scheduler(RawStore store, Instant now, PipelineMetrics metrics) {
        IntegrityAuditor auditor = new IntegrityAuditor(store, catalog(), CLOCK);
        return new IntegrityReportScheduler(auditor, CLOCK, Clock.fixed(now, ZoneOffset.UTC),
                LocalTime.of(4, 0), delivered::add, metrics);
    }

    @Test
    void testRunForAuditsEveryEntityAndDelivers() {
        RawStore store = new RawStore(new InMemoryRawRecordRepository());
        store.merge(DataDomain.GENERATION, constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 300));
        store.merge(DataDomain.GENERATION, constantDay("ERGT01", DAY_1, Cadence.MINUTE_5, 20).subList(0, 100));
        PipelineMetrics metrics = mock(PipelineMetrics.class);

        try (IntegrityReportScheduler scheduler = scheduler(store, Instant.parse("2024-03-02T00:00:00Z"), metrics)) {
            List<IntegrityReport> reports = scheduler.runFor(DAY_1);

            assertEquals(catalog().entities().size(), reports.size());
            assertEquals(List.of(reports), delivered);
            assertEquals(CoverageStatus.COMPLETE, status(reports, "BAYSW1"));
            assertEquals(CoverageStatus.PARTIAL, status(reports, "ERGT01"));
            assertEquals(CoverageStatus.MISSING, status(reports, "NSW1_ROOFTOP"));
            verify(metrics).recordIntegrityStatus("BAYSW1", CoverageStatus.COMPLETE);
            verify(metrics).recordIntegrityStatus("ERGT01", CoverageStatus.PARTIAL);
        }
    }

    @Test
    void testDelayUntilLaterToday() {
        // 01:00 market time (UTC+10)
        Instant now = Instant.parse("2024-03-01T15:00:00Z");
        try (IntegrityReportScheduler scheduler = scheduler(emptyStore(), now, PipelineMetrics.NOOP)) {
            assertEquals(Duration.ofHours(3), scheduler.delayUntilNextRun());
        }
    }

    @Test
    void testDelayRollsToTomorrowOncePassed() {
        // 04:00 market time exactly
        Instant now = Instant.parse("2024-03-01T18:00:00Z");
        try (IntegrityReportScheduler scheduler = scheduler(emptyStore(), now, PipelineMetrics.NOOP)) {
            assertEquals(Duration.ofDays(1), scheduler.delayUntilNextRun());
        }
    }

    private static RawStore emptyStore() {
        return new RawStore(new InMemoryRawRecordRepository());
    }

    private static CoverageStatus status(List<IntegrityReport> reports, String target) {
        return reports.stream().filter(r -> r.target().equals(target)).findFirst().orElseThrow().status();
    }
}
