package au.gridlens.service.ingest;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.Partition;
import au.gridlens.infrastructure.metrics.PipelineMetrics;
import au.gridlens.infrastructure.persistence.InMemoryRawRecordRepository;
import au.gridlens.service.store.MergeEvent;
import au.gridlens.service.store.MergeResult;
import au.gridlens.service.store.RawStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static au.gridlens.support.TelemetryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock
    private PipelineMetrics metrics;

    private RawStore store;
    private IngestionService service;
    private final List<MergeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new RawStore(new InMemoryRawRecordRepository());
        store.addListener(events::add);
        service = new IngestionService(store, catalog(), new CadenceDetector(), metrics);
    }

    @Test
    void testIngestMergesIntoSourceDomain() {
        MergeResult result = service.ingest("DISPATCH_SCADA", constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 400));

        assertEquals(288, result.written());
        assertEquals(288, store.count(new Partition(DataDomain.GENERATION, Cadence.MINUTE_5)));
        assertEquals(1, events.size());
        verify(metrics).recordRecordsMerged(DataDomain.GENERATION, 288);
    }

    @Test
    void testReingestIsIdempotent() {
        List<IntervalRecord> batch = constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 400);
        service.ingest("DISPATCH_SCADA", batch);

        MergeResult again = service.ingest("DISPATCH_SCADA", batch);

        assertEquals(0, again.written());
        assertEquals(288, again.duplicates());
        assertEquals(1, events.size());
    }

    @Test
    void testConflictQuarantinesEntity() {
        service.ingest("DISPATCH_SCADA", constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 400));

        MergeResult result = service.ingest("DISPATCH_SCADA", constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 401));

        assertTrue(result.hasViolations());
        assertTrue(store.isQuarantined("BAYSW1"));
    }

    @Test
    void testUnknownSourceRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> service.ingest("NOPE", constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 1)));
        assertEquals("sourceId", e.getField());
    }

    @Test
    void testCadenceMustMatchSource() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> service.ingest("TRADING_SCADA", constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 1)));

        assertEquals("nativeCadence", e.getField());
        assertEquals(0, store.totalCount());
    }

    @Test
    void testEntityFromOtherDomainRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> service.ingest("DISPATCH_PRICE", constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 1)));
        assertEquals("entityId", e.getField());
        verifyNoInteractions(metrics);
    }

    @Test
    void testEmptyBatch() {
        assertEquals(MergeResult.empty(), service.ingest("DISPATCH_SCADA", List.of()));
        assertTrue(events.isEmpty());
    }
}
