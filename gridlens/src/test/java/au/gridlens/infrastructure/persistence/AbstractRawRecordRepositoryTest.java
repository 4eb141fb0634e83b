package au.gridlens.infrastructure.persistence;

import au.gridlens.application.port.output.RawRecordRepository;
import au.gridlens.domain.common.DataIntegrityViolationException;
import au.gridlens.domain.common.StorageException;
import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;

import static au.gridlens.support.TelemetryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every Raw Store backend must share.
 */
abstract class AbstractRawRecordRepositoryTest {

    static final Partition GEN_5M = new Partition(DataDomain.GENERATION, Cadence.MINUTE_5);
    static final Partition GEN_30M = new Partition(DataDomain.GENERATION, Cadence.MINUTE_30);

    abstract RawRecordRepository repository();

    @Test
    void testAppendAndFindRange() {
        RawRecordRepository repo = repository();
        repo.appendBatch(GEN_5M, constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 500.0));
        repo.appendBatch(GEN_5M, constantDay("ERGT01", DAY_1, Cadence.MINUTE_5, 60.0));

        Instant from = CLOCK.dayStart(DAY_1).plusSeconds(3600);
        List<IntervalRecord> hour = repo.findRange(GEN_5M, "BAYSW1", from, from.plusSeconds(3600));

        assertEquals(12, hour.size());
        assertEquals(from, hour.get(0).timestamp());
        assertEquals(Cadence.MINUTE_5, hour.get(0).nativeCadence());
        assertTrue(hour.stream().allMatch(r -> r.entityId().equals("BAYSW1") && r.value() == 500.0));
    }

    @Test
    void testFindValuesIsHalfOpen() {
        RawRecordRepository repo = repository();
        repo.appendBatch(GEN_5M, constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 1.0));

        NavigableMap<Instant, Double> values =
                repo.findValues(GEN_5M, "BAYSW1", CLOCK.dayStart(DAY_1), CLOCK.dayStart(DAY_1).plusSeconds(600));
        assertEquals(2, values.size());
        assertTrue(repo.findValues(GEN_5M, "UNKNOWN", CLOCK.dayStart(DAY_1), CLOCK.dayEnd(DAY_1)).isEmpty());
    }

    @Test
    void testCountDistinctTimestamps() {
        RawRecordRepository repo = repository();
        repo.appendBatch(GEN_5M, day("BAYSW1", DAY_1, Cadence.MINUTE_5, i -> i).subList(0, 200));
        repo.appendBatch(GEN_5M, day("ERGT01", DAY_1, Cadence.MINUTE_5, i -> i).subList(100, 288));

        Instant from = CLOCK.dayStart(DAY_1);
        Instant to = CLOCK.dayEnd(DAY_1);
        assertEquals(200, repo.countDistinctTimestamps(GEN_5M, "BAYSW1", from, to));
        assertEquals(188, repo.countDistinctTimestamps(GEN_5M, "ERGT01", from, to));
        assertEquals(288, repo.countDistinctTimestamps(GEN_5M, null, from, to));
        assertEquals(0, repo.countDistinctTimestamps(GEN_30M, null, from, to));
        assertEquals(0, repo.countDistinctTimestamps(GEN_5M, null, to, from));
    }

    @Test
    void testPartitionsAndCounts() {
        RawRecordRepository repo = repository();
        repo.appendBatch(GEN_5M, constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 1.0));
        repo.appendBatch(GEN_30M, constantDay("BAYSW1", DAY_1, Cadence.MINUTE_30, 1.0));

        assertEquals(Set.of(GEN_5M, GEN_30M), repo.partitions());
        assertEquals(288, repo.count(GEN_5M));
        assertEquals(48, repo.count(GEN_30M));
        assertEquals(0, repo.count(new Partition(DataDomain.PRICE, Cadence.MINUTE_5)));
    }

    @Test
    void testFindAllOrderedByEntityThenTime() {
        RawRecordRepository repo = repository();
        repo.appendBatch(GEN_30M, constantDay("ERGT01", DAY_1, Cadence.MINUTE_30, 2.0));
        repo.appendBatch(GEN_30M, constantDay("BAYSW1", DAY_1, Cadence.MINUTE_30, 1.0));

        List<IntervalRecord> all = repo.findAll(GEN_30M);
        assertEquals(96, all.size());
        assertEquals("BAYSW1", all.get(0).entityId());
        assertEquals("ERGT01", all.get(95).entityId());
        assertTrue(all.get(0).timestamp().isBefore(all.get(1).timestamp()));
    }

    @Test
    void testCadenceMismatchRejected() {
        RawRecordRepository repo = repository();
        List<IntervalRecord> thirty = constantDay("BAYSW1", DAY_1, Cadence.MINUTE_30, 1.0);
        assertThrows(ValidationException.class, () -> repo.appendBatch(GEN_5M, thirty));
        assertEquals(0, repo.count(GEN_5M));
    }

    @Test
    void testDuplicateKeyRejected() {
        RawRecordRepository repo = repository();
        List<IntervalRecord> one = constantDay("BAYSW1", DAY_1, Cadence.MINUTE_5, 1.0).subList(0, 1);
        repo.appendBatch(GEN_5M, one);
        RuntimeException e = assertThrows(RuntimeException.class, () -> repo.appendBatch(GEN_5M, one));
        assertTrue(e instanceof DataIntegrityViolationException || e instanceof StorageException);
    }
}
