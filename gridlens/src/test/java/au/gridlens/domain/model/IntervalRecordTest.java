package au.gridlens.domain.model;

import au.gridlens.domain.common.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IntervalRecordTest {

    @Test
    void testRejectsInvalidFields() {
        Instant ts = Instant.parse("2024-03-01T00:00:00Z");
        assertEquals("entityId", assertThrows(ValidationException.class,
                () -> IntervalRecord.of(" ", ts, 1.0, Cadence.MINUTE_5)).getField());
        assertEquals("timestamp", assertThrows(ValidationException.class,
                () -> IntervalRecord.of("BAYSW1", null, 1.0, Cadence.MINUTE_5)).getField());
        assertEquals("value", assertThrows(ValidationException.class,
                () -> IntervalRecord.of("BAYSW1", ts, Double.POSITIVE_INFINITY, Cadence.MINUTE_5)).getField());
    }

    @Test
    void testCoverageClassification() {
        assertEquals(CoverageStatus.COMPLETE, CoverageStatus.classify(288, 288));
        assertEquals(CoverageStatus.PARTIAL, CoverageStatus.classify(287, 288));
        assertEquals(CoverageStatus.MISSING, CoverageStatus.classify(0, 288));
        assertEquals(CoverageStatus.PARTIAL, CoverageStatus.classify(24, 48));
    }
}
