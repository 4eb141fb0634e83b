package au.gridlens.service.audit;

import au.gridlens.domain.model.AuditTargetKind;
import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.CoverageStatus;
import au.gridlens.domain.model.IntegrityReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static au.gridlens.support.TelemetryFixtures.DAY_1;
import static org.junit.jupiter.api.Assertions.*;

class IntegrityReportExporterTest {

    private final IntegrityReportExporter exporter = new IntegrityReportExporter();

    private static List<IntegrityReport> reports() {
        return List.of(
                IntegrityReport.of("BAYSW1", AuditTargetKind.ENTITY, DAY_1, Cadence.MINUTE_5, 288),
                IntegrityReport.of("TRADING_SCADA", AuditTargetKind.SOURCE, DAY_1, Cadence.MINUTE_30, 12));
    }

    @Test
    void testJsonUsesIsoDatesAndEnumNames() {
        String json = exporter.toJson(reports());

        assertTrue(json.startsWith("["));
        assertTrue(json.contains("\"day\":\"2024-03-01\""), json);
        assertTrue(json.contains("\"status\":\"PARTIAL\""), json);
        assertTrue(json.contains("\"expectedCount\":48"), json);
    }

    @Test
    void testWriteCreatesParentsAndReadsBack(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("integrity-reports").resolve("integrity-2024-03-01.json");

        exporter.write(reports(), file);
        List<IntegrityReport> read = exporter.read(file);

        assertEquals(reports(), read);
        assertEquals(CoverageStatus.COMPLETE, read.get(0).status());
    }
}
