package au.gridlens.infrastructure.archive;

import au.gridlens.application.port.output.ArchiveFetchException;
import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.IntervalRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static au.gridlens.support.TelemetryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FileArchiveClientTest {

    @TempDir
    Path root;

    private FileArchiveClient client;

    @BeforeEach
    void setUp() {
        client = new FileArchiveClient(root, catalog());
    }

    @Test
    void testReadsWhatWasWritten() throws Exception {
        List<IntervalRecord> records = day("BAYSW1", DAY_1, Cadence.MINUTE_30, i -> 400.0 + i);
        Path file = client.write("TRADING_SCADA", DAY_1, records);

        assertEquals(root.resolve("TRADING_SCADA").resolve("2024-03-01.json"), file);
        assertEquals(records, client.fetch("TRADING_SCADA", DAY_1));
    }

    @Test
    void testRecordsTakeSourceCadence() throws Exception {
        Files.createDirectories(root.resolve("DISPATCH_SCADA"));
        Files.writeString(client.fileFor("DISPATCH_SCADA", DAY_1), """
                [
                  {"entityId": "BAYSW1", "timestamp": "2024-02-29T14:00:00Z", "value": 512.4, "units": "MW"},
                  {"entityId": "ERGT01", "timestamp": "2024-02-29T14:05:00Z", "value": 0}
                ]
                """);

        List<IntervalRecord> records = client.fetch("DISPATCH_SCADA", DAY_1);

        assertEquals(2, records.size());
        assertEquals(Cadence.MINUTE_5, records.get(0).nativeCadence());
        assertEquals(512.4, records.get(0).value());
        assertEquals(CLOCK.dayStart(DAY_1), records.get(0).timestamp());
    }

    @Test
    void testMissingFileIsPermanent() {
        ArchiveFetchException e = assertThrows(ArchiveFetchException.class, () -> client.fetch("DISPATCH_SCADA", DAY_2));
        assertFalse(e.isTransient());
        assertEquals("DISPATCH_SCADA", e.getSourceId());
        assertEquals(DAY_2, e.getDay());
    }

    @Test
    void testUnknownSourceIsPermanent() {
        ArchiveFetchException e = assertThrows(ArchiveFetchException.class, () -> client.fetch("NOPE", DAY_1));
        assertFalse(e.isTransient());
        assertTrue(e.getMessage().contains("unknown source"));
    }

    @Test
    void testMalformedContentIsPermanent() throws Exception {
        Files.createDirectories(root.resolve("DISPATCH_SCADA"));
        Files.writeString(client.fileFor("DISPATCH_SCADA", DAY_1), "{ not json");

        ArchiveFetchException e = assertThrows(ArchiveFetchException.class, () -> client.fetch("DISPATCH_SCADA", DAY_1));
        assertFalse(e.isTransient());
    }

    @Test
    void testInvalidRecordIsPermanent() throws Exception {
        Files.createDirectories(root.resolve("DISPATCH_SCADA"));
        Files.writeString(client.fileFor("DISPATCH_SCADA", DAY_1),
                "[{\"entityId\": \"\", \"timestamp\": \"2024-02-29T14:00:00Z\", \"value\": 1.0}]");

        ArchiveFetchException e = assertThrows(ArchiveFetchException.class, () -> client.fetch("DISPATCH_SCADA", DAY_1));
        assertFalse(e.isTransient());
        assertTrue(e.getMessage().contains("invalid record"));
    }
}
