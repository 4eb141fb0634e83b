package au.gridlens.infrastructure.catalog;

import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.model.EntityDescriptor;
import au.gridlens.service.catalog.EntityCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonCatalogLoaderTest {

    private final JsonCatalogLoader loader = new JsonCatalogLoader();

    @Test
    void testBundledCatalogLoads() {
        EntityCatalog catalog = loader.load("classpath:catalog.json");

        EntityDescriptor bayswater = catalog.requireEntity("BAYSW1");
        assertEquals(DataDomain.GENERATION, bayswater.domain());
        assertEquals(Cadence.MINUTE_5, bayswater.nativeCadence());
        assertEquals("DISPATCH_SCADA", catalog.sourceFor(bayswater).sourceId());
        assertEquals("ROOFTOP_PV_ACTUAL", catalog.sourceFor(catalog.requireEntity("NSW1_ROOFTOP")).sourceId());
        assertFalse(catalog.entitiesInRegion("nsw1").isEmpty());
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, """
                {
                  "sources": [{"sourceId": "TRADING_PRICE", "domain": "price", "cadence": "30m"}],
                  "entities": [{"entityId": "QLD1", "domain": "PRICE", "nativeCadence": "30"}]
                }
                """);

        EntityCatalog catalog = loader.load(file.toString());

        assertEquals(Cadence.MINUTE_30, catalog.requireSource("TRADING_PRICE").cadence());
        assertNull(catalog.requireEntity("QLD1").region());
    }

    @Test
    void testMissingFieldRejected() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.parse(mapper.readTree(
                "{\"entities\": [{\"entityId\": \"QLD1\", \"domain\": \"PRICE\"}]}")));
        assertTrue(e.getMessage().contains("nativeCadence"));
    }

    @Test
    void testMissingResource() {
        assertThrows(IllegalStateException.class, () -> loader.load("classpath:nope.json"));
    }
}
