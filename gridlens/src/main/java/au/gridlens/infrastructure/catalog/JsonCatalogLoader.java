package au.gridlens.infrastructure.catalog;

import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.DataDomain;
import au.gridlens.domain.model.EntityDescriptor;
import au.gridlens.domain.model.SourceDescriptor;
import au.gridlens.service.catalog.EntityCatalog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the entity/source catalog from JSON.
 *
 * <pre>
 * {
 *   "sources":  [ { "sourceId": "DISPATCH_SCADA", "domain": "GENERATION", "cadence": "5m" } ],
 *   "entities": [ { "entityId": "BAYSW1", "domain": "GENERATION", "nativeCadence": "5m",
 *                   "region": "NSW1", "fuel": "Coal" } ]
 * }
 * </pre>
 *
 * A location starting with "classpath:" is read from the classpath, anything else from disk.
 */
public final class JsonCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalogLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CLASSPATH_PREFIX = "classpath:";

    public EntityCatalog load(String location) {
        try (InputStream in = open(location)) {
            EntityCatalog catalog = parse(MAPPER.readTree(in));
            log.info("Loaded catalog from {}: {} entities, {} sources",
                    location, catalog.entities().size(), catalog.sources().size());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read catalog " + location, e);
        }
    }

    public EntityCatalog parse(JsonNode root) {
        List<SourceDescriptor> sources = new ArrayList<>();
        for (JsonNode node : root.path("sources")) {
            sources.add(new SourceDescriptor(
                    required(node, "sourceId"),
                    DataDomain.valueOf(required(node, "domain").toUpperCase()),
                    Cadence.parse(required(node, "cadence"))));
        }

        List<EntityDescriptor> entities = new ArrayList<>();
        for (JsonNode node : root.path("entities")) {
            entities.add(new EntityDescriptor(
                    required(node, "entityId"),
                    DataDomain.valueOf(required(node, "domain").toUpperCase()),
                    Cadence.parse(required(node, "nativeCadence")),
                    node.path("region").asText(null),
                    node.path("fuel").asText(null)));
        }
        return new EntityCatalog(entities, sources);
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = JsonCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Catalog resource not found: " + resource);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalStateException("Catalog entry missing '" + field + "': " + node);
        }
        return value.asText();
    }
}
