package au.gridlens.infrastructure.archive;

import au.gridlens.application.port.output.ArchiveClient;
import au.gridlens.application.port.output.ArchiveFetchException;
import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.SourceDescriptor;
import au.gridlens.service.catalog.EntityCatalog;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Archive adapter over a directory of daily JSON files: {@code <dir>/<sourceId>/<yyyy-MM-dd>.json}.
 *
 * Each file is an array of {@code {"entityId": "BAYSW1", "timestamp": "2024-03-01T00:05:00+10:00", "value": 512.4}}.
 * Records take the cadence the catalog declares for the source.
 * A missing file or malformed content is permanent; other I/O errors are transient.
 */
public final class FileArchiveClient implements ArchiveClient {
    private static final Logger log = LoggerFactory.getLogger(FileArchiveClient.class);

    private final Path root;
    private final EntityCatalog catalog;
    private final ObjectMapper mapper;

    public FileArchiveClient(Path root, EntityCatalog catalog) {
        this.root = root;
        this.catalog = catalog;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public List<IntervalRecord> fetch(String sourceId, LocalDate day) throws ArchiveFetchException {
        SourceDescriptor source = catalog.findSource(sourceId)
                .orElseThrow(() -> ArchiveFetchException.permanent(sourceId, day, "unknown source"));
        Path file = fileFor(sourceId, day);
        if (!Files.exists(file)) {
            throw ArchiveFetchException.permanent(sourceId, day, "no archive file " + file);
        }

        ArchiveRow[] rows;
        try {
            rows = mapper.readValue(file.toFile(), ArchiveRow[].class);
        } catch (JsonProcessingException e) {
            throw new ArchiveFetchException(sourceId, day, false, "malformed archive file " + file, e);
        } catch (IOException e) {
            throw ArchiveFetchException.transientFailure(sourceId, day, "cannot read " + file + ": " + e.getMessage(), e);
        }

        List<IntervalRecord> records = new ArrayList<>(rows.length);
        try {
            for (ArchiveRow row : rows) {
                records.add(new IntervalRecord(row.entityId(), row.timestamp(), row.value(), source.cadence()));
            }
        } catch (RuntimeException e) {
            throw new ArchiveFetchException(sourceId, day, false, "invalid record in " + file + ": " + e.getMessage(), e);
        }
        log.debug("Read {} records for {} {} from {}", records.size(), sourceId, day, file);
        return records;
    }

    /**
     * Write a day file. Used by collectors that mirror the upstream archive locally.
     */
    public Path write(String sourceId, LocalDate day, List<IntervalRecord> records) throws IOException {
        Path file = fileFor(sourceId, day);
        Files.createDirectories(file.getParent());
        ArchiveRow[] rows = records.stream()
                .map(r -> new ArchiveRow(r.entityId(), r.timestamp(), r.value()))
                .toArray(ArchiveRow[]::new);
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), Arrays.asList(rows));
        return file;
    }

    Path fileFor(String sourceId, LocalDate day) {
        return root.resolve(sourceId).resolve(day + ".json");
    }

    record ArchiveRow(
            @JsonProperty("entityId") String entityId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("value") double value) {
    }
}
