package au.gridlens.service.audit;

import au.gridlens.domain.model.IntegrityReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes integrity reports as a JSON array for operators and downstream tooling.
 */
public final class IntegrityReportExporter {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String toJson(List<IntegrityReport> reports) {
        try {
            return mapper.writeValueAsString(reports);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize integrity reports", e);
        }
    }

    public void write(List<IntegrityReport> reports, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), reports);
    }

    public List<IntegrityReport> read(Path file) throws IOException {
        return List.of(mapper.readValue(file.toFile(), IntegrityReport[].class));
    }
}
