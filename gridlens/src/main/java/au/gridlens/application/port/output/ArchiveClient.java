package au.gridlens.application.port.output;

import au.gridlens.domain.model.IntervalRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Market archive holding one file of interval records per source and market day.
 */
public interface ArchiveClient {

    /**
     * Fetch every record a source published for one market day.
     *
     * @throws ArchiveFetchException on failure; {@link ArchiveFetchException#isTransient()} tells whether a retry may help
     */
    List<IntervalRecord> fetch(String sourceId, LocalDate day) throws ArchiveFetchException;
}
