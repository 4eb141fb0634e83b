package au.gridlens.application.port.output;

import java.time.LocalDate;

/**
 * Archive fetch failure for one (source, day).
 */
public class ArchiveFetchException extends Exception {

    private final String sourceId;
    private final LocalDate day;
    private final boolean transientFailure;

    public ArchiveFetchException(String sourceId, LocalDate day, boolean transientFailure, String message) {
        this(sourceId, day, transientFailure, message, null);
    }

    public ArchiveFetchException(String sourceId, LocalDate day, boolean transientFailure, String message, Throwable cause) {
        super(String.format("[%s %s] %s", sourceId, day, message), cause);
        this.sourceId = sourceId;
        this.day = day;
        this.transientFailure = transientFailure;
    }

    public static ArchiveFetchException transientFailure(String sourceId, LocalDate day, String message, Throwable cause) {
        return new ArchiveFetchException(sourceId, day, true, message, cause);
    }

    public static ArchiveFetchException permanent(String sourceId, LocalDate day, String message) {
        return new ArchiveFetchException(sourceId, day, false, message);
    }

    public String getSourceId() {
        return sourceId;
    }

    public LocalDate getDay() {
        return day;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
