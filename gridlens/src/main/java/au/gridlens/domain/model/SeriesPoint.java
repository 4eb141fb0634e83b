package au.gridlens.domain.model;

import java.time.Instant;

/**
 * One point of a canonical series. A null value is an explicit missing marker.
 */
public record SeriesPoint(Instant timestamp, Double value) {

    public static SeriesPoint present(Instant timestamp, double value) {
        return new SeriesPoint(timestamp, value);
    }

    public static SeriesPoint missing(Instant timestamp) {
        return new SeriesPoint(timestamp, null);
    }

    public boolean isMissing() {
        return value == null;
    }
}
