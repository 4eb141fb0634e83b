package au.gridlens.domain.model;

import au.gridlens.domain.common.ValidationException;

import java.time.Duration;

/**
 * Sampling cadences used by market telemetry.
 *
 * Dispatch data (SCADA, prices) is published every 5 minutes, settlement data every 30.
 */
public enum Cadence {
    /**
     * 5-minute dispatch intervals (288 per day).
     */
    MINUTE_5(5, "5m"),

    /**
     * 15-minute intervals.
     */
    MINUTE_15(15, "15m"),

    /**
     * 30-minute settlement intervals (48 per day).
     */
    MINUTE_30(30, "30m"),

    /**
     * Hourly intervals.
     */
    HOUR_1(60, "1h"),

    /**
     * One bucket per market day.
     */
    DAY_1(1440, "1d");

    public static final int MINUTES_PER_DAY = 1440;

    private final int minutes;
    private final String label;

    Cadence(int minutes, String label) {
        this.minutes = minutes;
        this.label = label;
    }

    public int getMinutes() {
        return minutes;
    }

    public long getSeconds() {
        return minutes * 60L;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }

    public String getLabel() {
        return label;
    }

    /**
     * Expected number of samples in one full day.
     */
    public int periodsPerDay() {
        return MINUTES_PER_DAY / minutes;
    }

    /**
     * Number of whole periods covering the given duration (rounded up).
     * 1 day at 5m -> 288, 1 day at 30m -> 48.
     */
    public int periodsFor(Duration duration) {
        if (duration.isNegative()) {
            throw new ValidationException("duration", "Duration must not be negative: " + duration);
        }
        return (int) Math.ceil(duration.toSeconds() / (double) getSeconds());
    }

    public boolean isFinerOrEqual(Cadence other) {
        return minutes <= other.minutes;
    }

    /**
     * True when buckets of {@code coarser} are made of a whole number of this cadence's intervals.
     */
    public boolean divides(Cadence coarser) {
        return coarser.minutes % minutes == 0;
    }

    /**
     * Parse "5m", "30m", "1h", "1d", a minute count ("30") or an enum name.
     */
    public static Cadence parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("cadence", "Cadence must not be blank");
        }
        String normalized = text.trim();
        for (Cadence cadence : values()) {
            if (cadence.label.equalsIgnoreCase(normalized) || cadence.name().equalsIgnoreCase(normalized)) {
                return cadence;
            }
        }
        try {
            return ofMinutes(Integer.parseInt(normalized));
        } catch (NumberFormatException e) {
            throw new ValidationException("cadence", "Unknown cadence: " + text);
        }
    }

    public static Cadence ofMinutes(int minutes) {
        for (Cadence cadence : values()) {
            if (cadence.minutes == minutes) {
                return cadence;
            }
        }
        throw new ValidationException("cadence", "Unsupported cadence: " + minutes + " minutes");
    }
}
