package au.gridlens.service.clock;

import au.gridlens.domain.model.Cadence;

import java.time.*;

/**
 * Market Clock - Market day boundaries and bucket alignment.
 *
 * The NEM runs on AEST (UTC+10) all year, with no daylight saving, so a market day is
 * [00:00, 24:00) at a fixed offset.
 * Alignment: buckets align to a fixed origin (1970-01-01 00:00 in market time), so
 * sub-daily buckets match wall-clock boundaries and daily buckets are market days.
 */
public final class MarketClock {
    public static final ZoneOffset NEM_OFFSET = ZoneOffset.ofHours(10);

    private final ZoneOffset offset;
    private final Instant origin;

    public MarketClock(ZoneOffset offset) {
        this.offset = offset;
        this.origin = LocalDate.of(1970, 1, 1).atStartOfDay().toInstant(offset);
    }

    /**
     * Clock on NEM time (UTC+10).
     */
    public static MarketClock nem() {
        return new MarketClock(NEM_OFFSET);
    }

    public ZoneOffset getOffset() {
        return offset;
    }

    /**
     * Alignment origin for all buckets.
     */
    public Instant getOrigin() {
        return origin;
    }

    /**
     * Start of a market day (inclusive).
     */
    public Instant dayStart(LocalDate day) {
        return day.atStartOfDay().toInstant(offset);
    }

    /**
     * End of a market day (exclusive) - the next day's start.
     */
    public Instant dayEnd(LocalDate day) {
        return dayStart(day.plusDays(1));
    }

    /**
     * Market day a timestamp belongs to.
     */
    public LocalDate marketDay(Instant timestamp) {
        return timestamp.atOffset(offset).toLocalDate();
    }

    public LocalDate today(Clock clock) {
        return LocalDate.now(clock.withZone(offset));
    }

    /**
     * Floor timestamp to the start of its bucket.
     *
     * For 30-minute buckets: 10:07 -> 10:00, 10:30 -> 10:30.
     * For daily buckets: any time -> 00:00 market time of that day.
     */
    public Instant floorToBucket(Instant timestamp, Cadence cadence) {
        long elapsed = timestamp.getEpochSecond() - origin.getEpochSecond();
        long bucketIndex = Math.floorDiv(elapsed, cadence.getSeconds());
        return origin.plusSeconds(bucketIndex * cadence.getSeconds());
    }

    /**
     * Start of the bucket after the one starting at {@code bucketStart}.
     */
    public Instant nextBucket(Instant bucketStart, Cadence cadence) {
        return bucketStart.plusSeconds(cadence.getSeconds());
    }

    /**
     * Format timestamp in market time for logging.
     */
    public String format(Instant timestamp) {
        return timestamp.atOffset(offset).toString();
    }
}
