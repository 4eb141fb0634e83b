package au.gridlens.service.query;

import au.gridlens.domain.model.Cadence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Picks a target cadence when the caller does not name one.
 *
 * An explicit preference always wins. Ranges ending within the last 24 hours and no
 * longer than a week get 5-minute detail. Longer than a week, or more 5-minute samples
 * than the sample budget, falls back to 30 minutes.
 */
public final class ResolutionAdvisor {
    private static final Logger log = LoggerFactory.getLogger(ResolutionAdvisor.class);

    static final Duration REALTIME_WINDOW = Duration.ofHours(24);
    static final Duration DETAIL_LIMIT = Duration.ofDays(7);
    static final long DEFAULT_SAMPLE_BUDGET = 2_000_000L;

    private final Clock clock;
    private final long sampleBudget;

    public ResolutionAdvisor(Clock clock) {
        this(clock, DEFAULT_SAMPLE_BUDGET);
    }

    public ResolutionAdvisor(Clock clock, long sampleBudget) {
        this.clock = clock;
        this.sampleBudget = sampleBudget;
    }

    public Cadence advise(Instant start, Instant end, int entityCount, Cadence preference) {
        if (preference != null) {
            return preference;
        }
        Duration span = Duration.between(start, end);
        Duration sinceEnd = Duration.between(end, clock.instant()).abs();

        if (sinceEnd.compareTo(REALTIME_WINDOW) <= 0 && span.compareTo(DETAIL_LIMIT) <= 0) {
            return Cadence.MINUTE_5;
        }
        if (span.compareTo(DETAIL_LIMIT) > 0) {
            log.debug("Range of {} days exceeds detail limit, using 30m", span.toDays());
            return Cadence.MINUTE_30;
        }
        long estimatedSamples = (long) Cadence.MINUTE_5.periodsFor(span) * Math.max(1, entityCount);
        if (estimatedSamples > sampleBudget) {
            log.debug("Estimated {} samples exceeds budget {}, using 30m", estimatedSamples, sampleBudget);
            return Cadence.MINUTE_30;
        }
        return Cadence.MINUTE_5;
    }
}
