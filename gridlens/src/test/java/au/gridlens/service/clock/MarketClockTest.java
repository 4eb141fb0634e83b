package au.gridlens.service.clock;

import au.gridlens.domain.model.Cadence;
import org.junit.jupiter.api.Test;

import java.time.*;

import static org.junit.jupiter.api.Assertions.*;

class MarketClockTest {

    private final MarketClock clock = MarketClock.nem();

    @Test
    void testMarketDayIsUtcPlusTen() {
        LocalDate day = LocalDate.of(2024, 3, 1);
        assertEquals(Instant.parse("2024-02-29T14:00:00Z"), clock.dayStart(day));
        assertEquals(Instant.parse("2024-03-01T14:00:00Z"), clock.dayEnd(day));
        assertEquals(day, clock.marketDay(Instant.parse("2024-03-01T13:59:59Z")));
        assertEquals(day.plusDays(1), clock.marketDay(Instant.parse("2024-03-01T14:00:00Z")));
    }

    @Test
    void testFloorToThirtyMinuteBucket() {
        Instant t = OffsetDateTime.of(2024, 3, 1, 10, 7, 0, 0, MarketClock.NEM_OFFSET).toInstant();
        Instant expected = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, MarketClock.NEM_OFFSET).toInstant();
        assertEquals(expected, clock.floorToBucket(t, Cadence.MINUTE_30));
        assertEquals(expected, clock.floorToBucket(expected, Cadence.MINUTE_30));
    }

    @Test
    void testDailyBucketIsMarketDay() {
        Instant afternoon = OffsetDateTime.of(2024, 3, 1, 15, 0, 0, 0, MarketClock.NEM_OFFSET).toInstant();
        assertEquals(clock.dayStart(LocalDate.of(2024, 3, 1)), clock.floorToBucket(afternoon, Cadence.DAY_1));
    }

    @Test
    void testFloorBeforeOriginStaysAligned() {
        Instant before = clock.getOrigin().minusSeconds(60);
        assertEquals(clock.getOrigin().minusSeconds(300), clock.floorToBucket(before, Cadence.MINUTE_5));
    }

    @Test
    void testToday() {
        Clock fixed = Clock.fixed(Instant.parse("2024-03-01T15:00:00Z"), ZoneOffset.UTC);
        assertEquals(LocalDate.of(2024, 3, 2), clock.today(fixed));
    }
}
