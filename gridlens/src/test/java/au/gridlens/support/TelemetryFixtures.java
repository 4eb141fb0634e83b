package au.gridlens.support;

import au.gridlens.domain.model.*;
import au.gridlens.service.catalog.EntityCatalog;
import au.gridlens.service.clock.MarketClock;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/**
 * Shared catalog and record builders for tests.
 */
public final class TelemetryFixtures {

    public static final MarketClock CLOCK = MarketClock.nem();
    public static final LocalDate DAY_1 = LocalDate.of(2024, 3, 1);
    public static final LocalDate DAY_2 = DAY_1.plusDays(1);
    public static final LocalDate DAY_3 = DAY_1.plusDays(2);

    private TelemetryFixtures() {
    }

    /**
     * Two 5m generators in NSW1, a 30m rooftop entity, a 5m price region and their sources.
     */
    public static EntityCatalog catalog() {
        return new EntityCatalog(
                List.of(
                        new EntityDescriptor("BAYSW1", DataDomain.GENERATION, Cadence.MINUTE_5, "NSW1", "Coal"),
                        new EntityDescriptor("ERGT01", DataDomain.GENERATION, Cadence.MINUTE_5, "NSW1", "Gas"),
                        new EntityDescriptor("NSW1_ROOFTOP", DataDomain.ROOFTOP, Cadence.MINUTE_30, "NSW1", "Solar"),
                        new EntityDescriptor("SA1", DataDomain.PRICE, Cadence.MINUTE_5, "SA1", null)),
                List.of(
                        new SourceDescriptor("DISPATCH_SCADA", DataDomain.GENERATION, Cadence.MINUTE_5),
                        new SourceDescriptor("TRADING_SCADA", DataDomain.GENERATION, Cadence.MINUTE_30),
                        new SourceDescriptor("ROOFTOP_PV_ACTUAL", DataDomain.ROOFTOP, Cadence.MINUTE_30),
                        new SourceDescriptor("DISPATCH_PRICE", DataDomain.PRICE, Cadence.MINUTE_5)));
    }

    /**
     * Every interval of one market day, value by interval index.
     */
    public static List<IntervalRecord> day(String entityId, LocalDate day, Cadence cadence, IntToDoubleFunction value) {
        return intervals(entityId, CLOCK.dayStart(day), cadence.periodsPerDay(), cadence, value);
    }

    public static List<IntervalRecord> constantDay(String entityId, LocalDate day, Cadence cadence, double value) {
        return day(entityId, day, cadence, i -> value);
    }

    public static List<IntervalRecord> intervals(String entityId, Instant start, int count, Cadence cadence,
                                                 IntToDoubleFunction value) {
        List<IntervalRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(IntervalRecord.of(entityId, start.plusSeconds(i * cadence.getSeconds()),
                    value.applyAsDouble(i), cadence));
        }
        return records;
    }

    /**
     * Canonical series with NaN entries as missing markers.
     */
    public static CanonicalSeries series(String label, Cadence cadence, Instant start, double... values) {
        CanonicalSeries.Builder builder = CanonicalSeries.builder(label, cadence);
        for (int i = 0; i < values.length; i++) {
            Instant ts = start.plusSeconds(i * cadence.getSeconds());
            if (Double.isNaN(values[i])) {
                builder.addMissing(ts);
            } else {
                builder.add(ts, values[i]);
            }
        }
        return builder.build();
    }
}
