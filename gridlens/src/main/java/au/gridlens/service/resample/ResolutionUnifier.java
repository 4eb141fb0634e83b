package au.gridlens.service.resample;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.Cadence;
import au.gridlens.domain.model.CanonicalSeries;
import au.gridlens.domain.model.IntervalRecord;
import au.gridlens.domain.model.NativeSeries;
import au.gridlens.service.clock.MarketClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * Resolution Unifier - Resamples native-cadence series onto one target cadence.
 *
 * Pattern: bucket value = mean of the samples present in the bucket. The divisor is the
 * number of samples actually present, never the nominal count, so a bucket with 4 of 6
 * five-minute samples averages those 4. A bucket with no samples is missing, not zero.
 *
 * Alignment: buckets align to the market clock origin, so 30-minute buckets start on
 * :00 and :30 and daily buckets are market days.
 */
public final class ResolutionUnifier {
    private static final Logger log = LoggerFactory.getLogger(ResolutionUnifier.class);

    private final MarketClock marketClock;

    public ResolutionUnifier(MarketClock marketClock) {
        this.marketClock = marketClock;
    }

    /**
     * Unify one or more native series into a canonical series at {@code target}.
     *
     * Output covers every bucket from floor(start) up to the last bucket starting before end.
     * Several entities are summed per bucket; a bucket missing for any entity is missing in
     * the sum. Several series of the same entity are unified separately and the finest
     * cadence with a value wins per bucket.
     *
     * @throws ValidationException if a native cadence is coarser than target or does not divide it
     */
    public CanonicalSeries unify(List<NativeSeries> seriesSet, Cadence target, Instant start, Instant end) {
        if (seriesSet == null || seriesSet.isEmpty()) {
            throw new ValidationException("seriesSet", "At least one native series is required");
        }
        if (target == null) {
            throw new ValidationException("targetCadence", "Target cadence must not be null");
        }
        if (start == null || end == null || !start.isBefore(end)) {
            throw new ValidationException("range", String.format("Invalid range [%s, %s)", start, end));
        }
        for (NativeSeries series : seriesSet) {
            checkCadence(series, target);
        }

        Instant first = marketClock.floorToBucket(start, target);
        int buckets = bucketsBefore(first, end, target);

        Map<String, List<NativeSeries>> byEntity = new TreeMap<>();
        for (NativeSeries series : seriesSet) {
            byEntity.computeIfAbsent(series.entityId(), k -> new ArrayList<>()).add(series);
        }

        double[] total = new double[buckets];
        boolean[] present = new boolean[buckets];
        Arrays.fill(present, true);

        for (Map.Entry<String, List<NativeSeries>> entry : byEntity.entrySet()) {
            Double[] entityMeans = unifyEntity(entry.getValue(), target, first, buckets);
            for (int i = 0; i < buckets; i++) {
                if (entityMeans[i] == null) {
                    present[i] = false;
                } else {
                    total[i] += entityMeans[i];
                }
            }
        }

        String label = String.join("+", byEntity.keySet());
        CanonicalSeries.Builder builder = CanonicalSeries.builder(label, target);
        Instant bucket = first;
        for (int i = 0; i < buckets; i++) {
            if (present[i]) {
                builder.add(bucket, total[i]);
            } else {
                builder.addMissing(bucket);
            }
            bucket = marketClock.nextBucket(bucket, target);
        }
        CanonicalSeries result = builder.build();
        log.debug("Unified {} series ({} entities) to {} {} buckets, {} missing",
                seriesSet.size(), byEntity.size(), buckets, target.getLabel(), result.missingCount());
        return result;
    }

    public CanonicalSeries unify(NativeSeries series, Cadence target, Instant start, Instant end) {
        return unify(List.of(series), target, start, end);
    }

    /**
     * First bucket start the output of {@link #unify} covers for this range.
     */
    public Instant alignedStart(Instant start, Cadence target) {
        return marketClock.floorToBucket(start, target);
    }

    private Double[] unifyEntity(List<NativeSeries> series, Cadence target, Instant first, int buckets) {
        List<NativeSeries> finestFirst = new ArrayList<>(series);
        finestFirst.sort(Comparator.comparingInt(s -> s.nativeCadence().getMinutes()));

        Double[] merged = new Double[buckets];
        for (NativeSeries s : finestFirst) {
            Double[] means = bucketMeans(s, target, first, buckets);
            for (int i = 0; i < buckets; i++) {
                if (merged[i] == null) {
                    merged[i] = means[i];
                }
            }
        }
        return merged;
    }

    private Double[] bucketMeans(NativeSeries series, Cadence target, Instant first, int buckets) {
        double[] sum = new double[buckets];
        int[] count = new int[buckets];
        long firstSecond = first.getEpochSecond();
        long width = target.getSeconds();

        for (IntervalRecord record : series.records()) {
            long offset = record.timestamp().getEpochSecond() - firstSecond;
            if (offset < 0) {
                continue;
            }
            long index = offset / width;
            if (index >= buckets) {
                continue;
            }
            sum[(int) index] += record.value();
            count[(int) index]++;
        }

        Double[] means = new Double[buckets];
        for (int i = 0; i < buckets; i++) {
            if (count[i] > 0) {
                means[i] = sum[i] / count[i];
            }
        }
        return means;
    }

    private static void checkCadence(NativeSeries series, Cadence target) {
        Cadence nativeCadence = series.nativeCadence();
        if (!nativeCadence.isFinerOrEqual(target) || !nativeCadence.divides(target)) {
            throw new ValidationException("targetCadence", String.format(
                    "Cannot unify %s at %s to %s: native cadence must be finer than or equal to target and divide it",
                    series.entityId(), nativeCadence.getLabel(), target.getLabel()));
        }
    }

    private static int bucketsBefore(Instant first, Instant end, Cadence target) {
        long span = end.getEpochSecond() - first.getEpochSecond();
        long count = (span + target.getSeconds() - 1) / target.getSeconds();
        if (count > Integer.MAX_VALUE) {
            throw new ValidationException("range", "Range too large for " + target.getLabel() + " buckets");
        }
        return (int) count;
    }
}
