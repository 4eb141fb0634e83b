package au.gridlens.domain.model;

import au.gridlens.domain.common.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Gap-explicit, duplicate-free, single-cadence series.
 *
 * Timestamps are strictly increasing. A missing point carries no value; it is never
 * represented as zero.
 */
public final class CanonicalSeries {

    private final String label;
    private final Cadence cadence;
    private final Instant[] timestamps;
    private final double[] values;
    private final boolean[] present;

    private CanonicalSeries(String label, Cadence cadence, Instant[] timestamps, double[] values, boolean[] present) {
        this.label = label;
        this.cadence = cadence;
        this.timestamps = timestamps;
        this.values = values;
        this.present = present;
    }

    public static Builder builder(String label, Cadence cadence) {
        return new Builder(label, cadence);
    }

    public static CanonicalSeries empty(String label, Cadence cadence) {
        return new CanonicalSeries(label, cadence, new Instant[0], new double[0], new boolean[0]);
    }

    public String label() {
        return label;
    }

    public Cadence cadence() {
        return cadence;
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public Instant timestamp(int index) {
        return timestamps[index];
    }

    public boolean isPresent(int index) {
        return present[index];
    }

    /**
     * Value at index.
     *
     * @throws IllegalStateException if the point is a missing marker
     */
    public double value(int index) {
        if (!present[index]) {
            throw new IllegalStateException(
                    String.format("%s has no value at %s (missing)", label, timestamps[index]));
        }
        return values[index];
    }

    public int missingCount() {
        int missing = 0;
        for (boolean p : present) {
            if (!p) {
                missing++;
            }
        }
        return missing;
    }

    /**
     * Coverage of the whole series: complete when nothing is missing.
     */
    public CoverageStatus coverage() {
        if (isEmpty()) {
            return CoverageStatus.MISSING;
        }
        int missing = missingCount();
        if (missing == 0) {
            return CoverageStatus.COMPLETE;
        }
        return missing == size() ? CoverageStatus.MISSING : CoverageStatus.PARTIAL;
    }

    public List<SeriesPoint> points() {
        List<SeriesPoint> points = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            points.add(present[i] ? SeriesPoint.present(timestamps[i], values[i]) : SeriesPoint.missing(timestamps[i]));
        }
        return points;
    }

    /**
     * Empty builder with this series' cadence and a new label. Callers add one point per input timestamp.
     */
    public Builder deriveBuilder(String newLabel) {
        return new Builder(newLabel, cadence);
    }

    @Override
    public String toString() {
        return String.format("CanonicalSeries[%s, %s, %d points, %d missing]",
                label, cadence.getLabel(), size(), missingCount());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CanonicalSeries other)) {
            return false;
        }
        return label.equals(other.label)
                && cadence == other.cadence
                && Arrays.equals(timestamps, other.timestamps)
                && Arrays.equals(values, other.values)
                && Arrays.equals(present, other.present);
    }

    @Override
    public int hashCode() {
        int result = label.hashCode();
        result = 31 * result + cadence.hashCode();
        result = 31 * result + Arrays.hashCode(timestamps);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    /**
     * Appends points in timestamp order.
     */
    public static final class Builder {
        private final String label;
        private final Cadence cadence;
        private final List<Instant> timestamps = new ArrayList<>();
        private double[] values = new double[64];
        private boolean[] present = new boolean[64];

        private Builder(String label, Cadence cadence) {
            if (label == null || label.isBlank()) {
                throw new ValidationException("label", "Series label must not be blank");
            }
            if (cadence == null) {
                throw new ValidationException("cadence", "Series cadence must not be null");
            }
            this.label = label;
            this.cadence = cadence;
        }

        public Builder add(Instant timestamp, double value) {
            if (!Double.isFinite(value)) {
                throw new ValidationException("value",
                        String.format("Non-finite value for %s @ %s; use addMissing for gaps", label, timestamp));
            }
            append(timestamp, value, true);
            return this;
        }

        public Builder addMissing(Instant timestamp) {
            append(timestamp, 0.0, false);
            return this;
        }

        private void append(Instant timestamp, double value, boolean isPresent) {
            if (timestamp == null) {
                throw new ValidationException("timestamp", "Timestamp must not be null in " + label);
            }
            if (!timestamps.isEmpty() && !timestamp.isAfter(timestamps.get(timestamps.size() - 1))) {
                throw new ValidationException("timestamp", String.format(
                        "Timestamps must be strictly increasing in %s: %s after %s",
                        label, timestamp, timestamps.get(timestamps.size() - 1)));
            }
            int index = timestamps.size();
            if (index == values.length) {
                values = Arrays.copyOf(values, index * 2);
                present = Arrays.copyOf(present, index * 2);
            }
            timestamps.add(timestamp);
            values[index] = value;
            present[index] = isPresent;
        }

        public CanonicalSeries build() {
            int n = timestamps.size();
            return new CanonicalSeries(label, cadence,
                    timestamps.toArray(new Instant[0]),
                    Arrays.copyOf(values, n),
                    Arrays.copyOf(present, n));
        }
    }
}
