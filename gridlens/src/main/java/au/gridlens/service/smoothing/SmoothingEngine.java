package au.gridlens.service.smoothing;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.CanonicalSeries;
import au.gridlens.domain.query.SmoothingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * Smoothing Engine - Exponential (causal) and LOESS (non-causal) smoothing of power series.
 *
 * Output has the input's timestamps and length. Pure: no shared state, safe to call
 * from any number of threads.
 */
public final class SmoothingEngine {
    private static final Logger log = LoggerFactory.getLogger(SmoothingEngine.class);

    /**
     * Series at least this long fit their LOESS points in parallel.
     */
    static final int PARALLEL_THRESHOLD = 2048;

    private static final double SINGULAR_PIVOT = 1e-12;

    /**
     * Smooth a unified power series.
     *
     * EXPONENTIAL keeps missing markers: a missing input yields a missing output, not the
     * previous smoothed value, and the recurrence resumes from the last present point.
     * LOESS fits every point, missing inputs included.
     *
     * @throws ValidationException if LOESS has fewer than 2 present points to fit
     */
    public SmoothedSeries smooth(CanonicalSeries power, SmoothingConfig config) {
        if (power == null) {
            throw new ValidationException("series", "Series must not be null");
        }
        if (config == null) {
            throw new ValidationException("smoothing", "Smoothing config must not be null");
        }
        CanonicalSeries smoothed = switch (config.method()) {
            case EXPONENTIAL -> exponential(power, config.alpha());
            case LOESS -> loess(power, config.param(), config.degree());
        };
        log.debug("Smoothed {} ({} points) with {}", power.label(), power.size(), config.describe());
        return new SmoothedSeries(smoothed, config);
    }

    /**
     * y[first present] = x[first present]; y = alpha * x + (1 - alpha) * y_prev.
     *
     * A missing input stays missing in the output and leaves the state untouched, so the
     * next present point decays from the last present one. Leading missing points stay missing.
     */
    CanonicalSeries exponential(CanonicalSeries x, double alpha) {
        CanonicalSeries.Builder out = x.deriveBuilder(x.label());
        boolean seeded = false;
        double state = 0.0;
        for (int t = 0; t < x.size(); t++) {
            if (!x.isPresent(t)) {
                out.addMissing(x.timestamp(t));
                continue;
            }
            state = seeded ? alpha * x.value(t) + (1.0 - alpha) * state : x.value(t);
            seeded = true;
            out.add(x.timestamp(t), state);
        }
        return out.build();
    }

    /**
     * Locally weighted regression over the k nearest present points, tri-cube weights.
     *
     * k = max(2, round(fraction * n)) capped at the number of present points. Missing inputs
     * are left out of every fit; every output point, missing input or not, gets a fitted value.
     */
    CanonicalSeries loess(CanonicalSeries x, double fraction, int degree) {
        int n = x.size();
        int[] presentIdx = IntStream.range(0, n).filter(x::isPresent).toArray();
        if (presentIdx.length < 2) {
            throw new ValidationException("series", String.format(
                    "LOESS needs at least 2 present points, %s has %d", x.label(), presentIdx.length));
        }

        double[] pos = new double[n];
        double[] val = new double[n];
        long t0 = x.timestamp(0).getEpochSecond();
        double unit = x.cadence().getSeconds();
        for (int i = 0; i < n; i++) {
            pos[i] = (x.timestamp(i).getEpochSecond() - t0) / unit;
            val[i] = x.isPresent(i) ? x.value(i) : 0.0;
        }

        int k = Math.min(Math.max(2, (int) Math.round(fraction * n)), presentIdx.length);
        double[] fitted = new double[n];
        IntStream indices = IntStream.range(0, n);
        if (n >= PARALLEL_THRESHOLD) {
            indices = indices.parallel();
        }
        indices.forEach(i -> fitted[i] = fitAt(i, pos, val, presentIdx, k, degree));

        CanonicalSeries.Builder out = x.deriveBuilder(x.label());
        for (int i = 0; i < n; i++) {
            out.add(x.timestamp(i), fitted[i]);
        }
        return out.build();
    }

    private static double fitAt(int i, double[] pos, double[] val, int[] presentIdx, int k, int degree) {
        double center = pos[i];
        int[] neighbours = nearest(center, pos, presentIdx, k);

        double dmax = 0.0;
        for (int j : neighbours) {
            dmax = Math.max(dmax, Math.abs(pos[j] - center));
        }

        int m = neighbours.length;
        double[] xs = new double[m];
        double[] ys = new double[m];
        double[] ws = new double[m];
        for (int a = 0; a < m; a++) {
            int j = neighbours[a];
            double d = pos[j] - center;
            xs[a] = dmax > 0 ? d / dmax : 0.0;
            ys[a] = val[j];
            ws[a] = dmax > 0 ? tricube(Math.abs(d) / dmax) : 1.0;
        }

        for (int p = degree; p >= 0; p--) {
            double[] coefficients = weightedLeastSquares(xs, ys, ws, p);
            if (coefficients != null) {
                return coefficients[0];
            }
        }
        // Degree 0 only fails when every weight is zero
        double sum = 0.0;
        for (double y : ys) {
            sum += y;
        }
        return sum / m;
    }

    /**
     * The k present indices closest in time to {@code center}, expanding outwards from it.
     */
    private static int[] nearest(double center, double[] pos, int[] presentIdx, int k) {
        int right = lowerBound(presentIdx, pos, center);
        int left = right - 1;
        int[] chosen = new int[k];
        for (int c = 0; c < k; c++) {
            boolean takeLeft;
            if (left < 0) {
                takeLeft = false;
            } else if (right >= presentIdx.length) {
                takeLeft = true;
            } else {
                takeLeft = center - pos[presentIdx[left]] <= pos[presentIdx[right]] - center;
            }
            chosen[c] = takeLeft ? presentIdx[left--] : presentIdx[right++];
        }
        return chosen;
    }

    private static int lowerBound(int[] presentIdx, double[] pos, double target) {
        int lo = 0;
        int hi = presentIdx.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (pos[presentIdx[mid]] < target) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    static double tricube(double u) {
        if (u >= 1.0) {
            return 0.0;
        }
        double c = 1.0 - u * u * u;
        return c * c * c;
    }

    /**
     * Solves the normal equations of a weighted polynomial fit.
     *
     * @return coefficients, lowest order first, or null when the system is singular
     */
    static double[] weightedLeastSquares(double[] xs, double[] ys, double[] ws, int degree) {
        int size = degree + 1;
        double[][] a = new double[size][size + 1];
        for (int r = 0; r < xs.length; r++) {
            double w = ws[r];
            if (w == 0.0) {
                continue;
            }
            double[] powers = new double[2 * size - 1];
            powers[0] = 1.0;
            for (int p = 1; p < powers.length; p++) {
                powers[p] = powers[p - 1] * xs[r];
            }
            for (int row = 0; row < size; row++) {
                for (int col = 0; col < size; col++) {
                    a[row][col] += w * powers[row + col];
                }
                a[row][size] += w * powers[row] * ys[r];
            }
        }
        return solve(a, size);
    }

    private static double[] solve(double[][] a, int size) {
        for (int col = 0; col < size; col++) {
            int pivot = col;
            for (int row = col + 1; row < size; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < SINGULAR_PIVOT) {
                return null;
            }
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;
            for (int row = col + 1; row < size; row++) {
                double factor = a[row][col] / a[col][col];
                for (int c = col; c <= size; c++) {
                    a[row][c] -= factor * a[col][c];
                }
            }
        }
        double[] solution = new double[size];
        for (int row = size - 1; row >= 0; row--) {
            double sum = a[row][size];
            for (int c = row + 1; c < size; c++) {
                sum -= a[row][c] * solution[c];
            }
            solution[row] = sum / a[row][row];
        }
        return solution;
    }
}
