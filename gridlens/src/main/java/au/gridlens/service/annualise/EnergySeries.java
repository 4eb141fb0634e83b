package au.gridlens.service.annualise;

import au.gridlens.domain.model.CanonicalSeries;
import au.gridlens.domain.model.SeriesPoint;
import au.gridlens.domain.query.AnnualisationConfig;
import au.gridlens.domain.query.SmoothingConfig;

import java.util.List;

/**
 * Implied annual energy derived from a smoothed power series.
 *
 * Deliberately not a {@link CanonicalSeries}: it cannot be fed back into smoothing.
 * Only {@link AnnualisationCalculator} creates instances.
 */
public final class EnergySeries {

    private final CanonicalSeries energy;
    private final SmoothingConfig smoothing;
    private final AnnualisationConfig annualisation;

    EnergySeries(CanonicalSeries energy, SmoothingConfig smoothing, AnnualisationConfig annualisation) {
        this.energy = energy;
        this.smoothing = smoothing;
        this.annualisation = annualisation;
    }

    public int size() {
        return energy.size();
    }

    public boolean isPresent(int index) {
        return energy.isPresent(index);
    }

    public double value(int index) {
        return energy.value(index);
    }

    public List<SeriesPoint> points() {
        return energy.points();
    }

    public String label() {
        return energy.label();
    }

    public SmoothingConfig smoothing() {
        return smoothing;
    }

    public AnnualisationConfig annualisation() {
        return annualisation;
    }

    @Override
    public String toString() {
        return "EnergySeries[" + energy.label() + ", " + smoothing.describe()
                + ", days=" + annualisation.referenceYearDays() + ", scale=" + annualisation.unitScale()
                + ", n=" + energy.size() + "]";
    }
}
