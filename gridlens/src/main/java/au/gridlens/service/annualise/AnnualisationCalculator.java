package au.gridlens.service.annualise;

import au.gridlens.domain.common.ValidationException;
import au.gridlens.domain.model.CanonicalSeries;
import au.gridlens.domain.query.AnnualisationConfig;
import au.gridlens.service.smoothing.SmoothedSeries;

/**
 * Annualisation Calculator - Smoothed power to implied annual energy.
 *
 * energy = power * 24 * referenceYearDays / unitScale. With MW in and a scale of 1e6,
 * the result is TWh per year. Missing points stay missing.
 */
public final class AnnualisationCalculator {

    public EnergySeries annualise(SmoothedSeries power, AnnualisationConfig config) {
        if (power == null) {
            throw new ValidationException("series", "Smoothed series must not be null");
        }
        if (config == null) {
            throw new ValidationException("annualisation", "Annualisation config must not be null");
        }
        double factor = config.factor();
        CanonicalSeries source = power.power();
        CanonicalSeries.Builder out = source.deriveBuilder(source.label());
        for (int i = 0; i < source.size(); i++) {
            if (source.isPresent(i)) {
                out.add(source.timestamp(i), source.value(i) * factor);
            } else {
                out.addMissing(source.timestamp(i));
            }
        }
        return new EnergySeries(out.build(), power.config(), config);
    }
}
