package au.gridlens.service.smoothing;

import au.gridlens.domain.model.CanonicalSeries;
import au.gridlens.domain.query.SmoothingConfig;

/**
 * Smoothed power series and the configuration that produced it.
 *
 * Only {@link SmoothingEngine} creates instances, so holding one proves the values went
 * through smoothing in the power domain.
 */
public final class SmoothedSeries {

    private final CanonicalSeries power;
    private final SmoothingConfig config;

    SmoothedSeries(CanonicalSeries power, SmoothingConfig config) {
        this.power = power;
        this.config = config;
    }

    public CanonicalSeries power() {
        return power;
    }

    public SmoothingConfig config() {
        return config;
    }

    public int size() {
        return power.size();
    }

    @Override
    public String toString() {
        return "SmoothedSeries[" + power.label() + ", " + config.describe() + ", n=" + power.size() + "]";
    }
}
