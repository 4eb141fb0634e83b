package au.gridlens.domain.query;

import au.gridlens.domain.common.ValidationException;

/**
 * Validated smoothing selection.
 *
 * EXPONENTIAL: param is the span S (S >= 1), alpha = 2 / (S + 1), degree is 0.
 * LOESS: param is the neighbourhood fraction f in (0, 1], degree is the local polynomial degree (0..2).
 */
public record SmoothingConfig(SmoothingMethod method, double param, int degree) {

    public static final int DEFAULT_LOESS_DEGREE = 1;

    public SmoothingConfig {
        if (method == null) {
            throw new ValidationException("smoothingMethod", "Smoothing method must not be null");
        }
        if (!Double.isFinite(param)) {
            throw new ValidationException("smoothingParam", "Smoothing parameter must be finite: " + param);
        }
        switch (method) {
            case EXPONENTIAL -> {
                if (param < 1.0) {
                    throw new ValidationException("smoothingParam",
                            "Exponential span must be >= 1 sample, got " + param);
                }
                if (param != Math.rint(param)) {
                    throw new ValidationException("smoothingParam",
                            "Exponential span must be a whole number of samples, got " + param);
                }
                if (degree != 0) {
                    throw new ValidationException("degree", "Exponential smoothing takes no degree, got " + degree);
                }
            }
            case LOESS -> {
                if (param <= 0.0 || param > 1.0) {
                    throw new ValidationException("smoothingParam",
                            "LOESS fraction must be in (0, 1], got " + param);
                }
                if (degree < 0 || degree > 2) {
                    throw new ValidationException("degree", "LOESS degree must be 0, 1 or 2, got " + degree);
                }
            }
        }
    }

    public static SmoothingConfig exponential(double span) {
        return new SmoothingConfig(SmoothingMethod.EXPONENTIAL, span, 0);
    }

    public static SmoothingConfig loess(double fraction) {
        return new SmoothingConfig(SmoothingMethod.LOESS, fraction, DEFAULT_LOESS_DEGREE);
    }

    public static SmoothingConfig loess(double fraction, int degree) {
        return new SmoothingConfig(SmoothingMethod.LOESS, fraction, degree);
    }

    /**
     * Config for a method/parameter pair with the method's default degree.
     */
    public static SmoothingConfig of(SmoothingMethod method, double param) {
        if (method == null) {
            throw new ValidationException("smoothingMethod", "Smoothing method must not be null");
        }
        return method == SmoothingMethod.EXPONENTIAL ? exponential(param) : loess(param);
    }

    /**
     * Decay constant of the exponential family.
     */
    public double alpha() {
        if (method != SmoothingMethod.EXPONENTIAL) {
            throw new IllegalStateException("alpha is only defined for exponential smoothing");
        }
        return 2.0 / (param + 1.0);
    }

    public String describe() {
        return method == SmoothingMethod.EXPONENTIAL
                ? String.format("EWM(span=%s)", param)
                : String.format("LOESS(frac=%s, degree=%d)", param, degree);
    }
}
