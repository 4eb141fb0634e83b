package au.gridlens.domain.query;

import au.gridlens.domain.common.ValidationException;

/**
 * Smoothing families.
 */
public enum SmoothingMethod {
    /**
     * Exponentially weighted moving average. Parameter: span in samples. Causal.
     */
    EXPONENTIAL,

    /**
     * Locally weighted regression. Parameter: neighbourhood fraction of the series. Non-causal.
     */
    LOESS;

    public static SmoothingMethod parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("smoothingMethod", "Smoothing method must not be blank");
        }
        String normalized = text.trim().toUpperCase();
        switch (normalized) {
            case "EWM":
            case "EMA":
            case "EXPONENTIAL":
                return EXPONENTIAL;
            case "LOWESS":
            case "LOESS":
                return LOESS;
            default:
                throw new ValidationException("smoothingMethod", "Unknown smoothing method: " + text);
        }
    }
}
