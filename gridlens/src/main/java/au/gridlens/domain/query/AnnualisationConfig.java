package au.gridlens.domain.query;

import au.gridlens.domain.common.ValidationException;

/**
 * Annualisation constants: energy = power x 24 x referenceYearDays / unitScale.
 *
 * Both values are always explicit so leap years (366) and unit factors (1e6 for MW to TWh)
 * are chosen by the caller.
 */
public record AnnualisationConfig(int referenceYearDays, double unitScale) {

    public static final double MW_TO_TWH = 1_000_000.0;
    public static final double MW_TO_GWH = 1_000.0;

    public AnnualisationConfig {
        if (referenceYearDays != 365 && referenceYearDays != 366) {
            throw new ValidationException("referenceYearDays",
                    "Reference year must be 365 or 366 days, got " + referenceYearDays);
        }
        if (!Double.isFinite(unitScale) || unitScale <= 0.0) {
            throw new ValidationException("unitScale", "Unit scale must be positive and finite, got " + unitScale);
        }
    }

    public static AnnualisationConfig twhPerYear(int referenceYearDays) {
        return new AnnualisationConfig(referenceYearDays, MW_TO_TWH);
    }

    public static AnnualisationConfig gwhPerYear(int referenceYearDays) {
        return new AnnualisationConfig(referenceYearDays, MW_TO_GWH);
    }

    /**
     * Multiplier applied to a power value.
     */
    public double factor() {
        return 24.0 * referenceYearDays / unitScale;
    }
}
