package au.gridlens.domain.query;

import au.gridlens.domain.common.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SmoothingConfigTest {

    @Test
    void testExponentialAlpha() {
        assertEquals(2.0 / 31.0, SmoothingConfig.exponential(30).alpha(), 1e-15);
        assertEquals(1.0, SmoothingConfig.exponential(1).alpha(), 1e-15);
    }

    @Test
    void testExponentialSpanValidation() {
        assertThrows(ValidationException.class, () -> SmoothingConfig.exponential(0.5));
        assertThrows(ValidationException.class, () -> SmoothingConfig.exponential(2.5));
        assertThrows(ValidationException.class, () -> SmoothingConfig.exponential(Double.NaN));
        assertThrows(ValidationException.class,
                () -> new SmoothingConfig(SmoothingMethod.EXPONENTIAL, 30, 1));
    }

    @Test
    void testLoessFractionValidation() {
        assertEquals(1, SmoothingConfig.loess(0.3).degree());
        assertDoesNotThrow(() -> SmoothingConfig.loess(1.0, 2));
        assertThrows(ValidationException.class, () -> SmoothingConfig.loess(0.0));
        assertThrows(ValidationException.class, () -> SmoothingConfig.loess(1.01));
        assertThrows(ValidationException.class, () -> SmoothingConfig.loess(0.5, 3));
        assertThrows(IllegalStateException.class, () -> SmoothingConfig.loess(0.5).alpha());
    }

    @Test
    void testMethodParsing() {
        assertEquals(SmoothingMethod.EXPONENTIAL, SmoothingMethod.parse("ewm"));
        assertEquals(SmoothingMethod.LOESS, SmoothingMethod.parse("Lowess"));
        assertThrows(ValidationException.class, () -> SmoothingMethod.parse("kalman"));
    }

    @Test
    void testAnnualisationConfig() {
        assertEquals(24.0 * 365 / 1e6, AnnualisationConfig.twhPerYear(365).factor(), 1e-18);
        assertEquals(24.0 * 366 / 1e3, AnnualisationConfig.gwhPerYear(366).factor(), 1e-12);
        assertThrows(ValidationException.class, () -> new AnnualisationConfig(360, 1e6));
        assertThrows(ValidationException.class, () -> new AnnualisationConfig(365, 0));
        assertThrows(ValidationException.class, () -> new AnnualisationConfig(365, Double.POSITIVE_INFINITY));
    }
}
