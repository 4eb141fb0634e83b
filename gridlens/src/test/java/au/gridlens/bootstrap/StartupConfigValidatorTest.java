package au.gridlens.bootstrap;

import au.gridlens.config.GridLensConfig;
import au.gridlens.config.StorageMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    private static GridLensConfig config(int port, StorageMode mode, String duckDbPath, Duration ttl, int concurrency) {
        return new GridLensConfig(port, mode, duckDbPath, ZoneOffset.ofHours(10), ttl, 256, concurrency,
                Duration.ofSeconds(60), 4, Duration.ofSeconds(1), "classpath:catalog.json", "archive",
                LocalTime.of(6, 0));
    }

    @Test
    void testValidConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(
                config(9190, StorageMode.LAZY, "data/gridlens.duckdb", Duration.ofMinutes(5), 4)));
        assertDoesNotThrow(() -> StartupConfigValidator.validate(
                config(9190, StorageMode.EAGER, "", Duration.ofMinutes(5), 4)));
    }

    @Test
    void testLazyWithoutDiskStoreRejected() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
                config(9190, StorageMode.LAZY, " ", Duration.ofMinutes(5), 4)));
        assertTrue(e.getMessage().contains("LAZY"));
    }

    @Test
    void testEveryProblemReported() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> StartupConfigValidator.validate(
                config(70000, StorageMode.EAGER, "", Duration.ZERO, 0)));
        assertTrue(e.getMessage().contains("GRIDLENS_PORT"));
        assertTrue(e.getMessage().contains("GRIDLENS_CACHE_TTL_SECONDS"));
        assertTrue(e.getMessage().contains("GRIDLENS_ARCHIVE_CONCURRENCY"));
    }

    @Test
    void testDefaultsFromEnvironmentAreValid() {
        GridLensConfig defaults = GridLensConfig.fromEnv();
        assertTrue(defaults.summary().contains("port="));
    }
}
