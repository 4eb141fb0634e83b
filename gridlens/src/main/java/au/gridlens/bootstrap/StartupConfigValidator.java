package au.gridlens.bootstrap;

import au.gridlens.config.GridLensConfig;
import au.gridlens.config.StorageMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException listing every problem found,
 * and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(GridLensConfig config) {
        log.info("Running startup config validation...");
        List<String> problems = new ArrayList<>();

        if (config.port() <= 0 || config.port() > 65535) {
            problems.add("GRIDLENS_PORT must be 1-65535, got " + config.port());
        }
        if (config.storageMode() == StorageMode.LAZY && !config.hasDiskStore()) {
            problems.add("GRIDLENS_STORAGE_MODE=LAZY requires GRIDLENS_DUCKDB_PATH (lazy slices are read from disk)");
        }
        if (config.cacheTtl().isNegative() || config.cacheTtl().isZero()) {
            problems.add("GRIDLENS_CACHE_TTL_SECONDS must be positive, got " + config.cacheTtl().toSeconds());
        }
        if (config.cacheMaxEntries() <= 0) {
            problems.add("GRIDLENS_CACHE_MAX_ENTRIES must be positive, got " + config.cacheMaxEntries());
        }
        if (config.archiveConcurrency() <= 0) {
            problems.add("GRIDLENS_ARCHIVE_CONCURRENCY must be positive, got " + config.archiveConcurrency());
        }
        if (config.fetchTimeout().isNegative() || config.fetchTimeout().isZero()) {
            problems.add("GRIDLENS_FETCH_TIMEOUT_MS must be positive, got " + config.fetchTimeout().toMillis());
        }
        if (config.fetchMaxAttempts() <= 0) {
            problems.add("GRIDLENS_FETCH_MAX_ATTEMPTS must be positive, got " + config.fetchMaxAttempts());
        }
        if (config.fetchInitialBackoff().isNegative() || config.fetchInitialBackoff().isZero()) {
            problems.add("GRIDLENS_FETCH_INITIAL_BACKOFF_MS must be positive, got " + config.fetchInitialBackoff().toMillis());
        }
        if (config.catalogFile() == null || config.catalogFile().isBlank()) {
            problems.add("GRIDLENS_CATALOG_FILE must not be blank");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG - system refuses to start:\n  " + String.join("\n  ", problems));
        }
        log.info("Startup config validation passed: {}", config.summary());
    }
}
