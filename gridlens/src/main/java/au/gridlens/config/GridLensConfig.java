package au.gridlens.config;

import au.gridlens.util.Env;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Deployment configuration, read once at startup.
 */
public record GridLensConfig(
        int port,
        StorageMode storageMode,
        String duckDbPath,
        ZoneOffset marketOffset,
        Duration cacheTtl,
        int cacheMaxEntries,
        int archiveConcurrency,
        Duration fetchTimeout,
        int fetchMaxAttempts,
        Duration fetchInitialBackoff,
        String catalogFile,
        String archiveDir,
        LocalTime integrityExportTime) {

    public static GridLensConfig fromEnv() {
        return new GridLensConfig(
                Env.getInt("GRIDLENS_PORT", 9190),
                Env.getEnum("GRIDLENS_STORAGE_MODE", StorageMode.class, StorageMode.EAGER),
                Env.get("GRIDLENS_DUCKDB_PATH", "data/gridlens.duckdb"),
                ZoneOffset.of(Env.get("GRIDLENS_MARKET_OFFSET", "+10:00")),
                Duration.ofSeconds(Env.getLong("GRIDLENS_CACHE_TTL_SECONDS", 300)),
                Env.getInt("GRIDLENS_CACHE_MAX_ENTRIES", 256),
                Env.getInt("GRIDLENS_ARCHIVE_CONCURRENCY", 4),
                Duration.ofMillis(Env.getLong("GRIDLENS_FETCH_TIMEOUT_MS", 60_000)),
                Env.getInt("GRIDLENS_FETCH_MAX_ATTEMPTS", 4),
                Duration.ofMillis(Env.getLong("GRIDLENS_FETCH_INITIAL_BACKOFF_MS", 1_000)),
                Env.get("GRIDLENS_CATALOG_FILE", "classpath:catalog.json"),
                Env.get("GRIDLENS_ARCHIVE_DIR", "archive"),
                LocalTime.parse(Env.get("GRIDLENS_INTEGRITY_EXPORT_TIME", "06:00")));
    }

    /**
     * True when the Raw Store lives in a DuckDB file rather than in process memory.
     */
    public boolean hasDiskStore() {
        return duckDbPath != null && !duckDbPath.isBlank();
    }

    public String summary() {
        return String.format(
                "port=%d, storage=%s, duckdb=%s, offset=%s, cacheTtl=%s, cacheMax=%d, archiveConcurrency=%d, "
                        + "fetchTimeout=%s, fetchAttempts=%d, catalog=%s, archiveDir=%s",
                port, storageMode, hasDiskStore() ? duckDbPath : "<memory>", marketOffset, cacheTtl,
                cacheMaxEntries, archiveConcurrency, fetchTimeout, fetchMaxAttempts, catalogFile, archiveDir);
    }
}
