package au.gridlens.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pooled DataSource over an embedded DuckDB database file.
 */
public final class DuckDbDataSources {
    private static final Logger log = LoggerFactory.getLogger(DuckDbDataSources.class);

    /**
     * Create a pooled DataSource for the given database file, creating parent directories.
     *
     * One connection: DuckDB serializes writers in-process anyway, and a single pooled
     * connection keeps every caller on the same database instance.
     */
    public static HikariDataSource create(String databasePath) {
        Path path = Path.of(databasePath).toAbsolutePath();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create directory for DuckDB file " + path, e);
        }

        HikariConfig config = new HikariConfig();
        config.setDriverClassName("org.duckdb.DuckDBDriver");
        config.setJdbcUrl("jdbc:duckdb:" + path);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30_000);
        config.setPoolName("gridlens-duckdb");

        log.info("Opening DuckDB raw store at {}", path);
        return new HikariDataSource(config);
    }

    private DuckDbDataSources() {}
}
