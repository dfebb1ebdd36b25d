package com.diskwatcher.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Owns the SQLite file: connection pool, schema migrations and the JDBI handle factory.
 * One instance per process, passed to whoever needs it.
 */
public final class CatalogDatabase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CatalogDatabase.class);

    private static final int POOL_SIZE = 8;
    // short driver-level wait; BusyRetry does the backoff above it
    private static final int BUSY_TIMEOUT_MS = 1000;

    private final Path dbFile;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private CatalogDatabase(Path dbFile, HikariDataSource dataSource, Jdbi jdbi) {
        this.dbFile = dbFile;
        this.dataSource = dataSource;
        this.jdbi = jdbi;
    }

    /** Opens (creating if needed) the catalog at {@code dbFile} and migrates it to the latest schema. */
    public static CatalogDatabase open(Path dbFile) {
        Path file = dbFile.toAbsolutePath().normalize();
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CatalogException("Cannot create catalog directory for " + file, e);
        }

        HikariDataSource ds = createDataSource(file);
        try {
            migrate(ds);
            Jdbi jdbi = Jdbi.create(ds);
            jdbi.installPlugin(new SqlObjectPlugin());
            logger.info("catalog opened path={}", file);
            return new CatalogDatabase(file, ds, jdbi);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
    }

    private static HikariDataSource createDataSource(Path file) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + file);
        config.setPoolName("diskwatcher-catalog");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(POOL_SIZE);
        // sqlite-jdbc reads pragmas from connection properties
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MS));
        return new HikariDataSource(config);
    }

    private static void migrate(HikariDataSource ds) {
        Flyway flyway = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new CatalogException("Flyway migration failed", e);
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    public Path file() {
        return dbFile;
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.debug("catalog closed path={}", dbFile);
        }
    }
}
