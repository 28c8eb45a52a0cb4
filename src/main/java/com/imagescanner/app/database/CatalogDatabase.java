package com.imagescanner.app.database;

import java.nio.file.Path;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagescanner.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Catálogo SQLite: pool HikariCP + Jdbi (SqlObject), schema via Flyway na abertura.
 * <p>
 * Uma instância por arquivo de banco; fechar libera o pool.
 */
public final class CatalogDatabase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CatalogDatabase.class);

    private final Path dbFile;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private CatalogDatabase(Path dbFile, HikariDataSource dataSource) {
        this.dbFile = dbFile;
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    /** Abre o catálogo padrão resolvido por {@link Config#getDbFilePath()}. */
    public static CatalogDatabase open() {
        return open(Config.getDbFilePath());
    }

    public static CatalogDatabase open(Path dbFile) {
        HikariDataSource ds = createDataSource(dbFile);
        try {
            migrate(ds);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        logger.info("Catálogo aberto: {}", dbFile.toAbsolutePath());
        return new CatalogDatabase(dbFile, ds);
    }

    private static HikariDataSource createDataSource(Path dbFile) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
        config.setPoolName("image-scanner-db");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(4);
        // WAL + synchronous NORMAL: leituras dos workers não bloqueiam o commit do lote
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
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
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    public Path dbFile() {
        return dbFile;
    }

    public JdbiCatalogStore catalogStore() {
        return new JdbiCatalogStore(jdbi);
    }

    public JdbiScanLog scanLog() {
        return new JdbiScanLog(jdbi);
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
