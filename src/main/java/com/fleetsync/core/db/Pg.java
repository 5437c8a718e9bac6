package com.fleetsync.core.db;

import com.fleetsync.app.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Пул соединений к Postgres и миграции схемы. Один на процесс.
 */
public final class Pg {
    private static final Logger log = LoggerFactory.getLogger(Pg.class);
    private static HikariDataSource ds;

    private Pg(){}

    public static synchronized void init() {
        init(Config.load().db());
    }

    public static synchronized void init(Config.Db db) {
        if (ds != null) return;
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(db.url());
        hc.setUsername(db.user());
        hc.setPassword(db.pass());
        hc.setMaximumPoolSize(Math.max(2, db.poolSize()));
        hc.setMinimumIdle(1);
        hc.setPoolName("fs-pool");
        // быстрые таймауты и health-check
        hc.setConnectionTimeout(5000);
        hc.setValidationTimeout(3000);
        hc.setIdleTimeout(300000);
        hc.setMaxLifetime(1800000);
        hc.setConnectionTestQuery("SELECT 1");
        ds = new HikariDataSource(hc);
        log.info("Pg: pool started url={}", db.url());

        // Flyway migrations (classpath:db/migration)
        Flyway fw = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .load();
        fw.migrate();
        log.info("Pg: flyway migrate done");
    }

    public static Connection get() throws SQLException {
        if (ds == null) init();
        return ds.getConnection();
    }

    public static synchronized void close() {
        if (ds != null) {
            ds.close();
            ds = null;
            log.info("Pg: pool closed");
        }
    }

    static Timestamp ts(Instant t) {
        return t == null ? null : Timestamp.from(t);
    }

    static Instant instant(Timestamp t) {
        return t == null ? null : t.toInstant();
    }
}
