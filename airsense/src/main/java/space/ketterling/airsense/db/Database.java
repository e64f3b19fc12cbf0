package space.ketterling.airsense.db;

import space.ketterling.airsense.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds the connection pool shared by history reads and prediction writes.
     */
    public static HikariDataSource createDataSource(AppConfig cfg) {
        if (!cfg.databaseEnabled())
            throw new IllegalStateException("DB_JDBC_URL is not configured");
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("airsense-db");
        hc.setMaximumPoolSize(Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
