package com.devicesync.common.jdbc;

import com.devicesync.common.config.SyncConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.time.Duration;

/**
 * Builds the connection pool from {@code db.*} configuration keys.
 */
public final class DataSources {

    private DataSources() {}

    public static HikariDataSource create(SyncConfig config, String poolName) {
        var hikari = new HikariConfig();
        hikari.setPoolName(poolName);
        hikari.setJdbcUrl(config.require("db.url"));
        hikari.setUsername(config.get("db.username", null));
        hikari.setPassword(config.get("db.password", null));
        hikari.setMaximumPoolSize(config.getInt("db.pool-size", 10));
        hikari.setConnectionTimeout(config.getDuration("db.connection-timeout", Duration.ofSeconds(5)).toMillis());
        hikari.setIdleTimeout(30_000);
        return new HikariDataSource(hikari);
    }
}
