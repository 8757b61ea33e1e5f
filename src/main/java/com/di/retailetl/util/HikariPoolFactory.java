package com.di.retailetl.util;

import com.di.retailetl.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the HikariCP pool from a {@link DbConfigSnapshot}.
 */
@Slf4j
public final class HikariPoolFactory {

    private HikariPoolFactory() {}

    public static HikariDataSource create(DbConfigSnapshot snapshot) {
        int poolSize = InputValidator.validatePoolSize(snapshot.maximumPoolSize());
        int minIdle = Math.min(snapshot.minimumIdle(), poolSize);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
        hikariConfig.setUsername(snapshot.username());
        hikariConfig.setPassword(snapshot.password());
        hikariConfig.setDriverClassName(snapshot.driverClassName());
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(minIdle);
        hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
        hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
        hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());

        // run bookkeeping commits on its own; the load itself runs in a TransactionTemplate
        hikariConfig.setAutoCommit(true);
        // clean-only runs never open a connection
        hikariConfig.setInitializationFailTimeout(-1);
        hikariConfig.setPoolName("RetailEtlPool-" + shortKey(snapshot));

        log.info("[POOL] Creating | url={} | user={} | maxPoolSize={}, minIdle={}",
                sanitizeUrl(snapshot.jdbcUrl()), snapshot.username(), poolSize, minIdle);
        return new HikariDataSource(hikariConfig);
    }

    /** host_database_user, without credentials. */
    static String shortKey(DbConfigSnapshot snapshot) {
        String url = sanitizeUrl(snapshot.jdbcUrl());
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        String part = url;
        int slashSlash = url.indexOf("//");
        if (slashSlash >= 0) {
            part = url.substring(slashSlash + 2);
        }
        int slashDb = part.indexOf('/');
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    static String sanitizeUrl(String url) {
        return url == null ? "" : url.replaceAll("password=[^;&]+", "password=***");
    }
}
