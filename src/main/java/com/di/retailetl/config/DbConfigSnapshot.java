package com.di.retailetl.config;

import java.io.Serializable;

/**
 * Immutable connection settings handed to the pool factory.
 */
public record DbConfigSnapshot(
        String jdbcUrl,
        String username,
        String password,
        String driverClassName,
        int maximumPoolSize,
        int minimumIdle,
        long idleTimeoutMs,
        long connectionTimeoutMs,
        long maxLifetimeMs
) implements Serializable {

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + jdbcUrl + ", username=" + username
                + ", driverClassName=" + driverClassName + ", maximumPoolSize=" + maximumPoolSize + "]";
    }
}
