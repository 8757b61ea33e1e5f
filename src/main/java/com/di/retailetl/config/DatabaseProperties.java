package com.di.retailetl.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings bound from {@code retailetl.database.*}. Credentials come from environment
 * placeholders in {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "retailetl.database")
public class DatabaseProperties {

    private String jdbcUrl;
    private String username;
    @ToString.Exclude
    private String password;
    private String driverClassName = "com.mysql.cj.jdbc.Driver";
    private int maximumPoolSize = 4;
    private int minimumIdle = 1;
    private long idleTimeout = 300_000;
    private long connectionTimeout = 30_000;
    private long maxLifetime = 1_800_000;

    /** Names of required attributes that are missing or blank. */
    public List<String> getMissingAttributes() {
        List<String> missing = new ArrayList<>();
        if (jdbcUrl == null || jdbcUrl.isBlank()) missing.add("jdbcUrl");
        if (username == null || username.isBlank()) missing.add("username");
        if (password == null) missing.add("password");
        if (driverClassName == null || driverClassName.isBlank()) missing.add("driverClassName");
        return missing;
    }

    public DbConfigSnapshot toDbConfigSnapshot() {
        List<String> missing = getMissingAttributes();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("retailetl.database is missing required attribute(s): "
                    + String.join(", ", missing));
        }
        if (minimumIdle > maximumPoolSize) {
            throw new IllegalArgumentException("retailetl.database.minimum-idle (" + minimumIdle
                    + ") must not exceed maximum-pool-size (" + maximumPoolSize + ")");
        }
        return new DbConfigSnapshot(jdbcUrl.trim(), username.trim(), password, driverClassName.trim(),
                maximumPoolSize, minimumIdle, idleTimeout, connectionTimeout, maxLifetime);
    }
}
