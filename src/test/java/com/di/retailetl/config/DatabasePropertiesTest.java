package com.di.retailetl.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DatabaseProperties Tests")
class DatabasePropertiesTest {

    private DatabaseProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DatabaseProperties();
        properties.setJdbcUrl(" jdbc:mysql://localhost:3306/online_retail ");
        properties.setUsername("etl");
        properties.setPassword("s3cret");
    }

    @Test
    @DisplayName("Should build a snapshot with defaults for pool settings")
    void testToDbConfigSnapshot_Defaults() {
        DbConfigSnapshot snapshot = properties.toDbConfigSnapshot();

        assertEquals("jdbc:mysql://localhost:3306/online_retail", snapshot.jdbcUrl());
        assertEquals("etl", snapshot.username());
        assertEquals("s3cret", snapshot.password());
        assertEquals("com.mysql.cj.jdbc.Driver", snapshot.driverClassName());
        assertEquals(4, snapshot.maximumPoolSize());
        assertEquals(1, snapshot.minimumIdle());
        assertEquals(30_000L, snapshot.connectionTimeoutMs());
    }

    @Test
    @DisplayName("Should list every missing attribute")
    void testGetMissingAttributes() {
        DatabaseProperties empty = new DatabaseProperties();

        assertEquals(List.of("jdbcUrl", "username", "password"), empty.getMissingAttributes());
        assertTrue(properties.getMissingAttributes().isEmpty());
    }

    @Test
    @DisplayName("Should accept an empty password")
    void testGetMissingAttributes_EmptyPassword() {
        properties.setPassword("");

        assertTrue(properties.getMissingAttributes().isEmpty());
    }

    @Test
    @DisplayName("Should refuse to build a snapshot with missing attributes")
    void testToDbConfigSnapshot_Missing() {
        properties.setUsername(" ");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, properties::toDbConfigSnapshot);
        assertTrue(ex.getMessage().contains("username"));
    }

    @Test
    @DisplayName("Should refuse more idle connections than the pool holds")
    void testToDbConfigSnapshot_MinIdleAboveMax() {
        properties.setMaximumPoolSize(2);
        properties.setMinimumIdle(5);

        assertThrows(IllegalArgumentException.class, properties::toDbConfigSnapshot);
    }

    @Test
    @DisplayName("Should keep the password out of toString")
    void testToString_HidesPassword() {
        assertFalse(properties.toString().contains("s3cret"));
        assertFalse(properties.toDbConfigSnapshot().toString().contains("s3cret"));
        assertTrue(properties.toDbConfigSnapshot().toString().contains("online_retail"));
    }
}
