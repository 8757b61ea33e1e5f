package com.di.retailetl.load.metadata;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoadRunRepository Tests")
class LoadRunRepositoryTest {

    private final List<String> statements = new ArrayList<>();
    private final List<List<Object>> arguments = new ArrayList<>();

    private final LoadRunRepository repository = new LoadRunRepository(new JdbcTemplate() {
        @Override
        public int update(String sql, Object... args) {
            statements.add(sql);
            arguments.add(Arrays.asList(args));
            return 1;
        }
    });

    @Test
    @DisplayName("Should insert a STARTED run")
    void testInsert() {
        repository.insert(LoadRun.builder()
                .id("run-1")
                .targetTable("transactions")
                .loadMode("INCREMENTAL")
                .source("data/online_retail.csv")
                .schemaVersion("1.0")
                .rawRows(3)
                .cleanedRows(2)
                .rejectedRows(0)
                .duplicatesDropped(1)
                .build());

        assertTrue(statements.get(0).contains("INSERT INTO etl_load_runs"));
        List<Object> args = arguments.get(0);
        assertEquals("run-1", args.get(0));
        assertEquals(LoadRun.STATUS_STARTED, args.get(5));
        assertEquals(3, args.get(6));
        assertNull(args.get(10));
    }

    @Test
    @DisplayName("Should mark a run committed with its counts and watermark")
    void testMarkCommitted() {
        repository.markCommitted("run-1", 2, 1, "2010-12-01T09:02:00|C1002");

        assertTrue(statements.get(0).contains("'COMMITTED'"));
        assertEquals(List.of(2, 1, "2010-12-01T09:02:00|C1002", "run-1"), arguments.get(0));
    }

    @Test
    @DisplayName("Should truncate long error messages on failure")
    void testMarkFailed() {
        repository.markFailed("run-1", "CONNECTION_ERROR", "x".repeat(5000));

        assertTrue(statements.get(0).contains("'FAILED'"));
        assertEquals("CONNECTION_ERROR", arguments.get(0).get(0));
        assertEquals(2000, ((String) arguments.get(0).get(1)).length());
    }

    @Test
    @DisplayName("Should keep short and null messages as they are")
    void testTruncate() {
        assertEquals("boom", LoadRunRepository.truncate("boom"));
        assertNull(LoadRunRepository.truncate(null));
    }
}
