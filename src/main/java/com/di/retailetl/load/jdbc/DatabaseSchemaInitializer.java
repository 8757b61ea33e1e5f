package com.di.retailetl.load.jdbc;

import com.di.retailetl.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Creates the target and bookkeeping tables when they do not exist yet (MySQL dialect).
 */
@Slf4j
public class DatabaseSchemaInitializer {

    private final JdbcTemplate jdbc;
    private final String transactionsTable;

    public DatabaseSchemaInitializer(JdbcTemplate jdbc, String transactionsTable) {
        this.jdbc = jdbc;
        this.transactionsTable = InputValidator.validateTableName(transactionsTable);
    }

    public void createTablesIfAbsent() {
        List<String> statements = ddl();
        for (String statement : statements) {
            jdbc.execute(statement);
        }
        log.info("[DB-INIT] Ensured {} table(s) exist (target={})", statements.size(), transactionsTable);
    }

    List<String> ddl() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS products (
                    stock_code     VARCHAR(20) PRIMARY KEY,
                    description    VARCHAR(255),
                    category       VARCHAR(100),
                    schema_version VARCHAR(10)
                )""",
                """
                CREATE TABLE IF NOT EXISTS customers (
                    customer_id         VARCHAR(20) PRIMARY KEY,
                    country             VARCHAR(50),
                    first_purchase_date DATETIME,
                    last_purchase_date  DATETIME,
                    total_spent         DECIMAL(12,2),
                    total_transactions  INT,
                    schema_version      VARCHAR(10)
                )""",
                "CREATE TABLE IF NOT EXISTS " + transactionsTable + """
                 (
                    id              BIGINT AUTO_INCREMENT PRIMARY KEY,
                    invoice         VARCHAR(20),
                    line_no         INT,
                    invoice_date    DATETIME,
                    customer_id     VARCHAR(20),
                    stock_code      VARCHAR(20),
                    quantity        INT,
                    price           DECIMAL(10,2),
                    line_total      DECIMAL(12,2),
                    is_cancellation BOOLEAN,
                    country         VARCHAR(50),
                    schema_version  VARCHAR(10),
                    FOREIGN KEY (customer_id) REFERENCES customers(customer_id),
                    FOREIGN KEY (stock_code) REFERENCES products(stock_code),
                    INDEX (invoice_date),
                    INDEX (customer_id),
                    INDEX (stock_code)
                )""",
                """
                CREATE TABLE IF NOT EXISTS etl_watermarks (
                    table_name      VARCHAR(64) PRIMARY KEY,
                    last_invoice_id VARCHAR(20),
                    last_timestamp  DATETIME,
                    updated_at      TIMESTAMP
                )""",
                """
                CREATE TABLE IF NOT EXISTS etl_load_runs (
                    id                 VARCHAR(36) PRIMARY KEY,
                    target_table       VARCHAR(64),
                    load_mode          VARCHAR(16),
                    source             VARCHAR(512),
                    schema_version     VARCHAR(10),
                    status             VARCHAR(16),
                    raw_rows           INT,
                    cleaned_rows       INT,
                    rejected_rows      INT,
                    duplicates_dropped INT,
                    inserted_rows      INT,
                    skipped_rows       INT,
                    watermark_before   VARCHAR(64),
                    watermark_after    VARCHAR(64),
                    error_category     VARCHAR(64),
                    error_message      VARCHAR(2000),
                    started_at         TIMESTAMP,
                    completed_at       TIMESTAMP
                )""");
    }
}
