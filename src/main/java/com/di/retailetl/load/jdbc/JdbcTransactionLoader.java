package com.di.retailetl.load.jdbc;

import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.load.TransactionLoader;
import com.di.retailetl.load.plan.LoadMode;
import com.di.retailetl.load.plan.LoadPlan;
import com.di.retailetl.model.Row;
import com.di.retailetl.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a {@link LoadPlan} to MySQL.
 *
 * <p>Customers and products are aggregated from the plan and upserted first, then the
 * transaction rows are batch-inserted. A FULL plan clears the three tables beforehand.
 * Callers provide the surrounding transaction.
 */
@Slf4j
public class JdbcTransactionLoader implements TransactionLoader {

    static final String UPSERT_CUSTOMER = """
            INSERT INTO customers
              (customer_id, country, first_purchase_date, last_purchase_date,
               total_spent, total_transactions, schema_version)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON DUPLICATE KEY UPDATE
              country = VALUES(country),
              last_purchase_date = VALUES(last_purchase_date),
              total_spent = total_spent + VALUES(total_spent),
              total_transactions = total_transactions + VALUES(total_transactions)
            """;

    static final String UPSERT_PRODUCT = """
            INSERT INTO products (stock_code, description, category, schema_version)
            VALUES (?, ?, ?, ?)
            ON DUPLICATE KEY UPDATE
              description = VALUES(description),
              category = VALUES(category)
            """;

    static final String DEFAULT_CATEGORY = "OTHER";
    private static final Pattern CATEGORY = Pattern.compile("([A-Z]+)");

    private final JdbcTemplate jdbc;
    private final CleaningRules rules;
    private final String transactionsTable;

    public JdbcTransactionLoader(JdbcTemplate jdbc, CleaningRules rules, String transactionsTable) {
        this.jdbc = jdbc;
        this.rules = rules;
        this.transactionsTable = InputValidator.validateTableName(transactionsTable);
    }

    @Override
    public int load(LoadPlan plan, String schemaVersion) {
        if (plan.mode() == LoadMode.FULL) {
            jdbc.update("DELETE FROM " + transactionsTable);
            jdbc.update("DELETE FROM customers");
            jdbc.update("DELETE FROM products");
            log.info("[LOAD] Full refresh: cleared {}, customers and products", transactionsTable);
        }
        if (plan.isEmpty()) {
            log.info("[LOAD] Nothing to insert into {}", transactionsTable);
            return 0;
        }

        List<Object[]> customers = customerRows(plan.toInsert(), schemaVersion);
        List<Object[]> products = productRows(plan.toInsert(), schemaVersion);
        List<Object[]> transactions = new ArrayList<>(plan.toInsert().size());
        for (Row row : plan.toInsert()) {
            transactions.add(transactionRow(row, schemaVersion));
        }

        jdbc.batchUpdate(UPSERT_CUSTOMER, customers);
        jdbc.batchUpdate(UPSERT_PRODUCT, products);
        jdbc.batchUpdate(insertTransactionSql(), transactions);
        log.info("[LOAD] Loaded {} transaction(s), {} customer(s), {} product(s) into {} (schema {})",
                transactions.size(), customers.size(), products.size(), transactionsTable, schemaVersion);
        return transactions.size();
    }

    String insertTransactionSql() {
        return "INSERT INTO " + transactionsTable + """
                 (invoice, line_no, invoice_date, customer_id, stock_code,
                  quantity, price, line_total, is_cancellation, country, schema_version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    private Object[] transactionRow(Row row, String schemaVersion) {
        return new Object[] {
                row.get(rules.getInvoiceColumn()),
                row.get("line_no"),
                timestamp(row.get(rules.getTimestampColumn())),
                row.get(rules.getCustomerColumn()),
                row.get(rules.getStockCodeColumn()),
                row.get(rules.getQuantityColumn()),
                row.get(rules.getPriceColumn()),
                row.get(CleaningRules.LINE_TOTAL),
                row.get(CleaningRules.IS_CANCELLATION),
                row.get(rules.getCountryColumn()),
                schemaVersion
        };
    }

    /** One row per customer: first country, first/last purchase, summed line totals, distinct invoices. */
    List<Object[]> customerRows(List<Row> rows, String schemaVersion) {
        Map<Object, CustomerAggregate> byCustomer = new LinkedHashMap<>();
        for (Row row : rows) {
            Object customer = row.get(rules.getCustomerColumn());
            if (customer == null) {
                continue;
            }
            byCustomer.computeIfAbsent(customer, c -> new CustomerAggregate(row.get(rules.getCountryColumn())))
                    .add(row);
        }
        List<Object[]> result = new ArrayList<>(byCustomer.size());
        byCustomer.forEach((customer, agg) -> result.add(new Object[] {
                customer, agg.country, timestamp(agg.first), timestamp(agg.last),
                agg.totalSpent, agg.invoices.size(), schemaVersion
        }));
        return result;
    }

    List<Object[]> productRows(List<Row> rows, String schemaVersion) {
        Map<Object, Object> descriptions = new LinkedHashMap<>();
        for (Row row : rows) {
            Object stockCode = row.get(rules.getStockCodeColumn());
            if (stockCode != null) {
                descriptions.putIfAbsent(stockCode, row.get(rules.getDescriptionColumn()));
            }
        }
        List<Object[]> result = new ArrayList<>(descriptions.size());
        descriptions.forEach((stockCode, description) -> result.add(new Object[] {
                stockCode, description, categoryOf(description), schemaVersion
        }));
        return result;
    }

    /** First run of capital letters in the description, e.g. "WHITE HANGING HEART" gives "WHITE". */
    static String categoryOf(Object description) {
        if (description == null) {
            return DEFAULT_CATEGORY;
        }
        Matcher m = CATEGORY.matcher(String.valueOf(description));
        return m.find() ? m.group(1) : DEFAULT_CATEGORY;
    }

    private static Timestamp timestamp(Object value) {
        return value instanceof LocalDateTime ? Timestamp.valueOf((LocalDateTime) value) : null;
    }

    private final class CustomerAggregate {
        private final Object country;
        private LocalDateTime first;
        private LocalDateTime last;
        private BigDecimal totalSpent = BigDecimal.ZERO;
        private final Set<Object> invoices = new HashSet<>();

        private CustomerAggregate(Object country) {
            this.country = country;
        }

        private void add(Row row) {
            Object ts = row.get(rules.getTimestampColumn());
            if (ts instanceof LocalDateTime) {
                LocalDateTime t = (LocalDateTime) ts;
                first = first == null || t.isBefore(first) ? t : first;
                last = last == null || t.isAfter(last) ? t : last;
            }
            Object lineTotal = row.get(CleaningRules.LINE_TOTAL);
            if (lineTotal instanceof BigDecimal) {
                totalSpent = totalSpent.add((BigDecimal) lineTotal);
            }
            invoices.add(row.get(rules.getInvoiceColumn()));
        }
    }
}
