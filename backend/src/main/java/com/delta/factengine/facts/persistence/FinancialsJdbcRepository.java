package com.delta.factengine.facts.persistence;

import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.ExchangeRateEntry;
import com.delta.factengine.facts.model.FieldValue;
import com.delta.factengine.facts.model.FinancialSnapshot;
import com.delta.factengine.facts.model.SnapshotView;
import com.delta.factengine.facts.model.StockPrice;
import com.delta.factengine.facts.model.UpsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

@Repository
public class FinancialsJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(FinancialsJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final boolean postgres;

    public FinancialsJdbcRepository(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.postgres = detectPostgres(jdbc);
    }

    /**
     * Presence marker for a financials row; {@code lastUpdated} is the raw stored text and may be null.
     */
    public record SnapshotStamp(String lastUpdated) {
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public boolean schemaPresent() {
        try {
            jdbc.getJdbcTemplate().queryForList("SELECT company_id FROM financials WHERE 1 = 0");
            jdbc.getJdbcTemplate().queryForList("SELECT id FROM companies WHERE 1 = 0");
            jdbc.getJdbcTemplate().queryForList("SELECT rate FROM exchange_rates WHERE 1 = 0");
            jdbc.getJdbcTemplate().queryForList("SELECT price_value FROM stock_prices WHERE 1 = 0");
            return true;
        } catch (DataAccessException e) {
            log.warn("Schema check failed: {}", e.getMessage());
            return false;
        }
    }

    public long upsertCompany(String ticker, String name, String nameAlt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ticker", ticker)
            .addValue("name", name)
            .addValue("nameAlt", nameAlt);

        int updated = jdbc.update(
            """
                UPDATE companies
                SET name = COALESCE(:name, name),
                    name_alt = COALESCE(:nameAlt, name_alt)
                WHERE ticker = :ticker
                """,
            params
        );
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO companies (ticker, name, name_alt)
                        VALUES (:ticker, :name, :nameAlt)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException e) {
                log.debug("Concurrent insert for ticker {}; retrying as update", ticker);
                jdbc.update(
                    """
                        UPDATE companies
                        SET name = COALESCE(:name, name),
                            name_alt = COALESCE(:nameAlt, name_alt)
                        WHERE ticker = :ticker
                        """,
                    params
                );
            }
        }

        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM companies
                WHERE ticker = :ticker
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to upsert company for ticker " + ticker);
        }
        return id;
    }

    public List<CompanyTarget> findCompanyTargets(Integer offset, Integer limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("offset", offset == null ? 0 : Math.max(0, offset))
            .addValue("limit", limit == null ? Integer.MAX_VALUE : Math.max(0, limit));
        return jdbc.query(
            """
                SELECT id, ticker, name
                FROM companies
                ORDER BY id
                LIMIT :limit OFFSET :offset
                """,
            params,
            (rs, rowNum) -> new CompanyTarget(rs.getLong("id"), rs.getString("ticker"), rs.getString("name"))
        );
    }

    public Optional<CompanyTarget> findCompanyTarget(long companyId) {
        List<CompanyTarget> rows = jdbc.query(
            """
                SELECT id, ticker, name
                FROM companies
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", companyId),
            (rs, rowNum) -> new CompanyTarget(rs.getLong("id"), rs.getString("ticker"), rs.getString("name"))
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<SnapshotStamp> findSnapshotStamp(long companyId) {
        List<SnapshotStamp> rows = jdbc.query(
            """
                SELECT last_updated
                FROM financials
                WHERE company_id = :companyId
                """,
            new MapSqlParameterSource("companyId", companyId),
            (rs, rowNum) -> new SnapshotStamp(rs.getString("last_updated"))
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<FinancialSnapshot> findSnapshot(long companyId) {
        List<FinancialSnapshot> rows = jdbc.query(
            "SELECT * FROM financials WHERE company_id = :companyId",
            new MapSqlParameterSource("companyId", companyId),
            (rs, rowNum) -> mapSnapshot(rs)
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<SnapshotView> findSnapshotViews(Long companyId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit));
        String filter = "";
        if (companyId != null) {
            filter = "WHERE c.id = :companyId";
            params.addValue("companyId", companyId);
        }
        String sql = "SELECT c.id AS id, c.ticker AS ticker, c.name AS name, f.* "
            + "FROM financials f JOIN companies c ON c.id = f.company_id "
            + filter
            + " ORDER BY f.market_cap_value DESC NULLS LAST, c.id LIMIT :limit";
        return jdbc.query(
            sql,
            params,
            (rs, rowNum) -> new SnapshotView(
                new CompanyTarget(rs.getLong("id"), rs.getString("ticker"), rs.getString("name")),
                mapSnapshot(rs),
                rs.getString("last_updated")
            )
        );
    }

    /**
     * Writes only the given columns. Columns outside {@code writeSet} keep their stored values.
     */
    public UpsertOutcome upsertSnapshot(
        long companyId,
        Map<FinancialField, FieldValue> writeSet,
        String lastUpdated,
        String dataSource
    ) {
        if (writeSet == null || writeSet.isEmpty()) {
            throw new IllegalArgumentException("Write set must not be empty");
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("lastUpdated", lastUpdated)
            .addValue("dataSource", dataSource);
        List<String> columns = new ArrayList<>();
        writeSet.forEach((field, value) -> {
            columns.add(field.column());
            params.addValue(field.column(), value.value());
            if (field.isMonetary()) {
                columns.add(field.currencyColumn());
                params.addValue(field.currencyColumn(), value.currency());
            }
        });
        columns.add("last_updated");
        columns.add("data_source");

        if (postgres) {
            Boolean inserted = jdbc.queryForObject(
                buildPostgresUpsert(columns),
                params,
                Boolean.class
            );
            return Boolean.TRUE.equals(inserted) ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
        }

        UpsertOutcome outcome = transactionTemplate.execute(status -> {
            Integer existing = jdbc.queryForObject(
                "SELECT COUNT(*) FROM financials WHERE company_id = :companyId",
                params,
                Integer.class
            );
            if (existing != null && existing > 0) {
                jdbc.update(buildUpdate(columns), params);
                return UpsertOutcome.UPDATED;
            }
            jdbc.update(buildInsert(columns), params);
            return UpsertOutcome.INSERTED;
        });
        return outcome == null ? UpsertOutcome.UPDATED : outcome;
    }

    public List<ExchangeRateEntry> loadExchangeRates() {
        return jdbc.query(
            """
                SELECT from_currency, to_currency, rate, fetch_date
                FROM exchange_rates
                ORDER BY from_currency, to_currency, fetch_date
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ExchangeRateEntry(
                rs.getString("from_currency"),
                rs.getString("to_currency"),
                rs.getDouble("rate"),
                toInstant(rs.getTimestamp("fetch_date"))
            )
        );
    }

    public void upsertExchangeRate(ExchangeRateEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fromCurrency", entry.fromCurrency().toUpperCase(Locale.ROOT))
            .addValue("toCurrency", entry.toCurrency().toUpperCase(Locale.ROOT))
            .addValue("rate", entry.rate())
            .addValue("fetchDate", toTimestamp(entry.fetchDate() == null ? Instant.now() : entry.fetchDate()));
        int updated = jdbc.update(
            """
                UPDATE exchange_rates
                SET rate = :rate
                WHERE from_currency = :fromCurrency
                  AND to_currency = :toCurrency
                  AND fetch_date = :fetchDate
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO exchange_rates (from_currency, to_currency, rate, fetch_date)
                    VALUES (:fromCurrency, :toCurrency, :rate, :fetchDate)
                    """,
                params
            );
        }
    }

    public Optional<StockPrice> findStockPrice(long companyId, LocalDate priceDate) {
        List<StockPrice> rows = jdbc.query(
            """
                SELECT company_id, price_date, price_value, price_currency
                FROM stock_prices
                WHERE company_id = :companyId
                  AND price_date = :priceDate
                """,
            new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("priceDate", priceDate),
            (rs, rowNum) -> mapStockPrice(rs)
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Most recent stored price strictly before {@code priceDate}.
     */
    public Optional<StockPrice> findLatestStockPriceBefore(long companyId, LocalDate priceDate) {
        List<StockPrice> rows = jdbc.query(
            """
                SELECT company_id, price_date, price_value, price_currency
                FROM stock_prices
                WHERE company_id = :companyId
                  AND price_date < :priceDate
                ORDER BY price_date DESC
                LIMIT 1
                """,
            new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("priceDate", priceDate),
            (rs, rowNum) -> mapStockPrice(rs)
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public UpsertOutcome upsertStockPrice(StockPrice price, String lastUpdated) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("companyId", price.companyId())
            .addValue("priceDate", price.priceDate())
            .addValue("priceValue", price.value())
            .addValue("priceCurrency", price.currency())
            .addValue("lastUpdated", lastUpdated);

        if (postgres) {
            Boolean inserted = jdbc.queryForObject(
                """
                    INSERT INTO stock_prices (company_id, price_date, price_value, price_currency, last_updated)
                    VALUES (:companyId, :priceDate, :priceValue, :priceCurrency, :lastUpdated)
                    ON CONFLICT (company_id, price_date)
                    DO UPDATE SET
                        price_value = EXCLUDED.price_value,
                        price_currency = EXCLUDED.price_currency,
                        last_updated = EXCLUDED.last_updated
                    RETURNING (xmax = 0) AS inserted
                    """,
                params,
                Boolean.class
            );
            return Boolean.TRUE.equals(inserted) ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
        }

        UpsertOutcome outcome = transactionTemplate.execute(status -> {
            int updated = jdbc.update(
                """
                    UPDATE stock_prices
                    SET price_value = :priceValue,
                        price_currency = :priceCurrency,
                        last_updated = :lastUpdated
                    WHERE company_id = :companyId
                      AND price_date = :priceDate
                    """,
                params
            );
            if (updated > 0) {
                return UpsertOutcome.UPDATED;
            }
            jdbc.update(
                """
                    INSERT INTO stock_prices (company_id, price_date, price_value, price_currency, last_updated)
                    VALUES (:companyId, :priceDate, :priceValue, :priceCurrency, :lastUpdated)
                    """,
                params
            );
            return UpsertOutcome.INSERTED;
        });
        return outcome == null ? UpsertOutcome.UPDATED : outcome;
    }

    private String buildPostgresUpsert(List<String> columns) {
        StringJoiner names = new StringJoiner(", ", "company_id, ", "");
        StringJoiner values = new StringJoiner(", ", ":companyId, ", "");
        StringJoiner updates = new StringJoiner(",\n    ");
        for (String column : columns) {
            names.add(column);
            values.add(":" + column);
            updates.add(column + " = EXCLUDED." + column);
        }
        return "INSERT INTO financials (" + names + ")\n"
            + "VALUES (" + values + ")\n"
            + "ON CONFLICT (company_id)\n"
            + "DO UPDATE SET\n    " + updates + "\n"
            + "RETURNING (xmax = 0) AS inserted";
    }

    private String buildInsert(List<String> columns) {
        StringJoiner names = new StringJoiner(", ", "company_id, ", "");
        StringJoiner values = new StringJoiner(", ", ":companyId, ", "");
        for (String column : columns) {
            names.add(column);
            values.add(":" + column);
        }
        return "INSERT INTO financials (" + names + ") VALUES (" + values + ")";
    }

    private String buildUpdate(List<String> columns) {
        StringJoiner updates = new StringJoiner(", ");
        for (String column : columns) {
            updates.add(column + " = :" + column);
        }
        return "UPDATE financials SET " + updates + " WHERE company_id = :companyId";
    }

    private FinancialSnapshot mapSnapshot(ResultSet rs) throws SQLException {
        Map<FinancialField, FieldValue> fields = new EnumMap<>(FinancialField.class);
        for (FinancialField field : FinancialField.values()) {
            Object raw = rs.getObject(field.column());
            if (raw instanceof Number number) {
                String currency = field.isMonetary() ? rs.getString(field.currencyColumn()) : null;
                fields.put(field, new FieldValue(number.doubleValue(), currency));
            }
        }
        return new FinancialSnapshot(
            rs.getLong("company_id"),
            fields,
            parseInstant(rs.getString("last_updated")),
            rs.getString("data_source")
        );
    }

    private StockPrice mapStockPrice(ResultSet rs) throws SQLException {
        return new StockPrice(
            rs.getLong("company_id"),
            rs.getObject("price_date", LocalDate.class),
            rs.getDouble("price_value"),
            rs.getString("price_currency")
        );
    }

    public static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upsert", e);
            return false;
        }
    }
}
