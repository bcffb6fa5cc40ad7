package com.foodintel.catalog.output;

import com.foodintel.catalog.ingest.IdentityStore;
import com.foodintel.catalog.model.PipelineRun;
import com.foodintel.catalog.transform.Dataset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.foodintel.catalog.model.ProductColumns.*;

/**
 * Persists cleaned products and run metadata to ClickHouse, and reads back the
 * product codes already stored for incremental runs.
 *
 * The products table has a fixed column set; dataset columns outside it are not
 * stored and missing ones are written as NULL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter implements IdentityStore {

    static final String PRODUCTS_TABLE = "catalog.products";
    private static final int BATCH_SIZE = 1000;
    private static final DateTimeFormatter SQL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Stored dataset columns → ClickHouse type, in table order */
    static final Map<String, String> PRODUCT_COLUMNS = productColumns();

    private final JdbcTemplate jdbcTemplate;

    private static Map<String, String> productColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(CODE, "String");
        columns.put(PRODUCT_NAME, "Nullable(String)");
        columns.put(BRANDS, "Nullable(String)");
        columns.put(CATEGORIES, "Nullable(String)");
        columns.put(STORES, "Nullable(String)");
        columns.put(NUTRISCORE_GRADE, "LowCardinality(Nullable(String))");
        columns.put(NOVA_GROUP, "Nullable(Float64)");
        columns.put(ENERGY_100G, "Nullable(Float64)");
        columns.put(SUGARS_100G, "Nullable(Float64)");
        columns.put(FAT_100G, "Nullable(Float64)");
        columns.put(SALT_100G, "Nullable(Float64)");
        columns.put(STORE_ADDRESS, "Nullable(String)");
        columns.put(LATITUDE, "Nullable(Float64)");
        columns.put(LONGITUDE, "Nullable(Float64)");
        columns.put(CITY, "Nullable(String)");
        columns.put(POSTAL_CODE, "Nullable(String)");
        columns.put(GEOCODING_SCORE, "Nullable(Float64)");
        columns.put(SUGAR_CATEGORY, "LowCardinality(Nullable(String))");
        columns.put(IS_GEOCODED, "Nullable(UInt8)");
        return columns;
    }

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS catalog");

        String productColumns = PRODUCT_COLUMNS.entrySet().stream()
                .map(e -> String.format("    %-20s %s", e.getKey(), e.getValue()))
                .collect(Collectors.joining(",\n"));

        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + PRODUCTS_TABLE + "\n(\n"
                + "    category             LowCardinality(String),\n"
                + productColumns + ",\n"
                + "    ingested_at          DateTime\n"
                + """
                )
                ENGINE = ReplacingMergeTree(ingested_at)
                ORDER BY (category, code)
                """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS catalog.pipeline_runs
            (
                run_id              String,
                category            LowCardinality(String),
                incremental         UInt8,
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                records_fetched     Int32,
                records_new         Int32,
                records_written     Int32,
                quality_grade       Nullable(String),
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, category)
        """);

        log.info("ClickHouse schema ready.");
    }

    public void write(Dataset dataset, String category) {
        if (dataset.isEmpty()) return;

        int total = dataset.rowCount();
        log.info("Writing {} records to ClickHouse in batches of {}", total, BATCH_SIZE);
        LocalDateTime ingestedAt = LocalDateTime.now();

        List<Map<String, Object>> rows = dataset.rows();
        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<Map<String, Object>> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                writeBatchAsValues(batch, category, ingestedAt);
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write failed at offset {}: {}", i, e.getMessage(), e);
                throw e;
            }
        }

        log.info("Successfully wrote {} records", total);
    }

    /**
     * Build a single INSERT ... VALUES statement with all rows in the batch.
     * This is the most reliable approach with the ClickHouse JDBC driver,
     * avoiding PreparedStatement batch handling.
     */
    private void writeBatchAsValues(List<Map<String, Object>> batch, String category, LocalDateTime ingestedAt) {
        StringBuilder sql = new StringBuilder("INSERT INTO " + PRODUCTS_TABLE + "\n(category, ")
                .append(String.join(", ", PRODUCT_COLUMNS.keySet()))
                .append(", ingested_at)\nVALUES\n");

        String rows = batch.stream()
                .map(row -> toValueRow(row, category, ingestedAt))
                .collect(Collectors.joining(",\n"));

        sql.append(rows);
        jdbcTemplate.execute(sql.toString());
    }

    String toValueRow(Map<String, Object> row, String category, LocalDateTime ingestedAt) {
        String values = PRODUCT_COLUMNS.keySet().stream()
                .map(column -> sqlValue(row.get(column)))
                .collect(Collectors.joining(","));
        return "(" + sqlStr(category) + "," + values + "," + sqlStr(timestamp(ingestedAt)) + ")";
    }

    private String sqlValue(Object val) {
        if (val == null) return "NULL";
        if (val instanceof Boolean b) return b ? "1" : "0";
        if (val instanceof Number) return val.toString();
        return sqlStr(val);
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public Set<String> loadKnownIds(String category) {
        List<String> codes = jdbcTemplate.queryForList(
                "SELECT DISTINCT code FROM " + PRODUCTS_TABLE + " WHERE category = ?", String.class, category);
        log.info("History check: {} known products in ClickHouse", codes.size());
        return new HashSet<>(codes);
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            String sql = String.format("""
                INSERT INTO catalog.pipeline_runs
                (run_id, category, incremental, started_at, completed_at,
                 status, records_fetched, records_new, records_written, quality_grade, error_message)
                VALUES (%s,%s,%d,%s,%s,%s,%d,%d,%d,%s,%s)
                """,
                    sqlStr(run.getRunId()),
                    sqlStr(run.getCategory()),
                    run.isIncremental() ? 1 : 0,
                    sqlStr(timestamp(run.getStartedAt())),
                    sqlStr(timestamp(run.getCompletedAt())),
                    sqlStr(run.getStatus()),
                    run.getRecordsFetched(),
                    run.getRecordsNew(),
                    run.getRecordsWritten(),
                    sqlStr(run.getQualityGrade()),
                    sqlStr(run.getErrorMessage())
            );
            jdbcTemplate.execute(sql);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run: {}", e.getMessage());
        }
    }

    private String timestamp(LocalDateTime time) {
        return time == null ? null : time.format(SQL_TIMESTAMP);
    }
}
