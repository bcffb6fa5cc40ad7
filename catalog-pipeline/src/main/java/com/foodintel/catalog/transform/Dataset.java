package com.foodintel.catalog.transform;

import com.foodintel.catalog.model.ProductRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable table of products: ordered, typed columns and rows holding a value
 * (possibly null) for every column. Every operation returns a new Dataset.
 */
public final class Dataset {

    private final Map<String, ColumnType> schema;
    private final List<Map<String, Object>> rows;

    private Dataset(Map<String, ColumnType> schema, List<Map<String, Object>> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public static Dataset empty() {
        return new Dataset(Collections.emptyMap(), Collections.emptyList());
    }

    public static Dataset fromRecords(List<ProductRecord> records) {
        return fromRows(records.stream().map(ProductRecord::toRow).collect(Collectors.toList()));
    }

    /**
     * Build from loosely shaped rows. Columns are the union of all row keys in order
     * of first appearance; a row lacking a column gets null there. Types are inferred.
     */
    public static Dataset fromRows(List<Map<String, Object>> input) {
        List<String> columns = new ArrayList<>();
        for (Map<String, Object> row : input) {
            for (String key : row.keySet()) {
                if (!columns.contains(key)) columns.add(key);
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>(input.size());
        for (Map<String, Object> row : input) {
            Map<String, Object> full = new LinkedHashMap<>();
            for (String column : columns) {
                full.put(column, row.get(column));
            }
            rows.add(Collections.unmodifiableMap(full));
        }

        Map<String, ColumnType> schema = new LinkedHashMap<>();
        for (String column : columns) {
            schema.put(column, ColumnType.infer(rows.stream().map(r -> r.get(column)).collect(Collectors.toList())));
        }
        return new Dataset(Collections.unmodifiableMap(schema), Collections.unmodifiableList(rows));
    }

    // ── Shape ────────────────────────────────────────────────────────────────

    public List<String> columns() {
        return List.copyOf(schema.keySet());
    }

    public boolean hasColumn(String column) {
        return schema.containsKey(column);
    }

    /** @return the column's type, or null when the column does not exist */
    public ColumnType type(String column) {
        return schema.get(column);
    }

    public List<String> columnsOfType(ColumnType type) {
        return schema.entrySet().stream()
                .filter(e -> e.getValue() == type)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableList());
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return schema.size();
    }

    /** rows × columns */
    public long cellCount() {
        return (long) rows.size() * schema.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    // ── Access ───────────────────────────────────────────────────────────────

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public Object value(int row, String column) {
        return rows.get(row).get(column);
    }

    /** Values of one column in row order, nulls included. */
    public List<Object> values(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public int nullCount(String column) {
        int nulls = 0;
        for (Map<String, Object> row : rows) {
            if (row.get(column) == null) nulls++;
        }
        return nulls;
    }

    // ── Derivation ───────────────────────────────────────────────────────────

    /** Keep the rows matching the predicate, in order. */
    public Dataset filterRows(Predicate<Map<String, Object>> keep) {
        List<Map<String, Object>> kept = rows.stream().filter(keep).collect(Collectors.toUnmodifiableList());
        return new Dataset(schema, kept);
    }

    /** Replace every value of an existing column and set its type. */
    public Dataset mapColumn(String column, ColumnType type, UnaryOperator<Object> fn) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("No such column: " + column);
        }
        return withColumn(column, type, row -> fn.apply(row.get(column)));
    }

    /**
     * Add a column computed from each row. An existing column of the same name is
     * replaced in place; a new one is appended.
     */
    public Dataset withColumn(String column, ColumnType type, Function<Map<String, Object>, Object> fn) {
        Map<String, ColumnType> newSchema = new LinkedHashMap<>(schema);
        newSchema.put(column, type);

        List<Map<String, Object>> newRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.put(column, fn.apply(row));
            newRows.add(Collections.unmodifiableMap(copy));
        }
        return new Dataset(Collections.unmodifiableMap(newSchema), Collections.unmodifiableList(newRows));
    }

    @Override
    public String toString() {
        return "Dataset[" + rows.size() + " rows × " + schema.size() + " columns]";
    }
}
