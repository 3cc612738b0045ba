package io.croissant.core.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable in-memory table: ordered column names and rows of JSON cells.
 *
 * <p>
 * Every row holds every column; absent cells are {@link NullNode}. Equality is structural
 * (same columns in the same order, same rows in the same order).
 */
public final class Table {

    private final List<String> columns;
    private final List<Map<String, JsonNode>> rows;

    public Table(List<String> columns, List<? extends Map<String, JsonNode>> rows) {
        this.columns = List.copyOf(new LinkedHashSet<>(columns));
        List<Map<String, JsonNode>> copies = new ArrayList<>(rows.size());
        for (Map<String, JsonNode> row : rows) {
            Map<String, JsonNode> copy = new LinkedHashMap<>();
            for (String column : this.columns) {
                JsonNode cell = row.get(column);
                copy.put(column, cell == null ? NullNode.getInstance() : cell);
            }
            copies.add(Collections.unmodifiableMap(copy));
        }
        this.rows = Collections.unmodifiableList(copies);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public List<Map<String, JsonNode>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Values of one column, in row order.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<JsonNode> column(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("No column \"" + column + "\" in " + columns);
        }
        return rows.stream().map(row -> row.get(column)).toList();
    }

    /** Returns a copy where {@code column} holds {@code values}, added last if it did not exist. */
    public Table withColumn(String column, List<JsonNode> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(
                    "Column \"" + column + "\" has " + values.size() + " values for " + rows.size() + " rows");
        }
        List<String> names = new ArrayList<>(columns);
        if (!names.contains(column)) {
            names.add(column);
        }
        List<Map<String, JsonNode>> updated = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, JsonNode> row = new LinkedHashMap<>(rows.get(i));
            row.put(column, values.get(i));
            updated.add(row);
        }
        return new Table(names, updated);
    }

    /** Returns a copy with every column renamed to {@code prefix + "/" + column}. */
    public Table qualified(String prefix) {
        List<String> names = columns.stream().map(c -> prefix + "/" + c).toList();
        List<Map<String, JsonNode>> renamed = new ArrayList<>(rows.size());
        for (Map<String, JsonNode> row : rows) {
            Map<String, JsonNode> copy = new LinkedHashMap<>();
            row.forEach((column, cell) -> copy.put(prefix + "/" + column, cell));
            renamed.add(copy);
        }
        return new Table(names, renamed);
    }

    /**
     * Left outer merge: every row of this table is kept, once per matching row of {@code right},
     * or once with null right-hand cells when nothing matches. Keys match on their text form;
     * null keys never match. Columns of {@code right} already present here are not repeated.
     */
    public Table leftJoin(String leftKey, Table right, String rightKey) {
        Map<String, List<Map<String, JsonNode>>> index = new LinkedHashMap<>();
        for (Map<String, JsonNode> row : right.rows) {
            String key = keyOf(row.get(rightKey));
            if (key != null) {
                index.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }
        Set<String> names = new LinkedHashSet<>(columns);
        names.addAll(right.columns);
        List<Map<String, JsonNode>> merged = new ArrayList<>();
        for (Map<String, JsonNode> row : rows) {
            String key = keyOf(row.get(leftKey));
            List<Map<String, JsonNode>> matches = key == null ? List.of() : index.getOrDefault(key, List.of());
            if (matches.isEmpty()) {
                merged.add(row);
                continue;
            }
            for (Map<String, JsonNode> match : matches) {
                Map<String, JsonNode> combined = new LinkedHashMap<>(match);
                combined.putAll(row);
                merged.add(combined);
            }
        }
        return new Table(new ArrayList<>(names), merged);
    }

    /** Unions the rows of several tables; the columns are the union of theirs, in first-seen order. */
    public static Table concat(List<Table> tables) {
        Set<String> names = new LinkedHashSet<>();
        List<Map<String, JsonNode>> all = new ArrayList<>();
        for (Table table : tables) {
            names.addAll(table.columns);
            all.addAll(table.rows);
        }
        return new Table(new ArrayList<>(names), all);
    }

    private static String keyOf(JsonNode cell) {
        if (cell == null || cell.isNull() || cell.isMissingNode()) {
            return null;
        }
        return cell.isValueNode() ? cell.asText() : cell.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table other)) {
            return false;
        }
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table[columns=" + columns + ", rows=" + rows.size() + "]";
    }
}
