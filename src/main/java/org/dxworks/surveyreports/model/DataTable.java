package org.dxworks.surveyreports.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of string cells with named columns.
 *
 * In JSON a table is column oriented: {@code {"Q1_TEXT": ["good", "-99", ""]}}.
 * Numeric cells are read as their text, {@code null} cells as the empty string.
 */
public final class DataTable {

    public static final String MISSING_VALUE = "-99";

    private final List<String> columns;
    private final List<List<String>> rows;

    public DataTable(List<String> columns, List<List<String>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but table has "
                        + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(copy);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DataTable fromColumns(LinkedHashMap<String, List<String>> columnValues) {
        List<String> columns = new ArrayList<>(columnValues.keySet());
        int rowCount = 0;
        for (List<String> values : columnValues.values()) {
            rowCount = Math.max(rowCount, values == null ? 0 : values.size());
        }

        List<List<String>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            List<String> row = new ArrayList<>(columns.size());
            for (List<String> values : columnValues.values()) {
                String cell = values != null && r < values.size() ? values.get(r) : null;
                row.add(cell == null ? "" : cell);
            }
            rows.add(row);
        }
        return new DataTable(columns, rows);
    }

    @JsonValue
    public Map<String, List<String>> toColumns() {
        Map<String, List<String>> columnValues = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            List<String> values = new ArrayList<>(rows.size());
            for (List<String> row : rows) {
                values.add(row.get(c));
            }
            columnValues.put(columns.get(c), values);
        }
        return columnValues;
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Projects a single column, without copying the other columns.
     */
    public DataTable select(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<List<String>> projected = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            projected.add(Collections.singletonList(row.get(index)));
        }
        return new DataTable(List.of(column), projected);
    }

    /**
     * Drops every row whose cells are all either the missing value marker or empty.
     */
    public DataTable withoutBlankRows() {
        List<List<String>> kept = new ArrayList<>();
        for (List<String> row : rows) {
            if (!isBlankRow(row)) {
                kept.add(row);
            }
        }
        return new DataTable(columns, kept);
    }

    public static boolean isBlankCell(String cell) {
        return cell == null || cell.isEmpty() || MISSING_VALUE.equals(cell);
    }

    private static boolean isBlankRow(List<String> row) {
        for (String cell : row) {
            if (!isBlankCell(cell)) {
                return false;
            }
        }
        return true;
    }
}
