package com.eainde.xrf.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Untyped cell grid exactly as read from one worksheet (or one CSV file).
 *
 * <p>Cells are {@code String}, {@code Double}, {@code Boolean}, {@code LocalDateTime} or
 * {@code null}. The grid is only meaningful before column mapping; once a header row is
 * chosen, rows are turned into {@link com.eainde.xrf.parse.MappedRow}s.</p>
 *
 * @param sheetName name of the source sheet ("" when unknown)
 * @param rows      immutable rows, ragged lengths allowed
 */
public record RawGrid(String sheetName, List<List<Object>> rows) {

    public RawGrid {
        sheetName = sheetName == null ? "" : sheetName;
        List<List<Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (List<Object> row : rows) {
                // List.copyOf rejects nulls, blank cells are legitimately null
                copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static RawGrid of(List<List<Object>> rows) {
        return new RawGrid("", rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Object> row(int index) {
        return rows.get(index);
    }

    /** Cell at (row, column), {@code null} when the row is shorter. */
    public Object cell(int rowIndex, int columnIndex) {
        List<Object> row = rows.get(rowIndex);
        return columnIndex < row.size() ? row.get(columnIndex) : null;
    }
}
