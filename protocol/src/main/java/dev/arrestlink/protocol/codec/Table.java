package dev.arrestlink.protocol.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A small column-oriented dataset as returned by the arrest data queries: ordered column names and
 * rows of JSON-native cell values.
 *
 * <p>Cells are held in canonical form so that a table compares equal after a trip through
 * {@link TabularCodec}: integral numbers become {@link Long}, fractional numbers become
 * {@link Double}, and strings, booleans and {@code null} are kept as they are. Any other cell type
 * is rejected.
 *
 * @param columns column names, in order
 * @param rows rows whose width equals the number of columns; cells may be {@code null}
 */
public record Table(List<String> columns, List<List<Object>> rows) {

    public Table {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = Objects.requireNonNull(rows.get(i), "row " + i);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size()
                    + " cells, expected " + columns.size());
            }
            List<Object> cells = new ArrayList<>(row.size());
            for (Object cell : row) {
                cells.add(canonical(cell, i));
            }
            // List.copyOf would reject null cells.
            copied.add(Collections.unmodifiableList(cells));
        }
        rows = Collections.unmodifiableList(copied);
    }

    private static Object canonical(Object cell, int row) {
        if (cell == null || cell instanceof String || cell instanceof Boolean) {
            return cell;
        }
        if (cell instanceof Long || cell instanceof Integer || cell instanceof Short || cell instanceof Byte) {
            return ((Number) cell).longValue();
        }
        if (cell instanceof Double || cell instanceof Float) {
            return ((Number) cell).doubleValue();
        }
        throw new IllegalArgumentException("Row " + row + " has unsupported cell type "
            + cell.getClass().getName());
    }

    public int rowCount() {
        return rows.size();
    }

    public List<Object> column(String name) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }
}
