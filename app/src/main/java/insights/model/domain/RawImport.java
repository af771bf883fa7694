package insights.model.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tabular input of unknown shape: ordered header plus rows of untyped cells.
 * Column lookup ignores case and surrounding whitespace.
 */
public final class RawImport {
    private final List<String> columns;
    private final List<List<String>> rows;
    private final Map<String, Integer> index;

    public RawImport(List<String> columns, List<List<String>> rows) {
        this.columns = List.copyOf(columns == null ? List.of() : columns);
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> r : rows) copy.add(Collections.unmodifiableList(new ArrayList<>(r)));
        }
        this.rows = Collections.unmodifiableList(copy);
        this.index = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            index.putIfAbsent(normalize(this.columns.get(i)), i);
        }
    }

    public static String normalize(String column) {
        return column == null ? "" : column.trim().toLowerCase(Locale.ROOT);
    }

    public List<String> columns() { return columns; }

    public int size() { return rows.size(); }

    public boolean isEmpty() { return rows.isEmpty(); }

    public Row row(int i) { return new Row(i, rows.get(i)); }

    public List<Row> rows() {
        List<Row> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) out.add(new Row(i, rows.get(i)));
        return out;
    }

    /** Same header, rows {@code from} (inclusive) onward. */
    public RawImport dropLeadingRows(int from) {
        if (from <= 0) return this;
        return new RawImport(columns, rows.subList(Math.min(from, rows.size()), rows.size()));
    }

    /** Index of the first column whose normalized name contains {@code marker}, or -1. */
    public int findColumn(String marker) {
        String m = normalize(marker);
        for (int i = 0; i < columns.size(); i++) {
            if (normalize(columns.get(i)).contains(m)) return i;
        }
        return -1;
    }

    public final class Row {
        private final int position;
        private final List<String> cells;

        private Row(int position, List<String> cells) {
            this.position = position;
            this.cells = cells;
        }

        public int position() { return position; }

        /** Cell by column name; null when the column or the cell is absent. */
        public String get(String column) {
            Integer i = index.get(normalize(column));
            return i == null ? null : get(i);
        }

        public String get(int i) {
            return (i < 0 || i >= cells.size()) ? null : cells.get(i);
        }

        /** Cell of the first column whose name contains {@code marker}. */
        public String find(String marker) {
            int i = findColumn(marker);
            return i < 0 ? null : get(i);
        }

        public List<String> columns() { return columns; }

        public boolean isBlank() {
            for (String c : cells) if (c != null && !c.isBlank()) return false;
            return true;
        }
    }
}
