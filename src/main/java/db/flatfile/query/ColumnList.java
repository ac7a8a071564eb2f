package db.flatfile.query;

import java.util.ArrayList;
import java.util.List;

import db.flatfile.ColumnNotFoundException;
import db.flatfile.catalog.TableSchema;

/**
 * Requested column names for select/insert/update.
 * "*", "" and whitespace mean every column in schema order. Names may be
 * wrapped in backticks ("`id`, `name`"); the backticks are dropped.
 */
public final class ColumnList {
    private static final ColumnList ALL = new ColumnList(List.of());

    private final List<String> names; // empty => all columns

    private ColumnList(List<String> names) {
        this.names = names;
    }

    public static ColumnList all() {
        return ALL;
    }

    public static ColumnList parse(String raw) {
        if (raw == null) return ALL;
        String trimmed = raw.trim();
        if (trimmed.equals("*") || trimmed.isEmpty()) return ALL;
        return of(List.of(trimmed.split(",", -1)));
    }

    public static ColumnList of(List<String> raw) {
        if (raw == null || raw.isEmpty()) return ALL;
        List<String> cleaned = new ArrayList<>(raw.size());
        for (String name : raw) {
            cleaned.add(name == null ? "" : name.replace("`", "").trim());
        }
        return new ColumnList(List.copyOf(cleaned));
    }

    public boolean isAll() {
        return names.isEmpty();
    }

    public List<String> names() {
        return names;
    }

    /** Concrete names against a table: all columns for "*", otherwise as requested. */
    public List<String> resolveNames(TableSchema table) {
        return isAll() ? table.columns() : names;
    }

    /**
     * Column positions in requested order.
     * @throws ColumnNotFoundException listing every name the table does not declare
     */
    public int[] resolveIndexes(TableSchema table) {
        List<String> requested = resolveNames(table);
        int[] idxs = new int[requested.size()];
        List<String> invalid = new ArrayList<>();
        for (int i = 0; i < requested.size(); i++) {
            idxs[i] = table.columnIndex(requested.get(i));
            if (idxs[i] == -1) invalid.add(requested.get(i));
        }
        if (!invalid.isEmpty()) throw new ColumnNotFoundException(table.name(), invalid);
        return idxs;
    }

    @Override
    public String toString() {
        return isAll() ? "*" : String.join(",", names);
    }
}
