package db.flatfile.catalog;

import java.util.List;

// Immutable data carrier for a table definition.
// columns: declaration order; primaryKey: one of columns (empty only for a degenerate table).
public record TableSchema(String name, List<String> columns, String primaryKey) {

    public TableSchema {
        columns = List.copyOf(columns);
    }

    /** Position of the column, or -1 when the table does not declare it. */
    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public int primaryKeyIndex() {
        return columns.indexOf(primaryKey);
    }

    // Left behind by a "**" separator with no TAB after it; never queryable.
    public boolean isDegenerate() {
        return name == null || name.isEmpty() || columns.isEmpty();
    }
}
