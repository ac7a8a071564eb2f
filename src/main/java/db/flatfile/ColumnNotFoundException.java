package db.flatfile;

import java.util.List;

/**
 * Raised when a column list names columns the table does not declare.
 * Carries every offending name, not just the first one.
 */
public class ColumnNotFoundException extends DatabaseException {

    private final String tableName;
    private final List<String> columns;

    public ColumnNotFoundException(String tableName, List<String> columns) {
        super(ErrorCode.INVALID_COLUMN_NAME, "on table " + tableName + ": " + String.join(",", columns));
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }
}
