package db.flatfile.query;

import java.util.List;

/** Logical INSERT; values line up with columns (all columns for "*"). */
public record InsertQuery(String tableName, ColumnList columns, List<String> values) {
    public InsertQuery {
        if (columns == null) columns = ColumnList.all();
        if (values == null) throw new IllegalArgumentException("values required");
        values = List.copyOf(values);
    }
}
