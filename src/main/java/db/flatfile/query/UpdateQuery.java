package db.flatfile.query;

import java.util.List;

/** Logical UPDATE; blank criteria targets every row. */
public record UpdateQuery(String tableName, ColumnList columns, List<String> values, String criteria) {
    public UpdateQuery {
        if (columns == null) columns = ColumnList.all();
        if (values == null) throw new IllegalArgumentException("values required");
        values = List.copyOf(values);
        if (criteria == null) criteria = "";
    }
}
