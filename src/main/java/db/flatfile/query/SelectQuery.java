package db.flatfile.query;

/**
 * Logical SELECT.
 * criteria/order: blank means no filter / file order.
 */
public record SelectQuery(String tableName, ColumnList columns, String criteria, String order) {
    public SelectQuery {
        if (columns == null) columns = ColumnList.all();
        if (criteria == null) criteria = "";
        if (order == null) order = "";
    }

    public SelectQuery(String tableName) {
        this(tableName, ColumnList.all(), "", "");
    }
}
