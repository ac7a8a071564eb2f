package db.flatfile.query;

/** Logical representation of DELETE; blank criteria removes every row. */
public record DeleteQuery(String tableName, String criteria) {
    public DeleteQuery {
        if (criteria == null) criteria = "";
    }
}
