package db.flatfile.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Ordered set of table definitions for one database, in declaration order.
 */
public record Schema(List<TableSchema> tables) {

    public Schema {
        tables = List.copyOf(tables);
    }

    /** First table with the given name; later duplicates are shadowed. */
    public Optional<TableSchema> find(String name) {
        for (TableSchema t : tables) {
            if (t.name().equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public List<String> tableNames() {
        return tables.stream()
            .filter(t -> !t.isDegenerate())
            .map(TableSchema::name)
            .toList();
    }
}
