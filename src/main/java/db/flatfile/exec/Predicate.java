package db.flatfile.exec;

/**
 * Minimal predicate interface evaluated against a Row.
 */
public interface Predicate {
    boolean test(Row row);

    /** Matches nothing; used when a criteria names a column the table lacks. */
    Predicate NONE = row -> false;
}
