package db.flatfile.exec;

/**
 * Exact text equality on one column.
 */
public class EqualityPredicate implements Predicate {
    private final int columnIndex;
    private final String expected;

    public EqualityPredicate(int columnIndex, String expected) {
        this.columnIndex = columnIndex;
        this.expected = expected;
    }

    @Override
    public boolean test(Row row) {
        return expected.equals(row.value(columnIndex));
    }

    // For debugging
    @Override
    public String toString() { return "col[" + columnIndex + "] = " + expected; }
}
