package db.flatfile.exec;

import java.util.List;

/**
 * Passes through the child rows a predicate accepts, in child order.
 */
public class FilterOperator implements Operator {
    private final Operator child;
    private final Predicate predicate;
    private int matched;

    public FilterOperator(Operator child, Predicate predicate) {
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        matched = 0;
        child.open();
    }

    @Override
    public Row next() {
        for (Row r = child.next(); r != null; r = child.next()) {
            if (predicate.test(r)) {
                matched++;
                return r;
            }
        }
        return null;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<String> columns() { return child.columns(); }

    public int matched() { return matched; }
}
