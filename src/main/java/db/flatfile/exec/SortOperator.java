package db.flatfile.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Blocking sort on one column using natural ordering. Materializes the child
 * on open. Ties keep child order; descending reverses the finished ascending
 * order instead of negating the comparator.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final int columnIndex;
    private final boolean descending;

    private Iterator<Row> sorted;

    public SortOperator(Operator child, int columnIndex, boolean descending) {
        this.child = child;
        this.columnIndex = columnIndex;
        this.descending = descending;
    }

    @Override
    public void open() {
        child.open();
        List<Row> rows = new ArrayList<>();
        for (Row r = child.next(); r != null; r = child.next()) rows.add(r);
        // List.sort is a stable merge sort
        rows.sort(Comparator.comparing((Row r) -> r.value(columnIndex), NaturalOrderComparator.INSTANCE));
        if (descending) Collections.reverse(rows);
        sorted = rows.iterator();
    }

    @Override
    public Row next() {
        return sorted != null && sorted.hasNext() ? sorted.next() : null;
    }

    @Override
    public void close() {
        sorted = null;
        child.close();
    }

    @Override
    public List<String> columns() { return child.columns(); }
}
