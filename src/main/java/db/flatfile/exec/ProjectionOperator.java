package db.flatfile.exec;

import java.util.ArrayList;
import java.util.List;

import db.flatfile.storage.Record;

/**
 * Projection operator: selects a subset of columns from child rows, in the requested order.
 * Keeps the original position so callers can still relate output to the table file.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes; // indices to keep in output order
    private final List<String> projectedColumns;

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        this.child = child;
        this.columnIndexes = columnIndexes;
        List<String> childCols = child.columns();
        List<String> names = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) names.add(childCols.get(idx));
        this.projectedColumns = List.copyOf(names);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<String> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) {
            projected.add(r.value(idx));
        }
        return Row.of(new Record(projected), r.position(), projectedColumns);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<String> columns() { return projectedColumns; }
}
