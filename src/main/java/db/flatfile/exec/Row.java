package db.flatfile.exec;

import java.util.List;

import db.flatfile.storage.Record;

/**
 * Row is an execution pipeline unit (values + position in the table file + column names).
 * Record is the storage-level value list; Row adds where it came from and how to read it.
 * position: index of the record in the file as read, used by update/delete to target rows.
 */
public class Row {
    private final Record record;
    private final int position;
    private final List<String> columns;

    public static Row of(Record record, int position, List<String> columns) { return new Row(record, position, columns); }

    public Row(Record record, int position, List<String> columns) {
        this.record = record;
        this.position = position;
        this.columns = columns;
    }

    public int position() { return position; }
    public List<String> values() { return record.getValues(); }
    public List<String> columns() { return columns; }

    // Missing trailing fields read as empty text
    public String value(int columnIndex) { return record.get(columnIndex); }

    @Override
    public String toString() {
        return "Row" + values() + " pos=" + position;
    }
}
