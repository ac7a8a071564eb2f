package db.flatfile.exec;

import java.util.Iterator;
import java.util.List;

import db.flatfile.catalog.TableSchema;
import db.flatfile.storage.Record;
import db.flatfile.storage.StorageManager;

/**
 * Full table scan yielding records in file order, tagged with their position.
 * Either decodes the table file on open, or walks a record set the caller
 * already loaded (update/delete read once and rewrite the same list).
 */
public class SeqScanOperator implements Operator {
    private final StorageManager storage;
    private final TableSchema table;
    private final List<Record> preloaded;

    private Iterator<Record> records;
    private int position;

    public SeqScanOperator(StorageManager storage, TableSchema table) {
        this.storage = storage;
        this.table = table;
        this.preloaded = null;
    }

    private SeqScanOperator(TableSchema table, List<Record> records) {
        this.storage = null;
        this.table = table;
        this.preloaded = records;
    }

    public static SeqScanOperator over(TableSchema table, List<Record> records) {
        return new SeqScanOperator(table, records);
    }

    @Override
    public void open() {
        records = (preloaded != null ? preloaded : storage.scanTable(table.name())).iterator();
        position = 0;
    }

    @Override
    public Row next() {
        if (records == null || !records.hasNext()) return null;
        return Row.of(records.next(), position++, table.columns());
    }

    @Override
    public void close() {
        records = null;
    }

    @Override
    public List<String> columns() { return table.columns(); }
}
