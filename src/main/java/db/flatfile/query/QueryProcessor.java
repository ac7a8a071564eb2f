package db.flatfile.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.AutoKeyOverflowException;
import db.flatfile.ColumnListMismatchException;
import db.flatfile.DuplicateKeyException;
import db.flatfile.catalog.CatalogManager;
import db.flatfile.catalog.TableSchema;
import db.flatfile.exec.Row;
import db.flatfile.storage.Record;
import db.flatfile.storage.StorageManager;

/**
 * Executes logical queries. Every call is an independent read, compute and
 * (for mutations) full rewrite of one table file; nothing is carried between calls.
 */
public class QueryProcessor {
    private static final Logger logger = LoggerFactory.getLogger(QueryProcessor.class);

    private final CatalogManager catalog;
    private final StorageManager storage;
    private final QueryPlanner planner;
    private final QueryExecutor executor = new QueryExecutor();

    public QueryProcessor(CatalogManager catalog, StorageManager storage) {
        this.catalog = catalog;
        this.storage = storage;
        this.planner = new QueryPlanner(storage, new PredicateCompiler());
    }

    /**
     * Matching rows as column-name keyed maps, keys in requested order.
     * No match is an empty list, never an error.
     */
    public List<Map<String, String>> select(SelectQuery query) {
        TableSchema ts = catalog.requireTable(query.tableName());
        List<Row> rows = executor.collect(planner.plan(query, ts));
        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (Row r : rows) {
            Map<String, String> mapped = new LinkedHashMap<>();
            List<String> cols = r.columns();
            for (int i = 0; i < cols.size(); i++) mapped.put(cols.get(i), r.value(i));
            out.add(mapped);
        }
        return out;
    }

    /** Append one record; returns the key it was stored under. */
    public String insert(InsertQuery query) {
        TableSchema ts = catalog.requireTable(query.tableName());
        boolean newTable = storage.isNewTable(ts.name());
        List<Record> records = new ArrayList<>(storage.scanTable(ts.name()));

        List<String> subset = query.columns().resolveNames(ts);
        int[] colIdx = query.columns().resolveIndexes(ts);
        List<String> values = query.values();
        if (subset.size() != values.size()) {
            throw new ColumnListMismatchException(subset.size(), values.size());
        }

        int keyIdx = ts.primaryKeyIndex();
        int suppliedKeyPos = subset.indexOf(ts.primaryKey());
        boolean autokey = suppliedKeyPos == -1;
        String key;
        if (autokey) {
            key = nextKey(ts, newTable ? List.of() : records, keyIdx);
        } else {
            key = values.get(suppliedKeyPos);
            if (!newTable) checkUnique(records, keyIdx, key);
        }

        Record rec = Record.blank(ts.columns().size());
        if (autokey) rec.set(keyIdx, key);
        for (int i = 0; i < colIdx.length; i++) rec.set(colIdx[i], values.get(i));
        records.add(rec);
        storage.writeTable(ts.name(), records);
        logger.debug("Inserted key {} into '{}'{}", key, ts.name(), autokey ? " (auto)" : "");
        return key;
    }

    /** Overwrite columns on every targeted row; returns the targeted row count. */
    public int update(UpdateQuery query) {
        TableSchema ts = catalog.requireTable(query.tableName());
        List<Record> records = storage.scanTable(ts.name());
        List<Integer> targets = targetPositions(ts, records, query.criteria());

        int[] colIdx = query.columns().resolveIndexes(ts);
        List<String> values = query.values();
        if (colIdx.length != values.size()) {
            throw new ColumnListMismatchException(colIdx.length, values.size());
        }
        if (targets.isEmpty()) return 0;

        for (int pos : targets) {
            Record rec = records.get(pos);
            for (int c = 0; c < colIdx.length; c++) rec.set(colIdx[c], values.get(c));
        }
        storage.writeTable(ts.name(), records);
        logger.debug("Updated {} row(s) in '{}'", targets.size(), ts.name());
        return targets.size();
    }

    /** Remove targeted rows, keeping the order of the rest; returns the removed count. */
    public int delete(DeleteQuery query) {
        TableSchema ts = catalog.requireTable(query.tableName());
        List<Record> records = storage.scanTable(ts.name());
        Set<Integer> targets = new HashSet<>(targetPositions(ts, records, query.criteria()));
        if (targets.isEmpty()) return 0;

        List<Record> remaining = new ArrayList<>(records.size() - targets.size());
        for (int i = 0; i < records.size(); i++) {
            if (!targets.contains(i)) remaining.add(records.get(i));
        }
        storage.writeTable(ts.name(), remaining);
        logger.debug("Deleted {} row(s) from '{}'", targets.size(), ts.name());
        return targets.size();
    }

    private List<Integer> targetPositions(TableSchema ts, List<Record> records, String criteria) {
        List<Integer> positions = new ArrayList<>();
        for (Row r : executor.collect(planner.planTargets(ts, records, criteria))) positions.add(r.position());
        return positions;
    }

    private String nextKey(TableSchema ts, List<Record> records, int keyIdx) {
        if (records.isEmpty()) return "1";
        long max = Long.MIN_VALUE;
        for (Record r : records) max = Math.max(max, Keys.numericValue(r.get(keyIdx)));
        if (max == Long.MAX_VALUE) throw new AutoKeyOverflowException(ts.name());
        return String.valueOf(max + 1);
    }

    private void checkUnique(List<Record> records, int keyIdx, String key) {
        String wanted = Keys.canonical(key);
        for (Record r : records) {
            if (Keys.canonical(r.get(keyIdx)).equals(wanted)) throw new DuplicateKeyException(key);
        }
    }
}
