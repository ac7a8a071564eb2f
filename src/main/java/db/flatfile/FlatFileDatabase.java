package db.flatfile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.catalog.CatalogManager;
import db.flatfile.catalog.JsonSchemaCache;
import db.flatfile.catalog.SchemaCache;
import db.flatfile.query.ColumnList;
import db.flatfile.query.DeleteQuery;
import db.flatfile.query.InsertQuery;
import db.flatfile.query.QueryProcessor;
import db.flatfile.query.SelectQuery;
import db.flatfile.query.UpdateQuery;
import db.flatfile.storage.StorageManager;

/**
 * A database of delimited text files described by {@code <datapath>/<name>.dbd}.
 *
 * <pre>
 * FlatFileDatabase db = FlatFileDatabase.open(Path.of("data"), "library");
 * db.insert("books", "title, author", List.of("Dune", "Herbert"));
 * List&lt;Map&lt;String, String&gt;&gt; rows = db.select("books", "id,title", "author=/herb/", "title desc");
 * </pre>
 *
 * Column lists are comma separated strings or lists; "*" or blank means all
 * columns. Criteria are {@code COLUMN=VALUE}, {@code COLUMN=/regex/} or a bare
 * key value. Order is {@code COLUMN [ASC|DESC]}.
 *
 * Not thread safe and not safe against other processes writing the same files.
 */
public class FlatFileDatabase {
    private static final Logger logger = LoggerFactory.getLogger(FlatFileDatabase.class);

    private final String databaseName;
    private final DatabaseOptions options;
    private final CatalogManager catalog;
    private final StorageManager storage;
    private final QueryProcessor processor;

    public FlatFileDatabase(Path datapath, String databaseName, DatabaseOptions options, SchemaCache cache) {
        if (datapath == null) throw new IllegalArgumentException("datapath must not be null");
        if (databaseName == null) throw new IllegalArgumentException("databaseName must not be null");
        this.databaseName = databaseName;
        this.options = options == null ? DatabaseOptions.defaults() : options;
        this.catalog = new CatalogManager(datapath, databaseName, this.options, cache);
        this.storage = new StorageManager(datapath, databaseName, this.options);
        this.processor = new QueryProcessor(catalog, storage);
        logger.debug("Opened '{}' at {} with {}", databaseName, datapath, this.options);
    }

    public static FlatFileDatabase open(Path datapath, String databaseName) {
        return open(datapath, databaseName, DatabaseOptions.defaults());
    }

    public static FlatFileDatabase open(Path datapath, String databaseName, DatabaseOptions options) {
        return new FlatFileDatabase(datapath, databaseName, options, new JsonSchemaCache());
    }

    public static FlatFileDatabase open(Path datapath, String databaseName, Map<String, ?> options) {
        return open(datapath, databaseName, DatabaseOptions.fromMap(options));
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public DatabaseOptions getOptions() {
        return options;
    }

    // ---- introspection

    public List<String> listTables() {
        return catalog.listTables();
    }

    public List<String> tableSchema(String tableName) {
        return catalog.tableColumns(tableName);
    }

    public String primaryKey(String tableName) {
        return catalog.primaryKey(tableName);
    }

    // ---- select

    public List<Map<String, String>> select(String table) {
        return processor.select(new SelectQuery(table));
    }

    public List<Map<String, String>> select(String table, String columns) {
        return select(table, columns, "", "");
    }

    public List<Map<String, String>> select(String table, String columns, String criteria) {
        return select(table, columns, criteria, "");
    }

    public List<Map<String, String>> select(String table, String columns, String criteria, String order) {
        return processor.select(new SelectQuery(table, ColumnList.parse(columns), criteria, order));
    }

    public List<Map<String, String>> select(String table, List<String> columns, String criteria, String order) {
        return processor.select(new SelectQuery(table, ColumnList.of(columns), criteria, order));
    }

    // ---- insert

    /** Insert into every column in schema order. */
    public String insert(String table, List<?> values) {
        return insert(table, "*", values);
    }

    public String insert(String table, String columns, List<?> values) {
        return processor.insert(new InsertQuery(table, ColumnList.parse(columns), asText(values)));
    }

    public String insert(String table, List<String> columns, List<?> values) {
        return processor.insert(new InsertQuery(table, ColumnList.of(columns), asText(values)));
    }

    // ---- update

    public int update(String table, String columns, List<?> values) {
        return update(table, columns, values, "");
    }

    public int update(String table, String columns, List<?> values, String criteria) {
        return processor.update(new UpdateQuery(table, ColumnList.parse(columns), asText(values), criteria));
    }

    public int update(String table, List<String> columns, List<?> values, String criteria) {
        return processor.update(new UpdateQuery(table, ColumnList.of(columns), asText(values), criteria));
    }

    // ---- delete

    /** Remove every row. */
    public int delete(String table) {
        return delete(table, "");
    }

    public int delete(String table, String criteria) {
        return processor.delete(new DeleteQuery(table, criteria));
    }

    // Values may be numbers or other objects; stored as text, null as empty
    private static List<String> asText(List<?> values) {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        List<String> out = new ArrayList<>(values.size());
        for (Object v : values) out.add(v == null ? "" : String.valueOf(v));
        return out;
    }
}
