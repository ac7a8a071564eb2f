package db.flatfile.catalog;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.DatabaseOptions;
import db.flatfile.MissingTableParamException;
import db.flatfile.TableNotFoundException;

/**
 * Holds the schema of one database for the lifetime of the owning object.
 * Loaded once: from the cache when allowed, otherwise by parsing the schema
 * file (which always refreshes the cache). Never mutated afterwards.
 */
public class CatalogManager {
    private static final Logger logger = LoggerFactory.getLogger(CatalogManager.class);

    private final Schema schema;
    private final boolean fromCache;

    public CatalogManager(Path datapath, String databaseName, DatabaseOptions options, SchemaCache cache) {
        this(datapath, databaseName, options, cache, new SchemaParser());
    }

    public CatalogManager(Path datapath, String databaseName, DatabaseOptions options,
                          SchemaCache cache, SchemaParser parser) {
        SchemaCacheKey key = new SchemaCacheKey(datapath, databaseName);
        Optional<Schema> cached = options.useCache ? cache.get(key) : Optional.empty();
        if (cached.isPresent()) {
            this.schema = cached.get();
            this.fromCache = true;
        } else {
            this.schema = parser.parse(schemaFile(datapath, databaseName));
            this.fromCache = false;
            cache.put(key, schema);
        }
        logger.info("Loaded schema for '{}': {} table(s), cache {}", databaseName,
            schema.tableNames().size(), fromCache ? "hit" : "miss");
    }

    // Catalog over an already built schema (tests, embedding)
    public CatalogManager(Schema schema) {
        this.schema = schema;
        this.fromCache = false;
    }

    public static Path schemaFile(Path datapath, String databaseName) {
        return datapath.resolve(databaseName + DatabaseOptions.SCHEMA_EXTENSION);
    }

    public boolean loadedFromCache() {
        return fromCache;
    }

    /** Table definition or null when absent (no validation). */
    public TableSchema getTableSchema(String name) {
        return schema.find(name).orElse(null);
    }

    public TableSchema requireTable(String name) {
        if (name == null || name.isBlank()) throw new MissingTableParamException();
        TableSchema ts = getTableSchema(name);
        if (ts == null || ts.isDegenerate()) throw new TableNotFoundException(name);
        return ts;
    }

    public List<String> listTables() {
        return schema.tableNames();
    }

    public List<String> tableColumns(String name) {
        return requireTable(name).columns();
    }

    public String primaryKey(String name) {
        return requireTable(name).primaryKey();
    }
}
