package db.flatfile.catalog;

import java.util.Optional;

/**
 * Key-value store for parsed schemas. The catalog reads it on open (when the
 * use_cache option allows) and always refreshes it after parsing a schema file.
 * Invalidation is up to the implementation.
 */
public interface SchemaCache {
    Optional<Schema> get(SchemaCacheKey key);

    void put(SchemaCacheKey key, Schema schema);
}
