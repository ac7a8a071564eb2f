package db.flatfile.catalog;

import java.util.Optional;

/** Cache that never hits and forgets everything it is given. */
public final class NoOpSchemaCache implements SchemaCache {
    public static final NoOpSchemaCache INSTANCE = new NoOpSchemaCache();

    private NoOpSchemaCache() {}

    @Override
    public Optional<Schema> get(SchemaCacheKey key) { return Optional.empty(); }

    @Override
    public void put(SchemaCacheKey key, Schema schema) { }
}
