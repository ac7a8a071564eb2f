package db.flatfile.catalog;

import java.nio.file.Path;

// Identifies a cached schema: one entry per data directory + database name.
public record SchemaCacheKey(Path datapath, String databaseName) {
}
