package db.flatfile.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class JsonSchemaCacheTest {

    @TempDir
    Path dir;

    private final JsonSchemaCache cache = new JsonSchemaCache();

    @Test
    void putThenGetReturnsSameSchema() {
        SchemaCacheKey key = new SchemaCacheKey(dir, "school");
        Schema schema = new Schema(List.of(
            new TableSchema("students", List.of("id", "name"), "id"),
            new TableSchema("rooms", List.of("code", "floor"), "code")));
        cache.put(key, schema);

        assertTrue(Files.exists(dir.resolve(".school.dbd.cache")));
        Optional<Schema> loaded = cache.get(key);
        assertTrue(loaded.isPresent());
        assertEquals(schema, loaded.get());
    }

    @Test
    void missingFileIsAMiss() {
        assertTrue(cache.get(new SchemaCacheKey(dir, "absent")).isEmpty());
    }

    @Test
    void malformedFileIsAMiss() throws IOException {
        Files.writeString(dir.resolve(".broken.dbd.cache"), "{ not json ]");
        assertTrue(cache.get(new SchemaCacheKey(dir, "broken")).isEmpty());
    }
}
