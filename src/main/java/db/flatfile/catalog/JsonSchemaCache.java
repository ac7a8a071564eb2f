package db.flatfile.catalog;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import db.flatfile.DatabaseOptions;

/**
 * Schema cache persisted as JSON next to the schema file:
 * {@code <datapath>/.<databaseName>.dbd.cache}.
 * Unreadable or malformed cache files (Gson parse or record binding errors)
 * count as a miss.
 */
public class JsonSchemaCache implements SchemaCache {
    private static final Logger logger = LoggerFactory.getLogger(JsonSchemaCache.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public static Path cacheFile(SchemaCacheKey key) {
        return key.datapath().resolve("." + key.databaseName() + DatabaseOptions.SCHEMA_EXTENSION + ".cache");
    }

    @Override
    public Optional<Schema> get(SchemaCacheKey key) {
        Path file = cacheFile(key);
        if (!Files.exists(file)) return Optional.empty();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Schema loaded = gson.fromJson(reader, Schema.class);
            if (loaded == null || loaded.tables() == null) {
                logger.warn("Ignoring empty schema cache file: {}", file);
                return Optional.empty();
            }
            logger.debug("Loaded schema for '{}' from cache {}", key.databaseName(), file);
            return Optional.of(loaded);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed loading schema cache file: {}", file, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(SchemaCacheKey key, Schema schema) {
        Path file = cacheFile(key);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(schema, writer);
            logger.debug("Wrote schema cache {}", file);
        } catch (IOException e) {
            logger.warn("Failed saving schema cache file: {}", file, e);
        }
    }
}
