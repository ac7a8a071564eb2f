package db.flatfile.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.DatabaseOptions;

/**
 * Reads and rewrites whole table data files. Stateless apart from naming:
 * every read decodes the file afresh and every write replaces it entirely.
 * No locking; a concurrent writer in another process can interleave.
 */
public class StorageManager {
    private static final Logger logger = LoggerFactory.getLogger(StorageManager.class);

    private final Path datapath;
    private final String databaseName;
    private final DatabaseOptions options;
    private final RecordCodec codec;

    public StorageManager(Path datapath, String databaseName, DatabaseOptions options) {
        this.datapath = datapath;
        this.databaseName = databaseName;
        this.options = options;
        this.codec = new RecordCodec(options.delimiters());
    }

    /** {@code <datapath>/[<db>.]<table>.dtf} */
    public Path tableFile(String tableName) {
        String prefix = options.prependDatabaseNameToTableFilename ? databaseName + "." : "";
        return datapath.resolve(prefix + tableName + DatabaseOptions.DATA_EXTENSION);
    }

    public List<Record> scanTable(String tableName) {
        Path file = tableFile(tableName);
        if (!Files.exists(file)) return List.of();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading table file " + file, e);
        }
        List<Record> records = codec.decode(bytes);
        logger.debug("Read {} row(s) from {}", records.size(), file);
        return records;
    }

    /**
     * Replace the table file with the given records (truncate and write).
     * Callers must not treat the records as persisted until this returns.
     */
    public void writeTable(String tableName, List<Record> records) {
        Path file = tableFile(tableName);
        byte[] bytes = codec.encode(records);
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(file, bytes,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing table file " + file, e);
        }
        logger.debug("Wrote {} row(s) to {}", records.size(), file);
    }

    /** True when the table file is absent, empty or whitespace only. */
    public boolean isNewTable(String tableName) {
        Path file = tableFile(tableName);
        if (!Files.exists(file)) return true;
        try {
            if (Files.size(file) == 0) return true;
            for (byte b : Files.readAllBytes(file)) {
                if (b != ' ' && b != '\t' && b != '\n' && b != '\r' && b != '\f' && b != 0x0B) return false;
            }
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading table file " + file, e);
        }
    }
}
