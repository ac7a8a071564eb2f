package db.flatfile.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.flatfile.DatabaseOptions;

public class StorageManagerTest {

    @TempDir
    Path dir;

    @Test
    void tableFileNaming() {
        StorageManager plain = new StorageManager(dir, "school", DatabaseOptions.defaults());
        StorageManager prefixed = new StorageManager(dir, "school", DatabaseOptions.defaults().withPrependDatabaseName(true));
        assertEquals(dir.resolve("students.dtf"), plain.tableFile("students"));
        assertEquals(dir.resolve("school.students.dtf"), prefixed.tableFile("students"));
    }

    @Test
    void writeReadRewriteLifecycle() {
        StorageManager storage = new StorageManager(dir, "school", DatabaseOptions.defaults());
        assertTrue(storage.scanTable("people").isEmpty());
        assertTrue(storage.isNewTable("people"));

        storage.writeTable("people", List.of(Record.of("1", "Alice"), Record.of("2", "Bob")));
        assertFalse(storage.isNewTable("people"));
        assertEquals(2, storage.scanTable("people").size());

        // full overwrite, never append
        storage.writeTable("people", List.of(Record.of("2", "Bob")));
        List<Record> remaining = storage.scanTable("people");
        assertEquals(1, remaining.size());
        assertEquals("Bob", remaining.get(0).get(1));

        storage.writeTable("people", List.of());
        assertTrue(storage.isNewTable("people"));
    }

    @Test
    void whitespaceOnlyFileIsNew() throws IOException {
        StorageManager storage = new StorageManager(dir, "school", DatabaseOptions.defaults());
        Files.writeString(dir.resolve("people.dtf"), " \n\t\n");
        assertTrue(storage.isNewTable("people"));
        assertTrue(storage.scanTable("people").isEmpty());
    }
}
