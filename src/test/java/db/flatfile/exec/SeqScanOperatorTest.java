package db.flatfile.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.flatfile.DatabaseOptions;
import db.flatfile.catalog.TableSchema;
import db.flatfile.storage.Record;
import db.flatfile.storage.StorageManager;

public class SeqScanOperatorTest {

    private final TableSchema table = new TableSchema("scan_people", List.of("id", "name"), "id");

    @TempDir
    Path dir;

    @Test
    void scansFileInOrderWithPositions() {
        StorageManager storage = new StorageManager(dir, "scan", DatabaseOptions.defaults());
        storage.writeTable("scan_people", List.of(Record.of("1", "Ada"), Record.of("2", "Ben"), Record.of("3", "Cy")));

        SeqScanOperator scan = new SeqScanOperator(storage, table);
        scan.open();
        Row r;
        int count = 0;
        while ((r = scan.next()) != null) {
            assertEquals(count, r.position());
            assertEquals(String.valueOf(count + 1), r.value(0));
            count++;
        }
        scan.close();
        assertEquals(3, count);
        assertNull(scan.next());
    }

    @Test
    void missingFileScansEmpty() {
        SeqScanOperator scan = new SeqScanOperator(new StorageManager(dir, "scan", DatabaseOptions.defaults()), table);
        scan.open();
        assertNull(scan.next());
        scan.close();
    }

    @Test
    void reopenRestartsPreloadedScan() {
        SeqScanOperator scan = SeqScanOperator.over(table, List.of(Record.of("7", "Gil")));
        scan.open();
        assertNotNull(scan.next());
        assertNull(scan.next());
        scan.open();
        Row again = scan.next();
        assertEquals(0, again.position());
        assertEquals(List.of("id", "name"), again.columns());
        scan.close();
    }
}
