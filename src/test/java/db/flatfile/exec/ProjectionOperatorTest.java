package db.flatfile.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import db.flatfile.catalog.TableSchema;
import db.flatfile.query.QueryExecutor;
import db.flatfile.storage.Record;

public class ProjectionOperatorTest {

    @Test
    void reordersAndNamesColumns() {
        TableSchema table = new TableSchema("t", List.of("id", "name", "date"), "id");
        Operator root = new ProjectionOperator(SeqScanOperator.over(table, List.of(Record.of("12", "sherlock"))), new int[] {2, 0});
        assertEquals(List.of("date", "id"), root.columns());
        List<Row> rows = new QueryExecutor().collect(root);
        assertEquals(List.of("", "12"), rows.get(0).values());
        assertEquals(0, rows.get(0).position());
    }
}
