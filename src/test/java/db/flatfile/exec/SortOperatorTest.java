package db.flatfile.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import db.flatfile.catalog.TableSchema;
import db.flatfile.query.QueryExecutor;
import db.flatfile.storage.Record;

public class SortOperatorTest {

    private final TableSchema table = new TableSchema("elementary", List.of("id", "name", "date"), "id");

    private List<String> ids(List<Row> rows) {
        List<String> out = new ArrayList<>();
        for (Row r : rows) out.add(r.value(0));
        return out;
    }

    private List<Row> run(List<Record> records, int column, boolean desc) {
        Operator op = new SortOperator(SeqScanOperator.over(table, records), column, desc);
        return new QueryExecutor().collect(op);
    }

    @Test
    void tiesKeepOriginalOrder() {
        List<Record> records = List.of(
            Record.of("12", "james", "1925-09-09"),
            Record.of("47", "james", "1931-10-31"),
            Record.of("23", "charlie", "2020-01-16"));
        assertEquals(List.of("23", "12", "47"), ids(run(records, 1, false)));
    }

    @Test
    void descendingReversesAscending() {
        List<Record> records = List.of(
            Record.of("12", "james"),
            Record.of("47", "alice"),
            Record.of("23", "charlie"));
        assertEquals(List.of("12", "23", "47"), ids(run(records, 1, true)));
    }

    @Test
    void manyIdenticalKeysStayStable() {
        List<Record> records = new ArrayList<>();
        for (int i = 0; i < 200; i++) records.add(Record.of(String.valueOf(i), i % 2 == 0 ? "same" : "a"));
        List<String> ids = ids(run(records, 1, false));
        List<String> expected = new ArrayList<>();
        for (int i = 1; i < 200; i += 2) expected.add(String.valueOf(i));
        for (int i = 0; i < 200; i += 2) expected.add(String.valueOf(i));
        assertEquals(expected, ids);
    }

    @Test
    void positionsSurviveSorting() {
        List<Row> rows = run(List.of(Record.of("2", "b"), Record.of("1", "a")), 0, false);
        assertEquals(1, rows.get(0).position());
        assertEquals(0, rows.get(1).position());
    }
}
