package db.flatfile.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import db.flatfile.catalog.TableSchema;
import db.flatfile.exec.Predicate;
import db.flatfile.exec.Row;
import db.flatfile.storage.Record;

public class PredicateCompilerTest {

    private final TableSchema schema = new TableSchema("students", List.of("id", "name", "active"), "id");
    private final CriteriaParser parser = new CriteriaParser();
    private final PredicateCompiler pc = new PredicateCompiler();

    private Row row(String... vals) {
        return Row.of(new Record(List.of(vals)), 0, schema.columns());
    }

    private Predicate compile(String criteria) {
        return pc.compile(parser.parse(criteria, schema.primaryKey()), schema);
    }

    @Test
    void equalityIsExactText() {
        Predicate p = compile("name=Sherlock");
        assertTrue(p.test(row("1", "Sherlock", "1")));
        assertFalse(p.test(row("1", "sherlock", "1")));
    }

    @Test
    void bareValueMatchesKey() {
        Predicate p = compile("12");
        assertTrue(p.test(row("12", "x", "")));
        assertFalse(p.test(row("13", "x", "")));
    }

    @Test
    void booleanCriteria() {
        Predicate active = compile("active=true");
        Predicate inactive = compile("active=false");
        assertTrue(active.test(row("1", "a", "1")));
        assertTrue(inactive.test(row("2", "b", "")));
        assertFalse(inactive.test(row("1", "a", "1")));
    }

    @Test
    void regexIgnoresCase() {
        Predicate p = compile("name=/S/");
        assertTrue(p.test(row("12", "sherlock", "")));
        assertTrue(p.test(row("47", "watson", "")));
        assertFalse(p.test(row("23", "charlie", "")));
    }

    @Test
    void unknownColumnMatchesNothing() {
        assertSame(Predicate.NONE, compile("update_date=1"));
    }
}
