package db.flatfile.query;

import java.util.ArrayList;
import java.util.List;

import db.flatfile.exec.Operator;
import db.flatfile.exec.Row;

/**
 * Drains a planned operator pipeline into a list.
 * The root operator is closed even when a row fails to evaluate.
 */
public class QueryExecutor {

    public List<Row> collect(Operator op) {
        List<Row> out = new ArrayList<>();
        op.open();
        try {
            for (Row r = op.next(); r != null; r = op.next()) out.add(r);
        } finally {
            op.close();
        }
        return out;
    }
}
