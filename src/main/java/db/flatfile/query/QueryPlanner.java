package db.flatfile.query;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.catalog.TableSchema;
import db.flatfile.exec.FilterOperator;
import db.flatfile.exec.Operator;
import db.flatfile.exec.ProjectionOperator;
import db.flatfile.exec.SeqScanOperator;
import db.flatfile.exec.SortOperator;
import db.flatfile.storage.Record;
import db.flatfile.storage.StorageManager;

/**
 * Builds operator pipelines:
 *   select:        SeqScan -> [Filter] -> [Sort] -> Projection
 *   update/delete: SeqScan(loaded records) -> [Filter]
 * Unknown criteria/order columns are tolerated (empty match / no sort);
 * unknown projection columns are not.
 */
public class QueryPlanner {
    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    private final StorageManager storage;
    private final CriteriaParser criteriaParser = new CriteriaParser();
    private final PredicateCompiler compiler;

    public QueryPlanner(StorageManager storage, PredicateCompiler compiler) {
        this.storage = storage;
        this.compiler = compiler;
    }

    public Operator plan(SelectQuery query, TableSchema table) {
        // Validate the projection before touching the table file
        int[] projection = query.columns().resolveIndexes(table);

        Operator root = withCriteria(new SeqScanOperator(storage, table), table, query.criteria());

        OrderSpec order = OrderSpec.parse(query.order());
        if (order != null) {
            int idx = table.columnIndex(order.columnName());
            if (idx == -1) {
                logger.debug("Order column '{}' not in table '{}'; keeping file order", order.columnName(), table.name());
            } else {
                root = new SortOperator(root, idx, order.descending());
            }
        }
        return new ProjectionOperator(root, projection);
    }

    /** Rows of an already loaded record set that the criteria selects (all rows when blank). */
    public Operator planTargets(TableSchema table, List<Record> records, String criteria) {
        return withCriteria(SeqScanOperator.over(table, records), table, criteria);
    }

    private Operator withCriteria(Operator child, TableSchema table, String criteria) {
        if (criteria == null || criteria.isBlank()) return child;
        Criteria parsed = criteriaParser.parse(criteria, table.primaryKey());
        return new FilterOperator(child, compiler.compile(parsed, table));
    }
}
