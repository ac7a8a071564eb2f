package db.flatfile.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.catalog.TableSchema;
import db.flatfile.exec.EqualityPredicate;
import db.flatfile.exec.Predicate;
import db.flatfile.exec.RegexPredicate;

/**
 * Compiles parsed Criteria into a physical Predicate against a table's columns.
 * A criteria column the table does not declare compiles to {@link Predicate#NONE}
 * (no rows match) instead of failing.
 */
public class PredicateCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PredicateCompiler.class);

    public Predicate compile(Criteria criteria, TableSchema table) {
        if (criteria == null) throw new IllegalArgumentException("criteria must not be null");
        int colIndex = table.columnIndex(criteria.columnName());
        if (colIndex == -1) {
            logger.debug("Criteria column '{}' not in table '{}'; matching nothing", criteria.columnName(), table.name());
            return Predicate.NONE;
        }
        if (criteria.regex()) {
            return RegexPredicate.compile(colIndex, criteria.patternBody());
        }
        return new EqualityPredicate(colIndex, criteria.value());
    }
}
