package db.flatfile.exec;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Case-insensitive pattern search on one column. Unanchored: "s" matches "watson".
 */
public class RegexPredicate implements Predicate {
    private static final Logger logger = LoggerFactory.getLogger(RegexPredicate.class);

    private final int columnIndex;
    private final Pattern pattern;

    public RegexPredicate(int columnIndex, Pattern pattern) {
        this.columnIndex = columnIndex;
        this.pattern = pattern;
    }

    /** Predicate for the pattern body; an invalid body matches nothing. */
    public static Predicate compile(int columnIndex, String body) {
        try {
            return new RegexPredicate(columnIndex, Pattern.compile(body, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        } catch (PatternSyntaxException e) {
            logger.warn("Invalid criteria pattern /{}/, matching nothing: {}", body, e.getDescription());
            return Predicate.NONE;
        }
    }

    @Override
    public boolean test(Row row) {
        return pattern.matcher(row.value(columnIndex)).find();
    }

    @Override
    public String toString() { return "col[" + columnIndex + "] ~ /" + pattern.pattern() + "/i"; }
}
