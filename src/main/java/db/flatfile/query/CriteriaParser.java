package db.flatfile.query;

/**
 * Parses criteria strings:
 *   id=12        column id equals "12"
 *   name = /s/   column name matches /s/ (case-insensitive)
 *   12           bare value, compared against the primary key column
 * Splits on the first '=' only. "true" becomes "1" and "false" becomes ""
 * before the regex check.
 */
public class CriteriaParser {

    public Criteria parse(String raw, String primaryKey) {
        if (raw == null) throw new IllegalArgumentException("criteria must not be null");
        String column;
        String value;
        int eq = raw.indexOf('=');
        if (eq >= 0) {
            column = raw.substring(0, eq).trim();
            value = raw.substring(eq + 1).trim();
        } else {
            column = primaryKey;
            value = raw.trim();
        }
        if (value.equals("true")) value = "1";
        else if (value.equals("false")) value = "";
        boolean regex = value.length() >= 2 && value.startsWith("/") && value.endsWith("/");
        return new Criteria(column, value, regex);
    }
}
