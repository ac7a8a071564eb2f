package db.flatfile.query;

/**
 * Parsed {@code COLUMN=VALUE} filter. When regex is true the value keeps its
 * surrounding slashes; {@link #patternBody()} strips them.
 */
public record Criteria(String columnName, String value, boolean regex) {

    public String patternBody() {
        return regex ? value.substring(1, value.length() - 1) : value;
    }
}
