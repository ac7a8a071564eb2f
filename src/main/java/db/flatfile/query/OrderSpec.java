package db.flatfile.query;

import java.util.Locale;

/**
 * Sort clause "{@code <column> [ASC|DESC]}". Direction is case-insensitive and
 * defaults to ascending; any direction other than DESC is ascending.
 */
public record OrderSpec(String columnName, boolean descending) {

    /** Parsed spec, or null for a null/blank input. */
    public static OrderSpec parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String[] parts = raw.trim().split("\\s+", 2);
        boolean desc = parts.length > 1 && parts[1].trim().toLowerCase(Locale.ROOT).equals("desc");
        return new OrderSpec(parts[0], desc);
    }
}
