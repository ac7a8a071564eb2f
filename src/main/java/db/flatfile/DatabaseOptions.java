package db.flatfile;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.storage.Delimiters;

/**
 * Construction-time settings of a database. Immutable once built.
 *
 * Recognized option keys (map or properties form):
 *   prepend_databasename_to_table_filename  table files named "db.table.dtf"
 *   use_cache                               read the schema cache on open
 *   no_cache                                legacy negated alias of use_cache
 *   compat_legacy_delimiters                use bytes 200/201 as delimiters
 */
public class DatabaseOptions {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseOptions.class);

    public static final String PREPEND_DATABASE_NAME = "prepend_databasename_to_table_filename";
    public static final String USE_CACHE = "use_cache";
    public static final String NO_CACHE = "no_cache";
    public static final String COMPAT_LEGACY_DELIMITERS = "compat_legacy_delimiters";

    public static final String SCHEMA_EXTENSION = ".dbd";
    public static final String DATA_EXTENSION = ".dtf";

    public final boolean prependDatabaseNameToTableFilename;
    public final boolean useCache;
    public final boolean legacyDelimiterMode;

    public DatabaseOptions(boolean prependDatabaseNameToTableFilename,
                           boolean useCache,
                           boolean legacyDelimiterMode) {
        this.prependDatabaseNameToTableFilename = prependDatabaseNameToTableFilename;
        this.useCache = useCache;
        this.legacyDelimiterMode = legacyDelimiterMode;
    }

    public static DatabaseOptions defaults() {
        return new DatabaseOptions(false, true, false);
    }

    public static DatabaseOptions fromMap(Map<String, ?> options) {
        boolean prepend = false;
        boolean useCache = true;
        boolean legacy = false;
        if (options == null) return defaults();

        // Applied in iteration order, so a later use_cache/no_cache wins
        for (Map.Entry<String, ?> e : options.entrySet()) {
            String key = e.getKey();
            if (key == null) continue;
            switch (key) {
                case PREPEND_DATABASE_NAME -> prepend = toBoolean(e.getValue());
                case USE_CACHE -> useCache = toBoolean(e.getValue());
                case NO_CACHE -> useCache = !toBoolean(e.getValue());
                case COMPAT_LEGACY_DELIMITERS -> legacy = toBoolean(e.getValue());
                default -> logger.debug("Ignoring unknown option '{}'", key);
            }
        }
        return new DatabaseOptions(prepend, useCache, legacy);
    }

    public static DatabaseOptions fromProperties(Properties props) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (props != null) {
            for (String name : props.stringPropertyNames()) map.put(name, props.getProperty(name));
        }
        return fromMap(map);
    }

    static boolean toBoolean(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0;
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "1", "yes", "on" -> true;
            case "", "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Not a boolean option value: " + value);
        };
    }

    public Delimiters delimiters() {
        return legacyDelimiterMode ? Delimiters.LEGACY : Delimiters.STANDARD;
    }

    /** Effective filename and cache settings, keyed like the option map. */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        out.put(PREPEND_DATABASE_NAME, prependDatabaseNameToTableFilename);
        out.put(USE_CACHE, useCache);
        return out;
    }

    public DatabaseOptions withUseCache(boolean useCache) {
        return new DatabaseOptions(prependDatabaseNameToTableFilename, useCache, legacyDelimiterMode);
    }

    public DatabaseOptions withPrependDatabaseName(boolean prepend) {
        return new DatabaseOptions(prepend, useCache, legacyDelimiterMode);
    }

    public DatabaseOptions withLegacyDelimiters(boolean legacy) {
        return new DatabaseOptions(prependDatabaseNameToTableFilename, useCache, legacy);
    }

    @Override
    public String toString() {
        return "DatabaseOptions{prepend=" + prependDatabaseNameToTableFilename
            + ", useCache=" + useCache + ", legacyDelimiters=" + legacyDelimiterMode + "}";
    }
}
