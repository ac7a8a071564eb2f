package db.flatfile;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import db.flatfile.storage.Delimiters;

public class DatabaseOptionsTest {

    @Test
    void defaults() {
        DatabaseOptions o = DatabaseOptions.defaults();
        assertFalse(o.prependDatabaseNameToTableFilename);
        assertTrue(o.useCache);
        assertFalse(o.legacyDelimiterMode);
        assertEquals(Delimiters.STANDARD, o.delimiters());
        assertTrue(DatabaseOptions.fromMap(null).useCache);
    }

    @Test
    void fromMapAcceptsLooseBooleans() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(DatabaseOptions.PREPEND_DATABASE_NAME, "yes");
        m.put(DatabaseOptions.USE_CACHE, 0);
        m.put(DatabaseOptions.COMPAT_LEGACY_DELIMITERS, "On");
        m.put("colour", "blue");
        DatabaseOptions o = DatabaseOptions.fromMap(m);
        assertTrue(o.prependDatabaseNameToTableFilename);
        assertFalse(o.useCache);
        assertEquals(Delimiters.LEGACY, o.delimiters());
    }

    @Test
    void laterCacheKeyWins() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(DatabaseOptions.NO_CACHE, true);
        m.put(DatabaseOptions.USE_CACHE, true);
        assertTrue(DatabaseOptions.fromMap(m).useCache);

        m = new LinkedHashMap<>();
        m.put(DatabaseOptions.USE_CACHE, true);
        m.put(DatabaseOptions.NO_CACHE, "1");
        assertFalse(DatabaseOptions.fromMap(m).useCache);
    }

    @Test
    void invalidBooleanRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> DatabaseOptions.fromMap(Map.of(DatabaseOptions.USE_CACHE, "maybe")));
        assertFalse(DatabaseOptions.toBoolean(null));
        assertFalse(DatabaseOptions.toBoolean(" "));
        assertTrue(DatabaseOptions.toBoolean(2.5));
    }

    @Test
    void fromProperties() {
        Properties p = new Properties();
        p.setProperty(DatabaseOptions.PREPEND_DATABASE_NAME, "true");
        DatabaseOptions o = DatabaseOptions.fromProperties(p);
        assertTrue(o.prependDatabaseNameToTableFilename);
        assertTrue(o.useCache);
    }

    @Test
    void asMapReportsEffectiveSettings() {
        Map<String, Boolean> m = DatabaseOptions.defaults().withUseCache(false).withPrependDatabaseName(true).asMap();
        assertEquals(Boolean.TRUE, m.get(DatabaseOptions.PREPEND_DATABASE_NAME));
        assertEquals(Boolean.FALSE, m.get(DatabaseOptions.USE_CACHE));
        assertEquals(2, m.size());
    }
}
