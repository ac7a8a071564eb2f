package db.flatfile.query;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class KeysTest {

    @Test
    void numericValueUsesLeadingInteger() {
        assertEquals(47, Keys.numericValue("47"));
        assertEquals(12, Keys.numericValue(" 12abc"));
        assertEquals(-3, Keys.numericValue("-3"));
        assertEquals(0, Keys.numericValue("abc"));
        assertEquals(0, Keys.numericValue(""));
        assertEquals(Long.MAX_VALUE, Keys.numericValue("99999999999999999999"));
    }

    @Test
    void canonicalFormOfIntegers() {
        assertEquals("12", Keys.canonical("012"));
        assertEquals("12", Keys.canonical(" 12 "));
        assertEquals("12", Keys.canonical("+12"));
        assertEquals("A-12", Keys.canonical("A-12"));
        assertEquals("1.0", Keys.canonical("1.0"));
    }
}
