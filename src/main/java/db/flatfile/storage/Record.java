package db.flatfile.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a table: text values in column order. Carries no schema; the
 * number of values is whatever the data file held and may differ from the
 * declared column count.
 */
public class Record {
    private final List<String> values;
    // File bytes of fields that were not valid text; written back untouched until set
    private Map<Integer, byte[]> rawFields;

    public Record(Collection<String> values) {
        this.values = new ArrayList<>(values);
    }

    public static Record of(String... values) {
        return new Record(List.of(values));
    }

    // Blank record: every position empty text
    public static Record blank(int width) {
        List<String> vals = new ArrayList<>(width);
        for (int i = 0; i < width; i++) vals.add("");
        return new Record(vals);
    }

    public List<String> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /** Value at position, or empty text when the row is shorter. */
    public String get(int index) {
        return index >= 0 && index < values.size() ? values.get(index) : "";
    }

    /** Overwrite a position, padding a short row with empty values first. */
    public void set(int index, String value) {
        while (values.size() <= index) values.add("");
        values.set(index, value);
        if (rawFields != null) rawFields.remove(index);
    }

    void keepRawField(int index, byte[] bytes) {
        if (rawFields == null) rawFields = new HashMap<>();
        rawFields.put(index, bytes);
    }

    /** Original file bytes of an undecodable field, or null. */
    byte[] rawField(int index) {
        return rawFields == null ? null : rawFields.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
