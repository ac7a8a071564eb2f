package db.flatfile.storage;

/**
 * Byte values separating fields and rows in a table data file.
 */
public enum Delimiters {
    // ASCII unit separator / record separator
    STANDARD((byte) 31, (byte) 30),
    // Pre-2.0 data files
    LEGACY((byte) 200, (byte) 201);

    private final byte column;
    private final byte row;

    Delimiters(byte column, byte row) {
        this.column = column;
        this.row = row;
    }

    public byte column() { return column; }
    public byte row() { return row; }

    public char columnChar() { return (char) (column & 0xFF); }
    public char rowChar() { return (char) (row & 0xFF); }
}
