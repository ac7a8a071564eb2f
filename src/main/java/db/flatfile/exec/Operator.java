package db.flatfile.exec;

import java.util.List;

/**
 * Minimal physical operator interface
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /** Column names of the produced rows. */
    List<String> columns();
}
