package db.flatfile;

/**
 * Classification of the failures a database operation can raise.
 */
public enum ErrorCode {
    DBD_FILE_MISSING("DBD file missing or not readable"),
    MISSING_TABLE_PARAM("No table parameter"),
    TABLE_NOT_FOUND("Table not found"),
    KEY_NOT_UNIQUE("Invalid key (not unique)"),
    DBD_FILE_EMPTY("DBD file empty"),
    INVALID_COLUMN_NAME("Column name(s) do not exist"),
    COLUMN_LIST_MISMATCH("Input column list not same length of input data"),
    AUTOKEY_FAIL("Cannot auto assign next key id, out of bounds");

    private final String message;

    ErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
