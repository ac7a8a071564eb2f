package db.flatfile;

public class ColumnListMismatchException extends DatabaseException {

    public ColumnListMismatchException(int expected, int actual) {
        super(ErrorCode.COLUMN_LIST_MISMATCH, "got " + actual + " but expected " + expected);
    }
}
