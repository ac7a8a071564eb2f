package db.flatfile;

public class TableNotFoundException extends DatabaseException {

    public TableNotFoundException(String tableName) {
        super(ErrorCode.TABLE_NOT_FOUND, tableName);
    }

    protected TableNotFoundException(ErrorCode errorCode) {
        super(errorCode);
    }
}
