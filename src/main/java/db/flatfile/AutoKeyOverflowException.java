package db.flatfile;

/**
 * Raised when the next automatic key would exceed {@code Long.MAX_VALUE}.
 */
public class AutoKeyOverflowException extends DatabaseException {

    public AutoKeyOverflowException(String tableName) {
        super(ErrorCode.AUTOKEY_FAIL, "table " + tableName);
    }
}
