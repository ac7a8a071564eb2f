package db.flatfile;

/**
 * Raised when an operation receives a null or blank table name.
 */
public class MissingTableParamException extends TableNotFoundException {

    public MissingTableParamException() {
        super(ErrorCode.MISSING_TABLE_PARAM);
    }
}
