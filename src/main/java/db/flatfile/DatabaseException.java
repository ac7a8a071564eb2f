package db.flatfile;

/**
 * Base class of every domain failure raised by the database.
 * I/O problems on table files are not DatabaseExceptions; they surface as
 * {@link java.io.UncheckedIOException}.
 */
public class DatabaseException extends RuntimeException {

    private final ErrorCode errorCode;

    public DatabaseException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public DatabaseException(ErrorCode errorCode, String additionalMessage) {
        super(errorCode.getMessage() + ": " + additionalMessage);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }
}
