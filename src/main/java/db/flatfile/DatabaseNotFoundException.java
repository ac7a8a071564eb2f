package db.flatfile;

/**
 * Raised when the schema definition file is missing, unreadable or has no lines.
 */
public class DatabaseNotFoundException extends DatabaseException {

    public DatabaseNotFoundException(ErrorCode errorCode, String schemaFile) {
        super(errorCode, schemaFile);
    }
}
