package db.flatfile;

public class DuplicateKeyException extends DatabaseException {

    private final String key;

    public DuplicateKeyException(String key) {
        super(ErrorCode.KEY_NOT_UNIQUE, key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
