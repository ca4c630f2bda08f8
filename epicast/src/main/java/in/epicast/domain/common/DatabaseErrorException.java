package in.epicast.domain.common;

/**
 * Exception thrown when the storage backend fails to execute a query
 * or fails while rows are being read.
 */
public class DatabaseErrorException extends RuntimeException {

    private final String sql;

    public DatabaseErrorException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public DatabaseErrorException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * The query text that failed, if known.
     */
    public String getSql() {
        return sql;
    }
}
