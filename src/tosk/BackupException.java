package tosk;

/**
 * Base type for failures of a single push or pull. Callers at the operation boundary
 * turn these into one status line each.
 */
public class BackupException extends Exception {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
