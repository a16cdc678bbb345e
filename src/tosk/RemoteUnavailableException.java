package tosk;

/** The remote store could not be reached (connection error or timeout). */
public class RemoteUnavailableException extends BackupException {

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
