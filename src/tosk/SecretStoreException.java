package tosk;

/**
 * One of the two conditions that stop the program: the secret store could not be
 * unlocked, or a required value was left blank. {@link ToskCli} decides how to exit.
 */
public class SecretStoreException extends Exception {

    public enum Reason { WRONG_MASTER_PASSWORD, BLANK_REQUIRED_VALUE }

    private final Reason reason;

    public SecretStoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SecretStoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
