package tosk;

/** A secret needed for the remote call (token, owner or repository) is not configured. */
public class MissingCredentialException extends BackupException {

    private final String credentialName;

    public MissingCredentialException(String credentialName) {
        super(credentialName + " is not set. Run the setup again to provide it.");
        this.credentialName = credentialName;
    }

    public String credentialName() {
        return credentialName;
    }
}
