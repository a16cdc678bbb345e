package tosk;

/**
 * Immutable snapshot of the unlocked secrets handed to the synchronizer.
 * Built once after the secret store is unlocked and passed explicitly; nothing is
 * copied into process-wide state.
 */
public final class SyncSettings {

    public final String token;
    public final String dataPassphrase; // "" means backups are not encrypted
    public final String owner;
    public final String repo;

    public SyncSettings(String token, String dataPassphrase, String owner, String repo) {
        this.token = token == null ? "" : token;
        this.dataPassphrase = dataPassphrase == null ? "" : dataPassphrase;
        this.owner = owner == null ? "" : owner;
        this.repo = repo == null ? "" : repo;
    }

    public static SyncSettings fromBundle(SecretBundle bundle) {
        return new SyncSettings(
                bundle.get(SecretBundle.GITHUB_TOKEN),
                bundle.get(SecretBundle.ENCRYPTION_PASSPHRASE),
                bundle.get(SecretBundle.GITHUB_OWNER),
                bundle.get(SecretBundle.GITHUB_REPO));
    }

    public boolean encryptionEnabled() {
        return !dataPassphrase.isEmpty();
    }

    @Override
    public String toString() {
        return "SyncSettings[owner=" + owner + ", repo=" + repo
                + ", token=" + (token.isBlank() ? "<unset>" : "<set>")
                + ", encryption=" + (encryptionEnabled() ? "on" : "off") + "]";
    }
}
