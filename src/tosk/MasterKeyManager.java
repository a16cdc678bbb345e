package tosk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

/**
 * MasterKeyManager
 * ----------------
 * Owns the encrypted secret store and its master-password lifecycle:
 *  - First run (no store file): nothing to decrypt, go straight to asking for the secrets.
 *  - Returning run: ask once for the master password and open the store; a wrong password or a
 *    corrupted file stops the program, defaults are never substituted.
 *  - Any required secret that is missing or blank is asked for; the store is re-written only when
 *    it did not exist yet or something was newly entered.
 *  - Every write asks for a fresh master password ("Create a master password"); the one typed to
 *    unlock is never reused, and the master password itself is never stored.
 *
 * File format:
 *   <Base64( salt | nonce | AES-GCM( canonical JSON bundle ) )>
 *
 * Notes:
 *  - All questions go through a {@link ValueProvider}; this class never touches the terminal itself.
 *  - Fatal conditions are thrown as {@link SecretStoreException}; exiting is left to the caller.
 */
public class MasterKeyManager {

    private static final Logger log = LoggerFactory.getLogger(MasterKeyManager.class);

    /** One secret the program cannot run without, plus the question used to ask for it. */
    public static final class RequiredSecret {
        public final String name;
        public final String prompt;
        public final boolean allowBlank; // blank answer accepted (only the data passphrase)

        public RequiredSecret(String name, String prompt, boolean allowBlank) {
            this.name = name;
            this.prompt = prompt;
            this.allowBlank = allowBlank;
        }
    }

    /** Asked in this order on first run. */
    public static final List<RequiredSecret> REQUIRED_SECRETS = List.of(
            new RequiredSecret(SecretBundle.GITHUB_TOKEN,
                    "Enter your GitHub personal access token", false),
            new RequiredSecret(SecretBundle.ENCRYPTION_PASSPHRASE,
                    "Enter a passphrase to encrypt backups (leave blank to upload unencrypted)", true),
            new RequiredSecret(SecretBundle.GITHUB_OWNER,
                    "Enter the GitHub owner (user or organization) of the backup repository", false),
            new RequiredSecret(SecretBundle.GITHUB_REPO,
                    "Enter the GitHub repository name for backups", false)
    );

    private final Path storeFile;
    private final ValueProvider prompter;

    public MasterKeyManager(Path storeFile, ValueProvider prompter) {
        this.storeFile = storeFile;
        this.prompter = prompter;
    }

    public Path getStoreFile() {
        return storeFile;
    }

    public boolean storeExists() {
        return Files.isRegularFile(storeFile);
    }

    /**
     * Entry point at startup: load (or start empty), fill in what is missing, persist if needed.
     *
     * @return the unlocked secrets for the synchronizer
     */
    public SyncSettings unlock() throws SecretStoreException, IOException {
        boolean existed = storeExists();
        SecretBundle bundle = load();
        boolean changed = ensureRequiredKeys(bundle, REQUIRED_SECRETS);

        if (!existed || changed) {
            char[] master = promptForMasterPassword(true);
            try {
                persist(bundle, master);
            } finally {
                Arrays.fill(master, '\0');
            }
        } else {
            log.debug("Secret store unchanged; no write");
        }
        return SyncSettings.fromBundle(bundle);
    }

    /**
     * Read the store. Without a store file this returns an empty bundle and asks nothing.
     *
     * @throws SecretStoreException WRONG_MASTER_PASSWORD if the store does not open,
     *                              BLANK_REQUIRED_VALUE if no master password was typed
     */
    public SecretBundle load() throws SecretStoreException, IOException {
        if (!storeExists()) {
            log.info("No secret store at {}; starting setup", storeFile);
            return SecretBundle.empty();
        }

        String encoded = Files.readString(storeFile, StandardCharsets.UTF_8);
        char[] master = promptForMasterPassword(false);
        byte[] json = null;
        try {
            json = EncryptionUtils.openFromBase64(encoded, master);
            SecretBundle bundle = SecretBundle.fromJsonBytes(json);
            log.info("Secret store unlocked ({} values)", bundle.asMap().size());
            return bundle;
        } catch (AuthenticationFailedException | EnvelopeFormatException e) {
            throw new SecretStoreException(SecretStoreException.Reason.WRONG_MASTER_PASSWORD,
                    "Wrong master password or corrupted store: " + storeFile, e);
        } catch (IOException e) {
            // decrypted fine but the content is not a bundle
            throw new SecretStoreException(SecretStoreException.Reason.WRONG_MASTER_PASSWORD,
                    "Wrong master password or corrupted store: " + storeFile, e);
        } finally {
            Arrays.fill(master, '\0');
            if (json != null) Arrays.fill(json, (byte) 0);
        }
    }

    /**
     * Ask for every required secret that is missing or blank.
     * The data passphrase may be left blank (stored as "", meaning "do not encrypt backups");
     * once stored that way it counts as answered and is not asked again. A non-blank passphrase is
     * stored exactly as typed, surrounding spaces included.
     *
     * @return true if anything was filled in
     * @throws SecretStoreException BLANK_REQUIRED_VALUE when a mandatory answer is blank
     */
    public boolean ensureRequiredKeys(SecretBundle bundle, List<RequiredSecret> required)
            throws SecretStoreException, IOException {
        boolean changed = false;
        for (RequiredSecret secret : required) {
            boolean missing = secret.allowBlank ? !bundle.contains(secret.name) : bundle.isBlank(secret.name);
            if (!missing) continue;

            String answer = prompter.ask(secret.prompt, false);
            // passphrase kept as typed; names and tokens trimmed
            answer = answer.isBlank() ? "" : (secret.allowBlank ? answer : answer.trim());
            if (answer.isEmpty() && !secret.allowBlank) {
                throw new SecretStoreException(SecretStoreException.Reason.BLANK_REQUIRED_VALUE,
                        secret.name + " is required and was left blank.");
            }
            if (answer.isEmpty()) {
                log.info("{} left blank; backups will not be encrypted", secret.name);
            }
            bundle.put(secret.name, answer);
            changed = true;
        }
        return changed;
    }

    /**
     * Seal the bundle with the given master password and write it, replacing any previous store.
     */
    public void persist(SecretBundle bundle, char[] masterPassword) throws IOException {
        byte[] json = bundle.toJsonBytes();
        try {
            String encoded = EncryptionUtils.sealToBase64(json, masterPassword);
            Path parent = storeFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(storeFile, encoded, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            log.info("Secret store written to {}", storeFile);
        } finally {
            Arrays.fill(json, (byte) 0);
        }
    }

    /**
     * Ask for the master password.
     * Setup shows what is typed so the user sees the password being set; unlocking hides it.
     * The answer is used exactly as typed; only an all-blank answer is rejected.
     *
     * @param isSetup true for "Create a master password", false for "Enter your master password"
     */
    char[] promptForMasterPassword(boolean isSetup) throws SecretStoreException, IOException {
        String answer = isSetup
                ? prompter.ask("Create a master password (needed on every start)", false)
                : prompter.ask("Enter your master password", true);
        if (answer.isBlank()) {
            throw new SecretStoreException(SecretStoreException.Reason.BLANK_REQUIRED_VALUE,
                    "No master password entered.");
        }
        return answer.toCharArray();
    }
}
