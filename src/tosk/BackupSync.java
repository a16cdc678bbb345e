package tosk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Properties;

/**
 * BackupSync
 * ----------
 * Pushes local files to the remote content store and pulls them back:
 *  - push: read the file, seal it with the data passphrase if one is set, Base64 it, read the current
 *    version token right before writing, then create (no token) or update (token included).
 *  - pull: fetch, decode, open with the data passphrase if one is set, and replace the local file.
 *  - backupAll / restoreAll: apply push/pull to every entry of the fixed file table and return one
 *    status line per entry; one entry failing never stops the others.
 *  - Keeps a small sidecar (.tosk_backup.properties) with the last version token and push time per path.
 *
 * Threading: everything here is synchronous and single-threaded.
 * Security: the token and passphrase come from {@link SyncSettings}; nothing is read from the environment.
 */
public final class BackupSync {

    private static final Logger log = LoggerFactory.getLogger(BackupSync.class);

    private static final String MODE_HINT =
            "Wrong passphrase, or the backup was uploaded with a different encryption setting.";

    /** One row of the local file to remote path table. */
    public static final class BackupTarget {
        public final Path localFile;
        public final String remotePath;
        public final boolean required; // false: a missing local file is skipped, not an error

        public BackupTarget(Path localFile, String remotePath, boolean required) {
            this.localFile = localFile;
            this.remotePath = remotePath;
            this.required = required;
        }
    }

    /** What a successful push did. */
    public static final class PushResult {
        public final String remotePath;
        public final boolean created;      // true: no prior object, written without a version token
        public final boolean encrypted;
        public final String versionToken;  // new token reported by the store, may be null

        PushResult(String remotePath, boolean created, boolean encrypted, String versionToken) {
            this.remotePath = remotePath;
            this.created = created;
            this.encrypted = encrypted;
            this.versionToken = versionToken;
        }
    }

    private final SyncSettings settings;
    private final RemoteContentStore store;
    private final List<BackupTarget> targets;
    private final Path metadataFile; // may be null: no sidecar

    public BackupSync(SyncSettings settings, RemoteContentStore store, List<BackupTarget> targets, Path metadataFile) {
        this.settings = settings;
        this.store = store;
        this.targets = List.copyOf(targets);
        this.metadataFile = metadataFile;
    }

    /** The fixed table: task list (required) and its CSV export (optional) under the backup prefix. */
    public static List<BackupTarget> defaultTargets(AppSettings app) {
        return List.of(
                new BackupTarget(app.tasksFile(), remotePathFor(app.backupPrefix(), app.tasksFile()), true),
                new BackupTarget(app.exportFile(), remotePathFor(app.backupPrefix(), app.exportFile()), false));
    }

    static String remotePathFor(String prefix, Path local) {
        String name = local.getFileName().toString();
        return prefix.isBlank() ? name : prefix + "/" + name;
    }

    public List<BackupTarget> targets() {
        return targets;
    }

    // ---------- single file ----------

    /**
     * Upload one local file.
     *
     * @throws MissingCredentialException if token, owner or repo is not configured
     * @throws LocalFileMissingException if {@code localFile} does not exist
     * @throws RemoteRequestFailedException if the store rejects the write
     */
    public PushResult push(Path localFile, String remotePath, String message, String branch)
            throws BackupException, IOException {
        requireCredentials();
        if (!Files.isRegularFile(localFile)) {
            throw new LocalFileMissingException(localFile);
        }

        byte[] data = Files.readAllBytes(localFile);
        boolean encrypt = settings.encryptionEnabled();
        byte[] payload;
        if (encrypt) {
            char[] pass = EncryptionUtils.toChars(settings.dataPassphrase);
            try {
                payload = EncryptionUtils.seal(data, pass);
            } finally {
                Arrays.fill(pass, '\0');
            }
        } else {
            payload = data;
        }
        String content = Base64.getEncoder().encodeToString(payload);

        // read the token as late as possible; a concurrent write in between is still possible
        String token = store.fetchVersionToken(remotePath, branch);
        log.info("Pushing {} -> {}@{} ({}, {})", localFile, remotePath, branch,
                token == null ? "create" : "update", encrypt ? "encrypted" : "unencrypted");

        RemoteContentStore.UploadResult result = store.upload(remotePath, message, content, branch, token);
        recordSuccessfulBackup(remotePath, result.versionToken);
        return new PushResult(remotePath, token == null, encrypt, result.versionToken);
    }

    /**
     * Download one object and replace the local file with it. Nothing is written unless the payload
     * decodes (and, with a data passphrase set, opens) cleanly.
     *
     * @throws AuthenticationFailedException wrong data passphrase, tampered payload, or the object was
     *                                       uploaded unencrypted while a passphrase is now set
     * @throws EnvelopeFormatException payload is not Base64 or too short to be an envelope
     */
    public void pull(String remotePath, Path localFile, String branch)
            throws BackupException, GeneralSecurityException, IOException {
        requireCredentials();

        RemoteContentStore.RemoteFile remote = store.download(remotePath, branch);
        byte[] payload;
        try {
            // GitHub wraps lines; anything else outside the alphabet is an error
            payload = Base64.getDecoder().decode(remote.base64Content.replaceAll("[\r\n]", ""));
        } catch (IllegalArgumentException e) {
            throw new EnvelopeFormatException("Remote content is not valid Base64: " + remotePath, e);
        }

        byte[] data;
        if (settings.encryptionEnabled()) {
            char[] pass = EncryptionUtils.toChars(settings.dataPassphrase);
            try {
                data = EncryptionUtils.open(payload, pass);
            } finally {
                Arrays.fill(pass, '\0');
            }
        } else {
            data = payload;
        }

        Path parent = localFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.write(localFile, data,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        log.info("Restored {}@{} -> {} ({} bytes)", remotePath, branch, localFile, data.length);
    }

    // ---------- batch ----------

    /** Push every table entry; returns one status line per entry. */
    public List<String> backupAll(String branch) {
        List<String> lines = new ArrayList<>();
        for (BackupTarget t : targets) {
            String label = t.localFile + " -> " + t.remotePath;
            if (!t.required && !Files.isRegularFile(t.localFile)) {
                lines.add(label + ": skipped (no local file)");
                continue;
            }
            try {
                PushResult r = push(t.localFile, t.remotePath, commitMessage(t.localFile), branch);
                lines.add(label + ": " + (r.created ? "created" : "updated")
                        + (r.encrypted ? " (encrypted)" : " (unencrypted)"));
            } catch (BackupException | IOException e) {
                log.warn("Backup of {} failed", t.localFile, e);
                lines.add(label + ": FAILED - " + e.getMessage());
            }
        }
        return lines;
    }

    /** Pull every table entry; returns one status line per entry. */
    public List<String> restoreAll(String branch) {
        List<String> lines = new ArrayList<>();
        for (BackupTarget t : targets) {
            String label = t.remotePath + " -> " + t.localFile;
            try {
                pull(t.remotePath, t.localFile, branch);
                lines.add(label + ": restored");
            } catch (RemoteRequestFailedException e) {
                if (!t.required && e.statusCode() == 404) {
                    lines.add(label + ": skipped (not on remote)");
                } else {
                    log.warn("Restore of {} failed", t.remotePath, e);
                    lines.add(label + ": FAILED - " + e.getMessage());
                }
            } catch (EnvelopeFormatException e) {
                log.warn("Restore of {} failed: unreadable content", t.remotePath, e);
                lines.add(label + ": FAILED - " + e.getMessage()
                        + (settings.encryptionEnabled() ? ". " + MODE_HINT : ""));
            } catch (GeneralSecurityException e) {
                log.warn("Restore of {} failed to decrypt", t.remotePath, e);
                lines.add(label + ": FAILED - could not decrypt (" + e.getMessage() + "). " + MODE_HINT);
            } catch (BackupException | IOException e) {
                log.warn("Restore of {} failed", t.remotePath, e);
                lines.add(label + ": FAILED - " + e.getMessage());
            }
        }
        return lines;
    }

    /** One line per table entry describing the last recorded push; needs no credentials. */
    public static List<String> describeLastBackups(List<BackupTarget> targets, Path metadataFile) {
        Properties meta = readMetadata(metadataFile);
        List<String> lines = new ArrayList<>();
        for (BackupTarget t : targets) {
            String at = meta.getProperty(t.remotePath + ".last_backup_at_utc");
            String sha = meta.getProperty(t.remotePath + ".last_version_token");
            if (at == null) {
                lines.add(t.remotePath + ": never backed up from here");
            } else {
                lines.add(t.remotePath + ": last backup " + formatInstant(at)
                        + (sha == null ? "" : " (version " + shortToken(sha) + ")"));
            }
        }
        return lines;
    }

    // ---------- helpers ----------

    private void requireCredentials() throws MissingCredentialException {
        if (settings.token.isBlank()) throw new MissingCredentialException(SecretBundle.GITHUB_TOKEN);
        if (settings.owner.isBlank()) throw new MissingCredentialException(SecretBundle.GITHUB_OWNER);
        if (settings.repo.isBlank()) throw new MissingCredentialException(SecretBundle.GITHUB_REPO);
    }

    static String commitMessage(Path localFile) {
        return "Backup " + localFile.getFileName() + " "
                + DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").format(ZonedDateTime.now());
    }

    /** After a successful push, record the new version token + timestamp; failures here are only logged. */
    private void recordSuccessfulBackup(String remotePath, String versionToken) {
        if (metadataFile == null) return;
        Properties meta = readMetadata(metadataFile);
        if (versionToken != null) meta.setProperty(remotePath + ".last_version_token", versionToken);
        meta.setProperty(remotePath + ".last_backup_at_utc", Instant.now().toString());
        try (OutputStream out = Files.newOutputStream(metadataFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            meta.store(out, "Backup metadata");
        } catch (IOException e) {
            log.warn("Could not update backup metadata {}: {}", metadataFile, e.getMessage());
        }
    }

    private static Properties readMetadata(Path metadataFile) {
        Properties p = new Properties();
        if (metadataFile == null || !Files.isRegularFile(metadataFile)) return p;
        try (InputStream in = Files.newInputStream(metadataFile)) {
            p.load(in);
        } catch (IOException e) {
            log.warn("Could not read backup metadata {}: {}", metadataFile, e.getMessage());
        }
        return p;
    }

    /** yyyy-MM-dd HH:mm:ss in the system timezone; unparseable values are shown as stored. */
    private static String formatInstant(String isoUtc) {
        try {
            var z = ZonedDateTime.ofInstant(Instant.parse(isoUtc), ZoneId.systemDefault());
            return z.format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        } catch (DateTimeParseException e) {
            return isoUtc;
        }
    }

    private static String shortToken(String sha) {
        return sha.length() > 7 ? sha.substring(0, 7) : sha;
    }
}
