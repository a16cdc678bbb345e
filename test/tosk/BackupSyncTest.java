package tosk;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupSyncTest {

    private static final String BRANCH = "main";
    private static final String TASKS = "[{\"id\":1,\"title\":\"Write report\"}]";

    @TempDir
    Path dir;

    private InMemoryContentStore store;
    private Path tasksFile;
    private Path exportFile;
    private Path metadataFile;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryContentStore();
        tasksFile = dir.resolve("tasks.json");
        exportFile = dir.resolve("tasks_export.csv");
        metadataFile = dir.resolve(".tosk_backup.properties");
        Files.writeString(tasksFile, TASKS, StandardCharsets.UTF_8);
    }

    private BackupSync sync(String passphrase) {
        List<BackupSync.BackupTarget> targets = List.of(
                new BackupSync.BackupTarget(tasksFile, "backup/tasks.json", true),
                new BackupSync.BackupTarget(exportFile, "backup/tasks_export.csv", false));
        return new BackupSync(new SyncSettings("tok", passphrase, "me", "notes"), store, targets, metadataFile);
    }

    @Test
    void unencryptedPushUploadsPlainBase64WithoutVersionToken() throws Exception {
        BackupSync.PushResult result = sync("").push(tasksFile, "backup/tasks.json", "Backup tasks.json", BRANCH);

        assertThat(result.created).isTrue();
        assertThat(result.encrypted).isFalse();
        assertThat(store.uploads).hasSize(1);
        InMemoryContentStore.Upload upload = store.uploads.get(0);
        assertThat(upload.versionToken).isNull();
        assertThat(upload.branch).isEqualTo(BRANCH);
        assertThat(new String(Base64.getDecoder().decode(upload.content), StandardCharsets.UTF_8)).isEqualTo(TASKS);
    }

    @Test
    void encryptedPushUpdatesWithTheCurrentToken() throws Exception {
        store.put("backup/tasks.json", "b2xk");
        String current = store.get("backup/tasks.json").versionToken;

        BackupSync.PushResult result = sync("pp").push(tasksFile, "backup/tasks.json", "msg", BRANCH);

        assertThat(result.created).isFalse();
        assertThat(result.encrypted).isTrue();
        InMemoryContentStore.Upload upload = store.uploads.get(0);
        assertThat(upload.versionToken).isEqualTo(current);
        byte[] envelope = Base64.getDecoder().decode(upload.content);
        assertThat(new String(EncryptionUtils.open(envelope, "pp".toCharArray()), StandardCharsets.UTF_8))
                .isEqualTo(TASKS);
    }

    @Test
    void createWithPassphraseUploadsAnEnvelopeThatOpensToTheFileBytes() throws Exception {
        Path hello = dir.resolve("hello.txt");
        Files.writeString(hello, "hello", StandardCharsets.UTF_8);

        sync("secret").push(hello, "backup/hello.txt", "msg", BRANCH);

        InMemoryContentStore.Upload upload = store.uploads.get(0);
        assertThat(upload.versionToken).isNull();
        byte[] opened = EncryptionUtils.open(Base64.getDecoder().decode(upload.content), "secret".toCharArray());
        assertThat(new String(opened, StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void pullOfPlainObjectWithPassphraseSetFailsAndWritesNothing() throws Exception {
        Path hello = dir.resolve("hello.txt");
        Files.writeString(hello, "hello", StandardCharsets.UTF_8);
        sync("").push(hello, "backup/hello.txt", "msg", BRANCH);
        Path target = dir.resolve("restored.txt");

        assertThatThrownBy(() -> sync("secret").pull("backup/hello.txt", target, BRANCH))
                .isInstanceOf(java.security.GeneralSecurityException.class);
        assertThat(target).doesNotExist();
    }

    @Test
    void pushThenPullRestoresTheSameBytes() throws Exception {
        BackupSync sync = sync("pp");
        sync.push(tasksFile, "backup/tasks.json", "msg", BRANCH);
        Path restored = dir.resolve("restored/tasks.json");

        sync.pull("backup/tasks.json", restored, BRANCH);

        assertThat(Files.readString(restored, StandardCharsets.UTF_8)).isEqualTo(TASKS);
    }

    @Test
    void pullWithWrongPassphraseLeavesTheLocalFileAlone() throws Exception {
        sync("right").push(tasksFile, "backup/tasks.json", "msg", BRANCH);
        Files.writeString(tasksFile, "local edits", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> sync("wrong").pull("backup/tasks.json", tasksFile, BRANCH))
                .isInstanceOf(AuthenticationFailedException.class);
        assertThat(Files.readString(tasksFile, StandardCharsets.UTF_8)).isEqualTo("local edits");
    }

    @Test
    void pullAcceptsLineWrappedBase64() throws Exception {
        String wrapped = Base64.getMimeEncoder().encodeToString(new byte[200]);
        store.put("backup/blob", wrapped + "\n");
        Path out = dir.resolve("blob");

        sync("").pull("backup/blob", out, BRANCH);

        assertThat(Files.readAllBytes(out)).isEqualTo(new byte[200]);
    }

    @Test
    void pullOfNonBase64ContentFailsAndKeepsTheLocalFile() throws Exception {
        store.put("backup/tasks.json", "<html>502 Bad Gateway</html>");
        Files.writeString(tasksFile, "precious", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> sync("").pull("backup/tasks.json", tasksFile, BRANCH))
                .isInstanceOf(EnvelopeFormatException.class);
        assertThat(Files.readString(tasksFile, StandardCharsets.UTF_8)).isEqualTo("precious");
    }

    @Test
    void restoreAllReportsUndecodableContent() throws Exception {
        store.put("backup/tasks.json", "not*base64");

        List<String> lines = sync("").restoreAll(BRANCH);

        assertThat(lines.get(0)).endsWith(": FAILED - Remote content is not valid Base64: backup/tasks.json");
        assertThat(Files.readString(tasksFile, StandardCharsets.UTF_8)).isEqualTo(TASKS);
    }

    @Test
    void pushWithoutTokenFailsBeforeAnyRemoteCall() {
        BackupSync sync = new BackupSync(new SyncSettings("", "", "me", "notes"), store,
                List.of(), metadataFile);

        assertThatThrownBy(() -> sync.push(tasksFile, "backup/tasks.json", "msg", BRANCH))
                .isInstanceOf(MissingCredentialException.class)
                .extracting(e -> ((MissingCredentialException) e).credentialName())
                .isEqualTo(SecretBundle.GITHUB_TOKEN);
        assertThat(store.uploads).isEmpty();
    }

    @Test
    void pushOfMissingFileFailsWithItsPath() {
        Path missing = dir.resolve("nope.json");

        assertThatThrownBy(() -> sync("").push(missing, "backup/nope.json", "msg", BRANCH))
                .isInstanceOf(LocalFileMissingException.class)
                .hasMessageContaining("nope.json");
        assertThat(store.uploads).isEmpty();
    }

    @Test
    void backupAllSkipsOptionalFileThatDoesNotExist() {
        List<String> lines = sync("").backupAll(BRANCH);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).endsWith(": created (unencrypted)");
        assertThat(lines.get(1)).endsWith(": skipped (no local file)");
        assertThat(store.get("backup/tasks.json")).isNotNull();
    }

    @Test
    void backupAllKeepsGoingAfterAFailure() throws Exception {
        Files.writeString(exportFile, "ID,Title\n", StandardCharsets.UTF_8);
        store.failOn("backup/tasks.json");

        List<String> lines = sync("pp").backupAll(BRANCH);

        assertThat(lines.get(0)).contains(": FAILED - HTTP 500");
        assertThat(lines.get(1)).endsWith(": created (encrypted)");
    }

    @Test
    void secondBackupUpdatesInsteadOfCreating() {
        BackupSync sync = sync("");
        sync.backupAll(BRANCH);

        List<String> lines = sync.backupAll(BRANCH);

        assertThat(lines.get(0)).endsWith(": updated (unencrypted)");
        assertThat(store.uploads.get(1).versionToken).isNotNull();
    }

    @Test
    void restoreAllOverwritesLocalFilesAndSkipsAbsentOptionalOnes() throws Exception {
        BackupSync sync = sync("pp");
        sync.backupAll(BRANCH);
        Files.writeString(tasksFile, "changed locally", StandardCharsets.UTF_8);

        List<String> lines = sync.restoreAll(BRANCH);

        assertThat(lines.get(0)).endsWith(": restored");
        assertThat(lines.get(1)).endsWith(": skipped (not on remote)");
        assertThat(Files.readString(tasksFile, StandardCharsets.UTF_8)).isEqualTo(TASKS);
    }

    @Test
    void restoreOfUnencryptedBackupWithPassphraseSetExplainsTheFailure() {
        sync("").backupAll(BRANCH);

        List<String> lines = sync("pp").restoreAll(BRANCH);

        assertThat(lines.get(0)).contains(": FAILED - could not decrypt")
                .contains("different encryption setting");
    }

    @Test
    void restoreOfMissingRequiredFileFails() {
        List<String> lines = sync("").restoreAll(BRANCH);

        assertThat(lines.get(0)).contains(": FAILED - HTTP 404");
    }

    @Test
    void successfulPushIsRecordedInTheSidecar() throws Exception {
        BackupSync.PushResult result = sync("").push(tasksFile, "backup/tasks.json", "msg", BRANCH);

        Properties meta = new Properties();
        try (var in = Files.newInputStream(metadataFile)) {
            meta.load(in);
        }
        assertThat(meta.getProperty("backup/tasks.json.last_version_token")).isEqualTo(result.versionToken);
        assertThat(meta.getProperty("backup/tasks.json.last_backup_at_utc")).isNotBlank();

        List<String> status = BackupSync.describeLastBackups(sync("").targets(), metadataFile);
        assertThat(status.get(0)).startsWith("backup/tasks.json: last backup ");
        assertThat(status.get(1)).isEqualTo("backup/tasks_export.csv: never backed up from here");
    }

    @Test
    void remotePathJoinsPrefixAndFileName() {
        assertThat(BackupSync.remotePathFor("backup", Path.of("data", "tasks.json"))).isEqualTo("backup/tasks.json");
        assertThat(BackupSync.remotePathFor("", Path.of("tasks.json"))).isEqualTo("tasks.json");
    }

    @Test
    void commitMessageNamesTheFile() {
        assertThat(BackupSync.commitMessage(Path.of("x", "tasks.json")))
                .matches("Backup tasks\\.json \\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");
    }
}
