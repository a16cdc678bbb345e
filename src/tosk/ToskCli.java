package tosk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Locale;

/**
 * ToskCli
 * -------
 * Application entry point.
 *
 * Execution order:
 *  1. Load settings ({@link AppSettings}).
 *  2. For commands that talk to the remote store: unlock or set up the secret store ({@link MasterKeyManager}).
 *  3. Run the command and print one status line per file.
 *
 * Exit codes: 0 ok, 1 secret store could not be unlocked / required value blank,
 * 2 usage error, 3 at least one operation failed.
 */
public final class ToskCli {

    private static final Logger log = LoggerFactory.getLogger(ToskCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SECRET_STORE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 3;

    private final AppSettings settings;
    private final ValueProvider prompter;
    private final PrintStream out;

    ToskCli(AppSettings settings, ValueProvider prompter, PrintStream out) {
        this.settings = settings;
        this.prompter = prompter;
        this.out = out;
    }

    public static void main(String[] args) {
        int code;
        try {
            code = new ToskCli(AppSettings.load(), new ConsoleValueProvider(), System.out).run(args);
        } catch (IOException e) {
            System.err.println("Could not read settings: " + e.getMessage());
            code = EXIT_FAILED;
        }
        System.exit(code);
    }

    int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        try {
            switch (command) {
                case "backup":
                    return expectArgs(args, 1) ? runWithRemote(sync -> printLines(sync.backupAll(settings.backupBranch()))) : EXIT_USAGE;
                case "restore":
                    return expectArgs(args, 1) ? runWithRemote(sync -> printLines(sync.restoreAll(settings.backupBranch()))) : EXIT_USAGE;
                case "push":
                    return expectArgs(args, 3) ? runWithRemote(sync -> pushOne(sync, Path.of(args[1]), args[2])) : EXIT_USAGE;
                case "pull":
                    return expectArgs(args, 3) ? runWithRemote(sync -> pullOne(sync, args[1], Path.of(args[2]))) : EXIT_USAGE;
                case "export-csv":
                    return expectArgs(args, 1) ? exportCsv() : EXIT_USAGE;
                case "import-csv":
                    return expectArgs(args, 1) ? importCsv() : EXIT_USAGE;
                case "status":
                    return expectArgs(args, 1) ? status() : EXIT_USAGE;
                case "help":
                case "--help":
                case "-h":
                    printUsage();
                    return EXIT_OK;
                default:
                    out.println("Unknown command: " + args[0]);
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (SecretStoreException e) {
            log.error("Secret store: {}", e.getMessage());
            out.println(e.getMessage());
            return EXIT_SECRET_STORE;
        } catch (IOException e) {
            log.error("I/O failure running {}", command, e);
            out.println("Failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    // ---------- commands ----------

    /** Work that needs the unlocked secrets and a remote store; returns an exit code. */
    private interface RemoteCommand {
        int apply(BackupSync sync);
    }

    private int runWithRemote(RemoteCommand command) throws SecretStoreException, IOException {
        MasterKeyManager keys = new MasterKeyManager(settings.secretsFile(), prompter);
        SyncSettings secrets = keys.unlock();
        log.debug("Unlocked {}", secrets);
        try (var store = GitHubBackupLite.builder().from(settings, secrets).build()) {
            BackupSync sync = new BackupSync(secrets, store, BackupSync.defaultTargets(settings), settings.metadataFile());
            return command.apply(sync);
        }
    }

    private int pushOne(BackupSync sync, Path local, String remotePath) {
        try {
            BackupSync.PushResult r = sync.push(local, remotePath, BackupSync.commitMessage(local), settings.backupBranch());
            out.println(local + " -> " + remotePath + ": " + (r.created ? "created" : "updated"));
            return EXIT_OK;
        } catch (BackupException | IOException e) {
            log.warn("Push of {} failed", local, e);
            out.println(local + " -> " + remotePath + ": FAILED - " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int pullOne(BackupSync sync, String remotePath, Path local) {
        try {
            sync.pull(remotePath, local, settings.backupBranch());
            out.println(remotePath + " -> " + local + ": restored");
            return EXIT_OK;
        } catch (BackupException | GeneralSecurityException | IOException e) {
            log.warn("Pull of {} failed", remotePath, e);
            out.println(remotePath + " -> " + local + ": FAILED - " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int exportCsv() throws IOException {
        List<Task> tasks = TaskFileUtils.loadTasks(settings.tasksFile());
        int written = TaskFileUtils.exportCsv(tasks, settings.exportFile());
        out.println(written == 0 ? "No tasks to export." : "Exported " + written + " tasks to " + settings.exportFile());
        return EXIT_OK;
    }

    private int importCsv() throws IOException {
        Path csv = settings.exportFile();
        if (!csv.toFile().isFile()) {
            out.println("No CSV file: " + csv);
            return EXIT_FAILED;
        }
        List<Task> tasks = TaskFileUtils.importCsv(csv);
        TaskFileUtils.saveTasks(settings.tasksFile(), tasks);
        out.println("Imported " + tasks.size() + " tasks from " + csv);
        return EXIT_OK;
    }

    /** Local view only: no secrets needed. */
    private int status() {
        out.println("Secret store: " + settings.secretsFile()
                + (settings.secretsFile().toFile().isFile() ? " (present)" : " (not set up)"));
        printLines(BackupSync.describeLastBackups(BackupSync.defaultTargets(settings), settings.metadataFile()));
        return EXIT_OK;
    }

    // ---------- helpers ----------

    /** Prints the lines; exit code reflects whether any of them reports a failure. */
    private int printLines(List<String> lines) {
        boolean failed = false;
        for (String line : lines) {
            out.println(line);
            if (line.contains(": FAILED")) failed = true;
        }
        return failed ? EXIT_FAILED : EXIT_OK;
    }

    private boolean expectArgs(String[] args, int count) {
        if (args.length == count) return true;
        out.println("Wrong number of arguments for " + args[0]);
        printUsage();
        return false;
    }

    private void printUsage() {
        out.println("Usage: tosk <command>");
        out.println("  backup                 upload the task list and CSV export");
        out.println("  restore                download them and overwrite the local files");
        out.println("  push <local> <remote>  upload one file to a remote path");
        out.println("  pull <remote> <local>  download one remote path into a file");
        out.println("  export-csv             write the task list as CSV");
        out.println("  import-csv             replace the task list with the CSV export");
        out.println("  status                 show the last recorded backups");
    }
}
