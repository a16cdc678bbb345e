package tosk;

import java.nio.file.Path;

/** The local file to back up does not exist. */
public class LocalFileMissingException extends BackupException {

    private final Path file;

    public LocalFileMissingException(Path file) {
        super("Local file not found: " + file);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
