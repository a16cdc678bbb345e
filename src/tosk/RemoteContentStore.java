package tosk;

/**
 * A versioned remote object store addressed by path and branch.
 * Every write may carry the version token read just before it; no token means "create".
 */
public interface RemoteContentStore extends AutoCloseable {

    /** A stored object: its Base64 content exactly as the store returned it, plus its version token. */
    final class RemoteFile {
        public final String path;
        public final String base64Content;
        public final String versionToken;

        public RemoteFile(String path, String base64Content, String versionToken) {
            this.path = path;
            this.base64Content = base64Content;
            this.versionToken = versionToken;
        }
    }

    /** Outcome of a successful write. */
    final class UploadResult {
        public final int statusCode;
        public final String versionToken; // new token, may be null if the store did not report it

        public UploadResult(int statusCode, String versionToken) {
            this.statusCode = statusCode;
            this.versionToken = versionToken;
        }
    }

    /**
     * @return the current version token at {@code path}, or null if there is no such object
     */
    String fetchVersionToken(String path, String branch) throws BackupException;

    /**
     * @throws RemoteRequestFailedException on any non-200 answer, status and body verbatim
     */
    RemoteFile download(String path, String branch) throws BackupException;

    /**
     * Create ({@code versionToken == null}) or update the object at {@code path}.
     *
     * @throws RemoteRequestFailedException on any answer other than 200/201
     */
    UploadResult upload(String path, String message, String base64Content, String branch, String versionToken)
            throws BackupException;

    @Override
    void close();
}
