package tosk;

/**
 * The remote store answered with a non-success status. The status code and response body
 * are kept verbatim; they are not interpreted or mapped to finer types.
 */
public class RemoteRequestFailedException extends BackupException {

    private final int statusCode;
    private final String responseBody;

    public RemoteRequestFailedException(int statusCode, String responseBody) {
        super("HTTP " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
