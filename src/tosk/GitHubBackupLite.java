package tosk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.http.ContentStreamProvider;
import software.amazon.awssdk.http.HttpExecuteRequest;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.utils.http.SdkHttpUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * GitHubBackupLite
 * ----------------
 * Minimal client for the GitHub "repository contents" API, used to move backup payloads.
 * What it does:
 *  - GET  /repos/{owner}/{repo}/contents/{path}?ref={branch}  -> Base64 content + sha (version token)
 *  - PUT  /repos/{owner}/{repo}/contents/{path}  {message, content, branch, sha?}
 *  - Sends the token as a bearer header on every call.
 *
 * What it does NOT do:
 *  - No encryption (payloads arrive already sealed or deliberately plain), no retries,
 *    no interpretation of error bodies: non-success answers are reported verbatim.
 *
 * Lifecycle:
 *  - Construct with {@link GitHubBackupLite#builder()}, use it, then let try-with-resources call {@link #close()}.
 */
public class GitHubBackupLite implements RemoteContentStore {

    private static final Logger log = LoggerFactory.getLogger(GitHubBackupLite.class);

    private static final String ACCEPT = "application/vnd.github+json";
    private static final String API_VERSION = "2022-11-28";
    private static final String USER_AGENT = "tosk-backup";

    private final SdkHttpClient http;
    private final boolean ownsHttp;
    private final URI apiBase;
    private final String owner;
    private final String repo;
    private final String token;
    private final ObjectMapper mapper = new ObjectMapper();

    private GitHubBackupLite(SdkHttpClient http, boolean ownsHttp, URI apiBase, String owner, String repo, String token) {
        this.http = http;
        this.ownsHttp = ownsHttp;
        this.apiBase = apiBase;
        this.owner = owner;
        this.repo = repo;
        this.token = token;
    }

    // ---------- Builder ----------

    public static Builder builder() { return new Builder(); }

    /**
     * Builder
     * -------
     * Under the hood it builds an Apache-based {@link SdkHttpClient} with the given connect and socket
     * timeouts, unless a client is supplied (tests pass a mock).
     */
    public static final class Builder {
        private URI apiBase = URI.create("https://api.github.com");
        private String owner = "";
        private String repo = "";
        private String token = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration socketTimeout = Duration.ofSeconds(30);
        private SdkHttpClient httpClient;

        /** API root, e.g. "https://api.github.com" or "https://ghe.example.com/api/v3". */
        public Builder apiUrl(String url) { this.apiBase = URI.create(Objects.requireNonNull(url)); return this; }
        public Builder owner(String owner) { this.owner = owner == null ? "" : owner; return this; }
        public Builder repo(String repo) { this.repo = repo == null ? "" : repo; return this; }
        public Builder token(String token) { this.token = token == null ? "" : token; return this; }
        public Builder connectTimeout(Duration d) { this.connectTimeout = Objects.requireNonNull(d); return this; }
        public Builder socketTimeout(Duration d) { this.socketTimeout = Objects.requireNonNull(d); return this; }

        /** Use an existing client; it is not closed by {@link GitHubBackupLite#close()}. */
        public Builder httpClient(SdkHttpClient client) { this.httpClient = client; return this; }

        /** Settings and secrets in one go. */
        public Builder from(AppSettings settings, SyncSettings secrets) {
            return apiUrl(settings.githubApiUrl())
                    .connectTimeout(settings.connectTimeout())
                    .socketTimeout(settings.socketTimeout())
                    .owner(secrets.owner)
                    .repo(secrets.repo)
                    .token(secrets.token);
        }

        public GitHubBackupLite build() {
            if (apiBase.getScheme() == null || apiBase.getHost() == null) {
                throw new IllegalArgumentException("API url must be absolute: " + apiBase);
            }
            if (httpClient != null) {
                return new GitHubBackupLite(httpClient, false, apiBase, owner, repo, token);
            }
            SdkHttpClient http = ApacheHttpClient.builder()
                    .connectionTimeout(connectTimeout)
                    .socketTimeout(socketTimeout)
                    .build();
            return new GitHubBackupLite(http, true, apiBase, owner, repo, token);
        }
    }

    // ---------- Public API ----------

    @Override
    public String fetchVersionToken(String path, String branch) throws BackupException {
        Response resp = execute(SdkHttpMethod.GET, path, branch, null);
        if (resp.status != 200) {
            log.debug("No version token for {}@{} (HTTP {})", path, branch, resp.status);
            return null;
        }
        JsonNode sha = parse(resp).get("sha");
        return (sha == null || sha.isNull()) ? null : sha.asText();
    }

    @Override
    public RemoteFile download(String path, String branch) throws BackupException {
        Response resp = execute(SdkHttpMethod.GET, path, branch, null);
        if (resp.status != 200) {
            throw new RemoteRequestFailedException(resp.status, resp.body);
        }
        JsonNode node = parse(resp);
        JsonNode content = node.get("content");
        if (content == null || !content.isTextual()) {
            throw new BackupException("Remote path is not a file: " + path);
        }
        // files over 1 MB come back with encoding "none" and empty content
        JsonNode encoding = node.get("encoding");
        if (encoding == null || !"base64".equals(encoding.asText())) {
            throw new BackupException("Remote object is too large for the contents API: " + path);
        }
        JsonNode sha = node.get("sha");
        return new RemoteFile(path, content.asText(), sha == null ? null : sha.asText());
    }

    @Override
    public UploadResult upload(String path, String message, String base64Content, String branch, String versionToken)
            throws BackupException {
        ObjectNode body = mapper.createObjectNode();
        body.put("message", message);
        body.put("content", base64Content);
        body.put("branch", branch);
        if (versionToken != null) {
            body.put("sha", versionToken); // update; omitted means create
        }

        byte[] json;
        try {
            json = mapper.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode upload request", e);
        }

        Response resp = execute(SdkHttpMethod.PUT, path, null, json);
        if (resp.status != 200 && resp.status != 201) {
            throw new RemoteRequestFailedException(resp.status, resp.body);
        }

        String newToken = null;
        try {
            JsonNode sha = mapper.readTree(resp.body).path("content").get("sha");
            if (sha != null && !sha.isNull()) newToken = sha.asText();
        } catch (IOException e) {
            log.warn("Upload of {} succeeded but the response could not be read: {}", path, e.getMessage());
        }
        return new UploadResult(resp.status, newToken);
    }

    /** Close the underlying HTTP client if we created it (called automatically in try-with-resources). */
    @Override
    public void close() {
        if (ownsHttp) http.close();
    }

    // ---------- Helpers ----------

    private static final class Response {
        final int status;
        final String body;

        Response(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }

    private Response execute(SdkHttpMethod method, String path, String ref, byte[] body) throws RemoteUnavailableException {
        SdkHttpFullRequest.Builder req = SdkHttpFullRequest.builder()
                .method(method)
                .protocol(apiBase.getScheme())
                .host(apiBase.getHost())
                .encodedPath(contentsPath(path))
                .putHeader("Authorization", "Bearer " + token)
                .putHeader("Accept", ACCEPT)
                .putHeader("X-GitHub-Api-Version", API_VERSION)
                .putHeader("User-Agent", USER_AGENT);
        if (apiBase.getPort() != -1) req.port(apiBase.getPort());
        if (ref != null) req.putRawQueryParameter("ref", ref);

        ContentStreamProvider provider = null;
        if (body != null) {
            provider = () -> new ByteArrayInputStream(body);
            req.putHeader("Content-Type", "application/json")
               .putHeader("Content-Length", Integer.toString(body.length))
               .contentStreamProvider(provider);
        }

        HttpExecuteRequest request = HttpExecuteRequest.builder()
                .request(req.build())
                .contentStreamProvider(provider)
                .build();

        log.debug("{} {}", method, path);
        try {
            HttpExecuteResponse response = http.prepareRequest(request).call();
            int status = response.httpResponse().statusCode();
            return new Response(status, readBody(response.responseBody()));
        } catch (IOException e) {
            throw new RemoteUnavailableException("Remote store unreachable (" + method + " " + path + "): "
                    + e.getMessage(), e);
        }
    }

    private JsonNode parse(Response resp) throws BackupException {
        try {
            return mapper.readTree(resp.body);
        } catch (IOException e) {
            throw new BackupException("Unexpected response from remote store: " + resp.body, e);
        }
    }

    private static String readBody(Optional<AbortableInputStream> body) throws IOException {
        if (body.isEmpty()) return "";
        try (InputStream in = body.get()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Build the encoded request path. Each segment is URL-encoded on its own so "/" stays a separator.
     * Visual:
     *   owner "me", repo "notes", path "backup/tasks.json"
     *   -> "/repos/me/notes/contents/backup/tasks.json"
     */
    String contentsPath(String path) {
        String base = apiBase.getRawPath() == null ? "" : apiBase.getRawPath().replaceAll("/+$", "");
        String encodedPath = Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .map(SdkHttpUtils::urlEncode)
                .collect(Collectors.joining("/"));
        return base + "/repos/" + SdkHttpUtils.urlEncode(owner) + "/" + SdkHttpUtils.urlEncode(repo)
                + "/contents/" + encodedPath;
    }
}
