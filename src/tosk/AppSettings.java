package tosk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * AppSettings
 * -----------
 * Non-secret settings (file names, backup location, HTTP timeouts) read from {@code tosk.properties}.
 *
 * Lookup order, later wins:
 *  1. tosk.properties bundled on the classpath (defaults)
 *  2. tosk.properties in the working directory (optional)
 *  3. -Dtosk.&lt;key&gt;=... system properties
 */
public final class AppSettings {

    private static final Logger log = LoggerFactory.getLogger(AppSettings.class);

    public static final String FILE_NAME = "tosk.properties";
    private static final String SYSTEM_PREFIX = "tosk.";

    private final Properties props;

    AppSettings(Properties props) {
        this.props = props;
    }

    /** Load defaults + working-directory overrides + system property overrides. */
    public static AppSettings load() throws IOException {
        return load(Path.of(FILE_NAME));
    }

    public static AppSettings load(Path overrideFile) throws IOException {
        Properties p = new Properties();
        try (InputStream in = AppSettings.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) p.load(in);
        }
        if (overrideFile != null && Files.isRegularFile(overrideFile)) {
            try (InputStream in = Files.newInputStream(overrideFile)) {
                p.load(in);
            }
            log.debug("Loaded settings overrides from {}", overrideFile.toAbsolutePath());
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                p.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return new AppSettings(p);
    }

    public Path secretsFile()      { return Path.of(get("secrets.file", ".tosk_secrets.enc")); }
    public Path tasksFile()        { return Path.of(get("tasks.file", "tasks.json")); }
    public Path exportFile()       { return Path.of(get("export.file", "tasks_export.csv")); }
    public Path metadataFile()     { return Path.of(get("backup.metadata-file", ".tosk_backup.properties")); }
    public String backupPrefix()   { return trimSlashes(get("backup.prefix", "backup")); }
    public String backupBranch()   { return get("backup.branch", "main"); }
    public String githubApiUrl()   { return get("github.api-url", "https://api.github.com"); }

    public Duration connectTimeout() {
        return Duration.ofSeconds(positiveInt("http.connect-timeout-seconds", 10));
    }

    public Duration socketTimeout() {
        return Duration.ofSeconds(positiveInt("http.socket-timeout-seconds", 30));
    }

    private String get(String key, String def) {
        String v = props.getProperty(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    /** parse a positive int or fall back to the default (with a warning) */
    private int positiveInt(String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            int parsed = Integer.parseInt(v.trim());
            if (parsed > 0) return parsed;
        } catch (NumberFormatException e) {
            log.warn("Setting {}={} is not a number; using {}", key, v, def);
            return def;
        }
        log.warn("Setting {}={} must be positive; using {}", key, v, def);
        return def;
    }

    /** Strip leading/trailing slashes so we don't produce double slashes in remote paths. */
    private static String trimSlashes(String s) { return s.replaceAll("^/+|/+$", ""); }
}
