package io.github.hotbrkm.mailgoat.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@Data
@ConfigurationProperties(prefix = "mailgoat")
public class MailgoatConfig {

    /**
     * Base directory for local state. A leading {@code ~} is expanded to the user's home directory.
     */
    private String home = "~/.mailgoat";

    /**
     * Profile document; defaults to {@code <home>/profiles.json}.
     */
    private String profilesFile;

    /**
     * Directory holding one JSON file per sealed batch; defaults to {@code <home>/batches}.
     */
    private String batchStoreDir;

    /**
     * Whether send-batch draws a progress line on stderr.
     */
    private boolean progressEnabled = true;

    private Http http = new Http();

    public Path resolveHome() {
        return expand(home == null || home.isBlank() ? "~/.mailgoat" : home);
    }

    public Path resolveProfilesFile() {
        return profilesFile == null || profilesFile.isBlank() ? resolveHome().resolve("profiles.json") : expand(profilesFile);
    }

    public Path resolveBatchStoreDir() {
        return batchStoreDir == null || batchStoreDir.isBlank() ? resolveHome().resolve("batches") : expand(batchStoreDir);
    }

    static Path expand(String path) {
        String trimmed = path.trim();
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + trimmed.substring(1));
        }
        return Path.of(trimmed);
    }

    @Data
    public static class Http {
        public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
        public static final long DEFAULT_READ_TIMEOUT_MS = 15_000L;
        public static final String DEFAULT_USER_AGENT = "mailgoat-java/1.0.0";

        private long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private long readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        private String userAgent = DEFAULT_USER_AGENT;

        public long resolveConnectTimeoutMs() {
            return connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS;
        }

        public long resolveReadTimeoutMs() {
            return readTimeoutMs > 0 ? readTimeoutMs : DEFAULT_READ_TIMEOUT_MS;
        }
    }
}
