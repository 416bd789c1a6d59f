package clipqueue.coordinator.config;

import clipqueue.coordinator.service.SubmissionMode;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Configuration holder for the queue coordinator.
 * All settings have sensible defaults.
 */
public final class QueueConfig {

    // Backend settings
    private String backendBaseUrl = "http://localhost:3000/api";
    private Duration backendRequestTimeout = Duration.ofSeconds(30);

    // Cache settings
    private String databaseUrl = "jdbc:h2:file:./data/clipqueue;AUTO_SERVER=TRUE";
    private int databasePoolSize = 4;
    private String cacheKey = "video-processing-queue";
    private Duration retention = Duration.ofHours(24);

    // Event receiver settings
    private String serverHost = "0.0.0.0";
    private int serverPort = 8090;

    // Queue settings
    private Duration throttleWindow = Duration.ofMillis(250);
    private Duration pollInterval = Duration.ofMillis(250);
    private Duration taskTimeout = Duration.ofHours(6);
    private int submitThreads = 4;
    private SubmissionMode submissionMode = SubmissionMode.SEQUENTIAL;
    private boolean reconcileOnStartup = true;

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    public static QueueConfig fromEnv() {
        QueueConfig config = new QueueConfig();

        String backendUrl = System.getenv("CLIPQUEUE_BACKEND_URL");
        if (backendUrl != null && !backendUrl.isBlank()) {
            config.backendBaseUrl = backendUrl;
        }

        String dbUrl = System.getenv("CLIPQUEUE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("CLIPQUEUE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String mode = System.getenv("CLIPQUEUE_SUBMISSION_MODE");
        if (mode != null && !mode.isBlank()) {
            config.submissionMode = SubmissionMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        }

        String timeout = System.getenv("CLIPQUEUE_TASK_TIMEOUT_MINUTES");
        if (timeout != null && !timeout.isBlank()) {
            config.taskTimeout = Duration.ofMinutes(Long.parseLong(timeout));
        }

        return config;
    }

    /**
     * Read settings from an INI file with optional sections
     * [BACKEND], [CACHE], [EVENTS] and [QUEUE]. Missing keys keep their defaults.
     */
    public static QueueConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        QueueConfig config = new QueueConfig();

        Profile.Section backend = ini.get("BACKEND");
        if (backend != null) {
            config.backendBaseUrl = opt(backend, "base_url", config.backendBaseUrl);
            config.backendRequestTimeout = Duration.ofSeconds(
                    Long.parseLong(opt(backend, "request_timeout_seconds", "30")));
        }

        Profile.Section cache = ini.get("CACHE");
        if (cache != null) {
            config.databaseUrl = opt(cache, "database_url", config.databaseUrl);
            config.databasePoolSize = Integer.parseInt(opt(cache, "pool_size", String.valueOf(config.databasePoolSize)));
            config.cacheKey = opt(cache, "key", config.cacheKey);
            config.retention = Duration.ofHours(Long.parseLong(opt(cache, "retention_hours", "24")));
        }

        Profile.Section events = ini.get("EVENTS");
        if (events != null) {
            config.serverHost = opt(events, "host", config.serverHost);
            config.serverPort = Integer.parseInt(opt(events, "port", String.valueOf(config.serverPort)));
        }

        Profile.Section queue = ini.get("QUEUE");
        if (queue != null) {
            config.throttleWindow = Duration.ofMillis(Long.parseLong(opt(queue, "throttle_ms", "250")));
            config.pollInterval = Duration.ofMillis(Long.parseLong(opt(queue, "poll_ms", "250")));
            config.taskTimeout = Duration.ofMinutes(Long.parseLong(opt(queue, "task_timeout_minutes", "360")));
            config.submitThreads = Integer.parseInt(opt(queue, "submit_threads", String.valueOf(config.submitThreads)));
            config.submissionMode = SubmissionMode.valueOf(
                    opt(queue, "mode", config.submissionMode.name()).trim().toUpperCase(Locale.ROOT));
            config.reconcileOnStartup = Boolean.parseBoolean(opt(queue, "reconcile_on_startup", "true"));
        }

        return config;
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    // Getters
    public String backendBaseUrl() {
        return backendBaseUrl;
    }

    public Duration backendRequestTimeout() {
        return backendRequestTimeout;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String cacheKey() {
        return cacheKey;
    }

    public Duration retention() {
        return retention;
    }

    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public Duration throttleWindow() {
        return throttleWindow;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public int submitThreads() {
        return submitThreads;
    }

    public SubmissionMode submissionMode() {
        return submissionMode;
    }

    public boolean reconcileOnStartup() {
        return reconcileOnStartup;
    }

    // Fluent setters for testing/customization
    public QueueConfig withBackendBaseUrl(String url) {
        this.backendBaseUrl = url;
        return this;
    }

    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QueueConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public QueueConfig withThrottleWindow(Duration window) {
        this.throttleWindow = window;
        return this;
    }

    public QueueConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public QueueConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = timeout;
        return this;
    }

    public QueueConfig withSubmissionMode(SubmissionMode mode) {
        this.submissionMode = mode;
        return this;
    }

    public QueueConfig withRetention(Duration retention) {
        this.retention = retention;
        return this;
    }

    public QueueConfig withReconcileOnStartup(boolean reconcile) {
        this.reconcileOnStartup = reconcile;
        return this;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "backendBaseUrl='" + backendBaseUrl + '\'' +
                ", databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", mode=" + submissionMode +
                ", throttleMs=" + throttleWindow.toMillis() +
                ", taskTimeout=" + taskTimeout +
                '}';
    }
}
