package com.pcat.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the plugin catalog.
 * <p>
 * Archive: PCAT_PLUGINS_ZIP_PATH (local path or http(s) URL), PCAT_TEMP_DIR.
 * HTTP: PCAT_HTTP_CONNECT_TIMEOUT_SECONDS, PCAT_HTTP_REQUEST_TIMEOUT_SECONDS.
 * DB: PCAT_CATALOG_DB_ENABLED, PCAT_DB_HOST, PCAT_DB_PORT, PCAT_DB_NAME, PCAT_DB_USER,
 * PCAT_DB_PASSWORD, PCAT_DB_QUERY_TIMEOUT_SECONDS.
 */
public final class CatalogConfig {

    private static final String ENV_PLUGINS_ZIP_PATH = "PCAT_PLUGINS_ZIP_PATH";
    private static final String ENV_TEMP_DIR = "PCAT_TEMP_DIR";
    private static final String ENV_HTTP_CONNECT_TIMEOUT_SECONDS = "PCAT_HTTP_CONNECT_TIMEOUT_SECONDS";
    private static final String ENV_HTTP_REQUEST_TIMEOUT_SECONDS = "PCAT_HTTP_REQUEST_TIMEOUT_SECONDS";
    private static final String ENV_CATALOG_DB_ENABLED = "PCAT_CATALOG_DB_ENABLED";
    private static final String ENV_DB_HOST = "PCAT_DB_HOST";
    private static final String ENV_DB_PORT = "PCAT_DB_PORT";
    private static final String ENV_DB_NAME = "PCAT_DB_NAME";
    private static final String ENV_DB_USER = "PCAT_DB_USER";
    private static final String ENV_DB_PASSWORD = "PCAT_DB_PASSWORD";
    private static final String ENV_DB_QUERY_TIMEOUT_SECONDS = "PCAT_DB_QUERY_TIMEOUT_SECONDS";

    private static final int DEFAULT_HTTP_CONNECT_TIMEOUT_SECONDS = 10;
    private static final int DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS = 120;
    private static final boolean DEFAULT_CATALOG_DB_ENABLED = true;
    private static final String DEFAULT_DB_HOST = "localhost";
    private static final int DEFAULT_DB_PORT = 5432;
    private static final String DEFAULT_DB_NAME = "pcat";
    private static final String DEFAULT_DB_USER = "pcat";
    private static final int DEFAULT_DB_QUERY_TIMEOUT_SECONDS = 30;

    private final String pluginsZipPath;
    private final String tempDir;
    private final int httpConnectTimeoutSeconds;
    private final int httpRequestTimeoutSeconds;
    private final boolean catalogDbEnabled;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final int dbQueryTimeoutSeconds;

    private CatalogConfig(Builder b) {
        this.pluginsZipPath = b.pluginsZipPath;
        this.tempDir = b.tempDir != null ? b.tempDir : System.getProperty("java.io.tmpdir");
        this.httpConnectTimeoutSeconds = Math.max(1, b.httpConnectTimeoutSeconds);
        this.httpRequestTimeoutSeconds = Math.max(1, b.httpRequestTimeoutSeconds);
        this.catalogDbEnabled = b.catalogDbEnabled;
        this.dbHost = b.dbHost != null ? b.dbHost : DEFAULT_DB_HOST;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.dbQueryTimeoutSeconds = Math.max(0, b.dbQueryTimeoutSeconds);
    }

    /**
     * Location of the plugin manifest archive: an existing local file path or an http(s) URL.
     * May be null; a populate pass fails with {@link CatalogConfigurationException} when it is.
     */
    public String getPluginsZipPath() {
        return pluginsZipPath;
    }

    /** Directory for downloaded archives (PCAT_TEMP_DIR). Default {@code java.io.tmpdir}. */
    public String getTempDir() {
        return tempDir;
    }

    public Duration getHttpConnectTimeout() {
        return Duration.ofSeconds(httpConnectTimeoutSeconds);
    }

    public Duration getHttpRequestTimeout() {
        return Duration.ofSeconds(httpRequestTimeoutSeconds);
    }

    /** Whether the catalog is persisted via JDBC (PCAT_CATALOG_DB_ENABLED). False = in-memory catalog. */
    public boolean isCatalogDbEnabled() {
        return catalogDbEnabled;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    /** Database name (PCAT_DB_NAME). Default "pcat". */
    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    /** Per-statement query timeout in seconds; 0 = driver default (no limit). */
    public int getDbQueryTimeoutSeconds() {
        return dbQueryTimeoutSeconds;
    }

    public static CatalogConfig fromEnvironment() {
        return builder()
                .pluginsZipPath(getEnv(ENV_PLUGINS_ZIP_PATH, null))
                .tempDir(getEnv(ENV_TEMP_DIR, null))
                .httpConnectTimeoutSeconds(parseInt(System.getenv(ENV_HTTP_CONNECT_TIMEOUT_SECONDS), DEFAULT_HTTP_CONNECT_TIMEOUT_SECONDS))
                .httpRequestTimeoutSeconds(parseInt(System.getenv(ENV_HTTP_REQUEST_TIMEOUT_SECONDS), DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS))
                .catalogDbEnabled(parseBoolean(System.getenv(ENV_CATALOG_DB_ENABLED), DEFAULT_CATALOG_DB_ENABLED))
                .dbHost(getEnv(ENV_DB_HOST, DEFAULT_DB_HOST))
                .dbPort(parseInt(System.getenv(ENV_DB_PORT), DEFAULT_DB_PORT))
                .dbName(getEnv(ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(getEnv(ENV_DB_PASSWORD, ""))
                .dbQueryTimeoutSeconds(parseInt(System.getenv(ENV_DB_QUERY_TIMEOUT_SECONDS), DEFAULT_DB_QUERY_TIMEOUT_SECONDS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String pluginsZipPath;
        private String tempDir;
        private int httpConnectTimeoutSeconds = DEFAULT_HTTP_CONNECT_TIMEOUT_SECONDS;
        private int httpRequestTimeoutSeconds = DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS;
        private boolean catalogDbEnabled = DEFAULT_CATALOG_DB_ENABLED;
        private String dbHost = DEFAULT_DB_HOST;
        private int dbPort = DEFAULT_DB_PORT;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private int dbQueryTimeoutSeconds = DEFAULT_DB_QUERY_TIMEOUT_SECONDS;

        public Builder pluginsZipPath(String pluginsZipPath) {
            this.pluginsZipPath = pluginsZipPath;
            return this;
        }

        public Builder tempDir(String tempDir) {
            this.tempDir = tempDir;
            return this;
        }

        public Builder httpConnectTimeoutSeconds(int httpConnectTimeoutSeconds) {
            this.httpConnectTimeoutSeconds = httpConnectTimeoutSeconds;
            return this;
        }

        public Builder httpRequestTimeoutSeconds(int httpRequestTimeoutSeconds) {
            this.httpRequestTimeoutSeconds = httpRequestTimeoutSeconds;
            return this;
        }

        public Builder catalogDbEnabled(boolean catalogDbEnabled) {
            this.catalogDbEnabled = catalogDbEnabled;
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder dbQueryTimeoutSeconds(int dbQueryTimeoutSeconds) {
            this.dbQueryTimeoutSeconds = dbQueryTimeoutSeconds;
            return this;
        }

        public CatalogConfig build() {
            return new CatalogConfig(this);
        }
    }

    @Override
    public String toString() {
        return "CatalogConfig{pluginsZipPath=" + pluginsZipPath
                + ", tempDir=" + tempDir
                + ", catalogDbEnabled=" + catalogDbEnabled
                + ", db=" + dbHost + ":" + dbPort + "/" + dbName
                + ", dbUser=" + dbUser
                + ", dbQueryTimeoutSeconds=" + dbQueryTimeoutSeconds
                + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogConfig that = (CatalogConfig) o;
        return httpConnectTimeoutSeconds == that.httpConnectTimeoutSeconds
                && httpRequestTimeoutSeconds == that.httpRequestTimeoutSeconds
                && catalogDbEnabled == that.catalogDbEnabled
                && dbPort == that.dbPort
                && dbQueryTimeoutSeconds == that.dbQueryTimeoutSeconds
                && Objects.equals(pluginsZipPath, that.pluginsZipPath)
                && Objects.equals(tempDir, that.tempDir)
                && Objects.equals(dbHost, that.dbHost)
                && Objects.equals(dbName, that.dbName)
                && Objects.equals(dbUser, that.dbUser)
                && Objects.equals(dbPassword, that.dbPassword);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pluginsZipPath, tempDir, httpConnectTimeoutSeconds, httpRequestTimeoutSeconds,
                catalogDbEnabled, dbHost, dbPort, dbName, dbUser, dbPassword, dbQueryTimeoutSeconds);
    }
}
