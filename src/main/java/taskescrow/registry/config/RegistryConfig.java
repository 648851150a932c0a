package taskescrow.registry.config;

import taskescrow.registry.model.Task;

/**
 * Configuration holder for the task registry service.
 * All settings have sensible defaults.
 */
public final class RegistryConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskescrow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Platform settings, applied only when the registry is first initialized
    private String owner = "platform-owner";
    private int initialFeePercentage = 5;

    // Auth settings (optional)
    private String apiKey = null; // If set, mutating calls must provide X-Registry-Key header

    private RegistryConfig() {
    }

    public static RegistryConfig defaults() {
        return new RegistryConfig();
    }

    public static RegistryConfig fromEnv() {
        RegistryConfig config = new RegistryConfig();

        String dbUrl = System.getenv("TASKESCROW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("TASKESCROW_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize);
        }

        String host = System.getenv("TASKESCROW_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("TASKESCROW_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String owner = System.getenv("TASKESCROW_OWNER");
        if (owner != null && !owner.isBlank()) {
            config.owner = owner;
        }

        String fee = System.getenv("TASKESCROW_FEE_PERCENT");
        if (fee != null && !fee.isBlank()) {
            config.initialFeePercentage = Integer.parseInt(fee);
        }

        String apiKey = System.getenv("TASKESCROW_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        return config.validate();
    }

    /**
     * Reject settings the registry cannot start with.
     */
    public RegistryConfig validate() {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner identity is required");
        }
        if (owner.length() > Task.MAX_IDENTITY_LENGTH) {
            throw new IllegalArgumentException("owner identity exceeds " + Task.MAX_IDENTITY_LENGTH + " characters");
        }
        if (initialFeePercentage < 0 || initialFeePercentage > 10) {
            throw new IllegalArgumentException("fee percentage must be between 0 and 10, got " + initialFeePercentage);
        }
        if (databasePoolSize <= 0) {
            throw new IllegalArgumentException("database pool size must be positive");
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String owner() {
        return owner;
    }

    public int initialFeePercentage() {
        return initialFeePercentage;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // Fluent setters for testing/customization
    public RegistryConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public RegistryConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public RegistryConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public RegistryConfig withOwner(String owner) {
        this.owner = owner;
        return this;
    }

    public RegistryConfig withInitialFeePercentage(int pct) {
        this.initialFeePercentage = pct;
        return this;
    }

    public RegistryConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "RegistryConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", owner='" + owner + '\'' +
                ", initialFee=" + initialFeePercentage +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
