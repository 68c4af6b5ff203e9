package inkwell.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for process-level coordinator settings.
 * Pipeline behaviour lives in {@link PipelineConfig}. All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/inkwell;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Background maintenance
    private Duration leaseReaperInterval = Duration.ofSeconds(5);
    private Duration memorySweepInterval = Duration.ofSeconds(30);

    // Agent workers
    private int workersPerRole = 1;

    // Pipeline definition file (INI); defaults are used when unset
    private String pipelineConfigPath = null;

    // Auth settings (optional)
    private String operatorKey = null; // If set, mutating API calls must provide X-Inkwell-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("INKWELL_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("INKWELL_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String host = System.getenv("INKWELL_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String operatorKey = System.getenv("INKWELL_OPERATOR_KEY");
        if (operatorKey != null && !operatorKey.isBlank()) {
            config.operatorKey = operatorKey;
        }

        String pipelineConfig = System.getenv("INKWELL_PIPELINE_CONFIG");
        if (pipelineConfig != null && !pipelineConfig.isBlank()) {
            config.pipelineConfigPath = pipelineConfig;
        }

        String workers = System.getenv("INKWELL_WORKERS_PER_ROLE");
        if (workers != null && !workers.isBlank()) {
            config.workersPerRole = Integer.parseInt(workers);
        }

        return config;
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

    public Duration leaseReaperInterval() {
        return leaseReaperInterval;
    }

    public Duration memorySweepInterval() {
        return memorySweepInterval;
    }

    public int workersPerRole() {
        return workersPerRole;
    }

    public String pipelineConfigPath() {
        return pipelineConfigPath;
    }

    public String operatorKey() {
        return operatorKey;
    }

    public boolean hasOperatorKey() {
        return operatorKey != null && !operatorKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withOperatorKey(String key) {
        this.operatorKey = key;
        return this;
    }

    public CoordinatorConfig withLeaseReaperInterval(Duration interval) {
        this.leaseReaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withMemorySweepInterval(Duration interval) {
        this.memorySweepInterval = interval;
        return this;
    }

    public CoordinatorConfig withWorkersPerRole(int workers) {
        this.workersPerRole = workers;
        return this;
    }

    public CoordinatorConfig withPipelineConfigPath(String path) {
        this.pipelineConfigPath = path;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workersPerRole=" + workersPerRole +
                ", pipelineConfig=" + pipelineConfigPath +
                ", operatorKeySet=" + hasOperatorKey() +
                '}';
    }
}
