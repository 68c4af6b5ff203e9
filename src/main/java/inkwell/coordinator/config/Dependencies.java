package inkwell.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import inkwell.coordinator.agent.AgentAdapter;
import inkwell.coordinator.agent.AgentRuntime;
import inkwell.coordinator.api.v1.HealthController;
import inkwell.coordinator.api.v1.RunController;
import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.memory.TieredMemoryStore;
import inkwell.coordinator.monitor.PipelineMonitor;
import inkwell.coordinator.pipeline.PipelineScheduler;
import inkwell.coordinator.queue.InMemoryMessageQueue;
import inkwell.coordinator.queue.MessageQueue;
import inkwell.coordinator.repository.LongTermMemoryRepository;
import inkwell.coordinator.repository.PipelineRunRepository;
import inkwell.coordinator.repository.TaskLogRepository;
import inkwell.coordinator.resolver.ConflictRegistry;
import inkwell.coordinator.resolver.ConflictResolver;
import inkwell.coordinator.resolver.MergeStrategy;
import inkwell.coordinator.scheduler.LeaseReaper;
import inkwell.coordinator.scheduler.MaintenanceScheduler;
import inkwell.coordinator.scheduler.MemoryExpirySweeper;
import inkwell.coordinator.server.CoordinatorServer;
import inkwell.coordinator.server.RouterHandler;
import inkwell.coordinator.store.Database;
import inkwell.coordinator.store.JdbcLongTermMemoryRepository;
import inkwell.coordinator.store.JdbcPipelineRunRepository;
import inkwell.coordinator.store.JdbcTaskLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the coordinator components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.registerAgent(new ResearchAgent()); // one adapter per role
 * deps.start(); // agents, monitor, maintenance
 * PipelineRun run = deps.scheduler().start("Solar sails");
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final PipelineConfig pipelineConfig;
    private final Clock clock;
    private final ObjectMapper mapper;

    private final Database database;
    private final LongTermMemoryRepository longTermRepository;
    private final PipelineRunRepository runRepository;
    private final TaskLogRepository taskLogRepository;

    private final MessageQueue queue;
    private final MemoryStore memoryStore;
    private final ConflictRegistry conflictRegistry;
    private final ConflictResolver conflictResolver;
    private final PipelineMonitor monitor;
    private final PipelineScheduler scheduler;
    private final AgentRuntime agentRuntime;
    private final MaintenanceScheduler maintenance;

    // Controllers
    private final HealthController healthController;
    private final RunController runController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private CoordinatorServer server;
    private Thread monitorThread;

    private Dependencies(CoordinatorConfig config, PipelineConfig pipelineConfig, Clock clock) {
        this.config = config;
        this.pipelineConfig = pipelineConfig;
        this.clock = clock;
        this.mapper = RouterHandler.mapper();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.longTermRepository = new JdbcLongTermMemoryRepository(database);
        this.runRepository = new JdbcPipelineRunRepository(database);
        this.taskLogRepository = new JdbcTaskLogRepository(database);

        // Core
        this.queue = new InMemoryMessageQueue(pipelineConfig.queueCapacity(), pipelineConfig.queueLease(), clock);
        this.memoryStore = new TieredMemoryStore(longTermRepository, pipelineConfig.shortTermCapacity(),
                pipelineConfig.shortTermTtl(), clock);
        this.conflictRegistry = new ConflictRegistry();
        this.conflictResolver = new ConflictResolver(memoryStore, queue, conflictRegistry,
                pipelineConfig.ranking(), MergeStrategy.forName(pipelineConfig.mergeStrategy(), mapper), clock);
        this.monitor = new PipelineMonitor(queue, pipelineConfig.pollInterval(), clock);
        this.scheduler = new PipelineScheduler(pipelineConfig, queue, memoryStore, conflictResolver,
                runRepository, taskLogRepository, monitor, mapper, clock);
        this.agentRuntime = new AgentRuntime(queue, memoryStore, pipelineConfig.pollInterval(), clock);
        LeaseReaper leaseReaper = new LeaseReaper(queue, clock);
        MemoryExpirySweeper memorySweeper = new MemoryExpirySweeper(memoryStore, longTermRepository,
                pipelineConfig.longTermRetention(), clock);
        this.maintenance = new MaintenanceScheduler("inkwell-maintenance")
                .every("lease-reaper", config.leaseReaperInterval(), leaseReaper::reapExpiredLeases)
                .every("memory-sweeper", config.memorySweepInterval(), memorySweeper::sweep);

        // Controllers
        this.healthController = new HealthController(database, queue, scheduler);
        this.runController = new RunController(scheduler, monitor, taskLogRepository);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies, reading the pipeline definition from
     * {@link CoordinatorConfig#pipelineConfigPath()} when set.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return create(config, loadPipelineConfig(config));
    }

    public static Dependencies create(CoordinatorConfig config, PipelineConfig pipelineConfig) {
        return new Dependencies(config, pipelineConfig, Clock.systemUTC());
    }

    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    private static PipelineConfig loadPipelineConfig(CoordinatorConfig config) {
        String path = config.pipelineConfigPath();
        if (path == null || path.isBlank()) {
            log.info("No pipeline config file set, using defaults");
            return PipelineConfig.defaults();
        }
        try {
            return PipelineConfigLoader.load(new File(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline config " + path, e);
        }
    }

    /**
     * Register the adapter for one role, with {@link CoordinatorConfig#workersPerRole()} workers.
     */
    public Dependencies registerAgent(AgentAdapter adapter) {
        agentRuntime.register(adapter, config.workersPerRole());
        return this;
    }

    /**
     * Start agent workers, the resolution monitor and background maintenance.
     */
    public synchronized void start() {
        for (String role : pipelineConfig.roles()) {
            if (!agentRuntime.roles().contains(role)) {
                log.warn("No agent registered for role '{}'; its tasks will time out", role);
            }
        }
        agentRuntime.start();
        if (monitorThread == null) {
            monitorThread = new Thread(monitor, "inkwell-monitor");
            monitorThread.setDaemon(true);
            monitorThread.start();
        }
        maintenance.start();
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public PipelineConfig pipelineConfig() {
        return pipelineConfig;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public LongTermMemoryRepository longTermRepository() {
        return longTermRepository;
    }

    public PipelineRunRepository runRepository() {
        return runRepository;
    }

    public TaskLogRepository taskLogRepository() {
        return taskLogRepository;
    }

    public MessageQueue queue() {
        return queue;
    }

    public MemoryStore memoryStore() {
        return memoryStore;
    }

    public ConflictResolver conflictResolver() {
        return conflictResolver;
    }

    public PipelineMonitor monitor() {
        return monitor;
    }

    public PipelineScheduler scheduler() {
        return scheduler;
    }

    public AgentRuntime agentRuntime() {
        return agentRuntime;
    }

    public MaintenanceScheduler maintenance() {
        return maintenance;
    }

    /**
     * Fully configured router with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(runController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized CoordinatorServer server() {
        if (server == null) {
            server = new CoordinatorServer(config, routerHandler());
        }
        return server;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            closeQuietly("server", server::stop);
        }
        closeQuietly("pipeline scheduler", scheduler::close);
        closeQuietly("agent runtime", agentRuntime::close);
        closeQuietly("maintenance scheduler", maintenance::stop);
        if (monitorThread != null) {
            monitorThread.interrupt();
        }
        closeQuietly("database", database::close);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String what, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.warn("Error stopping {}: {}", what, e.getMessage());
        }
    }
}
