package taskescrow.registry.config;

import taskescrow.registry.api.v1.HealthController;
import taskescrow.registry.api.v1.PlatformController;
import taskescrow.registry.api.v1.TaskController;
import taskescrow.registry.api.v1.UserController;
import taskescrow.registry.core.TaskEventBus;
import taskescrow.registry.funds.AccountLedger;
import taskescrow.registry.funds.FundsTransfer;
import taskescrow.registry.model.PlatformState;
import taskescrow.registry.repository.ParticipantRepository;
import taskescrow.registry.repository.PlatformRepository;
import taskescrow.registry.repository.TaskRepository;
import taskescrow.registry.server.RouterHandler;
import taskescrow.registry.service.TaskRegistry;
import taskescrow.registry.store.Database;
import taskescrow.registry.store.JdbcParticipantRepository;
import taskescrow.registry.store.JdbcPlatformRepository;
import taskescrow.registry.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the registry, its storage and the HTTP controllers.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(RegistryConfig.fromEnv());
 * TaskRegistry registry = deps.taskRegistry();
 * // ... use the registry ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RegistryConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final ParticipantRepository participantRepository;
    private final PlatformRepository platformRepository;
    private final FundsTransfer funds;
    private final TaskEventBus eventBus;
    private final TaskRegistry taskRegistry;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final UserController userController;
    private final PlatformController platformController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(RegistryConfig config, FundsTransfer funds, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.funds = funds;
        this.eventBus = new TaskEventBus();

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.participantRepository = new JdbcParticipantRepository(database);
        this.platformRepository = new JdbcPlatformRepository(database);

        PlatformState state = platformRepository.initialize(config.owner(), config.initialFeePercentage());
        log.info("Platform owner: {}, fee: {}%, tasks so far: {}",
                state.owner(), state.platformFeePercentage(), state.taskCounter());

        // Services
        this.taskRegistry = new TaskRegistry(database, taskRepository, participantRepository,
                platformRepository, funds, eventBus, clock);

        // Controllers
        this.healthController = new HealthController(database, taskRegistry);
        this.taskController = new TaskController(taskRegistry);
        this.userController = new UserController(taskRegistry);
        this.platformController = new PlatformController(taskRegistry);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, an in-process ledger and the system clock.
     */
    public static Dependencies create(RegistryConfig config) {
        return create(config, new AccountLedger(), Clock.systemUTC());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(RegistryConfig.fromEnv());
    }

    /**
     * Create dependencies with a custom transfer mechanism and clock.
     */
    public static Dependencies create(RegistryConfig config, FundsTransfer funds, Clock clock) {
        return new Dependencies(config, funds, clock);
    }

    // Getters
    public RegistryConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public ParticipantRepository participantRepository() {
        return participantRepository;
    }

    public PlatformRepository platformRepository() {
        return platformRepository;
    }

    public FundsTransfer funds() {
        return funds;
    }

    public TaskEventBus eventBus() {
        return eventBus;
    }

    public TaskRegistry taskRegistry() {
        return taskRegistry;
    }

    // Controller getters
    public HealthController healthController() {
        return healthController;
    }

    public TaskController taskController() {
        return taskController;
    }

    public UserController userController() {
        return userController;
    }

    public PlatformController platformController() {
        return platformController;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(userController)
                    .registerController(platformController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
