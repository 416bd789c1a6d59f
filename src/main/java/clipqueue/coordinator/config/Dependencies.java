package clipqueue.coordinator.config;

import clipqueue.coordinator.api.internal.v1.EventController;
import clipqueue.coordinator.api.v1.JobController;
import clipqueue.coordinator.backend.HttpProcessingBackend;
import clipqueue.coordinator.backend.ProcessingBackend;
import clipqueue.coordinator.events.InMemoryEventBus;
import clipqueue.coordinator.events.ProgressEventBus;
import clipqueue.coordinator.server.EventReceiverServer;
import clipqueue.coordinator.server.RouterHandler;
import clipqueue.coordinator.service.BackendReconciler;
import clipqueue.coordinator.service.CompletionWaiter;
import clipqueue.coordinator.service.ProgressAggregator;
import clipqueue.coordinator.service.TaskSubmitter;
import clipqueue.coordinator.service.VideoQueueService;
import clipqueue.coordinator.store.Database;
import clipqueue.coordinator.store.JdbcJobCache;
import clipqueue.coordinator.store.JobStore;
import clipqueue.coordinator.util.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(QueueConfig.fromEnv());
 * deps.start(); // restore cache, open the event receiver, reconcile
 * VideoQueueService queue = deps.queueService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final Database database;
    private final JdbcJobCache jobCache;
    private final JobStore jobStore;
    private final ProcessingBackend backend;
    private final ProgressEventBus eventBus;
    private final ProgressAggregator aggregator;
    private final Subscription aggregatorSubscription;
    private final TaskSubmitter taskSubmitter;
    private final CompletionWaiter completionWaiter;
    private final BackendReconciler reconciler;
    private final VideoQueueService queueService;

    // Controllers
    private final JobController jobController;
    private final EventController eventController;

    private RouterHandler routerHandler;
    private EventReceiverServer server;

    private Dependencies(QueueConfig config, ProcessingBackend backend, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.jobCache = new JdbcJobCache(database, config.cacheKey());
        this.jobStore = new JobStore(jobCache, config.throttleWindow(), clock);
        this.backend = backend;
        this.eventBus = new InMemoryEventBus();

        // Services
        this.aggregator = new ProgressAggregator(jobStore, backend);
        this.aggregatorSubscription = eventBus.subscribe(aggregator);
        this.taskSubmitter = new TaskSubmitter(jobStore, backend);
        this.completionWaiter = new CompletionWaiter(jobStore, config.pollInterval());
        this.reconciler = new BackendReconciler(jobStore, backend, aggregator);
        this.queueService = new VideoQueueService(jobStore, taskSubmitter, completionWaiter, reconciler, config, clock);

        // Controllers
        this.jobController = new JobController(queueService);
        this.eventController = new EventController(eventBus);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(QueueConfig config) {
        return create(config, new HttpProcessingBackend(config.backendBaseUrl(), config.backendRequestTimeout()));
    }

    /**
     * Create dependencies with a given backend (e.g. a fake in tests).
     */
    public static Dependencies create(QueueConfig config, ProcessingBackend backend) {
        return new Dependencies(config, backend, Clock.systemUTC());
    }

    /**
     * Restore cached jobs, start the event receiver and, if configured,
     * reconcile with the backend.
     */
    public void start() {
        int kept = queueService.restore(jobCache.load());
        log.info("Restored {} jobs from cache", kept);

        server = new EventReceiverServer(routerHandler());
        server.start(config.serverHost(), config.serverPort());

        if (config.reconcileOnStartup()) {
            queueService.reconcile();
        }
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JdbcJobCache jobCache() {
        return jobCache;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public ProcessingBackend backend() {
        return backend;
    }

    public ProgressEventBus eventBus() {
        return eventBus;
    }

    public ProgressAggregator aggregator() {
        return aggregator;
    }

    public VideoQueueService queueService() {
        return queueService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(eventController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping event receiver: {}", e.getMessage());
            }
        }

        aggregatorSubscription.close();
        queueService.close();
        aggregator.close();
        jobStore.close(); // writes the last snapshot

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
