package io.routeweave.standalone.server;

import io.javalin.Javalin;
import io.routeweave.core.coordinator.FetchCoordinator;
import io.routeweave.core.fetch.FetcherFactory;
import io.routeweave.core.merge.ConfigMergeEngine;
import io.routeweave.core.reconcile.PollingWatcher;
import io.routeweave.core.reconcile.ResourceReconciler;
import io.routeweave.core.reconcile.ServiceReconciler;
import io.routeweave.core.store.Database;
import io.routeweave.core.store.JdbcOverrideStore;
import io.routeweave.core.store.JdbcResourceStore;
import io.routeweave.core.store.JdbcServiceStore;
import io.routeweave.core.store.JdbcSettingsStore;
import io.routeweave.standalone.config.ConfigLoader;
import io.routeweave.standalone.config.RouteWeaveConfig;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root: builds every component from a {@link RouteWeaveConfig},
 * starts the watchers and the HTTP server, and tears them down again.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay and configure logging</li>
 * <li>Open the connection pool and migrate the schema</li>
 * <li>Create the upstream fetcher behind a fetch coordinator</li>
 * <li>Create the merge engine over the stores</li>
 * <li>Start the Javalin server</li>
 * <li>Start the resource and service watchers (if enabled)</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.routeweave.standalone.StandaloneMain} so tests
 * can start an instance without going through {@code main()}.
 */
public final class RouteWeaveApp {

    private static final Logger LOG = LoggerFactory.getLogger(RouteWeaveApp.class);

    private final Javalin app;
    private final Database database;
    private final FetchCoordinator fetcher;
    private final ConfigMergeEngine mergeEngine;
    private final List<PollingWatcher> watchers;
    private final RouteWeaveConfig config;

    private RouteWeaveApp(
            Javalin app,
            Database database,
            FetchCoordinator fetcher,
            ConfigMergeEngine mergeEngine,
            List<PollingWatcher> watchers,
            RouteWeaveConfig config) {
        this.app = app;
        this.database = database;
        this.fetcher = fetcher;
        this.mergeEngine = mergeEngine;
        this.watchers = watchers;
        this.config = config;
    }

    /**
     * Loads configuration from the command line arguments and starts.
     *
     * @param args command-line arguments, e.g. {@code --config routeweave.yaml}
     */
    public static RouteWeaveApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        RouteWeaveConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /** Starts an instance from an already built configuration. */
    public static RouteWeaveApp start(RouteWeaveConfig config) {
        long startTime = System.nanoTime();
        Clock clock = Clock.systemUTC();

        Database database = Database.open(
                config.databaseUrl(),
                config.databaseUsername(),
                config.databasePassword(),
                config.databaseMaxPoolSize());
        FetchCoordinator fetcher = null;
        try {
            database.migrate();

            JdbcResourceStore resources = new JdbcResourceStore(database, clock);
            JdbcServiceStore services = new JdbcServiceStore(database, clock);
            JdbcOverrideStore overrides = new JdbcOverrideStore(database, clock);
            JdbcSettingsStore settings = new JdbcSettingsStore(database, clock);

            fetcher = new FetchCoordinator(FetcherFactory.create(config.dataSource()), config.fetchMinInterval(), clock);

            ConfigMergeEngine mergeEngine = new ConfigMergeEngine(
                    fetcher,
                    overrides,
                    services,
                    settings,
                    settings,
                    config.mergeCacheTtl(),
                    ConfigMergeEngine.DEFAULT_FETCH_TIMEOUT,
                    clock);

            Javalin app = Javalin.create();
            app.get(config.configPath(), new ConfigDocumentHandler(mergeEngine));
            app.post(config.invalidatePath(), new InvalidateHandler(mergeEngine));
            app.get("/health", new HealthHandler());
            app.get("/ready", new ReadinessHandler(() -> mergeEngine.lastMerged().isPresent()));
            app.exception(Exception.class, (e, ctx) -> {
                LOG.error("Unhandled error serving {}", ctx.path(), e);
                ctx.status(500);
                ctx.contentType(ProblemDetail.CONTENT_TYPE);
                ctx.result(ProblemDetail.internalError(e.getMessage(), ctx.path()).toString());
            });
            app.start(config.serverHost(), config.serverPort());

            List<PollingWatcher> watchers = new ArrayList<>();
            if (config.watcherEnabled()) {
                watchers.add(new PollingWatcher(
                        new ResourceReconciler(fetcher, resources, ConfigMergeEngine.DEFAULT_FETCH_TIMEOUT),
                        config.watcherInterval()));
                watchers.add(new PollingWatcher(
                        new ServiceReconciler(fetcher, services, ConfigMergeEngine.DEFAULT_FETCH_TIMEOUT),
                        config.watcherInterval()));
                watchers.forEach(PollingWatcher::start);
            }

            long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
            LOG.info(
                    "routeweave started: port={}, source={} {}, configPath={}, watchers={}, startupMs={}",
                    app.port(),
                    config.datasourceType().value(),
                    config.datasourceUrl(),
                    config.configPath(),
                    watchers.size(),
                    elapsedMs);

            return new RouteWeaveApp(app, database, fetcher, mergeEngine, watchers, config);
        } catch (RuntimeException e) {
            if (fetcher != null) {
                fetcher.close();
            }
            database.close();
            throw e;
        }
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public ConfigMergeEngine mergeEngine() {
        return mergeEngine;
    }

    public Database database() {
        return database;
    }

    public List<PollingWatcher> watchers() {
        return List.copyOf(watchers);
    }

    public RouteWeaveConfig config() {
        return config;
    }

    /** Stops the watchers, the HTTP server, the upstream fetcher and the connection pool, in that order. */
    public void stop() {
        watchers.forEach(PollingWatcher::stop);
        app.stop();
        fetcher.close();
        database.close();
        LOG.info("routeweave stopped");
    }
}
