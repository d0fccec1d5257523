package io.routeweave.standalone;

import io.routeweave.standalone.server.RouteWeaveApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Delegates to {@link RouteWeaveApp#start(String[])}; on failure
 * logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --config path/to/routeweave.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            RouteWeaveApp app = RouteWeaveApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "routeweave-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
