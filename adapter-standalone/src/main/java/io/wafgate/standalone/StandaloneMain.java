package io.wafgate.standalone;

import io.wafgate.standalone.gateway.GatewayApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone gateway.
 *
 * <p>
 * Delegates to {@link GatewayApp#start(String[])}. On failure, logs the error
 * and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/waf-gate.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            GatewayApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
