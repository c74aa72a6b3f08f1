package io.wafgate.standalone.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.wafgate.core.lifecycle.WafLifecycle;
import io.wafgate.standalone.config.ConfigLoader;
import io.wafgate.standalone.config.GatewayConfig;
import io.wafgate.standalone.filter.WafFilter;
import jakarta.servlet.DispatcherType;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import org.eclipse.jetty.servlet.FilterHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the example gateway: a Javalin server whose routes sit behind the
 * {@link WafFilter}.
 *
 * <p>
 * Startup:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Initialize the engine (a failure aborts startup)</li>
 * <li>Set the block message</li>
 * <li>Start Javalin with the filter on {@code /*} ahead of every route</li>
 * </ol>
 *
 * <p>
 * Routes: {@code GET /} returns a greeting, {@code POST /submit} echoes the
 * {@code name} form field as JSON, plus the liveness endpoint when enabled.
 *
 * <p>
 * Separate from {@link io.wafgate.standalone.StandaloneMain} so tests can
 * start and stop it without going through {@code main()}.
 */
public final class GatewayApp {

    private static final Logger LOG = LoggerFactory.getLogger(GatewayApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String GREETING = "Hello, Javalin with waf-gate!";

    private final Javalin app;
    private final WafLifecycle lifecycle;
    private final GatewayConfig config;

    private GatewayApp(Javalin app, WafLifecycle lifecycle, GatewayConfig config) {
        this.app = app;
        this.lifecycle = lifecycle;
        this.config = config;
    }

    /**
     * Loads configuration (see {@link ConfigLoader#resolveConfigPath}) and starts
     * the gateway on the process-wide lifecycle.
     */
    public static GatewayApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        GatewayConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, WafLifecycle.global());
    }

    /**
     * Starts the gateway with an explicit lifecycle.
     *
     * @throws io.wafgate.core.error.InitializationException if the engine
     *                                                      cannot be built
     */
    public static GatewayApp start(GatewayConfig config, WafLifecycle lifecycle) {
        Objects.requireNonNull(config, "config must not be null");
        long startTime = System.nanoTime();

        lifecycle.initialize(config.waf());
        lifecycle.setBlockMessage(config.blockMessage());

        WafFilter filter = new WafFilter(lifecycle, config.blockStatus());
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jetty.modifyServletContextHandler(handler ->
                    handler.addFilter(new FilterHolder(filter), "/*", EnumSet.of(DispatcherType.REQUEST)));
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler(lifecycle));
        }
        app.get("/", ctx -> ctx.result(GREETING));
        app.post("/submit", GatewayApp::submit);

        app.start(config.serverHost(), config.serverPort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "waf-gate started: port={}, rules={}, mode={}, blockStatus={}, startupMs={}",
                app.port(),
                config.waf().ruleFiles(),
                config.waf().ruleEngine().directive(),
                config.blockStatus(),
                elapsedMs);
        return new GatewayApp(app, lifecycle, config);
    }

    private static void submit(Context ctx) throws Exception {
        String name = ctx.formParam("name");
        ObjectNode body = MAPPER.createObjectNode();
        body.put("message", "Received name: " + (name != null ? name : ""));
        ctx.contentType("application/json");
        ctx.result(MAPPER.writeValueAsString(body));
    }

    /** Returns the port the gateway is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public WafLifecycle lifecycle() {
        return lifecycle;
    }

    public GatewayConfig config() {
        return config;
    }

    /** Stops the HTTP server. The engine stays initialized. */
    public void stop() {
        app.stop();
        LOG.info("waf-gate stopped");
    }
}
