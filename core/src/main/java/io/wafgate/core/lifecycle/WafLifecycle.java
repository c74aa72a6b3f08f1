package io.wafgate.core.lifecycle;

import io.wafgate.core.error.InitializationException;
import io.wafgate.core.error.RuleSourceException;
import io.wafgate.core.model.WafConfig;
import io.wafgate.core.spi.EngineSettings;
import io.wafgate.core.spi.InspectionEngine;
import io.wafgate.core.spi.InspectionEngineFactory;
import io.wafgate.core.spi.MatchedRuleListener;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the inspection engine exactly once and holds the process-wide block
 * message.
 *
 * <p>
 * The first {@link #initialize(WafConfig)} call validates the rule sources,
 * asks the {@link InspectionEngineFactory} for an engine and records the
 * outcome: either an immutable {@link EngineHandle} or a permanent failure.
 * Every later call, from any thread, is a no-op. Callers that arrive while
 * construction is in progress wait for it and then read the outcome through
 * {@link #state()}. A failure is never retried.
 *
 * <p>
 * After initialization the handle is read without locking.
 */
public final class WafLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(WafLifecycle.class);

    public static final String DEFAULT_BLOCK_MESSAGE = "Request blocked by Web Application Firewall";

    private final Supplier<InspectionEngineFactory> factorySupplier;
    private final Object lock = new Object();

    private volatile boolean attempted;
    private volatile EngineHandle handle;
    private volatile InitializationException failure;
    private volatile String blockMessage = DEFAULT_BLOCK_MESSAGE;

    /** Creates an independent lifecycle that builds its engine with {@code factory}. */
    public WafLifecycle(InspectionEngineFactory factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        this.factorySupplier = () -> factory;
    }

    private WafLifecycle(Supplier<InspectionEngineFactory> factorySupplier) {
        this.factorySupplier = factorySupplier;
    }

    /**
     * The process-wide lifecycle. Its engine factory is discovered with
     * {@link ServiceLoader} on first initialization.
     */
    public static WafLifecycle global() {
        return GlobalHolder.INSTANCE;
    }

    private static final class GlobalHolder {
        static final WafLifecycle INSTANCE = new WafLifecycle(WafLifecycle::discoverFactory);
    }

    /**
     * Initializes with a configuration listing only {@code ruleFiles}, other
     * fields at their defaults. With no paths, {@link WafConfig#defaults()} is
     * used.
     *
     * @throws InitializationException on the first call, if construction fails
     */
    public void initialize(String... ruleFiles) {
        if (ruleFiles == null || ruleFiles.length == 0) {
            initialize(WafConfig.defaults());
        } else {
            initialize(WafConfig.builder().ruleFiles(Arrays.asList(ruleFiles)).build());
        }
    }

    /**
     * Builds the engine if no attempt has been made yet.
     *
     * @throws InitializationException on the call that made the attempt, if it
     *                                 failed; later calls never throw
     */
    public void initialize(WafConfig config) {
        if (attempted) {
            return;
        }
        synchronized (lock) {
            if (attempted) {
                return;
            }
            try {
                handle = build(config);
                LOG.info(
                        "WAF engine initialized: engine={}, rules={}, mode={}, contextAware={}",
                        handle.engine().getClass().getSimpleName(),
                        config.ruleFiles().size(),
                        config.ruleEngine().directive(),
                        handle.contextAware());
            } catch (InitializationException e) {
                recordFailure(e);
                throw e;
            } catch (RuntimeException e) {
                InitializationException wrapped =
                        new InitializationException("Engine construction failed: " + e.getMessage(), e);
                recordFailure(wrapped);
                throw wrapped;
            } catch (ServiceConfigurationError | LinkageError e) {
                InitializationException wrapped =
                        new InitializationException("Engine construction failed: " + e.getMessage(), e);
                recordFailure(wrapped);
                throw wrapped;
            } catch (Error e) {
                // recorded so the lifecycle never stays uninitialized, then rethrown as is
                recordFailure(new InitializationException("Engine construction aborted: " + e, e));
                throw e;
            } finally {
                attempted = true;
            }
        }
    }

    private void recordFailure(InitializationException e) {
        failure = e;
        LOG.error("WAF initialization failed: {}", e.getMessage(), e);
    }

    private EngineHandle build(WafConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        List<Path> sources = resolveRuleSources(config);
        MatchedRuleListener errorListener = config.errorLogEnabled() ? new MatchedRuleLogger() : null;
        EngineSettings settings = new EngineSettings(config, sources, errorListener);

        InspectionEngineFactory factory = factorySupplier.get();
        InspectionEngine engine = factory.create(settings);
        if (engine == null) {
            throw new InitializationException(
                    "Engine factory " + factory.getClass().getName() + " returned no engine");
        }
        return EngineHandle.of(engine);
    }

    static List<Path> resolveRuleSources(WafConfig config) {
        if (config.ruleFiles().isEmpty()) {
            throw new RuleSourceException("No rule sources configured", null);
        }
        List<Path> resolved = new ArrayList<>(config.ruleFiles().size());
        for (String location : config.ruleFiles()) {
            Path path;
            try {
                path = config.rootDir().resolve(location).normalize();
            } catch (InvalidPathException e) {
                throw new RuleSourceException("Invalid rule source path: " + location, location, e);
            }
            if (!Files.isRegularFile(path)) {
                throw new RuleSourceException("Rule source not found or not a regular file: " + path, location);
            }
            if (!Files.isReadable(path)) {
                throw new RuleSourceException("Rule source not readable: " + path, location);
            }
            resolved.add(path);
        }
        return resolved;
    }

    private static InspectionEngineFactory discoverFactory() {
        Iterator<InspectionEngineFactory> it =
                ServiceLoader.load(InspectionEngineFactory.class).iterator();
        if (!it.hasNext()) {
            throw new InitializationException(
                    "No " + InspectionEngineFactory.class.getName() + " registered on the classpath");
        }
        InspectionEngineFactory factory = it.next();
        if (it.hasNext()) {
            LOG.warn(
                    "Multiple engine factories registered, using the first: factory={}",
                    factory.getClass().getName());
        }
        return factory;
    }

    public LifecycleState state() {
        if (handle != null) {
            return LifecycleState.READY;
        }
        return failure != null ? LifecycleState.FAILED : LifecycleState.UNINITIALIZED;
    }

    /** The engine handle, or {@code null} unless {@link #state()} is {@code READY}. */
    public EngineHandle handle() {
        return handle;
    }

    /** The recorded initialization failure, or {@code null}. */
    public InitializationException failure() {
        return failure;
    }

    /** Replaces the block message; {@code null} or empty values are ignored. */
    public void setBlockMessage(String message) {
        if (message == null || message.isEmpty()) {
            return;
        }
        blockMessage = message;
    }

    public String blockMessage() {
        return blockMessage;
    }
}
