package io.wafgate.core.spi;

import io.wafgate.core.error.EngineConfigurationException;

/**
 * Builds an {@link InspectionEngine} from validated settings.
 *
 * <p>
 * The process-wide lifecycle discovers its factory with
 * {@link java.util.ServiceLoader}; implementations register themselves in
 * {@code META-INF/services/io.wafgate.core.spi.InspectionEngineFactory} and
 * need a public no-arg constructor.
 */
public interface InspectionEngineFactory {

    /**
     * Builds the engine. Called at most once per lifecycle.
     *
     * @throws EngineConfigurationException if the rules or options are rejected
     */
    InspectionEngine create(EngineSettings settings);
}
