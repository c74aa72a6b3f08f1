package io.wafgate.core.spi;

import io.wafgate.core.model.WafConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything an {@link InspectionEngineFactory} needs to build an engine.
 *
 * @param config        the configuration as supplied by the caller
 * @param ruleSources   rule files, resolved against the root directory and
 *                      verified readable, in configured order
 * @param errorListener sink for matched rules, or {@code null} when the error
 *                      log is disabled
 */
public record EngineSettings(WafConfig config, List<Path> ruleSources, MatchedRuleListener errorListener) {

    public EngineSettings {
        Objects.requireNonNull(config, "config must not be null");
        ruleSources = List.copyOf(ruleSources);
    }
}
