package io.wafgate.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Engine configuration assembled once at startup.
 *
 * <p>
 * Only {@code ruleFiles} is required in practice: initialization fails when
 * the list is empty or when any entry does not resolve to a readable regular
 * file. Relative rule paths are resolved against {@code rootDir}.
 *
 * @param ruleFiles                ordered rule-source locations
 * @param rootDir                  base directory for relative rule paths
 * @param ruleEngine               engine mode
 * @param requestBodyAccess        whether request bodies are inspected
 * @param requestBodyLimit         max request-body bytes the engine ingests
 * @param requestBodyInMemoryLimit request-body bytes kept in memory before the
 *                                 engine spills to disk
 * @param responseBodyAccess       whether response bodies are inspected
 * @param responseBodyLimit        max response-body bytes the engine ingests
 * @param responseBodyMimeTypes    response MIME types eligible for inspection
 * @param debugLogger              optional sink for engine debug output, may
 *                                 be {@code null}
 * @param errorLogEnabled          log every matched rule at WARN
 */
public record WafConfig(
        List<String> ruleFiles,
        Path rootDir,
        RuleEngineMode ruleEngine,
        boolean requestBodyAccess,
        long requestBodyLimit,
        long requestBodyInMemoryLimit,
        boolean responseBodyAccess,
        long responseBodyLimit,
        List<String> responseBodyMimeTypes,
        Logger debugLogger,
        boolean errorLogEnabled) {

    public static final String DEFAULT_RULE_FILE = "./conf/waf.conf";
    public static final long DEFAULT_REQUEST_BODY_LIMIT = 10L * 1024 * 1024;
    public static final long DEFAULT_REQUEST_BODY_IN_MEMORY_LIMIT = 128L * 1024;
    public static final long DEFAULT_RESPONSE_BODY_LIMIT = 512L * 1024;
    public static final List<String> DEFAULT_RESPONSE_MIME_TYPES =
            List.of("text/html", "text/plain", "application/json", "application/xml");

    public WafConfig {
        ruleFiles = List.copyOf(Objects.requireNonNull(ruleFiles, "ruleFiles must not be null"));
        rootDir = rootDir != null ? rootDir : Path.of("");
        ruleEngine = ruleEngine != null ? ruleEngine : RuleEngineMode.ON;
        responseBodyMimeTypes = responseBodyMimeTypes != null
                ? List.copyOf(responseBodyMimeTypes)
                : DEFAULT_RESPONSE_MIME_TYPES;
        if (requestBodyLimit < 0 || requestBodyInMemoryLimit < 0 || responseBodyLimit < 0) {
            throw new IllegalArgumentException("body limits must not be negative");
        }
    }

    /** Configuration the gateway runs with when nothing is specified. */
    public static WafConfig defaults() {
        return builder().ruleFile(DEFAULT_RULE_FILE).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link WafConfig}. Every field except the rule list has a default. */
    public static final class Builder {
        private final List<String> ruleFiles = new ArrayList<>();
        private Path rootDir = Path.of("");
        private RuleEngineMode ruleEngine = RuleEngineMode.ON;
        private boolean requestBodyAccess = true;
        private long requestBodyLimit = DEFAULT_REQUEST_BODY_LIMIT;
        private long requestBodyInMemoryLimit = DEFAULT_REQUEST_BODY_IN_MEMORY_LIMIT;
        private boolean responseBodyAccess = false;
        private long responseBodyLimit = DEFAULT_RESPONSE_BODY_LIMIT;
        private List<String> responseBodyMimeTypes = DEFAULT_RESPONSE_MIME_TYPES;
        private Logger debugLogger;
        private boolean errorLogEnabled = true;

        Builder() {}

        public Builder ruleFile(String ruleFile) {
            this.ruleFiles.add(ruleFile);
            return this;
        }

        public Builder ruleFiles(List<String> ruleFiles) {
            this.ruleFiles.clear();
            this.ruleFiles.addAll(ruleFiles);
            return this;
        }

        public Builder rootDir(Path rootDir) {
            this.rootDir = rootDir;
            return this;
        }

        public Builder ruleEngine(RuleEngineMode ruleEngine) {
            this.ruleEngine = ruleEngine;
            return this;
        }

        public Builder requestBodyAccess(boolean requestBodyAccess) {
            this.requestBodyAccess = requestBodyAccess;
            return this;
        }

        public Builder requestBodyLimit(long requestBodyLimit) {
            this.requestBodyLimit = requestBodyLimit;
            return this;
        }

        public Builder requestBodyInMemoryLimit(long requestBodyInMemoryLimit) {
            this.requestBodyInMemoryLimit = requestBodyInMemoryLimit;
            return this;
        }

        public Builder responseBodyAccess(boolean responseBodyAccess) {
            this.responseBodyAccess = responseBodyAccess;
            return this;
        }

        public Builder responseBodyLimit(long responseBodyLimit) {
            this.responseBodyLimit = responseBodyLimit;
            return this;
        }

        public Builder responseBodyMimeTypes(List<String> responseBodyMimeTypes) {
            this.responseBodyMimeTypes = responseBodyMimeTypes;
            return this;
        }

        public Builder debugLogger(Logger debugLogger) {
            this.debugLogger = debugLogger;
            return this;
        }

        public Builder errorLogEnabled(boolean errorLogEnabled) {
            this.errorLogEnabled = errorLogEnabled;
            return this;
        }

        public WafConfig build() {
            return new WafConfig(
                    ruleFiles,
                    rootDir,
                    ruleEngine,
                    requestBodyAccess,
                    requestBodyLimit,
                    requestBodyInMemoryLimit,
                    responseBodyAccess,
                    responseBodyLimit,
                    responseBodyMimeTypes,
                    debugLogger,
                    errorLogEnabled);
        }
    }
}
