package io.wafgate.standalone.config;

import io.wafgate.core.lifecycle.WafLifecycle;
import io.wafgate.core.model.WafConfig;

/**
 * Root configuration of the standalone gateway.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param serverHost    bind address of the HTTP server
 * @param serverPort    listen port, {@code 0} for an ephemeral port
 * @param healthEnabled register the liveness endpoint
 * @param healthPath    liveness endpoint path
 * @param loggingFormat {@code json} or {@code text}
 * @param loggingLevel  root log level
 * @param blockMessage  message returned in blocked responses
 * @param blockStatus   status for interruptions whose action is not
 *                      {@code deny}
 * @param waf           engine configuration
 */
public record GatewayConfig(
        String serverHost,
        int serverPort,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        String blockMessage,
        int blockStatus,
        WafConfig waf) {

    /** Creates a new builder with the gateway defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GatewayConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 8080;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private String blockMessage = WafLifecycle.DEFAULT_BLOCK_MESSAGE;
        private int blockStatus = 403;
        private WafConfig waf = WafConfig.defaults();

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder blockMessage(String blockMessage) {
            this.blockMessage = blockMessage;
            return this;
        }

        public Builder blockStatus(int blockStatus) {
            this.blockStatus = blockStatus;
            return this;
        }

        public Builder waf(WafConfig waf) {
            this.waf = waf;
            return this;
        }

        public GatewayConfig build() {
            if (serverPort < 0 || serverPort > 65535) {
                throw new IllegalArgumentException("server port out of range: " + serverPort);
            }
            if (blockStatus < 100 || blockStatus > 599) {
                throw new IllegalArgumentException("block status is not an HTTP status: " + blockStatus);
            }
            return new GatewayConfig(
                    serverHost,
                    serverPort,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    blockMessage,
                    blockStatus,
                    waf);
        }
    }
}
