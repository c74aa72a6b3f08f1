package io.wafgate.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.wafgate.core.model.RuleEngineMode;
import io.wafgate.core.model.WafConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link GatewayConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code waf-gate.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified
 * path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults of {@link GatewayConfig.Builder} and
 * {@link WafConfig.Builder}; a missing {@code waf.rules} list falls back to
 * {@link WafConfig#DEFAULT_RULE_FILE}.
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable is
 * "set" if and only if it is defined and its trimmed value is non-empty.
 * {@code WAF_RULES} is a comma-separated list.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "waf-gate.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link GatewayConfig} from the given YAML file, applying
     * environment variable overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static GatewayConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link GatewayConfig} from the given YAML file, applying
     * environment variable overrides from {@code envLookup} (returning
     * {@code null} means the variable is not defined).
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static GatewayConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                root = YAML_MAPPER.createObjectNode();
            }
            return mapToConfig(root, envLookup, configPath);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Resolves the config file path from CLI arguments. */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GatewayConfig mapToConfig(JsonNode root, Function<String, String> envLookup, Path configPath) {
        GatewayConfig.Builder builder = GatewayConfig.builder();
        WafConfig.Builder waf = WafConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(server.get("port").asInt());

        JsonNode wafNode = root.path("waf");
        List<String> rules = new ArrayList<>();
        JsonNode rulesNode = wafNode.path("rules");
        if (rulesNode.isArray()) {
            rulesNode.forEach(rule -> rules.add(rule.asText()));
        } else if (rulesNode.isTextual()) {
            rules.add(rulesNode.asText());
        }
        // relative root-dir is taken relative to the config file
        Path baseDir = configPath.toAbsolutePath().getParent();
        Path rootDir = wafNode.has("root-dir")
                ? baseDir.resolve(wafNode.get("root-dir").asText())
                : baseDir;
        if (wafNode.has("rule-engine")) waf.ruleEngine(ruleEngine(wafNode.get("rule-engine")));
        if (wafNode.has("error-log")) waf.errorLogEnabled(wafNode.get("error-log").asBoolean());
        if (wafNode.has("block-message")) builder.blockMessage(wafNode.get("block-message").asText());
        if (wafNode.has("block-status")) builder.blockStatus(wafNode.get("block-status").asInt());

        JsonNode requestBody = wafNode.path("request-body");
        if (requestBody.has("access")) waf.requestBodyAccess(requestBody.get("access").asBoolean());
        if (requestBody.has("limit")) waf.requestBodyLimit(requestBody.get("limit").asLong());
        if (requestBody.has("in-memory-limit"))
            waf.requestBodyInMemoryLimit(requestBody.get("in-memory-limit").asLong());

        JsonNode responseBody = wafNode.path("response-body");
        if (responseBody.has("access")) waf.responseBodyAccess(responseBody.get("access").asBoolean());
        if (responseBody.has("limit")) waf.responseBodyLimit(responseBody.get("limit").asLong());
        if (responseBody.path("mime-types").isArray()) {
            List<String> mimeTypes = new ArrayList<>();
            responseBody.get("mime-types").forEach(type -> mimeTypes.add(type.asText()));
            waf.responseBodyMimeTypes(mimeTypes);
        }

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "WAF_BLOCK_MESSAGE", builder::blockMessage);
        envInt(envLookup, "WAF_BLOCK_STATUS", builder::blockStatus);

        if (isSet(envLookup, "WAF_RULES")) {
            rules.clear();
            Arrays.stream(envLookup.apply("WAF_RULES").split(","))
                    .map(String::trim)
                    .filter(rule -> !rule.isEmpty())
                    .forEach(rules::add);
        }
        if (isSet(envLookup, "WAF_ROOT_DIR")) {
            rootDir = Path.of(envLookup.apply("WAF_ROOT_DIR").trim());
        }
        envString(envLookup, "WAF_RULE_ENGINE", value -> waf.ruleEngine(RuleEngineMode.parse(value)));
        envBool(envLookup, "WAF_ERROR_LOG", waf::errorLogEnabled);
        envBool(envLookup, "WAF_REQUEST_BODY_ACCESS", waf::requestBodyAccess);
        envLong(envLookup, "WAF_REQUEST_BODY_LIMIT", waf::requestBodyLimit);
        envLong(envLookup, "WAF_REQUEST_BODY_IN_MEMORY_LIMIT", waf::requestBodyInMemoryLimit);
        envBool(envLookup, "WAF_RESPONSE_BODY_ACCESS", waf::responseBodyAccess);
        envLong(envLookup, "WAF_RESPONSE_BODY_LIMIT", waf::responseBodyLimit);

        waf.ruleFiles(rules.isEmpty() ? List.of(WafConfig.DEFAULT_RULE_FILE) : rules);
        waf.rootDir(rootDir);
        return builder.waf(waf.build()).build();
    }

    /** YAML 1.1 readers may turn an unquoted On/Off into a boolean. */
    private static RuleEngineMode ruleEngine(JsonNode node) {
        if (node.isBoolean()) {
            return node.asBoolean() ? RuleEngineMode.ON : RuleEngineMode.OFF;
        }
        return RuleEngineMode.parse(node.asText());
    }

    /** An env var is "set" if defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Integer.parseInt(envLookup.apply(envVar).trim()));
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Long.parseLong(envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
