package io.flowforge.formula.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServerConfig} from a YAML file, then overlays environment variables.
 *
 * <p>The file is {@code formula-server.yaml} in the working directory unless
 * {@code --config <path>} is given. Layout:
 *
 * <pre>{@code
 * server:
 *   host: 0.0.0.0
 *   port: 8080
 *   max-body-bytes: 1048576
 * formula:
 *   max-length: 10000
 *   max-nodes: 2000
 *   max-depth: 200
 * health:
 *   enabled: true
 *   path: /health
 * logging:
 *   format: json
 *   level: INFO
 * }</pre>
 *
 * <p>Missing keys keep the {@link ServerConfig.Builder} defaults. Environment variables win over
 * the file; a variable counts as set only when it is defined and not blank.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "formula-server.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration with overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, invalid or out of range
     */
    public static ServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration with overrides from the supplied lookup; {@code null} from the lookup
     * means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, invalid or out of range
     */
    public static ServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        ServerConfig config;
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid numeric environment override: " + e.getMessage(), e);
        }
        validate(config);
        return config;
    }

    /** Resolves the config file path from command-line arguments. */
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

    private static ServerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServerConfig.Builder builder = ServerConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());
        if (server.has("max-body-bytes")) builder.maxBodyBytes(server.get("max-body-bytes").asInt());

        JsonNode formula = root.path("formula");
        if (formula.has("max-length")) builder.maxFormulaLength(formula.get("max-length").asInt());
        if (formula.has("max-nodes")) builder.maxNodeCount(formula.get("max-nodes").asInt());
        if (formula.has("max-depth")) builder.maxDepth(formula.get("max-depth").asInt());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        envString(envLookup, "SERVER_HOST", builder::host);
        envInt(envLookup, "SERVER_PORT", builder::port);
        envInt(envLookup, "SERVER_MAX_BODY_BYTES", builder::maxBodyBytes);
        envInt(envLookup, "FORMULA_MAX_LENGTH", builder::maxFormulaLength);
        envInt(envLookup, "FORMULA_MAX_NODES", builder::maxNodeCount);
        envInt(envLookup, "FORMULA_MAX_DEPTH", builder::maxDepth);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static void validate(ServerConfig config) {
        if (config.port() < 0 || config.port() > 65535) {
            throw new ConfigLoadException("server.port must be between 0 and 65535, got " + config.port());
        }
        if (config.maxBodyBytes() <= 0) {
            throw new ConfigLoadException("server.max-body-bytes must be positive, got " + config.maxBodyBytes());
        }
        if (config.healthPath() == null || !config.healthPath().startsWith("/")) {
            throw new ConfigLoadException("health.path must start with '/', got " + config.healthPath());
        }
        String format = config.loggingFormat();
        if (!"json".equalsIgnoreCase(format) && !"text".equalsIgnoreCase(format)) {
            throw new ConfigLoadException("logging.format must be 'json' or 'text', got " + format);
        }
        try {
            config.limits();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid formula limits: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

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
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new NumberFormatException(envVar + "=" + raw);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
