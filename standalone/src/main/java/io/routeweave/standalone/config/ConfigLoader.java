package io.routeweave.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.routeweave.core.model.DataSourceType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link RouteWeaveConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code routeweave.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys keep the defaults of {@link RouteWeaveConfig.Builder}. Every
 * key can be overridden by an environment variable, which wins over YAML. A
 * variable counts as set only when it is defined and non-blank after
 * trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "routeweave.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *                             holds an invalid value
     */
    public static RouteWeaveConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given file, overlaying variables from the
     * supplied lookup. The lookup returns {@code null} for undefined names.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *                             holds an invalid value
     */
    public static RouteWeaveConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
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

    private static RouteWeaveConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RouteWeaveConfig.Builder builder = RouteWeaveConfig.builder();
        if (root == null) {
            root = YAML_MAPPER.createObjectNode();
        }

        JsonNode server = root.path("server");
        yamlString(server, "host", builder::serverHost);
        yamlInt(server, "server.port", "port", builder::serverPort);
        yamlString(server, "config-path", builder::configPath);
        yamlString(server, "invalidate-path", builder::invalidatePath);

        JsonNode datasource = root.path("datasource");
        yamlString(datasource, "type", value -> builder.datasourceType(parseType(value)));
        yamlString(datasource, "url", builder::datasourceUrl);
        yamlString(datasource, "username", builder::datasourceUsername);
        yamlString(datasource, "password", builder::datasourcePassword);
        if (datasource.has("skip-tls-verify"))
            builder.datasourceSkipTlsVerify(datasource.get("skip-tls-verify").asBoolean());
        if (datasource.has("include-non-tls-routers"))
            builder.datasourceIncludeNonTlsRouters(
                    datasource.get("include-non-tls-routers").asBoolean());
        yamlInt(datasource, "datasource.timeout-ms", "timeout-ms", builder::datasourceTimeoutMs);

        yamlInt(root.path("fetch"), "fetch.min-interval-ms", "min-interval-ms", builder::fetchMinIntervalMs);
        yamlInt(root.path("merge"), "merge.cache-ttl-ms", "cache-ttl-ms", builder::mergeCacheTtlMs);

        JsonNode watcher = root.path("watcher");
        if (watcher.has("enabled")) builder.watcherEnabled(watcher.get("enabled").asBoolean());
        yamlInt(watcher, "watcher.interval-ms", "interval-ms", builder::watcherIntervalMs);

        JsonNode database = root.path("database");
        yamlString(database, "url", builder::databaseUrl);
        yamlString(database, "username", builder::databaseUsername);
        yamlString(database, "password", builder::databasePassword);
        yamlInt(database, "database.max-pool-size", "max-pool-size", builder::databaseMaxPoolSize);

        JsonNode logging = root.path("logging");
        yamlString(logging, "format", builder::loggingFormat);
        yamlString(logging, "level", builder::loggingLevel);
        JsonNode loggers = logging.path("loggers");
        if (!loggers.isMissingNode() && !loggers.isNull()) {
            if (!loggers.isObject()) {
                throw new ConfigLoadException("'logging.loggers' must map logger names to levels");
            }
            loggers.fields().forEachRemaining(entry -> builder.loggerLevel(entry.getKey(), entry.getValue().asText()));
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(RouteWeaveConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envString(envLookup, "CONFIG_PATH", builder::configPath);
        envString(envLookup, "INVALIDATE_PATH", builder::invalidatePath);
        envString(envLookup, "DATASOURCE_TYPE", value -> builder.datasourceType(parseType(value)));
        envString(envLookup, "DATASOURCE_URL", builder::datasourceUrl);
        envString(envLookup, "DATASOURCE_USERNAME", builder::datasourceUsername);
        envString(envLookup, "DATASOURCE_PASSWORD", builder::datasourcePassword);
        envString(envLookup, "DATABASE_URL", builder::databaseUrl);
        envString(envLookup, "DATABASE_USERNAME", builder::databaseUsername);
        envString(envLookup, "DATABASE_PASSWORD", builder::databasePassword);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "LOG_LEVELS", value -> parseLoggerLevels(value, builder));

        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envInt(envLookup, "DATASOURCE_TIMEOUT_MS", builder::datasourceTimeoutMs);
        envInt(envLookup, "FETCH_MIN_INTERVAL_MS", builder::fetchMinIntervalMs);
        envInt(envLookup, "MERGE_CACHE_TTL_MS", builder::mergeCacheTtlMs);
        envInt(envLookup, "WATCHER_INTERVAL_MS", builder::watcherIntervalMs);
        envInt(envLookup, "DATABASE_MAX_POOL_SIZE", builder::databaseMaxPoolSize);

        envBool(envLookup, "DATASOURCE_SKIP_TLS_VERIFY", builder::datasourceSkipTlsVerify);
        envBool(envLookup, "DATASOURCE_INCLUDE_NON_TLS_ROUTERS", builder::datasourceIncludeNonTlsRouters);
        envBool(envLookup, "WATCHER_ENABLED", builder::watcherEnabled);
    }

    private static DataSourceType parseType(String value) {
        try {
            return DataSourceType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid datasource type: " + e.getMessage(), e);
        }
    }

    /** Parses {@code name=LEVEL} pairs separated by commas. */
    private static void parseLoggerLevels(String value, RouteWeaveConfig.Builder builder) {
        for (String pair : value.split(",")) {
            if (pair.isBlank()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                throw new ConfigLoadException("Invalid entry in LOG_LEVELS: '" + pair.trim() + "', expected name=LEVEL");
            }
            builder.loggerLevel(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
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
            setter.accept(parseInt(envVar, envLookup.apply(envVar).trim()));
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static void yamlString(JsonNode node, String field, Consumer<String> setter) {
        if (node.has(field) && !node.get(field).isNull()) {
            setter.accept(node.get(field).asText());
        }
    }

    private static void yamlInt(JsonNode node, String key, String field, IntConsumer setter) {
        if (!node.has(field)) {
            return;
        }
        JsonNode value = node.get(field);
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            setter.accept(value.intValue());
        } else {
            setter.accept(parseInt(key, value.asText()));
        }
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid integer for '" + key + "': '" + raw + "'", e);
        }
    }
}
