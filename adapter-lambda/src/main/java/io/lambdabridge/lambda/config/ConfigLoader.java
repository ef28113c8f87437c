package io.lambdabridge.lambda.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.lambdabridge.core.config.BridgeConfig;
import io.lambdabridge.core.error.BridgeConfigException;
import io.lambdabridge.core.model.ResponseType;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link LambdaBridgeConfig} from YAML with an environment variable overlay.
 *
 * <p>
 * Lookup order for the YAML document:
 * <ol>
 * <li>the file named by {@code LAMBDA_BRIDGE_CONFIG}, which must exist</li>
 * <li>{@code lambda-bridge.yaml} on the classpath</li>
 * <li>neither: documented defaults</li>
 * </ol>
 *
 * <pre>
 * bridge:
 *   include-base-path: true
 *   response-types:
 *     image/svg+xml: binary
 * logging:
 *   format: json
 *   level: INFO
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable is "set" only when it is
 * defined and its trimmed value is non-empty; otherwise the YAML value stands.
 * <ul>
 * <li>{@code BRIDGE_INCLUDE_BASE_PATH}: {@code true} or {@code false}</li>
 * <li>{@code BRIDGE_BINARY_TYPES}: comma-separated content types forced to binary</li>
 * <li>{@code BRIDGE_TEXT_TYPES}: comma-separated content types forced to text, applied after
 * the binary list</li>
 * <li>{@code LOG_FORMAT}, {@code LOG_LEVEL}</li>
 * </ul>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath resource consulted when no explicit file is configured. */
    public static final String DEFAULT_RESOURCE = "lambda-bridge.yaml";

    /** Environment variable naming an explicit configuration file. */
    public static final String CONFIG_PATH_ENV = "LAMBDA_BRIDGE_CONFIG";

    private ConfigLoader() {
        // utility class
    }

    /** Loads configuration using the process environment. */
    public static LambdaBridgeConfig load() {
        return load(System::getenv);
    }

    /**
     * Loads configuration, resolving the YAML source and overrides through {@code envLookup}.
     *
     * @param envLookup environment variable lookup; returning {@code null} means undefined
     * @throws ConfigLoadException if a configured file is missing or any value is invalid
     */
    public static LambdaBridgeConfig load(Function<String, String> envLookup) {
        if (isSet(envLookup, CONFIG_PATH_ENV)) {
            return load(Path.of(envLookup.apply(CONFIG_PATH_ENV).trim()), envLookup);
        }
        return loadResource(DEFAULT_RESOURCE, ConfigLoader.class.getClassLoader(), envLookup);
    }

    /**
     * Loads configuration from an explicit YAML file.
     *
     * @throws ConfigLoadException if the file is missing, unparsable or holds invalid values
     */
    public static LambdaBridgeConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath
                    + ". Check " + CONFIG_PATH_ENV + " or remove it to use the classpath default.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return mapToConfig(YAML_MAPPER.readTree(in), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Loads configuration from a classpath resource. A missing resource yields the defaults with
     * the environment overlay applied.
     *
     * @throws ConfigLoadException if the resource is unparsable or holds invalid values
     */
    public static LambdaBridgeConfig loadResource(
            String resource, ClassLoader classLoader, Function<String, String> envLookup) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
            }
            return mapToConfig(YAML_MAPPER.readTree(in), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration resource: " + resource, e);
        }
    }

    /** Maps a parsed YAML tree to the config via the builders, then overlays the environment. */
    private static LambdaBridgeConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        JsonNode safeRoot = root != null ? root : YAML_MAPPER.missingNode();
        BridgeConfig.Builder bridge = BridgeConfig.builder();
        LambdaBridgeConfig.Builder builder = LambdaBridgeConfig.builder();

        try {
            // --- YAML mapping ---

            JsonNode bridgeNode = safeRoot.path("bridge");
            if (bridgeNode.has("include-base-path")) {
                bridge.includeBasePath(parseBoolean(bridgeNode.get("include-base-path").asText(), "bridge.include-base-path"));
            }
            JsonNode responseTypes = bridgeNode.path("response-types");
            if (!responseTypes.isMissingNode() && !responseTypes.isNull()) {
                if (!responseTypes.isObject()) {
                    throw new ConfigLoadException("'bridge.response-types' must be a mapping of content type to text|binary");
                }
                Iterator<Map.Entry<String, JsonNode>> fields = responseTypes.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    bridge.responseType(
                            entry.getKey(),
                            parseResponseType(entry.getValue().asText(), "bridge.response-types." + entry.getKey()));
                }
            }

            JsonNode logging = safeRoot.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

            // --- Environment variable overlay ---

            if (isSet(envLookup, "BRIDGE_INCLUDE_BASE_PATH")) {
                bridge.includeBasePath(parseBoolean(envValue(envLookup, "BRIDGE_INCLUDE_BASE_PATH"), "BRIDGE_INCLUDE_BASE_PATH"));
            }
            envList(envLookup, "BRIDGE_BINARY_TYPES", type -> bridge.responseType(type, ResponseType.BINARY));
            envList(envLookup, "BRIDGE_TEXT_TYPES", type -> bridge.responseType(type, ResponseType.TEXT));
            envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
            envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

            return builder.bridge(bridge.build()).build();
        } catch (BridgeConfigException e) {
            throw new ConfigLoadException("Invalid bridge configuration: " + e.getMessage(), e);
        }
    }

    // --- Value parsing ---

    private static boolean parseBoolean(String value, String source) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new ConfigLoadException(
                    "Invalid boolean '" + value + "' for " + source + ", expected true or false");
        };
    }

    private static ResponseType parseResponseType(String value, String source) {
        try {
            return ResponseType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid response type '" + value + "' for " + source + ", expected text or binary", e);
        }
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String envValue(Function<String, String> envLookup, String envVar) {
        return envLookup.apply(envVar).trim();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envValue(envLookup, envVar));
        }
    }

    /** Feeds each non-blank entry of a comma-separated env var to {@code setter}. */
    private static void envList(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (!isSet(envLookup, envVar)) {
            return;
        }
        for (String item : envValue(envLookup, envVar).split(",")) {
            if (!item.isBlank()) {
                setter.accept(item.trim());
            }
        }
    }
}
