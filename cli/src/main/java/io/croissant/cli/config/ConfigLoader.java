package io.croissant.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link CliConfig} from an optional YAML file with an environment variable overlay.
 *
 * <p>
 * The file is {@code croissant.yaml} in the working directory unless {@code --config <path>} names
 * another one. A missing default file means defaults; a missing explicit file is an error.
 *
 * <pre>
 * cache:
 *   dir: /var/cache/croissant
 * http:
 *   timeout-ms: 30000
 * logging:
 *   format: json
 *   level: DEBUG
 * </pre>
 *
 * <p>
 * Environment variables take precedence over the file: {@code CROISSANT_CACHE_DIR},
 * {@code CROISSANT_HTTP_TIMEOUT_MS}, {@code LOG_FORMAT}, {@code LOG_LEVEL}. A variable counts as
 * set only when its trimmed value is non-empty.
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "croissant.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** Loads the configuration named by {@code args}, overlaid with {@link System#getenv}. */
    public static CliConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * @param args      command-line arguments, scanned for {@code --config}
     * @param envLookup environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file cannot be loaded or a value is invalid
     */
    public static CliConfig load(String[] args, Function<String, String> envLookup) {
        Path explicit = resolveConfigPath(args);
        Path path = explicit != null ? explicit : Path.of(DEFAULT_CONFIG_FILE);
        JsonNode root = MissingNode.getInstance();
        if (Files.exists(path)) {
            root = read(path);
        } else if (explicit != null) {
            throw new ConfigLoadException("Configuration file not found: " + path);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * The path following {@code --config}, or {@code null} when absent.
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
        return null;
    }

    private static JsonNode read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return root == null ? MissingNode.getInstance() : root;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + path, e);
        }
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        JsonNode cache = root.path("cache");
        if (cache.has("dir")) builder.cacheDirectory(Path.of(cache.get("dir").asText()));

        JsonNode http = root.path("http");
        if (http.has("timeout-ms")) builder.httpTimeoutMs(intValue(http.get("timeout-ms"), "http.timeout-ms"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        String cacheDir = env(envLookup, "CROISSANT_CACHE_DIR");
        if (cacheDir != null) builder.cacheDirectory(Path.of(cacheDir));
        String timeout = env(envLookup, "CROISSANT_HTTP_TIMEOUT_MS");
        if (timeout != null) builder.httpTimeoutMs(parseInt(timeout, "CROISSANT_HTTP_TIMEOUT_MS"));
        String format = env(envLookup, "LOG_FORMAT");
        if (format != null) builder.loggingFormat(format);
        String level = env(envLookup, "LOG_LEVEL");
        if (level != null) builder.loggingLevel(level);

        return builder.build();
    }

    private static int intValue(JsonNode node, String key) {
        if (node.canConvertToInt()) {
            return node.intValue();
        }
        return parseInt(node.asText(), key);
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static String env(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
