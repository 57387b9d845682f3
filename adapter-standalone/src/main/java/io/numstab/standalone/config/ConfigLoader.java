package io.numstab.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link StabilizerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Without {@code --config}, {@value #DEFAULT_CONFIG_FILE} in the working
 * directory is read if it exists; otherwise only defaults and environment
 * variables apply. An explicit {@code --config} file must exist.
 *
 * <p>
 * An environment variable is "set" if it is defined and its trimmed value is
 * non-empty. Set variables take precedence over YAML values.
 */
public final class ConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "numstab.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> STORES = Set.of(StabilizerConfig.STORE_SQLITE, StabilizerConfig.STORE_MEMORY);
    private static final Set<String> FORMATS = Set.of(StabilizerConfig.FORMAT_TEXT, StabilizerConfig.FORMAT_JSON);

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration for a run.
     *
     * @param explicitPath the {@code --config} argument, or {@code null} if
     *                     none was given
     * @param envLookup    environment variable lookup; returning {@code null}
     *                     means undefined
     * @throws ConfigLoadException if the file is missing, unreadable or holds
     *                             invalid values
     */
    public static StabilizerConfig load(Path explicitPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return loadFile(explicitPath, envLookup);
        }
        Path defaultPath = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.isRegularFile(defaultPath)) {
            return loadFile(defaultPath, envLookup);
        }
        return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
    }

    /**
     * Loads the configuration from {@code configPath}, which must exist.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds
     *                             invalid values
     */
    public static StabilizerConfig loadFile(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
    }

    private static StabilizerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        StabilizerConfig.Builder builder = StabilizerConfig.builder();

        JsonNode solver = root.path("solver");
        if (solver.has("binary")) builder.solverBinary(solver.get("binary").asText());
        if (solver.has("seed")) builder.solverSeed(seedFromYaml(solver.get("seed")));
        if (solver.has("timeout-ms")) builder.solverTimeoutMs(longFromYaml(solver.get("timeout-ms"), "solver.timeout-ms"));

        JsonNode cache = root.path("cache");
        if (cache.has("store")) builder.cacheStore(cache.get("store").asText());
        if (cache.has("dir")) builder.cacheDir(Path.of(cache.get("dir").asText()));

        JsonNode output = root.path("output");
        if (output.has("format")) builder.outputFormat(output.get("format").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        envString(envLookup, "NUMSTAB_SOLVER_BINARY", builder::solverBinary);
        envString(envLookup, "NUMSTAB_SOLVER_SEED", value -> builder.solverSeed(seedFromText(value)));
        envString(
                envLookup,
                "NUMSTAB_SOLVER_TIMEOUT_MS",
                value -> builder.solverTimeoutMs(longFromText(value, "NUMSTAB_SOLVER_TIMEOUT_MS")));
        envString(envLookup, "NUMSTAB_CACHE_STORE", builder::cacheStore);
        envString(envLookup, "NUMSTAB_CACHE_DIR", value -> builder.cacheDir(Path.of(value)));
        envString(envLookup, "NUMSTAB_OUTPUT_FORMAT", builder::outputFormat);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return validate(builder.build());
    }

    /** Normalizes enumerated values and rejects anything out of range. */
    static StabilizerConfig validate(StabilizerConfig config) {
        if (config.solverBinary() == null || config.solverBinary().isBlank()) {
            throw new ConfigLoadException("solver.binary must not be empty");
        }
        if (config.solverSeed().size() != 6) {
            throw new ConfigLoadException(
                    "solver.seed must have exactly 6 integers, got " + config.solverSeed().size());
        }
        if (config.solverTimeoutMs() < 0) {
            throw new ConfigLoadException("solver.timeout-ms must not be negative, got " + config.solverTimeoutMs());
        }
        return new StabilizerConfig(
                config.solverBinary().trim(),
                config.solverSeed(),
                config.solverTimeoutMs(),
                oneOf(config.cacheStore(), STORES, "cache.store"),
                config.cacheDir(),
                oneOf(config.outputFormat(), FORMATS, "output.format"),
                oneOf(config.loggingFormat(), FORMATS, "logging.format"),
                config.loggingLevel().trim().toUpperCase(Locale.ROOT));
    }

    private static String oneOf(String value, Set<String> allowed, String key) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (!allowed.contains(normalized)) {
            throw new ConfigLoadException(
                    key + " must be one of " + allowed.stream().sorted().toList() + ", got '" + value + "'");
        }
        return normalized;
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

    // --- Value parsing ---

    private static List<Long> seedFromYaml(JsonNode node) {
        if (!node.isArray()) {
            return seedFromText(node.asText());
        }
        List<Long> seed = new ArrayList<>();
        for (JsonNode element : node) {
            seed.add(longFromYaml(element, "solver.seed"));
        }
        return seed;
    }

    /** Seed written as a string: integers separated by spaces or commas. */
    private static List<Long> seedFromText(String text) {
        List<Long> seed = new ArrayList<>();
        for (String part : text.trim().split("[\\s,]+")) {
            if (!part.isEmpty()) {
                seed.add(longFromText(part, "solver.seed"));
            }
        }
        return seed;
    }

    private static long longFromYaml(JsonNode node, String key) {
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        return longFromText(node.asText(), key);
    }

    private static long longFromText(String text, String key) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(key + " must be an integer, got '" + text + "'", e);
        }
    }
}
