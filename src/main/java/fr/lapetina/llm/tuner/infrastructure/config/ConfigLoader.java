package fr.lapetina.llm.tuner.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Environment variable overrides (LLM_TUNER_*)
 * - Range validation
 * - Listener notification on (re)load
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_PROVIDER = "LLM_TUNER_PROVIDER";
    static final String ENV_MODEL = "LLM_TUNER_MODEL";
    static final String ENV_BEAM_WIDTH = "LLM_TUNER_BEAM_WIDTH";
    static final String ENV_MAX_ITERATIONS = "LLM_TUNER_MAX_ITERATIONS";
    static final String ENV_CONCURRENCY = "LLM_TUNER_CONCURRENCY";
    static final String ENV_TIMEOUT_MS = "LLM_TUNER_TIMEOUT_MS";

    private final AtomicReference<TunerConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(TunerConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads configuration from file or classpath, applies overrides and validates it.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public TunerConfig load() {
        return publish(loadFromPath());
    }

    private TunerConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public TunerConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private TunerConfig parse(InputStream inputStream, String source) {
        try {
            TunerConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private TunerConfig publish(TunerConfig config) {
        applyEnvironmentOverrides(config);
        validate(config);
        TunerConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    void applyEnvironmentOverrides(TunerConfig config) {
        String provider = environment.get(ENV_PROVIDER);
        if (provider != null && !provider.isBlank()) {
            config.getBackend().setProvider(provider.trim());
        }
        String model = environment.get(ENV_MODEL);
        if (model != null && !model.isBlank()) {
            config.getBackend().setModel(model.trim());
        }
        Integer beamWidth = intOverride(ENV_BEAM_WIDTH);
        if (beamWidth != null) {
            config.getOptimization().setBeamWidth(beamWidth);
        }
        Integer maxIterations = intOverride(ENV_MAX_ITERATIONS);
        if (maxIterations != null) {
            config.getOptimization().setMaxIterations(maxIterations);
        }
        Integer concurrency = intOverride(ENV_CONCURRENCY);
        if (concurrency != null) {
            config.getOptimization().setConcurrency(concurrency);
        }
        Integer timeoutMs = intOverride(ENV_TIMEOUT_MS);
        if (timeoutMs != null) {
            config.getMiddleware().getTimeout().setTimeoutMs(timeoutMs);
            config.getEvaluation().setTimeoutMs(timeoutMs);
        }
    }

    private Integer intOverride(String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Environment variable " + name + " is not an integer: " + value, e);
        }
    }

    /**
     * Checks value ranges.
     *
     * @throws ConfigurationException on the first invalid value
     */
    static void validate(TunerConfig config) {
        if (config.getBackend().getProvider() == null || config.getBackend().getProvider().isBlank()) {
            throw new ConfigurationException("backend.provider is required");
        }
        TunerConfig.OptimizationConfig optimization = config.getOptimization();
        checkRange("optimization.beamWidth", optimization.getBeamWidth(), 1, 20);
        checkRange("optimization.maxIterations", optimization.getMaxIterations(), 1, 100);
        checkRange("optimization.concurrency", optimization.getConcurrency(), 1, 50);
        checkRange("optimization.checkpointInterval", optimization.getCheckpointInterval(), 1, Integer.MAX_VALUE);
        checkRange("evaluation.maxConcurrency", config.getEvaluation().getMaxConcurrency(), 1, Integer.MAX_VALUE);
        if (config.getEvaluation().getTimeoutMs() <= 0) {
            throw new ConfigurationException("evaluation.timeoutMs must be positive");
        }

        TunerConfig.MiddlewareConfig middleware = config.getMiddleware();
        if (middleware.getThrottle().isEnabled() && middleware.getThrottle().getRps() <= 0) {
            throw new ConfigurationException("middleware.throttle.rps must be positive");
        }
        if (middleware.getRetry().getMaxRetries() < 0) {
            throw new ConfigurationException("middleware.retry.maxRetries must be >= 0");
        }
        if (middleware.getRetry().getBackoffFactor() < 1.0) {
            throw new ConfigurationException("middleware.retry.backoffFactor must be >= 1.0");
        }
        if (middleware.getTimeout().isEnabled() && middleware.getTimeout().getTimeoutMs() <= 0) {
            throw new ConfigurationException("middleware.timeout.timeoutMs must be positive");
        }
        if (middleware.getCircuitBreaker().getFailureThreshold() < 1
                || middleware.getCircuitBreaker().getSuccessThreshold() < 1) {
            throw new ConfigurationException("middleware.circuitBreaker thresholds must be >= 1");
        }
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ConfigurationException(name + " must be between " + min + " and " + max + ": " + value);
        }
    }

    /**
     * Returns the current configuration.
     */
    public TunerConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Forces a configuration reload, keeping the current one on failure.
     */
    public TunerConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(TunerConfig oldConfig, TunerConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    /**
     * Creates a default configuration.
     */
    public static TunerConfig createDefault() {
        return new TunerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
