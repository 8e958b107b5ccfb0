package fr.lapetina.llm.tuner;

import fr.lapetina.llm.tuner.domain.backend.BackendRegistry;
import fr.lapetina.llm.tuner.domain.backend.LlmBackend;
import fr.lapetina.llm.tuner.domain.pipeline.PromptPipeline;
import fr.lapetina.llm.tuner.evaluate.EvaluationOptions;
import fr.lapetina.llm.tuner.evaluate.Evaluator;
import fr.lapetina.llm.tuner.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.tuner.infrastructure.config.TunerConfig;
import fr.lapetina.llm.tuner.infrastructure.io.DatasetReader;
import fr.lapetina.llm.tuner.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.tuner.infrastructure.storage.InMemoryRunStorage;
import fr.lapetina.llm.tuner.infrastructure.storage.RunStorage;
import fr.lapetina.llm.tuner.middleware.MiddlewareStack;
import fr.lapetina.llm.tuner.optimize.BeamSearchOptimizer;
import fr.lapetina.llm.tuner.optimize.CheckpointWriter;
import fr.lapetina.llm.tuner.optimize.Optimizer;
import fr.lapetina.llm.tuner.optimize.OptimizerOptions;
import fr.lapetina.llm.tuner.optimize.PromptHintMutationStrategy;
import fr.lapetina.llm.tuner.optimize.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Wires configuration, backend, middleware, pipeline, evaluator and optimizer.
 *
 * <p>Usage:
 * <pre>{@code
 * try (TunerFactory factory = TunerFactory.create("config.yaml")) {
 *     EvaluationResult result = factory.getEvaluator()
 *             .evaluate(factory.getPipeline(), dataset, Metrics.exactMatch(), factory.evaluationOptions())
 *             .join();
 * }
 * }</pre>
 */
public class TunerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TunerFactory.class);

    private final ConfigLoader configLoader;
    private final TunerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final BackendRegistry backendRegistry;
    private final LlmBackend backend;
    private final PromptPipeline pipeline;
    private final Evaluator evaluator;
    private final RunStorage storage;
    private final CheckpointWriter checkpointWriter;
    private final Optimizer optimizer;
    private final DatasetReader datasetReader;

    /**
     * @param rawBackendOverride Backend used instead of the configured provider, before
     *                           middleware is applied; null in production
     */
    protected TunerFactory(String configPath, LlmBackend rawBackendOverride) {
        log.info("Initializing TunerFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        this.backendRegistry = BackendRegistry.withDefaults();
        LlmBackend raw = rawBackendOverride != null ? rawBackendOverride : createBackend();
        this.backend = MiddlewareStack.fromConfig(raw, config.getMiddleware(), metricsRegistry);

        this.pipeline = new PromptPipeline(backend, config.getPipeline().getTemplate(), config.getPipeline().getOptions());
        this.evaluator = new Evaluator(metricsRegistry);
        this.storage = createStorage();
        this.checkpointWriter = new CheckpointWriter(storage);

        BeamSearchOptimizer beamSearch = new BeamSearchOptimizer(
                evaluator, new PromptHintMutationStrategy(), checkpointWriter, metricsRegistry);
        this.optimizer = new Optimizer(StrategyRegistry.withDefaults(beamSearch), storage);
        this.datasetReader = new DatasetReader();

        log.info("TunerFactory initialized: provider={}, strategy={}",
                config.getBackend().getProvider(), config.getOptimization().getStrategy());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static TunerFactory create(String configPath) {
        return new TunerFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static TunerFactory create() {
        return create("config.yaml");
    }

    private LlmBackend createBackend() {
        TunerConfig.BackendConfig backendConfig = config.getBackend();
        Map<String, Object> settings = new HashMap<>();
        if (backendConfig.getSettings() != null) {
            settings.putAll(backendConfig.getSettings());
        }
        if (backendConfig.getModel() != null) {
            settings.put("model", backendConfig.getModel());
        }
        return backendRegistry.create(backendConfig.getProvider(), settings);
    }

    private RunStorage createStorage() {
        String type = config.getStorage().getType();
        if (type == null || type.equalsIgnoreCase("memory")) {
            return new InMemoryRunStorage();
        }
        throw new ConfigLoader.ConfigurationException("Unsupported storage type: " + type + ". Available: [memory]");
    }

    public EvaluationOptions evaluationOptions() {
        TunerConfig.EvaluationConfig evaluation = config.getEvaluation();
        return new EvaluationOptions(evaluation.isParallel(), evaluation.getMaxConcurrency(), evaluation.getTimeoutMs());
    }

    public OptimizerOptions optimizerOptions() {
        TunerConfig.OptimizationConfig optimization = config.getOptimization();
        return OptimizerOptions.builder()
                .strategy(optimization.getStrategy())
                .beamWidth(optimization.getBeamWidth())
                .maxIterations(optimization.getMaxIterations())
                .concurrency(optimization.getConcurrency())
                .checkpointInterval(optimization.getCheckpointInterval())
                .exampleTimeoutMs(config.getEvaluation().getTimeoutMs())
                .build();
    }

    public TunerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public BackendRegistry getBackendRegistry() {
        return backendRegistry;
    }

    /**
     * Returns the backend with its middleware applied.
     */
    public LlmBackend getBackend() {
        return backend;
    }

    public PromptPipeline getPipeline() {
        return pipeline;
    }

    public Evaluator getEvaluator() {
        return evaluator;
    }

    public RunStorage getStorage() {
        return storage;
    }

    public Optimizer getOptimizer() {
        return optimizer;
    }

    public DatasetReader getDatasetReader() {
        return datasetReader;
    }

    @Override
    public void close() {
        log.info("Shutting down TunerFactory...");
        checkpointWriter.close();
        if (metricsRegistry != null) {
            metricsRegistry.close();
        }
        log.info("TunerFactory shut down");
    }
}
