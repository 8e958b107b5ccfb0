package fr.lapetina.llm.tuner.infrastructure.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Root configuration object for the tuner.
 * Designed to be populated from YAML.
 */
public class TunerConfig {

    private BackendConfig backend = new BackendConfig();
    private MiddlewareConfig middleware = new MiddlewareConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();
    private OptimizationConfig optimization = new OptimizationConfig();
    private StorageConfig storage = new StorageConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public BackendConfig getBackend() { return backend; }
    public void setBackend(BackendConfig backend) { this.backend = backend; }

    public MiddlewareConfig getMiddleware() { return middleware; }
    public void setMiddleware(MiddlewareConfig middleware) { this.middleware = middleware; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public EvaluationConfig getEvaluation() { return evaluation; }
    public void setEvaluation(EvaluationConfig evaluation) { this.evaluation = evaluation; }

    public OptimizationConfig getOptimization() { return optimization; }
    public void setOptimization(OptimizationConfig optimization) { this.optimization = optimization; }

    public StorageConfig getStorage() { return storage; }
    public void setStorage(StorageConfig storage) { this.storage = storage; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * LLM provider selection.
     */
    public static class BackendConfig {
        private String provider = "echo";
        private String model;
        private Map<String, Object> settings = new HashMap<>();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public Map<String, Object> getSettings() { return settings; }
        public void setSettings(Map<String, Object> settings) { this.settings = settings; }
    }

    /**
     * Resilience layers wrapped around the backend.
     */
    public static class MiddlewareConfig {
        private ThrottleConfig throttle = new ThrottleConfig();
        private RetryConfig retry = new RetryConfig();
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
        private TimeoutConfig timeout = new TimeoutConfig();
        private LoggingConfig logging = new LoggingConfig();

        public ThrottleConfig getThrottle() { return throttle; }
        public void setThrottle(ThrottleConfig throttle) { this.throttle = throttle; }

        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }

        public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
        public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

        public TimeoutConfig getTimeout() { return timeout; }
        public void setTimeout(TimeoutConfig timeout) { this.timeout = timeout; }

        public LoggingConfig getLogging() { return logging; }
        public void setLogging(LoggingConfig logging) { this.logging = logging; }
    }

    public static class ThrottleConfig {
        private boolean enabled = false;
        private double rps = 3;
        private int burst = 0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getRps() { return rps; }
        public void setRps(double rps) { this.rps = rps; }

        /** 0 means twice the rate. */
        public int getBurst() { return burst; }
        public void setBurst(int burst) { this.burst = burst; }
    }

    public static class RetryConfig {
        private boolean enabled = true;
        private int maxRetries = 3;
        private long initialDelayMs = 1000;
        private long maxDelayMs = 30000;
        private double backoffFactor = 2.0;
        private boolean jitter = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialDelayMs() { return initialDelayMs; }
        public void setInitialDelayMs(long initialDelayMs) { this.initialDelayMs = initialDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }

        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
    }

    public static class CircuitBreakerConfig {
        private boolean enabled = false;
        private int failureThreshold = 5;
        private long timeoutMs = 60000;
        private int successThreshold = 3;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }
    }

    public static class TimeoutConfig {
        private boolean enabled = true;
        private long timeoutMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    public static class LoggingConfig {
        private boolean enabled = true;
        private boolean logRequests = true;
        private boolean logResponses = false;
        private boolean logErrors = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isLogRequests() { return logRequests; }
        public void setLogRequests(boolean logRequests) { this.logRequests = logRequests; }

        public boolean isLogResponses() { return logResponses; }
        public void setLogResponses(boolean logResponses) { this.logResponses = logResponses; }

        public boolean isLogErrors() { return logErrors; }
        public void setLogErrors(boolean logErrors) { this.logErrors = logErrors; }
    }

    /**
     * Prompt pipeline under optimization.
     */
    public static class PipelineConfig {
        private String template = "{question}";
        private Map<String, Object> options = new HashMap<>();

        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }

        public Map<String, Object> getOptions() { return options; }
        public void setOptions(Map<String, Object> options) { this.options = options; }
    }

    public static class EvaluationConfig {
        private boolean parallel = false;
        private int maxConcurrency = 4;
        private long timeoutMs = 30000;

        public boolean isParallel() { return parallel; }
        public void setParallel(boolean parallel) { this.parallel = parallel; }

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    public static class OptimizationConfig {
        private String strategy = "beam";
        private int beamWidth = 4;
        private int maxIterations = 10;
        private int concurrency = 8;
        private int checkpointInterval = 5;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getBeamWidth() { return beamWidth; }
        public void setBeamWidth(int beamWidth) { this.beamWidth = beamWidth; }

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public int getCheckpointInterval() { return checkpointInterval; }
        public void setCheckpointInterval(int checkpointInterval) { this.checkpointInterval = checkpointInterval; }
    }

    public static class StorageConfig {
        private String type = "memory";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_tuner";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
