package fr.lapetina.llm.tuner.middleware;

import fr.lapetina.llm.tuner.concurrent.Futures;
import fr.lapetina.llm.tuner.domain.backend.LlmBackend;
import fr.lapetina.llm.tuner.infrastructure.config.TunerConfig;
import fr.lapetina.llm.tuner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a decorated backend layer by layer.
 *
 * Layers wrap in the order they are added: the first one sits right around the
 * backend, the last one added is outermost and sees each call first. With
 * {@code throttle().retry()} every retry attempt is throttled.
 *
 * <pre>{@code
 * LlmBackend backend = MiddlewareStack.builder(raw)
 *         .throttle(ThrottleOptions.of(5))
 *         .retry(RetryOptions.defaults())
 *         .timeout(new TimeoutOptions(15_000))
 *         .logging(LoggingOptions.defaults())
 *         .build();
 * }</pre>
 */
public final class MiddlewareStack {

    private static final Logger log = LoggerFactory.getLogger(MiddlewareStack.class);

    private MiddlewareStack() {
    }

    public static Builder builder(LlmBackend backend) {
        return new Builder(backend);
    }

    /**
     * Applies the enabled layers of the configuration: throttle, retry, circuit breaker,
     * timeout, logging, then metrics when a registry is given.
     *
     * @param metrics Registry for the metrics layer and retry counters, or null
     */
    public static LlmBackend fromConfig(LlmBackend backend, TunerConfig.MiddlewareConfig config, MetricsRegistry metrics) {
        Builder builder = builder(backend);

        TunerConfig.ThrottleConfig throttle = config.getThrottle();
        if (throttle.isEnabled()) {
            int burst = throttle.getBurst() > 0 ? throttle.getBurst() : (int) Math.ceil(2 * throttle.getRps());
            builder.throttle(new ThrottleOptions(throttle.getRps(), burst));
        }

        TunerConfig.RetryConfig retry = config.getRetry();
        if (retry.isEnabled()) {
            RetryOptions options = new RetryOptions(
                    retry.getMaxRetries(),
                    retry.getInitialDelayMs(),
                    retry.getMaxDelayMs(),
                    retry.getBackoffFactor(),
                    retry.isJitter(),
                    DefaultRetryableErrors.INSTANCE
            );
            if (metrics != null) {
                builder.retry(options, (attempt, delayMs, error) -> metrics.incrementRetries());
            } else {
                builder.retry(options);
            }
        }

        TunerConfig.CircuitBreakerConfig circuitBreaker = config.getCircuitBreaker();
        if (circuitBreaker.isEnabled()) {
            CircuitBreaker breaker = new CircuitBreaker("backend", new CircuitBreakerOptions(
                    circuitBreaker.getFailureThreshold(),
                    circuitBreaker.getTimeoutMs(),
                    circuitBreaker.getSuccessThreshold()
            ));
            if (metrics != null) {
                metrics.registerCircuitState(breaker.getName(), () -> breaker.getState().ordinal());
            }
            builder.circuitBreaker(breaker);
        }

        if (config.getTimeout().isEnabled()) {
            builder.timeout(new TimeoutOptions(config.getTimeout().getTimeoutMs()));
        }

        TunerConfig.LoggingConfig logging = config.getLogging();
        if (logging.isEnabled()) {
            builder.logging(new LoggingOptions(logging.isLogRequests(), logging.isLogResponses(), logging.isLogErrors()));
        }

        if (metrics != null) {
            builder.metrics(metrics);
        }

        return builder.build();
    }

    /**
     * Builder for a decorated backend.
     */
    public static final class Builder {

        private LlmBackend current;
        private final List<String> layers = new ArrayList<>();

        private Builder(LlmBackend backend) {
            if (backend == null) {
                throw new IllegalArgumentException("backend is required");
            }
            this.current = backend;
        }

        public Builder throttle(ThrottleOptions options) {
            return wrap("throttle", new ThrottledBackend(current, options));
        }

        public Builder retry(RetryOptions options) {
            return wrap("retry", new RetryingBackend(current, options));
        }

        public Builder retry(RetryOptions options, Futures.RetryListener listener) {
            return wrap("retry", new RetryingBackend(current, options, listener));
        }

        public Builder circuitBreaker(CircuitBreakerOptions options) {
            return wrap("circuit-breaker", new CircuitBreakerBackend(current, options));
        }

        public Builder circuitBreaker(CircuitBreaker breaker) {
            return wrap("circuit-breaker", new CircuitBreakerBackend(current, breaker));
        }

        public Builder timeout(TimeoutOptions options) {
            return wrap("timeout", new TimeoutBackend(current, options));
        }

        public Builder logging(LoggingOptions options) {
            return wrap("logging", new LoggingBackend(current, options));
        }

        public Builder metrics(MetricsRegistry metrics) {
            return wrap("metrics", new MeteredBackend(current, metrics));
        }

        private Builder wrap(String layer, LlmBackend decorated) {
            current = decorated;
            layers.add(layer);
            return this;
        }

        /**
         * Returns the layer names, innermost first.
         */
        public List<String> layers() {
            return List.copyOf(layers);
        }

        public LlmBackend build() {
            log.info("Middleware stack built: layers={}", layers);
            return current;
        }
    }
}
