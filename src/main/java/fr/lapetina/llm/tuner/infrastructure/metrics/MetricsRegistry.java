package fr.lapetina.llm.tuner.infrastructure.metrics;

import fr.lapetina.llm.tuner.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Backend call counters and latency timers per operation and outcome
 * - Retry and circuit breaker counters
 * - Evaluation example outcomes
 * - Optimizer best-score gauge and iteration timer
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> callTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> exampleCounters = new ConcurrentHashMap<>();

    private final Counter retryCounter;
    private final Counter circuitRejections;
    private final Timer iterationTimer;

    // Best score scaled by 1e6, a gauge needs a mutable holder
    private final AtomicLong bestScoreMicros = new AtomicLong(0);
    private final AtomicInteger inFlightCalls = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.retryCounter = Counter.builder(prefix + "_backend_retries_total")
                .description("Backend call retries")
                .register(registry);

        this.circuitRejections = Counter.builder(prefix + "_circuit_rejections_total")
                .description("Calls rejected by an open circuit breaker")
                .register(registry);

        this.iterationTimer = Timer.builder(prefix + "_optimizer_iteration")
                .description("Optimizer iteration duration")
                .register(registry);

        Gauge.builder(prefix + "_optimizer_best_score", bestScoreMicros, v -> v.get() / 1_000_000.0)
                .description("Best score of the running optimization")
                .register(registry);

        Gauge.builder(prefix + "_backend_inflight", inFlightCalls, AtomicInteger::get)
                .description("In-flight backend calls")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_tuner");
    }

    /**
     * Records one backend call with its outcome ("ok", "timeout" or "error").
     */
    public void recordBackendCall(String operation, String outcome, Duration latency) {
        String key = operation + ":" + outcome;
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_backend_calls_total")
                        .description("Total number of backend calls")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
        callTimers.computeIfAbsent(operation, k ->
                Timer.builder(prefix + "_backend_latency")
                        .description("Backend call latency")
                        .tag("operation", operation)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments the error counter.
     */
    public void incrementErrorCount(String operation, ErrorType errorType) {
        String key = operation + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("operation", operation)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRetries() {
        retryCounter.increment();
    }

    public void incrementCircuitRejections() {
        circuitRejections.increment();
    }

    /**
     * Registers a gauge exposing a circuit breaker state ordinal (0=CLOSED, 1=OPEN, 2=HALF_OPEN).
     */
    public void registerCircuitState(String name, Supplier<Number> state) {
        Gauge.builder(prefix + "_circuit_state", state, s -> s.get().doubleValue())
                .description("Circuit breaker state (0=CLOSED, 1=OPEN, 2=HALF_OPEN)")
                .tag("name", name)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Counts one evaluated example.
     */
    public void recordExample(boolean success) {
        String outcome = success ? "success" : "failure";
        exampleCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_evaluation_examples_total")
                        .description("Evaluated examples")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordIteration(Duration duration, double bestScore) {
        iterationTimer.record(duration);
        bestScoreMicros.set(Math.round(bestScore * 1_000_000));
    }

    public void callStarted() {
        inFlightCalls.incrementAndGet();
    }

    public void callFinished() {
        inFlightCalls.decrementAndGet();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
