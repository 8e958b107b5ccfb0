package fr.lapetina.llm.tuner.evaluate;

import fr.lapetina.llm.tuner.concurrent.Futures;
import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import fr.lapetina.llm.tuner.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs a pipeline over a dataset and scores each output with a metric.
 *
 * For each example:
 * - the pipeline input is the example without its {@code answer}, {@code expected}
 *   and {@code ground-truth} fields
 * - the ground truth is {@code ground-truth}, else {@code expected}, else the whole example
 * - a timeout or a pipeline failure gives a failed result with score 0.0; the run goes on
 * - a {@link MetricRangeException} fails the whole evaluation
 *
 * Sequential and parallel modes produce the same aggregate.
 */
public final class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    static final List<String> GROUND_TRUTH_KEYS = List.of("answer", "expected", "ground-truth");

    private final MetricsRegistry metrics;

    public Evaluator(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    public Evaluator() {
        this(null);
    }

    /**
     * Evaluates the pipeline on every example.
     *
     * @return Future of the aggregate, failed only with a {@link MetricRangeException}
     */
    public CompletableFuture<EvaluationResult> evaluate(
            Pipeline pipeline,
            List<Map<String, Object>> dataset,
            Metric metric,
            EvaluationOptions options
    ) {
        long start = System.currentTimeMillis();
        log.debug("Evaluation started: examples={}, metric={}, parallel={}",
                dataset.size(), metric.name(), options.parallel());

        CompletableFuture<List<ExampleResult>> results = options.parallel()
                ? Futures.parallelMap(options.maxConcurrency(),
                        example -> evaluateExample(pipeline, example, metric, options.timeoutMs()), dataset)
                : evaluateSequentially(pipeline, dataset, metric, options.timeoutMs());

        return results.thenApply(list -> {
            EvaluationResult result = EvaluationResult.of(list);
            log.info("Evaluation completed: score={}, successful={}, total={}, elapsedMs={}",
                    String.format("%.3f", result.score()), result.count(), result.total(),
                    System.currentTimeMillis() - start);
            return result;
        });
    }

    public CompletableFuture<EvaluationResult> evaluate(
            Pipeline pipeline,
            List<Map<String, Object>> dataset,
            Metric metric
    ) {
        return evaluate(pipeline, dataset, metric, EvaluationOptions.defaults());
    }

    /**
     * Normalizes the dataset and resolves a built-in metric by name before evaluating.
     *
     * @throws IllegalArgumentException      for an unknown metric name
     * @throws UnsupportedDatasetException for a dataset in no known shape
     */
    public CompletableFuture<EvaluationResult> evaluateDataset(
            Pipeline pipeline,
            List<?> dataset,
            String metricName,
            EvaluationOptions options
    ) {
        Metric metric = Metrics.byName(metricName);
        return evaluate(pipeline, Datasets.format(dataset), metric, options);
    }

    private CompletableFuture<List<ExampleResult>> evaluateSequentially(
            Pipeline pipeline,
            List<Map<String, Object>> dataset,
            Metric metric,
            long timeoutMs
    ) {
        List<ExampleResult> results = Collections.synchronizedList(new ArrayList<>(dataset.size()));
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Map<String, Object> example : dataset) {
            chain = chain.thenCompose(ignored ->
                    evaluateExample(pipeline, example, metric, timeoutMs).thenAccept(results::add));
        }
        return chain.thenApply(ignored -> List.copyOf(results));
    }

    /**
     * Evaluates a single example. Only a metric range violation fails the returned future.
     */
    CompletableFuture<ExampleResult> evaluateExample(
            Pipeline pipeline,
            Map<String, Object> example,
            Metric metric,
            long timeoutMs
    ) {
        Map<String, Object> input = inputOf(example);
        Object groundTruth = groundTruthOf(example);

        CompletableFuture<Map<String, Object>> invocation;
        try {
            invocation = pipeline.invoke(input);
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }

        return Futures.withTimeout(invocation, timeoutMs)
                .handle((outcome, error) -> {
                    if (error != null) {
                        Throwable cause = Futures.unwrap(error);
                        log.debug("Example failed: error={}", cause.getMessage());
                        return record(ExampleResult.failure(example, groundTruth, cause, metric.name()));
                    }
                    if (outcome.isTimeout()) {
                        log.debug("Example timed out: timeoutMs={}", timeoutMs);
                        return record(ExampleResult.failure(example, groundTruth,
                                new TimeoutException("Example timed out after " + timeoutMs + " ms"), metric.name()));
                    }
                    Map<String, Object> prediction = outcome.get();
                    try {
                        double score = metric.score(prediction, groundTruth);
                        return record(ExampleResult.success(example, prediction, groundTruth, score, metric.name()));
                    } catch (MetricRangeException e) {
                        throw new CompletionException(e);
                    } catch (RuntimeException e) {
                        log.warn("Metric failed on example: metric={}, error={}", metric.name(), e.getMessage());
                        return record(ExampleResult.failure(example, groundTruth, e, metric.name()));
                    }
                });
    }

    private ExampleResult record(ExampleResult result) {
        if (metrics != null) {
            metrics.recordExample(result.success());
        }
        return result;
    }

    static Map<String, Object> inputOf(Map<String, Object> example) {
        Map<String, Object> input = new HashMap<>(example);
        GROUND_TRUTH_KEYS.forEach(input::remove);
        return Collections.unmodifiableMap(input);
    }

    static Object groundTruthOf(Map<String, Object> example) {
        Object groundTruth = example.get("ground-truth");
        if (groundTruth == null) {
            groundTruth = example.get("expected");
        }
        return groundTruth != null ? groundTruth : example;
    }
}
