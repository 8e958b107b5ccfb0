package fr.lapetina.llm.tuner.infrastructure.storage;

import fr.lapetina.llm.tuner.domain.pipeline.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local run storage.
 */
public final class InMemoryRunStorage implements RunStorage {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRunStorage.class);

    private final Map<String, Pipeline> runs = new ConcurrentHashMap<>();
    private final Map<String, List<MetricRecord>> histories = new ConcurrentHashMap<>();

    @Override
    public String createRun(Pipeline pipeline) {
        String runId = UUID.randomUUID().toString();
        runs.put(runId, pipeline);
        histories.put(runId, new CopyOnWriteArrayList<>());
        log.debug("Run created: runId={}", runId);
        return runId;
    }

    @Override
    public void appendMetric(String runId, int iteration, double score, Object payload) {
        histories.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>())
                .add(new MetricRecord(iteration, score, payload, System.currentTimeMillis()));
        log.debug("Metric appended: runId={}, iteration={}, score={}", runId, iteration, score);
    }

    @Override
    public Optional<Pipeline> loadRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<MetricRecord> loadHistory(String runId) {
        List<MetricRecord> history = histories.get(runId);
        return history != null ? List.copyOf(history) : List.of();
    }

    public int runCount() {
        return runs.size();
    }
}
