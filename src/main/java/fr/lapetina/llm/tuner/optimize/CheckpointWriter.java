package fr.lapetina.llm.tuner.optimize;

import fr.lapetina.llm.tuner.infrastructure.storage.RunStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Appends checkpoints to the run storage on a background thread.
 *
 * Submitting never blocks and never fails; storage errors are logged and dropped.
 */
public final class CheckpointWriter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointWriter.class);

    private final RunStorage storage;
    private final ExecutorService executor;

    public CheckpointWriter(RunStorage storage) {
        this.storage = storage;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "checkpoint-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules the checkpoint.
     *
     * @return Future completing once the write was attempted; callers may ignore it
     */
    public CompletableFuture<Void> submit(String runId, int iteration, double score, Object payload) {
        try {
            return CompletableFuture.runAsync(() -> write(runId, iteration, score, payload), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Checkpoint dropped, writer closed: runId={}, iteration={}", runId, iteration);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void write(String runId, int iteration, double score, Object payload) {
        try {
            storage.appendMetric(runId, iteration, score, payload);
            log.debug("Checkpoint saved: runId={}, iteration={}, score={}", runId, iteration, score);
        } catch (RuntimeException e) {
            log.warn("Failed to save checkpoint: runId={}, iteration={}", runId, iteration, e);
        }
    }

    public RunStorage getStorage() {
        return storage;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
