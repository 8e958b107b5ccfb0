package fr.lapetina.llm.tuner.optimize;

/**
 * Optimization settings.
 * Immutable and thread-safe.
 *
 * @param strategy           Registered strategy name
 * @param beamWidth          Candidates kept per generation (1..20)
 * @param maxIterations      Last generation to run (1..100)
 * @param concurrency        Candidates evaluated at once (1..50)
 * @param runId              Storage run identifier, generated when null
 * @param checkpointInterval Checkpoint every N generations (>= 1)
 * @param exampleTimeoutMs   Per-example evaluation timeout
 * @param startIteration     Generation the seed corresponds to, non-zero when resuming
 */
public record OptimizerOptions(
        String strategy,
        int beamWidth,
        int maxIterations,
        int concurrency,
        String runId,
        int checkpointInterval,
        long exampleTimeoutMs,
        int startIteration
) {
    public OptimizerOptions {
        if (strategy == null || strategy.isBlank()) {
            strategy = "beam";
        }
        checkRange("beamWidth", beamWidth, 1, 20);
        checkRange("maxIterations", maxIterations, 1, 100);
        checkRange("concurrency", concurrency, 1, 50);
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be >= 1: " + checkpointInterval);
        }
        if (exampleTimeoutMs <= 0) {
            throw new IllegalArgumentException("exampleTimeoutMs must be positive: " + exampleTimeoutMs);
        }
        if (startIteration < 0) {
            throw new IllegalArgumentException("startIteration must be >= 0: " + startIteration);
        }
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ": " + value);
        }
    }

    public static OptimizerOptions defaults() {
        return builder().build();
    }

    public OptimizerOptions withRunId(String runId) {
        return toBuilder().runId(runId).build();
    }

    public OptimizerOptions withStartIteration(int startIteration) {
        return toBuilder().startIteration(startIteration).build();
    }

    public Builder toBuilder() {
        return builder()
                .strategy(strategy)
                .beamWidth(beamWidth)
                .maxIterations(maxIterations)
                .concurrency(concurrency)
                .runId(runId)
                .checkpointInterval(checkpointInterval)
                .exampleTimeoutMs(exampleTimeoutMs)
                .startIteration(startIteration);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String strategy = "beam";
        private int beamWidth = 4;
        private int maxIterations = 10;
        private int concurrency = 8;
        private String runId;
        private int checkpointInterval = 5;
        private long exampleTimeoutMs = 30_000;
        private int startIteration;

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder beamWidth(int beamWidth) {
            this.beamWidth = beamWidth;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder checkpointInterval(int checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
            return this;
        }

        public Builder exampleTimeoutMs(long exampleTimeoutMs) {
            this.exampleTimeoutMs = exampleTimeoutMs;
            return this;
        }

        public Builder startIteration(int startIteration) {
            this.startIteration = startIteration;
            return this;
        }

        public OptimizerOptions build() {
            return new OptimizerOptions(strategy, beamWidth, maxIterations, concurrency,
                    runId, checkpointInterval, exampleTimeoutMs, startIteration);
        }
    }
}
