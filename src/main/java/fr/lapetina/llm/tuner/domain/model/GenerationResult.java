package fr.lapetina.llm.tuner.domain.model;

/**
 * Result of a text generation call.
 * Immutable and thread-safe.
 */
public record GenerationResult(
        String text,
        Usage usage,
        String model,
        String finishReason,
        ResultStatus status
) {
    public GenerationResult {
        if (usage == null) {
            usage = Usage.EMPTY;
        }
        if (status == null) {
            status = ResultStatus.OK;
        }
    }

    /**
     * Token accounting reported by the backend.
     */
    public record Usage(int promptTokens, int completionTokens, int totalTokens) {
        public static final Usage EMPTY = new Usage(0, 0, 0);

        public static Usage of(int promptTokens, int completionTokens) {
            return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
        }
    }

    public boolean isTimeout() {
        return status == ResultStatus.TIMEOUT;
    }

    public boolean isOk() {
        return status == ResultStatus.OK;
    }

    /**
     * Creates a successful result.
     */
    public static GenerationResult of(String text, String model, Usage usage) {
        return new GenerationResult(text, usage, model, "stop", ResultStatus.OK);
    }

    /**
     * Creates the distinguished timeout result. It carries no text.
     */
    public static GenerationResult timedOut() {
        return new GenerationResult(null, Usage.EMPTY, null, null, ResultStatus.TIMEOUT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String text;
        private Usage usage;
        private String model;
        private String finishReason;
        private ResultStatus status;

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder usage(Usage usage) {
            this.usage = usage;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder finishReason(String finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public GenerationResult build() {
            return new GenerationResult(text, usage, model, finishReason, status);
        }
    }
}
