package fr.lapetina.llm.tuner.domain.pipeline;

import fr.lapetina.llm.tuner.domain.backend.StubBackend;
import fr.lapetina.llm.tuner.domain.model.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptPipelineTest {

    @Test
    @DisplayName("should render the template and return the answer")
    void shouldRenderAndAnswer() {
        List<String> prompts = new CopyOnWriteArrayList<>();
        StubBackend stub = new StubBackend(prompt -> {
            prompts.add(prompt);
            return CompletableFuture.completedFuture(GenerationResult.of("4", "stub", GenerationResult.Usage.EMPTY));
        });
        PromptPipeline pipeline = new PromptPipeline(stub, "Q: {question}\nA:");

        Map<String, Object> output = pipeline.invoke(Map.of("question", "2+2")).join();

        assertThat(output).containsEntry(PromptPipeline.ANSWER, "4");
        assertThat(prompts).containsExactly("Q: 2+2\nA:");
    }

    @Test
    @DisplayName("should leave unknown placeholders in place")
    void shouldKeepUnknownPlaceholders() {
        assertThat(PromptPipeline.render("{question} in {language}", Map.of("question", "hi")))
                .isEqualTo("hi in {language}");
    }

    @Test
    @DisplayName("should not interpret replacement characters in values")
    void shouldQuoteReplacement() {
        assertThat(PromptPipeline.render("cost: {price}", Map.of("price", "$5 \\o/")))
                .isEqualTo("cost: $5 \\o/");
    }

    @Test
    @DisplayName("should fail when the backend times out")
    void shouldFailOnTimeout() {
        StubBackend stub = new StubBackend(prompt -> CompletableFuture.completedFuture(GenerationResult.timedOut()));
        PromptPipeline pipeline = new PromptPipeline(stub, "{question}");

        CompletableFuture<Map<String, Object>> call = pipeline.invoke(Map.of("question", "q"));

        assertThatThrownBy(call::join).hasCauseInstanceOf(BackendTimeoutException.class);
    }

    @Test
    @DisplayName("should reject a blank template")
    void shouldRejectBlankTemplate() {
        assertThatThrownBy(() -> new PromptPipeline(new StubBackend(), "  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
