package fr.lapetina.llm.tuner.domain.pipeline;

import fr.lapetina.llm.tuner.domain.backend.LlmBackend;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-call pipeline: renders a prompt template and returns the generated text
 * under the {@code answer} key.
 *
 * Placeholders are written {@code {field}}; a placeholder with no matching input field
 * is left as is.
 */
public final class PromptPipeline implements Pipeline {

    public static final String ANSWER = "answer";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_-]+)}");

    private final LlmBackend backend;
    private final String template;
    private final Map<String, Object> options;

    public PromptPipeline(LlmBackend backend, String template, Map<String, Object> options) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("template is required");
        }
        this.backend = backend;
        this.template = template;
        this.options = options != null ? Map.copyOf(options) : Map.of();
    }

    public PromptPipeline(LlmBackend backend, String template) {
        this(backend, template, Map.of());
    }

    @Override
    public CompletableFuture<Map<String, Object>> invoke(Map<String, Object> input) {
        String prompt = render(template, input);
        return backend.generate(prompt, options).thenApply(result -> {
            if (result.isTimeout()) {
                throw new BackendTimeoutException("Backend timed out for prompt template: " + template);
            }
            String text = result.text() != null ? result.text() : "";
            return Map.<String, Object>of(ANSWER, text);
        });
    }

    /**
     * Substitutes {@code {field}} placeholders with the input values.
     */
    public static String render(String template, Map<String, Object> input) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            Object value = input.get(matcher.group(1));
            String replacement = value != null ? value.toString() : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    public String getTemplate() {
        return template;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "PromptPipeline{template='" + template + "'}";
    }
}
