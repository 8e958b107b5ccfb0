package fr.lapetina.llm.tuner.domain.backend;

import java.util.Map;

/**
 * Creates a backend for one provider from its settings.
 */
@FunctionalInterface
public interface BackendFactory {

    /**
     * @param settings Provider settings (model, api key, base url, ...)
     * @return A new backend instance
     */
    LlmBackend create(Map<String, Object> settings);
}
