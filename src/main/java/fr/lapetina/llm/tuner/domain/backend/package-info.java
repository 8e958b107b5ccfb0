/**
 * Backend capability abstraction and provider registry.
 *
 * <p>{@link fr.lapetina.llm.tuner.domain.backend.LlmBackend} is the contract every provider
 * satisfies. Providers are looked up by name through a
 * {@link fr.lapetina.llm.tuner.domain.backend.BackendRegistry}:
 *
 * <pre>{@code
 * BackendRegistry registry = BackendRegistry.withDefaults();
 * registry.register("my-provider", settings -> new MyBackend(settings));
 * LlmBackend backend = registry.create("my-provider", Map.of("model", "m-1"));
 * }</pre>
 */
package fr.lapetina.llm.tuner.domain.backend;
