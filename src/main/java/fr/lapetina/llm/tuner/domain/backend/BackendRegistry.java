package fr.lapetina.llm.tuner.domain.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry mapping provider identifiers to backend factories.
 *
 * Instances are independent so tests and embedding applications can build their own.
 * {@link #withDefaults()} returns a registry populated with the built-in providers.
 */
public final class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, BackendFactory> factories = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding the built-in providers.
     */
    public static BackendRegistry withDefaults() {
        BackendRegistry registry = new BackendRegistry();
        registry.register(EchoBackend.PROVIDER, EchoBackend::new);
        return registry;
    }

    /**
     * Registers a provider factory, replacing any previous one with the same name.
     *
     * @param provider Provider name (used in configuration)
     * @param factory  Factory for creating backend instances
     */
    public void register(String provider, BackendFactory factory) {
        BackendFactory previous = factories.put(normalize(provider), factory);
        if (previous != null) {
            log.info("Backend provider replaced: provider={}", provider);
        } else {
            log.debug("Backend provider registered: provider={}", provider);
        }
    }

    /**
     * Creates a backend for the provider.
     *
     * @throws UnknownProviderException if the provider is not registered
     */
    public LlmBackend create(String provider, Map<String, Object> settings) {
        if (provider == null) {
            throw new UnknownProviderException(null, getAvailableProviders());
        }
        BackendFactory factory = factories.get(normalize(provider));
        if (factory == null) {
            throw new UnknownProviderException(provider, getAvailableProviders());
        }
        Map<String, Object> effective = settings != null ? settings : Map.of();
        log.info("Creating backend: provider={}, model={}", provider, effective.get("model"));
        return factory.create(effective);
    }

    public boolean isRegistered(String provider) {
        return provider != null && factories.containsKey(normalize(provider));
    }

    /**
     * Returns all registered provider names, sorted.
     */
    public List<String> getAvailableProviders() {
        return factories.keySet().stream().sorted().toList();
    }

    private static String normalize(String provider) {
        return provider.trim().toLowerCase();
    }
}
