package fr.lapetina.llm.tuner.domain.backend;

import java.util.List;

/**
 * Thrown when no factory is registered for the requested provider.
 */
public final class UnknownProviderException extends RuntimeException {

    private final String provider;
    private final List<String> supportedProviders;

    public UnknownProviderException(String provider, List<String> supportedProviders) {
        super("Unknown backend provider: " + provider + ", supported: " + supportedProviders);
        this.provider = provider;
        this.supportedProviders = List.copyOf(supportedProviders);
    }

    public String getProvider() {
        return provider;
    }

    public List<String> getSupportedProviders() {
        return supportedProviders;
    }
}
