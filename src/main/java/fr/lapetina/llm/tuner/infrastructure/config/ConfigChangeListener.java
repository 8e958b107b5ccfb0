package fr.lapetina.llm.tuner.infrastructure.config;

/**
 * Listener interface for configuration loads.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when configuration has been (re)loaded.
     *
     * @param oldConfig The previous configuration (may be null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(TunerConfig oldConfig, TunerConfig newConfig);
}
