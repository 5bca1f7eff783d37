package fr.lapetina.ollama.council.infrastructure.config;

/**
 * Callback for council configuration reloads.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a configuration has been loaded and validated.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(CouncilConfig oldConfig, CouncilConfig newConfig);
}
