package fr.lapetina.orchestrator.infrastructure.config;

/**
 * Notified after the configuration has been (re)loaded.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param oldConfig the previous configuration, null on initial load
     * @param newConfig the configuration now in effect
     */
    void onConfigChanged(OrchestratorConfig oldConfig, OrchestratorConfig newConfig);
}
