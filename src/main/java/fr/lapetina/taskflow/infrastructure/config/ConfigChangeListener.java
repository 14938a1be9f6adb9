package fr.lapetina.taskflow.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when configuration has been (re)loaded.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     */
    void onConfigChanged(TaskflowConfig oldConfig, TaskflowConfig newConfig);
}
