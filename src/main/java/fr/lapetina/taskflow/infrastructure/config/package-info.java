/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing and runtime configuration updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.taskflow.infrastructure.config.TaskflowConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.taskflow.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.taskflow.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>When the configuration file changes, listeners are notified. Rate-limit categories,
 * escalator tiers and breaker defaults are swapped at runtime; server and ring buffer
 * settings need a restart.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code environment} - {@code production} hides technical error details</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code timeouts} - Route handler timeout</li>
 *   <li>{@code circuitBreaker} - Breaker thresholds</li>
 *   <li>{@code retry} / {@code fallback} - Executor defaults</li>
 *   <li>{@code rateLimiting} - Fixed-window categories and escalator tiers</li>
 *   <li>{@code store} - Stale entry reaping</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.taskflow.infrastructure.config;
