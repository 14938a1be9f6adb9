/**
 * Taskflow - resilience core of a task-management REST backend.
 *
 * <p>Requests flow through an LMAX Disruptor pipeline that resolves the route,
 * enforces progressive blocks and fixed-window rate limits, then dispatches to
 * the route handler. Outbound calls made by handlers are guarded by circuit
 * breakers, retries and fallbacks. Every failure is rendered as a structured
 * error with a stable code, a user-facing message and recovery hints.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.taskflow.PipelineFactory} - Builds every collaborator from YAML
 *       configuration</li>
 *   <li>{@link fr.lapetina.taskflow.TaskflowApplication} - Standalone HTTP server</li>
 *   <li>{@link fr.lapetina.taskflow.Collaborators} - Identity store, caller resolution and
 *       business routes plugged in by the host application</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml").start()) {
 *     ApiRequest request = new ApiRequest(requestId, "GET", "/health", null,
 *             Map.of(), Map.of(), "127.0.0.1", null, null);
 *     ApiResponse response = factory.getPipeline().submit(request).get();
 * }
 * }</pre>
 *
 * @see fr.lapetina.taskflow.disruptor.DisruptorPipeline
 * @see fr.lapetina.taskflow.resilience.ResilienceContext
 */
package fr.lapetina.taskflow;
