/**
 * Circuit breaking, retries and fallbacks for asynchronous operations.
 *
 * <p>State transitions live in pure policy records
 * ({@link fr.lapetina.taskflow.resilience.CircuitBreakerPolicy}); mutable state is kept in an
 * injected {@link fr.lapetina.taskflow.infrastructure.store.StateStore}. Delays go through a
 * {@link fr.lapetina.taskflow.resilience.DelayScheduler} so that no executor thread sleeps.
 */
package fr.lapetina.taskflow.resilience;
