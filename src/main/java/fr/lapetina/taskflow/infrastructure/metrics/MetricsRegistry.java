package fr.lapetina.taskflow.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request latency per route, method and status
 * - Error counters by taxonomy code
 * - Rate-limit rejections, escalator blocks, retries and fallbacks
 * - Circuit breaker state gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> blockCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> breakerGauges = new ConcurrentHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_inflight_requests", inFlight, AtomicInteger::get)
                .description("Requests currently being dispatched")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("taskflow");
    }

    /**
     * Records a completed request.
     */
    public void recordRequest(String route, String method, int status, Duration duration) {
        String key = route + ":" + method + ":" + status;
        requestTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_http_requests")
                        .description("Completed HTTP requests")
                        .tag("route", route)
                        .tag("method", method)
                        .tag("status", Integer.toString(status))
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Counts an error rendered by the error middleware.
     */
    public void incrementError(String code, int status) {
        String key = code + ":" + status;
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Errors rendered to clients")
                        .tag("code", code)
                        .tag("status", Integer.toString(status))
                        .register(registry)
        ).increment();
    }

    public void incrementRateLimitRejection(String category) {
        rejectionCounters.computeIfAbsent(category, k ->
                Counter.builder(prefix + "_ratelimit_rejections_total")
                        .description("Requests rejected by a fixed-window limit")
                        .tag("category", category)
                        .register(registry)
        ).increment();
    }

    public void incrementBlocked(String category) {
        blockCounters.computeIfAbsent(category, k ->
                Counter.builder(prefix + "_blocked_requests_total")
                        .description("Requests rejected by the failed-attempt escalator")
                        .tag("category", category)
                        .register(registry)
        ).increment();
    }

    public void incrementRetry(String operationId) {
        retryCounters.computeIfAbsent(operationId, k ->
                Counter.builder(prefix + "_retries_total")
                        .description("Retry attempts scheduled")
                        .tag("operation", operationId)
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a fallback substitution. Reason is "timeout" or "error".
     */
    public void incrementFallback(String reason) {
        fallbackCounters.computeIfAbsent(reason, k ->
                Counter.builder(prefix + "_fallbacks_total")
                        .description("Fallback values served")
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for a circuit breaker (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     * Registering the same service twice is a no-op.
     */
    public void registerBreakerState(String serviceId, Supplier<Number> stateValue) {
        if (breakerGauges.putIfAbsent(serviceId, Boolean.TRUE) == null) {
            Gauge.builder(prefix + "_circuit_breaker_state", stateValue, s -> s.get().doubleValue())
                    .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                    .tag("service", serviceId)
                    .strongReference(true)
                    .register(registry);
        }
    }

    /**
     * Records stage-specific latency (routing, block check, dispatch).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .register(registry)
        ).record(latency);
    }

    public int incrementInFlight() {
        return inFlight.incrementAndGet();
    }

    public int decrementInFlight() {
        return inFlight.decrementAndGet();
    }

    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
