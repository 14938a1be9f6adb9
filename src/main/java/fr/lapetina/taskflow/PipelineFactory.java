package fr.lapetina.taskflow;

import fr.lapetina.taskflow.api.AuthRoutes;
import fr.lapetina.taskflow.api.ErrorHandlingMiddleware;
import fr.lapetina.taskflow.api.SystemRoutes;
import fr.lapetina.taskflow.api.routing.RouteContributor;
import fr.lapetina.taskflow.api.routing.RouteTable;
import fr.lapetina.taskflow.auth.HeaderRequestAuthenticator;
import fr.lapetina.taskflow.auth.RequestAuthenticator;
import fr.lapetina.taskflow.disruptor.DisruptorPipeline;
import fr.lapetina.taskflow.infrastructure.config.ConfigLoader;
import fr.lapetina.taskflow.infrastructure.config.TaskflowConfig;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.infrastructure.store.InMemoryStateStore;
import fr.lapetina.taskflow.infrastructure.store.StaleEntryReaper;
import fr.lapetina.taskflow.ratelimit.FailedAttemptTracker;
import fr.lapetina.taskflow.ratelimit.FixedWindowRateLimiter;
import fr.lapetina.taskflow.ratelimit.KeyStrategy;
import fr.lapetina.taskflow.ratelimit.ProgressiveBlockPolicy;
import fr.lapetina.taskflow.ratelimit.ProgressiveBlockPolicy.BlockTier;
import fr.lapetina.taskflow.ratelimit.RateLimitPolicy;
import fr.lapetina.taskflow.resilience.CircuitBreaker;
import fr.lapetina.taskflow.resilience.CircuitBreakerPolicy;
import fr.lapetina.taskflow.resilience.CircuitBreakerRegistry;
import fr.lapetina.taskflow.resilience.DelayScheduler;
import fr.lapetina.taskflow.resilience.FallbackExecutor;
import fr.lapetina.taskflow.resilience.FallbackOptions;
import fr.lapetina.taskflow.resilience.ResilienceContext;
import fr.lapetina.taskflow.resilience.RetryExecutor;
import fr.lapetina.taskflow.resilience.RetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds every collaborator from configuration and wires them into the pipeline.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml")) {
 *     DisruptorPipeline pipeline = factory.start().getPipeline();
 *     // use pipeline...
 * }
 * }</pre>
 *
 * A configuration reload swaps rate-limit policies, escalator tiers and the
 * default circuit breaker policy in place; state already recorded is kept.
 */
public class PipelineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private final ConfigLoader configLoader;
    private final TaskflowConfig config;
    private final Collaborators collaborators;
    private final RequestAuthenticator authenticator;
    private final MetricsRegistry metricsRegistry;
    private final CircuitBreakerRegistry breakerRegistry;
    private final RetryExecutor retryExecutor;
    private final ResilienceContext resilienceContext;
    private final FixedWindowRateLimiter rateLimiter;
    private final FailedAttemptTracker tracker;
    private final ErrorHandlingMiddleware middleware;
    private final RouteTable routeTable;
    private final StaleEntryReaper reaper;
    private final DisruptorPipeline pipeline;

    protected PipelineFactory(String configPath, Clock clock, DelayScheduler delayScheduler,
                              Collaborators collaborators) {
        log.info("Initializing PipelineFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();
        this.collaborators = collaborators;
        this.authenticator = collaborators.authenticator() != null
                ? collaborators.authenticator()
                : new HeaderRequestAuthenticator(() -> configLoader.getCurrentConfig().getServer().getGatewaySecret());

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Resilience executors
        this.breakerRegistry = new CircuitBreakerRegistry(
                breakerPolicy(config), new InMemoryStateStore<>(), clock);
        breakerRegistry.addCreationListener(this::registerBreakerMetrics);
        this.retryExecutor = new RetryExecutor(delayScheduler, new InMemoryStateStore<>(), metricsRegistry, clock);
        this.resilienceContext = new ResilienceContext(
                breakerRegistry,
                retryExecutor,
                new FallbackExecutor(delayScheduler, metricsRegistry),
                retryDefaults(config),
                fallbackDefaults(config)
        );

        // Rate limiting
        this.rateLimiter = new FixedWindowRateLimiter(rateLimitPolicies(config), new InMemoryStateStore<>(), clock);
        this.tracker = new FailedAttemptTracker(blockPolicy(config), new InMemoryStateStore<>(), clock);

        this.middleware = new ErrorHandlingMiddleware(metricsRegistry,
                () -> configLoader.getCurrentConfig().isProduction());

        // Routes
        this.routeTable = new RouteTable();
        new SystemRoutes(breakerRegistry, tracker, metricsRegistry, configLoader, clock).register(routeTable);
        new AuthRoutes(collaborators.credentialVerifier(), tracker, resilienceContext).register(routeTable);
        for (RouteContributor contributor : collaborators.routes()) {
            contributor.register(routeTable);
        }

        // Stale state eviction
        this.reaper = new StaleEntryReaper(Duration.ofMillis(config.getStore().getReapIntervalMs()));
        reaper.register("escalator", tracker::sweepStale);
        reaper.register("rate-windows", rateLimiter::sweep);
        reaper.register("retry-records",
                () -> retryExecutor.sweep(configLoader.getCurrentConfig().getStore().getRetryRetentionMs()));

        this.pipeline = DisruptorPipeline.builder()
                .fromConfig(config)
                .clock(clock)
                .rateLimitingEnabled(() -> configLoader.getCurrentConfig().getRateLimiting().isEnabled())
                .blockedRetryAfterSeconds(() ->
                        configLoader.getCurrentConfig().getRateLimiting().getEscalator().getBlockedRetryAfterSeconds())
                .routeTable(routeTable)
                .rateLimiter(rateLimiter)
                .tracker(tracker)
                .middleware(middleware)
                .metricsRegistry(metricsRegistry)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("PipelineFactory initialized: routes={}, rateLimitCategories={}, environment={}",
                routeTable.getRoutes().size(), rateLimiter.getPolicies().keySet(), config.getEnvironment());
    }

    public static PipelineFactory create(String configPath) {
        return create(configPath, Collaborators.defaults());
    }

    public static PipelineFactory create(String configPath, Collaborators collaborators) {
        return new PipelineFactory(configPath, Clock.systemUTC(), DelayScheduler.system(), collaborators);
    }

    public static PipelineFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the pipeline, the state reaper and the config watcher.
     */
    public PipelineFactory start() {
        pipeline.start();
        reaper.start();
        configLoader.startWatching();
        log.info("Pipeline started");
        return this;
    }

    public DisruptorPipeline getPipeline() {
        return pipeline;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public CircuitBreakerRegistry getBreakerRegistry() {
        return breakerRegistry;
    }

    public ResilienceContext getResilienceContext() {
        return resilienceContext;
    }

    public FixedWindowRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public FailedAttemptTracker getTracker() {
        return tracker;
    }

    public ErrorHandlingMiddleware getMiddleware() {
        return middleware;
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    public StaleEntryReaper getReaper() {
        return reaper;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    /**
     * Caller identity resolver for the HTTP front end.
     */
    public RequestAuthenticator getAuthenticator() {
        return authenticator;
    }

    /**
     * Configuration as loaded at startup; see {@link ConfigLoader#getCurrentConfig()} for reloads.
     */
    public TaskflowConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    static CircuitBreakerPolicy breakerPolicy(TaskflowConfig config) {
        TaskflowConfig.CircuitBreakerConfig breaker = config.getCircuitBreaker();
        return new CircuitBreakerPolicy(
                breaker.getFailureThreshold(), breaker.getResetTimeoutMs(), breaker.getSuccessThreshold());
    }

    static RetryOptions retryDefaults(TaskflowConfig config) {
        TaskflowConfig.RetryConfig retry = config.getRetry();
        return RetryOptions.builder()
                .maxAttempts(retry.getMaxAttempts())
                .delayMs(retry.getDelayMs())
                .backoff(retry.isBackoff())
                .maxDelayMs(retry.getMaxDelayMs())
                .build();
    }

    static FallbackOptions fallbackDefaults(TaskflowConfig config) {
        return FallbackOptions.builder()
                .timeoutMs(config.getFallback().getTimeoutMs())
                .cancelOnTimeout(config.getFallback().isCancelOnTimeout())
                .build();
    }

    static Map<String, RateLimitPolicy> rateLimitPolicies(TaskflowConfig config) {
        Map<String, RateLimitPolicy> policies = new LinkedHashMap<>();
        config.getRateLimiting().getCategories().forEach((category, c) -> policies.put(category, new RateLimitPolicy(
                category,
                c.getWindowMs(),
                c.getMaxRequests(),
                KeyStrategy.fromConfigName(c.getKeyStrategy()),
                c.isSkipSuccessfulRequests(),
                c.isProgressiveBlock(),
                c.isEscalateOnLimit(),
                c.getCode(),
                c.getMessage()
        )));
        return policies;
    }

    static ProgressiveBlockPolicy blockPolicy(TaskflowConfig config) {
        TaskflowConfig.EscalatorConfig escalator = config.getRateLimiting().getEscalator();
        List<BlockTier> tiers = escalator.getTiers().stream()
                .map(t -> new BlockTier(t.getMinFailures(), t.getDurationMs()))
                .toList();
        return new ProgressiveBlockPolicy(tiers, escalator.getResetWindowMs(), escalator.getWarnThreshold());
    }

    private void registerBreakerMetrics(CircuitBreaker breaker) {
        metricsRegistry.registerBreakerState(breaker.getServiceId(), () -> switch (breaker.getState()) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        });
    }

    private void onConfigChanged(TaskflowConfig oldConfig, TaskflowConfig newConfig) {
        log.info("Configuration changed, applying updates...");
        try {
            rateLimiter.updatePolicies(rateLimitPolicies(newConfig));
            tracker.updatePolicy(blockPolicy(newConfig));
            breakerRegistry.updateDefaults(breakerPolicy(newConfig));
            log.info("Configuration updates applied: environment={}, rateLimitingEnabled={}",
                    newConfig.getEnvironment(), newConfig.getRateLimiting().isEnabled());
        } catch (IllegalArgumentException e) {
            log.error("Rejected configuration update, keeping previous policies: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        log.info("Shutting down PipelineFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            reaper.close();
        } catch (Exception e) {
            log.warn("Error closing state reaper", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("PipelineFactory shut down");
    }
}
