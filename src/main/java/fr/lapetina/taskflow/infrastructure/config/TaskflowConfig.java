package fr.lapetina.taskflow.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the Taskflow backend.
 * Designed to be populated from YAML.
 */
public class TaskflowConfig {

    private ServerConfig server = new ServerConfig();
    private String environment = "production";
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private RetryConfig retry = new RetryConfig();
    private FallbackConfig fallback = new FallbackConfig();
    private RateLimitingConfig rateLimiting = new RateLimitingConfig();
    private StoreConfig store = new StoreConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public FallbackConfig getFallback() { return fallback; }
    public void setFallback(FallbackConfig fallback) { this.fallback = fallback; }

    public RateLimitingConfig getRateLimiting() { return rateLimiting; }
    public void setRateLimiting(RateLimitingConfig rateLimiting) { this.rateLimiting = rateLimiting; }

    public StoreConfig getStore() { return store; }
    public void setStore(StoreConfig store) { this.store = store; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Technical error details are hidden from non-admin callers in production.
     */
    public boolean isProduction() {
        return environment == null || "production".equalsIgnoreCase(environment);
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 32;
        private long responseTimeoutMs = 120_000;
        private String gatewaySecret;
        private List<String> trustedProxies = new ArrayList<>();

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public long getResponseTimeoutMs() { return responseTimeoutMs; }
        public void setResponseTimeoutMs(long responseTimeoutMs) { this.responseTimeoutMs = responseTimeoutMs; }

        /** Shared secret the gateway sends with identity headers; unset means identity headers are ignored. */
        public String getGatewaySecret() { return gatewaySecret; }
        public void setGatewaySecret(String gatewaySecret) { this.gatewaySecret = gatewaySecret; }

        /** Peer addresses whose X-Forwarded-For header is honoured. */
        public List<String> getTrustedProxies() { return trustedProxies; }
        public void setTrustedProxies(List<String> trustedProxies) { this.trustedProxies = trustedProxies; }
    }

    /**
     * Disruptor configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long handlerTimeoutMs = 30_000;

        public long getHandlerTimeoutMs() { return handlerTimeoutMs; }
        public void setHandlerTimeoutMs(long handlerTimeoutMs) { this.handlerTimeoutMs = handlerTimeoutMs; }
    }

    /**
     * Defaults for breakers created by the registry.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 5;
        private long resetTimeoutMs = 60_000;
        private int successThreshold = 2;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getResetTimeoutMs() { return resetTimeoutMs; }
        public void setResetTimeoutMs(long resetTimeoutMs) { this.resetTimeoutMs = resetTimeoutMs; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }
    }

    /**
     * Defaults for route handlers calling the retry executor.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long delayMs = 1000;
        private boolean backoff = true;
        private long maxDelayMs = 30_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getDelayMs() { return delayMs; }
        public void setDelayMs(long delayMs) { this.delayMs = delayMs; }

        public boolean isBackoff() { return backoff; }
        public void setBackoff(boolean backoff) { this.backoff = backoff; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
    }

    /**
     * Defaults for the fallback executor.
     */
    public static class FallbackConfig {
        private long timeoutMs = 10_000;
        private boolean cancelOnTimeout = false;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public boolean isCancelOnTimeout() { return cancelOnTimeout; }
        public void setCancelOnTimeout(boolean cancelOnTimeout) { this.cancelOnTimeout = cancelOnTimeout; }
    }

    /**
     * Fixed-window categories and the failed-attempt escalator.
     */
    public static class RateLimitingConfig {
        private boolean enabled = true;
        private Map<String, CategoryConfig> categories = defaultCategories();
        private EscalatorConfig escalator = new EscalatorConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, CategoryConfig> getCategories() { return categories; }
        public void setCategories(Map<String, CategoryConfig> categories) { this.categories = categories; }

        public EscalatorConfig getEscalator() { return escalator; }
        public void setEscalator(EscalatorConfig escalator) { this.escalator = escalator; }

        private static Map<String, CategoryConfig> defaultCategories() {
            Map<String, CategoryConfig> categories = new LinkedHashMap<>();
            categories.put("general", CategoryConfig.of(15 * 60_000L, 100, "client", false, false, false,
                    "RATE_LIMIT_EXCEEDED", "Too many requests from this IP, please try again later."));
            categories.put("auth", CategoryConfig.of(15 * 60_000L, 5, "client", true, true, true,
                    "AUTH_RATE_LIMIT_EXCEEDED", "Too many authentication attempts. Please try again later."));
            categories.put("login", CategoryConfig.of(60 * 60_000L, 10, "login", true, true, true,
                    "LOGIN_RATE_LIMIT_EXCEEDED", "Too many failed login attempts. Please try again in 1 hour."));
            categories.put("registration", CategoryConfig.of(60 * 60_000L, 3, "client", false, true, false,
                    "REGISTRATION_RATE_LIMIT_EXCEEDED", "Too many registration attempts. Please try again later."));
            categories.put("password-reset", CategoryConfig.of(60 * 60_000L, 3, "password-reset", false, true, false,
                    "PASSWORD_RESET_RATE_LIMIT_EXCEEDED",
                    "Too many password reset attempts. Please try again in 1 hour."));
            categories.put("email-verification", CategoryConfig.of(60 * 60_000L, 5, "email-verification", false, false,
                    false, "EMAIL_VERIFICATION_RATE_LIMIT_EXCEEDED",
                    "Too many verification email requests. Please try again in 1 hour."));
            categories.put("sensitive", CategoryConfig.of(60_000L, 5, "client", false, false, false,
                    "SENSITIVE_OPERATION_RATE_LIMIT_EXCEEDED",
                    "Too many requests for this operation. Please wait before trying again."));
            return categories;
        }
    }

    /**
     * One fixed-window category.
     */
    public static class CategoryConfig {
        private long windowMs = 15 * 60_000L;
        private int maxRequests = 100;
        private String keyStrategy = "client";
        private boolean skipSuccessfulRequests = false;
        private boolean progressiveBlock = false;
        private boolean escalateOnLimit = false;
        private String code = "RATE_LIMIT_EXCEEDED";
        private String message = "Too many requests, please try again later.";

        static CategoryConfig of(long windowMs, int maxRequests, String keyStrategy, boolean skipSuccessful,
                                 boolean progressiveBlock, boolean escalateOnLimit, String code, String message) {
            CategoryConfig config = new CategoryConfig();
            config.setWindowMs(windowMs);
            config.setMaxRequests(maxRequests);
            config.setKeyStrategy(keyStrategy);
            config.setSkipSuccessfulRequests(skipSuccessful);
            config.setProgressiveBlock(progressiveBlock);
            config.setEscalateOnLimit(escalateOnLimit);
            config.setCode(code);
            config.setMessage(message);
            return config;
        }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public String getKeyStrategy() { return keyStrategy; }
        public void setKeyStrategy(String keyStrategy) { this.keyStrategy = keyStrategy; }

        public boolean isSkipSuccessfulRequests() { return skipSuccessfulRequests; }
        public void setSkipSuccessfulRequests(boolean skipSuccessfulRequests) { this.skipSuccessfulRequests = skipSuccessfulRequests; }

        public boolean isProgressiveBlock() { return progressiveBlock; }
        public void setProgressiveBlock(boolean progressiveBlock) { this.progressiveBlock = progressiveBlock; }

        public boolean isEscalateOnLimit() { return escalateOnLimit; }
        public void setEscalateOnLimit(boolean escalateOnLimit) { this.escalateOnLimit = escalateOnLimit; }

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }

    /**
     * Failed-attempt escalator: block tiers and reset window.
     */
    public static class EscalatorConfig {
        private long resetWindowMs = 60 * 60_000L;
        private int warnThreshold = 3;
        private long blockedRetryAfterSeconds = 300;
        private List<TierConfig> tiers = new ArrayList<>(List.of(
                TierConfig.of(3, 5 * 60_000L),
                TierConfig.of(5, 15 * 60_000L),
                TierConfig.of(10, 60 * 60_000L)
        ));

        public long getResetWindowMs() { return resetWindowMs; }
        public void setResetWindowMs(long resetWindowMs) { this.resetWindowMs = resetWindowMs; }

        public int getWarnThreshold() { return warnThreshold; }
        public void setWarnThreshold(int warnThreshold) { this.warnThreshold = warnThreshold; }

        public long getBlockedRetryAfterSeconds() { return blockedRetryAfterSeconds; }
        public void setBlockedRetryAfterSeconds(long blockedRetryAfterSeconds) { this.blockedRetryAfterSeconds = blockedRetryAfterSeconds; }

        public List<TierConfig> getTiers() { return tiers; }
        public void setTiers(List<TierConfig> tiers) { this.tiers = tiers; }
    }

    /**
     * Block duration applied from a failure count upward.
     */
    public static class TierConfig {
        private int minFailures;
        private long durationMs;

        static TierConfig of(int minFailures, long durationMs) {
            TierConfig tier = new TierConfig();
            tier.setMinFailures(minFailures);
            tier.setDurationMs(durationMs);
            return tier;
        }

        public int getMinFailures() { return minFailures; }
        public void setMinFailures(int minFailures) { this.minFailures = minFailures; }

        public long getDurationMs() { return durationMs; }
        public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
    }

    /**
     * State store reaping.
     */
    public static class StoreConfig {
        private long reapIntervalMs = 60_000;
        private long retryRetentionMs = 60 * 60_000L;

        public long getReapIntervalMs() { return reapIntervalMs; }
        public void setReapIntervalMs(long reapIntervalMs) { this.reapIntervalMs = reapIntervalMs; }

        public long getRetryRetentionMs() { return retryRetentionMs; }
        public void setRetryRetentionMs(long retryRetentionMs) { this.retryRetentionMs = retryRetentionMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "taskflow";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
