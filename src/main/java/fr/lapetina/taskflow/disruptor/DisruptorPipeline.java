package fr.lapetina.taskflow.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.taskflow.api.ErrorHandlingMiddleware;
import fr.lapetina.taskflow.api.routing.RouteTable;
import fr.lapetina.taskflow.disruptor.exception.BackpressureException;
import fr.lapetina.taskflow.disruptor.handlers.BlockCheckHandler;
import fr.lapetina.taskflow.disruptor.handlers.CompletionHandler;
import fr.lapetina.taskflow.disruptor.handlers.DispatchHandler;
import fr.lapetina.taskflow.disruptor.handlers.RateLimitHandler;
import fr.lapetina.taskflow.disruptor.handlers.RoutingHandler;
import fr.lapetina.taskflow.domain.event.RequestEvent;
import fr.lapetina.taskflow.domain.event.RequestEventFactory;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import fr.lapetina.taskflow.domain.model.ApiResponse;
import fr.lapetina.taskflow.infrastructure.config.TaskflowConfig;
import fr.lapetina.taskflow.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.taskflow.ratelimit.FailedAttemptTracker;
import fr.lapetina.taskflow.ratelimit.FixedWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Disruptor pipeline carrying every HTTP request through the gate stages.
 *
 * Order: routing → block check → rate limit → dispatch → completion.
 * Each stage sees every event after the previous one; a stage that rejects a
 * request marks the event and later gates pass it through untouched.
 *
 * Multi-producer: HTTP worker threads publish concurrently. When the ring
 * buffer has no free slot, {@link #submit} fails fast with a
 * {@link BackpressureException} instead of blocking the caller.
 */
public final class DisruptorPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DisruptorPipeline.class);

    private final Disruptor<RequestEvent> disruptor;
    private final RingBuffer<RequestEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DisruptorPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;

        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new RequestEventFactory(),
                builder.ringBufferSize,
                new DisruptorThreadFactory("request-pipeline"),
                ProducerType.MULTI,
                waitStrategy
        );

        RoutingHandler routingHandler = new RoutingHandler(builder.routeTable);
        BlockCheckHandler blockCheckHandler = new BlockCheckHandler(
                builder.rateLimiter, builder.tracker, builder.metricsRegistry, builder.rateLimitingEnabled);
        RateLimitHandler rateLimitHandler = new RateLimitHandler(
                builder.rateLimiter, builder.tracker, builder.metricsRegistry, builder.rateLimitingEnabled);
        DispatchHandler dispatchHandler = new DispatchHandler(
                builder.middleware,
                builder.rateLimiter,
                builder.metricsRegistry,
                builder.clock,
                builder.handlerTimeoutMs,
                builder.blockedRetryAfterSeconds
        );
        CompletionHandler completionHandler = new CompletionHandler(builder.metricsRegistry);

        disruptor
                .handleEventsWith(routingHandler)
                .then(blockCheckHandler)
                .then(rateLimitHandler)
                .then(dispatchHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new DisruptorExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DisruptorPipeline created: ringBufferSize={}, waitStrategy={}, handlerTimeoutMs={}",
                builder.ringBufferSize, builder.waitStrategy, builder.handlerTimeoutMs);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DisruptorPipeline started");
        }
    }

    /**
     * Publishes a request into the ring buffer.
     *
     * @return future completed with the response, errors included; it only
     *         completes exceptionally if rendering itself failed
     * @throws BackpressureException if the ring buffer is full or the pipeline is stopped
     */
    public CompletableFuture<ApiResponse> submit(ApiRequest request) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        CompletableFuture<ApiResponse> responseFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            ringBuffer.get(sequence).initialize(request, responseFuture, clock.instant());
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Request submitted: requestId={}, sequence={}", request.requestId(), sequence);
        return responseFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DisruptorPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("DisruptorPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DisruptorPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Fails the caller's future when a stage throws, so no request hangs.
     */
    private static class DisruptorExceptionHandler implements ExceptionHandler<RequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(DisruptorExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, RequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getResponseFuture() != null && !event.getResponseFuture().isDone()) {
                event.getResponseFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long handlerTimeoutMs = 30_000;
        private BooleanSupplier rateLimitingEnabled = () -> true;
        private LongSupplier blockedRetryAfterSeconds = () -> 300;
        private Clock clock = Clock.systemUTC();
        private RouteTable routeTable;
        private FixedWindowRateLimiter rateLimiter;
        private FailedAttemptTracker tracker;
        private ErrorHandlingMiddleware middleware;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder handlerTimeoutMs(long timeoutMs) {
            this.handlerTimeoutMs = timeoutMs;
            return this;
        }

        public Builder rateLimitingEnabled(BooleanSupplier enabled) {
            this.rateLimitingEnabled = enabled;
            return this;
        }

        public Builder blockedRetryAfterSeconds(LongSupplier seconds) {
            this.blockedRetryAfterSeconds = seconds;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder routeTable(RouteTable routeTable) {
            this.routeTable = routeTable;
            return this;
        }

        public Builder rateLimiter(FixedWindowRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder tracker(FailedAttemptTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder middleware(ErrorHandlingMiddleware middleware) {
            this.middleware = middleware;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(TaskflowConfig config) {
            ringBufferSize(config.getDisruptor().getRingBufferSize());
            this.waitStrategy = config.getDisruptor().getWaitStrategy();
            this.handlerTimeoutMs = config.getTimeouts().getHandlerTimeoutMs();
            return this;
        }

        public DisruptorPipeline build() {
            if (routeTable == null) {
                throw new IllegalStateException("RouteTable is required");
            }
            if (rateLimiter == null) {
                throw new IllegalStateException("FixedWindowRateLimiter is required");
            }
            if (tracker == null) {
                throw new IllegalStateException("FailedAttemptTracker is required");
            }
            if (middleware == null) {
                throw new IllegalStateException("ErrorHandlingMiddleware is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new DisruptorPipeline(this);
        }
    }
}
